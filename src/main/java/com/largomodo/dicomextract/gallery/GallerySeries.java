package com.largomodo.dicomextract.gallery;

import com.largomodo.dicomextract.render.RenderedImage;

import java.util.List;

/**
 * One gallery section with its images in display order.
 */
public record GallerySeries(SeriesKey key, List<RenderedImage> images) {

    public GallerySeries {
        if (key == null || images == null) {
            throw new IllegalArgumentException("key and images must not be null");
        }
        images = List.copyOf(images);
    }
}
