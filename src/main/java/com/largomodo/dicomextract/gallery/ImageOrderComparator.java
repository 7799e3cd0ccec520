package com.largomodo.dicomextract.gallery;

import com.largomodo.dicomextract.render.RenderedImage;

import java.util.Comparator;
import java.util.OptionalDouble;

/**
 * Orders images inside a section: slice location, then instance number, unknown values last.
 * <p>
 * Images equal on both keys compare as 0; callers rely on a stable sort to keep their
 * enumeration order.
 */
public class ImageOrderComparator implements Comparator<RenderedImage> {

    @Override
    public int compare(RenderedImage i1, RenderedImage i2) {
        int sliceComparison = compareOptional(i1.metadata().sliceLocation(), i2.metadata().sliceLocation());
        if (sliceComparison != 0) {
            return sliceComparison;
        }
        return SeriesOrderComparator.compareOptional(i1.metadata().instanceNumber(), i2.metadata().instanceNumber());
    }

    private static int compareOptional(OptionalDouble a, OptionalDouble b) {
        if (a.isPresent() && b.isPresent()) {
            return Double.compare(a.getAsDouble(), b.getAsDouble());
        }
        return Boolean.compare(a.isEmpty(), b.isEmpty());
    }
}
