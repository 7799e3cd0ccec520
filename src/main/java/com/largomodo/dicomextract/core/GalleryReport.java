package com.largomodo.dicomextract.core;

import com.largomodo.dicomextract.render.RenderedImage;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of rendering one extraction report.
 *
 * @param exportDirectory directory holding the PNGs and the gallery
 * @param gallery         path of {@code index.html}, empty when nothing was rendered
 * @param images          rendered images in input order
 * @param noImageCount    DICOM files without pixel data
 * @param failedCount     files whose pixel data could not be decoded or written
 */
public record GalleryReport(Path exportDirectory, Optional<Path> gallery, List<RenderedImage> images,
                            int noImageCount, int failedCount) {

    public GalleryReport {
        if (exportDirectory == null || gallery == null || images == null) {
            throw new IllegalArgumentException("exportDirectory, gallery and images must not be null");
        }
        if (noImageCount < 0 || failedCount < 0) {
            throw new IllegalArgumentException("Counts must not be negative");
        }
        images = List.copyOf(images);
    }

    public int renderedCount() {
        return images.size();
    }
}
