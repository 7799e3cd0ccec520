package com.largomodo.dicomextract.render;

import com.largomodo.dicomextract.dicom.ImageMetadata;

import java.nio.file.Path;

/**
 * A PNG written to the export directory together with the header fields it was annotated with.
 */
public record RenderedImage(Path imagePath, ImageMetadata metadata) {

    public RenderedImage {
        if (imagePath == null || metadata == null) {
            throw new IllegalArgumentException("imagePath and metadata must not be null");
        }
    }
}
