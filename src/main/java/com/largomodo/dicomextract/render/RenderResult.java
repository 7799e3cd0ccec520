package com.largomodo.dicomextract.render;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Per-file rendering outcome.
 *
 * @param source DICOM file that was rendered
 * @param status what happened
 * @param image  the written image, present only for {@link Status#RENDERED}
 * @param detail failure reason for {@link Status#FAILED}, empty otherwise
 */
public record RenderResult(Path source, Status status, Optional<RenderedImage> image, String detail) {

    public enum Status {
        RENDERED,
        /** Valid DICOM without Pixel Data (directory index, structured report). */
        NO_IMAGE,
        FAILED
    }

    public RenderResult {
        if (source == null || status == null || image == null) {
            throw new IllegalArgumentException("source, status and image must not be null");
        }
        if (image.isPresent() != (status == Status.RENDERED)) {
            throw new IllegalArgumentException("An image is present exactly for RENDERED results");
        }
        detail = detail == null ? "" : detail;
    }

    public static RenderResult rendered(RenderedImage image) {
        return new RenderResult(image.metadata().sourceFile(), Status.RENDERED, Optional.of(image), "");
    }

    public static RenderResult noImage(Path source) {
        return new RenderResult(source, Status.NO_IMAGE, Optional.empty(), "no pixel data");
    }

    public static RenderResult failed(Path source, String reason) {
        return new RenderResult(source, Status.FAILED, Optional.empty(), reason);
    }
}
