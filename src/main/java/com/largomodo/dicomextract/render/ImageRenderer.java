package com.largomodo.dicomextract.render;

import java.nio.file.Path;

/**
 * Turns one extracted DICOM file into an annotated raster in the export directory.
 * <p>
 * Implementations never throw for per-file problems: decode and write failures are returned
 * as {@link RenderResult.Status#FAILED} so a batch can continue.
 */
public interface ImageRenderer {

    /**
     * @param dicomFile extracted DICOM file
     * @param exportDir existing directory the image is written to
     * @return outcome for this file
     */
    RenderResult render(Path dicomFile, Path exportDir);
}
