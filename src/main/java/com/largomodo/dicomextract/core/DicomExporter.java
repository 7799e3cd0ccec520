package com.largomodo.dicomextract.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Entry point to the extraction and rendering pipeline.
 * <p>
 * The two steps are independent: {@link #render} accepts any report produced by
 * {@link #extract}, including one that hit the cache.
 */
public interface DicomExporter {

    /**
     * Extract the DICOM records of an archive.
     *
     * @param archive     ZIP or ISO 9660 file
     * @param destination destination root, or null to use {@code <archive dir>/<basename>_<kind>}
     * @param overwrite   replace existing files instead of honoring a populated destination
     * @return per-entry report
     * @throws com.largomodo.dicomextract.archive.ArchiveOpenException if the archive cannot be opened
     * @throws IOException if the archive cannot be enumerated or the destination cannot be created
     */
    ExtractionReport extract(Path archive, Path destination, boolean overwrite) throws IOException;

    /**
     * Render the records of a report to annotated PNGs and write the gallery document.
     *
     * @param report    result of a previous {@link #extract} call
     * @param exportDir export directory, or null to derive one from the destination root
     * @return rendered images and per-outcome counts
     * @throws IOException if the export directory or the gallery cannot be written
     */
    GalleryReport render(ExtractionReport report, Path exportDir) throws IOException;
}
