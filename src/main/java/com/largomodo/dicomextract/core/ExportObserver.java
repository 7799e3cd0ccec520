package com.largomodo.dicomextract.core;

import com.largomodo.dicomextract.archive.ArchiveKind;
import com.largomodo.dicomextract.render.RenderedImage;

import java.nio.file.Path;

/**
 * Observer interface for extraction and rendering events.
 * <p>
 * The core never configures logging: everything a user should see is reported here, and
 * the caller decides how to surface it. One instance per run. All methods have default
 * no-op implementations, allowing consumers to override only the events they care about.
 * <p>
 * Example usage:
 * <pre>{@code
 * ExportObserver observer = new ExportObserver() {
 *     @Override
 *     public void onEntry(ExtractedFile file) {
 *         System.out.println(file.outcome() + ": " + file.sourcePath());
 *     }
 * };
 * }</pre>
 *
 * @see ExtractionEngine
 */
public interface ExportObserver {

    /**
     * Called once the archive is open and the destination is known.
     */
    default void onArchiveOpened(Path archive, ArchiveKind kind, Path destinationRoot) {}

    /**
     * Called when a populated destination short-circuits extraction.
     *
     * @param existingFiles number of regular files already in the destination
     */
    default void onCacheHit(Path destinationRoot, int existingFiles) {}

    /**
     * Called for every entry with its final outcome, in enumeration order.
     */
    default void onEntry(ExtractedFile file) {}

    /**
     * Called when an entry could not be read or written.
     */
    default void onEntryFailure(String entryPath, Exception e) {}

    /**
     * Called when a DICOM file was rendered to a raster image.
     */
    default void onRendered(RenderedImage image) {}

    /**
     * Called for DICOM files without pixel data (directory indexes, structured reports).
     */
    default void onNoImage(Path file) {}

    /**
     * Called when pixel data is present but cannot be decoded or the image cannot be written.
     */
    default void onRenderFailure(Path file, Exception e) {}

    /**
     * Called once the gallery document has been written.
     */
    default void onGalleryWritten(Path gallery, int imageCount) {}

    /**
     * Non-fatal conditions worth surfacing (missing fonts, cleanup problems).
     */
    default void onWarning(String message) {}
}
