package com.largomodo.dicomextract.core;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Per-entry line of an {@link ExtractionReport}.
 *
 * @param sourcePath     entry path inside the archive
 * @param destination    file written (or that would have been written); empty for NOT_DICOM and
 *                       for failures before a name was assigned
 * @param outcome        what happened
 * @param conflictSuffix numeric suffix for {@link ExtractionOutcome#CONFLICT_RENAMED}, 0 otherwise
 * @param directoryIndex true when the entry is a DICOM directory index (no pixel data expected)
 * @param detail         failure or skip reason, empty when not applicable
 */
public record ExtractedFile(String sourcePath, Optional<Path> destination, ExtractionOutcome outcome,
                            int conflictSuffix, boolean directoryIndex, String detail) {

    public ExtractedFile {
        if (sourcePath == null || destination == null || outcome == null) {
            throw new IllegalArgumentException("sourcePath, destination and outcome must not be null");
        }
        if ((outcome == ExtractionOutcome.CONFLICT_RENAMED) != (conflictSuffix > 0)) {
            throw new IllegalArgumentException("conflictSuffix must be positive exactly for CONFLICT_RENAMED, got "
                    + conflictSuffix + " for " + outcome);
        }
        detail = detail == null ? "" : detail;
    }

    public static ExtractedFile materialized(String sourcePath, Path destination, ExtractionOutcome outcome,
                                             int conflictSuffix, boolean directoryIndex) {
        return new ExtractedFile(sourcePath, Optional.of(destination), outcome, conflictSuffix, directoryIndex, "");
    }

    public static ExtractedFile skippedExisting(String sourcePath, Path destination, boolean directoryIndex) {
        return new ExtractedFile(sourcePath, Optional.of(destination), ExtractionOutcome.SKIPPED_EXISTING, 0,
                directoryIndex, "destination already populated");
    }

    public static ExtractedFile notDicom(String sourcePath, String reason) {
        return new ExtractedFile(sourcePath, Optional.empty(), ExtractionOutcome.NOT_DICOM, 0, false, reason);
    }

    public static ExtractedFile failed(String sourcePath, Optional<Path> destination, String reason) {
        return new ExtractedFile(sourcePath, destination, ExtractionOutcome.FAILED, 0, false, reason);
    }
}
