package com.largomodo.dicomextract.core;

/**
 * What happened to one archive entry during extraction.
 */
public enum ExtractionOutcome {
    WRITTEN,
    /** Destination already populated and overwrite disabled; nothing touched. */
    SKIPPED_EXISTING,
    OVERWRITTEN,
    /** Written under a numeric conflict suffix (name_1.ext, name_2.ext, ...). */
    CONFLICT_RENAMED,
    NOT_DICOM,
    FAILED;

    /**
     * @return true when the outcome left a file at its destination during this run
     */
    public boolean isMaterialized() {
        return this == WRITTEN || this == OVERWRITTEN || this == CONFLICT_RENAMED;
    }
}
