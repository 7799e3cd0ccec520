package com.largomodo.dicomextract.dicom;

/**
 * Outcome of inspecting one archive entry.
 *
 * @param verdict what the entry is
 * @param reason  human-readable detail for {@link Verdict#NOT_DICOM} and {@link Verdict#UNREADABLE}, empty otherwise
 */
public record ClassificationResult(Verdict verdict, String reason) {

    public enum Verdict {
        /** DICOM Part 10 file, expected to carry an image. */
        DICOM_RECORD,
        /** DICOM Part 10 directory index (DICOMDIR); extracted, never rendered. */
        DICOM_DIRECTORY,
        NOT_DICOM,
        UNREADABLE
    }

    private static final ClassificationResult RECORD = new ClassificationResult(Verdict.DICOM_RECORD, "");
    private static final ClassificationResult DIRECTORY = new ClassificationResult(Verdict.DICOM_DIRECTORY, "");

    public ClassificationResult {
        if (verdict == null) {
            throw new IllegalArgumentException("verdict must not be null");
        }
        reason = reason == null ? "" : reason;
    }

    public static ClassificationResult dicomRecord() {
        return RECORD;
    }

    public static ClassificationResult directoryIndex() {
        return DIRECTORY;
    }

    public static ClassificationResult notDicom(String reason) {
        return new ClassificationResult(Verdict.NOT_DICOM, reason);
    }

    public static ClassificationResult unreadable(String reason) {
        return new ClassificationResult(Verdict.UNREADABLE, reason);
    }

    /**
     * @return true for entries that get extracted (image records and directory indexes)
     */
    boolean isDicom() {
        return verdict == Verdict.DICOM_RECORD || verdict == Verdict.DICOM_DIRECTORY;
    }
}
