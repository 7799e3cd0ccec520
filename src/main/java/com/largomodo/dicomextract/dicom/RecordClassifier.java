package com.largomodo.dicomextract.dicom;

import com.largomodo.dicomextract.archive.ArchiveEntry;

/**
 * Decides whether an archive entry is a DICOM record without decoding its pixel data.
 * <p>
 * Implementations must open their own stream on the entry and read a bounded prefix only;
 * the entry stays readable for extraction afterwards.
 */
public interface RecordClassifier {

    /**
     * @param entry entry to inspect
     * @return classification, never null (I/O problems map to {@link ClassificationResult.Verdict#UNREADABLE})
     */
    ClassificationResult classify(ArchiveEntry entry);
}
