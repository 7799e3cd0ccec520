package com.largomodo.dicomextract.dicom;

import com.largomodo.dicomextract.archive.ArchiveEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Content-based DICOM detection over a bounded leading window of each entry.
 * <p>
 * An entry is DICOM only when it carries the 128-byte preamble followed by "DICM" (the same
 * rule strict DICOM toolkits apply without a "force" option). Directory indexes are
 * recognized by the Media Storage Directory SOP class in the file meta group, or by the
 * conventional DICOMDIR file name when the meta group does not fit in the window.
 */
public class DicomRecordClassifier implements RecordClassifier {

    private static final Logger log = LoggerFactory.getLogger(DicomRecordClassifier.class);

    public static final int DEFAULT_WINDOW = 8 * 1024;
    private static final String DICOMDIR_NAME = "DICOMDIR";

    private final int window;
    private final DicomFileReader reader = new DicomFileReader();

    public DicomRecordClassifier() {
        this(DEFAULT_WINDOW);
    }

    /**
     * @param window maximum number of leading bytes read per entry
     */
    public DicomRecordClassifier(int window) {
        if (window < DicomFileReader.PREFIX_LENGTH) {
            throw new IllegalArgumentException("window must hold at least the DICOM prefix ("
                    + DicomFileReader.PREFIX_LENGTH + " bytes), got: " + window);
        }
        this.window = window;
    }

    @Override
    public ClassificationResult classify(ArchiveEntry entry) {
        byte[] prefix = new byte[window];
        int length;
        try (InputStream in = entry.openStream()) {
            length = in.readNBytes(prefix, 0, window);
        } catch (IOException e) {
            log.debug("Cannot read leading bytes of {}: {}", entry.path(), e.getMessage());
            return ClassificationResult.unreadable(e.getMessage());
        }
        return classify(entry.fileName(), prefix, length);
    }

    /**
     * Classify from an already-read prefix.
     *
     * @param fileName base name of the entry (used for the DICOMDIR name convention)
     * @param prefix   leading bytes
     * @param length   number of valid bytes in {@code prefix}
     */
    public ClassificationResult classify(String fileName, byte[] prefix, int length) {
        if (length < DicomFileReader.PREFIX_LENGTH) {
            return ClassificationResult.notDicom("Too short for a DICOM preamble (" + length + " bytes)");
        }
        if (!DicomFileReader.hasPart10Prefix(prefix, length)) {
            return ClassificationResult.notDicom("No DICM marker at offset " + DicomFileReader.PREAMBLE_LENGTH);
        }

        try {
            DicomDataset meta = reader.readFileMetaInformation(prefix, length);
            boolean directory = meta.getString(DicomTags.MEDIA_STORAGE_SOP_CLASS_UID)
                    .map(DicomTags.MEDIA_STORAGE_DIRECTORY_UID::equals)
                    .orElse(false);
            if (directory) {
                return ClassificationResult.directoryIndex();
            }
        } catch (DecodeException e) {
            // hasPart10Prefix already passed; readFileMetaInformation is lenient past that point
            log.debug("File meta information of {} unreadable: {}", fileName, e.getMessage());
        }

        if (DICOMDIR_NAME.equalsIgnoreCase(fileName)) {
            return ClassificationResult.directoryIndex();
        }
        return ClassificationResult.dicomRecord();
    }
}
