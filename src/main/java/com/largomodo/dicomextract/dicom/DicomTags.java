package com.largomodo.dicomextract.dicom;

/**
 * DICOM tag numbers ((group << 16) | element) and well-known UIDs used by the reader.
 */
public final class DicomTags {

    // File Meta Information (always explicit VR little endian)
    public static final int MEDIA_STORAGE_SOP_CLASS_UID = 0x00020002;
    public static final int TRANSFER_SYNTAX_UID = 0x00020010;

    public static final int SPECIFIC_CHARACTER_SET = 0x00080005;
    public static final int SOP_CLASS_UID = 0x00080016;
    public static final int STUDY_DATE = 0x00080020;
    public static final int MODALITY = 0x00080060;
    public static final int STUDY_DESCRIPTION = 0x00081030;
    public static final int SERIES_DESCRIPTION = 0x0008103E;

    public static final int PATIENT_NAME = 0x00100010;
    public static final int PATIENT_ID = 0x00100020;

    public static final int SERIES_NUMBER = 0x00200011;
    public static final int INSTANCE_NUMBER = 0x00200013;
    public static final int SLICE_LOCATION = 0x00201041;

    public static final int SAMPLES_PER_PIXEL = 0x00280002;
    public static final int PHOTOMETRIC_INTERPRETATION = 0x00280004;
    public static final int PLANAR_CONFIGURATION = 0x00280006;
    public static final int NUMBER_OF_FRAMES = 0x00280008;
    public static final int ROWS = 0x00280010;
    public static final int COLUMNS = 0x00280011;
    public static final int BITS_ALLOCATED = 0x00280100;
    public static final int BITS_STORED = 0x00280101;
    public static final int PIXEL_REPRESENTATION = 0x00280103;
    public static final int RESCALE_INTERCEPT = 0x00281052;
    public static final int RESCALE_SLOPE = 0x00281053;

    public static final int PIXEL_DATA = 0x7FE00010;

    // Item and delimitation tags (group FFFE, never carry a VR)
    public static final int ITEM = 0xFFFEE000;
    public static final int ITEM_DELIMITATION = 0xFFFEE00D;
    public static final int SEQUENCE_DELIMITATION = 0xFFFEE0DD;

    public static final long UNDEFINED_LENGTH = 0xFFFFFFFFL;

    /** Media Storage Directory Storage: the SOP class of DICOMDIR index files. */
    public static final String MEDIA_STORAGE_DIRECTORY_UID = "1.2.840.10008.1.3.10";

    private DicomTags() {
    }

    public static int group(int tag) {
        return tag >>> 16;
    }

    /**
     * Format as (gggg,eeee) for messages.
     */
    public static String toString(int tag) {
        return String.format("(%04X,%04X)", tag >>> 16, tag & 0xFFFF);
    }
}
