package com.largomodo.dicomextract.dicom;

import java.nio.file.Path;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Header fields shown in overlays and used for gallery grouping.
 * <p>
 * Missing text fields hold {@link #UNKNOWN}; missing numeric fields are empty optionals.
 * No component is ever null, so sorting and formatting never see absent values.
 */
public record ImageMetadata(
        String patientName,
        String patientId,
        String studyDate,
        String studyDescription,
        OptionalInt seriesNumber,
        String seriesDescription,
        String modality,
        OptionalDouble sliceLocation,
        OptionalInt instanceNumber,
        Path sourceFile
) {

    public static final String UNKNOWN = "Unknown";

    public ImageMetadata {
        if (patientName == null || patientId == null || studyDate == null || studyDescription == null
                || seriesNumber == null || seriesDescription == null || modality == null
                || sliceLocation == null || instanceNumber == null || sourceFile == null) {
            throw new IllegalArgumentException("ImageMetadata components must not be null (use UNKNOWN or empty optionals)");
        }
    }

    /**
     * Extract the fields from a parsed dataset.
     */
    public static ImageMetadata from(DicomDataset dataset, Path sourceFile) {
        return new ImageMetadata(
                dataset.getString(DicomTags.PATIENT_NAME).map(ImageMetadata::formatPersonName).orElse(UNKNOWN),
                dataset.getString(DicomTags.PATIENT_ID).orElse(UNKNOWN),
                dataset.getString(DicomTags.STUDY_DATE).map(ImageMetadata::formatDate).orElse(UNKNOWN),
                dataset.getString(DicomTags.STUDY_DESCRIPTION).orElse(UNKNOWN),
                dataset.getInt(DicomTags.SERIES_NUMBER),
                dataset.getString(DicomTags.SERIES_DESCRIPTION).orElse(UNKNOWN),
                dataset.getString(DicomTags.MODALITY).orElse(UNKNOWN),
                dataset.getDouble(DicomTags.SLICE_LOCATION),
                dataset.getInt(DicomTags.INSTANCE_NUMBER),
                sourceFile
        );
    }

    String seriesNumberText() {
        return seriesNumber.isPresent() ? Integer.toString(seriesNumber.getAsInt()) : UNKNOWN;
    }

    public String sliceLocationText() {
        return sliceLocation.isPresent() ? String.format(Locale.ROOT, "%.2f", sliceLocation.getAsDouble()) : UNKNOWN;
    }

    public String instanceNumberText() {
        return instanceNumber.isPresent() ? Integer.toString(instanceNumber.getAsInt()) : UNKNOWN;
    }

    /**
     * "Doe^John^^^" becomes "Doe John".
     */
    static String formatPersonName(String personName) {
        String formatted = String.join(" ", personName.split("\\^")).replaceAll("\\s+", " ").trim();
        return formatted.isEmpty() ? UNKNOWN : formatted;
    }

    /**
     * DA values (YYYYMMDD) become YYYY-MM-DD; anything else is kept verbatim.
     */
    static String formatDate(String date) {
        if (date.length() == 8 && date.chars().allMatch(Character::isDigit)) {
            return date.substring(0, 4) + "-" + date.substring(4, 6) + "-" + date.substring(6);
        }
        return date;
    }
}
