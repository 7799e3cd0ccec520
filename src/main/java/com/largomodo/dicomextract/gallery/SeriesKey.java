package com.largomodo.dicomextract.gallery;

import com.largomodo.dicomextract.dicom.ImageMetadata;

import java.util.OptionalInt;

/**
 * Gallery section identity: (series number, series description).
 */
public record SeriesKey(OptionalInt seriesNumber, String seriesDescription) {

    public SeriesKey {
        if (seriesNumber == null || seriesDescription == null) {
            throw new IllegalArgumentException("seriesNumber and seriesDescription must not be null");
        }
    }

    public static SeriesKey of(ImageMetadata metadata) {
        return new SeriesKey(metadata.seriesNumber(), metadata.seriesDescription());
    }

    /**
     * Section heading, e.g. "Series 3: AX T2" or "Series Unknown: Unknown".
     */
    public String title() {
        String number = seriesNumber.isPresent() ? Integer.toString(seriesNumber.getAsInt()) : ImageMetadata.UNKNOWN;
        return "Series " + number + ": " + seriesDescription;
    }
}
