package com.largomodo.dicomextract.gallery;

import java.util.Comparator;
import java.util.OptionalInt;

/**
 * Orders gallery sections.
 * <p>
 * Sorting strategy:
 * 1. Series number ascending, sections without a number last
 * 2. Series description, case-insensitive, then case-sensitive so distinct keys never tie
 */
public class SeriesOrderComparator implements Comparator<SeriesKey> {

    @Override
    public int compare(SeriesKey k1, SeriesKey k2) {
        int numberComparison = compareOptional(k1.seriesNumber(), k2.seriesNumber());
        if (numberComparison != 0) {
            return numberComparison;
        }

        int descriptionComparison = k1.seriesDescription().compareToIgnoreCase(k2.seriesDescription());
        if (descriptionComparison != 0) {
            return descriptionComparison;
        }
        return k1.seriesDescription().compareTo(k2.seriesDescription());
    }

    static int compareOptional(OptionalInt a, OptionalInt b) {
        if (a.isPresent() && b.isPresent()) {
            return Integer.compare(a.getAsInt(), b.getAsInt());
        }
        // Unknown sorts after every known value
        return Boolean.compare(a.isEmpty(), b.isEmpty());
    }
}
