package com.largomodo.dicomextract.dicom;

import java.util.List;

/**
 * One top-level data element.
 *
 * @param tag       (group << 16) | element
 * @param vr        two-letter value representation, null for implicit VR encodings
 * @param value     raw value bytes in the dataset byte order (empty for encapsulated pixel data)
 * @param fragments encapsulated pixel data fragments, Basic Offset Table excluded; empty otherwise
 */
public record DicomElement(int tag, String vr, byte[] value, List<byte[]> fragments) {

    public DicomElement {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
    }

    public boolean isEncapsulated() {
        return !fragments.isEmpty();
    }
}
