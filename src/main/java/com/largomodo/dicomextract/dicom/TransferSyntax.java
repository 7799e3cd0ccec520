package com.largomodo.dicomextract.dicom;

import java.nio.ByteOrder;

/**
 * Dataset encodings understood by {@link DicomFileReader}.
 * <p>
 * Every transfer syntax not listed explicitly is an encapsulated (compressed) one, which is
 * always encoded as explicit VR little endian with fragmented pixel data.
 */
public enum TransferSyntax {
    IMPLICIT_VR_LITTLE_ENDIAN("1.2.840.10008.1.2", false, ByteOrder.LITTLE_ENDIAN, false, false),
    EXPLICIT_VR_LITTLE_ENDIAN("1.2.840.10008.1.2.1", true, ByteOrder.LITTLE_ENDIAN, false, false),
    DEFLATED_EXPLICIT_VR_LITTLE_ENDIAN("1.2.840.10008.1.2.1.99", true, ByteOrder.LITTLE_ENDIAN, true, false),
    EXPLICIT_VR_BIG_ENDIAN("1.2.840.10008.1.2.2", true, ByteOrder.BIG_ENDIAN, false, false),
    ENCAPSULATED(null, true, ByteOrder.LITTLE_ENDIAN, false, true);

    private final String uid;
    private final boolean explicitVr;
    private final ByteOrder byteOrder;
    private final boolean deflated;
    private final boolean encapsulated;

    TransferSyntax(String uid, boolean explicitVr, ByteOrder byteOrder, boolean deflated, boolean encapsulated) {
        this.uid = uid;
        this.explicitVr = explicitVr;
        this.byteOrder = byteOrder;
        this.deflated = deflated;
        this.encapsulated = encapsulated;
    }

    /**
     * Resolve a Transfer Syntax UID. A missing UID means the default implicit VR little endian.
     */
    public static TransferSyntax fromUid(String uid) {
        if (uid == null || uid.isBlank()) {
            return IMPLICIT_VR_LITTLE_ENDIAN;
        }
        for (TransferSyntax syntax : values()) {
            if (uid.equals(syntax.uid)) {
                return syntax;
            }
        }
        return ENCAPSULATED;
    }

    public String getUid() {
        return uid;
    }

    public boolean isExplicitVr() {
        return explicitVr;
    }

    public ByteOrder getByteOrder() {
        return byteOrder;
    }

    public boolean isDeflated() {
        return deflated;
    }

    public boolean isEncapsulated() {
        return encapsulated;
    }
}
