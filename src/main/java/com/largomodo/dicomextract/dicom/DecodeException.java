package com.largomodo.dicomextract.dicom;

import java.io.IOException;

/**
 * Thrown when a DICOM record is structurally malformed or its pixel data cannot be decoded.
 * <p>
 * Per-file: the batch records the failure and moves on.
 */
public class DecodeException extends IOException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
