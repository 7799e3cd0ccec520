package com.largomodo.dicomextract.archive;

import java.io.IOException;

/**
 * Thrown when the payload of a single entry cannot be read (corrupt data, truncated image).
 * <p>
 * Per-entry: callers record the failure and continue with the next entry.
 */
public class ArchiveReadException extends IOException {

    private final String entryPath;

    public ArchiveReadException(String entryPath, String message) {
        super(message + ": " + entryPath);
        this.entryPath = entryPath;
    }

    public ArchiveReadException(String entryPath, Throwable cause) {
        super("Cannot read entry " + entryPath + ": " + cause.getMessage(), cause);
        this.entryPath = entryPath;
    }

    public String getEntryPath() {
        return entryPath;
    }
}
