package com.largomodo.dicomextract.archive;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a container cannot be opened as any supported format.
 * <p>
 * Fatal for the run: nothing can be enumerated.
 */
public class ArchiveOpenException extends IOException {

    private final Path archive;

    public ArchiveOpenException(Path archive, String message) {
        super(message + ": " + archive);
        this.archive = archive;
    }

    public ArchiveOpenException(Path archive, String message, Throwable cause) {
        super(message + ": " + archive, cause);
        this.archive = archive;
    }

    public Path getArchive() {
        return archive;
    }
}
