package com.largomodo.dicomextract.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.attribute.FileTime;
import java.util.Optional;

/**
 * A regular file inside an open archive.
 * <p>
 * Entries never hold payload bytes themselves: each {@link #openStream()} call opens a fresh
 * stream, so one consumer (e.g. classification) cannot disturb another (extraction).
 * Only valid while the {@link ArchiveReader} that produced it is open.
 *
 * @param path         logical path inside the container, '/'-separated, no leading slash
 * @param size         uncompressed size in bytes, -1 when the container does not record it
 * @param lastModified modification time recorded by the container, if any
 * @param source       opens the entry payload
 */
public record ArchiveEntry(String path, long size, Optional<FileTime> lastModified, EntrySource source) {

    public ArchiveEntry {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be null or blank");
        }
        if (lastModified == null) {
            throw new IllegalArgumentException("lastModified must not be null (use Optional.empty())");
        }
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
    }

    /**
     * Base name of the entry (last path segment).
     */
    public String fileName() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /**
     * Opens a new stream over the entry payload. Caller closes it.
     *
     * @throws ArchiveReadException if the payload cannot be read from the container
     */
    public InputStream openStream() throws ArchiveReadException {
        try {
            return source.open();
        } catch (ArchiveReadException e) {
            throw e;
        } catch (IOException e) {
            throw new ArchiveReadException(path, e);
        }
    }

    /**
     * Lazily opens the payload of one entry.
     */
    @FunctionalInterface
    public interface EntrySource {
        InputStream open() throws IOException;
    }
}
