package com.largomodo.dicomextract.archive;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Uniform view over the regular files of a container.
 * <p>
 * Implementations hold the container open until {@link #close()}; entries returned by
 * {@link #entries()} are only readable while the reader is open.
 */
public interface ArchiveReader extends Closeable {

    /**
     * @return the container this reader was opened on
     */
    Path path();

    /**
     * @return container format
     */
    ArchiveKind kind();

    /**
     * Enumerates regular-file entries in archive-native order.
     * <p>
     * Restartable: every call returns a fresh list in the same order.
     *
     * @return entries, never null
     * @throws IOException if the container structure cannot be walked
     */
    List<ArchiveEntry> entries() throws IOException;
}
