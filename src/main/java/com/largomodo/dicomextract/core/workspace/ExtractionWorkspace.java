package com.largomodo.dicomextract.core.workspace;

import com.largomodo.dicomextract.archive.ArchiveEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stages archive entries next to their destination and promotes them once complete.
 * <p>
 * Each entry streams into a hidden {@code .<name>.part} file in the destination directory,
 * then moves onto its final name, atomically where the filesystem allows. A reader of the
 * destination therefore never sees a half-written record under its final name.
 * <p>
 * AutoCloseable: staged files that were never promoted (failed copy, interrupted run) are
 * deleted on close.
 */
public class ExtractionWorkspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExtractionWorkspace.class);

    public static final String PART_SUFFIX = ".part";

    private final Path directory;
    private final List<Path> stagedFiles = new ArrayList<>();

    /**
     * @param directory destination directory (must exist)
     */
    public ExtractionWorkspace(Path directory) {
        this.directory = directory;
    }

    Path getDirectory() {
        return directory;
    }

    /**
     * True for staging files created by a workspace (so cache checks can ignore leftovers).
     */
    public static boolean isStagingFile(Path file) {
        String name = file.getFileName().toString();
        return name.startsWith(".") && name.endsWith(PART_SUFFIX);
    }

    /**
     * Copy an entry's payload to {@code target} through a staging file.
     * <p>
     * The entry's modification time is applied best effort. An existing {@code target} is
     * replaced; callers decide beforehand whether replacing is allowed.
     *
     * @param entry  archive entry to materialize
     * @param target final destination inside this workspace's directory
     * @return number of bytes written
     * @throws IOException if reading the entry or writing the file fails
     */
    public long write(ArchiveEntry entry, Path target) throws IOException {
        Path staging = directory.resolve("." + target.getFileName() + PART_SUFFIX);
        track(staging);

        long bytes;
        try (InputStream in = entry.openStream()) {
            bytes = Files.copy(in, staging, StandardCopyOption.REPLACE_EXISTING);
        }

        if (entry.lastModified().isPresent()) {
            try {
                Files.setLastModifiedTime(staging, entry.lastModified().get());
            } catch (IOException e) {
                log.debug("Cannot set modification time of {}: {}", target.getFileName(), e.getMessage());
            }
        }

        promoteToFinal(staging, target);
        return bytes;
    }

    /**
     * Track a staging file for deletion on close().
     */
    void track(Path staging) {
        stagedFiles.add(staging);
    }

    /**
     * Mark a staging file as handled, preventing deletion on close().
     */
    void markAsPromoted(Path staging) {
        stagedFiles.remove(staging);
    }

    /**
     * Move a staging file onto its final name.
     * <p>
     * Atomic move preferred; falls back to copy+delete when the filesystem cannot rename
     * atomically. Replaces an existing target.
     *
     * @throws IOException if move/copy operations fail
     */
    public void promoteToFinal(Path staging, Path target) throws IOException {
        try {
            Files.move(staging, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.copy(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            try {
                Files.delete(staging);
            } catch (IOException deleteEx) {
                IOException compositeEx = new IOException(
                        "Atomic move unsupported and staging cleanup failed for: " + staging, e);
                compositeEx.addSuppressed(deleteEx);
                throw compositeEx;
            }
        }

        markAsPromoted(staging);
    }

    /**
     * Deletes staging files that were never promoted, newest first.
     * <p>
     * If the thread is interrupted, logs a warning and skips cleanup.
     *
     * @throws CleanupException if any deletion fails
     */
    @Override
    public void close() throws CleanupException {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Thread interrupted, skipping cleanup of staged files in: {}", directory);
            return;
        }

        Collections.reverse(stagedFiles);
        List<IOException> failures = new ArrayList<>();

        for (Path staging : stagedFiles) {
            try {
                Files.deleteIfExists(staging);
            } catch (IOException e) {
                failures.add(e);
                log.warn("Cleanup failed for staged file: {}", staging, e);
            }
        }
        stagedFiles.clear();

        if (!failures.isEmpty()) {
            throw new CleanupException(
                    "Cleanup of staged files encountered " + failures.size() + " failure(s) in: " + directory,
                    failures);
        }
    }
}
