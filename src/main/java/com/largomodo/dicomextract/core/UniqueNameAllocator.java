package com.largomodo.dicomextract.core;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Single authority for destination names inside one directory during one run.
 * <p>
 * A requested name is granted as-is when free (or when overwriting is allowed and the file
 * predates this run). Otherwise "_1", "_2", ... is inserted before the extension until a name
 * is neither on disk nor already granted. Names granted in this run are never reused, so two
 * entries can never share a destination even with overwrite enabled.
 * <p>
 * Synchronized: parallel writers must all allocate through one instance.
 */
public class UniqueNameAllocator {

    private final Path directory;
    private final boolean overwrite;
    private final Set<String> granted = new HashSet<>();

    public UniqueNameAllocator(Path directory, boolean overwrite) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        this.directory = directory;
        this.overwrite = overwrite;
    }

    /**
     * Reserve a destination for {@code fileName}.
     *
     * @param fileName requested base name (no path separators)
     * @return the granted path and the outcome it implies
     */
    public synchronized Allocation allocate(String fileName) {
        if (fileName == null || fileName.isBlank() || fileName.contains("/") || fileName.contains("\\")) {
            throw new IllegalArgumentException("fileName must be a non-blank base name, got: " + fileName);
        }

        Path requested = directory.resolve(fileName);
        if (!granted.contains(fileName)) {
            boolean exists = Files.exists(requested);
            if (!exists || overwrite) {
                granted.add(fileName);
                return new Allocation(requested,
                        exists ? ExtractionOutcome.OVERWRITTEN : ExtractionOutcome.WRITTEN, 0);
            }
        }

        // Split on the last dot, except for dot-files (".hidden" has no extension)
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";

        for (int suffix = 1; ; suffix++) {
            String candidate = base + "_" + suffix + extension;
            Path candidatePath = directory.resolve(candidate);
            if (!granted.contains(candidate) && !Files.exists(candidatePath)) {
                granted.add(candidate);
                return new Allocation(candidatePath, ExtractionOutcome.CONFLICT_RENAMED, suffix);
            }
        }
    }

    /**
     * @param path      granted destination
     * @param outcome   WRITTEN, OVERWRITTEN or CONFLICT_RENAMED
     * @param suffix    conflict suffix, 0 unless CONFLICT_RENAMED
     */
    public record Allocation(Path path, ExtractionOutcome outcome, int suffix) {
    }
}
