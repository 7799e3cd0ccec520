package com.largomodo.dicomextract.core;

import com.largomodo.dicomextract.archive.ArchiveKind;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Aggregate result of one extraction run.
 *
 * @param archive             source container
 * @param kind                detected container format
 * @param destinationRoot     directory the records were extracted to
 * @param explicitDestination true when the caller supplied {@code destinationRoot}
 * @param cacheHit            true when the populated destination was left untouched
 * @param files               per-entry outcomes in archive enumeration order
 * @param recordPaths         DICOM files available for rendering: files written by this run, or
 *                            the existing files of the destination that carry a DICOM prefix
 *                            on a cache hit
 */
public record ExtractionReport(Path archive, ArchiveKind kind, Path destinationRoot, boolean explicitDestination,
                               boolean cacheHit, List<ExtractedFile> files, List<Path> recordPaths) {

    public ExtractionReport {
        if (archive == null || kind == null || destinationRoot == null) {
            throw new IllegalArgumentException("archive, kind and destinationRoot must not be null");
        }
        files = List.copyOf(files);
        recordPaths = List.copyOf(recordPaths);
    }

    public long count(ExtractionOutcome outcome) {
        return files.stream().filter(f -> f.outcome() == outcome).count();
    }

    /**
     * @return number of DICOM entries that reached their destination during this run
     */
    public long materializedCount() {
        return files.stream().filter(f -> f.outcome().isMaterialized()).count();
    }

    /**
     * Destinations of the entries classified as directory indexes (DICOMDIR). Rendering
     * reports these as having no image without decoding them.
     */
    public Set<Path> directoryIndexPaths() {
        return files.stream()
                .filter(ExtractedFile::directoryIndex)
                .flatMap(f -> f.destination().stream())
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Success when at least one record was materialized, or the destination already held the
     * extraction of an earlier run.
     */
    public ExitStatus exitStatus() {
        return materializedCount() > 0 || (cacheHit && !recordPaths.isEmpty())
                ? ExitStatus.SUCCESS
                : ExitStatus.NO_QUALIFYING_RECORDS;
    }
}
