package com.largomodo.dicomextract.core;

import com.largomodo.dicomextract.archive.ArchiveEntry;
import com.largomodo.dicomextract.archive.ArchiveKind;
import com.largomodo.dicomextract.archive.ArchiveReader;
import com.largomodo.dicomextract.core.workspace.CleanupException;
import com.largomodo.dicomextract.core.workspace.ExtractionWorkspace;
import com.largomodo.dicomextract.dicom.ClassificationResult;
import com.largomodo.dicomextract.dicom.DicomFileReader;
import com.largomodo.dicomextract.dicom.RecordClassifier;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Archive to destination extraction pipeline.
 * <p>
 * Coordinates the per-run workflow:
 * 1. Resolve the destination root (explicit, or {@code <archive dir>/<basename>_<kind>})
 * 2. Apply the cache rule: a populated destination with overwrite disabled is left untouched
 * 3. Classify every entry, materialize DICOM entries under their base name with conflict suffixes
 * 4. Report every entry, in enumeration order, through the report and the observer
 * <p>
 * Per-entry read/write failures are recorded and do not stop the run; only failing to
 * enumerate the archive propagates.
 */
public class ExtractionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExtractionEngine.class);

    static final String MDC_ENTRY = "entry";

    private final RecordClassifier classifier;
    private final ExportObserver observer;

    public ExtractionEngine(RecordClassifier classifier, ExportObserver observer) {
        if (classifier == null || observer == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.classifier = classifier;
        this.observer = observer;
    }

    /**
     * Destination used when the caller supplies none: a sibling of the archive named
     * {@code <basename>_<kind tag>}, e.g. {@code /data/scan.zip -> /data/scan_zip}.
     */
    public static Path deriveDestination(Path archive, ArchiveKind kind) {
        Path absolute = archive.toAbsolutePath();
        String baseName = FilenameUtils.getBaseName(absolute.getFileName().toString());
        if (baseName.isEmpty()) {
            baseName = absolute.getFileName().toString();
        }
        return absolute.resolveSibling(baseName + "_" + kind.getTag());
    }

    /**
     * Extract the DICOM entries of an open archive.
     *
     * @param reader      open archive
     * @param destination destination root, or null to derive one from the archive name
     * @param overwrite   replace existing files instead of skipping a populated destination
     * @return report with one line per entry
     * @throws IOException if the archive cannot be enumerated or the destination cannot be created
     */
    public ExtractionReport extract(ArchiveReader reader, Path destination, boolean overwrite) throws IOException {
        boolean explicit = destination != null;
        Path root = explicit ? destination : deriveDestination(reader.path(), reader.kind());

        List<ArchiveEntry> entries = reader.entries();
        log.debug("{} entries in {}", entries.size(), reader.path().getFileName());

        Files.createDirectories(root);
        observer.onArchiveOpened(reader.path(), reader.kind(), root);

        // Cache rule: any regular file in the destination means "already extracted"
        List<Path> existing = listRegularFiles(root);
        boolean cacheHit = !overwrite && !existing.isEmpty();
        if (cacheHit) {
            log.warn("Output directory already contains {} file(s) and overwrite is off; skipping extraction: {}",
                    existing.size(), root);
            observer.onCacheHit(root, existing.size());
        }

        List<ExtractedFile> results = new ArrayList<>(entries.size());
        List<Path> written = new ArrayList<>();
        UniqueNameAllocator allocator = new UniqueNameAllocator(root, overwrite);
        ExtractionWorkspace workspace = new ExtractionWorkspace(root);

        try {
            for (ArchiveEntry entry : entries) {
                MDC.put(MDC_ENTRY, entry.path());
                try {
                    ExtractedFile result = processEntry(entry, root, cacheHit, allocator, workspace);
                    results.add(result);
                    if (result.outcome().isMaterialized()) {
                        written.add(result.destination().orElseThrow());
                    }
                    observer.onEntry(result);
                } finally {
                    MDC.remove(MDC_ENTRY);
                }
            }
        } finally {
            try {
                workspace.close();
            } catch (CleanupException e) {
                log.warn("Staged files left behind in {}", root, e);
                observer.onWarning(e.getMessage());
            }
        }

        ExtractionReport report = new ExtractionReport(reader.path(), reader.kind(), root, explicit, cacheHit,
                results, cacheHit ? existingRecords(existing) : written);
        log.debug("Extraction of {} finished with {}", reader.path().getFileName(), report.exitStatus());
        return report;
    }

    private ExtractedFile processEntry(ArchiveEntry entry, Path root, boolean cacheHit,
                                       UniqueNameAllocator allocator, ExtractionWorkspace workspace) {
        ClassificationResult classification = classifier.classify(entry);

        switch (classification.verdict()) {
            case NOT_DICOM:
                log.debug("Skipping non-DICOM file: {} ({})", entry.path(), classification.reason());
                return ExtractedFile.notDicom(entry.path(), classification.reason());
            case UNREADABLE:
                log.warn("Cannot read entry {}: {}", entry.path(), classification.reason());
                observer.onEntryFailure(entry.path(), new IOException(classification.reason()));
                return ExtractedFile.failed(entry.path(), Optional.empty(), classification.reason());
            default:
                break;
        }

        boolean directoryIndex = classification.verdict() == ClassificationResult.Verdict.DICOM_DIRECTORY;
        String fileName = destinationName(entry);

        if (cacheHit) {
            return ExtractedFile.skippedExisting(entry.path(), root.resolve(fileName), directoryIndex);
        }

        UniqueNameAllocator.Allocation allocation = allocator.allocate(fileName);
        try {
            workspace.write(entry, allocation.path());
        } catch (IOException e) {
            log.error("Failed to extract {} to {}: {}", entry.path(), allocation.path(), e.getMessage());
            observer.onEntryFailure(entry.path(), e);
            return ExtractedFile.failed(entry.path(), Optional.of(allocation.path()), e.getMessage());
        }

        switch (allocation.outcome()) {
            case OVERWRITTEN -> log.info("Overwritten: {}", allocation.path());
            case CONFLICT_RENAMED -> log.info("Extracted (renamed): {}", allocation.path());
            default -> log.info("Extracted: {}", allocation.path());
        }
        return ExtractedFile.materialized(entry.path(), allocation.path(), allocation.outcome(),
                allocation.suffix(), directoryIndex);
    }

    /**
     * Flat layout: only the entry's base name is kept, which also rules out path traversal.
     */
    static String destinationName(ArchiveEntry entry) {
        String name = FilenameUtils.getName(entry.path());
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            return "entry";
        }
        return name;
    }

    /**
     * Files of a populated destination that carry the DICOM Part 10 prefix; anything else the
     * user placed there is left out of rendering.
     */
    private static List<Path> existingRecords(List<Path> existing) {
        List<Path> records = new ArrayList<>(existing.size());
        for (Path file : existing) {
            if (hasDicomPrefix(file)) {
                records.add(file);
            } else {
                log.debug("Existing file is not DICOM, not rendered: {}", file.getFileName());
            }
        }
        return records;
    }

    private static boolean hasDicomPrefix(Path file) {
        byte[] prefix = new byte[DicomFileReader.PREFIX_LENGTH];
        try (InputStream in = Files.newInputStream(file)) {
            return DicomFileReader.hasPart10Prefix(prefix, in.readNBytes(prefix, 0, prefix.length));
        } catch (IOException e) {
            log.warn("Cannot inspect existing file {}: {}", file, e.getMessage());
            return false;
        }
    }

    private static List<Path> listRegularFiles(Path root) throws IOException {
        try (Stream<Path> stream = Files.list(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> !ExtractionWorkspace.isStagingFile(p))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
