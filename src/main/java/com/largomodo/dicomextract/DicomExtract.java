package com.largomodo.dicomextract;

import com.largomodo.dicomextract.archive.ArchiveKind;
import com.largomodo.dicomextract.archive.ArchiveOpenException;
import com.largomodo.dicomextract.core.DicomExporter;
import com.largomodo.dicomextract.core.ExitStatus;
import com.largomodo.dicomextract.core.ExportObserver;
import com.largomodo.dicomextract.core.ExtractionOutcome;
import com.largomodo.dicomextract.core.ExtractionReport;
import com.largomodo.dicomextract.core.GalleryReport;
import com.largomodo.dicomextract.service.DefaultDicomExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * CLI entry point for extracting DICOM records from ZIP and ISO 9660 archives.
 * <p>
 * Uses Picocli for argument parsing with automatic help generation. Accepts a single
 * positional archive path.
 * <p>
 * Smart defaults:
 * - Without -o: records go to {@code <archive dir>/<basename>_zip} (or {@code _iso})
 * - With --convert-to-png: images go to {@code <output>/export}, or to the sibling
 *   {@code <basename>_zip_export} when the output directory was derived
 */
@Command(
        name = "dicom-extract",
        mixinStandardHelpOptions = true,
        resourceBundle = "dicomextract.dicomextract",
        version = "${bundle:application.version}",
        header = "Extracts DICOM records from ZIP and ISO archives.",
        description = {
                "Scans a ZIP archive or ISO 9660 disc image (as shipped on patient CDs) for DICOM files," +
                        " recognized by content rather than by name, and copies them into a flat output directory.",
                "",
                "Re-running against a populated output directory leaves it untouched unless --overwrite is given.",
                "With --convert-to-png every image is rendered to an annotated PNG and an index.html gallery."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, rendering, etc.)",
                "2:Invalid command line arguments",
                "3:No DICOM files found in the archive",
                "4:Archive unreadable (corrupt or unsupported format)"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class DicomExtract implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DicomExtract.class);

    @Parameters(index = "0", paramLabel = "INPUT",
            description = "The ZIP archive or ISO image to extract.")
    File inputPath;

    @Option(names = {"-o", "--output-dir"},
            description = {
                    "Destination directory for the extracted DICOM files.",
                    "If omitted, a directory named '<archive>_zip' or '<archive>_iso' is created next to the archive.",
                    "A directory that already contains files is treated as a previous extraction."
            })
    File outputDir;

    @Option(names = "--convert-to-png",
            description = "Render every image to an annotated PNG and write an index.html gallery.")
    boolean convertToPng;

    @Option(names = "--overwrite",
            description = "Replace existing files in the output directory instead of skipping extraction.")
    boolean overwrite;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    private final Function<ExportObserver, DicomExporter> exporterFactory;

    public DicomExtract() {
        this(DefaultDicomExporter::new);
    }

    DicomExtract(Function<ExportObserver, DicomExporter> exporterFactory) {
        this.exporterFactory = exporterFactory;
    }

    public static void main(String[] args) {
        // Rendering needs no display; AWT must not look for one
        System.setProperty("java.awt.headless", "true");
        int exitCode = new CommandLine(new DicomExtract()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (!inputPath.exists()) {
            throw new ParameterException(spec.commandLine(),
                    "Input archive does not exist: " + inputPath.getAbsolutePath());
        }
        if (!inputPath.isFile()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path is not a file: " + inputPath.getAbsolutePath());
        }
        if (!inputPath.canRead()) {
            throw new ParameterException(spec.commandLine(),
                    "Input archive is not readable (check permissions): " + inputPath.getAbsolutePath());
        }
        if (outputDir != null && outputDir.exists() && !outputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
        }

        DicomExporter exporter = exporterFactory.apply(new LoggingObserver());
        Path destination = outputDir == null ? null : outputDir.toPath().toAbsolutePath();

        ExtractionReport report;
        try {
            report = exporter.extract(inputPath.toPath().toAbsolutePath(), destination, overwrite);
        } catch (ArchiveOpenException e) {
            log.error("Cannot open archive {}: {}", inputPath, e.getMessage());
            return ExitStatus.ARCHIVE_UNREADABLE.getExitCode();
        }

        logSummary(report);
        if (report.exitStatus() == ExitStatus.NO_QUALIFYING_RECORDS) {
            log.error("No DICOM files found in {}", inputPath.getName());
            return report.exitStatus().getExitCode();
        }

        if (convertToPng) {
            GalleryReport gallery = exporter.render(report, null);
            log.info("Rendering complete: {} rendered, {} without pixel data, {} failed",
                    gallery.renderedCount(), gallery.noImageCount(), gallery.failedCount());
        }

        return ExitStatus.SUCCESS.getExitCode();
    }

    private static void logSummary(ExtractionReport report) {
        log.info("Extraction complete: {} extracted, {} skipped, {} overwritten, {} renamed, {} non-DICOM, {} failed",
                report.count(ExtractionOutcome.WRITTEN),
                report.count(ExtractionOutcome.SKIPPED_EXISTING),
                report.count(ExtractionOutcome.OVERWRITTEN),
                report.count(ExtractionOutcome.CONFLICT_RENAMED),
                report.count(ExtractionOutcome.NOT_DICOM),
                report.count(ExtractionOutcome.FAILED));
    }

    /**
     * Surfaces run-level events; per-file problems are already logged where they occur.
     */
    private static final class LoggingObserver implements ExportObserver {

        @Override
        public void onArchiveOpened(Path archive, ArchiveKind kind, Path destinationRoot) {
            log.info("Processing {} archive: {} -> {}", kind, archive.getFileName(), destinationRoot);
        }

        @Override
        public void onGalleryWritten(Path gallery, int imageCount) {
            log.info("Gallery: {} ({} images)", gallery, imageCount);
        }
    }
}
