package com.largomodo.dicomextract.service;

import com.largomodo.dicomextract.archive.ArchiveReader;
import com.largomodo.dicomextract.archive.ArchiveReaders;
import com.largomodo.dicomextract.core.DicomExporter;
import com.largomodo.dicomextract.core.ExportObserver;
import com.largomodo.dicomextract.core.ExtractionEngine;
import com.largomodo.dicomextract.core.ExtractionReport;
import com.largomodo.dicomextract.core.GalleryReport;
import com.largomodo.dicomextract.dicom.DicomRecordClassifier;
import com.largomodo.dicomextract.dicom.RecordClassifier;
import com.largomodo.dicomextract.gallery.GalleryBuilder;
import com.largomodo.dicomextract.render.DicomImageRenderer;
import com.largomodo.dicomextract.render.FontResolver;
import com.largomodo.dicomextract.render.ImageRenderer;
import com.largomodo.dicomextract.render.RenderResult;
import com.largomodo.dicomextract.render.RenderedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Default wiring of archive readers, extraction engine, renderer and gallery builder.
 */
public class DefaultDicomExporter implements DicomExporter {

    private static final Logger log = LoggerFactory.getLogger(DefaultDicomExporter.class);

    static final String EXPORT_DIR_NAME = "export";

    private final ExtractionEngine engine;
    private final Supplier<ImageRenderer> rendererFactory;
    private final GalleryBuilder galleryBuilder;
    private final ExportObserver observer;

    /**
     * Production wiring: 8 KiB classification window, default font candidates.
     */
    public DefaultDicomExporter(ExportObserver observer) {
        this(new DicomRecordClassifier(), observer, new FontResolver(), new GalleryBuilder());
    }

    DefaultDicomExporter(RecordClassifier classifier, ExportObserver observer, FontResolver fontResolver,
                         GalleryBuilder galleryBuilder) {
        this(new ExtractionEngine(classifier, observer),
                () -> new DicomImageRenderer(fontResolver, observer),
                galleryBuilder, observer);
    }

    /**
     * @param rendererFactory supplies one renderer per {@link #render} call, so conflict
     *                        suffixes are tracked per run
     */
    public DefaultDicomExporter(ExtractionEngine engine, Supplier<ImageRenderer> rendererFactory,
                                GalleryBuilder galleryBuilder, ExportObserver observer) {
        if (engine == null || rendererFactory == null || galleryBuilder == null || observer == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.engine = engine;
        this.rendererFactory = rendererFactory;
        this.galleryBuilder = galleryBuilder;
        this.observer = observer;
    }

    /**
     * Export directory used when the caller supplies none: {@code <dest>/export} for an explicit
     * destination, the sibling {@code <dest>_export} for a derived one.
     */
    public static Path defaultExportDirectory(ExtractionReport report) {
        Path root = report.destinationRoot().toAbsolutePath();
        return report.explicitDestination()
                ? root.resolve(EXPORT_DIR_NAME)
                : root.resolveSibling(root.getFileName() + "_" + EXPORT_DIR_NAME);
    }

    @Override
    public ExtractionReport extract(Path archive, Path destination, boolean overwrite) throws IOException {
        try (ArchiveReader reader = ArchiveReaders.open(archive)) {
            return engine.extract(reader, destination, overwrite);
        }
    }

    @Override
    public GalleryReport render(ExtractionReport report, Path exportDir) throws IOException {
        Path target = exportDir != null ? exportDir : defaultExportDirectory(report);
        Files.createDirectories(target);

        ImageRenderer renderer = rendererFactory.get();
        Set<Path> directoryIndexes = report.directoryIndexPaths();
        List<RenderedImage> images = new ArrayList<>();
        int noImage = 0;
        int failed = 0;
        for (Path record : report.recordPaths()) {
            if (directoryIndexes.contains(record)) {
                log.debug("Directory index, not rendered: {}", record.getFileName());
                observer.onNoImage(record);
                noImage++;
                continue;
            }
            RenderResult result = renderer.render(record, target);
            switch (result.status()) {
                case RENDERED -> images.add(result.image().orElseThrow());
                case NO_IMAGE -> noImage++;
                case FAILED -> failed++;
            }
        }

        Optional<Path> gallery = Optional.empty();
        if (!images.isEmpty()) {
            gallery = Optional.of(galleryBuilder.build(images, target));
            observer.onGalleryWritten(gallery.get(), images.size());
        } else {
            log.warn("No images rendered; gallery not written");
        }

        log.debug("Rendered {} of {} records into {}", images.size(), report.recordPaths().size(), target);
        return new GalleryReport(target, gallery, images, noImage, failed);
    }
}
