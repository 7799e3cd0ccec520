package com.largomodo.dicomextract.service;

import com.largomodo.dicomextract.archive.ArchiveKind;
import com.largomodo.dicomextract.archive.ArchiveOpenException;
import com.largomodo.dicomextract.core.ExitStatus;
import com.largomodo.dicomextract.core.ExportObserver;
import com.largomodo.dicomextract.core.ExtractionEngine;
import com.largomodo.dicomextract.core.ExtractionOutcome;
import com.largomodo.dicomextract.core.ExtractionReport;
import com.largomodo.dicomextract.core.GalleryReport;
import com.largomodo.dicomextract.dicom.DicomRecordClassifier;
import com.largomodo.dicomextract.fixtures.SyntheticDicomFactory;
import com.largomodo.dicomextract.fixtures.SyntheticIsoFactory;
import com.largomodo.dicomextract.fixtures.SyntheticZipFactory;
import com.largomodo.dicomextract.gallery.GalleryBuilder;
import com.largomodo.dicomextract.render.FontResolver;
import com.largomodo.dicomextract.render.ImageRenderer;
import com.largomodo.dicomextract.render.RenderResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DefaultDicomExporterTest {

    @TempDir
    Path tempDir;

    private final ExportObserver observer = mock(ExportObserver.class);
    private DefaultDicomExporter exporter;

    @BeforeEach
    void setUp() {
        FontResolver noFont = mock(FontResolver.class);
        when(noFont.font()).thenReturn(Optional.empty());
        exporter = new DefaultDicomExporter(new DicomRecordClassifier(), observer, noFont, new GalleryBuilder());
    }

    private static byte[] slice(int series, String description, double location, int instance) {
        return SyntheticDicomFactory.ctSlice("Doe^John", series, description, location, instance);
    }

    private Path studyZip() throws IOException {
        return SyntheticZipFactory.builder()
                .entry("DICOMDIR", SyntheticDicomFactory.dicomDir())
                .directory("DICOM/")
                .entry("DICOM/SE1/IM0002", slice(1, "AXIAL", 5.0, 2))
                .entry("DICOM/SE1/IM0001", slice(1, "AXIAL", 0.0, 1))
                .entry("DICOM/SE2/IM0003", slice(2, "CORONAL", 0.0, 1))
                .entry("viewer/README.TXT", "Install the viewer".getBytes())
                .write(tempDir.resolve("study.zip"));
    }

    @Test
    void testZipEndToEndWithDerivedDirectories() throws IOException {
        Path zip = studyZip();

        ExtractionReport report = exporter.extract(zip, null, false);

        Path destination = tempDir.resolve("study_zip");
        assertEquals(destination, report.destinationRoot());
        assertEquals(ExitStatus.SUCCESS, report.exitStatus());
        assertEquals(4, report.count(ExtractionOutcome.WRITTEN));
        assertEquals(1, report.count(ExtractionOutcome.NOT_DICOM));

        GalleryReport gallery = exporter.render(report, null);

        Path exportDir = tempDir.resolve("study_zip_export");
        assertEquals(exportDir, gallery.exportDirectory());
        assertEquals(3, gallery.renderedCount());
        assertEquals(1, gallery.noImageCount(), "DICOMDIR has no pixel data");
        assertEquals(0, gallery.failedCount());
        assertEquals(Optional.of(exportDir.resolve("index.html")), gallery.gallery());
        assertTrue(Files.isRegularFile(exportDir.resolve("IM0001.png")));
        assertTrue(Files.isRegularFile(exportDir.resolve("IM0003.png")));
        verify(observer).onGalleryWritten(exportDir.resolve("index.html"), 3);

        String html = Files.readString(exportDir.resolve("index.html"));
        assertTrue(html.indexOf("IM0001.png") < html.indexOf("IM0002.png"), "Slices in location order");
        assertTrue(html.indexOf("IM0002.png") < html.indexOf("IM0003.png"), "Series 1 before series 2");
    }

    @Test
    void testIsoEndToEndWithExplicitDestination() throws IOException {
        Path iso = SyntheticIsoFactory.builder()
                .rockRidge()
                .file("DICOMDIR", SyntheticDicomFactory.dicomDir())
                .file("DICOM/IM0001", slice(1, "AXIAL", 0.0, 1))
                .file("DICOM/IM0002", slice(1, "AXIAL", 5.0, 2))
                .write(tempDir.resolve("PATIENT.ISO"));
        Path destination = tempDir.resolve("records");

        ExtractionReport report = exporter.extract(iso, destination, false);
        GalleryReport gallery = exporter.render(report, null);

        assertEquals(ArchiveKind.ISO, report.kind());
        assertTrue(report.explicitDestination());
        assertEquals(3, report.materializedCount());
        assertEquals(destination.resolve("export"), gallery.exportDirectory());
        assertEquals(2, gallery.renderedCount());
    }

    @Test
    void testRerunUsesPopulatedDestinationAndStillRenders() throws IOException {
        Path zip = studyZip();
        Path destination = tempDir.resolve("out");
        GalleryReport first = exporter.render(exporter.extract(zip, destination, false), null);

        ExtractionReport second = exporter.extract(zip, destination, false);
        GalleryReport again = exporter.render(second, null);

        assertTrue(second.cacheHit(), "Export subdirectory must not defeat the populated-destination rule");
        assertEquals(4, second.count(ExtractionOutcome.SKIPPED_EXISTING));
        assertEquals(first.renderedCount(), again.renderedCount());
        try (Stream<Path> files = Files.list(destination.resolve("export"))) {
            assertEquals(List.of("IM0001.png", "IM0002.png", "IM0003.png", "index.html"),
                    files.map(p -> p.getFileName().toString()).sorted().toList(),
                    "A second render replaces earlier images instead of adding suffixed copies");
        }
    }

    @Test
    void testExplicitExportDirectory() throws IOException {
        ExtractionReport report = exporter.extract(studyZip(), tempDir.resolve("out"), false);
        Path exportDir = tempDir.resolve("gallery");

        GalleryReport gallery = exporter.render(report, exportDir);

        assertEquals(exportDir, gallery.exportDirectory());
        assertTrue(Files.isRegularFile(exportDir.resolve("index.html")));
    }

    @Test
    void testNoImagesMeansNoGallery() throws IOException {
        Path zip = SyntheticZipFactory.builder()
                .entry("DICOMDIR", SyntheticDicomFactory.dicomDir())
                .write(tempDir.resolve("index-only.zip"));

        GalleryReport gallery = exporter.render(exporter.extract(zip, tempDir.resolve("out"), false), null);

        assertEquals(0, gallery.renderedCount());
        assertEquals(1, gallery.noImageCount());
        assertTrue(gallery.gallery().isEmpty());
        assertFalse(Files.exists(gallery.exportDirectory().resolve("index.html")));
        verify(observer, never()).onGalleryWritten(any(), anyInt());
    }

    @Test
    void testDamagedDirectoryIndexIsNoImageNotFailure() throws IOException {
        byte[] index = SyntheticDicomFactory.dicomDir();
        Path zip = SyntheticZipFactory.builder()
                .entry("DICOMDIR", Arrays.copyOf(index, index.length - 6))
                .entry("DICOM/IM0001", slice(1, "AXIAL", 0.0, 1))
                .write(tempDir.resolve("damaged-index.zip"));
        ExtractionReport report = exporter.extract(zip, tempDir.resolve("out"), false);
        assertTrue(report.files().get(0).directoryIndex());

        GalleryReport gallery = exporter.render(report, null);

        assertEquals(1, gallery.renderedCount());
        assertEquals(1, gallery.noImageCount());
        assertEquals(0, gallery.failedCount());
        verify(observer).onNoImage(tempDir.resolve("out").resolve("DICOMDIR"));
        verify(observer, never()).onRenderFailure(any(), any());
    }

    @Test
    void testDirectoryIndexSkippedOnPopulatedDestination() throws IOException {
        Path zip = studyZip();
        Path destination = tempDir.resolve("out");
        exporter.extract(zip, destination, false);
        // Damage the index after the first run
        byte[] index = Files.readAllBytes(destination.resolve("DICOMDIR"));
        Files.write(destination.resolve("DICOMDIR"), Arrays.copyOf(index, index.length - 6));

        ExtractionReport second = exporter.extract(zip, destination, false);
        GalleryReport gallery = exporter.render(second, null);

        assertTrue(second.cacheHit());
        assertEquals(3, gallery.renderedCount());
        assertEquals(1, gallery.noImageCount());
        assertEquals(0, gallery.failedCount());
    }

    @Test
    void testUnreadableArchive() throws IOException {
        Path garbage = tempDir.resolve("broken.zip");
        Files.write(garbage, "this is not a zip file at all".getBytes());

        assertThrows(ArchiveOpenException.class, () -> exporter.extract(garbage, tempDir.resolve("out"), false));
        assertFalse(Files.exists(tempDir.resolve("out")), "Nothing is created for an unreadable archive");
    }

    @Test
    void testRendererPerRenderCallAndFailuresCounted() throws IOException {
        AtomicInteger created = new AtomicInteger();
        ImageRenderer failing = (file, dir) -> RenderResult.failed(file, "boom");
        DefaultDicomExporter custom = new DefaultDicomExporter(
                new ExtractionEngine(new DicomRecordClassifier(), observer),
                () -> {
                    created.incrementAndGet();
                    return failing;
                },
                new GalleryBuilder(), observer);
        ExtractionReport report = custom.extract(studyZip(), tempDir.resolve("out"), false);

        GalleryReport first = custom.render(report, null);
        custom.render(report, null);

        assertEquals(2, created.get());
        assertEquals(3, first.failedCount());
        assertEquals(1, first.noImageCount(), "DICOMDIR never reaches the renderer");
        assertTrue(first.gallery().isEmpty());
    }

    @Test
    void testDefaultExportDirectory() {
        ExtractionReport explicit = new ExtractionReport(Path.of("/data/a.zip"), ArchiveKind.ZIP,
                Path.of("/data/out"), true, false, List.of(), List.of());
        ExtractionReport derived = new ExtractionReport(Path.of("/data/a.zip"), ArchiveKind.ZIP,
                Path.of("/data/a_zip"), false, false, List.of(), List.of());

        assertEquals(Path.of("/data/out/export"), DefaultDicomExporter.defaultExportDirectory(explicit));
        assertEquals(Path.of("/data/a_zip_export"), DefaultDicomExporter.defaultExportDirectory(derived));
    }

    @Test
    void testNullDependenciesRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DefaultDicomExporter(null, () -> null, new GalleryBuilder(), observer));
    }

    @Test
    void testObserverNotifiedOfArchiveOpened() throws IOException {
        Path zip = studyZip();

        exporter.extract(zip, tempDir.resolve("out"), false);

        verify(observer).onArchiveOpened(eq(zip), eq(ArchiveKind.ZIP), eq(tempDir.resolve("out")));
    }
}
