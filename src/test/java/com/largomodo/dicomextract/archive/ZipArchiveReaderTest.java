package com.largomodo.dicomextract.archive;

import com.largomodo.dicomextract.fixtures.SyntheticZipFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ZipArchiveReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testEntriesInArchiveOrderWithoutDirectories() throws IOException {
        Path zip = SyntheticZipFactory.builder()
                .directory("DICOM/")
                .entry("DICOM/IM0002", "second".getBytes())
                .entry("DICOM/IM0001", "first".getBytes())
                .entry("README.txt", "readme".getBytes())
                .write(tempDir.resolve("study.zip"));

        try (ZipArchiveReader reader = new ZipArchiveReader(zip)) {
            List<ArchiveEntry> entries = reader.entries();

            assertEquals(List.of("DICOM/IM0002", "DICOM/IM0001", "README.txt"),
                    entries.stream().map(ArchiveEntry::path).toList());
            assertEquals("IM0002", entries.get(0).fileName());
            assertEquals(6, entries.get(0).size());
            assertTrue(entries.get(0).lastModified().isPresent(), "ZIP entries carry a modification time");
        }
    }

    @Test
    void testEntriesAreRestartable() throws IOException {
        Path zip = SyntheticZipFactory.builder()
                .entry("a", "1".getBytes())
                .entry("b", "2".getBytes())
                .write(tempDir.resolve("two.zip"));

        try (ZipArchiveReader reader = new ZipArchiveReader(zip)) {
            List<ArchiveEntry> first = reader.entries();
            List<ArchiveEntry> second = reader.entries();

            assertEquals(first.stream().map(ArchiveEntry::path).toList(),
                    second.stream().map(ArchiveEntry::path).toList());
        }
    }

    @Test
    void testEachOpenStreamStartsAtTheBeginning() throws IOException {
        Path zip = SyntheticZipFactory.builder()
                .entry("IM0001", "payload-bytes".getBytes())
                .write(tempDir.resolve("one.zip"));

        try (ZipArchiveReader reader = new ZipArchiveReader(zip)) {
            ArchiveEntry entry = reader.entries().get(0);

            try (InputStream partial = entry.openStream()) {
                assertEquals('p', partial.read());
            }
            try (InputStream full = entry.openStream()) {
                assertArrayEquals("payload-bytes".getBytes(), full.readAllBytes());
            }
        }
    }

    @Test
    void testBackslashNamesAreNormalized() throws IOException {
        Path zip = SyntheticZipFactory.builder()
                .entry("DICOM\\IM0001", "x".getBytes())
                .write(tempDir.resolve("windows.zip"));

        try (ZipArchiveReader reader = new ZipArchiveReader(zip)) {
            ArchiveEntry entry = reader.entries().get(0);

            assertEquals("DICOM/IM0001", entry.path());
            assertEquals("IM0001", entry.fileName());
        }
    }

    @Test
    void testKindAndPath() throws IOException {
        Path zip = SyntheticZipFactory.builder().entry("a", new byte[0]).write(tempDir.resolve("k.zip"));

        try (ZipArchiveReader reader = new ZipArchiveReader(zip)) {
            assertEquals(ArchiveKind.ZIP, reader.kind());
            assertEquals(zip, reader.path());
        }
    }
}
