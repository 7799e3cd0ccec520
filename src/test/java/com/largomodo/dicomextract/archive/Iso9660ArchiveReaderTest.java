package com.largomodo.dicomextract.archive;

import com.largomodo.dicomextract.dicom.ClassificationResult;
import com.largomodo.dicomextract.dicom.DicomRecordClassifier;
import com.largomodo.dicomextract.fixtures.SyntheticDicomFactory;
import com.largomodo.dicomextract.fixtures.SyntheticIsoFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Iso9660ArchiveReaderTest {

    @TempDir
    Path tempDir;

    private static List<String> paths(ArchiveReader reader) throws IOException {
        return reader.entries().stream().map(ArchiveEntry::path).toList();
    }

    /**
     * Offset of the directory record whose identifier is {@code identifier}.
     */
    private static int recordOffset(byte[] image, String identifier) {
        byte[] needle = identifier.getBytes(StandardCharsets.ISO_8859_1);
        for (int i = 33; i <= image.length - needle.length; i++) {
            if (Byte.toUnsignedInt(image[i - 1]) == needle.length
                    && Arrays.equals(image, i, i + needle.length, needle, 0, needle.length)) {
                return i - 33;
            }
        }
        throw new IllegalStateException("No record named " + identifier);
    }

    @Test
    void testPrimaryTreeDepthFirstSortedByName() throws IOException {
        Path iso = SyntheticIsoFactory.builder()
                .file("README.TXT", "readme".getBytes())
                .file("DICOM/ST000001/IM0002", "two".getBytes())
                .file("DICOM/ST000001/IM0001", "one".getBytes())
                .file("DICOMDIR", "index".getBytes())
                .write(tempDir.resolve("disc.iso"));

        try (Iso9660ArchiveReader reader = new Iso9660ArchiveReader(iso)) {
            assertFalse(reader.usesJoliet());
            assertEquals(List.of("DICOM/ST000001/IM0001", "DICOM/ST000001/IM0002", "DICOMDIR", "README.TXT"),
                    paths(reader));
        }
    }

    @Test
    void testPayloadAndMetadata() throws IOException {
        byte[] payload = new byte[5000];
        Arrays.fill(payload, (byte) 0x5A);
        payload[4999] = 1;
        Path iso = SyntheticIsoFactory.builder()
                .file("DICOM/IM0001", payload)
                .write(tempDir.resolve("payload.iso"));

        try (Iso9660ArchiveReader reader = new Iso9660ArchiveReader(iso)) {
            ArchiveEntry entry = reader.entries().get(0);

            assertEquals(5000, entry.size());
            assertEquals(FileTime.from(Instant.parse("2024-01-15T10:30:00Z")), entry.lastModified().orElseThrow());
            try (InputStream in = entry.openStream()) {
                assertArrayEquals(payload, in.readAllBytes());
            }
            // Opening again yields the full payload
            try (InputStream in = entry.openStream()) {
                assertEquals(5000, in.readAllBytes().length);
            }
        }
    }

    @Test
    void testRockRidgeNamesPreserveCase() throws IOException {
        Path iso = SyntheticIsoFactory.builder()
                .rockRidge()
                .file("Study/image_0001.dcm", "x".getBytes())
                .write(tempDir.resolve("rr.iso"));

        try (Iso9660ArchiveReader reader = new Iso9660ArchiveReader(iso)) {
            assertEquals(List.of("Study/image_0001.dcm"), paths(reader));
        }
    }

    @Test
    void testJolietTreeUsedWithoutRockRidge() throws IOException {
        Path iso = SyntheticIsoFactory.builder()
                .joliet()
                .file("Patient Images/Scan one.dcm", "x".getBytes())
                .write(tempDir.resolve("joliet.iso"));

        try (Iso9660ArchiveReader reader = new Iso9660ArchiveReader(iso)) {
            assertTrue(reader.usesJoliet());
            assertEquals(List.of("Patient Images/Scan one.dcm"), paths(reader));
        }
    }

    @Test
    void testRockRidgePreferredOverJoliet() throws IOException {
        Path iso = SyntheticIsoFactory.builder()
                .rockRidge()
                .joliet()
                .file("dicom/im1.dcm", "x".getBytes())
                .write(tempDir.resolve("both.iso"));

        try (Iso9660ArchiveReader reader = new Iso9660ArchiveReader(iso)) {
            assertFalse(reader.usesJoliet());
            assertEquals(List.of("dicom/im1.dcm"), paths(reader));
        }
    }

    @Test
    void testEmptyDirectoriesYieldNoEntries() throws IOException {
        Path iso = SyntheticIsoFactory.builder()
                .directory("EMPTY")
                .file("A.DCM", "a".getBytes())
                .write(tempDir.resolve("empty-dir.iso"));

        try (Iso9660ArchiveReader reader = new Iso9660ArchiveReader(iso)) {
            assertEquals(List.of("A.DCM"), paths(reader));
        }
    }

    @Test
    void testEntryPastEndOfImageFailsPerEntry() throws IOException {
        Path iso = SyntheticIsoFactory.builder()
                .file("A.DCM", new byte[3000])
                .write(tempDir.resolve("cut.iso"));
        byte[] bytes = Files.readAllBytes(iso);
        // Drop the second sector of the file extent
        Files.write(iso, Arrays.copyOf(bytes, bytes.length - 2048));

        try (Iso9660ArchiveReader reader = new Iso9660ArchiveReader(iso)) {
            ArchiveEntry entry = reader.entries().get(0);
            ArchiveReadException e = assertThrows(ArchiveReadException.class, entry::openStream);
            assertEquals("A.DCM", e.getEntryPath());
        }
    }

    @Test
    void testLargeEntryIsClassifiedWithoutLoadingIt() throws IOException {
        byte[] slice = SyntheticDicomFactory.ctSlice("Doe^John", 1, "AXIAL", 0.0, 1);
        Path iso = SyntheticIsoFactory.builder()
                .file("BIG.DCM", slice)
                .write(tempDir.resolve("big.iso"));

        // Declare a 3 GiB extent and grow the image sparsely to cover it
        long declared = 3L << 30;
        byte[] bytes = Files.readAllBytes(iso);
        int record = recordOffset(bytes, "BIG.DCM;1");
        ByteBuffer view = ByteBuffer.wrap(bytes);
        long extentPosition = Integer.toUnsignedLong(view.order(ByteOrder.LITTLE_ENDIAN).getInt(record + 2)) * 2048;
        view.order(ByteOrder.LITTLE_ENDIAN).putInt(record + 10, (int) declared);
        view.order(ByteOrder.BIG_ENDIAN).putInt(record + 14, (int) declared);
        Files.write(iso, bytes);
        try (RandomAccessFile file = new RandomAccessFile(iso.toFile(), "rw")) {
            file.setLength(extentPosition + declared);
        }

        try (Iso9660ArchiveReader reader = new Iso9660ArchiveReader(iso)) {
            ArchiveEntry entry = reader.entries().get(0);
            assertEquals(declared, entry.size());

            ClassificationResult result = new DicomRecordClassifier().classify(entry);

            assertEquals(ClassificationResult.Verdict.DICOM_RECORD, result.verdict(), result.reason());
            try (InputStream in = entry.openStream()) {
                assertArrayEquals(Arrays.copyOf(slice, 1024), in.readNBytes(1024));
            }
        }
    }

    @Test
    void testStreamsAreIndependent() throws IOException {
        Path iso = SyntheticIsoFactory.builder()
                .file("A.DCM", "first payload".getBytes())
                .file("B.DCM", "second payload".getBytes())
                .write(tempDir.resolve("two.iso"));

        try (Iso9660ArchiveReader reader = new Iso9660ArchiveReader(iso)) {
            List<ArchiveEntry> entries = reader.entries();
            try (InputStream a = entries.get(0).openStream(); InputStream b = entries.get(1).openStream()) {
                assertEquals("first", new String(a.readNBytes(5)));
                assertEquals("second", new String(b.readNBytes(6)));
                assertEquals(" payload", new String(a.readAllBytes()));
                assertEquals(" payload", new String(b.readAllBytes()));
            }
        }
    }

    @Test
    void testRecordWithOversizedNameIsSkipped() throws IOException {
        Path iso = SyntheticIsoFactory.builder()
                .file("A.DCM", "a".getBytes())
                .file("B.DCM", "b".getBytes())
                .write(tempDir.resolve("bad-name.iso"));
        byte[] bytes = Files.readAllBytes(iso);
        int record = recordOffset(bytes, "B.DCM;1");
        // Name length now points past the record and the extent
        bytes[record + 32] = (byte) 255;
        Files.write(iso, bytes);

        try (Iso9660ArchiveReader reader = new Iso9660ArchiveReader(iso)) {
            assertEquals(List.of("A.DCM"), paths(reader));
        }
    }

    @Test
    void testMissingPrimaryDescriptorRaisesArchiveOpenException() throws IOException {
        Path iso = tempDir.resolve("blank.iso");
        Files.write(iso, new byte[20 * 2048]);

        assertThrows(ArchiveOpenException.class, () -> new Iso9660ArchiveReader(iso));
    }

    @ParameterizedTest
    @CsvSource({
            "IM0001.DCM;1, false, IM0001.DCM",
            "DICOMDIR.;1, false, DICOMDIR",
            "IM0001;1, false, IM0001",
            "NOVERSION, false, NOVERSION",
            "ST000001, true, ST000001"
    })
    void testCleanIdentifier(String identifier, boolean directory, String expected) {
        assertEquals(expected, Iso9660ArchiveReader.cleanIdentifier(identifier, directory));
    }
}
