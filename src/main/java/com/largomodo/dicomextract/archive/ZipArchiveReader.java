package com.largomodo.dicomextract.archive;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Optional;

/**
 * ZIP container backed by Commons Compress {@link ZipFile}.
 * <p>
 * Entries are listed from the central directory (archive-native order) and decompressed on
 * demand through random access, so classification and extraction can each open an entry
 * independently. Directory entries are skipped.
 */
public class ZipArchiveReader implements ArchiveReader {

    private final Path path;
    private final ZipFile zipFile;

    /**
     * Open a ZIP container.
     *
     * @param path ZIP file
     * @throws ArchiveOpenException if the central directory cannot be parsed
     */
    public ZipArchiveReader(Path path) throws ArchiveOpenException {
        this.path = path;
        try {
            this.zipFile = ZipFile.builder().setPath(path).get();
        } catch (IOException e) {
            throw new ArchiveOpenException(path, "Cannot open ZIP archive", e);
        }
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public ArchiveKind kind() {
        return ArchiveKind.ZIP;
    }

    @Override
    public List<ArchiveEntry> entries() {
        List<ArchiveEntry> result = new ArrayList<>();
        Enumeration<ZipArchiveEntry> zipEntries = zipFile.getEntries();
        while (zipEntries.hasMoreElements()) {
            ZipArchiveEntry zipEntry = zipEntries.nextElement();
            if (zipEntry.isDirectory()) {
                continue;
            }
            String name = normalize(zipEntry.getName());
            if (name.isEmpty()) {
                continue;
            }
            Optional<FileTime> modified = zipEntry.getTime() >= 0
                    ? Optional.of(zipEntry.getLastModifiedTime())
                    : Optional.empty();
            result.add(new ArchiveEntry(name, zipEntry.getSize(), modified, () -> {
                if (!zipFile.canReadEntryData(zipEntry)) {
                    throw new ArchiveReadException(name, "Unsupported compression method or encryption");
                }
                return zipFile.getInputStream(zipEntry);
            }));
        }
        return result;
    }

    /**
     * Windows-built archives occasionally use backslashes; strip leading separators too.
     */
    private static String normalize(String name) {
        String normalized = name.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }

    @Override
    public void close() throws IOException {
        zipFile.close();
    }
}
