package com.largomodo.dicomextract.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Opens the right {@link ArchiveReader} for a container path.
 * <p>
 * Detection: the file extension proposes a kind, magic bytes confirm it. When the extension
 * is unknown or contradicts the content, the content wins. Content matching no supported
 * format is an {@link ArchiveOpenException}.
 * <p>
 * Stateless utility. Safe for concurrent use.
 */
public class ArchiveReaders {

    private static final Logger log = LoggerFactory.getLogger(ArchiveReaders.class);

    // ISO 9660: volume descriptors start at sector 16 (16 * 2048), identifier follows the type byte
    static final int ISO_DESCRIPTOR_OFFSET = 16 * 2048;
    private static final byte[] ISO_STANDARD_ID = "CD001".getBytes(StandardCharsets.US_ASCII);

    private static final byte[] ZIP_LOCAL_HEADER = {'P', 'K', 3, 4};
    private static final byte[] ZIP_EMPTY_ARCHIVE = {'P', 'K', 5, 6};

    private ArchiveReaders() {
        // Static utility class - prevent instantiation
    }

    /**
     * Detect the container kind and open a reader for it.
     *
     * @param archive container path
     * @return open reader, caller closes it
     * @throws ArchiveOpenException if the file is missing or matches no supported format
     */
    public static ArchiveReader open(Path archive) throws ArchiveOpenException {
        ArchiveKind kind = detect(archive);
        log.debug("Opening {} as {}", archive, kind);
        return switch (kind) {
            case ZIP -> new ZipArchiveReader(archive);
            case ISO -> new Iso9660ArchiveReader(archive);
        };
    }

    /**
     * Determine the container kind from extension and magic bytes.
     *
     * @param archive container path
     * @return detected kind
     * @throws ArchiveOpenException if the file is unreadable or matches no supported format
     */
    public static ArchiveKind detect(Path archive) throws ArchiveOpenException {
        if (!Files.isRegularFile(archive)) {
            throw new ArchiveOpenException(archive, "Archive is not a regular file");
        }

        Optional<ArchiveKind> declared = ArchiveKind.fromFileName(archive.getFileName().toString());
        try {
            if (declared.isPresent() && matches(archive, declared.get())) {
                return declared.get();
            }
            for (ArchiveKind candidate : ArchiveKind.values()) {
                if (matches(archive, candidate)) {
                    if (declared.isPresent()) {
                        log.warn("{} has a .{} extension but contains a {} archive",
                                archive.getFileName(), declared.get().getExtension(), candidate);
                    }
                    return candidate;
                }
            }
        } catch (IOException e) {
            throw new ArchiveOpenException(archive, "Cannot read archive header", e);
        }
        throw new ArchiveOpenException(archive, "Not a ZIP or ISO 9660 archive");
    }

    private static boolean matches(Path archive, ArchiveKind kind) throws IOException {
        return switch (kind) {
            case ZIP -> {
                byte[] head = readAt(archive, 0, 4);
                yield startsWith(head, ZIP_LOCAL_HEADER) || startsWith(head, ZIP_EMPTY_ARCHIVE);
            }
            case ISO -> startsWith(readAt(archive, ISO_DESCRIPTOR_OFFSET + 1, ISO_STANDARD_ID.length), ISO_STANDARD_ID);
        };
    }

    /**
     * Read up to {@code length} bytes at {@code offset}; shorter (or empty) past end of file.
     */
    private static byte[] readAt(Path file, long offset, int length) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            if (channel.size() <= offset) {
                return new byte[0];
            }
            ByteBuffer buffer = ByteBuffer.allocate(length);
            channel.position(offset);
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) == -1) break;
            }
            byte[] result = new byte[buffer.position()];
            buffer.flip();
            buffer.get(result);
            return result;
        }
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
