package com.largomodo.dicomextract.archive;

import org.apache.commons.compress.utils.BoundedSeekableByteChannelInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Native reader for ISO 9660 CD/DVD images.
 * <p>
 * This class walks the on-disc structures directly:
 * <ul>
 *   <li>Volume descriptor set starting at sector 16 (first session only, so hybrid and
 *       multi-session discs read like their first session)</li>
 *   <li>Primary volume directory tree, or the Joliet tree when the image has one and the
 *       primary tree carries no Rock Ridge names</li>
 *   <li>Rock Ridge {@code NM} alternate names in the System Use area of directory records</li>
 * </ul>
 * <p>
 * Entries are yielded depth first with children sorted by name. Payload streams read their
 * extent by position from a shared {@link FileChannel}, so entries can be opened in any order
 * and a reader that stops early (e.g. classification) never loads the rest of the file.
 */
public class Iso9660ArchiveReader implements ArchiveReader {

    private static final Logger log = LoggerFactory.getLogger(Iso9660ArchiveReader.class);

    static final int SECTOR_SIZE = 2048;
    private static final int FIRST_DESCRIPTOR_SECTOR = 16;
    // Guards against images without a set terminator
    private static final int MAX_DESCRIPTORS = 64;
    private static final int MAX_DEPTH = 64;

    private static final int TYPE_PRIMARY = 1;
    private static final int TYPE_SUPPLEMENTARY = 2;
    private static final int TYPE_TERMINATOR = 255;

    // Volume descriptor field offsets
    private static final int VD_ESCAPE_SEQUENCES = 88;
    private static final int VD_LOGICAL_BLOCK_SIZE = 128;
    private static final int VD_ROOT_RECORD = 156;

    // Directory record field offsets
    private static final int DR_EXTENT = 2;
    private static final int DR_DATA_LENGTH = 10;
    private static final int DR_RECORDING_DATE = 18;
    private static final int DR_FLAGS = 25;
    private static final int DR_NAME_LENGTH = 32;
    private static final int DR_NAME = 33;

    private static final int FLAG_DIRECTORY = 0x02;
    private static final int FLAG_ASSOCIATED = 0x04;

    private static final int NM_CONTINUE = 0x01;
    private static final int NM_CURRENT = 0x02;
    private static final int NM_PARENT = 0x04;

    private final Path path;
    private final FileChannel channel;
    private final int blockSize;
    private final DirectoryRecord root;
    private final boolean joliet;

    /**
     * Open an ISO 9660 image and locate the directory tree to walk.
     *
     * @param path image file
     * @throws ArchiveOpenException if no valid primary volume descriptor is found
     */
    public Iso9660ArchiveReader(Path path) throws ArchiveOpenException {
        this.path = path;
        try {
            this.channel = FileChannel.open(path, StandardOpenOption.READ);
        } catch (IOException e) {
            throw new ArchiveOpenException(path, "Cannot open ISO image", e);
        }

        try {
            ByteBuffer primary = null;
            ByteBuffer jolietDescriptor = null;

            for (int i = 0; i < MAX_DESCRIPTORS; i++) {
                long position = (long) (FIRST_DESCRIPTOR_SECTOR + i) * SECTOR_SIZE;
                ByteBuffer descriptor = read(position, SECTOR_SIZE);
                if (descriptor.remaining() < SECTOR_SIZE || !hasStandardIdentifier(descriptor)) {
                    break;
                }
                int type = Byte.toUnsignedInt(descriptor.get(0));
                if (type == TYPE_PRIMARY && primary == null) {
                    primary = descriptor;
                } else if (type == TYPE_SUPPLEMENTARY && jolietDescriptor == null && isJoliet(descriptor)) {
                    jolietDescriptor = descriptor;
                } else if (type == TYPE_TERMINATOR) {
                    break;
                }
            }

            if (primary == null) {
                throw new ArchiveOpenException(path, "No ISO 9660 primary volume descriptor");
            }

            int declaredBlockSize = Short.toUnsignedInt(primary.getShort(VD_LOGICAL_BLOCK_SIZE));
            this.blockSize = declaredBlockSize == 0 ? SECTOR_SIZE : declaredBlockSize;

            DirectoryRecord primaryRoot = parseRootRecord(primary, false);
            if (primaryRoot == null || !primaryRoot.directory()) {
                throw new ArchiveOpenException(path, "Corrupt root directory record");
            }

            if (jolietDescriptor != null && !hasRockRidge(primaryRoot)) {
                DirectoryRecord jolietRoot = parseRootRecord(jolietDescriptor, true);
                if (jolietRoot != null && jolietRoot.directory()) {
                    log.debug("Using Joliet directory tree for {}", path.getFileName());
                    this.root = jolietRoot;
                    this.joliet = true;
                    return;
                }
            }
            this.root = primaryRoot;
            this.joliet = false;
        } catch (ArchiveOpenException e) {
            closeQuietly(e);
            throw e;
        } catch (IOException | RuntimeException e) {
            ArchiveOpenException openException = new ArchiveOpenException(path, "Cannot parse ISO 9660 volume descriptors", e);
            closeQuietly(openException);
            throw openException;
        }
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public ArchiveKind kind() {
        return ArchiveKind.ISO;
    }

    /**
     * @return true when names come from the Joliet supplementary tree
     */
    public boolean usesJoliet() {
        return joliet;
    }

    @Override
    public List<ArchiveEntry> entries() throws IOException {
        List<ArchiveEntry> result = new ArrayList<>();
        walk(root, "", result, new HashSet<>(), 0);
        return result;
    }

    private void walk(DirectoryRecord dir, String prefix, List<ArchiveEntry> out,
                      Set<Long> visited, int depth) throws IOException {
        if (!visited.add(dir.extent())) {
            log.warn("Directory loop detected at '{}' in {}, skipping", prefix, path.getFileName());
            return;
        }
        if (depth > MAX_DEPTH) {
            log.warn("Directory nesting deeper than {} at '{}' in {}, skipping", MAX_DEPTH, prefix, path.getFileName());
            return;
        }

        List<DirectoryRecord> children;
        try {
            children = readDirectory(dir);
        } catch (ArchiveReadException e) {
            if (depth == 0) {
                throw e;
            }
            log.warn("Unreadable directory '{}' in {}: {}", prefix, path.getFileName(), e.getMessage());
            return;
        }
        children.sort(Comparator.comparing(DirectoryRecord::name));

        for (DirectoryRecord child : children) {
            String childPath = prefix.isEmpty() ? child.name() : prefix + "/" + child.name();
            if (child.directory()) {
                walk(child, childPath, out, visited, depth + 1);
            } else {
                out.add(toEntry(child, childPath));
            }
        }
    }

    private ArchiveEntry toEntry(DirectoryRecord record, String entryPath) {
        long position = record.extent() * blockSize;
        long length = record.length();
        return new ArchiveEntry(entryPath, length, record.modified(), () -> {
            if (position + length > channel.size()) {
                throw new ArchiveReadException(entryPath, "Entry extends past end of image");
            }
            // Reads the extent in place; nothing beyond what the caller consumes is loaded
            return new BoundedSeekableByteChannelInputStream(position, length, channel);
        });
    }

    /**
     * Parse all records of a directory extent, excluding '.', '..' and associated files.
     * Records never straddle a logical block: a zero length byte means "skip to next block".
     */
    private List<DirectoryRecord> readDirectory(DirectoryRecord dir) throws IOException {
        if (dir.length() > Integer.MAX_VALUE) {
            throw new ArchiveReadException(dir.name(), "Directory extent too large");
        }
        int length = (int) dir.length();
        ByteBuffer data = read(dir.extent() * blockSize, length);
        if (data.remaining() < length) {
            throw new ArchiveReadException(dir.name(), "Directory extends past end of image");
        }

        List<DirectoryRecord> records = new ArrayList<>();
        int offset = 0;
        while (offset < length) {
            int recordLength = Byte.toUnsignedInt(data.get(offset));
            if (recordLength == 0) {
                offset = ((offset / blockSize) + 1) * blockSize;
                continue;
            }
            if (offset + recordLength > length || recordLength < DR_NAME + 1) {
                log.warn("Truncated directory record in '{}' of {}", dir.name(), path.getFileName());
                break;
            }
            DirectoryRecord record = parseRecord(data, offset, joliet);
            if (record != null && (record.flags() & FLAG_ASSOCIATED) == 0) {
                records.add(record);
            }
            offset += recordLength;
        }
        return records;
    }

    /**
     * Parse one directory record.
     *
     * @return the record, or null for the '.' and '..' self/parent records and for records
     *         whose name does not fit inside them
     */
    private DirectoryRecord parseRecord(ByteBuffer buffer, int offset, boolean ucs2Names) {
        int recordLength = Byte.toUnsignedInt(buffer.get(offset));
        int nameLength = Byte.toUnsignedInt(buffer.get(offset + DR_NAME_LENGTH));
        long extent = Integer.toUnsignedLong(buffer.getInt(offset + DR_EXTENT));
        long length = Integer.toUnsignedLong(buffer.getInt(offset + DR_DATA_LENGTH));
        int flags = Byte.toUnsignedInt(buffer.get(offset + DR_FLAGS));
        boolean directory = (flags & FLAG_DIRECTORY) != 0;
        Optional<FileTime> modified = parseRecordingDate(buffer, offset + DR_RECORDING_DATE);

        if (nameLength == 1) {
            byte special = buffer.get(offset + DR_NAME);
            if (special == 0x00 || special == 0x01) {
                return null;
            }
        }

        if (DR_NAME + nameLength > recordLength) {
            log.warn("Directory record name runs past its record (length {}, name length {}) in {}, skipping",
                    recordLength, nameLength, path.getFileName());
            return null;
        }

        byte[] rawName = new byte[nameLength];
        buffer.get(offset + DR_NAME, rawName);

        String name = null;
        if (!ucs2Names) {
            int systemUseStart = DR_NAME + nameLength + (nameLength % 2 == 0 ? 1 : 0);
            name = rockRidgeName(buffer, offset + systemUseStart, offset + recordLength);
        }
        if (name == null) {
            String identifier = new String(rawName, ucs2Names ? StandardCharsets.UTF_16BE : StandardCharsets.ISO_8859_1);
            name = cleanIdentifier(identifier, directory);
        }
        return new DirectoryRecord(name, extent, length, flags, directory, modified);
    }

    /**
     * The root record embedded in a volume descriptor is itself a '.' record.
     */
    private DirectoryRecord parseRootRecord(ByteBuffer descriptor, boolean ucs2Names) {
        long extent = Integer.toUnsignedLong(descriptor.getInt(VD_ROOT_RECORD + DR_EXTENT));
        long length = Integer.toUnsignedLong(descriptor.getInt(VD_ROOT_RECORD + DR_DATA_LENGTH));
        int flags = Byte.toUnsignedInt(descriptor.get(VD_ROOT_RECORD + DR_FLAGS));
        if ((flags & FLAG_DIRECTORY) == 0 || length == 0) {
            return null;
        }
        return new DirectoryRecord("", extent, length, flags, true,
                parseRecordingDate(descriptor, VD_ROOT_RECORD + DR_RECORDING_DATE));
    }

    /**
     * Strip the ";1" version suffix and the trailing dot of extension-less file identifiers.
     */
    static String cleanIdentifier(String identifier, boolean directory) {
        String name = identifier;
        if (!directory) {
            int semicolon = name.indexOf(';');
            if (semicolon >= 0) {
                name = name.substring(0, semicolon);
            }
            if (name.endsWith(".") && name.length() > 1) {
                name = name.substring(0, name.length() - 1);
            }
        }
        return name;
    }

    /**
     * Extract the Rock Ridge alternate name (NM entries) from a System Use area.
     *
     * @return the name, or null when no NM entry is present
     */
    private String rockRidgeName(ByteBuffer buffer, int start, int end) {
        StringBuilder name = null;
        int offset = start;
        while (offset + 4 <= end) {
            char sig1 = (char) buffer.get(offset);
            char sig2 = (char) buffer.get(offset + 1);
            int entryLength = Byte.toUnsignedInt(buffer.get(offset + 2));
            if (entryLength < 4 || offset + entryLength > end) {
                break;
            }
            if (sig1 == 'N' && sig2 == 'M' && entryLength >= 5) {
                int nmFlags = Byte.toUnsignedInt(buffer.get(offset + 4));
                if ((nmFlags & (NM_CURRENT | NM_PARENT)) == 0) {
                    byte[] part = new byte[entryLength - 5];
                    buffer.get(offset + 5, part);
                    if (name == null) {
                        name = new StringBuilder();
                    }
                    name.append(new String(part, StandardCharsets.UTF_8));
                    if ((nmFlags & NM_CONTINUE) == 0) {
                        break;
                    }
                }
            }
            offset += entryLength;
        }
        return name == null || name.length() == 0 ? null : name.toString();
    }

    /**
     * Rock Ridge is present when the root '.' record (or any child) carries SUSP entries.
     */
    private boolean hasRockRidge(DirectoryRecord primaryRoot) {
        try {
            int length = (int) Math.min(primaryRoot.length(), blockSize);
            ByteBuffer data = read(primaryRoot.extent() * blockSize, length);
            int offset = 0;
            while (offset < data.remaining()) {
                int recordLength = Byte.toUnsignedInt(data.get(offset));
                if (recordLength == 0 || offset + recordLength > data.remaining()) {
                    break;
                }
                int nameLength = Byte.toUnsignedInt(data.get(offset + DR_NAME_LENGTH));
                int systemUse = offset + DR_NAME + nameLength + (nameLength % 2 == 0 ? 1 : 0);
                for (int i = systemUse; i + 2 <= offset + recordLength; i++) {
                    char a = (char) data.get(i);
                    char b = (char) data.get(i + 1);
                    if ((a == 'S' && b == 'P') || (a == 'R' && b == 'R') || (a == 'N' && b == 'M')) {
                        return true;
                    }
                }
                offset += recordLength;
            }
        } catch (IOException | RuntimeException e) {
            log.debug("Rock Ridge probe failed for {}: {}", path.getFileName(), e.getMessage());
        }
        return false;
    }

    /**
     * 7-byte recording date: years since 1900, month, day, hour, minute, second,
     * GMT offset in 15 minute units (signed).
     */
    private static Optional<FileTime> parseRecordingDate(ByteBuffer buffer, int offset) {
        int year = Byte.toUnsignedInt(buffer.get(offset));
        int month = Byte.toUnsignedInt(buffer.get(offset + 1));
        int day = Byte.toUnsignedInt(buffer.get(offset + 2));
        int hour = Byte.toUnsignedInt(buffer.get(offset + 3));
        int minute = Byte.toUnsignedInt(buffer.get(offset + 4));
        int second = Byte.toUnsignedInt(buffer.get(offset + 5));
        int gmtOffset = buffer.get(offset + 6);
        if (month == 0 || day == 0) {
            return Optional.empty();
        }
        try {
            LocalDateTime local = LocalDateTime.of(1900 + year, month, day, hour, minute, second);
            ZoneOffset zone = ZoneOffset.ofTotalSeconds(gmtOffset * 15 * 60);
            return Optional.of(FileTime.from(local.toInstant(zone)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static boolean hasStandardIdentifier(ByteBuffer descriptor) {
        return descriptor.get(1) == 'C' && descriptor.get(2) == 'D' && descriptor.get(3) == '0'
                && descriptor.get(4) == '0' && descriptor.get(5) == '1';
    }

    /**
     * Joliet escape sequences: %/@ (level 1), %/C (level 2), %/E (level 3).
     */
    private static boolean isJoliet(ByteBuffer descriptor) {
        if (descriptor.get(VD_ESCAPE_SEQUENCES) != '%' || descriptor.get(VD_ESCAPE_SEQUENCES + 1) != '/') {
            return false;
        }
        byte level = descriptor.get(VD_ESCAPE_SEQUENCES + 2);
        return level == '@' || level == 'C' || level == 'E';
    }

    /**
     * Positional read; the returned buffer is little-endian and may hold fewer bytes than
     * requested at end of file (check {@link ByteBuffer#remaining()}).
     */
    private ByteBuffer read(long position, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer, position + buffer.position());
            if (n == -1) break;
        }
        buffer.flip();
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        return buffer;
    }

    private void closeQuietly(Exception primary) {
        try {
            channel.close();
        } catch (IOException closeEx) {
            primary.addSuppressed(closeEx);
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    private record DirectoryRecord(String name, long extent, long length, int flags,
                                   boolean directory, Optional<FileTime> modified) {
    }
}
