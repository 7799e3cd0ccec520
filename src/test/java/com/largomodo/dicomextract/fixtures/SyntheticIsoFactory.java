package com.largomodo.dicomextract.fixtures;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds small ISO 9660 images for reader tests.
 * <p>
 * Layout: system area (sectors 0-15), primary volume descriptor, optional Joliet
 * supplementary descriptor, set terminator, one sector per directory, then file extents.
 * Primary identifiers are upper-cased with a ";1" version; Rock Ridge NM entries keep the
 * original names when enabled.
 */
public class SyntheticIsoFactory {

    private static final int SECTOR = 2048;
    // 2024-01-15 10:30:00 GMT
    private static final byte[] RECORDING_DATE = {124, 1, 15, 10, 30, 0, 0};

    private final Dir root = new Dir("");
    private boolean rockRidge;
    private boolean joliet;

    public static SyntheticIsoFactory builder() {
        return new SyntheticIsoFactory();
    }

    /**
     * Add a file; intermediate directories are created from the '/' separated path.
     */
    public SyntheticIsoFactory file(String path, byte[] content) {
        String[] parts = path.split("/");
        Dir dir = root;
        for (int i = 0; i < parts.length - 1; i++) {
            dir = dir.dirs.computeIfAbsent(parts[i], Dir::new);
        }
        dir.files.put(parts[parts.length - 1], content);
        return this;
    }

    public SyntheticIsoFactory directory(String path) {
        Dir dir = root;
        for (String part : path.split("/")) {
            dir = dir.dirs.computeIfAbsent(part, Dir::new);
        }
        return this;
    }

    public SyntheticIsoFactory rockRidge() {
        this.rockRidge = true;
        return this;
    }

    public SyntheticIsoFactory joliet() {
        this.joliet = true;
        return this;
    }

    public Path write(Path target) throws IOException {
        Files.write(target, build());
        return target;
    }

    public byte[] build() {
        int sector = 16;
        int primarySector = sector++;
        int jolietSector = joliet ? sector++ : -1;
        int terminatorSector = sector++;

        // Directory extents: primary tree, then Joliet tree
        Map<Dir, Integer> primaryExtents = new IdentityHashMap<>();
        Map<Dir, Integer> jolietExtents = new IdentityHashMap<>();
        List<Dir> dirs = new ArrayList<>();
        collect(root, dirs);
        for (Dir dir : dirs) {
            primaryExtents.put(dir, sector++);
        }
        if (joliet) {
            for (Dir dir : dirs) {
                jolietExtents.put(dir, sector++);
            }
        }

        // File extents shared by both trees
        Map<byte[], Integer> fileExtents = new IdentityHashMap<>();
        for (Dir dir : dirs) {
            for (byte[] content : dir.files.values()) {
                fileExtents.put(content, sector);
                sector += Math.max(1, (content.length + SECTOR - 1) / SECTOR);
            }
        }

        ByteBuffer image = ByteBuffer.allocate(sector * SECTOR).order(ByteOrder.LITTLE_ENDIAN);
        writeDescriptor(image, primarySector, 1, sector, primaryExtents.get(root), false);
        if (joliet) {
            writeDescriptor(image, jolietSector, 2, sector, jolietExtents.get(root), true);
        }
        image.put(terminatorSector * SECTOR, (byte) 255);
        putAscii(image, terminatorSector * SECTOR + 1, "CD001");
        image.put(terminatorSector * SECTOR + 6, (byte) 1);

        writeTree(image, root, root, primaryExtents, fileExtents, false);
        if (joliet) {
            writeTree(image, root, root, jolietExtents, fileExtents, true);
        }
        for (Dir dir : dirs) {
            for (byte[] content : dir.files.values()) {
                image.put(fileExtents.get(content) * SECTOR, content);
            }
        }
        return image.array();
    }

    private void collect(Dir dir, List<Dir> out) {
        out.add(dir);
        for (Dir child : dir.dirs.values()) {
            collect(child, out);
        }
    }

    private void writeDescriptor(ByteBuffer image, int sector, int type, int volumeBlocks, int rootExtent,
                                 boolean jolietDescriptor) {
        int base = sector * SECTOR;
        image.put(base, (byte) type);
        putAscii(image, base + 1, "CD001");
        image.put(base + 6, (byte) 1);
        putAscii(image, base + 40, "SYNTHETIC");
        putBothEndian32(image, base + 80, volumeBlocks);
        putBothEndian16(image, base + 120, 1);
        putBothEndian16(image, base + 124, 1);
        putBothEndian16(image, base + 128, SECTOR);
        if (jolietDescriptor) {
            putAscii(image, base + 88, "%/E");
        }
        byte[] rootRecord = record(new byte[]{0}, rootExtent, SECTOR, true, new byte[0]);
        image.put(base + 156, rootRecord);
        image.put(base + 881, (byte) 1);
    }

    private void writeTree(ByteBuffer image, Dir dir, Dir parent, Map<Dir, Integer> extents,
                           Map<byte[], Integer> fileExtents, boolean ucs2) {
        ByteBuffer sector = ByteBuffer.allocate(SECTOR);

        byte[] selfSystemUse = rockRidge && !ucs2 && dir == root ? sharingProtocol() : new byte[0];
        sector.put(record(new byte[]{0}, extents.get(dir), SECTOR, true, selfSystemUse));
        sector.put(record(new byte[]{1}, extents.get(parent), SECTOR, true, new byte[0]));

        // ISO 9660 orders records by identifier; the reader sorts anyway
        Map<String, Object> children = new TreeMap<>();
        dir.dirs.forEach(children::put);
        dir.files.forEach(children::put);
        for (Map.Entry<String, Object> child : children.entrySet()) {
            String name = child.getKey();
            boolean isDir = child.getValue() instanceof Dir;
            byte[] identifier = identifier(name, isDir, ucs2);
            byte[] systemUse = rockRidge && !ucs2 ? alternateName(name) : new byte[0];
            byte[] record = isDir
                    ? record(identifier, extents.get((Dir) child.getValue()), SECTOR, true, systemUse)
                    : record(identifier, fileExtents.get((byte[]) child.getValue()),
                    ((byte[]) child.getValue()).length, false, systemUse);
            if (sector.remaining() < record.length) {
                throw new IllegalStateException("Directory '" + dir.name + "' does not fit in one sector");
            }
            sector.put(record);
        }
        image.put(extents.get(dir) * SECTOR, sector.array());

        for (Dir child : dir.dirs.values()) {
            writeTree(image, child, dir, extents, fileExtents, ucs2);
        }
    }

    private static byte[] identifier(String name, boolean directory, boolean ucs2) {
        if (ucs2) {
            return (directory ? name : name + ";1").getBytes(StandardCharsets.UTF_16BE);
        }
        String upper = name.toUpperCase(Locale.ROOT);
        if (directory) {
            return upper.getBytes(StandardCharsets.ISO_8859_1);
        }
        // Extension-less files get a trailing dot, as mastering tools write them
        return ((upper.contains(".") ? upper : upper + ".") + ";1").getBytes(StandardCharsets.ISO_8859_1);
    }

    static byte[] record(byte[] identifier, int extent, int length, boolean directory, byte[] systemUse) {
        int padding = identifier.length % 2 == 0 ? 1 : 0;
        int recordLength = 33 + identifier.length + padding + systemUse.length;
        if (recordLength % 2 != 0) {
            recordLength++;
        }
        ByteBuffer record = ByteBuffer.allocate(recordLength).order(ByteOrder.LITTLE_ENDIAN);
        record.put(0, (byte) recordLength);
        putBothEndian32(record, 2, extent);
        putBothEndian32(record, 10, length);
        record.put(18, RECORDING_DATE);
        record.put(25, (byte) (directory ? 0x02 : 0x00));
        putBothEndian16(record, 28, 1);
        record.put(32, (byte) identifier.length);
        record.put(33, identifier);
        record.put(33 + identifier.length + padding, systemUse);
        return record.array();
    }

    private static byte[] sharingProtocol() {
        return new byte[]{'S', 'P', 7, 1, (byte) 0xBE, (byte) 0xEF, 0};
    }

    private static byte[] alternateName(String name) {
        byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
        byte[] entry = new byte[5 + bytes.length];
        entry[0] = 'N';
        entry[1] = 'M';
        entry[2] = (byte) entry.length;
        entry[3] = 1;
        entry[4] = 0;
        System.arraycopy(bytes, 0, entry, 5, bytes.length);
        return entry;
    }

    private static void putAscii(ByteBuffer buffer, int offset, String text) {
        buffer.put(offset, text.getBytes(StandardCharsets.US_ASCII));
    }

    private static void putBothEndian16(ByteBuffer buffer, int offset, int value) {
        buffer.put(offset, (byte) value);
        buffer.put(offset + 1, (byte) (value >>> 8));
        buffer.put(offset + 2, (byte) (value >>> 8));
        buffer.put(offset + 3, (byte) value);
    }

    private static void putBothEndian32(ByteBuffer buffer, int offset, int value) {
        buffer.putInt(offset, value);
        buffer.put(offset + 4, (byte) (value >>> 24));
        buffer.put(offset + 5, (byte) (value >>> 16));
        buffer.put(offset + 6, (byte) (value >>> 8));
        buffer.put(offset + 7, (byte) value);
    }

    private static final class Dir {
        final String name;
        final Map<String, Dir> dirs = new TreeMap<>();
        final Map<String, byte[]> files = new TreeMap<>();

        Dir(String name) {
            this.name = name;
        }
    }
}
