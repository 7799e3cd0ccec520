package com.largomodo.dicomextract.dicom;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Reader for DICOM Part 10 files.
 * <p>
 * This class handles:
 * <ul>
 *   <li>The 128-byte preamble and "DICM" prefix</li>
 *   <li>File Meta Information (group 0002, always explicit VR little endian)</li>
 *   <li>Dataset bodies in implicit/explicit VR little endian, explicit VR big endian and
 *       deflated explicit VR little endian</li>
 *   <li>Skipping nested sequences of defined or undefined length</li>
 *   <li>Collecting encapsulated pixel data fragments</li>
 * </ul>
 * <p>
 * Only top-level elements are kept. Stateless; each call parses independently.
 */
public class DicomFileReader {

    public static final int PREAMBLE_LENGTH = 128;
    public static final int PREFIX_LENGTH = PREAMBLE_LENGTH + 4;
    private static final byte[] MAGIC = "DICM".getBytes(StandardCharsets.US_ASCII);

    // VRs with a 2-byte reserved field followed by a 4-byte length in explicit VR encodings
    private static final Set<String> LONG_LENGTH_VRS = Set.of(
            "OB", "OD", "OF", "OL", "OV", "OW", "SQ", "SV", "UC", "UN", "UR", "UT", "UV"
    );

    /**
     * True when {@code data} starts with a 128-byte preamble followed by "DICM".
     */
    public static boolean hasPart10Prefix(byte[] data, int length) {
        if (length < PREFIX_LENGTH) {
            return false;
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (data[PREAMBLE_LENGTH + i] != MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Parse a DICOM file from disk.
     *
     * @throws DecodeException if the file is not a well-formed DICOM Part 10 file
     * @throws IOException     if the file cannot be read
     */
    public DicomDataset read(Path file) throws IOException {
        return read(Files.readAllBytes(file));
    }

    /**
     * Parse a complete DICOM Part 10 file held in memory.
     *
     * @throws DecodeException if the bytes are not a well-formed DICOM Part 10 file
     */
    public DicomDataset read(byte[] data) throws DecodeException {
        if (!hasPart10Prefix(data, data.length)) {
            throw new DecodeException("Missing DICM prefix after 128-byte preamble");
        }

        ElementParser metaParser = new ElementParser(ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN), true, false);
        metaParser.buffer.position(PREFIX_LENGTH);
        Map<Integer, DicomElement> elements = new LinkedHashMap<>();
        metaParser.readGroup(0x0002, elements);

        String uid = stringValue(elements.get(DicomTags.TRANSFER_SYNTAX_UID));
        TransferSyntax syntax = TransferSyntax.fromUid(uid);
        if (uid == null) {
            uid = TransferSyntax.IMPLICIT_VR_LITTLE_ENDIAN.getUid();
        }

        ByteBuffer body = ByteBuffer.wrap(data);
        body.position(metaParser.buffer.position());
        if (syntax.isDeflated()) {
            body = ByteBuffer.wrap(inflate(data, body.position()));
        }
        body.order(syntax.getByteOrder());

        ElementParser bodyParser = new ElementParser(body, syntax.isExplicitVr(), false);
        bodyParser.readAll(elements);
        return new DicomDataset(syntax, uid, elements);
    }

    /**
     * Parse only the File Meta Information from a bounded prefix of a file.
     * <p>
     * Tolerates a prefix that ends mid-group: elements that do not fit are ignored.
     *
     * @param prefix leading bytes of the file
     * @param length number of valid bytes in {@code prefix}
     * @return dataset holding the group 0002 elements that fit in the prefix
     * @throws DecodeException if the prefix lacks the DICM marker
     */
    public DicomDataset readFileMetaInformation(byte[] prefix, int length) throws DecodeException {
        if (!hasPart10Prefix(prefix, length)) {
            throw new DecodeException("Missing DICM prefix after 128-byte preamble");
        }
        ByteBuffer buffer = ByteBuffer.wrap(prefix, 0, length).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position(PREFIX_LENGTH);
        ElementParser parser = new ElementParser(buffer, true, true);
        Map<Integer, DicomElement> elements = new LinkedHashMap<>();
        parser.readGroup(0x0002, elements);
        String uid = stringValue(elements.get(DicomTags.TRANSFER_SYNTAX_UID));
        return new DicomDataset(TransferSyntax.fromUid(uid),
                uid == null ? TransferSyntax.IMPLICIT_VR_LITTLE_ENDIAN.getUid() : uid, elements);
    }

    private static byte[] inflate(byte[] data, int offset) throws DecodeException {
        // Deflated transfer syntax uses raw deflate without zlib header
        Inflater inflater = new Inflater(true);
        try (InputStream in = new InflaterInputStream(
                new ByteArrayInputStream(data, offset, data.length - offset), inflater)) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new DecodeException("Corrupt deflated dataset: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
    }

    private static String stringValue(DicomElement element) {
        if (element == null) {
            return null;
        }
        String text = new String(element.value(), StandardCharsets.US_ASCII).replace("\0", "").trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Cursor over one encoded dataset.
     */
    private static final class ElementParser {

        private final ByteBuffer buffer;
        private final boolean lenient;
        private boolean explicitVr;

        ElementParser(ByteBuffer buffer, boolean explicitVr, boolean lenient) {
            this.buffer = buffer;
            this.explicitVr = explicitVr;
            this.lenient = lenient;
        }

        /**
         * Read consecutive elements of one group, stopping before the first element of another.
         */
        void readGroup(int group, Map<Integer, DicomElement> out) throws DecodeException {
            while (buffer.remaining() >= 8) {
                int nextGroup = Short.toUnsignedInt(buffer.getShort(buffer.position()));
                if (nextGroup != group) {
                    return;
                }
                int start = buffer.position();
                try {
                    DicomElement element = readElement();
                    if (element != null) {
                        out.put(element.tag(), element);
                    }
                } catch (DecodeException e) {
                    if (lenient) {
                        buffer.position(start);
                        return;
                    }
                    throw e;
                }
            }
        }

        void readAll(Map<Integer, DicomElement> out) throws DecodeException {
            while (buffer.remaining() >= 8) {
                DicomElement element = readElement();
                if (element != null && DicomTags.group(element.tag()) != 0xFFFE) {
                    out.put(element.tag(), element);
                }
            }
            // Trailing padding shorter than one element header is ignored
        }

        /**
         * @return the element, or null when its content was skipped (sequences)
         */
        private DicomElement readElement() throws DecodeException {
            try {
                int tag = readTag();
                if (DicomTags.group(tag) == 0xFFFE) {
                    long length = Integer.toUnsignedLong(buffer.getInt());
                    if (tag == DicomTags.ITEM && length != DicomTags.UNDEFINED_LENGTH) {
                        skip(length, tag);
                    }
                    return new DicomElement(tag, null, new byte[0], null);
                }

                String vr = null;
                long length;
                if (explicitVr) {
                    vr = new String(new byte[]{buffer.get(), buffer.get()}, StandardCharsets.US_ASCII);
                    if (LONG_LENGTH_VRS.contains(vr)) {
                        buffer.getShort();
                        length = Integer.toUnsignedLong(buffer.getInt());
                    } else {
                        length = Short.toUnsignedInt(buffer.getShort());
                    }
                } else {
                    length = Integer.toUnsignedLong(buffer.getInt());
                }

                if (length == DicomTags.UNDEFINED_LENGTH) {
                    if (tag == DicomTags.PIXEL_DATA) {
                        return new DicomElement(tag, vr, new byte[0], readFragments());
                    }
                    // Undefined-length UN content is always implicit VR little endian
                    boolean previous = explicitVr;
                    if ("UN".equals(vr)) {
                        explicitVr = false;
                    }
                    try {
                        skipSequenceItems();
                    } finally {
                        explicitVr = previous;
                    }
                    return null;
                }

                if ("SQ".equals(vr)) {
                    skip(length, tag);
                    return null;
                }

                if (length > buffer.remaining()) {
                    if (tag == DicomTags.PIXEL_DATA && !lenient) {
                        // Keep what is there; the renderer reports the truncated frame
                        byte[] partial = new byte[buffer.remaining()];
                        buffer.get(partial);
                        return new DicomElement(tag, vr, partial, null);
                    }
                    throw new DecodeException("Element " + DicomTags.toString(tag) + " length " + length
                            + " exceeds remaining " + buffer.remaining() + " bytes");
                }
                byte[] value = new byte[(int) length];
                buffer.get(value);
                return new DicomElement(tag, vr, value, null);
            } catch (BufferUnderflowException e) {
                throw new DecodeException("Unexpected end of data while reading element header", e);
            }
        }

        private int readTag() {
            int group = Short.toUnsignedInt(buffer.getShort());
            int element = Short.toUnsignedInt(buffer.getShort());
            return (group << 16) | element;
        }

        /**
         * Skip items until the Sequence Delimitation Item.
         */
        private void skipSequenceItems() throws DecodeException {
            while (true) {
                requireRemaining(8, DicomTags.SEQUENCE_DELIMITATION);
                int tag = readTag();
                long length = Integer.toUnsignedLong(buffer.getInt());
                if (tag == DicomTags.SEQUENCE_DELIMITATION) {
                    return;
                }
                if (tag != DicomTags.ITEM) {
                    throw new DecodeException("Expected item tag in sequence, found " + DicomTags.toString(tag));
                }
                if (length == DicomTags.UNDEFINED_LENGTH) {
                    skipItemDataset();
                } else {
                    skip(length, tag);
                }
            }
        }

        /**
         * Skip the elements of an undefined-length item until the Item Delimitation Item.
         */
        private void skipItemDataset() throws DecodeException {
            while (true) {
                requireRemaining(8, DicomTags.ITEM_DELIMITATION);
                DicomElement element = readElement();
                if (element != null && element.tag() == DicomTags.ITEM_DELIMITATION) {
                    return;
                }
            }
        }

        /**
         * Encapsulated pixel data: Basic Offset Table item, fragment items, sequence delimiter.
         */
        private List<byte[]> readFragments() throws DecodeException {
            List<byte[]> fragments = new ArrayList<>();
            boolean offsetTable = true;
            while (true) {
                requireRemaining(8, DicomTags.SEQUENCE_DELIMITATION);
                int tag = readTag();
                long length = Integer.toUnsignedLong(buffer.getInt());
                if (tag == DicomTags.SEQUENCE_DELIMITATION) {
                    return fragments;
                }
                if (tag != DicomTags.ITEM || length == DicomTags.UNDEFINED_LENGTH) {
                    throw new DecodeException("Malformed encapsulated pixel data at " + DicomTags.toString(tag));
                }
                requireRemaining(length, tag);
                byte[] fragment = new byte[(int) length];
                buffer.get(fragment);
                if (offsetTable) {
                    offsetTable = false;
                } else {
                    fragments.add(fragment);
                }
            }
        }

        private void skip(long length, int tag) throws DecodeException {
            requireRemaining(length, tag);
            buffer.position(buffer.position() + (int) length);
        }

        private void requireRemaining(long length, int tag) throws DecodeException {
            if (length > buffer.remaining()) {
                throw new DecodeException("Truncated data while reading " + DicomTags.toString(tag));
            }
        }
    }
}
