package com.largomodo.dicomextract.dicom;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Top-level elements of a parsed DICOM file with typed, absence-aware accessors.
 * <p>
 * Accessors never return null: a missing, empty or unparsable value is an empty Optional.
 * Text values are decoded with the Specific Character Set of the dataset (defaulting to
 * ISO-8859-1, a superset of the DICOM default repertoire).
 */
public class DicomDataset {

    private static final Map<String, Charset> CHARACTER_SETS = Map.of(
            "ISO_IR 100", StandardCharsets.ISO_8859_1,
            "ISO_IR 192", StandardCharsets.UTF_8,
            "ISO_IR 6", StandardCharsets.US_ASCII
    );

    private final TransferSyntax transferSyntax;
    private final String transferSyntaxUid;
    private final Map<Integer, DicomElement> elements;
    private final Charset charset;

    public DicomDataset(TransferSyntax transferSyntax, String transferSyntaxUid, Map<Integer, DicomElement> elements) {
        this.transferSyntax = transferSyntax;
        this.transferSyntaxUid = transferSyntaxUid;
        this.elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
        this.charset = resolveCharset();
    }

    public TransferSyntax transferSyntax() {
        return transferSyntax;
    }

    /**
     * @return the Transfer Syntax UID as declared in the file meta information, or the
     * implicit VR little endian UID when none was declared
     */
    public String transferSyntaxUid() {
        return transferSyntaxUid;
    }

    public boolean contains(int tag) {
        return elements.containsKey(tag);
    }

    public Optional<DicomElement> get(int tag) {
        return Optional.ofNullable(elements.get(tag));
    }

    public int size() {
        return elements.size();
    }

    public boolean hasPixelData() {
        DicomElement pixels = elements.get(DicomTags.PIXEL_DATA);
        return pixels != null && (pixels.value().length > 0 || pixels.isEncapsulated());
    }

    /**
     * Text value with trailing padding (space, NUL) and leading spaces removed.
     */
    public Optional<String> getString(int tag) {
        DicomElement element = elements.get(tag);
        if (element == null || element.value().length == 0) {
            return Optional.empty();
        }
        Charset decode = DicomTags.group(tag) == 0x0002 ? StandardCharsets.US_ASCII : charset;
        String text = stripPadding(new String(element.value(), decode));
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /**
     * First value of an Integer String (IS) element.
     */
    public OptionalInt getInt(int tag) {
        Optional<String> text = getString(tag).map(DicomDataset::firstValue);
        if (text.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(text.get()));
        } catch (NumberFormatException e) {
            // Some modalities write "12.0" into IS elements
            OptionalDouble asDouble = parseDouble(text.get());
            if (asDouble.isPresent() && asDouble.getAsDouble() == Math.rint(asDouble.getAsDouble())) {
                return OptionalInt.of((int) asDouble.getAsDouble());
            }
            return OptionalInt.empty();
        }
    }

    /**
     * First value of a Decimal String (DS) element.
     */
    public OptionalDouble getDouble(int tag) {
        Optional<String> text = getString(tag).map(DicomDataset::firstValue);
        return text.isEmpty() ? OptionalDouble.empty() : parseDouble(text.get());
    }

    /**
     * Binary Unsigned Short (US) element in the dataset byte order.
     */
    public OptionalInt getUnsignedShort(int tag) {
        DicomElement element = elements.get(tag);
        if (element == null || element.value().length < 2) {
            return OptionalInt.empty();
        }
        ByteOrder order = DicomTags.group(tag) == 0x0002 ? ByteOrder.LITTLE_ENDIAN : transferSyntax.getByteOrder();
        return OptionalInt.of(Short.toUnsignedInt(ByteBuffer.wrap(element.value()).order(order).getShort(0)));
    }

    private Charset resolveCharset() {
        DicomElement element = elements.get(DicomTags.SPECIFIC_CHARACTER_SET);
        if (element == null) {
            return StandardCharsets.ISO_8859_1;
        }
        String declared = firstValue(stripPadding(new String(element.value(), StandardCharsets.US_ASCII)));
        return CHARACTER_SETS.getOrDefault(declared, StandardCharsets.ISO_8859_1);
    }

    private static OptionalDouble parseDouble(String text) {
        try {
            double value = Double.parseDouble(text);
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static String firstValue(String multiValued) {
        int backslash = multiValued.indexOf('\\');
        return (backslash >= 0 ? multiValued.substring(0, backslash) : multiValued).trim();
    }

    private static String stripPadding(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\0')) {
            end--;
        }
        int start = 0;
        while (start < end && text.charAt(start) == ' ') {
            start++;
        }
        return text.substring(start, end);
    }
}
