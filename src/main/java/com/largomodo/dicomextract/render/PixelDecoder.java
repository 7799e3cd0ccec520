package com.largomodo.dicomextract.render;

import com.largomodo.dicomextract.dicom.DecodeException;
import com.largomodo.dicomextract.dicom.DicomDataset;
import com.largomodo.dicomextract.dicom.DicomElement;
import com.largomodo.dicomextract.dicom.DicomTags;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Decodes the first frame of a dataset's Pixel Data into a displayable image.
 * <p>
 * Native pixel data:
 * 1. Read samples of 8, 16 or 32 bits, masked (or sign-extended) to Bits Stored
 * 2. Apply Rescale Slope/Intercept to single-sample images
 * 3. Stretch min..max to 0..255, inverting MONOCHROME1
 * 4. Grayscale -> TYPE_BYTE_GRAY, RGB (interleaved or planar) -> TYPE_INT_RGB
 * <p>
 * Encapsulated pixel data is handed to ImageIO, which covers baseline JPEG.
 */
class PixelDecoder {

    private static final String MONOCHROME1 = "MONOCHROME1";
    private static final String MONOCHROME2 = "MONOCHROME2";
    private static final String RGB = "RGB";

    BufferedImage decode(DicomDataset dataset) throws DecodeException {
        DicomElement pixelData = dataset.get(DicomTags.PIXEL_DATA)
                .orElseThrow(() -> new DecodeException("Dataset has no Pixel Data"));

        if (pixelData.isEncapsulated()) {
            return decodeEncapsulated(pixelData, dataset.transferSyntaxUid());
        }
        if (dataset.transferSyntax().isEncapsulated()) {
            throw new DecodeException("Unsupported transfer syntax " + dataset.transferSyntaxUid());
        }

        int rows = require(dataset, DicomTags.ROWS, "Rows");
        int columns = require(dataset, DicomTags.COLUMNS, "Columns");
        int bitsAllocated = require(dataset, DicomTags.BITS_ALLOCATED, "Bits Allocated");
        int samplesPerPixel = dataset.getUnsignedShort(DicomTags.SAMPLES_PER_PIXEL).orElse(1);
        int bitsStored = dataset.getUnsignedShort(DicomTags.BITS_STORED).orElse(bitsAllocated);
        boolean signed = dataset.getUnsignedShort(DicomTags.PIXEL_REPRESENTATION).orElse(0) == 1;
        String photometric = dataset.getString(DicomTags.PHOTOMETRIC_INTERPRETATION)
                .orElse(samplesPerPixel == 3 ? RGB : MONOCHROME2);

        if (rows == 0 || columns == 0) {
            throw new DecodeException("Empty image: " + rows + "x" + columns);
        }
        if (bitsAllocated != 8 && bitsAllocated != 16 && bitsAllocated != 32) {
            throw new DecodeException("Unsupported Bits Allocated: " + bitsAllocated);
        }
        if (bitsStored == 0 || bitsStored > bitsAllocated) {
            throw new DecodeException("Bits Stored " + bitsStored + " inconsistent with Bits Allocated " + bitsAllocated);
        }

        long pixelCount = (long) rows * columns;
        long frameBytes = pixelCount * samplesPerPixel * (bitsAllocated / 8);
        if (frameBytes > Integer.MAX_VALUE) {
            throw new DecodeException("Frame too large: " + frameBytes + " bytes");
        }
        byte[] value = pixelData.value();
        if (value.length < frameBytes) {
            throw new DecodeException("Pixel Data truncated: expected " + frameBytes
                    + " bytes for one frame, found " + value.length);
        }

        double[] samples = readSamples(value, (int) (pixelCount * samplesPerPixel), bitsAllocated, bitsStored,
                signed, ByteBuffer.wrap(value).order(dataset.transferSyntax().getByteOrder()));

        if (samplesPerPixel == 1) {
            if (!photometric.equals(MONOCHROME1) && !photometric.equals(MONOCHROME2)) {
                throw new DecodeException("Unsupported Photometric Interpretation for one sample: " + photometric);
            }
            double slope = dataset.getDouble(DicomTags.RESCALE_SLOPE).orElse(1.0);
            double intercept = dataset.getDouble(DicomTags.RESCALE_INTERCEPT).orElse(0.0);
            if (slope != 1.0 || intercept != 0.0) {
                for (int i = 0; i < samples.length; i++) {
                    samples[i] = samples[i] * slope + intercept;
                }
            }
            return toGray(PixelNormalizer.stretch(samples, photometric.equals(MONOCHROME1)), columns, rows);
        }

        if (samplesPerPixel == 3 && photometric.equals(RGB)) {
            boolean planar = dataset.getUnsignedShort(DicomTags.PLANAR_CONFIGURATION).orElse(0) == 1;
            return toRgb(PixelNormalizer.stretch(samples, false), columns, rows, planar);
        }

        throw new DecodeException("Unsupported pixel layout: " + samplesPerPixel + " samples, " + photometric);
    }

    private static int require(DicomDataset dataset, int tag, String name) throws DecodeException {
        return dataset.getUnsignedShort(tag)
                .orElseThrow(() -> new DecodeException("Missing " + name + " " + DicomTags.toString(tag)));
    }

    private static double[] readSamples(byte[] value, int count, int bitsAllocated, int bitsStored,
                                        boolean signed, ByteBuffer buffer) {
        double[] samples = new double[count];
        long mask = bitsStored >= 32 ? 0xFFFFFFFFL : (1L << bitsStored) - 1;
        for (int i = 0; i < count; i++) {
            long raw = switch (bitsAllocated) {
                case 8 -> Byte.toUnsignedLong(value[i]);
                case 16 -> Short.toUnsignedLong(buffer.getShort(i * 2));
                default -> Integer.toUnsignedLong(buffer.getInt(i * 4));
            };
            raw &= mask;
            if (signed && (raw & (1L << (bitsStored - 1))) != 0) {
                raw -= 1L << bitsStored;
            }
            samples[i] = raw;
        }
        return samples;
    }

    private static BufferedImage toGray(byte[] pixels, int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        image.getRaster().setDataElements(0, 0, width, height, pixels);
        return image;
    }

    private static BufferedImage toRgb(byte[] samples, int width, int height, boolean planar) {
        int pixelCount = width * height;
        int[] argb = new int[pixelCount];
        for (int p = 0; p < pixelCount; p++) {
            int r;
            int g;
            int b;
            if (planar) {
                r = samples[p] & 0xFF;
                g = samples[pixelCount + p] & 0xFF;
                b = samples[2 * pixelCount + p] & 0xFF;
            } else {
                r = samples[p * 3] & 0xFF;
                g = samples[p * 3 + 1] & 0xFF;
                b = samples[p * 3 + 2] & 0xFF;
            }
            argb[p] = (r << 16) | (g << 8) | b;
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    private static BufferedImage decodeEncapsulated(DicomElement pixelData, String transferSyntaxUid)
            throws DecodeException {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(pixelData.fragments().get(0)));
            if (image == null && pixelData.fragments().size() > 1) {
                // A single frame may be split over several fragments
                ByteArrayOutputStream joined = new ByteArrayOutputStream();
                for (byte[] fragment : pixelData.fragments()) {
                    joined.write(fragment);
                }
                image = ImageIO.read(new ByteArrayInputStream(joined.toByteArray()));
            }
            if (image == null) {
                throw new DecodeException("No decoder for compressed pixel data (transfer syntax "
                        + transferSyntaxUid + ")");
            }
            return image;
        } catch (DecodeException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Cannot decode compressed pixel data (transfer syntax "
                    + transferSyntaxUid + "): " + e.getMessage(), e);
        }
    }
}
