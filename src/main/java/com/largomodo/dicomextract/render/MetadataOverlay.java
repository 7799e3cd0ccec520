package com.largomodo.dicomextract.render;

import com.largomodo.dicomextract.dicom.ImageMetadata;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Burns the identifying header fields into the top-left corner of an image.
 */
class MetadataOverlay {

    private static final int MARGIN = 6;

    static List<String> lines(ImageMetadata metadata) {
        return List.of(
                "Patient: " + metadata.patientName(),
                "ID: " + metadata.patientId(),
                "Study date: " + metadata.studyDate(),
                "Series: " + metadata.seriesDescription(),
                "Modality: " + metadata.modality(),
                "Slice: " + metadata.sliceLocationText(),
                "Instance: " + metadata.instanceNumberText()
        );
    }

    /**
     * Draw the overlay on an RGB copy of {@code source}, so white text shows on grayscale input.
     */
    static BufferedImage apply(BufferedImage source, ImageMetadata metadata, Font font) {
        BufferedImage annotated = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = annotated.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setFont(font);
            FontMetrics metrics = g.getFontMetrics();
            int y = MARGIN + metrics.getAscent();
            for (String line : lines(metadata)) {
                // 1px shadow keeps text readable over bright anatomy
                g.setColor(Color.BLACK);
                g.drawString(line, MARGIN + 1, y + 1);
                g.setColor(Color.WHITE);
                g.drawString(line, MARGIN, y);
                y += metrics.getHeight();
            }
        } finally {
            g.dispose();
        }
        return annotated;
    }
}
