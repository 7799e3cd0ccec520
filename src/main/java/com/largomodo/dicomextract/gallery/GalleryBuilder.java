package com.largomodo.dicomextract.gallery;

import com.largomodo.dicomextract.dicom.ImageMetadata;
import com.largomodo.dicomextract.render.RenderedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes the static {@code index.html} gallery for a set of rendered images.
 * <p>
 * The page is a classpath template with three placeholders: {@code {{TITLE}}},
 * {@code {{HEADER}}} and {@code {{SECTIONS}}}. The viewer script in the template steps
 * through the thumbnails in document order, so the flattened section order is also the
 * previous/next order. The document is regenerated on every call and always overwritten.
 */
public class GalleryBuilder {

    private static final Logger log = LoggerFactory.getLogger(GalleryBuilder.class);

    public static final String GALLERY_FILE = "index.html";
    static final String TEMPLATE_RESOURCE = "/gallery/template.html";

    private final String templateResource;

    public GalleryBuilder() {
        this(TEMPLATE_RESOURCE);
    }

    GalleryBuilder(String templateResource) {
        this.templateResource = templateResource;
    }

    /**
     * Group images into sections, ordered by {@link SeriesOrderComparator}, each sorted by
     * {@link ImageOrderComparator} with ties kept in input order.
     */
    public List<GallerySeries> group(List<RenderedImage> images) {
        Map<SeriesKey, List<RenderedImage>> sections = new TreeMap<>(new SeriesOrderComparator());
        for (RenderedImage image : images) {
            sections.computeIfAbsent(SeriesKey.of(image.metadata()), k -> new ArrayList<>()).add(image);
        }

        List<GallerySeries> result = new ArrayList<>(sections.size());
        for (Map.Entry<SeriesKey, List<RenderedImage>> section : sections.entrySet()) {
            List<RenderedImage> sorted = new ArrayList<>(section.getValue());
            // List.sort is a stable merge sort
            sorted.sort(new ImageOrderComparator());
            result.add(new GallerySeries(section.getKey(), sorted));
        }
        return result;
    }

    /**
     * Write {@code index.html} into {@code exportDir}.
     *
     * @param images    rendered images; the first one supplies the study header
     * @param exportDir directory holding the images
     * @return path of the written document
     * @throws IOException if the template is missing or the document cannot be written
     */
    public Path build(List<RenderedImage> images, Path exportDir) throws IOException {
        if (images.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a gallery without images");
        }

        List<GallerySeries> sections = group(images);
        ImageMetadata study = images.get(0).metadata();

        Map<String, String> values = new LinkedHashMap<>();
        values.put("{{TITLE}}", escape(study.patientName() + " - " + study.studyDescription()));
        values.put("{{HEADER}}", header(study));
        values.put("{{SECTIONS}}", sections(sections, exportDir));

        String html = loadTemplate();
        for (Map.Entry<String, String> value : values.entrySet()) {
            html = html.replace(value.getKey(), value.getValue());
        }

        Path gallery = exportDir.resolve(GALLERY_FILE);
        Files.writeString(gallery, html, StandardCharsets.UTF_8);
        log.info("Gallery written: {} ({} images, {} series)", gallery, images.size(), sections.size());
        return gallery;
    }

    private String loadTemplate() throws IOException {
        try (InputStream in = getClass().getResourceAsStream(templateResource)) {
            if (in == null) {
                throw new IOException("Internal resource " + templateResource +
                        " not found. Ensure application is built correctly.");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String header(ImageMetadata study) {
        StringBuilder html = new StringBuilder();
        html.append("<h1>").append(escape(study.patientName())).append("</h1>\n");
        html.append("<dl class=\"study\">\n");
        definition(html, "Patient ID", study.patientId());
        definition(html, "Study date", study.studyDate());
        definition(html, "Study", study.studyDescription());
        definition(html, "Modality", study.modality());
        html.append("</dl>");
        return html.toString();
    }

    private static void definition(StringBuilder html, String term, String value) {
        html.append("  <dt>").append(escape(term)).append("</dt><dd>").append(escape(value)).append("</dd>\n");
    }

    private static String sections(List<GallerySeries> sections, Path exportDir) {
        StringBuilder html = new StringBuilder();
        int index = 0;
        for (GallerySeries series : sections) {
            html.append("<section class=\"series\">\n");
            html.append("  <h2>").append(escape(series.key().title()))
                    .append(" <span class=\"count\">(").append(series.images().size()).append(")</span></h2>\n");
            html.append("  <div class=\"thumbs\">\n");
            for (RenderedImage image : series.images()) {
                String href = escape(relativeLink(exportDir, image.imagePath()));
                String caption = "Slice " + image.metadata().sliceLocationText()
                        + " / Instance " + image.metadata().instanceNumberText();
                html.append("    <a class=\"thumb\" href=\"").append(href)
                        .append("\" data-index=\"").append(index++)
                        .append("\" data-caption=\"").append(escape(caption)).append("\">")
                        .append("<img src=\"").append(href).append("\" alt=\"").append(escape(caption))
                        .append("\" loading=\"lazy\"><span>").append(escape(caption)).append("</span></a>\n");
            }
            html.append("  </div>\n");
            html.append("</section>\n");
        }
        return html.toString();
    }

    static String relativeLink(Path exportDir, Path image) {
        Path base = exportDir.toAbsolutePath().normalize();
        Path target = image.toAbsolutePath().normalize();
        Path relative = target.startsWith(base) ? base.relativize(target) : target.getFileName();
        return relative.toString().replace('\\', '/');
    }

    static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
