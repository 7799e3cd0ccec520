package com.largomodo.dicomextract.render;

import com.largomodo.dicomextract.core.ExportObserver;
import com.largomodo.dicomextract.core.UniqueNameAllocator;
import com.largomodo.dicomextract.dicom.DecodeException;
import com.largomodo.dicomextract.dicom.DicomDataset;
import com.largomodo.dicomextract.dicom.DicomFileReader;
import com.largomodo.dicomextract.dicom.ImageMetadata;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Font;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Renders extracted DICOM files to annotated PNGs.
 * <p>
 * Output name is {@code <source base name>.png}. A PNG left by an earlier run is replaced;
 * a base name already used in this run gets a "_n" suffix. One instance per export run,
 * since the names granted so far are remembered per export directory.
 */
public class DicomImageRenderer implements ImageRenderer {

    private static final Logger log = LoggerFactory.getLogger(DicomImageRenderer.class);

    static final String IMAGE_FORMAT = "png";

    private final DicomFileReader reader;
    private final PixelDecoder decoder;
    private final FontResolver fontResolver;
    private final ExportObserver observer;
    private final Map<Path, UniqueNameAllocator> allocators = new HashMap<>();
    private boolean fontWarningReported;

    public DicomImageRenderer(FontResolver fontResolver, ExportObserver observer) {
        this(new DicomFileReader(), fontResolver, observer);
    }

    DicomImageRenderer(DicomFileReader reader, FontResolver fontResolver, ExportObserver observer) {
        if (reader == null || fontResolver == null || observer == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.reader = reader;
        this.decoder = new PixelDecoder();
        this.fontResolver = fontResolver;
        this.observer = observer;
    }

    @Override
    public RenderResult render(Path dicomFile, Path exportDir) {
        DicomDataset dataset;
        try {
            dataset = reader.read(dicomFile);
        } catch (IOException e) {
            return failed(dicomFile, e);
        }

        if (!dataset.hasPixelData()) {
            log.debug("No pixel data: {}", dicomFile.getFileName());
            observer.onNoImage(dicomFile);
            return RenderResult.noImage(dicomFile);
        }

        ImageMetadata metadata = ImageMetadata.from(dataset, dicomFile);
        try {
            BufferedImage image = annotate(decoder.decode(dataset), metadata);
            Path target = allocatorFor(exportDir)
                    .allocate(FilenameUtils.getBaseName(dicomFile.getFileName().toString()) + "." + IMAGE_FORMAT)
                    .path();
            if (!ImageIO.write(image, IMAGE_FORMAT, target.toFile())) {
                throw new IOException("No ImageIO writer for " + IMAGE_FORMAT);
            }
            log.info("Rendered: {}", target);
            RenderedImage rendered = new RenderedImage(target, metadata);
            observer.onRendered(rendered);
            return RenderResult.rendered(rendered);
        } catch (IOException e) {
            return failed(dicomFile, e);
        }
    }

    private BufferedImage annotate(BufferedImage image, ImageMetadata metadata) {
        Optional<Font> font = fontResolver.font();
        if (font.isEmpty()) {
            warnOnce("No overlay font available; images are written without annotations");
            return image;
        }
        try {
            return MetadataOverlay.apply(image, metadata, font.get());
        } catch (RuntimeException | LinkageError e) {
            warnOnce("Text rendering failed, writing image without annotations: " + e);
            return image;
        }
    }

    private void warnOnce(String message) {
        if (!fontWarningReported) {
            fontWarningReported = true;
            log.warn(message);
            observer.onWarning(message);
        }
    }

    private UniqueNameAllocator allocatorFor(Path exportDir) {
        return allocators.computeIfAbsent(exportDir.toAbsolutePath().normalize(),
                dir -> new UniqueNameAllocator(dir, true));
    }

    private RenderResult failed(Path dicomFile, IOException e) {
        String kind = e instanceof DecodeException ? "Cannot decode" : "Cannot render";
        log.error("{} {}: {}", kind, dicomFile.getFileName(), e.getMessage());
        observer.onRenderFailure(dicomFile, e);
        return RenderResult.failed(dicomFile, e.getMessage());
    }
}
