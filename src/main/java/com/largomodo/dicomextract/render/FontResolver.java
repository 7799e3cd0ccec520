package com.largomodo.dicomextract.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Font;
import java.awt.GraphicsEnvironment;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the overlay font once, from a ranked list of family names.
 * <p>
 * The first installed family wins; the logical {@link Font#MONOSPACED} family is always
 * accepted when listed because the JDK maps it to some physical font. Font discovery can fail
 * outright on hosts without a font configuration, in which case no font is available and
 * images are left undecorated.
 */
public class FontResolver {

    private static final Logger log = LoggerFactory.getLogger(FontResolver.class);

    public static final List<String> DEFAULT_CANDIDATES = List.of(
            "DejaVu Sans Mono", "Liberation Mono", "Consolas", "Menlo", Font.MONOSPACED);
    public static final int DEFAULT_SIZE = 14;

    private final Optional<Font> font;

    public FontResolver() {
        this(DEFAULT_CANDIDATES, DEFAULT_SIZE);
    }

    public FontResolver(List<String> candidates, int size) {
        if (candidates == null || size <= 0) {
            throw new IllegalArgumentException("candidates must not be null and size must be positive");
        }
        this.font = resolve(candidates, size);
    }

    /**
     * @return the resolved font, empty when no candidate is usable
     */
    public Optional<Font> font() {
        return font;
    }

    private static Optional<Font> resolve(List<String> candidates, int size) {
        Set<String> installed;
        try {
            installed = new HashSet<>(Arrays.asList(
                    GraphicsEnvironment.getLocalGraphicsEnvironment().getAvailableFontFamilyNames()));
        } catch (RuntimeException | LinkageError e) {
            log.warn("Font discovery failed, overlays disabled: {}", e.toString());
            return Optional.empty();
        }

        for (String family : candidates) {
            if (installed.contains(family) || Font.MONOSPACED.equals(family)) {
                log.debug("Overlay font: {} {}pt", family, size);
                return Optional.of(new Font(family, Font.PLAIN, size));
            }
        }
        log.warn("None of the overlay fonts {} is installed", candidates);
        return Optional.empty();
    }
}
