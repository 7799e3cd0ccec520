package com.largomodo.dicomextract.archive;

import org.apache.commons.io.FilenameUtils;

import java.util.Optional;

/**
 * Supported container formats.
 * <p>
 * The tag is used in derived destination names ({@code <basename>_<tag>}), so it must stay
 * stable across releases: changing it would defeat the skip-if-populated cache of earlier runs.
 */
public enum ArchiveKind {
    ZIP("zip", "zip"),
    ISO("iso", "iso");

    private final String tag;
    private final String extension;

    ArchiveKind(String tag, String extension) {
        this.tag = tag;
        this.extension = extension;
    }

    public String getTag() {
        return tag;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Kind implied by a file name extension, case-insensitive.
     *
     * @param fileName file name (may be null)
     * @return matching kind, empty for unknown or missing extensions
     */
    public static Optional<ArchiveKind> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String ext = FilenameUtils.getExtension(fileName);
        for (ArchiveKind kind : values()) {
            if (kind.extension.equalsIgnoreCase(ext)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
