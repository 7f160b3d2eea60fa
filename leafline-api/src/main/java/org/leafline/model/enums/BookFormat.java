package org.leafline.model.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum BookFormat {
    EPUB("epub"),
    PDF("pdf"),
    TXT("txt"),
    MD("md"),
    HTML("html"),
    MOBI("mobi"),
    AZW3("azw3");

    private final String extension;

    BookFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static Optional<BookFormat> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        String match = normalized;
        return Arrays.stream(values())
                .filter(f -> f.extension.equals(match))
                .findFirst();
    }

    public static Optional<BookFormat> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? Optional.empty() : fromValue(fileName.substring(dot + 1));
    }
}
