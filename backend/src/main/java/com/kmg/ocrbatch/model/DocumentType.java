package com.kmg.ocrbatch.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum DocumentType {
    PDF,
    IMAGE;

    private static final Map<String, String> MIME_TYPES = Map.of(
            "pdf", "application/pdf",
            "png", "image/png",
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "tiff", "image/tiff",
            "tif", "image/tiff",
            "bmp", "image/bmp"
    );

    public static boolean isSupportedExtension(String extension) {
        return extension != null && MIME_TYPES.containsKey(extension.toLowerCase(Locale.ROOT));
    }

    public static Optional<DocumentType> fromFileName(String fileName) {
        String ext = extensionOf(fileName);
        if (!isSupportedExtension(ext)) {
            return Optional.empty();
        }
        return Optional.of("pdf".equals(ext) ? PDF : IMAGE);
    }

    public static String mimeTypeOf(String fileName) {
        String ext = extensionOf(fileName);
        return ext == null ? null : MIME_TYPES.get(ext);
    }

    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return null;
        }
        int idx = fileName.lastIndexOf('.');
        if (idx < 0 || idx == fileName.length() - 1) {
            return null;
        }
        return fileName.substring(idx + 1).toLowerCase(Locale.ROOT);
    }
}
