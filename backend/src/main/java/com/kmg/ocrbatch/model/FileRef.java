package com.kmg.ocrbatch.model;

import java.nio.file.Path;
import java.util.Objects;

public record FileRef(
        Path path,
        DocumentType documentType,
        long sizeBytes,
        Integer pageCount
) implements DocumentSource {
    public FileRef {
        Objects.requireNonNull(path, "path");
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    public String mimeType() {
        return DocumentType.mimeTypeOf(fileName());
    }

    @Override
    public String displayName() {
        return fileName();
    }
}
