package com.kmg.ocrbatch.model;

import java.util.Objects;

public record WorkItem(String id, DocumentSource source, ProcessingOptions options) {
    public WorkItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(options, "options");
    }

    public static String idForPosition(int position) {
        return String.format("item-%04d", position + 1);
    }

    public String displayName() {
        return source.displayName();
    }
}
