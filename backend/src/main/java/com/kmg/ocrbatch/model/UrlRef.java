package com.kmg.ocrbatch.model;

import java.net.URI;
import java.util.Objects;

public record UrlRef(URI uri) implements DocumentSource {
    public UrlRef {
        Objects.requireNonNull(uri, "uri");
    }

    @Override
    public String displayName() {
        return uri.toString();
    }
}
