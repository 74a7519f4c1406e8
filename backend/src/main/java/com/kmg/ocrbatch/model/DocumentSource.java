package com.kmg.ocrbatch.model;

public sealed interface DocumentSource permits FileRef, UrlRef {
    String displayName();
}
