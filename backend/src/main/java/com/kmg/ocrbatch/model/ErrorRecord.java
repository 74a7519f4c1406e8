package com.kmg.ocrbatch.model;

import java.time.Duration;
import java.util.Objects;

public record ErrorRecord(
        ErrorKind kind,
        String message,
        boolean retryable,
        Integer backendStatus,
        Duration retryAfter
) {
    public ErrorRecord {
        Objects.requireNonNull(kind, "kind");
    }

    public static ErrorRecord of(ErrorKind kind, String message, boolean retryable) {
        return new ErrorRecord(kind, message, retryable, null, null);
    }

    public static ErrorRecord cancelled() {
        return of(ErrorKind.CANCELLED, "Batch cancelled before the item completed", false);
    }
}
