package com.kmg.ocrbatch.dto;

import com.kmg.ocrbatch.model.ErrorKind;

public record ErrorView(
        ErrorKind kind,
        String message,
        boolean retryable,
        Integer backendStatus
) {
}
