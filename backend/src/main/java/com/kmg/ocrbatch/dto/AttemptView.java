package com.kmg.ocrbatch.dto;

import com.kmg.ocrbatch.model.ErrorKind;

public record AttemptView(
        int attemptNumber,
        String startedAt,
        boolean succeeded,
        ErrorKind errorKind,
        String errorMessage
) {
}
