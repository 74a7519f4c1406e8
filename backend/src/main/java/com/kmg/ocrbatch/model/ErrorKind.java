package com.kmg.ocrbatch.model;

public enum ErrorKind {
    UNSUPPORTED_FILE_TYPE,
    INVALID_INPUT,
    TRANSIENT,
    RATE_LIMITED,
    BACKEND_FAULT,
    INVALID_REQUEST,
    TIMEOUT,
    MALFORMED_RESPONSE,
    CANCELLED
}
