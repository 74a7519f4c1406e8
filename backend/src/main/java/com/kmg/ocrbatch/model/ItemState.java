package com.kmg.ocrbatch.model;

public enum ItemState {
    PENDING,
    IN_FLIGHT,
    RETRY_SCHEDULED,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
