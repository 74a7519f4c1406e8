package com.kmg.ocrbatch.model;

import java.time.Instant;

public record Attempt(String itemId, int attemptNumber, Instant startedAt, AttemptOutcome outcome) {
    public boolean succeeded() {
        return outcome instanceof AttemptOutcome.Success;
    }
}
