package com.kmg.ocrbatch.model;

import com.fasterxml.jackson.databind.JsonNode;

public sealed interface AttemptOutcome permits AttemptOutcome.Success, AttemptOutcome.Failure {

    record Success(JsonNode payload) implements AttemptOutcome {
    }

    record Failure(ErrorRecord error) implements AttemptOutcome {
    }
}
