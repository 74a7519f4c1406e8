package com.kmg.ocrbatch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.kmg.ocrbatch.model.ItemState;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemResultView(
        String id,
        String file,
        ItemState status,
        int attemptsUsed,
        List<AttemptView> attempts,
        JsonNode response,
        ErrorView error
) {
    public ItemResultView withFile(String value) {
        return new ItemResultView(id, value, status, attemptsUsed, attempts, response, error);
    }
}
