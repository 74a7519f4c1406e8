package com.kmg.ocrbatch.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public sealed interface ItemResult permits ItemResult.Succeeded, ItemResult.Failed {

    WorkItem item();

    List<Attempt> attempts();

    default String itemId() {
        return item().id();
    }

    default int attemptsUsed() {
        return attempts().size();
    }

    default ItemState state() {
        return this instanceof Succeeded ? ItemState.SUCCEEDED : ItemState.FAILED;
    }

    record Succeeded(WorkItem item, JsonNode payload, List<Attempt> attempts) implements ItemResult {
        public Succeeded {
            attempts = List.copyOf(attempts);
        }
    }

    record Failed(WorkItem item, ErrorRecord finalError, List<Attempt> attempts) implements ItemResult {
        public Failed {
            attempts = List.copyOf(attempts);
        }
    }
}
