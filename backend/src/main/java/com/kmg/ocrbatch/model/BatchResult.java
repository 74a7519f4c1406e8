package com.kmg.ocrbatch.model;

import java.util.List;

public record BatchResult(List<ItemResult> items, int succeededCount, int failedCount) {
    public BatchResult {
        items = List.copyOf(items);
    }

    public int total() {
        return items.size();
    }

    public boolean hasFailures() {
        return failedCount > 0;
    }
}
