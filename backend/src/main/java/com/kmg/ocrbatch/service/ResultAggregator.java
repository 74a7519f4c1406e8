package com.kmg.ocrbatch.service;

import com.kmg.ocrbatch.model.BatchResult;
import com.kmg.ocrbatch.model.ItemResult;
import com.kmg.ocrbatch.model.WorkItem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders terminal item results by their work item's input position, whatever order they finished in.
 */
public class ResultAggregator {

    public BatchResult aggregate(List<WorkItem> items, Collection<? extends ItemResult> results) {
        Map<String, ItemResult> byId = new HashMap<>();
        for (ItemResult result : results) {
            if (byId.putIfAbsent(result.itemId(), result) != null) {
                throw new IllegalStateException("Duplicate result for item " + result.itemId());
            }
        }

        List<ItemResult> ordered = new ArrayList<>(items.size());
        int succeeded = 0;
        int failed = 0;
        for (WorkItem item : items) {
            ItemResult result = byId.remove(item.id());
            if (result == null) {
                throw new IllegalStateException("Missing result for item " + item.id());
            }
            ordered.add(result);
            if (result instanceof ItemResult.Succeeded) {
                succeeded++;
            } else {
                failed++;
            }
        }

        if (!byId.isEmpty()) {
            throw new IllegalStateException("Results for unknown items: " + byId.keySet());
        }
        return new BatchResult(ordered, succeeded, failed);
    }
}
