package com.kmg.ocrbatch.service;

import com.kmg.ocrbatch.model.Attempt;
import com.kmg.ocrbatch.model.BatchResult;
import com.kmg.ocrbatch.model.ItemResult;
import com.kmg.ocrbatch.model.WorkItem;

/**
 * Progress callbacks of one batch run. Callbacks arrive on worker threads.
 */
public interface BatchListener {

    static BatchListener both(BatchListener first, BatchListener second) {
        return new BatchListener() {
            @Override
            public void onAttemptStarted(WorkItem item, int attemptNumber) {
                first.onAttemptStarted(item, attemptNumber);
                second.onAttemptStarted(item, attemptNumber);
            }

            @Override
            public void onAttemptFailed(WorkItem item, Attempt attempt, RetryDecision decision) {
                first.onAttemptFailed(item, attempt, decision);
                second.onAttemptFailed(item, attempt, decision);
            }

            @Override
            public void onItemCompleted(ItemResult result) {
                first.onItemCompleted(result);
                second.onItemCompleted(result);
            }

            @Override
            public void onBatchCompleted(BatchResult result) {
                first.onBatchCompleted(result);
                second.onBatchCompleted(result);
            }
        };
    }

    default void onAttemptStarted(WorkItem item, int attemptNumber) {
    }

    default void onAttemptFailed(WorkItem item, Attempt attempt, RetryDecision decision) {
    }

    default void onItemCompleted(ItemResult result) {
    }

    default void onBatchCompleted(BatchResult result) {
    }
}
