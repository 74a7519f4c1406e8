package com.kmg.ocrbatch.service;

import com.kmg.ocrbatch.model.Attempt;
import com.kmg.ocrbatch.model.AttemptOutcome;
import com.kmg.ocrbatch.model.BatchResult;
import com.kmg.ocrbatch.model.ItemResult;
import com.kmg.ocrbatch.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingBatchListener implements BatchListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingBatchListener.class);

    private final String batchId;

    public LoggingBatchListener(String batchId) {
        this.batchId = batchId;
    }

    @Override
    public void onAttemptStarted(WorkItem item, int attemptNumber) {
        log.debug("[{}] {} attempt {} started: {}", batchId, item.id(), attemptNumber, item.displayName());
    }

    @Override
    public void onAttemptFailed(WorkItem item, Attempt attempt, RetryDecision decision) {
        if (!(attempt.outcome() instanceof AttemptOutcome.Failure failure)) {
            return;
        }
        if (decision instanceof RetryDecision.Retry retry) {
            log.warn("[{}] {} attempt {} failed ({}: {}), retrying in {}ms",
                    batchId, item.id(), attempt.attemptNumber(), failure.error().kind(),
                    failure.error().message(), retry.delay().toMillis());
        } else {
            log.debug("[{}] {} attempt {} failed ({}), giving up",
                    batchId, item.id(), attempt.attemptNumber(), failure.error().kind());
        }
    }

    @Override
    public void onItemCompleted(ItemResult result) {
        if (result instanceof ItemResult.Failed failed) {
            log.error("[{}] {} failed after {} attempt(s): {} {}", batchId, result.itemId(), result.attemptsUsed(),
                    failed.finalError().kind(), failed.finalError().message());
        } else {
            log.info("[{}] {} succeeded after {} attempt(s): {}", batchId, result.itemId(), result.attemptsUsed(),
                    result.item().displayName());
        }
    }

    @Override
    public void onBatchCompleted(BatchResult result) {
        log.info("[{}] Batch completed: {} succeeded, {} failed", batchId, result.succeededCount(), result.failedCount());
    }
}
