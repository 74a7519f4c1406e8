package com.kmg.ocrbatch.service;

import com.kmg.ocrbatch.backend.BackendClientAdapter;
import com.kmg.ocrbatch.model.BatchResult;
import com.kmg.ocrbatch.model.WorkItem;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs work items through the backend adapter with bounded concurrency and per-item retries.
 * Item failures never fail the batch; they show up as failed entries of the {@link BatchResult}.
 */
public class BatchScheduler {
    private final BackendClientAdapter adapter;
    private final RetryPolicy retryPolicy;
    private final RetryTimer retryTimer;
    private final ResultAggregator aggregator;
    private final Clock clock;
    private final AtomicLong batchSequence = new AtomicLong();

    public BatchScheduler(BackendClientAdapter adapter, RetryPolicy retryPolicy, RetryTimer retryTimer,
                          ResultAggregator aggregator, Clock clock) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.retryTimer = Objects.requireNonNull(retryTimer, "retryTimer");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public BatchResult run(List<WorkItem> workItems, int concurrencyLimit) {
        return start(workItems, concurrencyLimit, null).await();
    }

    public BatchResult submitBatch(List<WorkItem> workItems, int concurrencyLimit, Duration timeout) {
        return submitBatch(workItems, concurrencyLimit, timeout, null);
    }

    public BatchResult submitBatch(List<WorkItem> workItems, int concurrencyLimit, Duration timeout,
                                   BatchListener listener) {
        Objects.requireNonNull(timeout, "timeout");
        return start(workItems, concurrencyLimit, listener).await(timeout);
    }

    public BatchExecution start(List<WorkItem> workItems, int concurrencyLimit, BatchListener listener) {
        Objects.requireNonNull(workItems, "workItems");
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1 (current: " + concurrencyLimit + ")");
        }
        Set<String> ids = new HashSet<>();
        for (WorkItem item : workItems) {
            if (!ids.add(item.id())) {
                throw new IllegalArgumentException("Duplicate work item id: " + item.id());
            }
        }

        String batchId = "batch-" + batchSequence.incrementAndGet();
        BatchListener logging = new LoggingBatchListener(batchId);
        BatchListener effective = listener == null ? logging : BatchListener.both(logging, listener);
        BatchExecution execution = new BatchExecution(batchId, workItems, concurrencyLimit, adapter, retryPolicy,
                retryTimer, aggregator, clock, effective);
        execution.launch();
        return execution;
    }
}
