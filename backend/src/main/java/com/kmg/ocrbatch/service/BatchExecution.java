package com.kmg.ocrbatch.service;

import com.kmg.ocrbatch.backend.BackendClientAdapter;
import com.kmg.ocrbatch.model.Attempt;
import com.kmg.ocrbatch.model.AttemptOutcome;
import com.kmg.ocrbatch.model.BatchResult;
import com.kmg.ocrbatch.model.ErrorKind;
import com.kmg.ocrbatch.model.ErrorRecord;
import com.kmg.ocrbatch.model.ItemResult;
import com.kmg.ocrbatch.model.ItemState;
import com.kmg.ocrbatch.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * One running batch. Holds all per-batch state, so concurrent batches never share anything mutable.
 *
 * <p>Per item: {@code PENDING -> IN_FLIGHT -> SUCCEEDED | FAILED | RETRY_SCHEDULED -> IN_FLIGHT ...}.
 * The worker pool has exactly {@code concurrencyLimit} threads and an attempt only runs on a worker, so at
 * most that many attempts are in flight. An item waiting out a retry delay sits in the {@link RetryTimer}
 * and holds no worker.</p>
 *
 * <p>Each item's terminal result is claimed once through a compare-and-set on its slot. Whoever wins
 * (the worker or {@link #cancel()}) records the result; a late attempt result is dropped.</p>
 */
public final class BatchExecution {
    private static final Logger log = LoggerFactory.getLogger(BatchExecution.class);
    private static final Duration MAX_WAIT = Duration.ofMillis(Long.MAX_VALUE);

    private final String batchId;
    private final List<WorkItem> items;
    private final BackendClientAdapter adapter;
    private final RetryPolicy retryPolicy;
    private final RetryTimer retryTimer;
    private final ResultAggregator aggregator;
    private final Clock clock;
    private final BatchListener listener;

    private final List<ItemProgress> progress;
    private final AtomicReferenceArray<ItemResult> slots;
    private final ConcurrentLinkedQueue<ItemResult> completionOrder = new ConcurrentLinkedQueue<>();
    private final AtomicInteger remaining;
    private final CountDownLatch done;
    private final Object dispatchLock = new Object();
    private final ExecutorService workers;
    private final int workerCount;
    private volatile boolean cancelled;

    BatchExecution(String batchId, List<WorkItem> items, int concurrencyLimit, BackendClientAdapter adapter,
                   RetryPolicy retryPolicy, RetryTimer retryTimer, ResultAggregator aggregator, Clock clock,
                   BatchListener listener) {
        this.batchId = batchId;
        this.items = List.copyOf(items);
        this.adapter = adapter;
        this.retryPolicy = retryPolicy;
        this.retryTimer = retryTimer;
        this.aggregator = aggregator;
        this.clock = clock;
        this.listener = listener;

        List<ItemProgress> tracked = new ArrayList<>(this.items.size());
        for (int i = 0; i < this.items.size(); i++) {
            tracked.add(new ItemProgress(i, this.items.get(i)));
        }
        this.progress = List.copyOf(tracked);
        this.slots = new AtomicReferenceArray<>(this.items.size());
        this.remaining = new AtomicInteger(this.items.size());
        this.done = new CountDownLatch(this.items.size());

        this.workerCount = Math.max(1, Math.min(concurrencyLimit, this.items.size()));
        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable, "ocr-" + batchId + "-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    void launch() {
        log.info("[{}] Starting batch of {} item(s) with {} worker(s)", batchId, items.size(), workerCount);
        if (items.isEmpty()) {
            finish();
            return;
        }
        for (ItemProgress item : progress) {
            dispatch(item);
        }
    }

    public String batchId() {
        return batchId;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isDone() {
        return done.getCount() == 0;
    }

    public Map<String, ItemState> itemStates() {
        Map<String, ItemState> states = new LinkedHashMap<>();
        for (ItemProgress item : progress) {
            states.put(item.item.id(), item.state);
        }
        return states;
    }

    /**
     * Stops scheduling attempts and fails every non-terminal item with {@link ErrorKind#CANCELLED}.
     * Backend calls already issued are left to finish; their results are discarded. No-op once the batch is done.
     */
    public void cancel() {
        synchronized (dispatchLock) {
            if (cancelled || isDone()) {
                return;
            }
            cancelled = true;
        }
        log.warn("[{}] Batch cancelled; failing unfinished items", batchId);
        for (ItemProgress item : progress) {
            complete(item, new ItemResult.Failed(item.item, ErrorRecord.cancelled(), item.attempts));
        }
        workers.shutdown();
    }

    public BatchResult await() {
        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
        }
        return result();
    }

    /**
     * Waits up to {@code timeout}; on expiry the batch is cancelled and the partial result returned.
     */
    public BatchResult await(Duration timeout) {
        try {
            long millis = timeout.compareTo(MAX_WAIT) >= 0 ? Long.MAX_VALUE : timeout.toMillis();
            if (!done.await(millis, TimeUnit.MILLISECONDS)) {
                log.warn("[{}] Batch did not finish within {}ms", batchId, millis);
                cancel();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
        }
        return result();
    }

    private BatchResult result() {
        awaitAllTerminal();
        return aggregator.aggregate(items, List.copyOf(completionOrder));
    }

    // After cancel() every slot is claimed, but a worker may still be between its claim and countDown.
    private void awaitAllTerminal() {
        boolean interrupted = false;
        while (done.getCount() > 0) {
            try {
                done.await();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void dispatch(ItemProgress item) {
        if (cancelled) {
            return;
        }
        try {
            workers.execute(() -> runAttempt(item));
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Worker pool closed before {} could be dispatched", batchId, item.item.id());
            complete(item, new ItemResult.Failed(item.item, ErrorRecord.cancelled(), item.attempts));
        }
    }

    private void runAttempt(ItemProgress item) {
        int attemptNumber;
        synchronized (dispatchLock) {
            if (cancelled || slots.get(item.position) != null) {
                return;
            }
            item.state = ItemState.IN_FLIGHT;
            attemptNumber = item.attempts.size() + 1;
        }

        try {
            notifyListener(() -> listener.onAttemptStarted(item.item, attemptNumber));
            Instant startedAt = clock.instant();
            AttemptOutcome outcome = adapter.invoke(item.item);
            Attempt attempt = new Attempt(item.item.id(), attemptNumber, startedAt, outcome);

            if (cancelled) {
                log.debug("[{}] Discarding attempt {} of {} after cancellation", batchId, attemptNumber, item.item.id());
                return;
            }
            item.attempts.add(attempt);

            if (outcome instanceof AttemptOutcome.Success success) {
                complete(item, new ItemResult.Succeeded(item.item, success.payload(), item.attempts));
                return;
            }

            ErrorRecord error = ((AttemptOutcome.Failure) outcome).error();
            RetryDecision decision = retryPolicy.decide(error, attemptNumber);
            notifyListener(() -> listener.onAttemptFailed(item.item, attempt, decision));

            if (decision instanceof RetryDecision.Retry retry) {
                item.state = ItemState.RETRY_SCHEDULED;
                retryTimer.schedule(() -> dispatch(item), retry.delay());
            } else {
                complete(item, new ItemResult.Failed(item.item, error, item.attempts));
            }
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error while processing {}", batchId, item.item.id(), e);
            ErrorRecord error = ErrorRecord.of(ErrorKind.BACKEND_FAULT, "Internal error: " + e.getMessage(), false);
            complete(item, new ItemResult.Failed(item.item, error, item.attempts));
        }
    }

    private void complete(ItemProgress item, ItemResult result) {
        if (!slots.compareAndSet(item.position, null, result)) {
            return;
        }
        item.state = result.state();
        completionOrder.add(result);
        done.countDown();
        notifyListener(() -> listener.onItemCompleted(result));
        if (remaining.decrementAndGet() == 0) {
            finish();
        }
    }

    private void finish() {
        workers.shutdown();
        BatchResult result = aggregator.aggregate(items, List.copyOf(completionOrder));
        notifyListener(() -> listener.onBatchCompleted(result));
    }

    private void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("[{}] Batch listener failed: {}", batchId, e.getMessage());
        }
    }

    private static final class ItemProgress {
        private final int position;
        private final WorkItem item;
        private final List<Attempt> attempts = new CopyOnWriteArrayList<>();
        private volatile ItemState state = ItemState.PENDING;

        private ItemProgress(int position, WorkItem item) {
            this.position = position;
            this.item = item;
        }
    }
}
