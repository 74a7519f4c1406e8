package com.kmg.ocrbatch.service;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class ScheduledRetryTimer implements RetryTimer, AutoCloseable {
    private final ScheduledExecutorService scheduler;

    public ScheduledRetryTimer() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ocr-retry-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void schedule(Runnable task, Duration delay) {
        if (delay.isZero()) {
            scheduler.execute(task);
            return;
        }
        scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
