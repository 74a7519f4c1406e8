package com.kmg.ocrbatch.service;

import java.time.Duration;

/**
 * Runs a task once a retry delay has elapsed, without holding a worker while waiting.
 */
public interface RetryTimer {

    void schedule(Runnable task, Duration delay);
}
