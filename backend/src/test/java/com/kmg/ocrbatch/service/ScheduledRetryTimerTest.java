package com.kmg.ocrbatch.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduledRetryTimerTest {

    @Test
    void schedule_RunsTaskAfterDelayOffTheCallingThread() throws InterruptedException {
        try (ScheduledRetryTimer timer = new ScheduledRetryTimer()) {
            // given
            CountDownLatch ran = new CountDownLatch(1);
            String[] threadName = new String[1];
            long start = System.nanoTime();

            // when
            timer.schedule(() -> {
                threadName[0] = Thread.currentThread().getName();
                ran.countDown();
            }, Duration.ofMillis(50));

            // then
            assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(50);
            assertThat(threadName[0]).isEqualTo("ocr-retry-timer");
        }
    }
}
