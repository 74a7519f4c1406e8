package com.kmg.ocrbatch.service;

import java.time.Duration;
import java.util.Objects;

public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    static RetryDecision retry(Duration delay) {
        return new Retry(delay);
    }

    static RetryDecision giveUp() {
        return GiveUp.INSTANCE;
    }

    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must be non-negative (current: " + delay + ")");
            }
        }
    }

    final class GiveUp implements RetryDecision {
        private static final GiveUp INSTANCE = new GiveUp();

        private GiveUp() {
        }

        @Override
        public String toString() {
            return "GiveUp";
        }
    }
}
