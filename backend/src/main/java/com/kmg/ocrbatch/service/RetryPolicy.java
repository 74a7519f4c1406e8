package com.kmg.ocrbatch.service;

import com.kmg.ocrbatch.config.RetrySettings;
import com.kmg.ocrbatch.model.ErrorKind;
import com.kmg.ocrbatch.model.ErrorRecord;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff retry policy.
 *
 * <pre>
 * delay = min(baseDelay * 2^(attemptNumber-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p>With baseDelay=1s and maxDelay=30s the waits after attempts 1, 2, 3 are 1s, 2s, 4s; from attempt 6 on
 * the cap applies. A {@link ErrorKind#RATE_LIMITED} failure carrying a larger retry-after hint waits for
 * the hint instead.</p>
 *
 * <p>Decisions depend only on the error and the attempt number; nothing here sleeps.</p>
 */
public class RetryPolicy {
    private final RetrySettings settings;
    private final DoubleSupplier random;

    public RetryPolicy(RetrySettings settings) {
        this(settings, Math::random);
    }

    public RetryPolicy(RetrySettings settings, DoubleSupplier random) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @param error         failure of the attempt that just finished
     * @param attemptNumber number of that attempt, starting at 1
     */
    public RetryDecision decide(ErrorRecord error, int attemptNumber) {
        if (attemptNumber <= 0) {
            throw new IllegalArgumentException("attemptNumber must be positive (current: " + attemptNumber + ")");
        }
        if (!error.retryable() || attemptNumber >= settings.maxAttempts()) {
            return RetryDecision.giveUp();
        }

        Duration delay = backoff(attemptNumber);
        if (error.kind() == ErrorKind.RATE_LIMITED && error.retryAfter() != null
                && error.retryAfter().compareTo(delay) > 0) {
            delay = error.retryAfter();
        }
        return RetryDecision.retry(delay);
    }

    public Duration backoff(int attemptNumber) {
        if (attemptNumber <= 0) {
            throw new IllegalArgumentException("attemptNumber must be positive (current: " + attemptNumber + ")");
        }
        long baseMs = settings.baseDelay().toMillis();
        long maxMs = settings.maxDelay().toMillis();

        // shift bounded so base * 2^shift cannot overflow before the cap is applied
        int shift = Math.min(attemptNumber - 1, 62);
        long exponential = baseMs > (maxMs >> shift) ? maxMs : Math.min(baseMs << shift, maxMs);

        long jitter = (long) (exponential * settings.jitterFactor() * random.getAsDouble());
        return Duration.ofMillis(Math.min(exponential + jitter, maxMs));
    }

    public int maxAttempts() {
        return settings.maxAttempts();
    }
}
