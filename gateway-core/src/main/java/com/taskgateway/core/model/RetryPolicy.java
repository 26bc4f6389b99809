package com.taskgateway.core.model;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Configuration for retry behavior, shared by the API client (per call) and the
 * dispatcher (per task).
 * 
 * Invariants:
 * - maxAttempts >= 1
 * - initialBackoff >= 0
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 * - maxElapsed is null (unbounded) or positive
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Duration maxElapsed
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("backoff bounds are inconsistent");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
        if (maxElapsed != null && (maxElapsed.isZero() || maxElapsed.isNegative())) {
            throw new IllegalArgumentException("maxElapsed must be positive");
        }
    }

    /**
     * Task-level default: 3 attempts, backoff starting at 60s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(
            3,
            Duration.ofSeconds(60),
            Duration.ofMinutes(10),
            2.0,
            0.1,
            null
        );
    }

    /**
     * Call-level default: 3 attempts within 120s, backoff starting at 1s.
     */
    public static RetryPolicy callDefault() {
        return new RetryPolicy(
            3,
            Duration.ofSeconds(1),
            Duration.ofSeconds(30),
            2.0,
            0.2,
            Duration.ofSeconds(120)
        );
    }

    /**
     * No retry policy: single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(
            1,
            Duration.ZERO,
            Duration.ZERO,
            1.0,
            0.0,
            null
        );
    }

    /**
     * Compute the backoff duration after a given attempt.
     * 
     * @param attemptNumber 1-indexed attempt number that just failed
     * @return Duration to wait before the next attempt
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }
        
        // Base backoff: initialBackoff * (multiplier ^ (attempt - 1))
        double baseBackoffMs = initialBackoff.toMillis() * 
            Math.pow(backoffMultiplier, attemptNumber - 1);
        
        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());
        
        // Apply jitter: backoff * (1 - jitter + random(0, 2*jitter))
        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange + 
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;
        
        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    /**
     * Check if the given error class should trigger another attempt.
     */
    public boolean shouldRetry(ErrorClass errorClass, int attemptsMade) {
        return errorClass.isRetryable() && hasMoreAttempts(attemptsMade);
    }

    /**
     * Check if more attempts are available.
     * 
     * @param attemptsMade Attempts already made
     */
    public boolean hasMoreAttempts(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Check if waiting {@code nextBackoff} keeps the call within its elapsed-time budget.
     */
    public boolean withinElapsedBudget(Duration elapsed, Duration nextBackoff) {
        return maxElapsed == null || elapsed.plus(nextBackoff).compareTo(maxElapsed) < 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;
        private Duration maxElapsed;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder maxElapsed(Duration maxElapsed) {
            this.maxElapsed = maxElapsed;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(
                maxAttempts, initialBackoff, maxBackoff,
                backoffMultiplier, jitterFactor, maxElapsed
            );
        }
    }
}
