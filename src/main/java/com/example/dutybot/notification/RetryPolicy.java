package com.example.dutybot.notification;

import java.time.Duration;

/**
 * Exponential backoff for notification delivery.
 *
 * <pre>
 * RetryPolicy policy = sinkConfig.retryPolicy();
 * while (true) {
 *     try {
 *         deliver();
 *         break;
 *     } catch (DispatchException e) {
 *         Duration delay = policy.getNextDelay();
 *         policy.recordFailure();
 *         if (!e.isTransient() || !policy.shouldRetry()) break;
 *         Thread.sleep(delay.toMillis());
 *     }
 * }
 * </pre>
 *
 * Not thread-safe; create one per delivery.
 */
public class RetryPolicy {

    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;

    private RetryPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true while fewer than {@code maxAttempts} attempts have failed
     */
    public boolean shouldRetry() {
        return attemptCount < maxAttempts;
    }

    public Duration getNextDelay() {
        return currentDelay;
    }

    public void recordFailure() {
        attemptCount++;
        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private int maxAttempts = 5;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be >= 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("Max attempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryPolicy build() {
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("Max delay must be >= initial delay");
            }
            return new RetryPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
