package in.elpyfi.infrastructure.common;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Retry schedule for store connection and schema revalidation.
 *
 * Two shapes:
 * - Exponential: initial delay × multiplier per failure, capped at max delay,
 *   exhausted after max attempts (connection probing at startup)
 * - Ladder: fixed steps, holding at the last one, never exhausted
 *   (schema monitor: 30s, 60s, 5min, 10min, 10min, ...)
 *
 * Usage:
 * <pre>
 * BackoffPolicy policy = BackoffPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .multiplier(2.0)
 *     .maxAttempts(3)
 *     .build();
 *
 * while (policy.shouldRetry()) {
 *     try {
 *         probe();
 *         policy.recordSuccess();
 *         break;
 *     } catch (SQLException e) {
 *         policy.recordFailure();
 *         Thread.sleep(policy.getNextDelay().toMillis());
 *     }
 * }
 * </pre>
 */
public class BackoffPolicy {

    private final List<Duration> ladder;   // null for exponential
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastAttemptTime;

    private BackoffPolicy(List<Duration> ladder, Duration initialDelay, Duration maxDelay,
                          double multiplier, int maxAttempts) {
        this.ladder = ladder;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true while attempts remain (always true for a ladder)
     */
    public synchronized boolean shouldRetry() {
        return attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized Duration getNextDelay() {
        if (ladder != null) {
            return ladder.get(Math.min(attemptCount, ladder.size() - 1));
        }
        return currentDelay;
    }

    /**
     * Record a failed attempt and advance the schedule.
     */
    public synchronized void recordFailure() {
        if (attemptCount < Integer.MAX_VALUE) {
            attemptCount++;
        }
        lastAttemptTime = Instant.now();

        if (ladder == null) {
            long next = (long) (currentDelay.toMillis() * multiplier);
            currentDelay = Duration.ofMillis(Math.min(next, maxDelay.toMillis()));
        }
    }

    /**
     * Record a success. Restarts the schedule from its first step.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastAttemptTime = null;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized boolean isExhausted() {
        return attemptCount >= maxAttempts;
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fixed steps, holding at the last one. Never exhausted.
     */
    public static BackoffPolicy ladder(Duration... steps) {
        if (steps.length == 0) {
            throw new IllegalArgumentException("Ladder needs at least one step");
        }
        for (Duration step : steps) {
            if (step.isNegative() || step.isZero()) {
                throw new IllegalArgumentException("Ladder steps must be positive");
            }
        }
        return new BackoffPolicy(List.of(steps), steps[0], steps[steps.length - 1], 1.0, Integer.MAX_VALUE);
    }

    /**
     * Schema monitor schedule: 30s, 60s, 5min, then every 10min.
     */
    public static BackoffPolicy forSchemaMonitor() {
        return ladder(
            Duration.ofSeconds(30),
            Duration.ofSeconds(60),
            Duration.ofMinutes(5),
            Duration.ofMinutes(10)
        );
    }

    /**
     * Startup connection probing.
     */
    public static BackoffPolicy forStoreConnect(int attempts, Duration initialDelay) {
        Duration cap = Duration.ofSeconds(30);
        return builder()
            .initialDelay(initialDelay)
            .maxDelay(initialDelay.compareTo(cap) > 0 ? initialDelay : cap)
            .multiplier(2.0)
            .maxAttempts(attempts)
            .build();
    }

    /**
     * Builder for the exponential shape.
     */
    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private int maxAttempts = 3;

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
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public BackoffPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new BackoffPolicy(null, initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
