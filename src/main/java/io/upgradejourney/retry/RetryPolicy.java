package io.upgradejourney.retry;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Bounds for a polling loop: how many attempts and how long to wait between them.
 * The interval grows by {@code backoffMultiplier} after each failed attempt, capped at {@code maxInterval}.
 */
@Value
@Builder
public class RetryPolicy {

    int maxAttempts;
    Duration interval;
    @Builder.Default
    double backoffMultiplier = 1.0;
    Duration maxInterval;

    public static RetryPolicy fixed(int maxAttempts, Duration interval) {
        return RetryPolicy.builder()
            .maxAttempts(maxAttempts)
            .interval(interval)
            .maxInterval(interval)
            .build();
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration delayAfterAttempt(int attempt) {
        double factor = Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
        long millis = (long) (interval.toMillis() * factor);
        long cap = maxInterval != null ? maxInterval.toMillis() : Long.MAX_VALUE;
        return Duration.ofMillis(Math.min(millis, cap));
    }

    /**
     * Sum of all delays a fully exhausted wait will sleep.
     */
    public Duration totalBudget() {
        Duration total = Duration.ZERO;
        for (int attempt = 1; attempt < maxAttempts; attempt++) {
            total = total.plus(delayAfterAttempt(attempt));
        }
        return total;
    }

    public void validate() {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be non-negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0, got " + backoffMultiplier);
        }
    }
}
