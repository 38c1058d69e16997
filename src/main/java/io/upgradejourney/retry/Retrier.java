package io.upgradejourney.retry;

import io.upgradejourney.exceptions.WaitTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Bounded retry-with-backoff. Converts open-ended waits into a deterministic
 * {@link WaitTimeoutException} once the policy is exhausted.
 * Exceptions thrown by an attempt are not retried; they propagate to the caller.
 */
@Slf4j
public class Retrier {

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public Retrier(RetryPolicy policy, Sleeper sleeper) {
        policy.validate();
        this.policy = policy;
        this.sleeper = sleeper;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * Poll {@code condition} until it returns true.
     *
     * @param operation name used in logs and in the timeout error
     * @throws WaitTimeoutException when every attempt returned false
     */
    public void waitUntil(String operation, BooleanSupplier condition) {
        Optional<Boolean> result = retryUntilPresent(operation,
            () -> condition.getAsBoolean() ? Optional.of(Boolean.TRUE) : Optional.empty());
        if (result.isEmpty()) {
            throw new WaitTimeoutException(operation,
                String.format("%s did not succeed after %d attempts", operation, policy.getMaxAttempts()));
        }
    }

    /**
     * Call {@code attempt} until it yields a value, returning empty once attempts are exhausted.
     * Unlike {@link #waitUntil}, exhaustion is not an exception.
     */
    public <T> Optional<T> retryUntilPresent(String operation, Supplier<Optional<T>> attempt) {
        for (int i = 1; i <= policy.getMaxAttempts(); i++) {
            Optional<T> value = attempt.get();
            if (value.isPresent()) {
                if (i > 1) {
                    log.debug("{} succeeded on attempt {}/{}", operation, i, policy.getMaxAttempts());
                }
                return value;
            }

            if (i < policy.getMaxAttempts()) {
                Duration delay = policy.delayAfterAttempt(i);
                log.debug("{} not ready (attempt {}/{}), retrying in {}ms",
                    operation, i, policy.getMaxAttempts(), delay.toMillis());
                pause(operation, delay);
            }
        }

        log.warn("{} gave up after {} attempts", operation, policy.getMaxAttempts());
        return Optional.empty();
    }

    private void pause(String operation, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WaitTimeoutException(operation, operation + " interrupted while waiting", e);
        }
    }
}
