package io.upgradejourney.exceptions;

import io.upgradejourney.enums.ErrorKind;

/**
 * Thrown when the service-computed object count disagrees with the number of writes.
 */
public class AggregateMismatchException extends HarnessException {

    private final long expected;
    private final long actual;

    public AggregateMismatchException(long expected, long actual) {
        super(ErrorKind.AGGREGATE_MISMATCH,
            String.format("aggregation: wanted %d, got %d", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public long getExpected() {
        return expected;
    }

    public long getActual() {
        return actual;
    }
}
