package io.upgradejourney.exceptions;

import io.upgradejourney.enums.ErrorKind;

/**
 * Thrown when a bounded wait runs out of attempts.
 */
public class WaitTimeoutException extends HarnessException {

    private final String operation;

    public WaitTimeoutException(String operation, String message) {
        super(ErrorKind.TIMEOUT, message);
        this.operation = operation;
    }

    public WaitTimeoutException(String operation, String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
