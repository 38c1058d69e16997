package io.upgradejourney.exceptions;

import io.upgradejourney.enums.ErrorKind;

/**
 * Base class for every failure that terminates an upgrade journey run.
 * Each subclass maps to exactly one {@link ErrorKind}.
 */
public class HarnessException extends RuntimeException {

    private final ErrorKind kind;

    public HarnessException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public HarnessException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
