package io.upgradejourney.exceptions;

import io.upgradejourney.enums.ErrorKind;

/**
 * Thrown when the configured version sequence cannot drive a run.
 */
public class SequenceException extends HarnessException {

    public SequenceException(String message) {
        super(ErrorKind.SEQUENCE, message);
    }
}
