package io.upgradejourney.exceptions;

import io.upgradejourney.enums.ErrorKind;

/**
 * Thrown when a record written at an earlier step can no longer be found, or comes back changed.
 */
public class DataLossException extends HarnessException {

    private final String version;

    public DataLossException(String version, String message) {
        super(ErrorKind.DATA_LOSS, message);
        this.version = version;
    }

    public DataLossException(String version, String message, Throwable cause) {
        super(ErrorKind.DATA_LOSS, message, cause);
        this.version = version;
    }

    public String getVersion() {
        return version;
    }
}
