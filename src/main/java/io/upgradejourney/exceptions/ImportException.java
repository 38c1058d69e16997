package io.upgradejourney.exceptions;

import io.upgradejourney.enums.ErrorKind;

/**
 * Thrown when the service rejects a version-tagged write.
 */
public class ImportException extends HarnessException {

    public ImportException(String message, Throwable cause) {
        super(ErrorKind.IMPORT, message, cause);
    }
}
