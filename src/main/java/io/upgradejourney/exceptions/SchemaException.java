package io.upgradejourney.exceptions;

import io.upgradejourney.enums.ErrorKind;

/**
 * Thrown when the service rejects creation of the test class.
 */
public class SchemaException extends HarnessException {

    public SchemaException(String message, Throwable cause) {
        super(ErrorKind.SCHEMA, message, cause);
    }
}
