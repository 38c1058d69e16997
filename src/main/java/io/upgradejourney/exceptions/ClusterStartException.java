package io.upgradejourney.exceptions;

import io.upgradejourney.enums.ErrorKind;

/**
 * Thrown when the initial cluster bootstrap does not reach a ready state.
 */
public class ClusterStartException extends HarnessException {

    public ClusterStartException(String message) {
        super(ErrorKind.CLUSTER_START, message);
    }

    public ClusterStartException(String message, Throwable cause) {
        super(ErrorKind.CLUSTER_START, message, cause);
    }
}
