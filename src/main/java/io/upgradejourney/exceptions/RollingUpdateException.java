package io.upgradejourney.exceptions;

import io.upgradejourney.enums.ErrorKind;
import io.upgradejourney.models.ClusterState;

/**
 * Thrown when a node fails to rejoin the cluster during a rolling update.
 * Carries the cluster state as it was when the update stopped, so mixed-version
 * leftovers can be inspected.
 */
public class RollingUpdateException extends HarnessException {

    private final int nodeIndex;
    private final ClusterState partialState;

    public RollingUpdateException(int nodeIndex, ClusterState partialState, String message, Throwable cause) {
        super(ErrorKind.ROLLING_UPDATE, message, cause);
        this.nodeIndex = nodeIndex;
        this.partialState = partialState;
    }

    public int getNodeIndex() {
        return nodeIndex;
    }

    public ClusterState getPartialState() {
        return partialState;
    }
}
