package io.upgradejourney.models;

import io.upgradejourney.enums.NodeState;
import lombok.Value;
import lombok.With;

/**
 * A single node of the cluster under test.
 * Instances are immutable; lifecycle operations produce new instances.
 */
@Value
public class ClusterNode {

    int index;

    @With
    String version;

    @With
    NodeState state;

    public static ClusterNode stopped(int index) {
        return new ClusterNode(index, null, NodeState.STOPPED);
    }

    public boolean isRunning() {
        return state == NodeState.RUNNING;
    }
}
