package io.upgradejourney.models;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable snapshot of the cluster: a fixed set of nodes keyed by index plus the
 * network they share. The current version is the one most recently applied.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ClusterState {

    private final String networkName;
    private final SortedMap<Integer, ClusterNode> nodes;
    private final String currentVersion;

    private ClusterState(String networkName, SortedMap<Integer, ClusterNode> nodes, String currentVersion) {
        this.networkName = networkName;
        this.nodes = Collections.unmodifiableSortedMap(new TreeMap<>(nodes));
        this.currentVersion = currentVersion;
    }

    /**
     * Cluster of {@code size} stopped nodes with no version applied yet.
     */
    public static ClusterState initial(int size, String networkName) {
        if (size < 1) {
            throw new IllegalArgumentException("Cluster size must be at least 1");
        }
        SortedMap<Integer, ClusterNode> nodes = new TreeMap<>();
        for (int i = 0; i < size; i++) {
            nodes.put(i, ClusterNode.stopped(i));
        }
        return new ClusterState(networkName, nodes, null);
    }

    public int size() {
        return nodes.size();
    }

    public ClusterNode node(int index) {
        ClusterNode node = nodes.get(index);
        if (node == null) {
            throw new IllegalArgumentException("No node with index " + index + " in cluster of size " + size());
        }
        return node;
    }

    /**
     * Nodes in ascending index order.
     */
    public List<ClusterNode> orderedNodes() {
        return new ArrayList<>(nodes.values());
    }

    public ClusterState withNode(ClusterNode node) {
        if (!nodes.containsKey(node.getIndex())) {
            throw new IllegalArgumentException("Cannot add node " + node.getIndex() + " to a cluster of fixed size " + size());
        }
        SortedMap<Integer, ClusterNode> updated = new TreeMap<>(nodes);
        updated.put(node.getIndex(), node);
        return new ClusterState(networkName, updated, currentVersion);
    }

    public ClusterState withCurrentVersion(String version) {
        return new ClusterState(networkName, nodes, version);
    }

    /**
     * True when every node is running the given version.
     */
    public boolean isUniformlyAt(String version) {
        for (Map.Entry<Integer, ClusterNode> entry : nodes.entrySet()) {
            ClusterNode node = entry.getValue();
            if (!node.isRunning() || !version.equals(node.getVersion())) {
                return false;
            }
        }
        return true;
    }
}
