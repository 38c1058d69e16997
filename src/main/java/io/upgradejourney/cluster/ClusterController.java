package io.upgradejourney.cluster;

import io.upgradejourney.enums.NodeState;
import io.upgradejourney.exceptions.ClusterStartException;
import io.upgradejourney.exceptions.RollingUpdateException;
import io.upgradejourney.exceptions.WaitTimeoutException;
import io.upgradejourney.models.ClusterNode;
import io.upgradejourney.models.ClusterState;
import io.upgradejourney.retry.Retrier;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the fixed set of nodes under test and the network they share.
 * Tracks the version and running state of each node as lifecycle operations complete.
 */
@Slf4j
public class ClusterController implements AutoCloseable {

    private final NodeRuntime runtime;
    private final RollingUpdateStrategy rollingUpdateStrategy;
    private final Retrier readinessRetrier;
    private ClusterState state;

    public ClusterController(NodeRuntime runtime,
                             RollingUpdateStrategy rollingUpdateStrategy,
                             Retrier readinessRetrier,
                             int clusterSize) {
        this.runtime = runtime;
        this.rollingUpdateStrategy = rollingUpdateStrategy;
        this.readinessRetrier = readinessRetrier;
        this.state = ClusterState.initial(clusterSize, null);
    }

    public ClusterState getState() {
        return state;
    }

    /**
     * Bring up every node on {@code version} and block until the cluster reports ready.
     *
     * @throws ClusterStartException if a node cannot be started or readiness is not reached in time
     */
    public void startAllNodes(String version) {
        for (ClusterNode node : state.orderedNodes()) {
            if (node.isRunning()) {
                throw new IllegalStateException("Cluster already started, node " + node.getIndex() + " is running");
            }
        }

        log.info("Starting {} nodes on version {}", state.size(), version);
        String networkName;
        try {
            networkName = runtime.startNetwork();
        } catch (Exception e) {
            log.error("Failed to create cluster network: {}", e.getMessage(), e);
            throw new ClusterStartException("cluster network could not be created: " + e.getMessage(), e);
        }

        for (ClusterNode node : state.orderedNodes()) {
            try {
                runtime.startNode(node.getIndex(), version);
            } catch (Exception e) {
                log.error("Failed to start node {} on {}: {}", node.getIndex(), version, e.getMessage(), e);
                throw new ClusterStartException(
                    String.format("node %d could not be started on %s: %s", node.getIndex(), version, e.getMessage()), e);
            }
        }

        log.info("Waiting up to {}ms for {} nodes to become ready on {}",
            readinessRetrier.getPolicy().totalBudget().toMillis(), state.size(), version);
        try {
            readinessRetrier.waitUntil("cluster start", this::allNodesReady);
        } catch (WaitTimeoutException e) {
            log.error("Cluster did not become ready on {}", version);
            throw new ClusterStartException(
                String.format("cluster of %d nodes did not become ready on %s: %s", state.size(), version, e.getMessage()), e);
        }

        ClusterState started = ClusterState.initial(state.size(), networkName);
        for (ClusterNode node : started.orderedNodes()) {
            started = started.withNode(node.withVersion(version).withState(NodeState.RUNNING));
        }
        state = started.withCurrentVersion(version);
        log.info("All {} nodes ready on {} (network: {})", state.size(), version, networkName);
    }

    /**
     * Upgrade the nodes one at a time to {@code targetVersion}.
     * On failure the recorded state is left at the partial, mixed-version point.
     *
     * @throws RollingUpdateException naming the node that did not rejoin
     */
    public void rollingUpdate(String targetVersion) {
        try {
            state = rollingUpdateStrategy.apply(state, targetVersion);
        } catch (RollingUpdateException e) {
            state = e.getPartialState();
            throw e;
        }
    }

    private boolean allNodesReady() {
        try {
            for (ClusterNode node : state.orderedNodes()) {
                if (!runtime.isNodeReady(node.getIndex())) {
                    log.debug("Node {} not ready yet", node.getIndex());
                    return false;
                }
            }
            return runtime.isClusterHealthy(state.size());
        } catch (Exception e) {
            log.debug("Readiness probe failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() throws Exception {
        log.info("Tearing down cluster of {} nodes", state.size());
        runtime.close();
        ClusterState stopped = state;
        for (ClusterNode node : state.orderedNodes()) {
            stopped = stopped.withNode(node.withState(NodeState.STOPPED));
        }
        state = stopped;
    }
}
