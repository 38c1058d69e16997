package io.upgradejourney.cluster;

import io.upgradejourney.enums.NodeState;
import io.upgradejourney.exceptions.RollingUpdateException;
import io.upgradejourney.exceptions.WaitTimeoutException;
import io.upgradejourney.metrics.MetricsProvider;
import io.upgradejourney.models.ClusterNode;
import io.upgradejourney.models.ClusterState;
import io.upgradejourney.retry.Retrier;
import lombok.extern.slf4j.Slf4j;

import static io.upgradejourney.metrics.MetricsConstants.ROLLING_UPDATE_PROGRESS_PERCENTAGE_METRIC_NAME;
import static io.upgradejourney.metrics.MetricsUtils.buildVersionTags;

/**
 * Replaces the nodes of a cluster one at a time, in ascending index order.
 * Each node is stopped, restarted on the target version and must rejoin a healthy
 * cluster before the next node is touched.
 *
 * <p>The transition is {@code (ClusterState, targetVersion) -> ClusterState}. On failure the
 * thrown {@link RollingUpdateException} holds the state reached so far; nothing is rolled back.
 */
@Slf4j
public class RollingUpdateStrategy {
    private final NodeRuntime runtime;
    private final Retrier readinessRetrier;
    private final MetricsProvider metricsProvider;

    public RollingUpdateStrategy(NodeRuntime runtime, Retrier readinessRetrier, MetricsProvider metricsProvider) {
        this.runtime = runtime;
        this.readinessRetrier = readinessRetrier;
        this.metricsProvider = metricsProvider;
    }

    public ClusterState apply(ClusterState cluster, String targetVersion) {
        for (ClusterNode node : cluster.orderedNodes()) {
            if (!node.isRunning()) {
                throw new IllegalStateException("Rolling update requires a running cluster, node "
                    + node.getIndex() + " is " + node.getState());
            }
        }

        log.info("Starting rolling update of {} nodes: {} -> {}", cluster.size(), cluster.getCurrentVersion(), targetVersion);
        ClusterState state = cluster;
        int updated = 0;

        for (ClusterNode node : cluster.orderedNodes()) {
            int index = node.getIndex();
            log.info("Replacing node {} ({} -> {})", index, node.getVersion(), targetVersion);

            try {
                runtime.stopNode(index);
            } catch (Exception e) {
                log.error("Failed to stop node {}: {}", index, e.getMessage(), e);
                throw new RollingUpdateException(index, state,
                    String.format("node %d could not be stopped: %s", index, e.getMessage()), e);
            }
            state = state.withNode(node.withState(NodeState.STOPPED));

            try {
                runtime.startNode(index, targetVersion);
            } catch (Exception e) {
                log.error("Failed to start node {} on {}: {}", index, targetVersion, e.getMessage(), e);
                throw new RollingUpdateException(index, state,
                    String.format("node %d could not be started on %s: %s", index, targetVersion, e.getMessage()), e);
            }

            try {
                readinessRetrier.waitUntil("node " + index + " rejoin", () -> hasRejoined(index, cluster.size()));
            } catch (WaitTimeoutException e) {
                log.error("Node {} did not rejoin the cluster on {}", index, targetVersion);
                throw new RollingUpdateException(index, state,
                    String.format("node %d did not rejoin the cluster on %s: %s", index, targetVersion, e.getMessage()), e);
            }

            state = state.withNode(node.withVersion(targetVersion).withState(NodeState.RUNNING))
                .withCurrentVersion(targetVersion);
            updated++;
            log.info("Node {} rejoined on {} ({}/{} nodes updated)", index, targetVersion, updated, cluster.size());
            metricsProvider.gauge(
                ROLLING_UPDATE_PROGRESS_PERCENTAGE_METRIC_NAME,
                updated * 100.0 / cluster.size(),
                buildVersionTags(targetVersion)
            );
        }

        log.info("Completed rolling update to {}", targetVersion);
        return state;
    }

    private boolean hasRejoined(int index, int expectedNodes) {
        try {
            return runtime.isNodeReady(index) && runtime.isClusterHealthy(expectedNodes);
        } catch (Exception e) {
            log.debug("Health probe for node {} failed: {}", index, e.getMessage());
            return false;
        }
    }
}
