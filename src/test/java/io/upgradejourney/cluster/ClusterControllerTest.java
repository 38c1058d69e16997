package io.upgradejourney.cluster;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.upgradejourney.enums.NodeState;
import io.upgradejourney.exceptions.ClusterStartException;
import io.upgradejourney.exceptions.RollingUpdateException;
import io.upgradejourney.exceptions.WaitTimeoutException;
import io.upgradejourney.metrics.MetricsProvider;
import io.upgradejourney.models.ClusterState;
import io.upgradejourney.retry.Retrier;
import io.upgradejourney.retry.RetryPolicy;
import io.upgradejourney.support.FakeNodeRuntime;
import io.upgradejourney.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ClusterController against an in-memory node runtime.
 */
class ClusterControllerTest {

    private FakeNodeRuntime runtime;
    private RecordingSleeper sleeper;
    private ClusterController controller;

    @BeforeEach
    void setUp() {
        runtime = new FakeNodeRuntime();
        sleeper = new RecordingSleeper();
        Retrier retrier = new Retrier(RetryPolicy.fixed(5, Duration.ofSeconds(1)), sleeper);
        MetricsProvider metricsProvider = new MetricsProvider(new SimpleMeterRegistry(), "test-run");
        RollingUpdateStrategy strategy = new RollingUpdateStrategy(runtime, retrier, metricsProvider);
        controller = new ClusterController(runtime, strategy, retrier, 3);
    }

    @Test
    void testStartAllNodesBringsUpEveryNodeOnVersion() {
        controller.startAllNodes("1.0");

        ClusterState state = controller.getState();
        assertThat(state.getNetworkName()).isEqualTo("test-network");
        assertThat(state.getCurrentVersion()).isEqualTo("1.0");
        assertThat(state.isUniformlyAt("1.0")).isTrue();
        assertThat(runtime.getEvents()).containsExactly("network", "start 0 1.0", "start 1 1.0", "start 2 1.0");
    }

    @Test
    void testStartAllNodesWaitsForReadiness() {
        runtime.slowStart(2);

        controller.startAllNodes("1.0");

        assertThat(sleeper.getSleeps()).hasSize(2);
        assertThat(controller.getState().isUniformlyAt("1.0")).isTrue();
    }

    @Test
    void testStartAllNodesFailsWhenANodeNeverBecomesReady() {
        runtime.neverReady(1);

        assertThatThrownBy(() -> controller.startAllNodes("1.0"))
            .isInstanceOf(ClusterStartException.class)
            .hasMessageContaining("did not become ready on 1.0")
            .hasCauseInstanceOf(WaitTimeoutException.class);

        assertThat(sleeper.getSleeps()).hasSize(4);
        assertThat(controller.getState().getCurrentVersion()).isNull();
    }

    @Test
    void testStartAllNodesTwiceIsRejected() {
        controller.startAllNodes("1.0");

        assertThatThrownBy(() -> controller.startAllNodes("1.0"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testRollingUpdateReplacesNodesOneAtATimeInIndexOrder() {
        controller.startAllNodes("1.0");
        runtime.getEvents().clear();

        controller.rollingUpdate("1.1");

        assertThat(runtime.getEvents()).containsExactly(
            "stop 0", "start 0 1.1",
            "stop 1", "start 1 1.1",
            "stop 2", "start 2 1.1");
        assertThat(controller.getState().isUniformlyAt("1.1")).isTrue();
        assertThat(controller.getState().getCurrentVersion()).isEqualTo("1.1");
    }

    @Test
    void testRollingUpdateFailureNamesNodeAndStopsThere() {
        controller.startAllNodes("1.0");
        runtime.getEvents().clear();
        runtime.neverReady(1);

        assertThatThrownBy(() -> controller.rollingUpdate("1.1"))
            .isInstanceOf(RollingUpdateException.class)
            .hasMessageContaining("node 1 did not rejoin")
            .satisfies(e -> assertThat(((RollingUpdateException) e).getNodeIndex()).isEqualTo(1));

        // node 2 was never touched
        assertThat(runtime.getEvents()).containsExactly("stop 0", "start 0 1.1", "stop 1", "start 1 1.1");

        ClusterState partial = controller.getState();
        assertThat(partial.node(0).getVersion()).isEqualTo("1.1");
        assertThat(partial.node(0).getState()).isEqualTo(NodeState.RUNNING);
        assertThat(partial.node(1).getVersion()).isEqualTo("1.0");
        assertThat(partial.node(1).getState()).isEqualTo(NodeState.STOPPED);
        assertThat(partial.node(2).getVersion()).isEqualTo("1.0");
        assertThat(partial.node(2).getState()).isEqualTo(NodeState.RUNNING);
        assertThat(partial.isUniformlyAt("1.1")).isFalse();
    }

    @Test
    void testRollingUpdateBeforeStartIsRejected() {
        assertThatThrownBy(() -> controller.rollingUpdate("1.1"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("running cluster");
        assertThat(runtime.getEvents()).isEmpty();
    }

    @Test
    void testCloseStopsRuntimeAndMarksNodesStopped() throws Exception {
        controller.startAllNodes("1.0");

        controller.close();

        assertThat(runtime.isClosed()).isTrue();
        assertThat(controller.getState().orderedNodes())
            .allMatch(node -> node.getState() == NodeState.STOPPED);
        assertThat(runtime.getRunning()).isEmpty();
    }
}
