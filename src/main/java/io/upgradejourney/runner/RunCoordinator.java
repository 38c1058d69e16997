package io.upgradejourney.runner;

import io.upgradejourney.cluster.ClusterController;
import io.upgradejourney.enums.ErrorKind;
import io.upgradejourney.enums.RunPhase;
import io.upgradejourney.enums.RunStatus;
import io.upgradejourney.exceptions.HarnessException;
import io.upgradejourney.exceptions.SequenceException;
import io.upgradejourney.metrics.MetricsProvider;
import io.upgradejourney.models.RunResult;
import io.upgradejourney.models.RunState;
import io.upgradejourney.models.VersionSequence;
import io.upgradejourney.verification.ConsistencyVerifier;
import io.upgradejourney.workload.WorkloadDriver;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.upgradejourney.metrics.MetricsConstants.ERROR_KIND_TAG;
import static io.upgradejourney.metrics.MetricsConstants.STEP_DURATION_METRIC_NAME;
import static io.upgradejourney.metrics.MetricsConstants.STEP_FAILURES_METRIC_NAME;
import static io.upgradejourney.metrics.MetricsUtils.buildStepTags;

/**
 * Drives the upgrade loop over a version sequence.
 *
 * <p>Step 0 bootstraps: start all nodes, create the schema, import, verify.
 * Every later step upgrades: rolling update to the step's version, import, verify.
 * The first failure ends the run; nothing after a broken step is trusted.
 */
@Slf4j
public class RunCoordinator {

    private final ClusterController cluster;
    private final WorkloadDriver workload;
    private final ConsistencyVerifier verifier;
    private final MetricsProvider metricsProvider;

    public RunCoordinator(ClusterController cluster,
                          WorkloadDriver workload,
                          ConsistencyVerifier verifier,
                          MetricsProvider metricsProvider) {
        this.cluster = cluster;
        this.workload = workload;
        this.verifier = verifier;
        this.metricsProvider = metricsProvider;
    }

    /**
     * Validate {@code versions} and run them. An empty list fails before any cluster operation.
     */
    public RunResult run(List<String> versions) {
        VersionSequence sequence;
        try {
            sequence = VersionSequence.of(versions);
        } catch (SequenceException e) {
            log.error("Rejecting run: {}", e.getMessage());
            return failure(0, 0, null, null, e);
        }
        return run(sequence);
    }

    public RunResult run(VersionSequence sequence) {
        log.info("Starting upgrade journey from {} over {} versions: {}",
            sequence.bootstrapVersion(), sequence.size(), sequence);
        RunState state = RunState.initial();

        for (int i = 0; i < sequence.size(); i++) {
            String targetVersion = sequence.get(i);
            String currentVersion = cluster.getState().getCurrentVersion();
            RunPhase phase = RunPhase.forStep(i);
            state = state.atStep(i);

            log.info("[Step {}/{}] {} {} -> {}", i, sequence.size(), phase, currentVersion, targetVersion);
            long startNanos = System.nanoTime();
            try {
                if (phase == RunPhase.BOOTSTRAPPING) {
                    cluster.startAllNodes(targetVersion);
                    workload.createSchema();
                } else {
                    cluster.rollingUpdate(targetVersion);
                }
                state = workload.importForVersion(state, targetVersion);
                verifier.findEachImportedObject(sequence, i);
                verifier.aggregateObjects(state.getObjectsCreated());
            } catch (HarnessException e) {
                log.error("[Step {}/{}] {} failed: {}", i, sequence.size(), e.getKind().getValue(), e.getMessage(), e);
                return failure(i, sequence.size(), currentVersion, targetVersion, e, state);
            } catch (RuntimeException e) {
                log.error("[Step {}/{}] unexpected failure: {}", i, sequence.size(), e.getMessage(), e);
                return failure(i, sequence.size(), currentVersion, targetVersion,
                    new HarnessException(ErrorKind.UNEXPECTED, String.valueOf(e.getMessage()), e), state);
            } finally {
                metricsProvider.timer(STEP_DURATION_METRIC_NAME, buildStepTags(phase, targetVersion))
                    .record(Duration.ofNanos(System.nanoTime() - startNanos));
            }
            log.info("[Step {}/{}] verified {} objects on {}", i, sequence.size(), state.getObjectsCreated(), targetVersion);
        }

        RunResult result = RunResult.completed(sequence.size(), sequence.get(sequence.size() - 1), state.getObjectsCreated());
        log.info(result.describe());
        return result;
    }

    private RunResult failure(int stepIndex, int totalSteps, String currentVersion, String targetVersion,
                              HarnessException error) {
        return failure(stepIndex, totalSteps, currentVersion, targetVersion, error, RunState.initial());
    }

    private RunResult failure(int stepIndex, int totalSteps, String currentVersion, String targetVersion,
                              HarnessException error, RunState state) {
        metricsProvider.counter(STEP_FAILURES_METRIC_NAME, Map.of(ERROR_KIND_TAG, error.getKind().getValue()))
            .increment();
        RunResult result = RunResult.builder()
            .status(RunStatus.FAILED)
            .stepIndex(stepIndex)
            .totalSteps(totalSteps)
            .phase(RunPhase.forStep(stepIndex))
            .currentVersion(currentVersion)
            .targetVersion(targetVersion)
            .errorKind(error.getKind())
            .message(error.getMessage())
            .objectsCreated(state.getObjectsCreated())
            .build();
        log.error(result.describe());
        return result;
    }
}
