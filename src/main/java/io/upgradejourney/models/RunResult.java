package io.upgradejourney.models;

import io.upgradejourney.enums.ErrorKind;
import io.upgradejourney.enums.RunPhase;
import io.upgradejourney.enums.RunStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Terminal outcome of a run: either every step verified or the first failure.
 */
@Value
@Builder
public class RunResult {

    // shown for the current version before the cluster has been started
    private static final String NO_VERSION = "none";

    RunStatus status;
    int stepIndex;
    int totalSteps;
    RunPhase phase;
    String currentVersion;
    String targetVersion;
    ErrorKind errorKind;
    String message;
    long objectsCreated;

    public static RunResult completed(int totalSteps, String finalVersion, long objectsCreated) {
        return RunResult.builder()
            .status(RunStatus.COMPLETED)
            .stepIndex(totalSteps - 1)
            .totalSteps(totalSteps)
            .currentVersion(finalVersion)
            .targetVersion(finalVersion)
            .objectsCreated(objectsCreated)
            .build();
    }

    public boolean isSuccess() {
        return status == RunStatus.COMPLETED;
    }

    public int exitCode() {
        return isSuccess() ? 0 : 1;
    }

    /**
     * One-line diagnostic suitable for the final log line.
     */
    public String describe() {
        if (isSuccess()) {
            return String.format("Completed %d steps, final version %s, %d objects verified",
                totalSteps, targetVersion, objectsCreated);
        }
        return String.format("Failed at step %d/%d (%s, %s -> %s): %s: %s",
            stepIndex, totalSteps, phase, currentVersion != null ? currentVersion : NO_VERSION, targetVersion,
            errorKind != null ? errorKind.getValue() : "unknown", message);
    }
}
