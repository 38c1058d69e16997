package io.upgradejourney.models;

import lombok.Value;

/**
 * Counters carried from step to step by the run coordinator.
 */
@Value
public class RunState {

    long objectsCreated;
    int currentStepIndex;

    public static RunState initial() {
        return new RunState(0, 0);
    }

    public RunState withObjectCreated() {
        return new RunState(objectsCreated + 1, currentStepIndex);
    }

    public RunState atStep(int stepIndex) {
        return new RunState(objectsCreated, stepIndex);
    }
}
