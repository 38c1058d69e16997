package io.upgradejourney.enums;

/**
 * Phase of a single step in the upgrade loop.
 */
public enum RunPhase {
    /**
     * First step: all nodes started together, schema created.
     */
    BOOTSTRAPPING,

    /**
     * Any later step: nodes replaced one at a time.
     */
    UPGRADING;

    public static RunPhase forStep(int stepIndex) {
        return stepIndex == 0 ? BOOTSTRAPPING : UPGRADING;
    }
}
