package io.upgradejourney.metrics;

import io.upgradejourney.enums.RunPhase;

import java.util.HashMap;
import java.util.Map;

import static io.upgradejourney.metrics.MetricsConstants.PHASE_TAG;
import static io.upgradejourney.metrics.MetricsConstants.VERSION_TAG;

/**
 * Utility class for handling metrics.
 */
public class MetricsUtils {

    private MetricsUtils() {}

    /**
     * Builds a map of metrics tags for one step of a run.
     *
     * @param phase the step phase
     * @param version the version the step applies
     * @return a mutable map of metrics tags
     */
    public static Map<String, String> buildStepTags(RunPhase phase, String version) {
        Map<String, String> tags = new HashMap<>();
        tags.put(PHASE_TAG, phase.name().toLowerCase());
        tags.put(VERSION_TAG, version);
        return tags;
    }

    public static Map<String, String> buildVersionTags(String version) {
        Map<String, String> tags = new HashMap<>();
        tags.put(VERSION_TAG, version);
        return tags;
    }
}
