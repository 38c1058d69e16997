package io.upgradejourney.metrics;

/**
 * Constants for metrics names and tags reported by a run.
 */
public class MetricsConstants {
    public final static String STEP_DURATION_METRIC_NAME = "upgrade_step_duration";
    public final static String OBJECTS_CREATED_METRIC_NAME = "upgrade_objects_created";
    public final static String STEP_FAILURES_METRIC_NAME = "upgrade_step_failures";
    public final static String ROLLING_UPDATE_PROGRESS_PERCENTAGE_METRIC_NAME = "rolling_update_progress_percentage";
    public final static String PHASE_TAG = "phase";
    public final static String VERSION_TAG = "version";
    public final static String ERROR_KIND_TAG = "errorKind";

    private MetricsConstants() {}
}
