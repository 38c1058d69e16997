package io.upgradejourney.config;

import java.util.List;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_SERVICE_ENDPOINT = "http://localhost:8080";
    public static final String DEFAULT_SERVICE_IMAGE = "semitechnologies/weaviate";
    public static final int DEFAULT_HTTP_BASE_PORT = 8080;
    public static final String DEFAULT_CLASS_NAME = "Collection";
    public static final long DEFAULT_REQUEST_TIMEOUT_SECONDS = 30L;

    public static final int DEFAULT_CLUSTER_SIZE = 3;
    public static final String DEFAULT_NETWORK_ALIAS_PREFIX = "weaviate-node-";
    public static final String DEFAULT_DATA_DIR = "target/upgrade-journey-data";
    public static final long DEFAULT_STARTUP_TIMEOUT_SECONDS = 120L;

    // Readiness: fixed 1s interval, 120 attempts
    public static final int DEFAULT_READINESS_MAX_ATTEMPTS = 120;
    public static final long DEFAULT_READINESS_INTERVAL_MILLIS = 1000L;
    public static final double DEFAULT_READINESS_BACKOFF_MULTIPLIER = 1.0;
    public static final long DEFAULT_READINESS_MAX_INTERVAL_MILLIS = 5000L;

    // Read-after-write tolerance
    public static final int DEFAULT_VISIBILITY_MAX_ATTEMPTS = 10;
    public static final long DEFAULT_VISIBILITY_INTERVAL_MILLIS = 500L;

    public static final List<String> DEFAULT_VERSIONS = List.of(
        "1.16.0",
        "1.16.1",
        "1.16.2",
        "1.16.3",
        "1.16.4",
        "1.16.5",
        "1.16.6",
        "1.16.7",
        "1.16.8",
        "1.16.9",
        "1.17.0",
        "1.17.1",
        "1.17.2"
    );

    // Environment overrides
    public static final String ENV_CONFIG_FILE = "UPGRADE_JOURNEY_CONFIG_FILE";
    public static final String ENV_VERSIONS = "UPGRADE_JOURNEY_VERSIONS";
    public static final String ENV_RUN_ID = "UPGRADE_JOURNEY_RUN_ID";
    public static final String DEFAULT_RUN_ID = "upgrade-journey";
}
