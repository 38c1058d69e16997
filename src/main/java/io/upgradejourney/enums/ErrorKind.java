package io.upgradejourney.enums;

/**
 * Kinds of failure a run can terminate with.
 */
public enum ErrorKind {
    SEQUENCE("sequence_error"),
    CLUSTER_START("cluster_start_error"),
    ROLLING_UPDATE("rolling_update_error"),
    SCHEMA("schema_error"),
    IMPORT("import_error"),
    DATA_LOSS("data_loss_error"),
    AGGREGATE_MISMATCH("aggregate_mismatch_error"),
    TIMEOUT("timeout_error"),
    UNEXPECTED("unexpected_error");

    private final String value;

    ErrorKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
