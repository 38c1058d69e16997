package io.upgradejourney.enums;

/**
 * Terminal status of an upgrade journey run. There is no partial success.
 */
public enum RunStatus {
    COMPLETED,
    FAILED
}
