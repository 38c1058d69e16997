package io.upgradejourney.enums;

/**
 * Lifecycle state of a single cluster node as tracked by the harness.
 *
 * <ul>
 *   <li><strong>RUNNING</strong> - Node has been started and reported ready</li>
 *   <li><strong>STOPPED</strong> - Node is down, either before bootstrap or mid-replacement</li>
 * </ul>
 */
public enum NodeState {
    RUNNING,
    STOPPED
}
