package io.upgradejourney.cluster;

import lombok.extern.slf4j.Slf4j;
import org.testcontainers.containers.ContainerLaunchException;
import org.testcontainers.containers.wait.strategy.AbstractWaitStrategy;

import java.time.Duration;

/**
 * Considers a container started as soon as it is running. Service readiness is polled
 * separately, so all nodes of a cluster can be started before any of them has formed a quorum.
 */
@Slf4j
class ContainerRunningWaitStrategy extends AbstractWaitStrategy {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    @Override
    protected void waitUntilReady() {
        long deadline = System.nanoTime() + startupTimeout.toNanos();
        while (!waitStrategyTarget.isRunning()) {
            if (System.nanoTime() >= deadline) {
                throw new ContainerLaunchException(
                    "Container did not reach running state within " + startupTimeout.toMillis() + "ms");
            }
            try {
                Thread.sleep(POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ContainerLaunchException("Interrupted while waiting for container to run", e);
            }
        }
        log.debug("Container {} is running", waitStrategyTarget.getContainerId());
    }
}
