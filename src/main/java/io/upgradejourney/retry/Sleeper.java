package io.upgradejourney.retry;

import java.time.Duration;

/**
 * Clock abstraction used by {@link Retrier} between attempts so waits can be faked in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
