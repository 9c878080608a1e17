package net.bulwark.Kafka.Backoff;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Blocking wait used by backoff policies. Swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

    void sleep(Duration duration) throws InterruptedException;
}
