package io.cloudsoft.gax4j.client.retry;

import static java.util.Objects.requireNonNull;

import java.time.Instant;

/**
 * Source of the current instant used by retry policies.
 * 
 * Policies never read the system time directly, so tests can substitute a simulated clock.
 * 
 * @since 0.1.0
 */
@FunctionalInterface
public interface Clock {

    Instant now();

    static Clock system() {
        return Instant::now;
    }

    static Clock of(java.time.Clock clock) {
        requireNonNull(clock, "clock");
        return clock::instant;
    }
}
