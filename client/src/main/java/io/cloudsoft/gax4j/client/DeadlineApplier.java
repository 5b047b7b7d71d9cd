package io.cloudsoft.gax4j.client;

import java.time.Instant;

import io.cloudsoft.gax4j.client.retry.Clock;

/**
 * Pushes the deadline of the next attempt into the transport of a stub, before the attempt is made.
 */
@FunctionalInterface
public interface DeadlineApplier {

    DeadlineApplier NONE = (stub, deadline, clock) -> { };

    /**
     * @param stub      the target of the call
     * @param deadline  instant by which the next attempt must complete
     * @param clock     clock the deadline was computed with
     */
    void apply(Object stub, Instant deadline, Clock clock);
}
