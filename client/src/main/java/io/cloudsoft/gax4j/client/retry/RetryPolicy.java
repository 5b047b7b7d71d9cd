package io.cloudsoft.gax4j.client.retry;

import java.time.Instant;

import io.cloudsoft.gax4j.client.Status;

/**
 * Policy to decide if a failed RPC operation should be retried, and how long the next attempt may run.
 * 
 * The application provides a prototype instance when the client is created. Each logical operation
 * works on its own copy obtained from {@link #clone()}, so implementations need not be thread-safe,
 * but must not share mutable state between copies.
 * 
 * @since 0.1.0
 */
public interface RetryPolicy {

    /**
     * @return a new copy of this policy with the same retry criteria and fresh state
     */
    RetryPolicy clone();

    /**
     * Handle the failure of one attempt. Any internal state modification happens here.
     * 
     * @param status outcome of the failed attempt
     * @return {@code true} if the operation should be retried
     */
    boolean onFailure(Status status);

    /**
     * Calculate the deadline for the next attempt.
     * 
     * Note: this is different from the deadline in {@link LimitedDurationRetryPolicy}, which is the
     * deadline after which retry attempts are abandoned.
     * 
     * @return the <em>deadline</em> for the next attempt, NOT its maximum <em>duration</em>
     */
    Instant operationDeadline();
}
