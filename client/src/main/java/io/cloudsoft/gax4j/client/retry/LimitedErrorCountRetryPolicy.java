package io.cloudsoft.gax4j.client.retry;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import io.cloudsoft.gax4j.client.Status;

/**
 * Retry policy that counts transient errors and stops once the limit is exceeded.
 * 
 * With {@code maxFailures} of {@code 2} the first two transient failures are retried and the third is
 * not, i.e. an operation makes at most {@code maxFailures + 1} attempts.
 * 
 * @since 0.1.0
 */
public class LimitedErrorCountRetryPolicy implements RetryPolicy {
    private final Clock clock;
    private final Duration rpcTimeout;
    private final int maxFailures;
    private int failureCount;

    /**
     * @param maxFailures  number of transient failures to retry (e.g. {@code 1} means two attempts)
     * @param rpcTimeout   maximum duration of each attempt
     */
    public LimitedErrorCountRetryPolicy(int maxFailures, Duration rpcTimeout) {
        this(maxFailures, rpcTimeout, Clock.system());
    }

    public LimitedErrorCountRetryPolicy(int maxFailures, Duration rpcTimeout, Clock clock) {
        if (maxFailures < 0) {
            throw new IllegalArgumentException("maxFailures should be zero or more");
        }
        requireNonNull(rpcTimeout, "rpcTimeout");
        if (rpcTimeout.isNegative()) {
            throw new IllegalArgumentException("rpcTimeout should not be negative");
        }
        this.clock = requireNonNull(clock, "clock");
        this.rpcTimeout = rpcTimeout.truncatedTo(ChronoUnit.MILLIS);
        this.maxFailures = maxFailures;
        this.failureCount = 0;
    }

    protected LimitedErrorCountRetryPolicy(LimitedErrorCountRetryPolicy other) {
        this(other.maxFailures, other.rpcTimeout, other.clock);
    }

    @Override
    public RetryPolicy clone() {
        return new LimitedErrorCountRetryPolicy(this);
    }

    @Override
    public boolean onFailure(Status status) {
        if (status.isPermanentFailure() || failureCount >= maxFailures) {
            return false;
        }
        failureCount++;
        return true;
    }

    @Override
    public Instant operationDeadline() {
        return Deadlines.plusSaturated(clock.now(), rpcTimeout);
    }

    public int getMaxFailures() {
        return maxFailures;
    }

    public Duration getRpcTimeout() {
        return rpcTimeout;
    }

    public int getFailureCount() {
        return failureCount;
    }

    @Override
    public String toString() {
        return "LimitedErrorCountRetryPolicy[failures=" + failureCount + " of " + maxFailures
                + ", rpcTimeout=" + rpcTimeout + "]";
    }
}
