package io.cloudsoft.gax4j.client.retry;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import io.cloudsoft.gax4j.client.Status;

/**
 * Retry policy that keeps retrying transient errors until a fixed amount of time has elapsed.
 * 
 * The window starts when the policy is created (or cloned). Attempts are never allowed to run past the
 * end of the window, even when their own {@code rpcTimeout} would extend further.
 * 
 * @since 0.1.0
 */
public class LimitedDurationRetryPolicy implements RetryPolicy {
    private final Clock clock;
    private final Duration rpcTimeout;
    private final Duration maxDuration;
    private final Instant deadline;

    /**
     * @param maxDuration  how long to keep retrying, measured from creation of the policy
     * @param rpcTimeout   maximum duration of each attempt
     */
    public LimitedDurationRetryPolicy(Duration maxDuration, Duration rpcTimeout) {
        this(maxDuration, rpcTimeout, Clock.system());
    }

    public LimitedDurationRetryPolicy(Duration maxDuration, Duration rpcTimeout, Clock clock) {
        requireNonNull(maxDuration, "maxDuration");
        requireNonNull(rpcTimeout, "rpcTimeout");
        if (maxDuration.isNegative()) {
            throw new IllegalArgumentException("maxDuration should not be negative");
        }
        if (rpcTimeout.isNegative()) {
            throw new IllegalArgumentException("rpcTimeout should not be negative");
        }
        this.clock = requireNonNull(clock, "clock");
        this.rpcTimeout = rpcTimeout.truncatedTo(ChronoUnit.MILLIS);
        this.maxDuration = maxDuration.truncatedTo(ChronoUnit.MILLIS);
        this.deadline = Deadlines.plusSaturated(clock.now(), this.maxDuration);
    }

    /**
     * Copies the configuration of {@code other}; the retry window restarts from the current time.
     */
    protected LimitedDurationRetryPolicy(LimitedDurationRetryPolicy other) {
        this(other.maxDuration, other.rpcTimeout, other.clock);
    }

    @Override
    public RetryPolicy clone() {
        return new LimitedDurationRetryPolicy(this);
    }

    @Override
    public boolean onFailure(Status status) {
        return !status.isPermanentFailure() && clock.now().isBefore(deadline);
    }

    @Override
    public Instant operationDeadline() {
        Instant attemptDeadline = Deadlines.plusSaturated(clock.now(), rpcTimeout);
        return attemptDeadline.isBefore(deadline) ? attemptDeadline : deadline;
    }

    public Duration getMaxDuration() {
        return maxDuration;
    }

    public Duration getRpcTimeout() {
        return rpcTimeout;
    }

    /**
     * @return the instant after which no more retries are attempted
     */
    public Instant getDeadline() {
        return deadline;
    }

    @Override
    public String toString() {
        return "LimitedDurationRetryPolicy[deadline=" + deadline + ", maxDuration=" + maxDuration
                + ", rpcTimeout=" + rpcTimeout + "]";
    }
}
