package io.cloudsoft.gax4j.client.retry;

import java.time.Duration;
import java.time.Instant;

/**
 * Simulated clock that only moves when told to.
 */
public class MutableClock implements Clock {
    private Instant now;

    public MutableClock(Instant now) {
        this.now = now;
    }

    @Override
    public Instant now() {
        return now;
    }

    public void set(Instant now) {
        this.now = now;
    }

    public void advance(Duration duration) {
        now = now.plus(duration);
    }
}
