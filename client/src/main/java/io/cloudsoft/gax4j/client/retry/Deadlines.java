package io.cloudsoft.gax4j.client.retry;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

final class Deadlines {

    private Deadlines() {
    }

    /**
     * @return {@code instant + duration}, or {@link Instant#MAX} if that is past the end of the time-line
     */
    static Instant plusSaturated(Instant instant, Duration duration) {
        try {
            return instant.plus(duration);
        } catch (DateTimeException | ArithmeticException e) {
            return Instant.MAX;
        }
    }
}
