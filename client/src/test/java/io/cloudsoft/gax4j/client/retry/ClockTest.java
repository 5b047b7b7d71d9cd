package io.cloudsoft.gax4j.client.retry;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;

import java.time.Instant;
import java.time.ZoneOffset;

import org.testng.annotations.Test;

public class ClockTest {

    @Test
    public void testAdaptsJdkClock() {
        Instant fixed = Instant.parse("2019-05-01T10:15:30Z");
        Clock clock = Clock.of(java.time.Clock.fixed(fixed, ZoneOffset.UTC));
        assertEquals(clock.now(), fixed);
    }

    @Test
    public void testSystemClockDoesNotGoBackwards() {
        Clock clock = Clock.system();
        Instant first = clock.now();
        Instant second = clock.now();
        assertFalse(second.isBefore(first));
    }

    @Test(expectedExceptions = NullPointerException.class)
    public void testRejectsNullJdkClock() {
        Clock.of(null);
    }
}
