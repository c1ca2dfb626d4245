package com.openaasx.harvester.harvest.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExponentialBackoffTest {

    @Test
    void delayDoublesUpToMaximumAndStaysThere() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0);

        long[] expected = {1, 2, 4, 8, 16, 32, 60, 60};
        for (long seconds : expected) {
            assertEquals(Duration.ofSeconds(seconds), backoff.recordFailure());
        }
        assertEquals(Duration.ofSeconds(60), backoff.currentDelay());
        assertEquals(8, backoff.consecutiveFailures());
    }

    @Test
    void successResetsDelayAndFailureCount() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0);
        backoff.recordFailure();
        backoff.recordFailure();
        backoff.recordFailure();

        backoff.recordSuccess();

        assertEquals(Duration.ofSeconds(1), backoff.currentDelay());
        assertEquals(0, backoff.consecutiveFailures());
    }
}
