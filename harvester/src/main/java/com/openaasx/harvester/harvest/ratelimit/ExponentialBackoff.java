package com.openaasx.harvester.harvest.ratelimit;

import java.time.Duration;

public final class ExponentialBackoff {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private long currentDelayMs;
    private int consecutiveFailures;

    public ExponentialBackoff(Duration baseDelay, Duration maxDelay, double multiplier) {
        this.baseDelayMs = Math.max(1, baseDelay.toMillis());
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelay.toMillis());
        this.multiplier = Math.max(1.0, multiplier);
        this.currentDelayMs = this.baseDelayMs;
    }

    /**
     * Returns the delay to wait before the next attempt and grows the delay for the one after.
     */
    public synchronized Duration recordFailure() {
        long delay = currentDelayMs;
        consecutiveFailures++;
        currentDelayMs = Math.min(maxDelayMs, (long) Math.ceil(currentDelayMs * multiplier));
        return Duration.ofMillis(delay);
    }

    public synchronized void recordSuccess() {
        currentDelayMs = baseDelayMs;
        consecutiveFailures = 0;
    }

    public synchronized Duration currentDelay() {
        return Duration.ofMillis(currentDelayMs);
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }
}
