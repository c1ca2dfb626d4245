package com.openaasx.harvester.harvest.ratelimit;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

public final class TokenBucket {
    private final double ratePerSecond;
    private final double capacity;
    private final LongSupplier nanoClock;
    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(double ratePerSecond, double capacity) {
        this(ratePerSecond, capacity, System::nanoTime);
    }

    TokenBucket(double ratePerSecond, double capacity, LongSupplier nanoClock) {
        if (ratePerSecond <= 0 || capacity < 1) {
            throw new IllegalArgumentException("rate must be positive and capacity at least 1");
        }
        this.ratePerSecond = ratePerSecond;
        this.capacity = capacity;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    public void acquire() throws InterruptedException {
        for (;;) {
            long waitNanos = tryAcquire();
            if (waitNanos <= 0) {
                return;
            }
            // sleep outside the monitor so other sources and callers are not blocked
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    /**
     * Takes a token if one is available. Returns 0 on success, otherwise the nanoseconds until
     * one token will have refilled.
     */
    synchronized long tryAcquire() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return 0;
        }
        double missing = 1.0 - tokens;
        return Math.max(1L, (long) Math.ceil(missing / ratePerSecond * 1_000_000_000L));
    }

    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    public double ratePerSecond() {
        return ratePerSecond;
    }

    public double capacity() {
        return capacity;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed / 1_000_000_000.0 * ratePerSecond);
            lastRefillNanos = now;
        }
    }
}
