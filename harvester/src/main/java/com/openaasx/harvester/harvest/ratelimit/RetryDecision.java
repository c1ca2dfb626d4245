package com.openaasx.harvester.harvest.ratelimit;

import java.time.Duration;

public record RetryDecision(boolean retry, Duration delay, String reason) {

    public static RetryDecision retryAfter(Duration delay, String reason) {
        return new RetryDecision(true, delay, reason);
    }

    public static RetryDecision giveUp(String reason) {
        return new RetryDecision(false, Duration.ZERO, reason);
    }

    public static RetryDecision done() {
        return new RetryDecision(false, Duration.ZERO, "ok");
    }
}
