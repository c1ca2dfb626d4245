package com.openaasx.harvester.harvest.ratelimit;

import com.openaasx.harvester.config.HarvesterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-source token buckets with response-driven exponential backoff. Every network call made by
 * the harvester acquires a token from the bucket of its source first.
 */
public class RateLimiter {
    public static final String GITHUB = "github";
    public static final String WEB = "web";
    private static final int MAX_FORBIDDEN_FAILURES = 3;
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final HarvesterProperties.RateLimits limits;
    private final Map<String, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final Map<String, ExponentialBackoff> backoffs = new ConcurrentHashMap<>();

    public RateLimiter(HarvesterProperties.RateLimits limits) {
        this.limits = limits;
        buckets.put(GITHUB, new TokenBucket(limits.getGithubRequestsPerMinute() / 60.0, limits.getGithubBurst()));
        buckets.put(WEB, newWebBucket());
    }

    public void acquire(String source) throws InterruptedException {
        bucket(source).acquire();
    }

    public RetryDecision recordOutcome(String source, int statusCode) {
        ExponentialBackoff backoff = backoff(source);
        if (statusCode >= 200 && statusCode < 300) {
            backoff.recordSuccess();
            return RetryDecision.done();
        }
        if (statusCode == 429 || statusCode == 503) {
            Duration delay = backoff.recordFailure();
            log.warn("Rate limited source={} status={} backoff_ms={}", key(source), statusCode, delay.toMillis());
            return RetryDecision.retryAfter(delay, "http_" + statusCode);
        }
        if (statusCode == 403) {
            if (backoff.consecutiveFailures() < MAX_FORBIDDEN_FAILURES) {
                Duration delay = backoff.recordFailure();
                log.warn("Forbidden, possibly rate limited source={} backoff_ms={}", key(source), delay.toMillis());
                return RetryDecision.retryAfter(delay, "http_403");
            }
            return RetryDecision.giveUp("http_403");
        }
        return RetryDecision.giveUp("http_" + statusCode);
    }

    public RetryDecision recordTransportFailure(String source, String errorCode) {
        Duration delay = backoff(source).recordFailure();
        log.debug("Transport failure source={} error={} backoff_ms={}", key(source), errorCode, delay.toMillis());
        return RetryDecision.retryAfter(delay, errorCode);
    }

    TokenBucket bucket(String source) {
        return buckets.computeIfAbsent(key(source), ignored -> newWebBucket());
    }

    ExponentialBackoff backoff(String source) {
        return backoffs.computeIfAbsent(
            key(source),
            ignored -> new ExponentialBackoff(
                Duration.ofMillis(limits.getBackoffBaseMs()),
                Duration.ofMillis(limits.getBackoffMaxMs()),
                limits.getBackoffMultiplier()
            )
        );
    }

    private TokenBucket newWebBucket() {
        return new TokenBucket(limits.getWebRequestsPerSecond(), limits.getWebBurst());
    }

    private static String key(String source) {
        return source == null || source.isBlank() ? WEB : source.trim().toLowerCase(Locale.ROOT);
    }
}
