package com.openaasx.harvester.harvest.http;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.model.HttpFetchResult;
import com.openaasx.harvester.harvest.ratelimit.RateLimiter;
import com.openaasx.harvester.harvest.ratelimit.RetryDecision;
import com.openaasx.harvester.harvest.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;

@Service
public class HarvestHttpClient {
    private static final Logger log = LoggerFactory.getLogger(HarvestHttpClient.class);

    private final HarvesterProperties properties;
    private final RateLimiter rateLimiter;
    private final HttpClient client;

    public HarvestHttpClient(
        HarvesterProperties properties,
        RateLimiter rateLimiter,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String source, String url, String acceptHeader) {
        return get(source, url, acceptHeader, Map.of(), properties.getDownload().getMaxPageBytes());
    }

    public HttpFetchResult get(String source, String url, String acceptHeader, Map<String, String> headers) {
        return get(source, url, acceptHeader, headers, properties.getDownload().getMaxPageBytes());
    }

    public HttpFetchResult get(String source, String url, String acceptHeader, Map<String, String> headers, long maxBytes) {
        int maxAttempts = 1 + properties.getRequestMaxRetries();
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(source, url, acceptHeader, headers, maxBytes);
            RetryDecision decision = decide(source, lastResult);
            if (!decision.retry() || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug("Retrying url={} attempt={} reason={} delay_ms={}", url, attempt, decision.reason(), decision.delay().toMillis());
            if (!sleep(decision.delay())) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private RetryDecision decide(String source, HttpFetchResult result) {
        String errorCode = result.errorCode();
        if (errorCode == null) {
            return rateLimiter.recordOutcome(source, result.statusCode());
        }
        if (errorCode.equals("timeout") || errorCode.equals("io_error")) {
            return rateLimiter.recordTransportFailure(source, errorCode);
        }
        return RetryDecision.giveUp(errorCode);
    }

    private HttpFetchResult executeOnce(
        String source,
        String url,
        String acceptHeader,
        Map<String, String> headers,
        long maxBytes
    ) {
        Instant startedAt = Instant.now();
        URI uri = UrlUtils.parse(url);
        if (uri == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        try {
            rateLimiter.acquire(source);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept);
            if (headers != null) {
                headers.forEach(builder::header);
            }
            HttpResponse<InputStream> response = client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofInputStream());
            byte[] responseBytes;
            try (InputStream body = response.body()) {
                responseBytes = readLimited(body, maxBytes);
            }
            if (responseBytes == null) {
                return errorResult(url, startedAt, "body_too_large", "Response exceeded " + maxBytes + " bytes");
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                new String(responseBytes, StandardCharsets.UTF_8),
                responseBytes,
                response.headers().firstValue("Content-Type").orElse(null),
                response.headers().firstValue("Content-Encoding").orElse(null),
                response.headers(),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_request", e.getMessage());
        }
    }

    private byte[] readLimited(InputStream in, long maxBytes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            total += read;
            if (total > maxBytes) {
                return null;
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
