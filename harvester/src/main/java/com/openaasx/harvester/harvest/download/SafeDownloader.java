package com.openaasx.harvester.harvest.download;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.model.FailureKind;
import com.openaasx.harvester.harvest.model.LocalEnvironmentException;
import com.openaasx.harvester.harvest.ratelimit.RateLimiter;
import com.openaasx.harvester.harvest.ratelimit.RetryDecision;
import com.openaasx.harvester.harvest.util.HashUtils;
import com.openaasx.harvester.harvest.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class SafeDownloader {
    private static final Logger log = LoggerFactory.getLogger(SafeDownloader.class);
    private static final String DEFAULT_FILENAME = "download.aasx";
    private static final int CHUNK_SIZE = 8192;
    private static final Pattern DISPOSITION_FILENAME =
        Pattern.compile("filename\\*?=(?:UTF-8'')?\"?([^\";]+)\"?", Pattern.CASE_INSENSITIVE);

    private final HarvesterProperties properties;
    private final RateLimiter rateLimiter;
    private final ArchiveInspector archiveInspector;
    private final HttpClient client;

    public SafeDownloader(
        HarvesterProperties properties,
        RateLimiter rateLimiter,
        ArchiveInspector archiveInspector,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.archiveInspector = archiveInspector;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public DownloadResult download(String url, Path destDir) throws DownloadException {
        return download(url, destDir, properties.getDownload().getMaxBytes());
    }

    public DownloadResult download(String url, Path destDir, long maxBytes) throws DownloadException {
        URI uri = UrlUtils.parse(url);
        if (uri == null) {
            throw new DownloadFailedException(FailureKind.PERMANENT_REMOTE, 0, "Invalid URL: " + url);
        }
        checkContentLength(uri, maxBytes);

        HttpResponse<InputStream> response = openWithRetries(uri);
        String filename = resolveFilename(response);
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        Path target = destDir.resolve(filename).normalize();
        if (!destDir.normalize().equals(target.getParent())) {
            target = destDir.resolve(DEFAULT_FILENAME);
        }

        long size;
        String sha256;
        try (InputStream body = response.body()) {
            MessageDigest digest = HashUtils.newSha256();
            size = stream(body, target, digest, maxBytes);
            sha256 = HashUtils.toHex(digest.digest());
        } catch (IOException e) {
            deleteQuietly(target);
            throw new DownloadFailedException(FailureKind.TRANSIENT_NETWORK, "Transfer failed: " + e.getMessage(), e);
        }

        if (looksLikeArchive(filename, contentType)) {
            ArchiveInspection inspection = archiveInspector.inspect(target);
            if (!inspection.safe()) {
                deleteQuietly(target);
                log.warn("Rejected archive url={} reason={}", url, inspection.reason());
                throw new UnsafeArchiveException(inspection);
            }
        }
        log.debug("Downloaded url={} file={} bytes={} sha256={}", url, filename, size, sha256);
        return new DownloadResult(target, size, sha256, contentType, filename);
    }

    private long stream(InputStream body, Path target, MessageDigest digest, long maxBytes)
        throws IOException, FileTooLargeException {
        OutputStream out;
        try {
            out = Files.newOutputStream(target);
        } catch (IOException e) {
            throw new LocalEnvironmentException("Cannot write download target " + target, e);
        }
        long total = 0;
        boolean overBudget = false;
        try (out) {
            byte[] buffer = new byte[CHUNK_SIZE];
            int read;
            while ((read = body.read(buffer)) != -1) {
                total += read;
                if (total > maxBytes) {
                    overBudget = true;
                    break;
                }
                digest.update(buffer, 0, read);
                out.write(buffer, 0, read);
            }
        }
        if (overBudget) {
            deleteQuietly(target);
            throw new FileTooLargeException("File exceeds size limit: > " + maxBytes + " bytes", maxBytes);
        }
        return total;
    }

    private void checkContentLength(URI uri, long maxBytes) throws FileTooLargeException {
        OptionalLong declared;
        try {
            HttpResponse<Void> head = follow(uri, "HEAD", HttpResponse.BodyHandlers.discarding());
            if (head.statusCode() < 200 || head.statusCode() >= 300) {
                return;
            }
            declared = head.headers().firstValueAsLong("Content-Length");
        } catch (IOException | TooManyRedirectsException | RuntimeException e) {
            log.debug("HEAD request failed url={} error={}", uri, e.getMessage());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (declared.isPresent() && declared.getAsLong() > maxBytes) {
            throw new FileTooLargeException(
                "File too large: " + declared.getAsLong() + " bytes > " + maxBytes + " bytes", maxBytes);
        }
    }

    private HttpResponse<InputStream> openWithRetries(URI uri) throws DownloadException {
        int maxAttempts = 1 + properties.getRequestMaxRetries();
        for (int attempt = 1; ; attempt++) {
            RetryDecision decision;
            try {
                HttpResponse<InputStream> response = follow(uri, "GET", HttpResponse.BodyHandlers.ofInputStream());
                int status = response.statusCode();
                decision = rateLimiter.recordOutcome(RateLimiter.WEB, status);
                if (status >= 200 && status < 300) {
                    return response;
                }
                closeQuietly(response.body());
                if (!decision.retry() || attempt >= maxAttempts) {
                    throw new DownloadFailedException(FailureKind.fromHttpStatus(status), status, "HTTP " + status);
                }
            } catch (IOException e) {
                decision = rateLimiter.recordTransportFailure(RateLimiter.WEB, "io_error");
                if (attempt >= maxAttempts) {
                    throw new DownloadFailedException(FailureKind.TRANSIENT_NETWORK, "Network error: " + e.getMessage(), e);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DownloadFailedException(FailureKind.TRANSIENT_NETWORK, "Interrupted", e);
            }
            try {
                Thread.sleep(decision.delay().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DownloadFailedException(FailureKind.TRANSIENT_NETWORK, "Interrupted", e);
            }
        }
    }

    private <T> HttpResponse<T> follow(URI start, String method, HttpResponse.BodyHandler<T> handler)
        throws IOException, InterruptedException, TooManyRedirectsException {
        int maxRedirects = properties.getDownload().getMaxRedirects();
        URI current = start;
        for (int hops = 0; ; hops++) {
            rateLimiter.acquire(RateLimiter.WEB);
            HttpRequest request = HttpRequest.newBuilder(current)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "*/*")
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
            HttpResponse<T> response = client.send(request, handler);
            Optional<String> location = response.headers().firstValue("Location");
            if (!isRedirect(response.statusCode()) || location.isEmpty()) {
                return response;
            }
            if (response.body() instanceof InputStream in) {
                closeQuietly(in);
            }
            if (hops + 1 > maxRedirects) {
                throw new TooManyRedirectsException(start.toString(), maxRedirects);
            }
            current = current.resolve(location.get().trim());
        }
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    String resolveFilename(HttpResponse<?> response) {
        String fromHeader = response.headers().firstValue("Content-Disposition")
            .map(SafeDownloader::dispositionFilename)
            .map(UrlUtils::safeFilename)
            .orElse(null);
        if (fromHeader != null) {
            return fromHeader;
        }
        String fromUrl = UrlUtils.safeFilename(UrlUtils.lastPathSegment(response.uri().toString()));
        return fromUrl != null ? fromUrl : DEFAULT_FILENAME;
    }

    private static String dispositionFilename(String header) {
        Matcher matcher = DISPOSITION_FILENAME.matcher(header);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    static boolean looksLikeArchive(String filename, String contentType) {
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        if (name.endsWith(".zip") || name.endsWith(".aasx")) {
            return true;
        }
        if (contentType == null) {
            return false;
        }
        String mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return mediaType.equals("application/zip") || mediaType.equals("application/octet-stream");
    }

    private static void closeQuietly(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Failed to close response body: {}", e.getMessage());
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete partial download {}: {}", path, e.getMessage());
        }
    }
}
