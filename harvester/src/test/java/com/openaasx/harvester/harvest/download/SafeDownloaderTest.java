package com.openaasx.harvester.harvest.download;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.HarvestFixtures;
import com.openaasx.harvester.harvest.model.FailureKind;
import com.openaasx.harvester.harvest.ratelimit.RateLimiter;
import com.openaasx.harvester.harvest.util.HashUtils;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SafeDownloaderTest {

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private ExecutorService executor;
    private HarvesterProperties properties;
    private final AtomicInteger getRequests = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = HarvestFixtures.fastProperties(tempDir);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    private SafeDownloader downloader() {
        return new SafeDownloader(
            properties,
            new RateLimiter(properties.getRateLimits()),
            new ArchiveInspector(properties),
            executor
        );
    }

    private void serve(Route get) {
        serve(request -> new MockResponse().setResponseCode(405), get);
    }

    private void serve(Route head, Route get) {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if ("HEAD".equals(request.getMethod())) {
                    return head.respond(request);
                }
                getRequests.incrementAndGet();
                return get.respond(request);
            }
        });
    }

    @Test
    void downloadsHashesAndNamesFileFromUrl() throws Exception {
        byte[] payload = HarvestFixtures.aasxPackage(HarvestFixtures.AAS_V3_XML);
        serve(request -> new MockResponse().setResponseCode(200).setBody(new Buffer().write(payload)));

        DownloadResult result = downloader().download(server.url("/files/pump.aasx").toString(), tempDir);

        assertThat(result.filename()).isEqualTo("pump.aasx");
        assertThat(result.sizeBytes()).isEqualTo(payload.length);
        assertThat(result.path()).exists();
        assertThat(result.sha256()).isEqualTo(HashUtils.toHex(HashUtils.newSha256().digest(payload)));
    }

    @Test
    void contentDispositionFilenameWins() throws Exception {
        byte[] payload = HarvestFixtures.aasxPackage(HarvestFixtures.AAS_V3_XML);
        serve(request -> new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Disposition", "attachment; filename=\"../../motor.aasx\"")
            .setBody(new Buffer().write(payload)));

        DownloadResult result = downloader().download(server.url("/download?id=42").toString(), tempDir);

        assertThat(result.filename()).isEqualTo("motor.aasx");
        assertThat(result.path().getParent()).isEqualTo(tempDir);
    }

    @Test
    void declaredLengthOverBudgetFailsBeforeAnyGet() {
        serve(
            request -> new MockResponse().setResponseCode(200).setHeader("Content-Length", "5000"),
            request -> new MockResponse().setResponseCode(200).setBody("x".repeat(5000))
        );

        assertThatThrownBy(() -> downloader().download(server.url("/big.aasx").toString(), tempDir, 1024))
            .isInstanceOf(FileTooLargeException.class)
            .satisfies(e -> assertThat(((DownloadException) e).kind()).isEqualTo(FailureKind.RESOURCE_LIMIT));
        assertThat(getRequests.get()).isZero();
    }

    @Test
    void streamingPastBudgetAbortsAndLeavesNoFile() throws Exception {
        serve(request -> new MockResponse().setResponseCode(200).setChunkedBody("y".repeat(64 * 1024), 1024));

        assertThatThrownBy(() -> downloader().download(server.url("/stream.aasx").toString(), tempDir, 4096))
            .isInstanceOf(FileTooLargeException.class);
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.filter(Files::isRegularFile)).isEmpty();
        }
    }

    @Test
    void redirectLoopStopsAtConfiguredLimit() {
        serve(request -> new MockResponse().setResponseCode(302).setHeader("Location", "/loop.aasx"));

        assertThatThrownBy(() -> downloader().download(server.url("/loop.aasx").toString(), tempDir))
            .isInstanceOf(TooManyRedirectsException.class);
    }

    @Test
    void redirectIsFollowedToFinalName() throws Exception {
        byte[] payload = HarvestFixtures.aasxPackage(HarvestFixtures.AAS_V3_XML);
        serve(request -> {
            if (request.getPath().startsWith("/moved")) {
                return new MockResponse().setResponseCode(301).setHeader("Location", "/storage/valve.aasx");
            }
            return new MockResponse().setResponseCode(200).setBody(new Buffer().write(payload));
        });

        DownloadResult result = downloader().download(server.url("/moved").toString(), tempDir);

        assertThat(result.filename()).isEqualTo("valve.aasx");
    }

    @Test
    void notFoundIsPermanentFailure() {
        serve(request -> new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> downloader().download(server.url("/missing.aasx").toString(), tempDir))
            .isInstanceOf(DownloadFailedException.class)
            .satisfies(e -> {
                DownloadFailedException failure = (DownloadFailedException) e;
                assertThat(failure.statusCode()).isEqualTo(404);
                assertThat(failure.kind()).isEqualTo(FailureKind.PERMANENT_REMOTE);
            });
    }

    @Test
    void zipBombIsDeletedAfterInspection() throws Exception {
        byte[] bomb = HarvestFixtures.zerosZip(10 * 1024 * 1024);
        serve(request -> new MockResponse().setResponseCode(200).setBody(new Buffer().write(bomb)));

        assertThatThrownBy(() -> downloader().download(server.url("/bomb.aasx").toString(), tempDir))
            .isInstanceOf(UnsafeArchiveException.class)
            .hasMessageStartingWith("Unsafe archive: Suspicious compression ratio");
        assertThat(tempDir.resolve("bomb.aasx")).doesNotExist();
    }

    @Test
    void archiveDetectionUsesNameOrMediaType() {
        assertThat(SafeDownloader.looksLikeArchive("a.AASX", null)).isTrue();
        assertThat(SafeDownloader.looksLikeArchive("blob", "application/zip; charset=binary")).isTrue();
        assertThat(SafeDownloader.looksLikeArchive("notes.txt", "text/plain")).isFalse();
    }

    @FunctionalInterface
    private interface Route {
        MockResponse respond(RecordedRequest request);
    }
}
