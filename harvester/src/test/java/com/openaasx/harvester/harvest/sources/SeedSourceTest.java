package com.openaasx.harvester.harvest.sources;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.http.HarvestHttpClient;
import com.openaasx.harvester.harvest.model.Candidate;
import com.openaasx.harvester.harvest.model.DiscoveryResult;
import com.openaasx.harvester.harvest.model.HttpFetchResult;
import com.openaasx.harvester.harvest.model.SourceCursors;
import com.openaasx.harvester.harvest.model.SourceKind;
import com.openaasx.harvester.harvest.ratelimit.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SeedSourceTest {
    private static final String SEED = "https://samples.example.com/downloads/";

    @Mock
    private HarvestHttpClient httpClient;

    private HarvesterProperties properties;
    private SeedSource source;

    @BeforeEach
    void setUp() {
        properties = new HarvesterProperties();
        HarvesterProperties.SourceEntry entry = new HarvesterProperties.SourceEntry();
        entry.setUrl(SEED);
        entry.setType("seed");
        HarvesterProperties.SourceEntry sitemap = new HarvesterProperties.SourceEntry();
        sitemap.setUrl("https://ignored.example.com");
        sitemap.setType("sitemap");
        properties.setSources(List.of(entry, sitemap));
        properties.setAllowedDomains(List.of("example.com"));
        source = new SeedSource(properties, httpClient, new LinkExtractor(properties));
    }

    @Test
    void keepsOnlyAllowlistedTargetLinks() {
        String html = """
            <html><body>
              <a href="pump.aasx">Pump</a>
              <a href="https://cdn.example.com/files/Motor.AASX">Motor</a>
              <a href="https://elsewhere.net/valve.aasx">Valve</a>
              <a href="manual.pdf">Manual</a>
              <a href="pump.aasx">Pump again</a>
            </body></html>
            """;
        when(httpClient.get(eq(RateLimiter.WEB), eq(SEED), anyString())).thenReturn(page(SEED, 200, html));

        DiscoveryResult result = source.discover(SourceCursors.empty(), 10);

        assertThat(result.candidates())
            .extracting(Candidate::url)
            .containsExactly(
                "https://cdn.example.com/files/Motor.AASX",
                "https://samples.example.com/downloads/pump.aasx"
            );
        assertThat(result.candidates()).allSatisfy(candidate -> {
            assertThat(candidate.sourceType()).isEqualTo(SourceKind.SEED);
            assertThat(candidate.sourceRef()).isEqualTo(SEED);
        });
        assertThat(result.errors()).containsEntry("domain_not_allowed", 1);
    }

    @Test
    void failedSeedFetchIsCountedNotThrown() {
        when(httpClient.get(eq(RateLimiter.WEB), eq(SEED), anyString())).thenReturn(page(SEED, 503, ""));

        DiscoveryResult result = source.discover(SourceCursors.empty(), 10);

        assertThat(result.candidates()).isEmpty();
        assertThat(result.errors()).containsEntry("http_503", 1);
    }

    @Test
    void stopsAtMaxResults() {
        String html = "<a href='a.aasx'>a</a><a href='b.aasx'>b</a><a href='c.aasx'>c</a>";
        when(httpClient.get(eq(RateLimiter.WEB), eq(SEED), anyString())).thenReturn(page(SEED, 200, html));

        DiscoveryResult result = source.discover(SourceCursors.empty(), 2);

        assertThat(result.candidates()).hasSize(2);
    }

    static HttpFetchResult page(String url, int status, String body) {
        return new HttpFetchResult(
            url,
            URI.create(url),
            status,
            body,
            body.getBytes(StandardCharsets.UTF_8),
            "text/html",
            null,
            null,
            Instant.now(),
            Duration.ofMillis(5),
            null,
            null
        );
    }
}
