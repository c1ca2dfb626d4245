package com.openaasx.harvester.harvest.sources;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.HarvestFixtures;
import com.openaasx.harvester.harvest.http.HarvestHttpClient;
import com.openaasx.harvester.harvest.model.Candidate;
import com.openaasx.harvester.harvest.model.DiscoveryResult;
import com.openaasx.harvester.harvest.model.GitHubCursor;
import com.openaasx.harvester.harvest.model.SourceCursors;
import com.openaasx.harvester.harvest.ratelimit.RateLimiter;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

class GitHubSourceTest {
    private static final String CODE_PAGE = """
        {"total_count": 45, "items": [
          {"name": "pump.aasx",
           "html_url": "https://github.com/acme/models/blob/main/samples/pump.aasx",
           "repository": {"full_name": "acme/models"}},
          {"name": "odd.aasx",
           "html_url": "https://github.com/acme/models/tree/main/odd.aasx",
           "repository": {"full_name": "acme/models"}}
        ]}
        """;
    private static final String REPO_CODE = """
        {"total_count": 1, "items": [
          {"name": "twin.aasx",
           "html_url": "https://github.com/acme/twins/blob/v1/twin.aasx",
           "repository": {"full_name": "acme/twins"}}
        ]}
        """;
    private static final String REPO_CODE_THREE = """
        {"total_count": 3, "items": [
          {"name": "a.aasx", "html_url": "https://github.com/acme/twins/blob/v1/a.aasx",
           "repository": {"full_name": "acme/twins"}},
          {"name": "b.aasx", "html_url": "https://github.com/acme/twins/blob/v1/b.aasx",
           "repository": {"full_name": "acme/twins"}},
          {"name": "c.aasx", "html_url": "https://github.com/acme/twins/blob/v1/c.aasx",
           "repository": {"full_name": "acme/twins"}}
        ]}
        """;

    private MockWebServer server;
    private ExecutorService executor;
    private HarvesterProperties properties;
    private final List<String> codeQueries = new CopyOnWriteArrayList<>();
    private final List<String> codePages = new CopyOnWriteArrayList<>();
    private final AtomicInteger licenseLookups = new AtomicInteger();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();
    private volatile String repoCode = REPO_CODE;
    private volatile int repoStatus = 200;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                authHeaders.add(String.valueOf(request.getHeader("Authorization")));
                HttpUrl url = request.getRequestUrl();
                String path = url.encodedPath();
                if (path.equals("/search/code")) {
                    String q = url.queryParameter("q");
                    codeQueries.add(q);
                    if (q.contains("repo:acme/twins")) {
                        return repoStatus == 200 ? json(repoCode) : new MockResponse().setResponseCode(repoStatus);
                    }
                    codePages.add(url.queryParameter("page"));
                    return json(CODE_PAGE);
                }
                if (path.equals("/search/repositories")) {
                    return json("{\"items\": [{\"full_name\": \"acme/twins\"}]}");
                }
                if (path.equals("/repos/acme/twins/license")) {
                    licenseLookups.incrementAndGet();
                    return json("{\"license\": {\"spdx_id\": \"MIT\"}}");
                }
                return new MockResponse().setResponseCode(404);
            }
        });
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = HarvestFixtures.fastProperties(null);
        String api = server.url("/").toString();
        properties.getGithub().setApiBaseUrl(api.substring(0, api.length() - 1));
        properties.getGithub().setToken("test-token");
        properties.getGithub().setTopics(List.of("aasx"));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    private GitHubSource source() {
        HarvestHttpClient client = new HarvestHttpClient(properties, new RateLimiter(properties.getRateLimits()), executor);
        return new GitHubSource(properties, client, HarvestFixtures.objectMapper());
    }

    @Test
    void firstRunRewritesBlobUrlsAndAdvancesCursor() {
        DiscoveryResult result = source().discover(SourceCursors.empty(), 100);

        assertThat(result.candidates())
            .extracting(Candidate::url, Candidate::sourceRef, Candidate::license)
            .containsExactly(
                tuple("https://raw.githubusercontent.com/acme/models/main/samples/pump.aasx", "acme/models", null),
                tuple("https://raw.githubusercontent.com/acme/twins/v1/twin.aasx", "acme/twins", "MIT")
            );
        GitHubCursor cursor = result.cursors().github();
        assertThat(cursor.codeSearchPage()).isEqualTo(2);
        assertThat(cursor.reposSearched()).containsExactly("acme/twins");
        assertThat(cursor.topicReposSeen()).containsExactly("acme/twins");
        assertThat(cursor.repoLicenses()).containsEntry("acme/twins", "MIT");
        assertThat(result.errors()).containsEntry("unsupported_html_url", 1);
        assertThat(authHeaders).allMatch("Bearer test-token"::equals);
    }

    @Test
    void secondRunResumesFromCursorAndSkipsSearchedRepos() {
        GitHubSource source = source();
        DiscoveryResult first = source.discover(SourceCursors.empty(), 100);

        DiscoveryResult second = source.discover(first.cursors(), 100);

        assertThat(codePages).containsExactly("1", "2");
        assertThat(licenseLookups.get()).isEqualTo(1);
        assertThat(codeQueries.stream().filter(q -> q.contains("repo:"))).hasSize(1);
        // 2 * 30 >= 45, so the last page does not advance
        assertThat(second.cursors().github().codeSearchPage()).isEqualTo(2);
    }

    @Test
    void repoCutShortByResultBudgetIsSearchedAgain() {
        repoCode = REPO_CODE_THREE;
        GitHubSource source = source();

        DiscoveryResult first = source.discover(SourceCursors.empty(), 2);

        assertThat(first.candidates()).extracting(Candidate::url).containsExactly(
            "https://raw.githubusercontent.com/acme/models/main/samples/pump.aasx",
            "https://raw.githubusercontent.com/acme/twins/v1/a.aasx");
        assertThat(first.cursors().github().reposSearched()).isEmpty();

        DiscoveryResult second = source.discover(first.cursors(), 100);

        assertThat(second.candidates()).extracting(Candidate::url).contains(
            "https://raw.githubusercontent.com/acme/twins/v1/b.aasx",
            "https://raw.githubusercontent.com/acme/twins/v1/c.aasx");
        assertThat(second.cursors().github().reposSearched()).containsExactly("acme/twins");
    }

    @Test
    void failedRepoSearchLeavesRepoPending() {
        repoStatus = 500;
        GitHubSource source = source();

        DiscoveryResult first = source.discover(SourceCursors.empty(), 100);

        assertThat(first.candidates()).extracting(Candidate::sourceRef).containsExactly("acme/models");
        assertThat(first.cursors().github().reposSearched()).isEmpty();
        assertThat(first.errors()).containsEntry("http_500", 1);

        repoStatus = 200;
        DiscoveryResult second = source.discover(first.cursors(), 100);

        assertThat(second.candidates()).extracting(Candidate::sourceRef).contains("acme/twins");
        assertThat(second.cursors().github().reposSearched()).containsExactly("acme/twins");
    }

    @Test
    void codePageCutShortByResultBudgetIsNotAdvanced() {
        DiscoveryResult result = source().discover(SourceCursors.empty(), 0);

        assertThat(result.candidates()).isEmpty();
        assertThat(result.cursors().github().codeSearchPage()).isEqualTo(1);
    }

    @Test
    void cachedLicenseEnrichesCodeSearchHits() {
        GitHubCursor cursor = new GitHubCursor(1, null, Set.of("acme/twins"), Map.of("acme/models", "Apache-2.0"));

        DiscoveryResult result = source().discover(SourceCursors.empty().withGithub(cursor), 100);

        assertThat(result.candidates())
            .extracting(Candidate::license)
            .containsExactly("Apache-2.0");
        assertThat(licenseLookups.get()).isZero();
    }

    @Test
    void onlyBlobUrlsOnGithubMapToRawHost() {
        GitHubSource source = source();

        assertThat(source.toRawUrl("https://github.com/o/r/blob/main/dir/a b.aasx"))
            .isEmpty();
        assertThat(source.toRawUrl("https://github.com/o/r/blob/main/dir/a%20b.aasx"))
            .contains("https://raw.githubusercontent.com/o/r/main/dir/a%20b.aasx");
        assertThat(source.toRawUrl("https://gitlab.com/o/r/blob/main/a.aasx")).isEmpty();
        assertThat(source.toRawUrl("https://github.com/o/r/raw/main/a.aasx")).isEmpty();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json").setBody(body);
    }
}
