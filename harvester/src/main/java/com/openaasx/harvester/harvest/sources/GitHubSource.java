package com.openaasx.harvester.harvest.sources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.http.HarvestHttpClient;
import com.openaasx.harvester.harvest.model.Candidate;
import com.openaasx.harvester.harvest.model.DiscoveryResult;
import com.openaasx.harvester.harvest.model.GitHubCursor;
import com.openaasx.harvester.harvest.model.HttpFetchResult;
import com.openaasx.harvester.harvest.model.SourceCursors;
import com.openaasx.harvester.harvest.model.SourceKind;
import com.openaasx.harvester.harvest.ratelimit.RateLimiter;
import com.openaasx.harvester.harvest.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

import static com.openaasx.harvester.harvest.sources.SeedSource.increment;

@Component
public class GitHubSource implements DiscoverySource {
    private static final Logger log = LoggerFactory.getLogger(GitHubSource.class);
    private static final String ACCEPT = "application/vnd.github+json";
    private static final String API_VERSION = "2022-11-28";

    private final HarvesterProperties properties;
    private final HarvestHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GitHubSource(HarvesterProperties properties, HarvestHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.GITHUB;
    }

    @Override
    public DiscoveryResult discover(SourceCursors prior, int maxResults) {
        GitHubCursor cursor = prior.github();
        Map<String, Integer> errors = new LinkedHashMap<>();
        List<Candidate> candidates = new ArrayList<>();
        TreeSet<String> topicReposSeen = new TreeSet<>(cursor.topicReposSeen());
        TreeSet<String> reposSearched = new TreeSet<>(cursor.reposSearched());
        TreeMap<String, String> licenses = new TreeMap<>(cursor.repoLicenses());
        if (!properties.getGithub().hasToken()) {
            log.warn("No GitHub token configured; code search requires authentication");
        }

        int page = cursor.codeSearchPage();
        int perPage = properties.getGithub().getPerPage();
        String codeQuery = "extension:" + properties.getTargetExtension();
        SearchPage codePage = search(codeQuery, page, perPage, licenses, errors);
        boolean codePageKept = addUpTo(candidates, codePage.candidates(), maxResults);
        int nextPage = codePage.hasMore() && codePageKept ? page + 1 : page;
        log.info("GitHub code search page={} total={} candidates={} has_more={}",
            page, codePage.totalCount(), codePage.candidates().size(), codePage.hasMore());

        for (String topic : properties.getGithub().getTopics()) {
            if (candidates.size() >= maxResults) {
                break;
            }
            for (String repo : searchTopic(topic, errors)) {
                if (candidates.size() >= maxResults) {
                    break;
                }
                if (reposSearched.contains(repo)) {
                    continue;
                }
                topicReposSeen.add(repo);
                String license = licenses.containsKey(repo) ? licenses.get(repo) : lookupLicense(repo, licenses, errors);
                String repoQuery = codeQuery + " repo:" + repo;
                SearchPage repoPage = search(repoQuery, 1, properties.getGithub().getRepoSearchPerPage(), licenses, errors);
                List<Candidate> withLicense = repoPage.candidates().stream()
                    .map(c -> new Candidate(c.url(), c.sourceType(), c.sourceRef(), emptyToNull(license), c.filename()))
                    .toList();
                boolean allKept = addUpTo(candidates, withLicense, maxResults);
                // a repo is only done once its search answered and every file made it into the result
                if (!repoPage.failed() && allKept) {
                    reposSearched.add(repo);
                }
                log.debug("GitHub topic={} repo={} files={} complete={}", topic, repo, withLicense.size(),
                    !repoPage.failed() && allKept);
            }
        }

        GitHubCursor updated = new GitHubCursor(nextPage, topicReposSeen, reposSearched, licenses);
        return new DiscoveryResult(kind(), candidates, prior.withGithub(updated), errors);
    }


    private SearchPage search(String query, int page, int perPage, Map<String, String> licenses, Map<String, Integer> errors) {
        String url = properties.getGithub().getApiBaseUrl() + "/search/code?q=" + encode(query)
            + "&page=" + page + "&per_page=" + perPage;
        JsonNode json = fetchJson(url, errors);
        if (json == null) {
            return SearchPage.FAILED;
        }
        long total = json.path("total_count").asLong(0);
        List<Candidate> found = new ArrayList<>();
        for (JsonNode item : json.path("items")) {
            String repo = item.path("repository").path("full_name").asText(null);
            Optional<String> raw = toRawUrl(item.path("html_url").asText(null));
            if (raw.isEmpty()) {
                increment(errors, "unsupported_html_url");
                continue;
            }
            String license = repo == null ? null : emptyToNull(licenses.get(repo));
            found.add(new Candidate(raw.get(), SourceKind.GITHUB, repo, license, item.path("name").asText(null)));
        }
        boolean hasMore = (long) page * perPage < total;
        return new SearchPage(found, total, hasMore, false);
    }

    private List<String> searchTopic(String topic, Map<String, Integer> errors) {
        String url = properties.getGithub().getApiBaseUrl() + "/search/repositories?q=" + encode("topic:" + topic)
            + "&sort=updated&per_page=" + properties.getGithub().getPerPage();
        JsonNode json = fetchJson(url, errors);
        if (json == null) {
            return List.of();
        }
        List<String> repos = new ArrayList<>();
        for (JsonNode item : json.path("items")) {
            String name = item.path("full_name").asText("");
            if (!name.isBlank()) {
                repos.add(name);
            }
        }
        return repos;
    }

    private String lookupLicense(String repo, Map<String, String> licenses, Map<String, Integer> errors) {
        String url = properties.getGithub().getApiBaseUrl() + "/repos/" + repo + "/license";
        HttpFetchResult fetch = httpClient.get(RateLimiter.GITHUB, url, ACCEPT, headers());
        if (fetch.statusCode() == 404) {
            licenses.put(repo, "");
            return null;
        }
        if (!fetch.isSuccessful()) {
            increment(errors, "license_" + fetch.errorKey());
            return null;
        }
        try {
            String spdx = objectMapper.readTree(fetch.body()).path("license").path("spdx_id").asText("");
            licenses.put(repo, spdx);
            return emptyToNull(spdx);
        } catch (JsonProcessingException e) {
            increment(errors, "invalid_json");
            return null;
        }
    }

    /**
     * Maps {@code https://github.com/{owner}/{repo}/blob/{ref}/{path}} to the raw content host.
     */
    Optional<String> toRawUrl(String htmlUrl) {
        URI uri = UrlUtils.parse(htmlUrl);
        if (uri == null || !"github.com".equalsIgnoreCase(uri.getHost()) || uri.getRawPath() == null) {
            return Optional.empty();
        }
        String[] parts = uri.getRawPath().split("/", 6);
        // "", owner, repo, "blob", ref, path
        if (parts.length < 6 || !parts[3].equals("blob") || parts[1].isEmpty() || parts[2].isEmpty()
            || parts[4].isEmpty() || parts[5].isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(properties.getGithub().getRawBaseUrl() + "/" + parts[1] + "/" + parts[2] + "/" + parts[4] + "/" + parts[5]);
    }

    private JsonNode fetchJson(String url, Map<String, Integer> errors) {
        HttpFetchResult fetch = httpClient.get(RateLimiter.GITHUB, url, ACCEPT, headers());
        if (!fetch.isSuccessful()) {
            log.warn("GitHub request failed url={} error={}", url, fetch.errorKey());
            increment(errors, fetch.errorKey());
            return null;
        }
        try {
            return objectMapper.readTree(fetch.body());
        } catch (JsonProcessingException e) {
            increment(errors, "invalid_json");
            return null;
        }
    }

    private Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-GitHub-Api-Version", API_VERSION);
        if (properties.getGithub().hasToken()) {
            headers.put("Authorization", "Bearer " + properties.getGithub().getToken().trim());
        }
        return headers;
    }

    /**
     * Returns false when {@code max} cut the source short.
     */
    private static boolean addUpTo(List<Candidate> target, List<Candidate> source, int max) {
        for (Candidate candidate : source) {
            if (target.size() >= max) {
                return false;
            }
            target.add(candidate);
        }
        return true;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private record SearchPage(List<Candidate> candidates, long totalCount, boolean hasMore, boolean failed) {
        static final SearchPage FAILED = new SearchPage(List.of(), 0, false, true);
    }
}
