package com.openaasx.harvester.harvest.sources;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.http.HarvestHttpClient;
import com.openaasx.harvester.harvest.model.Candidate;
import com.openaasx.harvester.harvest.model.CommonCrawlCursor;
import com.openaasx.harvester.harvest.model.DiscoveryResult;
import com.openaasx.harvester.harvest.model.HttpFetchResult;
import com.openaasx.harvester.harvest.model.SourceCursors;
import com.openaasx.harvester.harvest.model.SourceKind;
import com.openaasx.harvester.harvest.ratelimit.RateLimiter;
import com.openaasx.harvester.harvest.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static com.openaasx.harvester.harvest.sources.SeedSource.increment;

@Component
public class CommonCrawlSource implements DiscoverySource {
    static final String NEXT_PAGE_HEADER = "X-CDX-Next-Page-Token";
    private static final Logger log = LoggerFactory.getLogger(CommonCrawlSource.class);
    private static final int MAX_LOGGED_DOMAINS = 10;

    private final HarvesterProperties properties;
    private final HarvestHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public CommonCrawlSource(HarvesterProperties properties, HarvestHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.COMMONCRAWL;
    }

    @Override
    public DiscoveryResult discover(SourceCursors prior, int maxResults) {
        CommonCrawlCursor cursor = prior.commoncrawl();
        Map<String, Integer> errors = new LinkedHashMap<>();
        HarvesterProperties.CommonCrawl config = properties.getCommoncrawl();
        int limit = Math.min(Math.max(1, maxResults * 2), config.getMaxLimit());

        StringBuilder url = new StringBuilder(config.getIndexUrl())
            .append("?url=").append(encode(config.getUrlPattern()))
            .append("&output=json")
            .append("&limit=").append(limit)
            .append("&matchType=").append(encode(config.getMatchType()));
        if (cursor.lastCursor() != null && !cursor.lastCursor().isBlank()) {
            url.append("&cursor=").append(encode(cursor.lastCursor()));
        }

        HttpFetchResult fetch = httpClient.get(RateLimiter.WEB, url.toString(), "application/json,text/plain;q=0.9,*/*;q=0.1");
        if (!fetch.isSuccessful()) {
            log.warn("Common Crawl index query failed error={}", fetch.errorKey());
            increment(errors, fetch.errorKey());
            return new DiscoveryResult(kind(), List.of(), prior, errors);
        }

        // processed_urls grows only after harvesting, see SourceCursors.settle
        Set<String> processed = cursor.processedUrls();
        Set<String> emitted = new HashSet<>();
        TreeSet<String> domains = new TreeSet<>(cursor.discoveredDomains());
        List<String> newDomains = new ArrayList<>();
        List<Candidate> candidates = new ArrayList<>();
        String body = fetch.body() == null ? "" : fetch.body();
        boolean truncated = false;
        for (String line : body.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            if (candidates.size() >= maxResults) {
                truncated = true;
                break;
            }
            JsonNode record;
            try {
                record = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                increment(errors, "invalid_record");
                continue;
            }
            String recordUrl = record.path("url").asText("");
            if (recordUrl.isBlank() || processed.contains(recordUrl) || emitted.contains(recordUrl)
                || !UrlUtils.hasExtension(recordUrl, properties.getTargetExtension())) {
                continue;
            }
            String domain = UrlUtils.host(recordUrl);
            if (domain != null && domains.add(domain)) {
                newDomains.add(domain);
            }
            if (!UrlUtils.isAllowedDomain(recordUrl, properties.getAllowedDomains())) {
                increment(errors, "domain_not_allowed");
                continue;
            }
            String timestamp = record.path("timestamp").asText("");
            emitted.add(recordUrl);
            candidates.add(new Candidate(
                recordUrl,
                SourceKind.COMMONCRAWL,
                timestamp.isBlank() ? "commoncrawl" : timestamp,
                null,
                UrlUtils.lastPathSegment(recordUrl)
            ));
        }

        if (!newDomains.isEmpty()) {
            log.info("Common Crawl discovered {} new domains: {}", newDomains.size(),
                newDomains.subList(0, Math.min(MAX_LOGGED_DOMAINS, newDomains.size())));
        }
        // a page cut short by the result budget is read again next time
        String nextCursor = truncated ? cursor.lastCursor() : fetch.header(NEXT_PAGE_HEADER);
        CommonCrawlCursor updated = new CommonCrawlCursor(nextCursor, domains, processed);
        log.info("Common Crawl candidates={} next_cursor={}", candidates.size(), nextCursor);
        return new DiscoveryResult(kind(), candidates, prior.withCommoncrawl(updated), errors);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
