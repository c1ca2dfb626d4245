package com.openaasx.harvester.harvest.sources;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.http.HarvestHttpClient;
import com.openaasx.harvester.harvest.model.Candidate;
import com.openaasx.harvester.harvest.model.DiscoveryResult;
import com.openaasx.harvester.harvest.model.HttpFetchResult;
import com.openaasx.harvester.harvest.model.SourceCursors;
import com.openaasx.harvester.harvest.model.SourceKind;
import com.openaasx.harvester.harvest.ratelimit.RateLimiter;
import com.openaasx.harvester.harvest.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class SeedSource implements DiscoverySource {
    static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.1";
    private static final Logger log = LoggerFactory.getLogger(SeedSource.class);

    private final HarvesterProperties properties;
    private final HarvestHttpClient httpClient;
    private final LinkExtractor linkExtractor;

    public SeedSource(HarvesterProperties properties, HarvestHttpClient httpClient, LinkExtractor linkExtractor) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.linkExtractor = linkExtractor;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.SEED;
    }

    @Override
    public DiscoveryResult discover(SourceCursors prior, int maxResults) {
        List<Candidate> candidates = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();
        List<String> seeds = properties.sourceUrls("seed");
        if (seeds.isEmpty()) {
            log.info("No seed pages configured");
        }
        for (String seedUrl : seeds) {
            if (candidates.size() >= maxResults) {
                break;
            }
            HttpFetchResult fetch = httpClient.get(RateLimiter.WEB, seedUrl, HTML_ACCEPT);
            if (!fetch.isSuccessful()) {
                log.warn("Seed page fetch failed url={} error={}", seedUrl, fetch.errorKey());
                increment(errors, fetch.errorKey());
                continue;
            }
            int found = 0;
            for (String link : linkExtractor.extractTargetLinks(fetch.body(), fetch.finalUrlOrRequested())) {
                if (candidates.size() >= maxResults) {
                    break;
                }
                if (!UrlUtils.isAllowedDomain(link, properties.getAllowedDomains())) {
                    log.debug("Skipping link outside allowlist url={}", link);
                    increment(errors, "domain_not_allowed");
                    continue;
                }
                candidates.add(new Candidate(link, SourceKind.SEED, seedUrl, null, UrlUtils.lastPathSegment(link)));
                found++;
            }
            log.info("Seed page url={} candidates={}", seedUrl, found);
        }
        return new DiscoveryResult(kind(), candidates, prior, errors);
    }

    static void increment(Map<String, Integer> errors, String key) {
        errors.merge(key, 1, Integer::sum);
    }
}
