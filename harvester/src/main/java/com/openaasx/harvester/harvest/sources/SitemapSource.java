package com.openaasx.harvester.harvest.sources;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.http.HarvestHttpClient;
import com.openaasx.harvester.harvest.model.Candidate;
import com.openaasx.harvester.harvest.model.DiscoveryResult;
import com.openaasx.harvester.harvest.model.HttpFetchResult;
import com.openaasx.harvester.harvest.model.SourceCursors;
import com.openaasx.harvester.harvest.model.SourceKind;
import com.openaasx.harvester.harvest.ratelimit.RateLimiter;
import com.openaasx.harvester.harvest.robots.RobotsRules;
import com.openaasx.harvester.harvest.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.GZIPInputStream;

import static com.openaasx.harvester.harvest.sources.SeedSource.increment;

@Component
public class SitemapSource implements DiscoverySource {
    private static final Logger log = LoggerFactory.getLogger(SitemapSource.class);
    private static final String XML_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";

    private final HarvesterProperties properties;
    private final HarvestHttpClient httpClient;
    private final LinkExtractor linkExtractor;

    public SitemapSource(HarvesterProperties properties, HarvestHttpClient httpClient, LinkExtractor linkExtractor) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.linkExtractor = linkExtractor;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.SITEMAP;
    }

    @Override
    public DiscoveryResult discover(SourceCursors prior, int maxResults) {
        List<Candidate> candidates = new ArrayList<>();
        Map<String, Integer> errors = new LinkedHashMap<>();
        for (String site : properties.sourceUrls("sitemap")) {
            if (candidates.size() >= maxResults) {
                break;
            }
            discoverSite(site, maxResults, candidates, errors);
        }
        return new DiscoveryResult(kind(), candidates, prior, errors);
    }

    private void discoverSite(String site, int maxResults, List<Candidate> candidates, Map<String, Integer> errors) {
        RobotsRules robots = fetchRobots(site);
        List<String> sitemaps = locateSitemaps(site, robots, errors);
        if (sitemaps.isEmpty()) {
            log.info("No sitemap found site={}", site);
            return;
        }
        LinkedHashSet<String> pages = new LinkedHashSet<>();
        for (String sitemap : sitemaps) {
            pages.addAll(collectPages(sitemap, 0, errors));
        }
        List<String> relevant = pages.stream()
            .filter(this::isPotentialTargetPage)
            .limit(properties.getSitemap().getMaxPagesPerSite())
            .toList();
        log.info("Sitemap site={} sitemaps={} pages={} relevant={}", site, sitemaps.size(), pages.size(), relevant.size());

        for (String page : relevant) {
            if (candidates.size() >= maxResults) {
                return;
            }
            if (UrlUtils.hasExtension(page, properties.getTargetExtension())) {
                addCandidate(page, page, candidates, errors);
                continue;
            }
            if (properties.getSitemap().isRespectRobots() && !robots.allowsUrl(page)) {
                increment(errors, "blocked_by_robots");
                continue;
            }
            HttpFetchResult fetch = httpClient.get(RateLimiter.WEB, page, SeedSource.HTML_ACCEPT);
            if (!fetch.isSuccessful()) {
                increment(errors, fetch.errorKey());
                continue;
            }
            for (String link : linkExtractor.extractTargetLinks(fetch.body(), fetch.finalUrlOrRequested())) {
                if (candidates.size() >= maxResults) {
                    return;
                }
                addCandidate(link, page, candidates, errors);
            }
        }
    }

    private void addCandidate(String url, String sourceRef, List<Candidate> candidates, Map<String, Integer> errors) {
        if (!UrlUtils.isAllowedDomain(url, properties.getAllowedDomains())) {
            increment(errors, "domain_not_allowed");
            return;
        }
        candidates.add(new Candidate(url, SourceKind.SITEMAP, sourceRef, null, UrlUtils.lastPathSegment(url)));
    }

    private RobotsRules fetchRobots(String site) {
        String robotsUrl = resolve(site, "/robots.txt");
        if (robotsUrl == null) {
            return RobotsRules.allowAll();
        }
        HttpFetchResult fetch = httpClient.get(RateLimiter.WEB, robotsUrl, "text/plain,*/*;q=0.1");
        if (!fetch.isSuccessful()) {
            return RobotsRules.allowAll();
        }
        return RobotsRules.parse(fetch.body(), site);
    }

    private List<String> locateSitemaps(String site, RobotsRules robots, Map<String, Integer> errors) {
        if (!robots.sitemapUrls().isEmpty()) {
            return robots.sitemapUrls();
        }
        for (String path : properties.getSitemap().getCommonPaths()) {
            String url = resolve(site, path);
            if (url == null) {
                continue;
            }
            HttpFetchResult fetch = httpClient.get(RateLimiter.WEB, url, XML_ACCEPT);
            if (!fetch.isSuccessful()) {
                continue;
            }
            String payload = payloadOrNull(url, fetch, errors);
            if (payload != null && (payload.contains("<urlset") || payload.contains("<sitemapindex"))) {
                return List.of(url);
            }
        }
        return List.of();
    }

    private List<String> collectPages(String sitemapUrl, int depth, Map<String, Integer> errors) {
        if (depth > properties.getSitemap().getMaxDepth()) {
            return List.of();
        }
        HttpFetchResult fetch = httpClient.get(RateLimiter.WEB, sitemapUrl, XML_ACCEPT);
        if (!fetch.isSuccessful()) {
            increment(errors, fetch.errorKey());
            return List.of();
        }
        String payload = payloadOrNull(sitemapUrl, fetch, errors);
        if (payload == null || payload.isBlank()) {
            increment(errors, "empty_sitemap_payload");
            return List.of();
        }
        Document xml = Jsoup.parse(payload, "", Parser.xmlParser());
        List<String> pages = new ArrayList<>();
        for (Element loc : xml.select("url > loc")) {
            String page = loc.text().trim();
            if (!page.isEmpty()) {
                pages.add(page);
            }
        }
        List<String> nested = xml.select("sitemap > loc").eachText();
        for (String child : nested.stream().limit(properties.getSitemap().getMaxNestedSitemaps()).toList()) {
            pages.addAll(collectPages(child.trim(), depth + 1, errors));
        }
        return pages;
    }

    boolean isPotentialTargetPage(String url) {
        if (UrlUtils.hasExtension(url, properties.getTargetExtension())) {
            return true;
        }
        URI uri = UrlUtils.parse(url);
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        for (String keyword : properties.getSitemap().getKeywords()) {
            if (path.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private String payloadOrNull(String sitemapUrl, HttpFetchResult fetch, Map<String, Integer> errors) {
        byte[] bodyBytes = fetch.bodyBytes();
        if (bodyBytes == null) {
            return fetch.body();
        }
        if (!isGzipPayload(sitemapUrl, fetch, bodyBytes)) {
            return new String(bodyBytes, StandardCharsets.UTF_8);
        }
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(bodyBytes))) {
            return new String(gzip.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            increment(errors, "gzip_decode_error");
            return null;
        }
    }

    private boolean isGzipPayload(String sitemapUrl, HttpFetchResult fetch, byte[] bodyBytes) {
        if (bodyBytes.length >= 2 && (bodyBytes[0] & 0xFF) == 0x1f && (bodyBytes[1] & 0xFF) == 0x8b) {
            return true;
        }
        String encoding = fetch.contentEncoding();
        return sitemapUrl.toLowerCase(Locale.ROOT).endsWith(".gz")
            || (encoding != null && encoding.toLowerCase(Locale.ROOT).contains("gzip"));
    }

    private static String resolve(String site, String path) {
        URI base = UrlUtils.parse(site);
        if (base == null) {
            return null;
        }
        return base.resolve(path).toString();
    }
}
