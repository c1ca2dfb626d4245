package com.openaasx.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

public record CommonCrawlCursor(
    @JsonInclude(JsonInclude.Include.ALWAYS) @JsonProperty("last_cursor") String lastCursor,
    @JsonProperty("discovered_domains") Set<String> discoveredDomains,
    @JsonProperty("processed_urls") Set<String> processedUrls
) {
    public CommonCrawlCursor {
        discoveredDomains = Collections.unmodifiableSet(discoveredDomains == null ? new TreeSet<>() : new TreeSet<>(discoveredDomains));
        processedUrls = Collections.unmodifiableSet(processedUrls == null ? new TreeSet<>() : new TreeSet<>(processedUrls));
    }

    public static CommonCrawlCursor initial() {
        return new CommonCrawlCursor(null, null, null);
    }
}
