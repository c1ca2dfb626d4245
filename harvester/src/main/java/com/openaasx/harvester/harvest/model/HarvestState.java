package com.openaasx.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

public class HarvestState {
    private SourceCursors cursors = SourceCursors.empty();
    private Set<String> seenUrls = new TreeSet<>();
    private Set<String> seenSha256 = new TreeSet<>();
    private Instant lastRun;

    @JsonProperty("cursors")
    public SourceCursors getCursors() {
        return cursors;
    }

    @JsonProperty("cursors")
    public void setCursors(SourceCursors cursors) {
        this.cursors = cursors == null ? SourceCursors.empty() : cursors;
    }

    @JsonProperty("seen_urls")
    public Set<String> getSeenUrls() {
        return seenUrls;
    }

    @JsonProperty("seen_urls")
    public void setSeenUrls(Collection<String> seenUrls) {
        this.seenUrls = seenUrls == null ? new TreeSet<>() : new TreeSet<>(seenUrls);
    }

    @JsonProperty("seen_sha256")
    public Set<String> getSeenSha256() {
        return seenSha256;
    }

    @JsonProperty("seen_sha256")
    public void setSeenSha256(Collection<String> seenSha256) {
        this.seenSha256 = seenSha256 == null ? new TreeSet<>() : new TreeSet<>(seenSha256);
    }

    @JsonProperty("last_run")
    public Instant getLastRun() {
        return lastRun;
    }

    @JsonProperty("last_run")
    public void setLastRun(Instant lastRun) {
        this.lastRun = lastRun;
    }

    public boolean isSeenUrl(String url) {
        return url != null && seenUrls.contains(url);
    }

    public boolean isSeenSha256(String sha256) {
        return sha256 != null && seenSha256.contains(sha256);
    }

    public boolean markUrlSeen(String url) {
        return url != null && !url.isBlank() && seenUrls.add(url);
    }

    public boolean markSha256Seen(String sha256) {
        return sha256 != null && !sha256.isBlank() && seenSha256.add(sha256);
    }
}
