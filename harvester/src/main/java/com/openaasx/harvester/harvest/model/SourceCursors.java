package com.openaasx.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public record SourceCursors(
    @JsonProperty("github") GitHubCursor github,
    @JsonProperty("commoncrawl") CommonCrawlCursor commoncrawl
) {
    public SourceCursors {
        github = github == null ? GitHubCursor.initial() : github;
        commoncrawl = commoncrawl == null ? CommonCrawlCursor.initial() : commoncrawl;
    }

    public static SourceCursors empty() {
        return new SourceCursors(null, null);
    }

    public SourceCursors withGithub(GitHubCursor cursor) {
        return new SourceCursors(cursor, commoncrawl);
    }

    public SourceCursors withCommoncrawl(CommonCrawlCursor cursor) {
        return new SourceCursors(github, cursor);
    }

    /**
     * Takes the slice owned by {@code kind} from {@code updated}, keeping every other slice.
     */
    public SourceCursors mergeFrom(SourceKind kind, SourceCursors updated) {
        if (updated == null) {
            return this;
        }
        return switch (kind) {
            case GITHUB -> withGithub(updated.github());
            case COMMONCRAWL -> withCommoncrawl(updated.commoncrawl());
            default -> this;
        };
    }

    /**
     * Reconciles the cursors produced by discovery with what the run actually harvested. URLs of
     * the processed batch join {@code processed_urls}. Any source with deferred candidates keeps its
     * previous paging position, and repositories with deferred files are searched again.
     */
    public SourceCursors settle(SourceCursors prior, List<Candidate> processed, List<Candidate> deferred) {
        TreeSet<String> processedUrls = new TreeSet<>(commoncrawl.processedUrls());
        for (Candidate candidate : processed) {
            if (candidate.sourceType() == SourceKind.COMMONCRAWL && candidate.url() != null) {
                processedUrls.add(candidate.url());
            }
        }
        boolean commoncrawlDeferred = deferred.stream().anyMatch(c -> c.sourceType() == SourceKind.COMMONCRAWL);
        CommonCrawlCursor settledCommoncrawl = new CommonCrawlCursor(
            commoncrawlDeferred ? prior.commoncrawl().lastCursor() : commoncrawl.lastCursor(),
            commoncrawl.discoveredDomains(),
            processedUrls
        );

        Set<String> reposSearched = new TreeSet<>(github.reposSearched());
        boolean githubDeferred = false;
        for (Candidate candidate : deferred) {
            if (candidate.sourceType() == SourceKind.GITHUB) {
                githubDeferred = true;
                if (candidate.sourceRef() != null && !prior.github().reposSearched().contains(candidate.sourceRef())) {
                    reposSearched.remove(candidate.sourceRef());
                }
            }
        }
        GitHubCursor settledGithub = new GitHubCursor(
            githubDeferred ? prior.github().codeSearchPage() : github.codeSearchPage(),
            github.topicReposSeen(),
            reposSearched,
            github.repoLicenses()
        );
        return new SourceCursors(settledGithub, settledCommoncrawl);
    }
}
