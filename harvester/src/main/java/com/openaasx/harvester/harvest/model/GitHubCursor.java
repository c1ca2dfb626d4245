package com.openaasx.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Progress of the code-hosting source. An empty license value marks a repository that was looked
 * up and has no detectable license.
 */
public record GitHubCursor(
    @JsonProperty("code_search_page") int codeSearchPage,
    @JsonProperty("topic_repos_seen") Set<String> topicReposSeen,
    @JsonProperty("repos_searched") Set<String> reposSearched,
    @JsonProperty("repo_licenses") Map<String, String> repoLicenses
) {
    public GitHubCursor {
        codeSearchPage = Math.max(1, codeSearchPage);
        topicReposSeen = Collections.unmodifiableSet(topicReposSeen == null ? new TreeSet<>() : new TreeSet<>(topicReposSeen));
        reposSearched = Collections.unmodifiableSet(reposSearched == null ? new TreeSet<>() : new TreeSet<>(reposSearched));
        repoLicenses = Collections.unmodifiableMap(repoLicenses == null ? new TreeMap<>() : new TreeMap<>(repoLicenses));
    }

    public static GitHubCursor initial() {
        return new GitHubCursor(1, null, null, null);
    }
}
