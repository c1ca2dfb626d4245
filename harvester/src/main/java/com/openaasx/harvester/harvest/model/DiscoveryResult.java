package com.openaasx.harvester.harvest.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DiscoveryResult(
    SourceKind kind,
    List<Candidate> candidates,
    SourceCursors cursors,
    Map<String, Integer> errors
) {
    public DiscoveryResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        errors = errors == null ? Map.of() : new LinkedHashMap<>(errors);
    }

    public static DiscoveryResult failed(SourceKind kind, SourceCursors prior, String reason) {
        return new DiscoveryResult(kind, List.of(), prior, Map.of(reason, 1));
    }
}
