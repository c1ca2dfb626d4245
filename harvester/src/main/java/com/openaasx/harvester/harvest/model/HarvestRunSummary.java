package com.openaasx.harvester.harvest.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record HarvestRunSummary(
    HarvestPhase phase,
    boolean dryRun,
    Instant startedAt,
    Instant finishedAt,
    int discoveredCount,
    int newCandidateCount,
    int processedCount,
    Map<VerificationStatus, Integer> byStatus,
    Map<SourceKind, Integer> candidatesBySource,
    Map<SourceKind, Map<String, Integer>> sourceErrors,
    List<String> plannedUrls,
    int catalogSize
) {
}
