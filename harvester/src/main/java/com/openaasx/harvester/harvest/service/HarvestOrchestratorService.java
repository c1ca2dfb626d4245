package com.openaasx.harvester.harvest.service;

import com.openaasx.harvester.config.HarvesterProperties;
import com.openaasx.harvester.harvest.model.Candidate;
import com.openaasx.harvester.harvest.model.CatalogEntry;
import com.openaasx.harvester.harvest.model.DiscoveryResult;
import com.openaasx.harvester.harvest.model.FailureKind;
import com.openaasx.harvester.harvest.model.HarvestPhase;
import com.openaasx.harvester.harvest.model.HarvestRunRequest;
import com.openaasx.harvester.harvest.model.HarvestRunSummary;
import com.openaasx.harvester.harvest.model.HarvestState;
import com.openaasx.harvester.harvest.model.LocalEnvironmentException;
import com.openaasx.harvester.harvest.model.SourceCursors;
import com.openaasx.harvester.harvest.model.SourceKind;
import com.openaasx.harvester.harvest.model.VerificationStatus;
import com.openaasx.harvester.harvest.persistence.CatalogFormatException;
import com.openaasx.harvester.harvest.persistence.CatalogStore;
import com.openaasx.harvester.harvest.persistence.StateStore;
import com.openaasx.harvester.harvest.publish.CatalogPublisher;
import com.openaasx.harvester.harvest.sources.DiscoverySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Drives one harvest run: load state, discover, deduplicate, process, merge, persist, publish.
 */
@Service
public class HarvestOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(HarvestOrchestratorService.class);

    private final HarvesterProperties properties;
    private final StateStore stateStore;
    private final CatalogStore catalogStore;
    private final List<DiscoverySource> sources;
    private final CandidateProcessor candidateProcessor;
    private final CatalogPublisher publisher;
    private final ExecutorService discoveryExecutor;
    private final ExecutorService processingExecutor;
    private volatile HarvestPhase phase = HarvestPhase.IDLE;

    public HarvestOrchestratorService(
        HarvesterProperties properties,
        StateStore stateStore,
        CatalogStore catalogStore,
        List<DiscoverySource> sources,
        CandidateProcessor candidateProcessor,
        CatalogPublisher publisher,
        @Qualifier("discoveryExecutor") ExecutorService discoveryExecutor,
        @Qualifier("processingExecutor") ExecutorService processingExecutor
    ) {
        this.properties = properties;
        this.stateStore = stateStore;
        this.catalogStore = catalogStore;
        this.sources = sources.stream().sorted(Comparator.comparing(DiscoverySource::kind)).toList();
        this.candidateProcessor = candidateProcessor;
        this.publisher = publisher;
        this.discoveryExecutor = discoveryExecutor;
        this.processingExecutor = processingExecutor;
    }

    public HarvestPhase currentPhase() {
        return phase;
    }

    public HarvestRunSummary run(HarvestRunRequest request) {
        Instant startedAt = Instant.now();
        HarvesterProperties.Run defaults = properties.getRun();
        int maxValidate = request.maxValidate() == null ? defaults.getMaxValidate() : Math.max(0, request.maxValidate());
        int maxGithub = request.maxGithub() == null ? defaults.getMaxGithub() : Math.max(0, request.maxGithub());
        int maxWeb = request.maxWeb() == null ? defaults.getMaxWeb() : Math.max(0, request.maxWeb());
        try {
            enter(HarvestPhase.LOADING_STATE);
            HarvestState state = stateStore.load();
            stateStore.reconcile(state, catalogStore);

            enter(HarvestPhase.DISCOVERING);
            List<DiscoveryResult> results = discover(request, state.getCursors(), maxGithub, maxWeb);
            SourceCursors cursors = state.getCursors();
            List<Candidate> discovered = new ArrayList<>();
            Map<SourceKind, Integer> bySource = new EnumMap<>(SourceKind.class);
            Map<SourceKind, Map<String, Integer>> sourceErrors = new EnumMap<>(SourceKind.class);
            for (DiscoveryResult result : results) {
                cursors = cursors.mergeFrom(result.kind(), result.cursors());
                discovered.addAll(result.candidates());
                bySource.put(result.kind(), result.candidates().size());
                if (!result.errors().isEmpty()) {
                    sourceErrors.put(result.kind(), result.errors());
                }
            }
            log.info("Discovery finished candidates={} by_source={} errors={}", discovered.size(), bySource, sourceErrors);

            enter(HarvestPhase.DEDUPLICATING);
            List<Candidate> fresh = deduplicate(discovered, state);
            List<Candidate> batch = fresh.subList(0, Math.min(maxValidate, fresh.size()));
            List<Candidate> deferred = fresh.subList(batch.size(), fresh.size());
            log.info("Deduplicated new={} batch={} deferred={}", fresh.size(), batch.size(), deferred.size());

            if (request.dryRun()) {
                List<String> planned = batch.stream().map(Candidate::url).toList();
                planned.forEach(url -> log.info("Would process {}", url));
                enter(HarvestPhase.DONE);
                return new HarvestRunSummary(HarvestPhase.DONE, true, startedAt, Instant.now(), discovered.size(),
                    fresh.size(), 0, Map.of(), bySource, sourceErrors, planned, catalogStore.readAll().size());
            }
            state.setCursors(cursors.settle(state.getCursors(), batch, deferred));

            enter(HarvestPhase.PROCESSING);
            List<CatalogEntry> entries = process(batch);
            for (CatalogEntry entry : entries) {
                state.markUrlSeen(entry.url());
                state.markSha256Seen(entry.sha256());
            }

            enter(HarvestPhase.MERGING);
            if (!entries.isEmpty()) {
                catalogStore.merge(entries);
            }

            enter(HarvestPhase.PERSISTING);
            state.setLastRun(Instant.now());
            stateStore.save(state);

            enter(HarvestPhase.PUBLISHING);
            List<CatalogEntry> catalog = catalogStore.readAll();
            if (properties.getPublish().isEnabled()) {
                publisher.publish(catalog, properties.getStorage().publicPath());
            }

            enter(HarvestPhase.DONE);
            Map<VerificationStatus, Integer> byStatus = new EnumMap<>(VerificationStatus.class);
            entries.forEach(entry -> byStatus.merge(entry.status(), 1, Integer::sum));
            log.info("Harvest finished processed={} by_status={} catalog_size={}", entries.size(), byStatus, catalog.size());
            return new HarvestRunSummary(HarvestPhase.DONE, false, startedAt, Instant.now(), discovered.size(),
                fresh.size(), entries.size(), byStatus, bySource, sourceErrors, List.of(), catalog.size());
        } catch (LocalEnvironmentException | CatalogFormatException e) {
            log.error("Harvest aborted in phase {}: {}", phase, e.getMessage());
            throw e;
        } finally {
            if (phase == HarvestPhase.DONE) {
                phase = HarvestPhase.IDLE;
            }
        }
    }

    private List<DiscoveryResult> discover(HarvestRunRequest request, SourceCursors prior, int maxGithub, int maxWeb) {
        List<DiscoverySource> selected = sources.stream().filter(source -> request.includes(source.kind())).toList();
        List<CompletableFuture<DiscoveryResult>> futures = new ArrayList<>();
        for (DiscoverySource source : selected) {
            int limit = source.kind().isWebClass() ? maxWeb : maxGithub;
            futures.add(CompletableFuture.supplyAsync(() -> source.discover(prior, limit), discoveryExecutor));
        }
        List<DiscoveryResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            DiscoverySource source = selected.get(i);
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                log.warn("Discovery source {} failed", source.kind().id(), e.getCause());
                results.add(DiscoveryResult.failed(source.kind(), prior, "source_exception"));
            }
        }
        return results;
    }

    private List<CatalogEntry> process(List<Candidate> batch) {
        List<CompletableFuture<CatalogEntry>> futures = new ArrayList<>();
        for (Candidate candidate : batch) {
            futures.add(CompletableFuture.supplyAsync(() -> candidateProcessor.process(candidate), processingExecutor));
        }
        List<CatalogEntry> entries = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Candidate candidate = batch.get(i);
            try {
                entries.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof LocalEnvironmentException localFailure) {
                    throw localFailure;
                }
                log.warn("Processing failed url={}", candidate.url(), cause);
                String reason = cause == null ? "unknown error" : String.valueOf(cause.getMessage());
                entries.add(candidateProcessor.failedEntry(candidate, FailureKind.PERMANENT_REMOTE, reason));
            }
        }
        return entries;
    }

    /**
     * Drops candidates whose URL was seen in an earlier run or earlier in this batch.
     */
    static List<Candidate> deduplicate(List<Candidate> candidates, HarvestState state) {
        Set<String> batchUrls = new LinkedHashSet<>();
        List<Candidate> fresh = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (candidate.url() == null || state.isSeenUrl(candidate.url()) || !batchUrls.add(candidate.url())) {
                continue;
            }
            fresh.add(candidate);
        }
        return fresh;
    }

    private void enter(HarvestPhase next) {
        log.debug("Harvest phase {} -> {}", phase, next);
        phase = next;
    }
}
