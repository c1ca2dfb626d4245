package com.openaasx.harvester.harvest.sources;

import com.openaasx.harvester.harvest.model.DiscoveryResult;
import com.openaasx.harvester.harvest.model.SourceCursors;
import com.openaasx.harvester.harvest.model.SourceKind;

public interface DiscoverySource {

    SourceKind kind();

    /**
     * Finds at most {@code maxResults} candidates, resuming from {@code prior}. Failures are
     * reported through the result's error counters, never thrown.
     */
    DiscoveryResult discover(SourceCursors prior, int maxResults);
}
