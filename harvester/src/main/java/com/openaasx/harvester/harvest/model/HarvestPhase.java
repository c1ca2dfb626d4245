package com.openaasx.harvester.harvest.model;

public enum HarvestPhase {
    IDLE,
    LOADING_STATE,
    DISCOVERING,
    DEDUPLICATING,
    PROCESSING,
    MERGING,
    PERSISTING,
    PUBLISHING,
    DONE
}
