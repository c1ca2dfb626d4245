package com.openaasx.harvester.harvest.model;

public record HarvestRunRequest(
    Integer maxValidate,
    Integer maxGithub,
    Integer maxWeb,
    boolean dryRun,
    SourceKind source
) {
    public static HarvestRunRequest defaults() {
        return new HarvestRunRequest(null, null, null, false, null);
    }

    public boolean includes(SourceKind kind) {
        return source == null || source == kind;
    }
}
