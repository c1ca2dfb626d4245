package com.openaasx.harvester.harvest.model;

public record Candidate(
    String url,
    SourceKind sourceType,
    String sourceRef,
    String license,
    String filename
) {
    public Candidate(String url, SourceKind sourceType, String sourceRef) {
        this(url, sourceType, sourceRef, null, null);
    }
}
