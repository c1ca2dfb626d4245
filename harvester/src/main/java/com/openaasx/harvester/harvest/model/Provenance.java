package com.openaasx.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Provenance(
    @JsonProperty("source_type") SourceKind sourceType,
    @JsonProperty("source_ref") String sourceRef,
    @JsonProperty("license") String license,
    @JsonProperty("discovered_at") Instant discoveredAt,
    @JsonProperty("last_verified_at") Instant lastVerifiedAt
) {
    public Provenance withDiscoveredAt(Instant value) {
        return new Provenance(sourceType, sourceRef, license, value, lastVerifiedAt);
    }
}
