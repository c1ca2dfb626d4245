package com.openaasx.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CatalogEntry(
    @JsonProperty("id") String id,
    @JsonProperty("file") FileFacts file,
    @JsonProperty("provenance") Provenance provenance,
    @JsonProperty("verification") VerificationOutcome verification,
    @JsonProperty("metadata") ExtractedMetadata metadata
) {
    public static final String CONTENT_ID_PREFIX = "sha256-";
    public static final String FAILED_ID_PREFIX = "failed-";

    public CatalogEntry {
        metadata = metadata == null ? ExtractedMetadata.empty() : metadata;
    }

    public String url() {
        return file == null ? null : file.url();
    }

    public String sha256() {
        return file == null ? null : file.sha256();
    }

    public VerificationStatus status() {
        return verification == null ? VerificationStatus.FAILED : verification.status();
    }

    /**
     * Applies a newer observation of the same fingerprint. Everything but the first discovery
     * time comes from {@code update}.
     */
    public CatalogEntry refreshedBy(CatalogEntry update) {
        Provenance merged = update.provenance();
        if (merged != null && provenance != null && provenance.discoveredAt() != null) {
            merged = merged.withDiscoveredAt(provenance.discoveredAt());
        }
        return new CatalogEntry(id, update.file(), merged, update.verification(), update.metadata());
    }
}
