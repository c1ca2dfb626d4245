package com.openaasx.harvester.harvest.verify;

import com.fasterxml.jackson.databind.JsonNode;
import com.openaasx.harvester.harvest.model.VerificationOutcome;

/**
 * Catalog-facing outcome plus the checker's raw JSON tree, when it produced one.
 */
public record VerificationReport(VerificationOutcome outcome, JsonNode outcomeTree) {

    public static VerificationReport of(VerificationOutcome outcome) {
        return new VerificationReport(outcome, null);
    }
}
