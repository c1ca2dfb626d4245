package com.openaasx.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationOutcome(
    @JsonProperty("status") VerificationStatus status,
    @JsonProperty("engine") String engine,
    @JsonProperty("exit_code") Integer exitCode,
    @JsonProperty("summary") String summary,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("report_path") String reportPath
) {
    public VerificationOutcome {
        status = status == null ? VerificationStatus.FAILED : status;
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static VerificationOutcome failed(String engine, String summary, List<String> errors) {
        return new VerificationOutcome(VerificationStatus.FAILED, engine, null, summary, errors, null);
    }
}
