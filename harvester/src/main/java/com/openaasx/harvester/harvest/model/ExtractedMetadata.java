package com.openaasx.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ExtractedMetadata(
    @JsonProperty("shells") List<ShellInfo> shells,
    @JsonProperty("submodels") List<SubmodelInfo> submodels,
    @JsonProperty("semantic_ids") List<String> semanticIds
) {
    public ExtractedMetadata {
        shells = shells == null ? List.of() : List.copyOf(shells);
        submodels = submodels == null ? List.of() : List.copyOf(submodels);
        semanticIds = semanticIds == null ? List.of() : List.copyOf(semanticIds);
    }

    public static ExtractedMetadata empty() {
        return new ExtractedMetadata(List.of(), List.of(), List.of());
    }
}
