package com.openaasx.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubmodelInfo(
    @JsonProperty("id") String id,
    @JsonProperty("id_short") String idShort,
    @JsonProperty("semantic_id") String semanticId
) {
}
