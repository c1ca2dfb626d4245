package com.openaasx.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShellInfo(
    @JsonProperty("id") String id,
    @JsonProperty("id_short") String idShort,
    @JsonProperty("global_asset_id") String globalAssetId
) {
}
