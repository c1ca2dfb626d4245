package com.openaasx.harvester.harvest.extract;

import com.openaasx.harvester.harvest.model.ExtractedMetadata;
import com.openaasx.harvester.harvest.model.ShellInfo;
import com.openaasx.harvester.harvest.model.SubmodelInfo;

import java.util.List;

public record ExtractionResult(
    boolean success,
    List<ShellInfo> shells,
    List<SubmodelInfo> submodels,
    List<String> semanticIds,
    String error
) {
    public static ExtractionResult failure(String error) {
        return new ExtractionResult(false, List.of(), List.of(), List.of(), error);
    }

    public ExtractedMetadata toMetadata() {
        return success ? new ExtractedMetadata(shells, submodels, semanticIds) : ExtractedMetadata.empty();
    }
}
