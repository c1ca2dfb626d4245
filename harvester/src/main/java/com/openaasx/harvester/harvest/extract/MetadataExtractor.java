package com.openaasx.harvester.harvest.extract;

import java.nio.file.Path;

public interface MetadataExtractor {

    /**
     * Never throws; failures are reported through {@link ExtractionResult#error()}.
     */
    ExtractionResult extract(Path file);
}
