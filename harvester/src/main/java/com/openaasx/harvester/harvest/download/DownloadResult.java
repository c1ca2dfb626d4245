package com.openaasx.harvester.harvest.download;

import java.nio.file.Path;

public record DownloadResult(
    Path path,
    long sizeBytes,
    String sha256,
    String contentType,
    String filename
) {
}
