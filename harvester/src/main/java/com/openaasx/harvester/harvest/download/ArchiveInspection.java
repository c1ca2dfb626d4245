package com.openaasx.harvester.harvest.download;

public record ArchiveInspection(
    int entryCount,
    long compressedBytes,
    long uncompressedBytes,
    double ratio,
    boolean safe,
    boolean readable,
    String reason
) {
    public static ArchiveInspection unreadable(String message) {
        return new ArchiveInspection(0, 0, 0, 0, false, false, "Invalid ZIP file: " + message);
    }
}
