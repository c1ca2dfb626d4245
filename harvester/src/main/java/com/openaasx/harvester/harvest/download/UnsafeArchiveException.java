package com.openaasx.harvester.harvest.download;

import com.openaasx.harvester.harvest.model.FailureKind;

public class UnsafeArchiveException extends DownloadException {
    private final ArchiveInspection inspection;

    public UnsafeArchiveException(ArchiveInspection inspection) {
        super(inspection.readable() ? FailureKind.RESOURCE_LIMIT : FailureKind.PARSE_FORMAT,
            "Unsafe archive: " + inspection.reason());
        this.inspection = inspection;
    }

    public ArchiveInspection inspection() {
        return inspection;
    }
}
