package com.openaasx.harvester.harvest.download;

import com.openaasx.harvester.harvest.model.FailureKind;

public class FileTooLargeException extends DownloadException {
    private final long limitBytes;

    public FileTooLargeException(String message, long limitBytes) {
        super(FailureKind.RESOURCE_LIMIT, message);
        this.limitBytes = limitBytes;
    }

    public long limitBytes() {
        return limitBytes;
    }
}
