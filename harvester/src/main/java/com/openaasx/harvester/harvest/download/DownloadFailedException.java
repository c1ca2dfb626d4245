package com.openaasx.harvester.harvest.download;

import com.openaasx.harvester.harvest.model.FailureKind;

public class DownloadFailedException extends DownloadException {
    private final int statusCode;

    public DownloadFailedException(FailureKind kind, int statusCode, String message) {
        super(kind, message);
        this.statusCode = statusCode;
    }

    public DownloadFailedException(FailureKind kind, String message, Throwable cause) {
        super(kind, message, cause);
        this.statusCode = 0;
    }

    public int statusCode() {
        return statusCode;
    }
}
