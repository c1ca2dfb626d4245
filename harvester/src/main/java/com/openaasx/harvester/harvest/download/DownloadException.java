package com.openaasx.harvester.harvest.download;

import com.openaasx.harvester.harvest.model.FailureKind;

public abstract class DownloadException extends Exception {
    private final FailureKind kind;

    protected DownloadException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected DownloadException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }
}
