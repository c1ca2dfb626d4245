package com.openaasx.harvester.harvest.model;

import java.util.Locale;

public enum FailureKind {
    TRANSIENT_NETWORK,
    RESOURCE_LIMIT,
    PERMANENT_REMOTE,
    PARSE_FORMAT,
    LOCAL_ENVIRONMENT;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FailureKind fromHttpStatus(int statusCode) {
        if (statusCode == 403 || statusCode == 429 || statusCode == 503 || statusCode == 408) {
            return TRANSIENT_NETWORK;
        }
        return PERMANENT_REMOTE;
    }
}
