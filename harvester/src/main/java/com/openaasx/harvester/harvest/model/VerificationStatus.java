package com.openaasx.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VerificationStatus {
    VERIFIED,
    PARSEABLE,
    FAILED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VerificationStatus fromId(String value) {
        return value == null ? FAILED : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
