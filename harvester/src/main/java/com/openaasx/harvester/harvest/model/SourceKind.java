package com.openaasx.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SourceKind {
    GITHUB("github", "github"),
    SEED("seed", "seeds"),
    SITEMAP("sitemap", "sitemap"),
    COMMONCRAWL("commoncrawl", "commoncrawl");

    private final String id;
    private final String selector;

    SourceKind(String id, String selector) {
        this.id = id;
        this.selector = selector;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String selector() {
        return selector;
    }

    public boolean isWebClass() {
        return this != GITHUB;
    }

    @JsonCreator
    public static SourceKind fromId(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SourceKind kind : values()) {
            if (kind.id.equals(normalized) || kind.selector.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown source: " + value);
    }
}
