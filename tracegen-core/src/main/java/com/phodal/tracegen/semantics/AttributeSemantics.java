package com.phodal.tracegen.semantics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Semantic convention a span's generated attributes follow.
 */
public enum AttributeSemantics {

    HTTP("http"),
    DATABASE("db");

    private final String key;

    AttributeSemantics(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * @throws IllegalArgumentException for names other than {@code http}, {@code db} or {@code database}
     */
    @JsonCreator
    public static AttributeSemantics fromString(String value) {
        String name = value.trim().toLowerCase(Locale.ROOT);
        switch (name) {
            case "http":
                return HTTP;
            case "db":
            case "database":
                return DATABASE;
            default:
                throw new IllegalArgumentException("unknown attribute semantics '" + value + "'");
        }
    }
}
