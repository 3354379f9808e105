package com.phodal.tracegen.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * OTEL Span Kind
 */
public enum SpanKind {
    /**
     * Server span (processing incoming request)
     */
    SERVER,

    /**
     * Client span (outgoing request to external service)
     */
    CLIENT,

    /**
     * Producer span (message/event producer)
     */
    PRODUCER,

    /**
     * Consumer span (message/event consumer)
     */
    CONSUMER,

    /**
     * Internal span (internal processing)
     */
    INTERNAL;

    /**
     * Lenient parsing of {@code server}, {@code SPAN_KIND_SERVER} and friends. Unknown names map to
     * {@link #INTERNAL}.
     */
    @JsonCreator
    public static SpanKind fromString(String value) {
        if (value == null) {
            return INTERNAL;
        }
        String name = value.trim().toUpperCase(Locale.ROOT);
        if (name.startsWith("SPAN_KIND_")) {
            name = name.substring("SPAN_KIND_".length());
        }
        for (SpanKind kind : values()) {
            if (kind.name().equals(name)) {
                return kind;
            }
        }
        return INTERNAL;
    }
}
