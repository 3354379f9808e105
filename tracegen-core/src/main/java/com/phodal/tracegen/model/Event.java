package com.phodal.tracegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Timestamped annotation of a span.
 */
@Value
@Builder
public class Event {

    public static final String EXCEPTION_EVENT_NAME = "exception";

    @NonNull
    String name;

    @NonNull
    Instant timestamp;

    boolean exception;

    @NonNull
    @Builder.Default
    AttributeSet attributes = AttributeSet.empty();
}
