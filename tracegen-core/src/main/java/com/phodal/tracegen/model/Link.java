package com.phodal.tracegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Reference from one span to another span, possibly in a different trace.
 */
@Value
@Builder
public class Link {

    @NonNull
    String traceId;

    @NonNull
    String spanId;

    @NonNull
    @Builder.Default
    AttributeSet attributes = AttributeSet.empty();
}
