package com.phodal.tracegen.generator.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.phodal.tracegen.model.SpanKind;
import com.phodal.tracegen.model.SpanStatus;
import com.phodal.tracegen.semantics.AttributeSemantics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Parameters of one span of a {@link TraceTemplate}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpanTemplate {

    /**
     * Sets {@code service.name} of the span's resource. Required.
     */
    private String service;

    /**
     * Span name; a random operation name is chosen when missing.
     */
    private String name;

    /**
     * Span kind; inferred from the services of parent and child when missing.
     */
    private SpanKind kind;

    /**
     * Index of the parent in {@link TraceTemplate#getSpans()}, smaller than the own index. The span
     * is a root span when missing.
     */
    private Integer parentIdx;

    /**
     * Duration interval in milliseconds; derived from the parent's duration when missing.
     */
    private Range duration;

    private AttributeSemantics attributeSemantics;
    private Map<String, Object> attributes;
    private AttributeParams randomAttributes;
    private List<EventTemplate> events;
    private List<LinkTemplate> links;
    private EventParams randomEvents;
    private LinkParams randomLinks;

    /**
     * Merged into the resource shared by all spans of the same service.
     */
    private ResourceTemplate resource;

    private SpanStatus status;
}
