package com.phodal.tracegen.generator.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A link that is added to every generated instance of a span. It points to the parent span, to
 * the span generated right before when {@code linkToPreviousSpanIndex} is set, or to a random
 * span of another trace for root spans.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LinkTemplate {

    private Map<String, Object> attributes;
    private AttributeParams randomAttributes;
    private boolean linkToPreviousSpanIndex;
}
