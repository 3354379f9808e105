package com.phodal.tracegen.generator.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.phodal.tracegen.model.SpanStatus;
import com.phodal.tracegen.semantics.AttributeSemantics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Template parameters applied to every span that does not set them itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpanDefaults {

    private AttributeSemantics attributeSemantics;
    /**
     * Merged into the attributes of every span; span attributes win.
     */
    private Map<String, Object> attributes;
    /**
     * Sampled once per trace and added to every span.
     */
    private AttributeParams randomAttributes;
    private EventParams randomEvents;
    private LinkParams randomLinks;
    private ResourceTemplate resource;
    private SpanStatus status;
    private Range duration;
}
