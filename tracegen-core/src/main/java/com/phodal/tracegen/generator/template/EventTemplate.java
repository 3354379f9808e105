package com.phodal.tracegen.generator.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * An event that is added to every generated instance of a span.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventTemplate {

    private String name;
    private Map<String, Object> attributes;
    private AttributeParams randomAttributes;
}
