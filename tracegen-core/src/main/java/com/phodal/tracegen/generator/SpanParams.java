package com.phodal.tracegen.generator;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Span parameters of a {@link TraceParams} entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpanParams {

    /**
     * Number of spans; zero or missing means {@value ParameterizedGenerator#DEFAULT_SPAN_COUNT}.
     */
    private Integer count;

    /**
     * Approximate attribute payload per span in bytes; zero or missing means
     * {@value ParameterizedGenerator#DEFAULT_SPAN_SIZE}.
     */
    private Integer size;

    @JsonProperty("random_name")
    @JsonAlias("randomName")
    private boolean randomName;

    @JsonProperty("fixed_attrs")
    @JsonAlias({"fixedAttributes", "fixedAttrs"})
    private Map<String, Object> fixedAttributes;
}
