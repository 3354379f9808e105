package com.phodal.tracegen.generator;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Coarse description of one trace for the {@link ParameterizedGenerator}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TraceParams {

    /**
     * Hex trace ID to reuse; a random one is generated when missing.
     */
    @JsonAlias("traceID")
    private String id;

    /**
     * Service of all spans; one random service per trace when missing.
     */
    private String service;

    /**
     * Draw a random service per span instead.
     */
    @JsonProperty("random_service_name")
    @JsonAlias("randomServiceName")
    private boolean randomServiceName;

    private SpanParams spans;
}
