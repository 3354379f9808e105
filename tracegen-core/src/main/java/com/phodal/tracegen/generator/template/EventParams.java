package com.phodal.tracegen.generator.template;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Random events per span. Counts below one are emission probabilities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventParams {

    /**
     * Random events per span; zero means one.
     */
    private double count;

    /**
     * Exception events per span.
     */
    private double exceptionCount;

    /**
     * Only emit exception events for failed spans, and then at least one.
     */
    @JsonAlias("generateExceptionOnError")
    private boolean exceptionOnError;

    private AttributeParams randomAttributes;
}
