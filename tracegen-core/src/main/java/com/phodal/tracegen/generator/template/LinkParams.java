package com.phodal.tracegen.generator.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Random links per span. Counts below one are emission probabilities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LinkParams {

    /**
     * Random links per span; zero means one.
     */
    private double count;

    private AttributeParams randomAttributes;
}
