package com.phodal.tracegen.generator.template;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How many random attributes to create and how many distinct values each may take.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AttributeParams {

    public static final int DEFAULT_CARDINALITY = 20;

    private int count;

    /**
     * Distinct values per attribute; defaults to {@value #DEFAULT_CARDINALITY}, non-positive values
     * mean unbounded.
     */
    private Integer cardinality;

    public static AttributeParams of(int count) {
        return new AttributeParams(count, null);
    }

    public static AttributeParams of(int count, int cardinality) {
        return new AttributeParams(count, cardinality);
    }
}
