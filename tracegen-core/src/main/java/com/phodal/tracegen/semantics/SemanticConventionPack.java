package com.phodal.tracegen.semantics;

import com.phodal.tracegen.generator.SpanDraft;
import com.phodal.tracegen.random.RandomData;

/**
 * Fills a span with attributes of one semantic convention. Packs never overwrite attributes that
 * are already present.
 */
public interface SemanticConventionPack {

    AttributeSemantics semantics();

    void apply(SpanDraft span, RandomData random);
}
