package com.phodal.tracegen.semantics;

import com.phodal.tracegen.generator.SpanDraft;
import com.phodal.tracegen.random.RandomData;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the available semantic convention packs.
 */
public class SemanticConventions {

    private final Map<AttributeSemantics, SemanticConventionPack> packs = new EnumMap<>(AttributeSemantics.class);

    public SemanticConventions() {
        this(List.of(new HttpSemanticConventions(), new DatabaseSemanticConventions()));
    }

    public SemanticConventions(List<SemanticConventionPack> packs) {
        packs.forEach(pack -> this.packs.put(pack.semantics(), pack));
    }

    /**
     * Applies the pack for {@code semantics}; {@code null} or a kind without pack is a no-op.
     */
    public void apply(AttributeSemantics semantics, SpanDraft span, RandomData random) {
        if (semantics == null) {
            return;
        }
        SemanticConventionPack pack = packs.get(semantics);
        if (pack != null) {
            pack.apply(span, random);
        }
    }
}
