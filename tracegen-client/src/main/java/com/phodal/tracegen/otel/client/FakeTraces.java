package com.phodal.tracegen.otel.client;

import com.phodal.tracegen.generator.TemplatedGenerator;
import com.phodal.tracegen.generator.template.SpanDefaults;
import com.phodal.tracegen.generator.template.SpanTemplate;
import com.phodal.tracegen.generator.template.TraceTemplate;
import com.phodal.tracegen.model.Trace;
import com.phodal.tracegen.random.RandomSource;
import com.phodal.tracegen.semantics.AttributeSemantics;

import java.util.List;
import java.util.Map;

/**
 * Small built-in trace used to check that a collector accepts data.
 */
final class FakeTraces {

    static final String SERVICE = "tracegen-smoke-test";

    private static final TraceTemplate TEMPLATE = TraceTemplate.builder()
            .defaults(SpanDefaults.builder()
                    .attributeSemantics(AttributeSemantics.HTTP)
                    .attributes(Map.of("tracegen.smoke-test", true))
                    .build())
            .spans(List.of(
                    SpanTemplate.builder().service(SERVICE).name("smoke-test").build(),
                    SpanTemplate.builder().service(SERVICE).name("call-backend").parentIdx(0).build(),
                    SpanTemplate.builder().service(SERVICE + "-backend").name("handle").parentIdx(1).build()))
            .build();

    private FakeTraces() {
    }

    static Trace trace(RandomSource random) {
        return new TemplatedGenerator(TEMPLATE, random).trace();
    }
}
