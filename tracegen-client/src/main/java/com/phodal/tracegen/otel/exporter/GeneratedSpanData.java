package com.phodal.tracegen.otel.exporter;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.sdk.common.InstrumentationLibraryInfo;
import io.opentelemetry.sdk.common.InstrumentationScopeInfo;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.LinkData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.data.StatusData;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Finished span handed to the OpenTelemetry SDK exporters. Generated spans never pass through a
 * tracer, so this carries the already mapped values as they are.
 */
@Value
@Builder
class GeneratedSpanData implements SpanData {

    static final InstrumentationScopeInfo SCOPE = InstrumentationScopeInfo.builder("tracegen")
            .setVersion("1.0.0")
            .build();

    String name;
    SpanKind kind;
    SpanContext spanContext;
    SpanContext parentSpanContext;
    StatusData status;
    long startEpochNanos;
    long endEpochNanos;
    Attributes attributes;
    List<EventData> events;
    List<LinkData> links;
    Resource resource;

    @Override
    public boolean hasEnded() {
        return true;
    }

    @Override
    public int getTotalRecordedEvents() {
        return events.size();
    }

    @Override
    public int getTotalRecordedLinks() {
        return links.size();
    }

    @Override
    public int getTotalAttributeCount() {
        return attributes.size();
    }

    @Override
    public InstrumentationScopeInfo getInstrumentationScopeInfo() {
        return SCOPE;
    }

    @Override
    @SuppressWarnings("deprecation")
    public InstrumentationLibraryInfo getInstrumentationLibraryInfo() {
        return InstrumentationLibraryInfo.create(SCOPE.getName(), SCOPE.getVersion());
    }
}
