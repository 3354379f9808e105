package com.phodal.tracegen.generator;

import com.phodal.tracegen.model.AttributeSet;
import com.phodal.tracegen.model.Event;
import com.phodal.tracegen.model.Link;
import com.phodal.tracegen.model.Resource;
import com.phodal.tracegen.model.Span;
import com.phodal.tracegen.model.SpanKind;
import com.phodal.tracegen.model.SpanStatus;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable span under construction. Semantic convention packs may still touch a draft's parent,
 * so drafts are frozen into {@link Span}s only once the whole trace has been built.
 */
@Getter
@Setter
public class SpanDraft {

    private final int index;
    private final String traceId;
    private final String spanId;
    private final SpanDraft parent;
    private final HostInfo host;
    private final AttributeSet.Builder attributes = AttributeSet.builder();
    private final List<Event> events = new ArrayList<>();
    private final List<Link> links = new ArrayList<>();

    private String serviceName;
    private String name;
    private SpanKind kind = SpanKind.INTERNAL;
    private Instant startTime;
    private Duration duration = Duration.ZERO;
    private SpanStatus status = SpanStatus.ok();
    /**
     * Set when the status came from the template, which semantic packs must not override.
     */
    private boolean statusFixed;
    private Resource resource;

    public SpanDraft(int index, String traceId, String spanId, SpanDraft parent, HostInfo host) {
        this.index = index;
        this.traceId = traceId;
        this.spanId = spanId;
        this.parent = parent;
        this.host = host;
    }

    public boolean hasParent() {
        return parent != null;
    }

    public Instant getEndTime() {
        return startTime.plus(duration);
    }

    /**
     * Marks the span as failed unless the template fixed its status.
     */
    public void markError(String message) {
        if (!statusFixed) {
            status = SpanStatus.error(message);
        }
    }

    public Span toSpan() {
        return Span.builder()
                .traceId(traceId)
                .spanId(spanId)
                .parentSpanId(parent != null ? parent.getSpanId() : null)
                .serviceName(serviceName)
                .name(name)
                .kind(kind)
                .startTime(startTime)
                .duration(duration)
                .status(status)
                .attributes(attributes.build())
                .events(events)
                .links(links)
                .resource(resource)
                .build();
    }

    /**
     * Network identity of the service emitting a span.
     */
    public record HostInfo(String hostName, String hostIp, int hostPort) {
    }
}
