package com.phodal.tracegen.model;

import com.phodal.tracegen.exception.InvalidParameterException;
import lombok.Value;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Set of causally related spans sharing one trace ID.
 */
@Value
public class Trace {

    String traceId;
    List<Span> spans;

    private Trace(String traceId, List<Span> spans) {
        this.traceId = traceId;
        this.spans = spans;
    }

    /**
     * Creates a trace after checking that the spans form a closed, causally ordered forest.
     *
     * @throws InvalidParameterException if a span belongs to another trace, a span ID repeats, a
     *                                   parent is missing or a parent starts after its child
     */
    public static Trace of(String traceId, List<Span> spans) {
        String id = Ids.normalizeTraceId(traceId);
        Map<String, Span> byId = new HashMap<>(spans.size() * 2);
        for (int i = 0; i < spans.size(); i++) {
            Span span = spans.get(i);
            if (!id.equals(span.getTraceId())) {
                throw new InvalidParameterException("spans[" + i + "] belongs to trace " + span.getTraceId()
                        + " instead of " + id);
            }
            if (byId.putIfAbsent(span.getSpanId(), span) != null) {
                throw new InvalidParameterException("spans[" + i + "] repeats span ID " + span.getSpanId());
            }
        }
        for (int i = 0; i < spans.size(); i++) {
            Span span = spans.get(i);
            if (span.isRoot()) {
                continue;
            }
            Span parent = byId.get(span.getParentSpanId());
            if (parent == null) {
                throw new InvalidParameterException("spans[" + i + "] references unknown parent "
                        + span.getParentSpanId());
            }
            if (parent.getStartTime().isAfter(span.getStartTime())) {
                throw new InvalidParameterException("spans[" + i + "] starts before its parent");
            }
        }
        return new Trace(id, List.copyOf(spans));
    }

    public Optional<Span> getRootSpan() {
        return spans.stream().filter(Span::isRoot).findFirst();
    }

    public Optional<Span> findSpan(String spanId) {
        return spans.stream().filter(span -> span.getSpanId().equals(spanId)).findFirst();
    }

    public int getSpanCount() {
        return spans.size();
    }
}
