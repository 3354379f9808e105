package com.phodal.tracegen.semantics;

import com.phodal.tracegen.generator.SpanDraft;
import com.phodal.tracegen.model.AttributeSet;
import com.phodal.tracegen.model.SpanKind;
import com.phodal.tracegen.random.RandomData;
import io.opentelemetry.semconv.NetworkAttributes.NetworkTransportValues;
import io.opentelemetry.semconv.NetworkAttributes.NetworkTypeValues;
import io.opentelemetry.semconv.ServerAttributes;

import static io.opentelemetry.semconv.NetworkAttributes.NETWORK_LOCAL_ADDRESS;
import static io.opentelemetry.semconv.NetworkAttributes.NETWORK_PEER_ADDRESS;
import static io.opentelemetry.semconv.NetworkAttributes.NETWORK_TRANSPORT;
import static io.opentelemetry.semconv.NetworkAttributes.NETWORK_TYPE;

/**
 * Connection level attributes shared by the HTTP and database packs.
 */
final class NetworkConventions {

    private NetworkConventions() {
    }

    static void apply(SpanDraft span, RandomData random) {
        AttributeSet.Builder attributes = span.getAttributes();
        attributes.putIfAbsent(NETWORK_TRANSPORT.getKey(), NetworkTransportValues.TCP);
        attributes.putIfAbsent(NETWORK_TYPE.getKey(), NetworkTypeValues.IPV4);

        if (span.getKind() == SpanKind.CLIENT) {
            attributes.putIfAbsent(ServerAttributes.SERVER_PORT.getKey(), random.source().port());
        } else if (span.getKind() == SpanKind.SERVER) {
            SpanDraft.HostInfo host = span.getHost();
            attributes.putIfAbsent(NETWORK_LOCAL_ADDRESS.getKey(), host.hostIp());
            attributes.putIfAbsent(ServerAttributes.SERVER_ADDRESS.getKey(), host.hostName());
            attributes.putIfAbsent(ServerAttributes.SERVER_PORT.getKey(), host.hostPort());

            SpanDraft parent = span.getParent();
            if (parent != null && parent.getKind() == SpanKind.CLIENT) {
                parent.getAttributes().putIfAbsent(NETWORK_PEER_ADDRESS.getKey(),
                        attributes.get(NETWORK_LOCAL_ADDRESS.getKey()));
                parent.getAttributes().putIfAbsent(ServerAttributes.SERVER_ADDRESS.getKey(),
                        attributes.get(ServerAttributes.SERVER_ADDRESS.getKey()));
            }
        }
    }
}
