package com.phodal.tracegen.otel.exporter;

import com.phodal.tracegen.otel.config.TracingClientProperties;

import java.net.URI;

/**
 * Turns the configured {@code host:port} endpoint into the URL each protocol posts to.
 */
final class Endpoints {

    static final String OTLP_HTTP_TRACES_PATH = "/v1/traces";
    static final String JAEGER_TRACES_PATH = "/api/traces";

    private Endpoints() {
    }

    static String baseUrl(TracingClientProperties properties) {
        String endpoint = properties.getEndpoint().trim();
        if (endpoint.contains("://")) {
            return endpoint;
        }
        return (properties.isPlaintext() ? "http://" : "https://") + endpoint;
    }

    static String otlpGrpcUrl(TracingClientProperties properties) {
        return baseUrl(properties);
    }

    static String otlpHttpUrl(TracingClientProperties properties) {
        return withDefaultPath(baseUrl(properties), OTLP_HTTP_TRACES_PATH);
    }

    static String jaegerUrl(TracingClientProperties properties) {
        return withDefaultPath(baseUrl(properties), JAEGER_TRACES_PATH);
    }

    private static String withDefaultPath(String url, String path) {
        String currentPath = URI.create(url).getPath();
        if (currentPath == null || currentPath.isEmpty() || "/".equals(currentPath)) {
            return url.replaceAll("/+$", "") + path;
        }
        return url;
    }
}
