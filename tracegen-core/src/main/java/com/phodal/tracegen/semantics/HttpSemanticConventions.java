package com.phodal.tracegen.semantics;

import com.phodal.tracegen.generator.SpanDraft;
import com.phodal.tracegen.model.AttributeSet;
import com.phodal.tracegen.model.SpanKind;
import com.phodal.tracegen.random.RandomData;
import io.opentelemetry.semconv.HttpAttributes;
import io.opentelemetry.semconv.NetworkAttributes;
import io.opentelemetry.semconv.UrlAttributes;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * HTTP server and client attributes. Server spans decide method, status and URL; a client parent
 * of a server span mirrors them.
 */
public class HttpSemanticConventions implements SemanticConventionPack {

    public static final String HTTP_REQUEST_METHOD = HttpAttributes.HTTP_REQUEST_METHOD.getKey();
    public static final String HTTP_RESPONSE_STATUS_CODE = HttpAttributes.HTTP_RESPONSE_STATUS_CODE.getKey();
    public static final String HTTP_METHOD_OLD = "http.method";
    public static final String HTTP_STATUS_CODE_OLD = "http.status_code";
    public static final String RESPONSE_CONTENT_TYPE = "http.response.header.content-type";
    public static final String RESPONSE_CONTENT_LENGTH = "http.response.header.content-length";
    public static final String REQUEST_CONTENT_LENGTH = "http.request.header.content-length";
    public static final String REQUEST_ACCEPT = "http.request.header.accept";

    private static final Set<String> METHODS_WITH_BODY = Set.of("POST", "PUT", "PATCH");

    @Override
    public AttributeSemantics semantics() {
        return AttributeSemantics.HTTP;
    }

    @Override
    public void apply(SpanDraft span, RandomData random) {
        if (span.getKind() == SpanKind.INTERNAL) {
            return;
        }
        NetworkConventions.apply(span, random);

        AttributeSet.Builder attributes = span.getAttributes();
        attributes.putIfAbsent(NetworkAttributes.NETWORK_PROTOCOL_NAME.getKey(), "http");
        attributes.putIfAbsent(NetworkAttributes.NETWORK_PROTOCOL_VERSION.getKey(), "1.1");

        if (span.getKind() != SpanKind.SERVER) {
            return;
        }

        String method = httpMethod(attributes).orElseGet(() -> {
            String m = random.httpMethod();
            attributes.put(HTTP_REQUEST_METHOD, m);
            return m;
        });

        Object contentType = attributes.get(RESPONSE_CONTENT_TYPE);
        if (contentType == null) {
            contentType = List.of(random.httpContentType());
            attributes.put(RESPONSE_CONTENT_TYPE, contentType);
        }

        long status = httpStatusCode(attributes.build()).orElseGet(() -> {
            long s = random.httpStatusSuccess();
            attributes.put(HTTP_RESPONSE_STATUS_CODE, s);
            return s;
        });
        if (status >= 500) {
            span.markError(reasonPhrase(status));
        }

        URI url = requestUrl(span);
        attributes.putIfAbsent(UrlAttributes.URL_FULL.getKey(), url.toString());
        attributes.putIfAbsent(UrlAttributes.URL_SCHEME.getKey(), url.getScheme());
        if (url.getPath() != null) {
            attributes.putIfAbsent(UrlAttributes.URL_PATH.getKey(), url.getPath());
        }

        attributes.putIfAbsent(RESPONSE_CONTENT_LENGTH, List.of((long) random.source().intBetween(100_000, 1_000_000)));
        if (METHODS_WITH_BODY.contains(method)) {
            attributes.putIfAbsent(REQUEST_CONTENT_LENGTH, List.of((long) random.source().intBetween(10_000, 100_000)));
        }

        SpanDraft parent = span.getParent();
        if (parent != null && parent.getKind() == SpanKind.CLIENT) {
            AttributeSet.Builder parentAttributes = parent.getAttributes();
            if (status >= 400) {
                parent.markError(reasonPhrase(status));
            }
            parentAttributes.putIfAbsent(HTTP_REQUEST_METHOD, method);
            parentAttributes.putIfAbsent(REQUEST_ACCEPT, contentType);
            parentAttributes.putIfAbsent(HTTP_RESPONSE_STATUS_CODE, status);
            parentAttributes.putIfAbsent(UrlAttributes.URL_FULL.getKey(), url.toString());
        }
    }

    /**
     * HTTP status of a span, read from the current or the legacy attribute name.
     */
    public static Optional<Long> httpStatusCode(AttributeSet attributes) {
        return attributes.getLong(HTTP_RESPONSE_STATUS_CODE).or(() -> attributes.getLong(HTTP_STATUS_CODE_OLD));
    }

    private static Optional<String> httpMethod(AttributeSet.Builder attributes) {
        AttributeSet current = attributes.build();
        return current.getString(HTTP_REQUEST_METHOD).or(() -> current.getString(HTTP_METHOD_OLD));
    }

    private static URI requestUrl(SpanDraft span) {
        Object own = span.getAttributes().get(UrlAttributes.URL_FULL.getKey());
        if (own instanceof String s) {
            Optional<URI> parsed = parse(s);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        SpanDraft parent = span.getParent();
        if (parent != null && parent.getAttributes().get(UrlAttributes.URL_FULL.getKey()) instanceof String s) {
            Optional<URI> parsed = parse(s);
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        SpanDraft.HostInfo host = span.getHost();
        return URI.create("https://" + host.hostName() + ":" + host.hostPort() + "/"
                + span.getName().replaceAll("[^A-Za-z0-9._~-]", "-"));
    }

    private static Optional<URI> parse(String url) {
        try {
            URI uri = new URI(url);
            return uri.getScheme() != null ? Optional.of(uri) : Optional.empty();
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    static String reasonPhrase(long status) {
        switch ((int) status) {
            case 400: return "Bad Request";
            case 401: return "Unauthorized";
            case 403: return "Forbidden";
            case 404: return "Not Found";
            case 405: return "Method Not Allowed";
            case 406: return "Not Acceptable";
            case 408: return "Request Timeout";
            case 409: return "Conflict";
            case 410: return "Gone";
            case 411: return "Length Required";
            case 412: return "Precondition Failed";
            case 413: return "Request Entity Too Large";
            case 414: return "Request URI Too Long";
            case 415: return "Unsupported Media Type";
            case 417: return "Expectation Failed";
            case 428: return "Precondition Required";
            case 500: return "Internal Server Error";
            case 501: return "Not Implemented";
            case 502: return "Bad Gateway";
            case 503: return "Service Unavailable";
            case 504: return "Gateway Timeout";
            default: return "HTTP " + status;
        }
    }
}
