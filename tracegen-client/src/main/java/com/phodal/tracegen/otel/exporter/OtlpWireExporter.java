package com.phodal.tracegen.otel.exporter;

import com.phodal.tracegen.model.Span;
import com.phodal.tracegen.otel.config.TracingClientProperties;
import com.phodal.tracegen.otel.config.TracingClientProperties.ExporterType;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporterBuilder;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporterBuilder;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLContext;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Sends spans with the OpenTelemetry SDK's OTLP exporters, over gRPC or HTTP/protobuf.
 */
@Slf4j
public class OtlpWireExporter implements WireExporter {

    private final SpanExporter spanExporter;
    private final OtlpSpanDataMapper mapper = new OtlpSpanDataMapper();
    private final String name;
    private final String endpoint;
    private final Duration timeout;

    /**
     * @throws IOException if a configured certificate or key file cannot be read
     */
    public OtlpWireExporter(TracingClientProperties properties, Map<String, String> headers) throws IOException {
        this.timeout = properties.getTimeout();
        this.name = properties.getExporter().value();
        if (properties.getExporter() == ExporterType.OTLP_HTTP) {
            this.endpoint = Endpoints.otlpHttpUrl(properties);
            this.spanExporter = buildHttpExporter(properties, headers);
        } else {
            this.endpoint = Endpoints.otlpGrpcUrl(properties);
            this.spanExporter = buildGrpcExporter(properties, headers);
        }
        if (properties.getTls().getServerName() != null) {
            log.warn("tls.server-name {} is not supported by the OTLP exporters, the endpoint host is verified instead",
                    properties.getTls().getServerName());
        }
    }

    OtlpWireExporter(SpanExporter spanExporter, String name, String endpoint, Duration timeout) {
        this.spanExporter = spanExporter;
        this.name = name;
        this.endpoint = endpoint;
        this.timeout = timeout;
    }

    private SpanExporter buildHttpExporter(TracingClientProperties properties, Map<String, String> headers)
            throws IOException {
        log.info("Using OTLP HTTP exporter: {}", endpoint);
        OtlpHttpSpanExporterBuilder builder = OtlpHttpSpanExporter.builder()
                .setEndpoint(endpoint)
                .setTimeout(timeout)
                .setRetryPolicy(null);
        headers.forEach(builder::addHeader);

        TracingClientProperties.Tls tls = properties.getTls();
        if (!properties.isPlaintext()) {
            if (tls.getCaFile() != null) {
                builder.setTrustedCertificates(read(tls.getCaFile()));
            }
            if (tls.getCertFile() != null && tls.getKeyFile() != null) {
                builder.setClientTls(read(tls.getKeyFile()), read(tls.getCertFile()));
            }
            if (tls.isInsecureSkipVerify()) {
                X509TrustManager trustManager = insecureTrustManager();
                builder.setSslContext(sslContext(trustManager), trustManager);
            }
        }
        return builder.build();
    }

    private SpanExporter buildGrpcExporter(TracingClientProperties properties, Map<String, String> headers)
            throws IOException {
        log.info("Using OTLP gRPC exporter: {}", endpoint);
        OtlpGrpcSpanExporterBuilder builder = OtlpGrpcSpanExporter.builder()
                .setEndpoint(endpoint)
                .setTimeout(timeout)
                .setRetryPolicy(null);
        headers.forEach(builder::addHeader);

        TracingClientProperties.Tls tls = properties.getTls();
        if (!properties.isPlaintext()) {
            if (tls.getCaFile() != null) {
                builder.setTrustedCertificates(read(tls.getCaFile()));
            }
            if (tls.getCertFile() != null && tls.getKeyFile() != null) {
                builder.setClientTls(read(tls.getKeyFile()), read(tls.getCertFile()));
            }
            if (tls.isInsecureSkipVerify()) {
                X509TrustManager trustManager = insecureTrustManager();
                builder.setSslContext(sslContext(trustManager), trustManager);
            }
        }
        return builder.build();
    }

    @Override
    public void export(List<Span> spans) {
        CompletableResultCode result = spanExporter.export(mapper.map(spans));
        result.join(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!result.isDone()) {
            throw ExportFailures.transmission(endpoint, name, spans, "timed out after " + timeout, null);
        }
        if (!result.isSuccess()) {
            throw ExportFailures.classify(endpoint, name, spans, result.getFailureThrowable());
        }
        log.debug("Exported {} spans to {}", spans.size(), endpoint);
    }

    @Override
    public String getName() {
        return name;
    }

    String getEndpoint() {
        return endpoint;
    }

    @Override
    public void shutdown() {
        log.info("Shutting down OTLP exporter for {}", endpoint);
        CompletableResultCode result = spanExporter.shutdown().join(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!result.isSuccess()) {
            log.warn("OTLP exporter for {} did not shut down cleanly", endpoint);
        }
    }

    private static byte[] read(String file) throws IOException {
        return Files.readAllBytes(Path.of(file));
    }

    private static X509TrustManager insecureTrustManager() {
        return (X509TrustManager) InsecureTrustManagerFactory.INSTANCE.getTrustManagers()[0];
    }

    private static SSLContext sslContext(X509TrustManager trustManager) throws IOException {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new X509TrustManager[]{trustManager}, null);
            return context;
        } catch (GeneralSecurityException e) {
            throw new IOException("cannot create TLS context: " + e.getMessage(), e);
        }
    }
}
