package com.phodal.tracegen.otel.exporter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phodal.tracegen.model.Span;
import com.phodal.tracegen.otel.config.TracingClientProperties;
import io.jaegertracing.thriftjava.Batch;
import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.thrift.TException;
import org.apache.thrift.TSerializer;
import org.apache.thrift.protocol.TBinaryProtocol;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import javax.net.ssl.SNIHostName;
import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Posts Thrift encoded batches to a Jaeger collector's {@code /api/traces} HTTP endpoint.
 */
@Slf4j
public class JaegerWireExporter implements WireExporter {

    public static final MediaType THRIFT_MEDIA_TYPE = MediaType.parseMediaType("application/x-thrift");

    private final WebClient webClient;
    private final ConnectionProvider connectionProvider;
    private final JaegerBatchMapper mapper;
    private final String endpoint;
    private final Duration timeout;

    /**
     * @throws IOException if a configured certificate or key file cannot be read
     */
    public JaegerWireExporter(TracingClientProperties properties,
                              Map<String, String> headers,
                              ObjectMapper objectMapper) throws IOException {
        this.endpoint = Endpoints.jaegerUrl(properties);
        this.timeout = properties.getTimeout();
        this.mapper = new JaegerBatchMapper(objectMapper);
        this.connectionProvider = ConnectionProvider.create("tracegen-jaeger");

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .responseTimeout(timeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis());
        if ("https".equalsIgnoreCase(URI.create(endpoint).getScheme())) {
            SslContext sslContext = sslContext(properties.getTls());
            String serverName = properties.getTls().getServerName();
            httpClient = httpClient.secure(spec -> {
                var builder = spec.sslContext(sslContext);
                if (serverName != null && !serverName.isEmpty()) {
                    builder.serverNames(new SNIHostName(serverName));
                }
            });
        }

        this.webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeaders(httpHeaders -> headers.forEach(httpHeaders::set))
                .build();
        log.info("Using Jaeger exporter: {}", endpoint);
    }

    private static SslContext sslContext(TracingClientProperties.Tls tls) throws IOException {
        SslContextBuilder builder = SslContextBuilder.forClient();
        if (tls.isInsecureSkipVerify()) {
            builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
        } else if (tls.getCaFile() != null) {
            builder.trustManager(new File(tls.getCaFile()));
        }
        if (tls.getCertFile() != null && tls.getKeyFile() != null) {
            builder.keyManager(new File(tls.getCertFile()), new File(tls.getKeyFile()));
        }
        return builder.build();
    }

    @Override
    public void export(List<Span> spans) {
        for (Batch batch : mapper.map(spans)) {
            byte[] body = encode(batch, spans);
            try {
                webClient.post()
                        .uri(endpoint)
                        .contentType(THRIFT_MEDIA_TYPE)
                        .bodyValue(body)
                        .retrieve()
                        .toBodilessEntity()
                        .timeout(timeout)
                        .block();
            } catch (RuntimeException e) {
                Throwable error = Exceptions.unwrap(e);
                log.error("Failed to export batch of {} to Jaeger at {}: {}",
                        batch.getProcess().getServiceName(), endpoint, error.getMessage());
                throw ExportFailures.classify(endpoint, getName(), spans, error);
            }
            log.debug("Exported {} spans of {} to Jaeger", batch.getSpansSize(), batch.getProcess().getServiceName());
        }
    }

    private byte[] encode(Batch batch, List<Span> spans) {
        try {
            return new TSerializer(new TBinaryProtocol.Factory()).serialize(batch);
        } catch (TException e) {
            throw ExportFailures.transmission(endpoint, getName(), spans, "cannot encode batch: " + e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return TracingClientProperties.ExporterType.JAEGER.value();
    }

    String getEndpoint() {
        return endpoint;
    }

    @Override
    public void shutdown() {
        log.info("Shutting down Jaeger exporter for {}", endpoint);
        connectionProvider.disposeLater().block(timeout);
    }
}
