package io.nexus.server.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nexus.core.json.JsonRenderer;
import io.nexus.core.session.DownstreamEndpoint;
import io.nexus.core.session.TransportSession;
import io.nexus.core.session.TransportSessionFactory;
import io.nexus.serialization.JacksonJsonRenderer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.net.http.HttpClient;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// Creates {@link McpSseSession}s for configured downstream endpoints.
///
/// All sessions share one HTTP/1.1 client. Timeouts come from configuration:
///
/// | Property | Default | Description |
/// |----------|---------|-------------|
/// | `nexus.mcp.connection-timeout` | `30s` | Stream opening and handshake |
/// | `nexus.mcp.call-timeout` | `60s` | Each request, including tool calls |
///
/// @see McpSseSession for the transport
@ApplicationScoped
public class McpSessionFactory implements TransportSessionFactory {

    private final HttpClient httpClient;
    private final JsonRpc jsonRpc;
    private final JsonRenderer renderer;
    private final Duration connectionTimeout;
    private final Duration callTimeout;

    @Inject
    public McpSessionFactory(
            JsonRpc jsonRpc,
            ObjectMapper objectMapper,
            @ConfigProperty(name = "nexus.mcp.connection-timeout", defaultValue = "30s")
                    Duration connectionTimeout,
            @ConfigProperty(name = "nexus.mcp.call-timeout", defaultValue = "60s")
                    Duration callTimeout) {
        this(
                HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(connectionTimeout)
                        .build(),
                jsonRpc,
                new JacksonJsonRenderer(objectMapper),
                connectionTimeout,
                callTimeout);
    }

    McpSessionFactory(
            HttpClient httpClient,
            JsonRpc jsonRpc,
            JsonRenderer renderer,
            Duration connectionTimeout,
            Duration callTimeout) {
        this.httpClient = httpClient;
        this.jsonRpc = jsonRpc;
        this.renderer = renderer;
        this.connectionTimeout = connectionTimeout;
        this.callTimeout = callTimeout;
    }

    @Override
    public TransportSession create(DownstreamEndpoint endpoint) {
        return new McpSseSession(
                endpoint, httpClient, jsonRpc, renderer, connectionTimeout, callTimeout);
    }
}
