package io.nexus.server.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nexus.core.json.JsonRenderer;
import io.nexus.core.json.JsonValue;
import io.nexus.core.progress.ProgressEvent;
import io.nexus.core.progress.ProgressSink;
import io.nexus.core.session.ConnectionException;
import io.nexus.core.session.DownstreamEndpoint;
import io.nexus.core.session.ProtocolException;
import io.nexus.core.session.RemoteToolException;
import io.nexus.core.session.ToolCallResponse;
import io.nexus.core.session.ToolTimeoutException;
import io.nexus.core.session.TransportSession;
import io.nexus.core.tool.ToolDescriptor;
import io.nexus.core.tool.ToolExecutionResult;
import io.nexus.serialization.JsonValueConverter;
import io.nexus.server.validation.LogSanitizer;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;
import org.jboss.logging.Logger;

/// {@link TransportSession} speaking MCP over the SSE transport.
///
/// One long-lived `GET` stream carries every server-to-router message; each
/// router-to-server message is a separate `POST` to the message URL the server
/// announces in its `endpoint` event:
///
/// ```
/// +——————————————————+      GET <address>        +——————————————————+
/// │                  │ ————————————————————————> │                  │
/// │  McpSseSession   │  <—— endpoint, message —— │  downstream MCP  │
/// │                  │       (SSE stream)        │  server          │
/// │                  │                           │                  │
/// │                  │ ———— POST <message url> —>│                  │
/// │                  │  (requests, notifications)│                  │
/// +——————————————————+                           +——————————————————+
/// ```
///
/// ### Correlation
/// Responses are matched to pending calls by JSON-RPC `id`; progress
/// notifications are matched by the `progressToken` each `tools/call` carries
/// in `params._meta`. Any number of calls may be in flight at once.
///
/// ### Stream loss
/// When the SSE stream ends, every pending call fails with
/// {@link RemoteToolException#sessionClosed()}. The session does not reconnect.
///
/// @implNote Thread-safe. A single reader thread per session parses the stream
/// and delivers progress, so notifications for one call reach its sink in
/// stream order and before the call's result.
///
/// @see McpSessionFactory for creation
/// @see JsonRpc for message formatting
public class McpSseSession implements TransportSession {

    private static final Logger LOG = Logger.getLogger(McpSseSession.class);

    static final String PROTOCOL_VERSION = "2024-11-05";
    static final String CLIENT_NAME = "nexus-router";
    static final String CLIENT_VERSION = "0.1.0";

    private final DownstreamEndpoint endpoint;
    private final HttpClient httpClient;
    private final JsonRpc jsonRpc;
    private final JsonRenderer renderer;
    private final Duration connectionTimeout;
    private final Duration callTimeout;

    /// Maps JSON-RPC request ID -> pending response future.
    private final Map<String, CompletableFuture<JsonNode>> pendingRequests =
            new ConcurrentHashMap<>();

    /// Maps progress token -> sink of the call that owns it.
    private final Map<String, ProgressSink> progressSinks = new ConcurrentHashMap<>();

    private final CompletableFuture<URI> messageEndpoint = new CompletableFuture<>();

    private volatile Stream<String> eventStream;
    private volatile Thread readerThread;
    private volatile URI messageUri;
    private volatile boolean closed;
    private volatile boolean streamClosed;

    /// Creates an unconnected session.
    ///
    /// @param endpoint the server to connect to, not null
    /// @param httpClient client for the stream and message posts, not null
    /// @param jsonRpc JSON-RPC helper, not null
    /// @param renderer renders non-text result content, not null
    /// @param connectionTimeout bound on stream opening and handshake, not null
    /// @param callTimeout bound on each request, not null
    public McpSseSession(
            DownstreamEndpoint endpoint,
            HttpClient httpClient,
            JsonRpc jsonRpc,
            JsonRenderer renderer,
            Duration connectionTimeout,
            Duration callTimeout) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.jsonRpc = Objects.requireNonNull(jsonRpc, "jsonRpc must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.connectionTimeout =
                Objects.requireNonNull(connectionTimeout, "connectionTimeout must not be null");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout must not be null");
    }

    @Override
    public DownstreamEndpoint endpoint() {
        return endpoint;
    }

    /// Opens the SSE stream, waits for the message endpoint, and performs the
    /// `initialize` handshake.
    ///
    /// @throws ConnectionException if the stream cannot be opened, no endpoint
    ///     event arrives within the connection timeout, or the handshake fails
    @Override
    public void connect() throws ConnectionException {
        if (eventStream != null) {
            throw new IllegalStateException("Session already connected: " + endpoint.name());
        }
        if (closed) {
            throw new ConnectionException("Session closed: " + endpoint.name());
        }

        LOG.infov("Connecting to {0} at {1}", endpoint.name(), endpoint.address());
        long deadline = System.nanoTime() + connectionTimeout.toNanos();

        HttpResponse<Stream<String>> response = openStream();
        eventStream = response.body();
        startReader(response.body());

        try {
            messageUri = messageEndpoint.get(remaining(deadline), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            close();
            throw new ConnectionException(
                    "No endpoint event from " + endpoint.name() + " within " + connectionTimeout, e);
        } catch (ExecutionException e) {
            close();
            throw new ConnectionException(
                    "Stream from " + endpoint.name() + " ended before the endpoint event",
                    e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new ConnectionException("Interrupted while connecting to " + endpoint.name(), e);
        }

        handshake(deadline);
        LOG.infov("Connected to {0}, message endpoint {1}", endpoint.name(), messageUri);
    }

    @Override
    public List<ToolDescriptor> listCapabilities() throws ProtocolException {
        List<ToolDescriptor> tools = new ArrayList<>();
        String cursor = null;

        do {
            ObjectNode params = jsonRpc.params();
            if (cursor != null) {
                params.put("cursor", cursor);
            }

            JsonNode result;
            try {
                result = request("tools/list", params, callTimeout);
            } catch (RemoteToolException e) {
                throw new ProtocolException(
                        "tools/list failed on " + endpoint.name() + ": " + e.getMessage(), e);
            } catch (TimeoutException e) {
                throw new ProtocolException(
                        "tools/list timed out on " + endpoint.name() + " after " + callTimeout, e);
            }

            JsonNode list = result.get("tools");
            if (list == null || !list.isArray()) {
                throw new ProtocolException(
                        "tools/list reply from " + endpoint.name() + " has no tools array");
            }
            for (JsonNode tool : list) {
                tools.add(parseToolDescriptor(tool));
            }

            JsonNode next = result.get("nextCursor");
            cursor = next != null && next.isTextual() && !next.asText().isEmpty() ? next.asText() : null;
        } while (cursor != null);

        LOG.debugv("Discovered {0} tools on {1}", tools.size(), endpoint.name());
        return tools;
    }

    @Override
    public ToolExecutionResult invoke(
            String toolName, Map<String, Object> arguments, ProgressSink progress)
            throws RemoteToolException, ToolTimeoutException {
        Objects.requireNonNull(toolName, "toolName must not be null");
        Objects.requireNonNull(progress, "progress must not be null");

        String progressToken = "router-" + toolName + "-" + UUID.randomUUID();

        ObjectNode params = jsonRpc.params();
        params.put("name", toolName);
        params.set(
                "arguments",
                JsonValueConverter.toNode(JsonValue.of(arguments != null ? arguments : Map.of())));
        params.putObject("_meta").put("progressToken", progressToken);

        progressSinks.put(progressToken, progress);
        try {
            JsonNode result = request("tools/call", params, callTimeout);
            return toResponse(result).toExecutionResult(toolName, renderer);
        } catch (TimeoutException e) {
            throw ToolTimeoutException.after(toolName, callTimeout);
        } finally {
            progressSinks.remove(progressToken);
        }
    }

    /// Cancels the stream and fails every pending call.
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        Stream<String> stream = eventStream;
        if (stream != null) {
            stream.close();
        }
        Thread reader = readerThread;
        if (reader != null) {
            reader.interrupt();
        }
        failPending();
        LOG.debugv("Closed session {0}", endpoint.name());
    }

    /// Returns the number of calls awaiting a response.
    ///
    /// @return pending request count
    int pendingRequestCount() {
        return pendingRequests.size();
    }

    boolean isStreamOpen() {
        return !streamClosed;
    }

    // -----------------------------------------------------------------------
    // Connection
    // -----------------------------------------------------------------------

    private HttpResponse<Stream<String>> openStream() throws ConnectionException {
        URI streamUri;
        try {
            streamUri = URI.create(endpoint.address());
        } catch (IllegalArgumentException e) {
            throw new ConnectionException("Invalid address for " + endpoint.name(), e);
        }

        HttpRequest request =
                HttpRequest.newBuilder(streamUri)
                        .header("Accept", "text/event-stream")
                        .GET()
                        .build();

        HttpResponse<Stream<String>> response;
        try {
            response =
                    httpClient
                            .sendAsync(request, HttpResponse.BodyHandlers.ofLines())
                            .get(connectionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw ConnectionException.unreachable(endpoint, e.getCause());
        } catch (TimeoutException e) {
            throw ConnectionException.unreachable(endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ConnectionException.unreachable(endpoint, e);
        }

        if (response.statusCode() != 200) {
            response.body().close();
            throw new ConnectionException(
                    "SSE stream of "
                            + endpoint.name()
                            + " answered with HTTP "
                            + response.statusCode());
        }
        return response;
    }

    private void startReader(Stream<String> lines) {
        SseEventReader reader = new SseEventReader(this::onEvent);
        Thread thread =
                new Thread(
                        () -> {
                            try {
                                lines.forEach(reader::onLine);
                            } catch (RuntimeException e) {
                                if (!closed) {
                                    LOG.warnv(
                                            "SSE stream of {0} failed: {1}",
                                            endpoint.name(), e.getMessage());
                                }
                            } finally {
                                onStreamClosed();
                            }
                        },
                        "nexus-sse-" + endpoint.name());
        thread.setDaemon(true);
        readerThread = thread;
        thread.start();
    }

    private void handshake(long deadline) throws ConnectionException {
        ObjectNode params = jsonRpc.params();
        params.put("protocolVersion", PROTOCOL_VERSION);
        params.putObject("capabilities");
        ObjectNode clientInfo = params.putObject("clientInfo");
        clientInfo.put("name", CLIENT_NAME);
        clientInfo.put("version", CLIENT_VERSION);

        try {
            JsonNode result = request("initialize", params, Duration.ofNanos(remaining(deadline)));
            JsonNode serverInfo = result.path("serverInfo");
            LOG.debugv(
                    "Server {0} identifies as {1} {2} (protocol {3})",
                    endpoint.name(),
                    serverInfo.path("name").asText("unknown"),
                    serverInfo.path("version").asText(""),
                    result.path("protocolVersion").asText(PROTOCOL_VERSION));
            post(jsonRpc.createNotification("notifications/initialized", null));
        } catch (RemoteToolException e) {
            close();
            throw new ConnectionException(
                    "Handshake with " + endpoint.name() + " failed: " + e.getMessage(), e);
        } catch (TimeoutException e) {
            close();
            throw new ConnectionException(
                    "Handshake with " + endpoint.name() + " timed out after " + connectionTimeout,
                    e);
        }
    }

    private static long remaining(long deadline) {
        return Math.max(0, deadline - System.nanoTime());
    }

    // -----------------------------------------------------------------------
    // Requests
    // -----------------------------------------------------------------------

    /// Sends a request and waits for its correlated response.
    private JsonNode request(String method, JsonNode params, Duration timeout)
            throws RemoteToolException, TimeoutException {
        if (closed || streamClosed || messageUri == null) {
            throw RemoteToolException.sessionClosed();
        }

        String requestId = UUID.randomUUID().toString();
        CompletableFuture<JsonNode> responseFuture = new CompletableFuture<>();
        pendingRequests.put(requestId, responseFuture);

        try {
            // the stream may have ended between the check above and the put
            if (streamClosed) {
                throw RemoteToolException.sessionClosed();
            }
            LOG.debugv("Sending {0} to {1}: id={2}", method, endpoint.name(), requestId);
            post(jsonRpc.createRequest(requestId, method, params));

            JsonNode response = responseFuture.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return jsonRpc.result(response);
        } catch (McpException e) {
            throw new RemoteToolException(e.getMessage(), e.getErrorCode());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RemoteToolException remote) {
                throw remote;
            }
            throw new RemoteToolException(
                    cause != null ? cause.getMessage() : "Request failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteToolException("Interrupted while waiting for " + method, e);
        } finally {
            pendingRequests.remove(requestId);
        }
    }

    private void post(String message) throws RemoteToolException {
        HttpRequest request =
                HttpRequest.newBuilder(messageUri)
                        .header("Content-Type", "application/json")
                        .timeout(callTimeout)
                        .POST(HttpRequest.BodyPublishers.ofString(message))
                        .build();
        try {
            HttpResponse<Void> response =
                    httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() / 100 != 2) {
                throw new RemoteToolException(
                        "Message post to " + endpoint.name() + " answered with HTTP "
                                + response.statusCode());
            }
        } catch (IOException e) {
            throw new RemoteToolException(
                    "Message post to " + endpoint.name() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteToolException("Interrupted while posting to " + endpoint.name(), e);
        }
    }

    // -----------------------------------------------------------------------
    // Stream handling (reader thread)
    // -----------------------------------------------------------------------

    private void onEvent(SseEvent event) {
        if ("endpoint".equals(event.event())) {
            onEndpoint(event.data());
            return;
        }
        if (!SseEvent.DEFAULT_EVENT.equals(event.event())) {
            LOG.debugv("Ignoring SSE event {0} from {1}", event.event(), endpoint.name());
            return;
        }

        JsonNode message;
        try {
            message = jsonRpc.parse(event.data());
        } catch (McpException e) {
            LOG.warnv("Dropping malformed message from {0}: {1}", endpoint.name(), e.getMessage());
            return;
        }

        if (jsonRpc.isResponse(message)) {
            onResponse(message);
        } else if (jsonRpc.isRequest(message)) {
            onServerMessage(message);
        }
    }

    private void onEndpoint(String data) {
        try {
            URI resolved = URI.create(endpoint.address()).resolve(data.trim());
            if (!messageEndpoint.complete(resolved)) {
                LOG.debugv("Ignoring repeated endpoint event from {0}", endpoint.name());
            }
        } catch (IllegalArgumentException e) {
            messageEndpoint.completeExceptionally(
                    new ProtocolException("Invalid endpoint event: " + LogSanitizer.sanitize(data)));
        }
    }

    private void onResponse(JsonNode message) {
        String id = jsonRpc.extractId(message);
        if (id == null) {
            LOG.warnv("Received response without ID from {0}", endpoint.name());
            return;
        }

        CompletableFuture<JsonNode> future = pendingRequests.remove(id);
        if (future != null) {
            future.complete(message);
        } else {
            LOG.debugv("Received response for unknown or timed-out ID {0} from {1}", id, endpoint.name());
        }
    }

    private void onServerMessage(JsonNode message) {
        String method = jsonRpc.extractMethod(message);
        if ("notifications/progress".equals(method)) {
            onProgress(message.path("params"));
        } else if ("ping".equals(method) && message.hasNonNull("id")) {
            replyToPing(message.get("id"));
        } else {
            LOG.debugv("Unhandled MCP method from {0}: {1}", endpoint.name(), method);
        }
    }

    private void onProgress(JsonNode params) {
        JsonNode token = params.get("progressToken");
        if (token == null || token.isNull()) {
            return;
        }
        ProgressSink sink = progressSinks.get(token.asText());
        if (sink == null) {
            LOG.debugv("Progress for unknown token {0}", LogSanitizer.sanitize(token.asText()));
            return;
        }

        Double total = params.hasNonNull("total") ? params.get("total").asDouble() : null;
        String text = params.hasNonNull("message") ? params.get("message").asText() : null;
        try {
            sink.report(new ProgressEvent(params.path("progress").asDouble(0.0), total, text));
        } catch (RuntimeException e) {
            LOG.warnv(e, "Progress sink failed for {0}", endpoint.name());
        }
    }

    private void replyToPing(JsonNode id) {
        String reply = jsonRpc.createResponse(id, null);
        HttpRequest request =
                HttpRequest.newBuilder(messageUri)
                        .header("Content-Type", "application/json")
                        .timeout(callTimeout)
                        .POST(HttpRequest.BodyPublishers.ofString(reply))
                        .build();
        httpClient
                .sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .whenComplete(
                        (response, error) -> {
                            if (error != null) {
                                LOG.debugv(
                                        "Ping reply to {0} failed: {1}",
                                        endpoint.name(), error.getMessage());
                            }
                        });
    }

    private void onStreamClosed() {
        streamClosed = true;
        if (!closed) {
            LOG.warnv("SSE stream of {0} ended", endpoint.name());
        }
        messageEndpoint.completeExceptionally(
                new IOException("SSE stream closed before the endpoint event"));
        failPending();
    }

    private void failPending() {
        for (String id : List.copyOf(pendingRequests.keySet())) {
            CompletableFuture<JsonNode> future = pendingRequests.remove(id);
            if (future != null) {
                future.completeExceptionally(RemoteToolException.sessionClosed());
            }
        }
    }

    // -----------------------------------------------------------------------
    // Parsing
    // -----------------------------------------------------------------------

    private ToolDescriptor parseToolDescriptor(JsonNode tool) throws ProtocolException {
        JsonNode name = tool.get("name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            throw new ProtocolException("Tool without a name declared by " + endpoint.name());
        }
        String description = tool.hasNonNull("description") ? tool.get("description").asText() : "";
        return new ToolDescriptor(
                name.asText(), description, JsonValueConverter.objectFromNode(tool.get("inputSchema")));
    }

    private static ToolCallResponse toResponse(JsonNode result) {
        List<JsonValue> content = new ArrayList<>();
        JsonNode items = result.get("content");
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                content.add(JsonValueConverter.fromNode(item));
            }
        }
        return new ToolCallResponse(content, result.path("isError").asBoolean(false));
    }
}
