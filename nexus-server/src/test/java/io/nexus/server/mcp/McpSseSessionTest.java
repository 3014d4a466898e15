package io.nexus.server.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nexus.core.json.JsonValue;
import io.nexus.core.progress.ProgressEvent;
import io.nexus.core.progress.ProgressSink;
import io.nexus.core.session.ConnectionException;
import io.nexus.core.session.DownstreamEndpoint;
import io.nexus.core.session.RemoteToolException;
import io.nexus.core.session.ToolTimeoutException;
import io.nexus.core.session.TransportSession;
import io.nexus.core.tool.ToolDescriptor;
import io.nexus.core.tool.ToolExecutionResult;
import io.nexus.serialization.JacksonJsonRenderer;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class McpSseSessionTest {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration CALL_TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<TransportSession> sessions = new ArrayList<>();

    private FakeMcpServer server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeMcpServer();
        httpClient =
                HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(Duration.ofSeconds(2))
                        .build();
    }

    @AfterEach
    void tearDown() {
        sessions.forEach(TransportSession::close);
        server.close();
    }

    private TransportSession session(String address, Duration connectTimeout, Duration callTimeout) {
        McpSessionFactory factory =
                new McpSessionFactory(
                        httpClient,
                        new JsonRpc(mapper),
                        new JacksonJsonRenderer(mapper),
                        connectTimeout,
                        callTimeout);
        TransportSession session = factory.create(new DownstreamEndpoint("fake", address));
        sessions.add(session);
        return session;
    }

    private TransportSession connected() throws Exception {
        TransportSession session = session(server.sseAddress(), CONNECT_TIMEOUT, CALL_TIMEOUT);
        session.connect();
        return session;
    }

    private static ObjectNode textContent(ObjectMapper mapper, String text, boolean isError) {
        ObjectNode result = mapper.createObjectNode();
        ObjectNode item = result.putArray("content").addObject();
        item.put("type", "text");
        item.put("text", text);
        if (isError) {
            result.put("isError", true);
        }
        return result;
    }

    @Nested
    class Connect {

        @Test
        void shouldPerformInitializeHandshake() throws Exception {
            connected();

            List<JsonNode> received = server.received();
            assertThat(received).extracting(m -> m.get("method").asText())
                    .containsExactly("initialize", "notifications/initialized");

            JsonNode params = received.get(0).get("params");
            assertThat(params.get("protocolVersion").asText()).isEqualTo("2024-11-05");
            assertThat(params.get("clientInfo").get("name").asText()).isEqualTo("nexus-router");
            assertThat(params.get("capabilities").isObject()).isTrue();
            assertThat(received.get(1).has("id")).isFalse();
        }

        @Test
        void shouldFailWhenServerUnreachable() {
            TransportSession session =
                    session("http://127.0.0.1:1/sse", Duration.ofSeconds(2), CALL_TIMEOUT);

            assertThatThrownBy(session::connect)
                    .isInstanceOf(ConnectionException.class)
                    .hasMessageContaining("Failed to connect to fake");
        }

        @Test
        void shouldFailOnNonOkStatus() {
            TransportSession session =
                    session(server.address("/missing"), CONNECT_TIMEOUT, CALL_TIMEOUT);

            assertThatThrownBy(session::connect)
                    .isInstanceOf(ConnectionException.class)
                    .hasMessageContaining("HTTP 404");
        }

        @Test
        void shouldFailWhenEndpointEventNeverArrives() {
            server.silent();
            TransportSession session =
                    session(server.sseAddress(), Duration.ofMillis(300), CALL_TIMEOUT);

            assertThatThrownBy(session::connect)
                    .isInstanceOf(ConnectionException.class)
                    .hasMessageContaining("No endpoint event");
        }

        @Test
        void shouldFailWhenHandshakeIsRejected() {
            server.on(
                    "initialize",
                    (message, srv) -> srv.replyError(message, -32602, "Unsupported protocol"));
            TransportSession session = session(server.sseAddress(), CONNECT_TIMEOUT, CALL_TIMEOUT);

            assertThatThrownBy(session::connect)
                    .isInstanceOf(ConnectionException.class)
                    .hasMessageContaining("Handshake with fake failed")
                    .hasMessageContaining("Unsupported protocol");
        }
    }

    @Nested
    class ListCapabilities {

        @Test
        void shouldFollowPaginationCursor() throws Exception {
            server.on(
                    "tools/list",
                    (message, srv) -> {
                        ObjectNode result = srv.object();
                        boolean secondPage = message.path("params").has("cursor");
                        ObjectNode tool = result.putArray("tools").addObject();
                        if (secondPage) {
                            tool.put("name", "calculate");
                            tool.put("description", "Evaluates arithmetic");
                        } else {
                            tool.put("name", "search");
                            tool.put("description", "Web search");
                            ObjectNode schema = tool.putObject("inputSchema");
                            schema.put("type", "object");
                            schema.putObject("properties").putObject("query").put("type", "string");
                            result.put("nextCursor", "page-2");
                        }
                        srv.reply(message, result);
                    });
            TransportSession session = connected();

            List<ToolDescriptor> tools = session.listCapabilities();

            assertThat(tools).extracting(ToolDescriptor::name).containsExactly("search", "calculate");
            assertThat(tools.get(0).inputSchema().members()).containsOnlyKeys("type", "properties");
            assertThat(tools.get(1).inputSchema()).isEqualTo(JsonValue.JsonObject.empty());
            assertThat(tools.get(1).description()).isEqualTo("Evaluates arithmetic");

            List<JsonNode> listCalls =
                    server.received().stream()
                            .filter(m -> "tools/list".equals(m.path("method").asText()))
                            .toList();
            assertThat(listCalls).hasSize(2);
            assertThat(listCalls.get(1).get("params").get("cursor").asText()).isEqualTo("page-2");
        }
    }

    @Nested
    class Invoke {

        @Test
        void shouldForwardProgressBeforeResult() throws Exception {
            server.on(
                    "tools/call",
                    (message, srv) -> {
                        String token =
                                message.get("params").get("_meta").get("progressToken").asText();
                        srv.progress(token, 1, 4.0, "Searching");
                        srv.progress(token, 3, 4.0, "Ranking");
                        srv.reply(message, textContent(mapper, "3 results", false));
                    });
            TransportSession session = connected();
            List<ProgressEvent> events = new CopyOnWriteArrayList<>();

            ToolExecutionResult result =
                    session.invoke("search", Map.of("query", "quarkus"), events::add);

            assertThat(result.success()).isTrue();
            assertThat(result.resultText()).isEqualTo("3 results");
            assertThat(events).extracting(ProgressEvent::message).containsExactly("Searching", "Ranking");
            assertThat(events).extracting(ProgressEvent::fraction).containsExactly(0.25, 0.75);
        }

        @Test
        void shouldSendNameArgumentsAndProgressToken() throws Exception {
            server.on(
                    "tools/call",
                    (message, srv) -> srv.reply(message, textContent(mapper, "ok", false)));
            TransportSession session = connected();

            session.invoke("calculate", Map.of("expression", "2+2"), ProgressSink.NOOP);

            JsonNode call =
                    server.awaitReceived(
                            m -> "tools/call".equals(m.path("method").asText()),
                            Duration.ofSeconds(1));
            JsonNode params = call.get("params");
            assertThat(params.get("name").asText()).isEqualTo("calculate");
            assertThat(params.get("arguments").get("expression").asText()).isEqualTo("2+2");
            assertThat(params.get("_meta").get("progressToken").asText())
                    .startsWith("router-calculate-");
        }

        @Test
        void shouldMapIsErrorToFailedResult() throws Exception {
            server.on(
                    "tools/call",
                    (message, srv) -> srv.reply(message, textContent(mapper, "division by zero", true)));
            TransportSession session = connected();

            ToolExecutionResult result =
                    session.invoke("calculate", Map.of("expression", "1/0"), ProgressSink.NOOP);

            assertThat(result.success()).isFalse();
            assertThat(result.resultText()).isEqualTo("Error: division by zero");
        }

        @Test
        void shouldThrowRemoteToolExceptionOnErrorReply() throws Exception {
            server.on(
                    "tools/call",
                    (message, srv) -> srv.replyError(message, -32602, "Unknown tool: nope"));
            TransportSession session = connected();

            assertThatThrownBy(() -> session.invoke("nope", Map.of(), ProgressSink.NOOP))
                    .isInstanceOf(RemoteToolException.class)
                    .hasMessage("Unknown tool: nope")
                    .extracting(e -> ((RemoteToolException) e).getErrorCode())
                    .isEqualTo(-32602);
        }

        @Test
        void shouldTimeOutWhenNoReplyArrives() throws Exception {
            TransportSession session =
                    session(server.sseAddress(), CONNECT_TIMEOUT, Duration.ofMillis(300));
            session.connect();

            assertThatThrownBy(() -> session.invoke("slow", Map.of(), ProgressSink.NOOP))
                    .isInstanceOf(ToolTimeoutException.class);
            assertThat(((McpSseSession) session).pendingRequestCount()).isZero();
        }

        @Test
        void shouldCorrelateRepliesArrivingOutOfOrder() throws Exception {
            List<JsonNode> held = new ArrayList<>();
            server.on(
                    "tools/call",
                    (message, srv) -> {
                        synchronized (held) {
                            held.add(message);
                            if (held.size() < 2) {
                                return;
                            }
                        }
                        for (int i = held.size() - 1; i >= 0; i--) {
                            JsonNode call = held.get(i);
                            String name = call.get("params").get("name").asText();
                            srv.reply(call, textContent(mapper, "result of " + name, false));
                        }
                    });
            TransportSession session = connected();
            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<ToolExecutionResult> first =
                        pool.submit(() -> session.invoke("first", Map.of(), ProgressSink.NOOP));
                Future<ToolExecutionResult> second =
                        pool.submit(() -> session.invoke("second", Map.of(), ProgressSink.NOOP));

                assertThat(first.get(5, TimeUnit.SECONDS).resultText()).isEqualTo("result of first");
                assertThat(second.get(5, TimeUnit.SECONDS).resultText()).isEqualTo("result of second");
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        void shouldIgnoreProgressForUnknownTokens() throws Exception {
            server.on(
                    "tools/call",
                    (message, srv) -> {
                        srv.progress("someone-else", 0.5, null, "not ours");
                        srv.reply(message, textContent(mapper, "done", false));
                    });
            TransportSession session = connected();
            List<ProgressEvent> events = new CopyOnWriteArrayList<>();

            session.invoke("search", Map.of(), events::add);

            assertThat(events).isEmpty();
        }
    }

    @Nested
    class StreamLoss {

        @Test
        void shouldFailPendingCallWhenStreamDrops() throws Exception {
            server.on("tools/call", (message, srv) -> srv.dropStream());
            TransportSession session = connected();

            assertThatThrownBy(() -> session.invoke("search", Map.of(), ProgressSink.NOOP))
                    .isInstanceOf(RemoteToolException.class)
                    .hasMessage("Session closed");
        }

        @Test
        void shouldRejectCallsMadeAfterStreamDropsWithoutWaitingForTimeout() throws Exception {
            McpSseSession session = (McpSseSession) connected();
            server.dropStream();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (session.isStreamOpen() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertThat(session.isStreamOpen()).isFalse();

            long started = System.nanoTime();
            assertThatThrownBy(() -> session.invoke("search", Map.of(), ProgressSink.NOOP))
                    .isInstanceOf(RemoteToolException.class)
                    .hasMessage("Session closed");
            assertThat(Duration.ofNanos(System.nanoTime() - started))
                    .isLessThan(CALL_TIMEOUT.dividedBy(2));
        }

        @Test
        void shouldRejectCallsAfterClose() throws Exception {
            TransportSession session = connected();
            session.close();

            assertThatThrownBy(() -> session.invoke("search", Map.of(), ProgressSink.NOOP))
                    .isInstanceOf(RemoteToolException.class)
                    .hasMessage("Session closed");
        }
    }

    @Nested
    class ServerRequests {

        @Test
        void shouldAnswerPing() throws Exception {
            connected();
            ObjectNode ping = mapper.createObjectNode();
            ping.put("jsonrpc", "2.0");
            ping.put("id", "srv-1");
            ping.put("method", "ping");

            server.send(ping);

            JsonNode reply =
                    server.awaitReceived(
                            m -> "srv-1".equals(m.path("id").asText()) && m.has("result"),
                            Duration.ofSeconds(2));
            assertThat(reply.get("result").isObject()).isTrue();
        }
    }
}
