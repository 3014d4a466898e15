package io.nexus.core.routing;

import io.nexus.core.session.ConnectionState;
import io.nexus.core.session.DownstreamEndpoint;
import io.nexus.core.session.TransportSession;
import io.nexus.core.tool.ToolDescriptor;
import java.util.List;
import java.util.Objects;

/// A configured downstream server together with its transport and state.
///
/// Owned by the {@link ConnectionManager} for the router's lifetime. State
/// transitions are made only by the manager; readers see them through
/// volatile fields.
public final class DownstreamSession {

    private final DownstreamEndpoint endpoint;
    private final TransportSession transport;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile List<ToolDescriptor> declaredTools = List.of();
    private volatile String failureMessage;

    DownstreamSession(DownstreamEndpoint endpoint, TransportSession transport) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
    }

    public String name() {
        return endpoint.name();
    }

    public DownstreamEndpoint endpoint() {
        return endpoint;
    }

    public TransportSession transport() {
        return transport;
    }

    public ConnectionState state() {
        return state;
    }

    /// Returns whether the session completed its handshake and discovery.
    ///
    /// @return true if `READY`
    public boolean isReady() {
        return state == ConnectionState.READY;
    }

    /// Returns the tools declared during discovery, in server order.
    ///
    /// @return immutable list, empty unless the session is or was ready
    public List<ToolDescriptor> declaredTools() {
        return declaredTools;
    }

    /// Returns the message of the failure that moved this session to `FAILED`.
    ///
    /// @return failure message, or null if the session never failed
    public String failureMessage() {
        return failureMessage;
    }

    void markConnecting() {
        state = ConnectionState.CONNECTING;
    }

    void markReady(List<ToolDescriptor> tools) {
        declaredTools = List.copyOf(tools);
        state = ConnectionState.READY;
    }

    void markFailed(String message) {
        failureMessage = message;
        state = ConnectionState.FAILED;
    }

    void markDisconnected() {
        state = ConnectionState.DISCONNECTED;
    }
}
