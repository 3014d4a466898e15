package io.nexus.core.session;

import io.nexus.core.progress.ProgressSink;
import io.nexus.core.tool.ToolDescriptor;
import io.nexus.core.tool.ToolExecutionResult;
import java.util.List;
import java.util.Map;

/// One long-lived, bidirectional connection to a downstream tool server.
///
/// Carries request/response calls plus out-of-band progress notifications on
/// the same channel. Implementations decide the wire protocol; the router only
/// depends on this contract.
///
/// ### Contracts
/// - Only {@link #invoke} emits progress, in the order the server produced it,
///   and strictly before the call's terminal result
/// - A failing call leaves the session usable
/// - Implementations that can carry a single in-flight call serialize calls
///   internally
///
/// @implNote Implementations must be safe for concurrent {@link #invoke} calls.
/// @see TransportSessionFactory for creating sessions per endpoint
public interface TransportSession extends AutoCloseable {

    /// Opens the connection and performs the protocol handshake.
    ///
    /// @throws ConnectionException if the server is unreachable or the handshake fails
    void connect() throws ConnectionException;

    /// Lists the tools the server declares.
    ///
    /// @return declared tools in server order, never null
    /// @throws ProtocolException if discovery fails or the reply is malformed
    List<ToolDescriptor> listCapabilities() throws ProtocolException;

    /// Invokes a tool on the server.
    ///
    /// @param toolName the tool to call, not null
    /// @param arguments call arguments, not null
    /// @param progress receives progress notifications for this call, not null
    /// @return the call result, never null
    /// @throws RemoteToolException if the server rejects the call or the session closes
    /// @throws ToolTimeoutException if no result arrives within the call timeout
    ToolExecutionResult invoke(String toolName, Map<String, Object> arguments, ProgressSink progress)
            throws RemoteToolException, ToolTimeoutException;

    /// Returns the endpoint this session connects to.
    ///
    /// @return endpoint, never null
    DownstreamEndpoint endpoint();

    /// Closes the connection and fails any pending calls.
    @Override
    void close();
}
