package io.nexus.core.routing;

import io.nexus.core.progress.MonotonicProgressSink;
import io.nexus.core.progress.ProgressScaler;
import io.nexus.core.progress.ProgressSink;
import io.nexus.core.session.TransportException;
import io.nexus.core.tool.ToolExecutionResult;
import io.nexus.core.tool.ToolRoute;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Forwards a planned call to the session that owns the tool.
///
/// Every outcome is returned as a {@link ToolExecutionResult}; nothing is
/// thrown for a failed call, so one failure never aborts a batch:
/// - unknown tool: `Error: Unknown tool: <name>`
/// - owning session not ready: `Error: No connection to server: <server>`
/// - transport failure: `Error: <message>`
///
/// Progress of the call is kept non-decreasing, scaled into the caller's
/// slice, prefixed with `[<tool>] `, and cut off once the result is known.
///
/// @implNote Thread-safe. Holds no per-call state.
public final class Dispatcher {

    private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

    private final ConnectionManager connections;

    /// Creates a dispatcher over the given sessions.
    ///
    /// @param connections resolves routes and sessions, not null
    public Dispatcher(ConnectionManager connections) {
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
    }

    /// Executes one tool call.
    ///
    /// @param toolName the tool to call, not null
    /// @param arguments call arguments, may be null (treated as empty)
    /// @param scaler the call's slice of overall progress, not null
    /// @param upstream overall progress sink, not null
    /// @return the call outcome, never null
    public ToolExecutionResult execute(
            String toolName,
            Map<String, Object> arguments,
            ProgressScaler scaler,
            ProgressSink upstream) {
        Objects.requireNonNull(toolName, "toolName must not be null");
        Objects.requireNonNull(scaler, "scaler must not be null");
        Objects.requireNonNull(upstream, "upstream must not be null");
        Map<String, Object> args = arguments != null ? arguments : Map.of();

        ToolRoute route;
        try {
            route = requireRoute(toolName);
        } catch (UnknownToolException e) {
            logger.warning(e.getMessage());
            return ToolExecutionResult.failure(toolName, e.getMessage());
        }

        Optional<DownstreamSession> session = connections.session(route.ownerSessionName());
        if (session.isEmpty() || !session.get().isReady()) {
            return ToolExecutionResult.failure(
                    toolName, "No connection to server: " + route.ownerSessionName());
        }

        MonotonicProgressSink callProgress =
                new MonotonicProgressSink(scaler.wrap(toolName, upstream));
        try {
            logger.fine("Dispatching " + toolName + " to " + route.ownerSessionName());
            return session.get().transport().invoke(toolName, args, callProgress);
        } catch (TransportException e) {
            logger.warning("Tool " + toolName + " failed: " + e.getMessage());
            return ToolExecutionResult.failure(toolName, e.getMessage());
        } catch (RuntimeException e) {
            logger.warning("Tool " + toolName + " failed unexpectedly: " + e);
            return ToolExecutionResult.failure(
                    toolName, e.getMessage() != null ? e.getMessage() : e.toString());
        } finally {
            callProgress.close();
        }
    }

    private ToolRoute requireRoute(String toolName) throws UnknownToolException {
        return connections.resolve(toolName).orElseThrow(() -> new UnknownToolException(toolName));
    }
}
