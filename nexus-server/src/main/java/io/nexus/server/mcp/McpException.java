package io.nexus.server.mcp;

import java.io.Serial;

/// Exception thrown when an MCP message cannot be parsed or carries a
/// JSON-RPC error.
///
/// Raised by {@link JsonRpc}; {@link McpSseSession} translates it into the
/// router's checked transport exceptions at the session boundary.
public class McpException extends RuntimeException {

    @Serial private static final long serialVersionUID = 5486229795475543465L;

    private final Integer errorCode;

    /// Creates an MCP exception with a message.
    ///
    /// @param message the error message
    public McpException(String message) {
        super(message);
        this.errorCode = null;
    }

    /// Creates an MCP exception with a cause.
    ///
    /// @param message the error message
    /// @param cause the underlying cause
    public McpException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = null;
    }

    private McpException(String message, Integer errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    /// Returns the JSON-RPC error code.
    ///
    /// @return error code, or null if this is not a JSON-RPC error reply
    public Integer getErrorCode() {
        return errorCode;
    }

    /// Creates an exception for a JSON-RPC error reply.
    ///
    /// @param code the reply's error code
    /// @param message the reply's error message
    /// @return new exception
    public static McpException rpcError(int code, String message) {
        return new McpException(message, code);
    }
}
