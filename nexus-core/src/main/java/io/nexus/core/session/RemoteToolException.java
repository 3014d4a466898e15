package io.nexus.core.session;

import java.io.Serial;

/// Thrown when a downstream server reports an error for a tool call, or the
/// session closes while the call is pending.
public class RemoteToolException extends TransportException {

    @Serial private static final long serialVersionUID = -6040917123577108823L;

    private final Integer errorCode;

    public RemoteToolException(String message) {
        this(message, (Integer) null);
    }

    /// Creates an exception for a JSON-RPC style error reply.
    ///
    /// @param message the server's error message
    /// @param errorCode the server's error code, may be null
    public RemoteToolException(String message, Integer errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public RemoteToolException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = null;
    }

    /// Returns the server-provided error code.
    ///
    /// @return error code, or null if not available
    public Integer getErrorCode() {
        return errorCode;
    }

    /// Creates the exception used to fail calls pending on a closed session.
    ///
    /// @return new exception
    public static RemoteToolException sessionClosed() {
        return new RemoteToolException("Session closed");
    }
}
