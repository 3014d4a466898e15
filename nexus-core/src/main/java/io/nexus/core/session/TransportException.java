package io.nexus.core.session;

import java.io.Serial;

/// Base exception for failures talking to a downstream server.
///
/// Subclasses separate the failure kinds:
/// - {@link ConnectionException}: server unreachable or handshake failed
/// - {@link ProtocolException}: malformed or failed capability discovery
/// - {@link RemoteToolException}: the server reported a call error, or the session closed
/// - {@link ToolTimeoutException}: no result within the call timeout
public class TransportException extends Exception {

    @Serial private static final long serialVersionUID = -3307451218630145192L;

    /// Creates an exception with a message.
    ///
    /// @param message the error message
    public TransportException(String message) {
        super(message);
    }

    /// Creates an exception with a message and cause.
    ///
    /// @param message the error message
    /// @param cause the underlying cause
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
