package io.nexus.core.session;

import java.io.Serial;

/// Thrown when a downstream server cannot be reached or the handshake fails.
public class ConnectionException extends TransportException {

    @Serial private static final long serialVersionUID = 8125096376913526401L;

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    /// Creates an exception for an unreachable endpoint.
    ///
    /// @param endpoint the endpoint that could not be reached
    /// @param cause the underlying cause
    /// @return new exception
    public static ConnectionException unreachable(DownstreamEndpoint endpoint, Throwable cause) {
        return new ConnectionException(
                "Failed to connect to " + endpoint.name() + " at " + endpoint.address(), cause);
    }
}
