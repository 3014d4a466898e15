package io.nexus.core.session;

import java.io.Serial;

/// Thrown when capability discovery fails or a server reply cannot be understood.
public class ProtocolException extends TransportException {

    @Serial private static final long serialVersionUID = 2214436591809512877L;

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
