package io.nexus.core.session;

/// Creates unconnected transport sessions for configured endpoints.
@FunctionalInterface
public interface TransportSessionFactory {

    /// Creates a session for the endpoint without connecting it.
    ///
    /// @param endpoint the downstream endpoint, not null
    /// @return new session, never null
    TransportSession create(DownstreamEndpoint endpoint);
}
