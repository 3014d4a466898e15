package io.nexus.core.session;

/// Lifecycle state of a downstream session.
///
/// Sessions move `DISCONNECTED -> CONNECTING -> READY`, or to `FAILED` when the
/// handshake or capability discovery fails. There is no transition out of
/// `FAILED`; the router does not reconnect.
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    READY,
    FAILED
}
