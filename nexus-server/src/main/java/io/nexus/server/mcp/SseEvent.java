package io.nexus.server.mcp;

/// One Server-Sent Event as received from a downstream server.
///
/// @param event event name; `message` when the server sent none
/// @param data event payload, data lines joined with `\n`
/// @param id last event ID seen on the stream, may be null
public record SseEvent(String event, String data, String id) {

    public static final String DEFAULT_EVENT = "message";
}
