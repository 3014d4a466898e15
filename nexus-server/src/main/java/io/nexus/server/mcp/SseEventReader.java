package io.nexus.server.mcp;

import java.util.Objects;
import java.util.function.Consumer;

/// Incremental parser for the `text/event-stream` format.
///
/// Fed one line at a time (without line terminator); dispatches an
/// {@link SseEvent} on every blank line that follows at least one `data`
/// field. Comment lines (leading `:`) and unknown fields are ignored. An event
/// left incomplete when the stream ends is discarded.
///
/// @implNote **Not thread-safe**. One reader per stream, fed by a single thread.
public final class SseEventReader {

    private final Consumer<SseEvent> sink;

    private String eventName;
    private StringBuilder data;
    private String lastEventId;

    /// Creates a reader.
    ///
    /// @param sink receives each complete event, not null
    public SseEventReader(Consumer<SseEvent> sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /// Processes one line of the stream.
    ///
    /// @param line the line without its terminator, not null
    public void onLine(String line) {
        if (line.isEmpty()) {
            dispatch();
            return;
        }
        if (line.startsWith(":")) {
            return;
        }

        String field;
        String value;
        int colon = line.indexOf(':');
        if (colon < 0) {
            field = line;
            value = "";
        } else {
            field = line.substring(0, colon);
            value = line.substring(colon + 1);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
        }

        switch (field) {
            case "event" -> eventName = value;
            case "data" -> {
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
            }
            case "id" -> lastEventId = value;
            default -> {
                // retry and unknown fields
            }
        }
    }

    private void dispatch() {
        if (data != null) {
            String name = eventName != null && !eventName.isEmpty() ? eventName : SseEvent.DEFAULT_EVENT;
            sink.accept(new SseEvent(name, data.toString(), lastEventId));
        }
        eventName = null;
        data = null;
    }
}
