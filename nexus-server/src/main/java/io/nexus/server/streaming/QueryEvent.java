package io.nexus.server.streaming;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.nexus.core.progress.ProgressEvent;

/// SSE events emitted while a streamed query runs.
///
/// ### Event Types
/// - `progress` - an orchestration checkpoint or forwarded tool progress
/// - `completed` - the final answer; always the last event
/// - `error` - the orchestration failed unexpectedly; always the last event
///
/// @see QueryProgressStream for event publishing
/// @see io.nexus.server.api.RouterResource for the SSE endpoint
public sealed interface QueryEvent {

    /// Returns the event type identifier.
    ///
    /// @return event type string for the SSE event field
    @JsonProperty("type")
    String type();

    /// Progress of the running query.
    ///
    /// @param progress fraction in `[0, 1]`, non-decreasing within one stream
    /// @param total always `1.0`
    /// @param message human-readable checkpoint, may be null
    record Progress(double progress, double total, String message) implements QueryEvent {

        @Override
        public String type() {
            return "progress";
        }

        public static Progress from(ProgressEvent event) {
            return new Progress(event.fraction(), 1.0, event.message());
        }
    }

    /// Final answer of the query.
    ///
    /// @param answer the answer text, never blank
    record Completed(String answer) implements QueryEvent {

        @Override
        public String type() {
            return "completed";
        }
    }

    /// Unexpected failure of the query.
    ///
    /// @param message failure description
    record Failed(String message) implements QueryEvent {

        @Override
        public String type() {
            return "error";
        }
    }
}
