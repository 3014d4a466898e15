package io.nexus.core.llm;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Sealed hierarchy for language model replies.
///
/// - {@link Text}: the model produced output
/// - {@link Error}: the call failed; the message explains why
///
/// @see LanguageModel#complete for the producing call
public sealed interface ModelResponse permits ModelResponse.Text, ModelResponse.Error {

    /// Returns when this response was created.
    Instant timestamp();

    /// Text produced by the model.
    ///
    /// @param content the output text, not null (may be empty)
    /// @param metadata execution metadata such as token usage, not null
    /// @param timestamp when the response was created, not null
    record Text(String content, Map<String, Object> metadata, Instant timestamp)
            implements ModelResponse {

        public Text {
            Objects.requireNonNull(content, "content must not be null");
            metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static Text of(String content) {
            return new Text(content, Map.of(), Instant.now());
        }

        public static Text of(String content, Map<String, Object> metadata) {
            return new Text(content, metadata, Instant.now());
        }
    }

    /// The model call failed.
    ///
    /// @param message failure description, not null
    /// @param timestamp when the failure occurred, not null
    record Error(String message, Instant timestamp) implements ModelResponse {

        public Error {
            Objects.requireNonNull(message, "message must not be null");
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static Error of(String message) {
            return new Error(message, Instant.now());
        }
    }
}
