package io.nexus.core.json;

/// Renders a {@link JsonValue} as JSON text.
///
/// Keeps `nexus-core` independent of any JSON library. The Jackson-based
/// implementation lives in `nexus-serialization` as `JacksonJsonRenderer`.
///
/// @see JsonValue for the document model
@FunctionalInterface
public interface JsonRenderer {

    /// Renders the document as JSON text.
    ///
    /// @param value the document to render, not null
    /// @return JSON text, never null
    String render(JsonValue value);
}
