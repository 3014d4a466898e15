package io.nexus.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nexus.core.json.JsonRenderer;
import io.nexus.core.json.JsonValue;
import java.io.UncheckedIOException;
import java.util.Objects;

/// Jackson-based {@link JsonRenderer}.
///
/// Renders compactly by default; the pretty variant indents nested members,
/// which keeps input schemas readable inside planning prompts.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is.
public class JacksonJsonRenderer implements JsonRenderer {

    private final ObjectMapper objectMapper;
    private final boolean pretty;

    /// Creates a compact renderer.
    ///
    /// @param objectMapper the mapper to write with, not null
    public JacksonJsonRenderer(ObjectMapper objectMapper) {
        this(objectMapper, false);
    }

    /// Creates a renderer.
    ///
    /// @param objectMapper the mapper to write with, not null
    /// @param pretty whether to indent the output
    public JacksonJsonRenderer(ObjectMapper objectMapper, boolean pretty) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.pretty = pretty;
    }

    @Override
    public String render(JsonValue value) {
        try {
            var node = JsonValueConverter.toNode(value);
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                    : objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render JSON document", e);
        }
    }
}
