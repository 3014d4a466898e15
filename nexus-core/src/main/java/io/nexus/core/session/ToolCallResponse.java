package io.nexus.core.session;

import io.nexus.core.json.JsonRenderer;
import io.nexus.core.json.JsonValue;
import io.nexus.core.json.JsonValue.JsonObject;
import io.nexus.core.json.JsonValue.JsonString;
import io.nexus.core.tool.ToolExecutionResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Raw response of a downstream tool call.
///
/// Only the first content item contributes to the result text: its `text`
/// member when it is a string, otherwise its JSON rendering. An empty content
/// list yields an empty text.
///
/// @param content ordered content items as returned by the server, not null
/// @param isError whether the server flagged the call as failed
public record ToolCallResponse(List<JsonValue> content, boolean isError) {

    public ToolCallResponse {
        content = content != null ? List.copyOf(content) : List.of();
    }

    /// Creates a successful response with a single text item.
    ///
    /// @param text the text content, not null
    /// @return new response, never null
    public static ToolCallResponse text(String text) {
        Map<String, JsonValue> item = new LinkedHashMap<>();
        item.put("type", new JsonString("text"));
        item.put("text", new JsonString(text));
        return new ToolCallResponse(List.of(new JsonObject(item)), false);
    }

    /// Extracts the textual result.
    ///
    /// @param renderer renders non-text content items, not null
    /// @return result text, never null
    public String resultText(JsonRenderer renderer) {
        if (content.isEmpty()) {
            return "";
        }
        JsonValue first = content.get(0);
        if (first instanceof JsonObject object) {
            Optional<JsonValue> text = object.get("text");
            if (text.isPresent() && text.get() instanceof JsonString s) {
                return s.value();
            }
        }
        return renderer.render(first);
    }

    /// Converts this response into an execution result.
    ///
    /// @param toolName the called tool, not null
    /// @param renderer renders non-text content items, not null
    /// @return successful result, or a failed one when {@link #isError()} is set
    public ToolExecutionResult toExecutionResult(String toolName, JsonRenderer renderer) {
        String text = resultText(renderer);
        return isError
                ? ToolExecutionResult.failure(toolName, text)
                : ToolExecutionResult.success(toolName, text);
    }
}
