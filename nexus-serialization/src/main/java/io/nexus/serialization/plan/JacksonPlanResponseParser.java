package io.nexus.serialization.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nexus.core.plan.PlanResponseParser;
import io.nexus.core.plan.PlannedCall;
import io.nexus.core.plan.PlanningException;
import io.nexus.serialization.JsonValueConverter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Jackson-based implementation of {@link PlanResponseParser}.
///
/// Parses the planner model's reply into {@link PlannedCall} lists. Two
/// top-level shapes are accepted:
///
/// **Array:**
/// ```json
/// [{"tool": "search", "arguments": {"query": "weather"}}]
/// ```
///
/// **Wrapped:**
/// ```json
/// {"tools": [{"tool": "search", "arguments": {"query": "weather"}}]}
/// ```
///
/// Any other top-level value yields an empty plan. Entries that are not
/// objects, or that carry no `tool` name, are skipped with a warning.
/// Markdown code fences are stripped before deserialisation.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
///
/// @see io.nexus.core.plan.LlmPlanner for the primary caller
public class JacksonPlanResponseParser implements PlanResponseParser {

    private static final Logger logger = Logger.getLogger(JacksonPlanResponseParser.class.getName());

    private final ObjectMapper objectMapper;

    /// Creates a parser backed by the given Jackson mapper.
    ///
    /// @param objectMapper the mapper to use for JSON deserialisation, not null
    public JacksonPlanResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public List<PlannedCall> parse(String content) throws PlanningException {
        Objects.requireNonNull(content, "content must not be null");
        if (content.isBlank()) {
            return List.of();
        }
        String json = extractJson(content);
        if (json.isEmpty()) {
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PlanningException("Failed to parse plan JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode calls = root;
        if (root != null && root.isObject()) {
            calls = root.get("tools");
        }
        if (calls == null || !calls.isArray()) {
            return List.of();
        }

        List<PlannedCall> planned = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            JsonNode entry = calls.get(i);
            JsonNode tool = entry.isObject() ? entry.get("tool") : null;
            if (tool == null || !tool.isTextual() || tool.textValue().isBlank()) {
                logger.warning("Skipping plan entry " + i + " without a tool name");
                continue;
            }
            planned.add(PlannedCall.of(tool.textValue(), arguments(entry.get("arguments"))));
        }
        return planned;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> arguments(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return (Map<String, Object>) JsonValueConverter.fromNode(node).toPlain();
    }

    /// Extracts the JSON content from a model reply, stripping markdown fences.
    ///
    /// @param content raw reply, not null
    /// @return cleaned JSON text ready for deserialisation
    static String extractJson(String content) {
        String trimmed = content.trim();

        int start = trimmed.indexOf("```json");
        if (start >= 0) {
            String fenced = fencedBody(trimmed, start);
            if (fenced != null) {
                return fenced;
            }
        }

        start = trimmed.indexOf("```");
        if (start >= 0) {
            String fenced = fencedBody(trimmed, start);
            if (fenced != null) {
                return fenced;
            }
        }

        if (trimmed.startsWith("[") || trimmed.startsWith("{")) {
            return trimmed;
        }

        // Prose around a bare array
        int arrayStart = trimmed.indexOf('[');
        int arrayEnd = trimmed.lastIndexOf(']');
        if (arrayStart >= 0 && arrayEnd > arrayStart) {
            return trimmed.substring(arrayStart, arrayEnd + 1);
        }

        return trimmed;
    }

    private static String fencedBody(String content, int fenceStart) {
        int lineEnd = content.indexOf('\n', fenceStart);
        if (lineEnd < 0) {
            return null;
        }
        int bodyStart = lineEnd + 1;
        int end = content.indexOf("```", bodyStart);
        if (end < bodyStart) {
            // Unterminated fence: take the rest
            return content.substring(bodyStart).trim();
        }
        return content.substring(bodyStart, end).trim();
    }
}
