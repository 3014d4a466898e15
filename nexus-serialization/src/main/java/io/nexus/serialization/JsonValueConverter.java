package io.nexus.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.nexus.core.json.JsonValue;
import io.nexus.core.json.JsonValue.JsonArray;
import io.nexus.core.json.JsonValue.JsonBoolean;
import io.nexus.core.json.JsonValue.JsonNull;
import io.nexus.core.json.JsonValue.JsonNumber;
import io.nexus.core.json.JsonValue.JsonObject;
import io.nexus.core.json.JsonValue.JsonString;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Converts between Jackson trees and {@link JsonValue} documents.
///
/// Member order is preserved in both directions. Numbers are carried as
/// `BigDecimal`; binary, POJO and missing nodes map to `null`.
///
/// @implNote Stateless and thread-safe.
public final class JsonValueConverter {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private JsonValueConverter() {}

    /// Converts a Jackson tree into a document.
    ///
    /// @param node the tree, may be null
    /// @return equivalent document, never null
    public static JsonValue fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return JsonNull.INSTANCE;
        }
        if (node.isObject()) {
            Map<String, JsonValue> members = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                members.put(field.getKey(), fromNode(field.getValue()));
            }
            return new JsonObject(members);
        }
        if (node.isArray()) {
            List<JsonValue> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(fromNode(element));
            }
            return new JsonArray(elements);
        }
        if (node.isBoolean()) {
            return new JsonBoolean(node.booleanValue());
        }
        if (node.isNumber()) {
            return new JsonNumber(node.decimalValue());
        }
        if (node.isTextual()) {
            return new JsonString(node.textValue());
        }
        return JsonNull.INSTANCE;
    }

    /// Converts a Jackson tree into an object document.
    ///
    /// @param node the tree, may be null
    /// @return the object, or an empty object if the node is not a JSON object
    public static JsonObject objectFromNode(JsonNode node) {
        JsonValue value = fromNode(node);
        return value instanceof JsonObject object ? object : JsonObject.empty();
    }

    /// Converts a document into a Jackson tree.
    ///
    /// @param value the document, not null
    /// @return equivalent tree, never null
    public static JsonNode toNode(JsonValue value) {
        if (value instanceof JsonObject object) {
            ObjectNode node = NODES.objectNode();
            object.members().forEach((name, member) -> node.set(name, toNode(member)));
            return node;
        }
        if (value instanceof JsonArray array) {
            ArrayNode node = NODES.arrayNode();
            array.elements().forEach(element -> node.add(toNode(element)));
            return node;
        }
        if (value instanceof JsonBoolean b) {
            return NODES.booleanNode(b.value());
        }
        if (value instanceof JsonNumber n) {
            return NODES.numberNode(n.value());
        }
        if (value instanceof JsonString s) {
            return NODES.textNode(s.value());
        }
        return NODES.nullNode();
    }
}
