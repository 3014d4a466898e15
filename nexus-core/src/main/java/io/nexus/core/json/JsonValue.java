package io.nexus.core.json;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Opaque structured document exchanged with downstream servers.
///
/// Tool input schemas and tool result content are carried through the router
/// as `JsonValue` trees. The router never interprets them beyond forwarding;
/// member order of objects is preserved so that a schema reaches the planner
/// and the upward listing exactly as the downstream server declared it.
///
/// ### Variants
/// - {@link JsonNull}: the JSON `null` literal
/// - {@link JsonBoolean}, {@link JsonNumber}, {@link JsonString}: scalars
/// - {@link JsonArray}: ordered elements
/// - {@link JsonObject}: ordered members
///
/// Rendering to text is delegated to a {@link JsonRenderer} so that
/// `nexus-core` stays free of any JSON library.
///
/// @see JsonRenderer for text rendering
public sealed interface JsonValue
        permits JsonValue.JsonNull,
                JsonValue.JsonBoolean,
                JsonValue.JsonNumber,
                JsonValue.JsonString,
                JsonValue.JsonArray,
                JsonValue.JsonObject {

    /// Converts a plain Java value into a document tree.
    ///
    /// Accepts `null`, {@link Boolean}, {@link Number}, {@link CharSequence},
    /// {@link Map} with string keys, {@link Iterable}, and existing `JsonValue`s.
    ///
    /// @param value the value to convert, may be null
    /// @return the equivalent document, never null
    /// @throws IllegalArgumentException if the value has no JSON representation
    static JsonValue of(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof JsonValue json) {
            return json;
        }
        if (value instanceof Boolean b) {
            return new JsonBoolean(b);
        }
        if (value instanceof BigDecimal d) {
            return new JsonNumber(d);
        }
        if (value instanceof Number n) {
            return new JsonNumber(new BigDecimal(n.toString()));
        }
        if (value instanceof CharSequence s) {
            return new JsonString(s.toString());
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, JsonValue> members = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                members.put(String.valueOf(entry.getKey()), of(entry.getValue()));
            }
            return new JsonObject(members);
        }
        if (value instanceof Iterable<?> iterable) {
            List<JsonValue> elements = new ArrayList<>();
            for (Object element : iterable) {
                elements.add(of(element));
            }
            return new JsonArray(elements);
        }
        throw new IllegalArgumentException(
                "No JSON representation for " + value.getClass().getName());
    }

    /// Converts this document back into plain Java values.
    ///
    /// Objects become insertion-ordered maps, arrays become lists, numbers
    /// become {@link BigDecimal}, and `null` becomes `null`.
    ///
    /// @return plain value, may be null for {@link JsonNull}
    Object toPlain();

    /// The JSON `null` literal.
    enum JsonNull implements JsonValue {
        INSTANCE;

        @Override
        public Object toPlain() {
            return null;
        }
    }

    /// A JSON boolean.
    ///
    /// @param value the boolean value
    record JsonBoolean(boolean value) implements JsonValue {

        @Override
        public Object toPlain() {
            return value;
        }
    }

    /// A JSON number with arbitrary precision.
    ///
    /// @param value the numeric value, not null
    record JsonNumber(BigDecimal value) implements JsonValue {

        public JsonNumber {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    /// A JSON string.
    ///
    /// @param value the string value, not null
    record JsonString(String value) implements JsonValue {

        public JsonString {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    /// An ordered JSON array.
    ///
    /// @param elements array elements, not null (may be empty)
    record JsonArray(List<JsonValue> elements) implements JsonValue {

        public JsonArray {
            elements = elements != null ? List.copyOf(elements) : List.of();
        }

        @Override
        public Object toPlain() {
            List<Object> plain = new ArrayList<>(elements.size());
            for (JsonValue element : elements) {
                plain.add(element.toPlain());
            }
            return Collections.unmodifiableList(plain);
        }
    }

    /// An ordered JSON object.
    ///
    /// @param members object members in declaration order, not null (may be empty)
    record JsonObject(Map<String, JsonValue> members) implements JsonValue {

        private static final JsonObject EMPTY = new JsonObject(Map.of());

        public JsonObject {
            members =
                    members != null
                            ? Collections.unmodifiableMap(new LinkedHashMap<>(members))
                            : Map.of();
        }

        /// Returns the empty object `{}`.
        ///
        /// @return shared empty object, never null
        public static JsonObject empty() {
            return EMPTY;
        }

        /// Looks up a member by name.
        ///
        /// @param name member name, not null
        /// @return the member value if present
        public Optional<JsonValue> get(String name) {
            return Optional.ofNullable(members.get(name));
        }

        @Override
        public Object toPlain() {
            Map<String, Object> plain = new LinkedHashMap<>();
            members.forEach((name, value) -> plain.put(name, value.toPlain()));
            return Collections.unmodifiableMap(plain);
        }
    }
}
