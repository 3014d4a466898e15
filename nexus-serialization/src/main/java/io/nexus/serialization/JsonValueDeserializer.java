package io.nexus.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.nexus.core.json.JsonValue;
import java.io.IOException;
import java.io.Serial;

/// Reads any JSON into a {@link JsonValue}.
///
/// @implNote Package-private. Registered by {@link NexusJacksonModule}.
class JsonValueDeserializer extends StdDeserializer<JsonValue> {

    @Serial private static final long serialVersionUID = -5581203954723149712L;

    JsonValueDeserializer() {
        super(JsonValue.class);
    }

    @Override
    public JsonValue deserialize(JsonParser parser, DeserializationContext context)
            throws IOException {
        JsonNode node = parser.readValueAsTree();
        return JsonValueConverter.fromNode(node);
    }

    @Override
    public JsonValue getNullValue(DeserializationContext context) {
        return JsonValue.JsonNull.INSTANCE;
    }
}
