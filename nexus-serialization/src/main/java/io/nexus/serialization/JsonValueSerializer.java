package io.nexus.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.nexus.core.json.JsonValue;
import java.io.IOException;
import java.io.Serial;

/// Writes a {@link JsonValue} as the JSON it represents.
///
/// @implNote Package-private. Registered by {@link NexusJacksonModule}.
class JsonValueSerializer extends StdSerializer<JsonValue> {

    @Serial private static final long serialVersionUID = 3290857172203657781L;

    JsonValueSerializer() {
        super(JsonValue.class);
    }

    @Override
    public void serialize(JsonValue value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeTree(JsonValueConverter.toNode(value));
    }
}
