package io.nexus.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.nexus.core.json.JsonValue;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the router's serialization configuration.
///
/// - `JsonValue`: {@link JsonValueSerializer} / {@link JsonValueDeserializer},
///   so that tool schemas and content pass through REST responses unchanged
///
/// @implNote All registrations are explicit; no classpath scanning.
public class NexusJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 1764423093378110325L;

    public NexusJacksonModule() {
        super("NexusJacksonModule");

        addSerializer(JsonValue.class, new JsonValueSerializer());
        addDeserializer(JsonValue.class, new JsonValueDeserializer());
    }
}
