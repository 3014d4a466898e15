package io.nexus.server.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nexus.serialization.NexusJacksonModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/// CDI producers for shared utility beans.
///
/// The produced {@link ObjectMapper} is also the one Quarkus REST uses for
/// request and response bodies, so tool schemas ({@link io.nexus.core.json.JsonValue})
/// render as plain JSON in every API response.
@ApplicationScoped
public class ServerConfiguration {

    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new NexusJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
