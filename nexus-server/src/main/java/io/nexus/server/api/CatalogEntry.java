package io.nexus.server.api;

import io.nexus.core.json.JsonValue.JsonObject;
import io.nexus.core.tool.ToolRoute;

/// Full descriptor of a routed tool, as listed by `GET /api/v1/tools/catalog`.
///
/// @param name tool name
/// @param server owning downstream server
/// @param description tool description, may be empty
/// @param inputSchema schema exactly as the server declared it
public record CatalogEntry(String name, String server, String description, JsonObject inputSchema) {

    static CatalogEntry from(ToolRoute route) {
        return new CatalogEntry(
                route.toolName(),
                route.ownerSessionName(),
                route.descriptor().description(),
                route.descriptor().inputSchema());
    }
}
