package io.nexus.core.tool;

import io.nexus.core.json.JsonValue.JsonObject;
import java.util.Objects;

/// Describes a tool declared by a downstream server during capability discovery.
///
/// Descriptors are immutable once discovered. The `inputSchema` is opaque to
/// the router: it is forwarded verbatim to the planner and to the upward
/// catalog listing, never interpreted.
///
/// ### Contracts
/// - **Precondition**: `name` must not be null or blank
/// - **Postcondition**: All fields immutable after construction
///
/// @param name tool identifier, unique across the merged route table, not null
/// @param description human-readable description, not null (may be empty)
/// @param inputSchema JSON-Schema-like document describing accepted arguments, not null
/// @see ToolRoute for the routing entry derived from a descriptor
public record ToolDescriptor(String name, String description, JsonObject inputSchema) {

    /// Shown wherever a tool declares no description.
    public static final String NO_DESCRIPTION = "No description";

    /// Compact constructor with validation.
    public ToolDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        description = description != null ? description : "";
        inputSchema = inputSchema != null ? inputSchema : JsonObject.empty();
    }

    /// Returns the description, or {@link #NO_DESCRIPTION} when none was declared.
    ///
    /// @return display text, never null or empty
    public String displayDescription() {
        return description.isEmpty() ? NO_DESCRIPTION : description;
    }

    /// Creates a descriptor with an empty input schema.
    ///
    /// @param name tool identifier, not null
    /// @param description human-readable description, may be null
    /// @return new descriptor, never null
    public static ToolDescriptor simple(String name, String description) {
        return new ToolDescriptor(name, description, JsonObject.empty());
    }
}
