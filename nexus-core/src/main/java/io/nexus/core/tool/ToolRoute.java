package io.nexus.core.tool;

import java.util.Objects;

/// Routing entry mapping a tool name to the downstream session that owns it.
///
/// Routes hold the owning session's name rather than the session itself; the
/// connection manager owns sessions for the whole process lifetime.
///
/// @param toolName the routed tool name, not null
/// @param ownerSessionName name of the downstream endpoint that declared the tool, not null
/// @param descriptor the declared descriptor including its schema, not null
public record ToolRoute(String toolName, String ownerSessionName, ToolDescriptor descriptor) {

    public ToolRoute {
        Objects.requireNonNull(toolName, "toolName must not be null");
        Objects.requireNonNull(ownerSessionName, "ownerSessionName must not be null");
        Objects.requireNonNull(descriptor, "descriptor must not be null");
    }

    /// Creates a route for a descriptor declared by the named session.
    ///
    /// @param sessionName owning endpoint name, not null
    /// @param descriptor declared tool, not null
    /// @return new route, never null
    public static ToolRoute of(String sessionName, ToolDescriptor descriptor) {
        return new ToolRoute(descriptor.name(), sessionName, descriptor);
    }
}
