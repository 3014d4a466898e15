package io.nexus.core.tool;

import java.util.List;
import java.util.Optional;

/// Merged mapping from tool name to owning downstream session.
///
/// The table is rebuilt as sessions report their capabilities. Readers always
/// observe a consistent snapshot: a concurrent {@link #register} never leaves a
/// half-applied batch visible.
///
/// ### Collision policy
/// When two sessions declare the same tool name, the later registration wins.
/// The entry keeps its original position in {@link #routes()} ordering.
///
/// @see DefaultRouteTable for the default implementation
public interface RouteTable {

    /// Registers every tool declared by a session.
    ///
    /// @param sessionName the declaring session's name, not null
    /// @param descriptors tools declared by the session, not null
    /// @return names of tools whose previous owner was replaced, never null
    List<String> register(String sessionName, List<ToolDescriptor> descriptors);

    /// Looks up the route for a tool name.
    ///
    /// @param toolName the tool name, not null
    /// @return the route if any session declared the tool
    Optional<ToolRoute> resolve(String toolName);

    /// Returns all routes in registration order.
    ///
    /// @return immutable snapshot, never null
    List<ToolRoute> routes();

    /// Returns all descriptors in registration order.
    ///
    /// @return immutable snapshot, never null
    default List<ToolDescriptor> descriptors() {
        return routes().stream().map(ToolRoute::descriptor).toList();
    }

    /// Returns the number of routed tools.
    ///
    /// @return tool count
    default int size() {
        return routes().size();
    }

    /// Returns whether no tool is routed.
    ///
    /// @return true if the table is empty
    default boolean isEmpty() {
        return size() == 0;
    }
}
