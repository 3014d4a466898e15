package io.nexus.core.introspect;

import io.nexus.core.tool.ToolRoute;
import java.util.List;

/// Snapshot of the routed tools, as listed to upstream clients.
///
/// @param totalTools number of routed tools
/// @param tools one summary per tool in route-table order, not null
public record ToolCatalogView(int totalTools, List<ToolSummary> tools) {

    public ToolCatalogView {
        tools = tools != null ? List.copyOf(tools) : List.of();
    }

    /// Builds a view from the current routes.
    ///
    /// @param routes routes in route-table order, not null
    /// @return new view, never null
    public static ToolCatalogView from(List<ToolRoute> routes) {
        List<ToolSummary> summaries =
                routes.stream()
                        .map(
                                route ->
                                        new ToolSummary(
                                                route.toolName(),
                                                route.ownerSessionName(),
                                                route.descriptor().displayDescription()))
                        .toList();
        return new ToolCatalogView(summaries.size(), summaries);
    }

    /// One routed tool.
    ///
    /// @param name tool name
    /// @param server owning endpoint name
    /// @param description tool description, or `No description` when none was declared
    public record ToolSummary(String name, String server, String description) {}
}
