package io.nexus.core.plan;

import io.nexus.core.tool.ToolDescriptor;
import java.util.List;

/// Chooses which tools to call for a query.
///
/// @see LlmPlanner for the language-model implementation
public interface Planner {

    /// Plans tool calls for a query against the current catalog.
    ///
    /// @param query the user query, not null
    /// @param catalog tools currently routable, not null
    /// @return planned calls in execution order, never null; empty means no tools are needed
    /// @throws PlanningException if no plan could be produced
    List<PlannedCall> plan(String query, List<ToolDescriptor> catalog) throws PlanningException;
}
