package io.nexus.core.plan;

import java.util.List;

/// Parses the planner model's raw reply into planned calls.
///
/// Keeps `nexus-core` free of JSON libraries. The Jackson-based
/// implementation lives in `nexus-serialization` as `JacksonPlanResponseParser`.
///
/// ### Accepted shapes
/// - a JSON array of `{"tool": "...", "arguments": {...}}`
/// - an object `{"tools": [...]}` holding such an array
/// - either of the above wrapped in markdown code fences
/// - blank text, meaning no calls
///
/// @see LlmPlanner for the primary caller
public interface PlanResponseParser {

    /// Parses the reply.
    ///
    /// @param content raw model reply, not null
    /// @return calls in plan order, never null, may be empty
    /// @throws PlanningException if the reply is not valid JSON
    List<PlannedCall> parse(String content) throws PlanningException;
}
