package io.nexus.core.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One tool call chosen by the planner.
///
/// The tool name is not validated against the catalog here; unknown names
/// surface as failed results during dispatch.
///
/// @param toolName the tool to call, not null
/// @param arguments call arguments in planner order, not null (may be empty)
public record PlannedCall(String toolName, Map<String, Object> arguments) {

    public PlannedCall {
        Objects.requireNonNull(toolName, "toolName must not be null");
        arguments =
                arguments != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                        : Map.of();
    }

    public static PlannedCall of(String toolName, Map<String, Object> arguments) {
        return new PlannedCall(toolName, arguments);
    }
}
