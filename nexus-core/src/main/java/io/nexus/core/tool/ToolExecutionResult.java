package io.nexus.core.tool;

import java.util.Objects;

/// Outcome of one planned tool call, fed to synthesis.
///
/// Failures are carried as values rather than exceptions so that one failing
/// call never aborts the rest of a batch. Failed results render their text as
/// `"Error: <message>"`.
///
/// @param toolName the tool that was called, not null
/// @param resultText textual result or rendered error, not null
/// @param success whether the call completed without error
public record ToolExecutionResult(String toolName, String resultText, boolean success) {

    public ToolExecutionResult {
        Objects.requireNonNull(toolName, "toolName must not be null");
        resultText = resultText != null ? resultText : "";
    }

    /// Creates a successful result.
    ///
    /// @param toolName the called tool, not null
    /// @param resultText the textual result, may be null (treated as empty)
    /// @return successful result, never null
    public static ToolExecutionResult success(String toolName, String resultText) {
        return new ToolExecutionResult(toolName, resultText, true);
    }

    /// Creates a failed result with the `"Error: "` prefix applied.
    ///
    /// @param toolName the called tool, not null
    /// @param message the failure message, may be null
    /// @return failed result, never null
    public static ToolExecutionResult failure(String toolName, String message) {
        return new ToolExecutionResult(toolName, "Error: " + message, false);
    }
}
