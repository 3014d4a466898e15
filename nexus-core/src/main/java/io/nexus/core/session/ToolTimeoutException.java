package io.nexus.core.session;

import java.io.Serial;
import java.time.Duration;

/// Thrown when a tool call does not complete within the call timeout.
public class ToolTimeoutException extends TransportException {

    @Serial private static final long serialVersionUID = 4471090312688259036L;

    private final String toolName;

    public ToolTimeoutException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    /// Returns the tool that timed out.
    ///
    /// @return tool name, not null
    public String getToolName() {
        return toolName;
    }

    /// Creates an exception for a call that exceeded its timeout.
    ///
    /// @param toolName the tool that timed out
    /// @param timeout the elapsed timeout
    /// @return new exception
    public static ToolTimeoutException after(String toolName, Duration timeout) {
        return new ToolTimeoutException(
                toolName,
                "Tool '" + toolName + "' timed out after " + timeout.toMillis() + "ms");
    }
}
