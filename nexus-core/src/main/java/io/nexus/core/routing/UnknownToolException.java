package io.nexus.core.routing;

import java.io.Serial;

/// Thrown when a planned call names a tool that no session declared.
public class UnknownToolException extends Exception {

    @Serial private static final long serialVersionUID = -1480323517740982231L;

    private final String toolName;

    /// Creates an exception for the unknown tool.
    ///
    /// @param toolName the unresolved tool name
    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    /// Returns the unresolved tool name.
    ///
    /// @return tool name
    public String getToolName() {
        return toolName;
    }
}
