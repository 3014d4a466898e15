package io.nexus.core.plan;

import io.nexus.core.tool.ToolExecutionResult;
import java.util.List;

/// Turns tool results, or the bare query, into the final answer.
///
/// Neither method throws; failures are rendered into the returned text.
///
/// @see LlmSynthesizer for the language-model implementation
public interface Synthesizer {

    /// Composes an answer from tool results.
    ///
    /// @param query the user query, not null
    /// @param results results in plan order, not null
    /// @return answer text, never null
    String synthesize(String query, List<ToolExecutionResult> results);

    /// Answers the query without tools.
    ///
    /// @param query the user query, not null
    /// @return answer text, never null
    String respondDirectly(String query);
}
