package io.nexus.core.plan;

import io.nexus.core.llm.LanguageModel;
import io.nexus.core.llm.ModelResponse;
import io.nexus.core.tool.ToolExecutionResult;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// {@link Synthesizer} backed by a language model.
///
/// Model failures and unexpected exceptions are rendered as text:
/// - `Error synthesizing response: <message>` for synthesis
/// - `Error generating direct response: <message>` for direct answers
///
/// A blank model reply yields `Unable to synthesize response.` or
/// `Unable to generate response.` respectively.
///
/// @implNote Thread-safe. The synthesizer is stateless.
public class LlmSynthesizer implements Synthesizer {

    private static final Logger LOG = Logger.getLogger(LlmSynthesizer.class.getName());

    private static final String SYNTHESIS_PROMPT_TEMPLATE =
            """
            Based on the following tool execution results, provide a comprehensive
            and helpful response to the user's query.

            USER QUERY: %s

            TOOL RESULTS:
            %s

            Provide a clear, well-structured response that addresses the user's query using the information
            from the tool results. Be concise but comprehensive.""";

    private final LanguageModel model;

    /// Creates a synthesizer.
    ///
    /// @param model the answering model, not null
    public LlmSynthesizer(LanguageModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    @Override
    public String synthesize(String query, List<ToolExecutionResult> results) {
        try {
            ModelResponse response = model.complete(buildPrompt(query, results));
            if (response instanceof ModelResponse.Error error) {
                return "Error synthesizing response: " + error.message();
            }
            String content = ((ModelResponse.Text) response).content().strip();
            return content.isEmpty() ? "Unable to synthesize response." : content;
        } catch (RuntimeException e) {
            LOG.warning("Synthesis failed: " + e.getMessage());
            return "Error synthesizing response: " + e.getMessage();
        }
    }

    @Override
    public String respondDirectly(String query) {
        try {
            ModelResponse response = model.complete(query);
            if (response instanceof ModelResponse.Error error) {
                return "Error generating direct response: " + error.message();
            }
            String content = ((ModelResponse.Text) response).content().strip();
            return content.isEmpty() ? "Unable to generate response." : content;
        } catch (RuntimeException e) {
            LOG.warning("Direct response failed: " + e.getMessage());
            return "Error generating direct response: " + e.getMessage();
        }
    }

    String buildPrompt(String query, List<ToolExecutionResult> results) {
        String resultsText =
                results.stream()
                        .map(
                                r ->
                                        "Tool: "
                                                + r.toolName()
                                                + "\nSuccess: "
                                                + r.success()
                                                + "\nResult: "
                                                + r.resultText())
                        .collect(Collectors.joining("\n\n"));
        return SYNTHESIS_PROMPT_TEMPLATE.formatted(query, resultsText);
    }
}
