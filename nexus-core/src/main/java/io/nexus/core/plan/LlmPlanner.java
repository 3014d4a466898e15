package io.nexus.core.plan;

import io.nexus.core.json.JsonRenderer;
import io.nexus.core.llm.LanguageModel;
import io.nexus.core.llm.ModelResponse;
import io.nexus.core.tool.ToolDescriptor;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link Planner} that asks a language model for a JSON list of tool calls.
///
/// The prompt lists every tool with its description and input schema, then
/// the query, and asks for a JSON array of `{"tool", "arguments"}` objects.
/// An empty array means the query needs no tools.
///
/// @implNote Thread-safe. The planner is stateless.
///
/// @see PlanResponseParser for reply parsing
public class LlmPlanner implements Planner {

    private static final Logger LOG = Logger.getLogger(LlmPlanner.class.getName());

    private static final String PLANNING_PROMPT_TEMPLATE =
            """
            You are a planning assistant. Given a user query and available tools,
            decide which tools to call and with what arguments.

            AVAILABLE TOOLS:
            %s

            USER QUERY: %s

            Respond with a JSON array of tool calls. Each tool call should have:
            - "tool": the tool name (exactly as shown above)
            - "arguments": the arguments to pass (matching the schema)

            Example response format:
            [
              {"tool": "web_search", "arguments": {"objective": "Find latest news", "search_queries": ["AI news 2025"]}}
            ]

            If no tools are needed, respond with an empty array: []

            IMPORTANT:
            - Only use tools that are in the AVAILABLE TOOLS list
            - Match the argument names exactly to the schema
            - Respond ONLY with valid JSON, no other text or markdown""";

    private final LanguageModel model;
    private final PlanResponseParser responseParser;
    private final JsonRenderer schemaRenderer;

    /// Creates a planner.
    ///
    /// @param model the planning model, not null
    /// @param responseParser converts the reply to calls, not null
    /// @param schemaRenderer renders tool input schemas into the prompt, not null
    public LlmPlanner(
            LanguageModel model, PlanResponseParser responseParser, JsonRenderer schemaRenderer) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.responseParser = Objects.requireNonNull(responseParser, "responseParser must not be null");
        this.schemaRenderer = Objects.requireNonNull(schemaRenderer, "schemaRenderer must not be null");
    }

    @Override
    public List<PlannedCall> plan(String query, List<ToolDescriptor> catalog)
            throws PlanningException {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");

        ModelResponse response = model.complete(buildPrompt(query, catalog));
        if (response instanceof ModelResponse.Error error) {
            throw new PlanningException("Planning model failed: " + error.message());
        }

        String content = ((ModelResponse.Text) response).content();
        if (content.isBlank()) {
            LOG.warning("Empty response from planning model");
            return List.of();
        }

        List<PlannedCall> calls = responseParser.parse(content);
        LOG.info("Planned " + calls.size() + " tool call(s)");
        return calls;
    }

    String buildPrompt(String query, List<ToolDescriptor> catalog) {
        return PLANNING_PROMPT_TEMPLATE.formatted(formatTools(catalog), query);
    }

    private String formatTools(List<ToolDescriptor> catalog) {
        StringBuilder sb = new StringBuilder();
        for (ToolDescriptor tool : catalog) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            String description = tool.displayDescription();
            sb.append("- ")
                    .append(tool.name())
                    .append(": ")
                    .append(description)
                    .append("\n  Schema: ")
                    .append(schemaRenderer.render(tool.inputSchema()));
        }
        return sb.toString();
    }
}
