package io.nexus.core.llm.stub;

import io.nexus.core.llm.LanguageModel;
import io.nexus.core.llm.LanguageModelConfig;
import io.nexus.core.llm.ModelResponse;
import java.util.Map;
import java.util.logging.Logger;

/// Language model that answers without calling any external API.
///
/// Replies come from {@link StubResponseRegistry} when a fragment matches.
/// Otherwise a planning prompt receives `[]`, so the router takes the direct
/// answer path, and any other prompt receives a labelled echo.
///
/// @implNote Thread-safe.
public class StubLanguageModel implements LanguageModel {

    private static final Logger logger = Logger.getLogger(StubLanguageModel.class.getName());

    static final String PLANNING_MARKER = "AVAILABLE TOOLS:";

    private final LanguageModelConfig config;
    private final StubResponseRegistry registry;

    public StubLanguageModel(LanguageModelConfig config) {
        this.config = config;
        this.registry = StubResponseRegistry.getInstance();
    }

    @Override
    public String getId() {
        return "stub:" + config.getModel();
    }

    @Override
    public LanguageModelConfig getConfig() {
        return config;
    }

    @Override
    public ModelResponse complete(String prompt) {
        logger.info("[STUB] Model received prompt (" + prompt.length() + " chars)");

        String reply = registry.findResponse(prompt);
        if (reply == null) {
            reply = prompt.contains(PLANNING_MARKER) ? "[]" : generateReply(prompt);
        }
        return ModelResponse.Text.of(reply, Map.of("stub", true, "model", config.getModel()));
    }

    private String generateReply(String prompt) {
        String excerpt = prompt.length() > 200 ? prompt.substring(0, 200) + "..." : prompt;
        return "[STUB RESPONSE from " + config.getModel() + "] " + excerpt;
    }
}
