package io.nexus.adapter.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.nexus.core.llm.LanguageModel;
import io.nexus.core.llm.LanguageModelConfig;
import io.nexus.core.llm.ModelResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link LanguageModel}.
///
/// Sends each prompt as a single user message; no conversation history is
/// kept between calls, so one instance can serve concurrent orchestrations.
///
/// @implNote Thread-safe if the wrapped {@link ChatModel} is (the LangChain4j
/// HTTP-backed models are).
///
/// @see LangChain4jProvider for model creation
public class LangChain4jLanguageModel implements LanguageModel {

    private static final Logger logger = Logger.getLogger(LangChain4jLanguageModel.class.getName());

    private final String id;
    private final LanguageModelConfig config;
    private final ChatModel model;

    /// Creates a language model wrapping the given chat model.
    ///
    /// @param id model instance identifier, not null
    /// @param config model configuration, not null
    /// @param model the LangChain4j chat model to delegate to, not null
    public LangChain4jLanguageModel(String id, LanguageModelConfig config, ChatModel model) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    /// Sends the prompt to the underlying chat model.
    ///
    /// @param prompt the prompt text, not null
    /// @return text response with usage metadata on success, error response on failure; never null
    @Override
    public ModelResponse complete(String prompt) {
        Instant startTime = Instant.now();

        try {
            List<ChatMessage> messages = List.of(UserMessage.from(prompt));
            ChatResponse response = model.chat(messages);

            if (response == null || response.aiMessage() == null) {
                return ModelResponse.Error.of("No response from model");
            }

            AiMessage aiMessage = response.aiMessage();
            String output = aiMessage.text() != null ? aiMessage.text() : "";

            logger.fine("Model '" + id + "' completed in "
                    + Duration.between(startTime, Instant.now()).toMillis() + "ms");
            return ModelResponse.Text.of(output, buildMetadata(response, startTime));

        } catch (Exception e) {
            logger.severe("Model '" + id + "' call failed: " + e.getMessage());
            return ModelResponse.Error.of(
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public LanguageModelConfig getConfig() {
        return config;
    }

    private Map<String, Object> buildMetadata(ChatResponse response, Instant startTime) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("model", config.getModel());
        metadata.put("timestamp", startTime.toString());
        metadata.put("duration_ms", Duration.between(startTime, Instant.now()).toMillis());

        if (response.metadata() == null) {
            return metadata;
        }

        var tokenUsage = response.metadata().tokenUsage();
        if (tokenUsage != null) {
            putIfPresent(metadata, "input_tokens", tokenUsage.inputTokenCount());
            putIfPresent(metadata, "output_tokens", tokenUsage.outputTokenCount());
            putIfPresent(metadata, "total_tokens", tokenUsage.totalTokenCount());
        }

        var finishReason = response.metadata().finishReason();
        if (finishReason != null) {
            metadata.put("finish_reason", finishReason.toString());
        }

        return metadata;
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
