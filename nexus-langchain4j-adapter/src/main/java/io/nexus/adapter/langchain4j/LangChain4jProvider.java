package io.nexus.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.nexus.core.llm.LanguageModel;
import io.nexus.core.llm.LanguageModelConfig;
import io.nexus.core.llm.spi.LanguageModelProvider;
import java.util.Map;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link LanguageModelProvider}.
///
/// Creates {@link ChatModel} instances for supported AI providers and wraps them
/// in {@link LangChain4jLanguageModel}. Supports OpenAI (GPT and o-series),
/// Anthropic (Claude), Google (Gemini/Gemma), and DeepSeek models.
///
/// DeepSeek uses the OpenAI-compatible API with a custom base URL. Temperature
/// is sent only when configured, since reasoning models reject non-default values.
///
/// @implNote Stateless and thread-safe. Each call to {@link #createModel} creates
/// a new model instance.
///
/// @see LangChain4jLanguageModel for the model wrapper
public class LangChain4jProvider implements LanguageModelProvider {

    private static final Logger logger = Logger.getLogger(LangChain4jProvider.class.getName());

    static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";

    private static final int DEFAULT_MAX_TOKENS = 4096;

    @Override
    public String getName() {
        return "langchain4j";
    }

    @Override
    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || isOpenAi(modelName)
                || modelName.startsWith("gemini")
                || modelName.startsWith("gemma")
                || modelName.startsWith("deepseek");
    }

    @Override
    public LanguageModel createModel(LanguageModelConfig config, Map<String, String> credentials) {
        logger.info("Creating LangChain4j model: " + config.getModel());
        ChatModel model = createChatModel(config, credentials);
        return new LangChain4jLanguageModel("langchain4j:" + config.getModel(), config, model);
    }

    @Override
    public int getPriority() {
        return 100;
    }

    /// Creates the appropriate {@link ChatModel} based on model name prefix.
    ///
    /// @param config model configuration, not null
    /// @param credentials API keys by name, not null
    /// @return configured chat model, never null
    /// @throws IllegalArgumentException if the model name is not supported
    /// @throws IllegalStateException if the required API key is missing
    ChatModel createChatModel(LanguageModelConfig config, Map<String, String> credentials) {
        String modelName = config.getModel();

        if (modelName.startsWith("claude")) {
            return createAnthropicModel(config, credentials);
        } else if (isOpenAi(modelName)) {
            return createOpenAiModel(config, credentials, null);
        } else if (modelName.startsWith("gemini") || modelName.startsWith("gemma")) {
            return createGoogleAiModel(config, credentials);
        } else if (modelName.startsWith("deepseek")) {
            return createOpenAiModel(config, credentials, DEEPSEEK_BASE_URL);
        }

        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    private static boolean isOpenAi(String modelName) {
        return modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("o3")
                || modelName.startsWith("o4");
    }

    private ChatModel createAnthropicModel(
            LanguageModelConfig config, Map<String, String> credentials) {
        String apiKey = requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY");

        var builder =
                AnthropicChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(config.getModel())
                        .maxTokens(maxTokens(config))
                        .timeout(config.getTimeout());

        if (config.getTemperature() != null) builder.temperature(config.getTemperature());

        return builder.build();
    }

    /// Creates an OpenAI-compatible model, used for both OpenAI and DeepSeek
    /// (via base URL override).
    ///
    /// @param config model configuration, not null
    /// @param credentials API keys, not null
    /// @param baseUrl custom API endpoint, may be null (uses OpenAI default)
    /// @return configured model, never null
    private ChatModel createOpenAiModel(
            LanguageModelConfig config, Map<String, String> credentials, String baseUrl) {
        String apiKey =
                baseUrl != null
                        ? requireApiKey(credentials, "deepseek_api_key", "DEEPSEEK_API_KEY")
                        : requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY");

        var builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(config.getModel())
                        .timeout(config.getTimeout());

        if (baseUrl != null) builder.baseUrl(baseUrl);
        if (config.getTemperature() != null) builder.temperature(config.getTemperature());
        // Reasoning models only accept max_completion_tokens
        if (config.getMaxTokens() != null) builder.maxCompletionTokens(config.getMaxTokens());

        return builder.build();
    }

    private ChatModel createGoogleAiModel(
            LanguageModelConfig config, Map<String, String> credentials) {
        String apiKey = requireApiKey(credentials, "google_api_key", "GOOGLE_API_KEY");

        var builder =
                GoogleAiGeminiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(config.getModel())
                        .maxOutputTokens(maxTokens(config))
                        .timeout(config.getTimeout());

        if (config.getTemperature() != null) builder.temperature(config.getTemperature());

        return builder.build();
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @param credentials credential map to search, not null
    /// @param keyNames candidate key names in priority order
    /// @return the first non-blank value found, never null
    /// @throws IllegalStateException if no key name resolves to a value
    static String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }

    private static int maxTokens(LanguageModelConfig config) {
        return config.getMaxTokens() != null ? config.getMaxTokens() : DEFAULT_MAX_TOKENS;
    }
}
