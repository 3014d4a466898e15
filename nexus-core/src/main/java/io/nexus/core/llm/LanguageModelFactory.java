package io.nexus.core.llm;

import io.nexus.core.llm.spi.LanguageModelProvider;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Creates language models through the highest-priority supporting provider.
///
/// @implNote Thread-safe after construction. Provider list and credentials are
/// immutable once the factory is created.
///
/// @see LanguageModelProvider for implementing backends
public class LanguageModelFactory {

    private static final Logger logger = Logger.getLogger(LanguageModelFactory.class.getName());

    private final List<LanguageModelProvider> providers;
    private final Map<String, String> credentials;

    /// Creates a factory over explicit providers.
    ///
    /// @param providers available providers, not null
    /// @param credentials API keys by name, not null
    public LanguageModelFactory(
            List<LanguageModelProvider> providers, Map<String, String> credentials) {
        this.providers = List.copyOf(Objects.requireNonNull(providers, "providers must not be null"));
        this.credentials = Map.copyOf(Objects.requireNonNull(credentials, "credentials must not be null"));
        logger.info(
                "Loaded "
                        + this.providers.size()
                        + " language model providers: "
                        + this.providers.stream().map(LanguageModelProvider::getName).toList());
    }

    /// Creates a model for the configuration.
    ///
    /// @param config model configuration, not null
    /// @return created model, never null
    /// @throws IllegalStateException if no provider supports the configured model
    public LanguageModel createModel(LanguageModelConfig config) {
        String modelName = config.getModel();
        LanguageModelProvider provider =
                providers.stream()
                        .filter(p -> p.supportsModel(modelName))
                        .max(Comparator.comparingInt(LanguageModelProvider::getPriority))
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No provider found for model: "
                                                        + modelName
                                                        + ". Available providers: "
                                                        + providers.stream()
                                                                .map(LanguageModelProvider::getName)
                                                                .toList()));

        logger.info("Creating model '" + modelName + "' with provider: " + provider.getName());
        return provider.createModel(config, credentials);
    }

    /// Returns the configured providers.
    ///
    /// @return immutable list, never null
    public List<LanguageModelProvider> getProviders() {
        return providers;
    }

    /// Checks if any provider supports the model.
    ///
    /// @param modelName model identifier, not null
    /// @return `true` if at least one provider supports it
    public boolean isModelSupported(String modelName) {
        return providers.stream().anyMatch(p -> p.supportsModel(modelName));
    }
}
