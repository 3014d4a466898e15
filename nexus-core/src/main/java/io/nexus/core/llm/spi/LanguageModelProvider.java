package io.nexus.core.llm.spi;

import io.nexus.core.llm.LanguageModel;
import io.nexus.core.llm.LanguageModelConfig;
import java.util.Map;

/// Provider interface for pluggable language model backends.
///
/// Providers are passed explicitly to
/// {@link io.nexus.core.llm.LanguageModelFactory}; no classpath scanning is
/// involved.
///
/// ### Priority System
/// When several providers support a model, the one with the highest
/// {@link #getPriority()} wins. The stub provider uses 1000 when enabled so it
/// intercepts every model.
///
/// @implNote Implementations should be stateless and thread-safe.
/// @see io.nexus.core.llm.stub.StubLanguageModelProvider for a testing implementation
public interface LanguageModelProvider {

    /// Returns the provider's display name for logging.
    ///
    /// @return provider name, never null
    String getName();

    /// Checks if this provider can create the given model.
    ///
    /// @param modelName model identifier, not null
    /// @return `true` if supported
    boolean supportsModel(String modelName);

    /// Creates a model for the configuration.
    ///
    /// @param config model configuration, not null
    /// @param credentials API keys by name, not null
    /// @return configured model, never null
    /// @throws IllegalStateException if required credentials are missing
    LanguageModel createModel(LanguageModelConfig config, Map<String, String> credentials);

    /// Returns this provider's selection priority.
    ///
    /// @return priority; higher values are preferred (default: 0)
    default int getPriority() {
        return 0;
    }
}
