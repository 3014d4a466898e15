package io.nexus.core.llm;

/// A text-completion capability backed by some LLM provider.
///
/// Implementations must not throw for provider failures; they return
/// {@link ModelResponse.Error} instead.
///
/// @implNote Implementations must be thread-safe. One instance serves
/// concurrent orchestrations.
///
/// @see io.nexus.core.llm.spi.LanguageModelProvider for creating models
public interface LanguageModel {

    /// Returns the identifier of this model instance.
    ///
    /// @return identifier, never null
    String getId();

    /// Returns the configuration this model was created with.
    ///
    /// @return configuration, never null
    LanguageModelConfig getConfig();

    /// Sends a single-turn prompt and returns the reply.
    ///
    /// @param prompt user prompt, not null
    /// @return the reply or the failure, never null
    ModelResponse complete(String prompt);
}
