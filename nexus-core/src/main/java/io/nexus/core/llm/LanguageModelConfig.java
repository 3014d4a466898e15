package io.nexus.core.llm;

import java.time.Duration;
import java.util.Objects;

/// Immutable configuration of the router's language model.
///
/// ### Fields
/// - `model` - model identifier, for example `gpt-5` or `claude-sonnet-4` (required)
/// - `temperature` - sampling temperature; omitted from requests when null
/// - `maxTokens` - response token limit; provider default when null
/// - `timeout` - request timeout (default: 60 seconds)
///
/// @implNote Thread-safe. All fields are immutable after construction.
public final class LanguageModelConfig {

    private final String model;
    private final Double temperature;
    private final Integer maxTokens;
    private final Duration timeout;

    private LanguageModelConfig(Builder builder) {
        this.model = Objects.requireNonNull(builder.model, "Model required");
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
        this.timeout = builder.timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the model identifier.
    ///
    /// @return non-null model name
    public String getModel() {
        return model;
    }

    /// Returns the sampling temperature.
    ///
    /// @return temperature, may be null (not sent to the provider)
    public Double getTemperature() {
        return temperature;
    }

    /// Returns the response token limit.
    ///
    /// @return max tokens, may be null (provider default used)
    public Integer getMaxTokens() {
        return maxTokens;
    }

    /// Returns the request timeout.
    ///
    /// @return timeout, never null
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "LanguageModelConfig{model='" + model + "', temperature=" + temperature
                + ", maxTokens=" + maxTokens + ", timeout=" + timeout + "}";
    }

    public static final class Builder {
        private String model;
        private Double temperature;
        private Integer maxTokens;
        private Duration timeout = Duration.ofSeconds(60);

        private Builder() {}

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
            return this;
        }

        public LanguageModelConfig build() {
            return new LanguageModelConfig(this);
        }
    }
}
