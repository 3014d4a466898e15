package io.nexus.core;

/// Configuration options for the router's orchestration.
///
/// ### Default Values
/// - `maxParallelCalls`: `10` (concurrent tool calls of one query)
/// - `parallelToolCalls`: `true` (calls of one plan run concurrently)
///
/// @implNote **Not thread-safe**. Configure before passing to {@link RouterFactory}.
///
/// @see RouterFactory.Builder#config(RouterConfig)
public class RouterConfig {
    private int maxParallelCalls = 10;
    private boolean parallelToolCalls = true;

    /// Creates a configuration with default values.
    public RouterConfig() {}

    /// Returns how many tool calls of one query may be in flight at once.
    ///
    /// The limit applies per query. Calls of different queries never wait
    /// for each other.
    ///
    /// @return per-query concurrency limit, always positive
    public int getMaxParallelCalls() {
        return maxParallelCalls;
    }

    /// Sets the per-query concurrency limit.
    ///
    /// @param maxParallelCalls limit, must be positive
    /// @throws IllegalArgumentException if not positive
    public void setMaxParallelCalls(int maxParallelCalls) {
        if (maxParallelCalls <= 0) {
            throw new IllegalArgumentException(
                    "maxParallelCalls must be positive: " + maxParallelCalls);
        }
        this.maxParallelCalls = maxParallelCalls;
    }

    /// Returns whether calls of one plan run concurrently.
    ///
    /// @return `true` for concurrent execution, `false` for plan order one by one
    public boolean isParallelToolCalls() {
        return parallelToolCalls;
    }

    public void setParallelToolCalls(boolean parallelToolCalls) {
        this.parallelToolCalls = parallelToolCalls;
    }

    /// Creates a new builder.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link RouterConfig}.
    public static class Builder {
        private final RouterConfig config = new RouterConfig();

        public Builder maxParallelCalls(int limit) {
            config.setMaxParallelCalls(limit);
            return this;
        }

        public Builder parallelToolCalls(boolean parallel) {
            config.setParallelToolCalls(parallel);
            return this;
        }

        public RouterConfig build() {
            return config;
        }
    }
}
