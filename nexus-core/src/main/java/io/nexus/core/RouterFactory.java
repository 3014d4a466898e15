package io.nexus.core;

import io.nexus.core.json.JsonRenderer;
import io.nexus.core.llm.LanguageModel;
import io.nexus.core.llm.LanguageModelConfig;
import io.nexus.core.llm.LanguageModelFactory;
import io.nexus.core.llm.spi.LanguageModelProvider;
import io.nexus.core.llm.stub.StubLanguageModelProvider;
import io.nexus.core.orchestration.QueryOrchestrator;
import io.nexus.core.plan.LlmPlanner;
import io.nexus.core.plan.LlmSynthesizer;
import io.nexus.core.plan.PlanResponseParser;
import io.nexus.core.plan.Planner;
import io.nexus.core.plan.Synthesizer;
import io.nexus.core.routing.ConnectionManager;
import io.nexus.core.routing.Dispatcher;
import io.nexus.core.session.TransportSessionFactory;
import io.nexus.core.tool.DefaultRouteTable;
import io.nexus.core.tool.RouteTable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/// Factory for wiring a {@link Router}.
///
/// ### Usage
/// {@snippet :
/// Router router = RouterFactory.builder()
///     .config(RouterConfig.builder().maxParallelCalls(10).build())
///     .sessionFactory(endpoint -> new McpSseSession(endpoint, ...))
///     .languageModelProviders(List.of(new LangChain4jProvider()))
///     .credentials(RouterFactory.loadCredentialsFromEnvironment())
///     .planResponseParser(new JacksonPlanResponseParser(mapper))
///     .jsonRenderer(new JacksonJsonRenderer(mapper))
///     .build();
/// router.connectAll(endpoints);
/// }
///
/// @see Router
/// @see RouterConfig
public final class RouterFactory {

    private RouterFactory() {}

    public static Builder builder() {
        return new Builder();
    }

    /// Discovers API credentials from environment variables ending in `_API_KEY`.
    ///
    /// @return discovered credentials, never null (may be empty)
    public static Map<String, String> loadCredentialsFromEnvironment() {
        Map<String, String> credentials = new HashMap<>();
        System.getenv()
                .forEach(
                        (key, value) -> {
                            if (value != null
                                    && !value.isEmpty()
                                    && key.toUpperCase().endsWith("_API_KEY")) {
                                credentials.put(key, value);
                            }
                        });
        return credentials;
    }

    /// Fluent builder for {@link Router} instances.
    ///
    /// Either a {@link Planner} and {@link Synthesizer} are supplied directly, or
    /// they are built from a language model created through the configured
    /// providers. The built-in {@link StubLanguageModelProvider} is always
    /// included; {@link #stubMode(boolean)} switches it on.
    ///
    /// @implNote **Not thread-safe**. Configure on one thread, then call {@link #build()}.
    public static class Builder {
        private RouterConfig config = new RouterConfig();
        private TransportSessionFactory sessionFactory;
        private RouteTable routeTable;
        private LanguageModelConfig languageModelConfig =
                LanguageModelConfig.builder().model("gpt-5").build();
        private final List<LanguageModelProvider> providers = new ArrayList<>();
        private final Map<String, String> credentials = new HashMap<>();
        private Boolean stubMode;
        private PlanResponseParser planResponseParser;
        private JsonRenderer jsonRenderer;
        private Planner planner;
        private Synthesizer synthesizer;
        private ExecutorService executorService;

        private Builder() {}

        public Builder config(RouterConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Sets how transports are created per downstream endpoint.
        ///
        /// @param sessionFactory the transport factory, not null
        /// @return this builder for chaining, never null
        public Builder sessionFactory(TransportSessionFactory sessionFactory) {
            this.sessionFactory = sessionFactory;
            return this;
        }

        public Builder routeTable(RouteTable routeTable) {
            this.routeTable = routeTable;
            return this;
        }

        public Builder languageModelConfig(LanguageModelConfig languageModelConfig) {
            this.languageModelConfig =
                    Objects.requireNonNull(languageModelConfig, "languageModelConfig must not be null");
            return this;
        }

        public Builder languageModelProviders(List<LanguageModelProvider> providers) {
            this.providers.clear();
            this.providers.addAll(providers);
            return this;
        }

        public Builder languageModelProvider(LanguageModelProvider provider) {
            this.providers.add(provider);
            return this;
        }

        public Builder credentials(Map<String, String> credentials) {
            this.credentials.putAll(credentials);
            return this;
        }

        public Builder credential(String key, String value) {
            this.credentials.put(key, value);
            return this;
        }

        /// Enables or disables stub models that answer without API calls.
        ///
        /// When unset, the `nexus.stub.enabled` system property or the
        /// `NEXUS_STUB_ENABLED` environment variable decides.
        ///
        /// @param enabled `true` to enable stub mode
        /// @return this builder for chaining, never null
        public Builder stubMode(boolean enabled) {
            this.stubMode = enabled;
            return this;
        }

        public Builder planResponseParser(PlanResponseParser planResponseParser) {
            this.planResponseParser = planResponseParser;
            return this;
        }

        public Builder jsonRenderer(JsonRenderer jsonRenderer) {
            this.jsonRenderer = jsonRenderer;
            return this;
        }

        public Builder planner(Planner planner) {
            this.planner = planner;
            return this;
        }

        public Builder synthesizer(Synthesizer synthesizer) {
            this.synthesizer = synthesizer;
            return this;
        }

        /// Sets the pool running tool calls. The router shuts it down on close.
        ///
        /// @param executorService the pool, not null
        /// @return this builder for chaining, never null
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        /// Builds the router.
        ///
        /// @return a new unconnected router, never null
        /// @throws NullPointerException if the session factory, or the parser and
        ///     renderer needed for the default planner, are missing
        /// @throws IllegalStateException if no provider supports the configured model
        public Router build() {
            Objects.requireNonNull(sessionFactory, "sessionFactory must not be null");

            Planner resolvedPlanner = planner;
            Synthesizer resolvedSynthesizer = synthesizer;
            if (resolvedPlanner == null || resolvedSynthesizer == null) {
                LanguageModel model = createLanguageModel();
                if (resolvedPlanner == null) {
                    resolvedPlanner =
                            new LlmPlanner(
                                    model,
                                    Objects.requireNonNull(
                                            planResponseParser, "planResponseParser must not be null"),
                                    Objects.requireNonNull(
                                            jsonRenderer, "jsonRenderer must not be null"));
                }
                if (resolvedSynthesizer == null) {
                    resolvedSynthesizer = new LlmSynthesizer(model);
                }
            }

            ExecutorService executor =
                    executorService != null
                            ? executorService
                            : Executors.newCachedThreadPool(new ToolThreadFactory());

            ConnectionManager connections =
                    new ConnectionManager(
                            sessionFactory, routeTable != null ? routeTable : new DefaultRouteTable());
            QueryOrchestrator orchestrator =
                    new QueryOrchestrator(
                            connections,
                            new Dispatcher(connections),
                            resolvedPlanner,
                            resolvedSynthesizer,
                            executor,
                            config.isParallelToolCalls(),
                            config.getMaxParallelCalls());
            return new Router(config, connections, orchestrator, executor);
        }

        private LanguageModel createLanguageModel() {
            List<LanguageModelProvider> all = new ArrayList<>(providers);
            all.add(
                    stubMode != null
                            ? new StubLanguageModelProvider(stubMode)
                            : new StubLanguageModelProvider());
            return new LanguageModelFactory(all, credentials).createModel(languageModelConfig);
        }
    }

    private static final class ToolThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "nexus-tool-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
