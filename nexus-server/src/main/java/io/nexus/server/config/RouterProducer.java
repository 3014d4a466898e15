package io.nexus.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.nexus.adapter.langchain4j.LangChain4jProvider;
import io.nexus.core.Router;
import io.nexus.core.RouterConfig;
import io.nexus.core.RouterFactory;
import io.nexus.core.llm.LanguageModelConfig;
import io.nexus.core.session.TransportSessionFactory;
import io.nexus.serialization.JacksonJsonRenderer;
import io.nexus.serialization.plan.JacksonPlanResponseParser;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// Produces the process-wide {@link Router}.
///
/// Wires the core router with the MCP session factory, the LangChain4j
/// language model provider and the Jackson-based plan parser. Downstream
/// connections are opened later by {@link ServerBootstrap}.
///
/// ### Credentials
/// API keys come from environment variables ending in `_API_KEY` and from
/// `nexus.credentials.<KEY>` properties; properties win on conflict.
///
/// @see ServerBootstrap for connecting downstream servers at startup
@ApplicationScoped
public class RouterProducer {

    private static final Logger LOG = Logger.getLogger(RouterProducer.class);

    static final String CREDENTIALS_PREFIX = "nexus.credentials.";

    private Router router;

    @Inject Config config;

    @Inject TransportSessionFactory sessionFactory;

    @Inject ObjectMapper objectMapper;

    @Produces
    @Singleton
    public Router router() {
        RouterConfig routerConfig =
                RouterConfig.builder()
                        .maxParallelCalls(
                                config.getOptionalValue(
                                                "nexus.orchestration.max-parallel-calls",
                                                Integer.class)
                                        .orElse(10))
                        .parallelToolCalls(
                                config.getOptionalValue(
                                                "nexus.orchestration.parallel-tool-calls",
                                                Boolean.class)
                                        .orElse(true))
                        .build();

        LanguageModelConfig modelConfig = languageModelConfig();
        boolean stubEnabled =
                config.getOptionalValue("nexus.stub.enabled", Boolean.class).orElse(false);

        router =
                RouterFactory.builder()
                        .config(routerConfig)
                        .sessionFactory(sessionFactory)
                        .languageModelConfig(modelConfig)
                        .languageModelProviders(List.of(new LangChain4jProvider()))
                        .credentials(credentials())
                        .stubMode(stubEnabled)
                        .planResponseParser(new JacksonPlanResponseParser(objectMapper))
                        .jsonRenderer(new JacksonJsonRenderer(objectMapper, true))
                        .build();

        LOG.infov(
                "Configured router: model={0}, stub={1}, parallelToolCalls={2}, maxParallelCalls={3}",
                modelConfig.getModel(),
                stubEnabled,
                routerConfig.isParallelToolCalls(),
                routerConfig.getMaxParallelCalls());
        return router;
    }

    LanguageModelConfig languageModelConfig() {
        return LanguageModelConfig.builder()
                .model(config.getOptionalValue("nexus.llm.model", String.class).orElse("gpt-5"))
                .temperature(
                        config.getOptionalValue("nexus.llm.temperature", Double.class).orElse(null))
                .maxTokens(
                        config.getOptionalValue("nexus.llm.max-tokens", Integer.class).orElse(null))
                .timeout(
                        config.getOptionalValue("nexus.llm.timeout", Duration.class)
                                .orElse(Duration.ofSeconds(60)))
                .build();
    }

    Map<String, String> credentials() {
        Map<String, String> credentials = new HashMap<>(RouterFactory.loadCredentialsFromEnvironment());
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(CREDENTIALS_PREFIX)) {
                String key = propertyName.substring(CREDENTIALS_PREFIX.length());
                config.getOptionalValue(propertyName, String.class)
                        .filter(value -> !value.isBlank())
                        .ifPresent(value -> credentials.put(key, value));
            }
        }
        return credentials;
    }

    @PreDestroy
    public void cleanup() {
        if (router != null) {
            router.close();
            LOG.info("Router closed");
        }
    }
}
