package io.nexus.core.llm.stub;

import io.nexus.core.llm.LanguageModel;
import io.nexus.core.llm.LanguageModelConfig;
import io.nexus.core.llm.spi.LanguageModelProvider;
import java.util.Map;
import java.util.logging.Logger;

/// Provider that serves {@link StubLanguageModel}s for development and tests.
///
/// ### Enabling Stub Mode
/// - Constructor flag: `new StubLanguageModelProvider(true)`
/// - System property: `-Dnexus.stub.enabled=true`
/// - Environment variable: `NEXUS_STUB_ENABLED=true`
///
/// ### Priority Behavior
/// - When enabled: priority 1000 (intercepts all models)
/// - When disabled: priority -1 and no model supported
///
/// @implNote Thread-safe and stateless.
public class StubLanguageModelProvider implements LanguageModelProvider {

    private static final Logger logger =
            Logger.getLogger(StubLanguageModelProvider.class.getName());

    private static final String ENABLED_ENV = "NEXUS_STUB_ENABLED";
    private static final String ENABLED_PROPERTY = "nexus.stub.enabled";

    private final boolean enabled;

    /// Creates a provider enabled by system property or environment variable.
    public StubLanguageModelProvider() {
        this(isEnabledGlobally());
    }

    /// Creates a provider with an explicit enabled flag.
    ///
    /// @param enabled whether stub mode is on
    public StubLanguageModelProvider(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public boolean supportsModel(String modelName) {
        return enabled;
    }

    @Override
    public LanguageModel createModel(LanguageModelConfig config, Map<String, String> credentials) {
        if (!enabled) {
            throw new IllegalStateException("Stub provider called but not enabled");
        }
        logger.info("[STUB] Creating stub model for: " + config.getModel());
        return new StubLanguageModel(config);
    }

    /// Returns the provider priority.
    ///
    /// @return 1000 when enabled, -1 when disabled
    @Override
    public int getPriority() {
        return enabled ? 1000 : -1;
    }

    private static boolean isEnabledGlobally() {
        if ("true".equalsIgnoreCase(System.getProperty(ENABLED_PROPERTY))) {
            return true;
        }
        return "true".equalsIgnoreCase(System.getenv(ENABLED_ENV));
    }
}
