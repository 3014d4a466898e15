package io.nexus.core.llm.stub;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Singleton registry of canned replies for {@link StubLanguageModel}.
///
/// A reply is registered under a prompt fragment; the stub answers with the
/// first registered reply whose fragment occurs in the prompt. Fragments are
/// checked in registration order.
///
/// @implNote Thread-safe singleton. All access is synchronized on the instance.
public class StubResponseRegistry {

    private static final Logger logger = Logger.getLogger(StubResponseRegistry.class.getName());

    private static final StubResponseRegistry INSTANCE = new StubResponseRegistry();

    private final Map<String, String> responses = new LinkedHashMap<>();

    private StubResponseRegistry() {}

    /// Returns the shared registry.
    ///
    /// @return singleton instance, never null
    public static StubResponseRegistry getInstance() {
        return INSTANCE;
    }

    /// Registers a reply for prompts containing `fragment`.
    ///
    /// Re-registering a fragment replaces its reply and keeps its position.
    ///
    /// @param fragment prompt fragment to match, not null
    /// @param response reply text, not null
    public synchronized void registerResponse(String fragment, String response) {
        Objects.requireNonNull(fragment, "fragment must not be null");
        Objects.requireNonNull(response, "response must not be null");
        responses.put(fragment, response);
        logger.fine("Registered stub response for fragment: " + fragment);
    }

    /// Finds the reply for a prompt.
    ///
    /// @param prompt the prompt, not null
    /// @return registered reply, or null if no fragment matches
    public synchronized String findResponse(String prompt) {
        for (Map.Entry<String, String> entry : responses.entrySet()) {
            if (prompt.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    /// Removes every registered reply.
    public synchronized void clearResponses() {
        responses.clear();
    }
}
