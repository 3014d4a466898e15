package io.nexus.core.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/// Default thread-safe implementation of {@link RouteTable}.
///
/// Holds an immutable snapshot behind a volatile reference. Writers copy the
/// snapshot under a lock and publish the new map in one store, so lookups never
/// block and never see a partially registered session.
///
/// ### Thread Safety
/// @implNote Thread-safe. Writes are serialized by a {@link ReentrantLock};
/// reads are lock-free.
///
/// @see RouteTable for the contract and collision policy
public final class DefaultRouteTable implements RouteTable {

    private static final Logger logger = Logger.getLogger(DefaultRouteTable.class.getName());

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Map<String, ToolRoute> snapshot = Map.of();

    @Override
    public List<String> register(String sessionName, List<ToolDescriptor> descriptors) {
        Objects.requireNonNull(sessionName, "sessionName must not be null");
        Objects.requireNonNull(descriptors, "descriptors must not be null");

        List<String> replaced = new ArrayList<>();
        writeLock.lock();
        try {
            Map<String, ToolRoute> next = new LinkedHashMap<>(snapshot);
            for (ToolDescriptor descriptor : descriptors) {
                ToolRoute previous = next.put(descriptor.name(), ToolRoute.of(sessionName, descriptor));
                if (previous != null && !previous.ownerSessionName().equals(sessionName)) {
                    replaced.add(descriptor.name());
                    logger.warning(
                            "Tool '"
                                    + descriptor.name()
                                    + "' declared by both '"
                                    + previous.ownerSessionName()
                                    + "' and '"
                                    + sessionName
                                    + "'; routing to '"
                                    + sessionName
                                    + "'");
                }
            }
            snapshot = Collections.unmodifiableMap(next);
        } finally {
            writeLock.unlock();
        }
        return List.copyOf(replaced);
    }

    @Override
    public Optional<ToolRoute> resolve(String toolName) {
        Objects.requireNonNull(toolName, "toolName must not be null");
        return Optional.ofNullable(snapshot.get(toolName));
    }

    @Override
    public List<ToolRoute> routes() {
        return List.copyOf(snapshot.values());
    }
}
