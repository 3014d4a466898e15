package io.nexus.core.routing;

import io.nexus.core.session.DownstreamEndpoint;
import io.nexus.core.session.TransportException;
import io.nexus.core.session.TransportSession;
import io.nexus.core.session.TransportSessionFactory;
import io.nexus.core.tool.RouteTable;
import io.nexus.core.tool.ToolDescriptor;
import io.nexus.core.tool.ToolRoute;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Owns one transport session per configured downstream endpoint.
///
/// {@link #connectAll} connects each endpoint in configuration order and runs
/// capability discovery. A failing endpoint is marked `FAILED` and skipped;
/// startup continues with the rest. Once every endpoint was attempted, the
/// tools of all ready sessions are merged into the {@link RouteTable} in the
/// same order, so the last endpoint wins a name collision.
///
/// ### Lifecycle
/// - {@link #connectAll} runs once; a second call is rejected
/// - Sessions live until {@link #close()}; there is no reconnection
///
/// ### Thread Safety
/// @implNote Lookups are safe from any thread after {@link #connectAll}
/// returns. The session map is published once and never mutated.
///
/// @see Dispatcher for routing calls through the sessions
public final class ConnectionManager implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ConnectionManager.class.getName());

    private final TransportSessionFactory sessionFactory;
    private final RouteTable routeTable;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile Map<String, DownstreamSession> sessions = Map.of();

    /// Creates a manager.
    ///
    /// @param sessionFactory creates transports per endpoint, not null
    /// @param routeTable receives the merged tool routes, not null
    public ConnectionManager(TransportSessionFactory sessionFactory, RouteTable routeTable) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory must not be null");
        this.routeTable = Objects.requireNonNull(routeTable, "routeTable must not be null");
    }

    /// Connects every endpoint and builds the route table.
    ///
    /// @param endpoints endpoints in configuration order, not null
    /// @return the sessions in configuration order, never null
    /// @throws IllegalStateException if called more than once
    /// @throws IllegalArgumentException if two endpoints share a name
    public List<DownstreamSession> connectAll(List<DownstreamEndpoint> endpoints) {
        Objects.requireNonNull(endpoints, "endpoints must not be null");
        requireUniqueNames(endpoints);
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("connectAll has already been called");
        }

        Map<String, DownstreamSession> connected = new LinkedHashMap<>();
        for (DownstreamEndpoint endpoint : endpoints) {
            DownstreamSession session =
                    new DownstreamSession(endpoint, sessionFactory.create(endpoint));
            connected.put(endpoint.name(), session);
            connect(session);
        }
        sessions = Collections.unmodifiableMap(connected);

        int ready = 0;
        for (DownstreamSession session : connected.values()) {
            if (session.isReady()) {
                routeTable.register(session.name(), session.declaredTools());
                ready++;
            }
        }
        logger.info(
                "Connected "
                        + ready
                        + "/"
                        + connected.size()
                        + " downstream server(s), "
                        + routeTable.size()
                        + " tool(s) routed");
        return List.copyOf(connected.values());
    }

    /// Resolves the route for a tool name.
    ///
    /// @param toolName the tool name, not null
    /// @return route if some ready session declared the tool
    public Optional<ToolRoute> resolve(String toolName) {
        return routeTable.resolve(toolName);
    }

    /// Returns the merged catalog in route-table order.
    ///
    /// @return immutable snapshot, never null
    public List<ToolDescriptor> snapshotCatalog() {
        return routeTable.descriptors();
    }

    /// Returns all routes in route-table order.
    ///
    /// @return immutable snapshot, never null
    public List<ToolRoute> routes() {
        return routeTable.routes();
    }

    /// Looks up a session by endpoint name.
    ///
    /// @param name endpoint name, not null
    /// @return the session if configured
    public Optional<DownstreamSession> session(String name) {
        return Optional.ofNullable(sessions.get(name));
    }

    /// Returns every configured session in configuration order.
    ///
    /// @return immutable list, never null
    public List<DownstreamSession> sessions() {
        return List.copyOf(sessions.values());
    }

    /// Closes every session.
    @Override
    public void close() {
        for (DownstreamSession session : sessions.values()) {
            try {
                session.transport().close();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to close session " + session.name(), e);
            }
            session.markDisconnected();
        }
    }

    private void connect(DownstreamSession session) {
        TransportSession transport = session.transport();
        session.markConnecting();
        try {
            transport.connect();
            List<ToolDescriptor> tools = transport.listCapabilities();
            session.markReady(tools);
            logger.info(
                    "Connected to "
                            + session.name()
                            + " at "
                            + session.endpoint().address()
                            + " ("
                            + tools.size()
                            + " tools)");
        } catch (TransportException | RuntimeException e) {
            session.markFailed(e.getMessage());
            logger.warning(
                    "Failed to connect to " + session.name() + ": " + e.getMessage());
            closeQuietly(session, transport);
        }
    }

    // A failed session keeps no stream or reader thread open.
    private void closeQuietly(DownstreamSession session, TransportSession transport) {
        try {
            transport.close();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to close session " + session.name(), e);
        }
    }

    private static void requireUniqueNames(List<DownstreamEndpoint> endpoints) {
        Set<String> names = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (DownstreamEndpoint endpoint : endpoints) {
            if (!names.add(endpoint.name())) {
                duplicates.add(endpoint.name());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException("Duplicate downstream server names: " + duplicates);
        }
    }
}
