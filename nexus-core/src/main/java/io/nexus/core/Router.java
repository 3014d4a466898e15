package io.nexus.core;

import io.nexus.core.introspect.HealthReport;
import io.nexus.core.introspect.ToolCatalogView;
import io.nexus.core.orchestration.QueryOrchestrator;
import io.nexus.core.progress.ProgressSink;
import io.nexus.core.routing.ConnectionManager;
import io.nexus.core.routing.DownstreamSession;
import io.nexus.core.session.DownstreamEndpoint;
import io.nexus.core.tool.ToolRoute;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// The router aggregate: downstream sessions plus query orchestration.
///
/// Built once by {@link RouterFactory} and shared by all request handlers.
///
/// ### Lifecycle
/// 1. {@link #connectAll(List)} once at startup
/// 2. {@link #processQuery}, {@link #listAvailableTools()}, {@link #healthCheck()}
///    from any thread
/// 3. {@link #close()} at shutdown
///
/// @implNote Thread-safe after {@link #connectAll(List)} returns.
public final class Router implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(Router.class.getName());

    private final RouterConfig config;
    private final ConnectionManager connections;
    private final QueryOrchestrator orchestrator;
    private final ExecutorService executorService;

    Router(
            RouterConfig config,
            ConnectionManager connections,
            QueryOrchestrator orchestrator,
            ExecutorService executorService) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.executorService = Objects.requireNonNull(executorService, "executorService must not be null");
    }

    /// Connects every downstream endpoint and builds the route table.
    ///
    /// Unreachable endpoints are marked failed; startup continues.
    ///
    /// @param endpoints endpoints in configuration order, not null
    /// @return sessions in configuration order, never null
    /// @throws IllegalStateException if called more than once
    public List<DownstreamSession> connectAll(List<DownstreamEndpoint> endpoints) {
        return connections.connectAll(endpoints);
    }

    /// Answers a query using the downstream tools.
    ///
    /// @param query the user query, not null
    /// @param progress receives overall progress, not null
    /// @return the answer text, never null
    public String processQuery(String query, ProgressSink progress) {
        return orchestrator.processQuery(query, progress);
    }

    /// Answers a query without progress reporting.
    ///
    /// @param query the user query, not null
    /// @return the answer text, never null
    public String processQuery(String query) {
        return orchestrator.processQuery(query, ProgressSink.NOOP);
    }

    /// Lists the routed tools.
    ///
    /// @return catalog snapshot, never null
    public ToolCatalogView listAvailableTools() {
        return ToolCatalogView.from(connections.routes());
    }

    /// Returns every route including the verbatim input schemas.
    ///
    /// @return routes in route-table order, never null
    public List<ToolRoute> catalog() {
        return connections.routes();
    }

    /// Reports router and downstream status.
    ///
    /// @return health snapshot, never null
    public HealthReport healthCheck() {
        return HealthReport.from(connections.sessions());
    }

    public RouterConfig getConfig() {
        return config;
    }

    /// Closes every downstream session and stops the worker pool.
    @Override
    public void close() {
        logger.info("Shutting down router");
        connections.close();
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
