package io.nexus.server.api;

import io.nexus.core.Router;
import io.nexus.core.introspect.HealthReport;
import io.nexus.core.introspect.ToolCatalogView;
import io.nexus.server.streaming.QueryEvent;
import io.nexus.server.streaming.QueryProgressStream;
import io.nexus.server.validation.LogSanitizer;
import io.smallrye.mutiny.Multi;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestStreamElementType;

/// REST API exposing the router to upstream clients.
///
/// ### Endpoints
/// | Method | Path | Description |
/// |--------|------|-------------|
/// | POST | `/api/v1/query` | Answer a query |
/// | POST | `/api/v1/query/stream` | Answer a query, streaming progress as SSE |
/// | GET | `/api/v1/tools` | List routed tools |
/// | GET | `/api/v1/tools/catalog` | List routed tools with input schemas |
/// | GET | `/api/v1/health` | Router and downstream status |
///
/// Query failures never surface as HTTP errors: the orchestration turns them
/// into an answer text. Only invalid requests are rejected (400).
///
/// @see Router for the underlying operations
/// @see QueryProgressStream for the streamed variant
@Path("/api/v1")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RouterResource {

    private static final Logger LOG = Logger.getLogger(RouterResource.class);

    private final Router router;
    private final QueryProgressStream progressStream;

    @Inject
    public RouterResource(Router router, QueryProgressStream progressStream) {
        this.router = router;
        this.progressStream = progressStream;
    }

    /// Answers a query.
    ///
    /// @param request the query, validated by {@link io.nexus.server.validation.ValidQuery}
    /// @return the query with its answer, never null
    @POST
    @Path("/query")
    public QueryResponse query(@Valid @NotNull QueryRequest request) {
        LOG.infov("Query received: {0}", LogSanitizer.abbreviate(request.query(), 100));

        String answer = router.processQuery(request.query());
        return new QueryResponse(request.query(), answer);
    }

    /// Answers a query, streaming progress events followed by the answer.
    ///
    /// @param request the query, validated by {@link io.nexus.server.validation.ValidQuery}
    /// @return SSE stream of {@link QueryEvent}s ending with `completed` or `error`
    @POST
    @Path("/query/stream")
    @Produces(MediaType.SERVER_SENT_EVENTS)
    @RestStreamElementType(MediaType.APPLICATION_JSON)
    public Multi<QueryEvent> queryStream(@Valid @NotNull QueryRequest request) {
        String logQuery = LogSanitizer.abbreviate(request.query(), 100);
        LOG.infov("Streamed query received: {0}", logQuery);

        return progressStream
                .stream(request.query())
                .onTermination()
                .invoke(
                        (t, cancelled) -> {
                            if (t != null) {
                                LOG.warnv(t, "Query stream failed: {0}", logQuery);
                            } else if (cancelled) {
                                LOG.debugv("Query stream cancelled by client: {0}", logQuery);
                            } else {
                                LOG.debugv("Query stream completed: {0}", logQuery);
                            }
                        });
    }

    @GET
    @Path("/tools")
    public ToolCatalogView tools() {
        return router.listAvailableTools();
    }

    /// Lists routed tools including the input schema each server declared.
    ///
    /// @return catalog entries in route-table order, never null
    @GET
    @Path("/tools/catalog")
    public List<CatalogEntry> catalog() {
        return router.catalog().stream().map(CatalogEntry::from).toList();
    }

    @GET
    @Path("/health")
    public HealthReport health() {
        return router.healthCheck();
    }
}
