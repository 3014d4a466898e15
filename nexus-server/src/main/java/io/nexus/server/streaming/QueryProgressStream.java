package io.nexus.server.streaming;

import io.nexus.core.Router;
import io.nexus.server.validation.LogSanitizer;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Objects;
import java.util.concurrent.Executor;
import org.jboss.logging.Logger;

/// Runs a query and streams its progress as {@link QueryEvent}s.
///
/// Each subscription runs one orchestration on a worker thread. Progress
/// events are forwarded as they happen; the stream ends with exactly one
/// {@link QueryEvent.Completed} (or {@link QueryEvent.Failed}).
///
/// ### Cancellation
/// When the subscriber cancels (client disconnect), the orchestration keeps
/// running to completion but nothing further is emitted; its result is
/// discarded.
///
/// @implNote Thread-safe. Stateless apart from the shared router.
/// @see io.nexus.server.api.RouterResource for the SSE endpoint
@ApplicationScoped
public class QueryProgressStream {

    private static final Logger LOG = Logger.getLogger(QueryProgressStream.class);

    private final Router router;
    private final Executor executor;

    @Inject
    public QueryProgressStream(Router router) {
        this(router, Infrastructure.getDefaultWorkerPool());
    }

    QueryProgressStream(Router router, Executor executor) {
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /// Streams the processing of one query.
    ///
    /// @param query the query to answer, not null
    /// @return cold stream; each subscription runs the query once
    public Multi<QueryEvent> stream(String query) {
        Objects.requireNonNull(query, "query must not be null");

        return Multi.createFrom()
                .<QueryEvent>emitter(
                        emitter -> {
                            String answer;
                            try {
                                answer =
                                        router.processQuery(
                                                query,
                                                event -> {
                                                    if (!emitter.isCancelled()) {
                                                        emitter.emit(QueryEvent.Progress.from(event));
                                                    }
                                                });
                            } catch (RuntimeException e) {
                                LOG.errorv(
                                        e,
                                        "Streamed query failed: {0}",
                                        LogSanitizer.abbreviate(query, 100));
                                if (!emitter.isCancelled()) {
                                    emitter.emit(new QueryEvent.Failed("Internal server error"));
                                    emitter.complete();
                                }
                                return;
                            }

                            if (!emitter.isCancelled()) {
                                emitter.emit(new QueryEvent.Completed(answer));
                                emitter.complete();
                            }
                        })
                .runSubscriptionOn(executor);
    }
}
