package io.nexus.core.orchestration;

import io.nexus.core.plan.PlannedCall;
import io.nexus.core.plan.Planner;
import io.nexus.core.plan.PlanningException;
import io.nexus.core.plan.Synthesizer;
import io.nexus.core.progress.MonotonicProgressSink;
import io.nexus.core.progress.ProgressScaler;
import io.nexus.core.progress.ProgressSink;
import io.nexus.core.routing.ConnectionManager;
import io.nexus.core.routing.Dispatcher;
import io.nexus.core.tool.ToolDescriptor;
import io.nexus.core.tool.ToolExecutionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.logging.Logger;

/// Runs one query end to end: plan, dispatch, synthesize.
///
/// ### Progress checkpoints
/// | Fraction | Message |
/// |---|---|
/// | 0.1 | `Analyzing query and planning tool calls...` |
/// | 0.2 | `Planning which tools to use...` |
/// | 0.3 | `Executing <n> tool(s)...` |
/// | 0.3 - 0.8 | per-call slices, `Executing tool <i>/<n>: <tool>` and forwarded tool progress |
/// | 0.9 | `Synthesizing final response...` or `Generating direct response...` |
/// | 1.0 | `Complete!` |
///
/// The reported stream never decreases and never exceeds 1.0, also when
/// calls run concurrently and their notifications interleave.
///
/// ### Failure handling
/// - empty route table: returns {@link #NO_TOOLS_MESSAGE} without planning
/// - planner failure or empty plan: answers the query directly
/// - tool failure: becomes a failed result that still reaches synthesis
///
/// ### Concurrency
/// Calls of one query share a per-query limit of `maxParallelCalls` permits.
/// Queries never queue behind each other's calls, provided the executor grows
/// on demand (the default built by `RouterFactory` does).
///
/// @implNote Thread-safe. Per-query state lives in an {@link OrchestrationRun}.
/// The executor is owned by the caller.
public final class QueryOrchestrator {

    private static final Logger logger = Logger.getLogger(QueryOrchestrator.class.getName());

    public static final String NO_TOOLS_MESSAGE =
            "No downstream tools available. Please check server connections.";

    private static final double EXECUTION_START = 0.3;
    private static final double EXECUTION_WIDTH = 0.5;

    private final ConnectionManager connections;
    private final Dispatcher dispatcher;
    private final Planner planner;
    private final Synthesizer synthesizer;
    private final ExecutorService executor;
    private final boolean parallelToolCalls;
    private final int maxParallelCalls;

    /// Creates an orchestrator.
    ///
    /// @param connections source of the tool catalog, not null
    /// @param dispatcher executes planned calls, not null
    /// @param planner chooses calls, not null
    /// @param synthesizer composes the answer, not null
    /// @param executor runs tool calls, not null
    /// @param parallelToolCalls whether calls of one plan run concurrently
    /// @param maxParallelCalls calls of one query in flight at once, must be positive
    /// @throws IllegalArgumentException if `maxParallelCalls` is not positive
    public QueryOrchestrator(
            ConnectionManager connections,
            Dispatcher dispatcher,
            Planner planner,
            Synthesizer synthesizer,
            ExecutorService executor,
            boolean parallelToolCalls,
            int maxParallelCalls) {
        if (maxParallelCalls <= 0) {
            throw new IllegalArgumentException(
                    "maxParallelCalls must be positive: " + maxParallelCalls);
        }
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.parallelToolCalls = parallelToolCalls;
        this.maxParallelCalls = maxParallelCalls;
    }

    /// Processes a query.
    ///
    /// @param query the user query, not null
    /// @param sink receives overall progress, not null
    /// @return the answer text, never null
    public String processQuery(String query, ProgressSink sink) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(sink, "sink must not be null");

        OrchestrationRun run = new OrchestrationRun(query);
        try (MonotonicProgressSink progress = new MonotonicProgressSink(sink)) {
            progress.report(0.1, "Analyzing query and planning tool calls...");

            List<ToolDescriptor> catalog = connections.snapshotCatalog();
            if (catalog.isEmpty()) {
                logger.warning("Run " + run.id() + ": no downstream tools available");
                run.advance(OrchestrationPhase.DONE);
                progress.report(1.0, "Complete!");
                return NO_TOOLS_MESSAGE;
            }

            progress.report(0.2, "Planning which tools to use...");
            List<PlannedCall> calls = plan(run, catalog);

            String answer;
            if (calls.isEmpty()) {
                progress.report(0.9, "Generating direct response...");
                answer = synthesizer.respondDirectly(query);
            } else {
                run.advance(OrchestrationPhase.EXECUTING);
                progress.report(EXECUTION_START, "Executing " + calls.size() + " tool(s)...");
                List<ToolExecutionResult> results = execute(calls, progress);

                run.advance(OrchestrationPhase.SYNTHESIZING);
                progress.report(0.9, "Synthesizing final response...");
                answer = synthesizer.synthesize(query, results);
            }

            run.advance(OrchestrationPhase.DONE);
            progress.report(1.0, "Complete!");
            return answer;
        }
    }

    private List<PlannedCall> plan(OrchestrationRun run, List<ToolDescriptor> catalog) {
        try {
            return planner.plan(run.query(), catalog);
        } catch (PlanningException e) {
            logger.warning("Run " + run.id() + ": planning failed, answering directly: " + e.getMessage());
            return List.of();
        }
    }

    private List<ToolExecutionResult> execute(List<PlannedCall> calls, ProgressSink progress) {
        int count = calls.size();
        if (!parallelToolCalls || count == 1) {
            List<ToolExecutionResult> results = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                results.add(executeOne(calls.get(i), i, count, progress));
            }
            return results;
        }

        Semaphore permits = new Semaphore(Math.min(maxParallelCalls, count));
        List<Future<ToolExecutionResult>> futures = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            PlannedCall call = calls.get(i);
            int index = i;
            try {
                permits.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(future -> future.cancel(true));
                return interrupted(calls);
            }
            futures.add(
                    executor.submit(
                            () -> {
                                try {
                                    return executeOne(call, index, count, progress);
                                } finally {
                                    permits.release();
                                }
                            }));
        }

        List<ToolExecutionResult> results = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String toolName = calls.get(i).toolName();
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                logger.warning("Tool call " + toolName + " failed: " + e.getCause());
                results.add(ToolExecutionResult.failure(toolName, String.valueOf(e.getCause())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(ToolExecutionResult.failure(toolName, "Interrupted"));
            }
        }
        return results;
    }

    private static List<ToolExecutionResult> interrupted(List<PlannedCall> calls) {
        List<ToolExecutionResult> results = new ArrayList<>(calls.size());
        for (PlannedCall call : calls) {
            results.add(ToolExecutionResult.failure(call.toolName(), "Interrupted"));
        }
        return results;
    }

    private ToolExecutionResult executeOne(
            PlannedCall call, int index, int count, ProgressSink progress) {
        ProgressScaler scaler =
                ProgressScaler.slice(index, count, EXECUTION_START, EXECUTION_WIDTH);
        progress.report(
                scaler.lo(),
                "Executing tool " + (index + 1) + "/" + count + ": " + call.toolName());
        return dispatcher.execute(call.toolName(), call.arguments(), scaler, progress);
    }
}
