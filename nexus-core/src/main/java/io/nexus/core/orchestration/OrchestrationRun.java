package io.nexus.core.orchestration;

import java.util.Objects;
import java.util.UUID;

/// Ephemeral state of one query orchestration.
///
/// Each run belongs to a single call of {@link QueryOrchestrator#processQuery}
/// and is never shared between threads of different queries.
public final class OrchestrationRun {

    private final String id = UUID.randomUUID().toString();
    private final String query;
    private volatile OrchestrationPhase phase = OrchestrationPhase.PLANNING;

    OrchestrationRun(String query) {
        this.query = Objects.requireNonNull(query, "query must not be null");
    }

    public String id() {
        return id;
    }

    public String query() {
        return query;
    }

    public OrchestrationPhase phase() {
        return phase;
    }

    /// Moves the run to a later phase.
    ///
    /// @param next the next phase, not null
    /// @throws IllegalStateException if `next` does not come after the current phase
    void advance(OrchestrationPhase next) {
        if (next.ordinal() <= phase.ordinal()) {
            throw new IllegalStateException(
                    "Run " + id + " cannot move from " + phase + " to " + next);
        }
        phase = next;
    }
}
