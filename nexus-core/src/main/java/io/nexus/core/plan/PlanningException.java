package io.nexus.core.plan;

import java.io.Serial;

/// Thrown when the planner cannot produce a plan.
///
/// The orchestrator answers the query directly when planning fails.
public class PlanningException extends Exception {

    @Serial private static final long serialVersionUID = 7728905471310925513L;

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
