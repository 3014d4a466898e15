package io.nexus.core.orchestration;

/// Phases of one query orchestration, in the only order they may occur.
///
/// The direct-answer path moves from `PLANNING` straight to `DONE`.
public enum OrchestrationPhase {
    PLANNING,
    EXECUTING,
    SYNTHESIZING,
    DONE
}
