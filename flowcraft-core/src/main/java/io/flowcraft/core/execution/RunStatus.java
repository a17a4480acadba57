package io.flowcraft.core.execution;

/// Lifecycle state of a run.
///
/// ```
/// READY -> RUNNING -> COMPLETED | FAILED | CANCELLED
/// READY -> CANCELLED
/// ```
public enum RunStatus {
    READY,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /// Returns whether the run can no longer change state.
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /// Returns whether callers should still wait for an outcome.
    public boolean isPending() {
        return !isTerminal();
    }
}
