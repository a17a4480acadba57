package io.flowcraft.core.execution;

/// Listener for run lifecycle events.
///
/// All methods have no-op defaults, so listeners override only what they need.
///
/// ### Callback Order
/// ```
/// onRunStart(runId, workflow)
///   onNodeStart(runId, nodeId)
///   onRetry(runId, nodeId, attempt, cause)   zero or more times
///   onNodeComplete(runId, record)
/// onRunComplete(runId, status)
/// ```
///
/// @implNote Implementations must be thread-safe: parallel branches report
/// from several threads at once.
public interface ExecutionListener {

    /// Called once when the run starts traversing the graph.
    default void onRunStart(String runId, String workflowName) {}

    /// Called before a node resolves its inputs.
    default void onNodeStart(String runId, String nodeId) {}

    /// Called before a node retries a capability call.
    ///
    /// @param attempt one-based number of the attempt about to run
    /// @param cause failure of the previous attempt, not null
    default void onRetry(String runId, String nodeId, int attempt, Throwable cause) {}

    /// Called after a node's record is committed, on success and on failure.
    default void onNodeComplete(String runId, ExecutionRecord record) {}

    /// Called once when the run reaches a terminal status.
    default void onRunComplete(String runId, RunStatus status) {}

    /// Listener that ignores all events.
    ExecutionListener NOOP = new ExecutionListener() {};
}
