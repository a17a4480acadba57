package io.flowcraft.core.execution;

import io.flowcraft.core.state.StateContainer;
import java.util.List;

/// Outcome of a run, or of a synchronous wait on one.
///
/// ### Permitted Subtypes
/// - {@link Completed} - the run reached `END`
/// - {@link Failure} - a node failed for good; committed records are kept
/// - {@link Cancelled} - the run was cancelled; committed records are kept
/// - {@link Pending} - a synchronous wait timed out; the run continues in the background
///
/// @see ExecutionEngine#execute
public sealed interface ExecutionResult {

    /// Returns the run this result belongs to.
    String runId();

    /// @param finalState state at `END`, not null
    /// @param records committed records in commit order, not null
    record Completed(String runId, StateContainer finalState, List<ExecutionRecord> records)
            implements ExecutionResult {
        public Completed {
            records = List.copyOf(records);
        }
    }

    /// @param error the failure, with node id and phase when raised by a node, not null
    /// @param lastState last committed state before the failure, not null
    /// @param records committed records, the failed node's included, not null
    record Failure(
            String runId,
            RuntimeException error,
            StateContainer lastState,
            List<ExecutionRecord> records)
            implements ExecutionResult {
        public Failure {
            records = List.copyOf(records);
        }
    }

    /// @param records records committed before cancellation took effect, not null
    record Cancelled(String runId, List<ExecutionRecord> records) implements ExecutionResult {
        public Cancelled {
            records = List.copyOf(records);
        }
    }

    /// @param handle handle to the still-running run, not null
    record Pending(RunHandle handle) implements ExecutionResult {
        @Override
        public String runId() {
            return handle.runId();
        }
    }
}
