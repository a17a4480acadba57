package io.flowcraft.core.execution;

import java.io.Serial;

/// Signals that a run was cancelled while a node or branch was in flight.
///
/// Unwinds the run without committing a record for the interrupted node.
public class RunCancelledException extends RuntimeException {
    @Serial private static final long serialVersionUID = -2957316020410871946L;

    private final String runId;

    public RunCancelledException(String runId) {
        super("Run '" + runId + "' was cancelled");
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
