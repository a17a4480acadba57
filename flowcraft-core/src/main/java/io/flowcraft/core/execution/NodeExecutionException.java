package io.flowcraft.core.execution;

import java.io.Serial;
import java.util.Objects;

/// A node failed for good: its retry budget is exhausted or the failure is not
/// retryable.
///
/// Terminates the owning branch. The cause chain is preserved as-is.
public class NodeExecutionException extends RuntimeException {
    @Serial private static final long serialVersionUID = 4172036458519906261L;

    private final String nodeId;
    private final Phase phase;

    public NodeExecutionException(String nodeId, Phase phase, Throwable cause) {
        super(message(nodeId, phase, cause.getMessage()), cause);
        this.nodeId = nodeId;
        this.phase = Objects.requireNonNull(phase, "phase must not be null");
    }

    public NodeExecutionException(String nodeId, Phase phase, String message) {
        super(message(nodeId, phase, message));
        this.nodeId = nodeId;
        this.phase = Objects.requireNonNull(phase, "phase must not be null");
    }

    private static String message(String nodeId, Phase phase, String detail) {
        return "Node '" + nodeId + "' failed during " + phase.label() + ": " + detail;
    }

    public String getNodeId() {
        return nodeId;
    }

    public Phase getPhase() {
        return phase;
    }
}
