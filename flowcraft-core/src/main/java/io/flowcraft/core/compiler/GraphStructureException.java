package io.flowcraft.core.compiler;

import java.io.Serial;

/// Thrown when a workflow's nodes and edges do not form a valid executable graph.
///
/// Raised by {@link GraphCompiler} before any run starts; never retried.
public class GraphStructureException extends RuntimeException {
    @Serial private static final long serialVersionUID = 8519943040067312298L;

    private final String nodeId;

    public GraphStructureException(String message) {
        this(null, message, null);
    }

    public GraphStructureException(String nodeId, String message) {
        this(nodeId, message, null);
    }

    public GraphStructureException(String nodeId, String message, Throwable cause) {
        super(nodeId != null ? "Node '" + nodeId + "': " + message : message, cause);
        this.nodeId = nodeId;
    }

    /// Returns the offending node id, or null for graph-wide violations.
    public String getNodeId() {
        return nodeId;
    }
}
