package io.flowcraft.core.output;

import java.io.Serial;

/// Thrown when a capability payload does not match a node's declared result shape.
///
/// Node-scoped and recoverable: the node executor retries with a prompt that
/// restates the expected schema before giving up.
public class OutputValidationException extends RuntimeException {
    @Serial private static final long serialVersionUID = -6958200474167128833L;

    private final String nodeId;
    private final String field;
    private final String expected;
    private final String actual;

    public OutputValidationException(String nodeId, String field, String expected, String actual) {
        super(
                "Node '"
                        + nodeId
                        + "' output field '"
                        + field
                        + "' expected "
                        + expected
                        + " but was "
                        + actual);
        this.nodeId = nodeId;
        this.field = field;
        this.expected = expected;
        this.actual = actual;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getField() {
        return field;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
