package io.flowcraft.serialization;

import java.io.Serial;

/// Thrown when a workflow document cannot be read into a
/// {@link io.flowcraft.core.workflow.WorkflowSpec}.
///
/// Covers malformed JSON or YAML as well as documents that are well formed
/// but miss required keys or carry values of the wrong shape. Structural
/// graph rules are checked later by the compiler.
public class WorkflowParseException extends RuntimeException {
    @Serial private static final long serialVersionUID = -3150913837425419873L;

    private final String location;

    public WorkflowParseException(String location, String message) {
        this(location, message, null);
    }

    public WorkflowParseException(String location, String message, Throwable cause) {
        super(location != null ? location + ": " + message : message, cause);
        this.location = location;
    }

    /// Returns the document path of the offending value, e.g. `nodes[1].llm`,
    /// or null when the whole document is at fault.
    public String getLocation() {
        return location;
    }
}
