package io.flowcraft.core.workflow;

import java.util.Objects;

/// Tool requested by a node.
///
/// @param name registry name of the tool, not null
/// @param onError what to do when the registry does not know the tool
public record ToolRef(String name, OnError onError) {

    public enum OnError {
        /// Fail the node.
        FAIL,
        /// Log and run the node without the tool.
        CONTINUE
    }

    public ToolRef {
        Objects.requireNonNull(name, "name must not be null");
        onError = onError != null ? onError : OnError.FAIL;
    }

    public static ToolRef of(String name) {
        return new ToolRef(name, OnError.FAIL);
    }
}
