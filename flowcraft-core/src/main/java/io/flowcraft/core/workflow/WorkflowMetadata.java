package io.flowcraft.core.workflow;

import java.util.Objects;

public record WorkflowMetadata(String name, String description, String version) {

    public WorkflowMetadata {
        Objects.requireNonNull(name, "name must not be null");
        version = version != null ? version : "1.0.0";
    }

    public static WorkflowMetadata named(String name) {
        return new WorkflowMetadata(name, null, null);
    }
}
