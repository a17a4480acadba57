package io.flowcraft.core.capability;

import io.flowcraft.core.output.OutputModel;
import io.flowcraft.core.tool.ToolDefinition;
import io.flowcraft.core.workflow.LlmConfig;
import java.util.List;
import java.util.Objects;

/// One call to the LLM capability.
///
/// @param nodeId requesting node, not null
/// @param prompt fully resolved prompt, not null
/// @param outputModel result shape the payload must match, not null
/// @param tools tools offered to the model, not null (may be empty)
/// @param config merged LLM settings, not null
/// @param attempt zero-based attempt index within the node's retry budget
public record LlmRequest(
        String nodeId,
        String prompt,
        OutputModel outputModel,
        List<ToolDefinition> tools,
        LlmConfig config,
        int attempt) {

    public LlmRequest {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(outputModel, "outputModel must not be null");
        Objects.requireNonNull(config, "config must not be null");
        tools = tools != null ? List.copyOf(tools) : List.of();
    }
}
