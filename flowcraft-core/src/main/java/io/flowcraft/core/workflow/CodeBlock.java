package io.flowcraft.core.workflow;

import io.flowcraft.core.capability.SandboxLimits;
import java.util.Objects;

/// Code a node runs in the sandbox capability.
///
/// The code is opaque to the engine. It receives the node's resolved inputs
/// and the current state values as bindings, never unresolved templates.
///
/// @param code source text, not null
/// @param limits execution limits, not null
public record CodeBlock(String code, SandboxLimits limits) {

    public CodeBlock {
        Objects.requireNonNull(code, "code must not be null");
        limits = limits != null ? limits : SandboxLimits.DEFAULT;
    }
}
