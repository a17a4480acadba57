package io.flowcraft.core.capability;

import java.util.Map;

/// External sandbox that runs a node's code block.
///
/// Bindings are concrete values: resolved node inputs plus the current state
/// fields. The engine never passes unresolved templates.
public interface SandboxCapability {

    /// Runs code under the given limits.
    ///
    /// @param code source text, not null
    /// @param bindings variables visible to the code, not null
    /// @param limits resource limits, not null
    /// @return execution outcome, never null
    /// @throws SafetyException if the code violates the sandbox policy
    /// @throws CapabilityException if the sandbox itself is unavailable
    SandboxResult run(String code, Map<String, Object> bindings, SandboxLimits limits)
            throws CapabilityException;
}
