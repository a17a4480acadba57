package io.flowcraft.core.execution;

import java.util.Locale;

/// Stage of a node execution at which a failure surfaced.
public enum Phase {
    /// Input mapping, prompt template or tool acquisition.
    RESOLVE,
    /// LLM capability call.
    INVOKE,
    /// Output payload or state update validation.
    VALIDATE,
    /// Sandboxed code execution.
    SANDBOX;

    /// Returns the lower-case name used in messages.
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
