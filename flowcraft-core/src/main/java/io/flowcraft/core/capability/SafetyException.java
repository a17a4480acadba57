package io.flowcraft.core.capability;

import java.io.Serial;

/// Thrown by a sandbox when code violates its safety policy.
///
/// Never retried and never swallowed: the owning node fails with it as cause.
public class SafetyException extends RuntimeException {
    @Serial private static final long serialVersionUID = -8727011349183040517L;

    private final String codeSnippet;

    public SafetyException(String message, String codeSnippet) {
        super(message);
        this.codeSnippet = codeSnippet;
    }

    /// Returns the offending code fragment, may be null.
    public String getCodeSnippet() {
        return codeSnippet;
    }
}
