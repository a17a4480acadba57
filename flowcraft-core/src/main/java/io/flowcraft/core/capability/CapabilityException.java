package io.flowcraft.core.capability;

import java.io.Serial;

/// Failure reported by an external capability.
///
/// @see TransientCapabilityException
/// @see PermanentCapabilityException
public abstract class CapabilityException extends Exception {
    @Serial private static final long serialVersionUID = 5391176140262874467L;

    protected CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }

    /// Returns whether retrying the same call may succeed.
    public abstract boolean isTransient();
}
