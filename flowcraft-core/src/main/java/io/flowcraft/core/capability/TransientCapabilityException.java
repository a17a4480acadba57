package io.flowcraft.core.capability;

import java.io.Serial;

/// Retryable capability failure, such as rate limiting or a dropped connection.
public class TransientCapabilityException extends CapabilityException {
    @Serial private static final long serialVersionUID = -4409165710293746172L;

    public TransientCapabilityException(String message) {
        super(message, null);
    }

    public TransientCapabilityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
