package io.flowcraft.core.capability;

import java.io.Serial;

/// Non-retryable capability failure, such as bad credentials or an unknown model.
public class PermanentCapabilityException extends CapabilityException {
    @Serial private static final long serialVersionUID = 2231841906534470015L;

    public PermanentCapabilityException(String message) {
        super(message, null);
    }

    public PermanentCapabilityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
