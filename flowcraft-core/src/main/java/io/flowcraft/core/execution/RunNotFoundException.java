package io.flowcraft.core.execution;

import java.io.Serial;

/// Thrown when a run id is not known to the engine.
public class RunNotFoundException extends RuntimeException {
    @Serial private static final long serialVersionUID = 6815230449926318752L;

    public RunNotFoundException(String runId) {
        super("Unknown run: " + runId);
    }
}
