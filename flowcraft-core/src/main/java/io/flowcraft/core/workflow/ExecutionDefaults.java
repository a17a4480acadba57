package io.flowcraft.core.workflow;

import java.time.Duration;
import java.util.Objects;

/// Workflow-wide execution policy.
///
/// ### Default Values
/// - `maxRetries`: `3` (extra attempts after the first)
/// - `timeout`: `120s` (default wait for synchronous calls)
/// - `backoffBase`: `500ms` (first transient-failure delay, doubled per attempt)
/// - `backoffMax`: `30s` (delay cap)
///
/// @param maxRetries retry budget per node, zero or more
/// @param timeout default synchronous wait, positive
/// @param backoffBase first backoff delay, not negative
/// @param backoffMax largest backoff delay, not less than `backoffBase`
public record ExecutionDefaults(
        int maxRetries, Duration timeout, Duration backoffBase, Duration backoffMax) {

    public static final ExecutionDefaults DEFAULT =
            new ExecutionDefaults(
                    3, Duration.ofSeconds(120), Duration.ofMillis(500), Duration.ofSeconds(30));

    public ExecutionDefaults {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(backoffBase, "backoffBase must not be null");
        Objects.requireNonNull(backoffMax, "backoffMax must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (backoffBase.isNegative() || backoffMax.compareTo(backoffBase) < 0) {
            throw new IllegalArgumentException(
                    "backoff must satisfy 0 <= base <= max: " + backoffBase + ", " + backoffMax);
        }
    }

    public ExecutionDefaults withMaxRetries(int maxRetries) {
        return new ExecutionDefaults(maxRetries, timeout, backoffBase, backoffMax);
    }

    public ExecutionDefaults withBackoff(Duration base, Duration max) {
        return new ExecutionDefaults(maxRetries, timeout, base, max);
    }

    public ExecutionDefaults withTimeout(Duration timeout) {
        return new ExecutionDefaults(maxRetries, timeout, backoffBase, backoffMax);
    }
}
