package io.flowcraft.core.execution;

import io.flowcraft.core.capability.TokenUsage;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/// Immutable trace entry for one node invocation.
///
/// Exactly one record is committed per invocation that is not cancelled,
/// whether it succeeds or fails. Retries of the same invocation share the
/// record and show up in {@link #attempts()}.
///
/// @param runId owning run, not null
/// @param nodeId invoked node, not null
/// @param startedAt wall-clock start, not null
/// @param endedAt wall-clock end, not null
/// @param duration measured elapsed time, not null
/// @param usage tokens summed over all attempts, not null
/// @param cost estimated cost in USD
/// @param provider resolved provider, not null (`unknown` when unresolvable)
/// @param model resolved model name, not null (may be empty)
/// @param iteration zero-based pass of the enclosing loop, null outside loops
/// @param attempts capability calls made, zero when the node failed before invoking
/// @param error failure message, null on success
/// @param failedPhase phase of the failure, null on success
public record ExecutionRecord(
        String runId,
        String nodeId,
        Instant startedAt,
        Instant endedAt,
        Duration duration,
        TokenUsage usage,
        double cost,
        String provider,
        String model,
        Integer iteration,
        int attempts,
        String error,
        Phase failedPhase) {

    public ExecutionRecord {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(endedAt, "endedAt must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        usage = usage != null ? usage : TokenUsage.ZERO;
    }

    public boolean succeeded() {
        return error == null;
    }
}
