package io.flowcraft.core.profiling;

import java.time.Duration;
import java.time.Instant;

/// Aggregated telemetry of one node id within a run.
///
/// Loop iterations and retries of the same node all land in one bucket.
///
/// @param nodeId the node, not null
/// @param callCount number of recorded invocations
/// @param total summed duration, not null
/// @param average `total / callCount`, not null
/// @param cost summed cost estimate in USD
/// @param firstRecorded time of the first recording, not null
/// @param lastRecorded time of the latest recording, not null
public record NodeTimings(
        String nodeId,
        int callCount,
        Duration total,
        Duration average,
        double cost,
        Instant firstRecorded,
        Instant lastRecorded) {

    /// Returns the total duration in fractional milliseconds.
    public double totalMillis() {
        return total.toNanos() / 1_000_000.0;
    }
}
