package io.flowcraft.core.profiling;

import java.time.Duration;

/// A node whose share of total run time exceeded the analysis threshold.
///
/// @param nodeId the node, not null
/// @param total aggregated duration, not null
/// @param percentOfTotal share of total run time, rounded to two decimals
/// @param callCount number of invocations
/// @param average average duration per invocation, not null
public record Bottleneck(
        String nodeId, Duration total, double percentOfTotal, int callCount, Duration average) {}
