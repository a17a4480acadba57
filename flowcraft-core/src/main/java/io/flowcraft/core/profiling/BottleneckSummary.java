package io.flowcraft.core.profiling;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// Bottleneck analysis of one run, computed on demand.
///
/// @param runId the analyzed run, not null
/// @param totalTime summed duration of every recorded node, not null
/// @param nodeCount number of distinct node ids recorded
/// @param slowestNode node with the highest aggregated duration, null when nothing ran
/// @param thresholdPercent share above which a node was flagged
/// @param nodes per-node aggregates, slowest first, not null
/// @param bottlenecks flagged nodes, highest share first, not null
/// @param costs cost totals for the run, not null
public record BottleneckSummary(
        String runId,
        Duration totalTime,
        int nodeCount,
        String slowestNode,
        double thresholdPercent,
        List<NodeTimings> nodes,
        List<Bottleneck> bottlenecks,
        CostReport costs) {

    public BottleneckSummary {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(totalTime, "totalTime must not be null");
        nodes = List.copyOf(nodes);
        bottlenecks = List.copyOf(bottlenecks);
        costs = costs != null ? costs : CostReport.EMPTY;
    }

    /// Returns the ids of flagged nodes, highest share first.
    public List<String> bottleneckIds() {
        return bottlenecks.stream().map(Bottleneck::nodeId).toList();
    }
}
