package io.flowcraft.core.profiling;

import io.flowcraft.core.capability.TokenUsage;
import java.util.Map;

/// Cost totals of one run.
///
/// @param totalCost summed USD estimate
/// @param totalUsage summed tokens, not null
/// @param callCount number of priced invocations
/// @param byProvider cost per provider, not null
/// @param byModel cost per `provider/model` key, not null
public record CostReport(
        double totalCost,
        TokenUsage totalUsage,
        int callCount,
        Map<String, Double> byProvider,
        Map<String, Double> byModel) {

    public static final CostReport EMPTY = new CostReport(0.0, TokenUsage.ZERO, 0, Map.of(), Map.of());

    public CostReport {
        byProvider = Map.copyOf(byProvider);
        byModel = Map.copyOf(byModel);
    }
}
