package io.flowcraft.core.profiling;

import io.flowcraft.core.capability.PricingCapability;
import io.flowcraft.core.capability.TokenUsage;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Logger;

/// Per-run cost totals by provider and by provider+model.
///
/// Free providers always cost zero. Calls whose provider cannot be resolved
/// are bucketed under {@link ProviderResolver#UNKNOWN} at zero cost instead
/// of failing.
///
/// @implNote Thread-safe without locks; totals are adders keyed in
/// ConcurrentHashMaps.
public final class CostAggregator {

    private static final Logger logger = Logger.getLogger(CostAggregator.class.getName());

    private final PricingCapability pricing;
    private final Map<String, DoubleAdder> byProvider = new ConcurrentHashMap<>();
    private final Map<String, DoubleAdder> byModel = new ConcurrentHashMap<>();
    private final DoubleAdder total = new DoubleAdder();
    private final LongAdder inputTokens = new LongAdder();
    private final LongAdder outputTokens = new LongAdder();
    private final LongAdder calls = new LongAdder();

    public CostAggregator(PricingCapability pricing) {
        this.pricing = Objects.requireNonNull(pricing, "pricing must not be null");
    }

    /// Prices and accumulates one invocation.
    ///
    /// @param provider explicit provider, may be null
    /// @param model model name, optionally `provider/model`, may be null
    /// @param usage tokens consumed, not null
    /// @return the priced entry, never null
    public CostEntry add(String provider, String model, TokenUsage usage) {
        CostEntry entry = price(provider, model, usage);
        book(entry);
        return entry;
    }

    /// Prices one invocation without adding it to the totals.
    ///
    /// A pricing capability that throws is logged and the call is priced at zero.
    ///
    /// @return the priced entry, never null
    public CostEntry price(String provider, String model, TokenUsage usage) {
        Objects.requireNonNull(usage, "usage must not be null");
        ResolvedModel resolved = ProviderResolver.resolve(provider, model);
        return new CostEntry(resolved.provider(), resolved.model(), usage, cost(resolved, usage));
    }

    /// Adds a priced entry to the totals.
    public void book(CostEntry entry) {
        String key = new ResolvedModel(entry.provider(), entry.model()).key();
        byProvider.computeIfAbsent(entry.provider(), p -> new DoubleAdder()).add(entry.cost());
        byModel.computeIfAbsent(key, k -> new DoubleAdder()).add(entry.cost());
        total.add(entry.cost());
        inputTokens.add(entry.usage().inputTokens());
        outputTokens.add(entry.usage().outputTokens());
        calls.increment();
    }

    private double cost(ResolvedModel resolved, TokenUsage usage) {
        if (ProviderResolver.UNKNOWN.equals(resolved.provider())
                || ProviderResolver.isFree(resolved.provider())) {
            return 0.0;
        }
        double cost;
        try {
            cost = pricing.estimate(resolved.provider(), resolved.model(), usage);
        } catch (RuntimeException e) {
            logger.warning(
                    "Pricing failed for "
                            + resolved.key()
                            + " ("
                            + e.getMessage()
                            + "), recording zero");
            return 0.0;
        }
        if (cost < 0 || Double.isNaN(cost)) {
            logger.warning(
                    "Pricing returned " + cost + " for " + resolved.key() + ", recording zero");
            return 0.0;
        }
        return cost;
    }

    /// Returns a snapshot of the totals.
    public CostReport report() {
        return new CostReport(
                total.sum(),
                new TokenUsage(inputTokens.sum(), outputTokens.sum()),
                (int) calls.sum(),
                snapshot(byProvider),
                snapshot(byModel));
    }

    private static Map<String, Double> snapshot(Map<String, DoubleAdder> adders) {
        Map<String, Double> copy = new ConcurrentHashMap<>();
        adders.forEach((key, adder) -> copy.put(key, adder.sum()));
        return copy;
    }
}
