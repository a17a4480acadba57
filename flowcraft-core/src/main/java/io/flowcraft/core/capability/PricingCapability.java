package io.flowcraft.core.capability;

/// Converts token usage into a cost estimate.
///
/// @see io.flowcraft.core.profiling.DefaultPricingTable
@FunctionalInterface
public interface PricingCapability {

    /// Estimates the USD cost of one call.
    ///
    /// @param provider resolved provider name, not null
    /// @param model model name without provider prefix, not null
    /// @param usage token usage, not null
    /// @return cost in USD, zero for free or local providers, never negative
    double estimate(String provider, String model, TokenUsage usage);
}
