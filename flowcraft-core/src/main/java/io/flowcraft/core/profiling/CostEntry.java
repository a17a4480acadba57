package io.flowcraft.core.profiling;

import io.flowcraft.core.capability.TokenUsage;

/// Cost of one LLM invocation.
///
/// @param provider resolved provider, `unknown` when it could not be determined
/// @param model bare model name, may be empty
/// @param usage tokens consumed, not null
/// @param cost USD estimate, zero for free providers
public record CostEntry(String provider, String model, TokenUsage usage, double cost) {}
