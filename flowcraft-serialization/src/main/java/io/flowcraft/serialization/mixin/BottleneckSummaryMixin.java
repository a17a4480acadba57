package io.flowcraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;

/// Jackson mixin that omits `slowestNode` from summaries of runs that recorded nothing.
///
/// @see io.flowcraft.serialization.FlowcraftJacksonModule
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BottleneckSummaryMixin {}
