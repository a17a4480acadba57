package io.flowcraft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin for `ExecutionRecord` trace output.
///
/// Drops the null `iteration`, `error` and `failedPhase` components of
/// successful or loop-free invocations and pins the identifying components
/// to the front of each object.
///
/// @see io.flowcraft.serialization.FlowcraftJacksonModule
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"runId", "nodeId", "iteration", "attempts", "startedAt", "endedAt"})
public abstract class ExecutionRecordMixin {}
