package io.flowcraft.core.capability;

/// External LLM provider consumed by the node executor.
///
/// Implementations shape the model output into the requested result fields
/// and report token usage. Failures are classified so the executor can decide
/// whether to retry.
///
/// @implNote Implementations must be thread-safe. Parallel branches call
/// {@link #invoke} concurrently, and a call should respond to thread
/// interruption so cancelled runs release it.
///
/// @see StubLlmCapability for an offline implementation
public interface LlmCapability {

    /// Sends one prompt to the model.
    ///
    /// @param request the prompt, result shape, tools and settings, not null
    /// @return payload and token usage, never null
    /// @throws TransientCapabilityException for failures worth retrying, such as rate limits
    /// @throws PermanentCapabilityException for failures that will not go away on retry
    LlmResult invoke(LlmRequest request) throws CapabilityException;
}
