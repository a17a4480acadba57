package io.flowcraft.adapter.langchain4j;

import dev.langchain4j.model.chat.ChatModel;
import io.flowcraft.core.profiling.ResolvedModel;
import io.flowcraft.core.workflow.LlmConfig;

/// Creates the LangChain4j {@link ChatModel} that serves one model configuration.
///
/// @see LangChain4jModelFactory for the provider-backed implementation
@FunctionalInterface
public interface ChatModelFactory {

    /// @param model resolved provider and bare model name, not null
    /// @param config merged node settings, not null
    /// @return a chat model, never null
    /// @throws IllegalArgumentException if the provider is not supported
    /// @throws IllegalStateException if a required credential is missing
    ChatModel create(ResolvedModel model, LlmConfig config);
}
