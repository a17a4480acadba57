package io.flowcraft.core.workflow;

/// LLM capability settings, declared workflow-wide and optionally per node.
///
/// Every component may be null, meaning "not set here". {@link #overriding}
/// merges a node-level config over the workflow default key by key.
///
/// @param provider provider name such as `openai`, `anthropic`, `google`, `ollama`, may be null
/// @param model model name, optionally `provider/model`, may be null
/// @param temperature sampling temperature in `[0, 1]`, may be null
/// @param maxTokens response token limit, positive, may be null
/// @param apiBase custom endpoint URL, may be null
public record LlmConfig(
        String provider, String model, Double temperature, Integer maxTokens, String apiBase) {

    public static final LlmConfig EMPTY = new LlmConfig(null, null, null, null, null);

    public LlmConfig {
        if (temperature != null && (temperature < 0.0 || temperature > 1.0)) {
            throw new IllegalArgumentException("temperature must be within [0, 1]: " + temperature);
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
    }

    public static LlmConfig of(String provider, String model) {
        return new LlmConfig(provider, model, null, null, null);
    }

    /// Returns this config with unset keys filled from `base`.
    ///
    /// Any key set here wins over the same key in `base`.
    ///
    /// @param base the workflow-level default, may be null
    /// @return merged config, never null
    public LlmConfig overriding(LlmConfig base) {
        if (base == null) {
            return this;
        }
        return new LlmConfig(
                provider != null ? provider : base.provider,
                model != null ? model : base.model,
                temperature != null ? temperature : base.temperature,
                maxTokens != null ? maxTokens : base.maxTokens,
                apiBase != null ? apiBase : base.apiBase);
    }
}
