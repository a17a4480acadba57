package io.flowcraft.core.profiling;

/// Provider and bare model name resolved from an LLM configuration.
///
/// @param provider lower-case provider name, or {@link ProviderResolver#UNKNOWN}
/// @param model model name without any `provider/` prefix, never null
public record ResolvedModel(String provider, String model) {

    /// Returns the `provider/model` key used for per-model cost buckets.
    public String key() {
        return provider + "/" + model;
    }
}
