package io.flowcraft.core.profiling;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Determines the provider behind a model name.
///
/// ### Resolution Order
/// 1. An explicit provider, when given
/// 2. A `provider/model` prefix, e.g. `ollama/llama3`
/// 3. The model-name family, e.g. `gpt-` for OpenAI, `claude` for Anthropic
/// 4. {@link #UNKNOWN}
///
/// @implNote Stateless and thread-safe.
public final class ProviderResolver {

    public static final String UNKNOWN = "unknown";
    public static final String OLLAMA = "ollama";

    private static final Set<String> FREE_PROVIDERS = Set.of(OLLAMA);

    private static final Map<String, String> PREFIX_ALIASES =
            Map.of(
                    "openai", "openai",
                    "anthropic", "anthropic",
                    "google", "google",
                    "gemini", "google",
                    "vertex_ai", "google",
                    "ollama", OLLAMA,
                    "ollama_chat", OLLAMA);

    private static final List<Map.Entry<String, String>> MODEL_FAMILIES =
            List.of(
                    Map.entry("gpt-", "openai"),
                    Map.entry("o1", "openai"),
                    Map.entry("o3", "openai"),
                    Map.entry("claude", "anthropic"),
                    Map.entry("gemini", "google"),
                    Map.entry("llama", OLLAMA),
                    Map.entry("mistral", OLLAMA),
                    Map.entry("qwen", OLLAMA),
                    Map.entry("phi", OLLAMA),
                    Map.entry("gemma", OLLAMA),
                    Map.entry("deepseek", OLLAMA));

    private ProviderResolver() {}

    /// Resolves provider and bare model name.
    ///
    /// @param provider explicit provider, may be null or blank
    /// @param model model name, optionally prefixed, may be null
    /// @return resolved pair, never null
    public static ResolvedModel resolve(String provider, String model) {
        String bareModel = model != null ? model.trim() : "";
        String prefixed = null;

        int slash = bareModel.indexOf('/');
        if (slash > 0) {
            prefixed = PREFIX_ALIASES.get(bareModel.substring(0, slash).toLowerCase(Locale.ROOT));
            if (prefixed != null) {
                bareModel = bareModel.substring(slash + 1);
            }
        }

        if (provider != null && !provider.isBlank()) {
            return new ResolvedModel(provider.trim().toLowerCase(Locale.ROOT), bareModel);
        }
        if (prefixed != null) {
            return new ResolvedModel(prefixed, bareModel);
        }
        String lower = bareModel.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> family : MODEL_FAMILIES) {
            if (lower.startsWith(family.getKey())) {
                return new ResolvedModel(family.getValue(), bareModel);
            }
        }
        return new ResolvedModel(UNKNOWN, bareModel);
    }

    /// Returns whether calls to the provider are always free.
    public static boolean isFree(String provider) {
        return FREE_PROVIDERS.contains(provider);
    }
}
