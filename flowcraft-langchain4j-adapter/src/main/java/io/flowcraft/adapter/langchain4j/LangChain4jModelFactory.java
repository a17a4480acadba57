package io.flowcraft.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.flowcraft.core.profiling.ResolvedModel;
import io.flowcraft.core.workflow.LlmConfig;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Builds LangChain4j chat models for the supported providers.
///
/// | Provider    | Model class                | Credential                        |
/// |-------------|----------------------------|-----------------------------------|
/// | `openai`    | `OpenAiChatModel`          | `OPENAI_API_KEY`                  |
/// | `deepseek`  | `OpenAiChatModel`          | `DEEPSEEK_API_KEY`                |
/// | `anthropic` | `AnthropicChatModel`       | `ANTHROPIC_API_KEY`               |
/// | `google`    | `GoogleAiGeminiChatModel`  | `GOOGLE_API_KEY`, `GEMINI_API_KEY`|
/// | `ollama`    | `OllamaChatModel`          | none; `OLLAMA_BASE_URL` optional  |
///
/// Client-side retries are disabled on every model: the node executor owns
/// the retry budget and backoff.
///
/// @implNote Stateless and thread-safe. Each call creates a new model instance.
public class LangChain4jModelFactory implements ChatModelFactory {

    private static final Logger logger = Logger.getLogger(LangChain4jModelFactory.class.getName());

    static final int DEFAULT_MAX_TOKENS = 4096;
    static final double DEFAULT_TEMPERATURE = 0.7;
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";
    static final String OLLAMA_BASE_URL = "http://localhost:11434";

    private final Map<String, String> credentials;

    /// @param credentials API keys keyed by variable name, not null
    public LangChain4jModelFactory(Map<String, String> credentials) {
        this.credentials = Map.copyOf(Objects.requireNonNull(credentials, "credentials"));
    }

    @Override
    public ChatModel create(ResolvedModel model, LlmConfig config) {
        logger.info("Creating LangChain4j model: " + model.key());
        return switch (model.provider()) {
            case "openai" -> openAi(model, config, requireApiKey("OPENAI_API_KEY"), null);
            case "deepseek" -> openAi(
                    model, config, requireApiKey("DEEPSEEK_API_KEY"), DEEPSEEK_BASE_URL);
            case "anthropic" -> anthropic(model, config);
            case "google" -> gemini(model, config);
            case "ollama" -> ollama(model, config);
            default -> throw new IllegalArgumentException(
                    "Unsupported provider '" + model.provider() + "' for model " + model.model());
        };
    }

    private ChatModel openAi(
            ResolvedModel model, LlmConfig config, String apiKey, String defaultBaseUrl) {
        var builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(model.model())
                        .temperature(temperature(config))
                        .maxTokens(maxTokens(config))
                        .timeout(DEFAULT_TIMEOUT)
                        .maxRetries(0);

        String baseUrl = config.apiBase() != null ? config.apiBase() : defaultBaseUrl;
        if (baseUrl != null) builder.baseUrl(baseUrl);

        return builder.build();
    }

    private ChatModel anthropic(ResolvedModel model, LlmConfig config) {
        var builder =
                AnthropicChatModel.builder()
                        .apiKey(requireApiKey("ANTHROPIC_API_KEY"))
                        .modelName(model.model())
                        .temperature(temperature(config))
                        .maxTokens(maxTokens(config))
                        .timeout(DEFAULT_TIMEOUT)
                        .maxRetries(0);

        if (config.apiBase() != null) builder.baseUrl(config.apiBase());

        return builder.build();
    }

    private ChatModel gemini(ResolvedModel model, LlmConfig config) {
        return GoogleAiGeminiChatModel.builder()
                .apiKey(requireApiKey("GOOGLE_API_KEY", "GEMINI_API_KEY"))
                .modelName(model.model())
                .temperature(temperature(config))
                .maxOutputTokens(maxTokens(config))
                .timeout(DEFAULT_TIMEOUT)
                .maxRetries(0)
                .build();
    }

    private ChatModel ollama(ResolvedModel model, LlmConfig config) {
        String baseUrl = config.apiBase();
        if (baseUrl == null) {
            baseUrl = credentials.getOrDefault("OLLAMA_BASE_URL", OLLAMA_BASE_URL);
        }
        return OllamaChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(model.model())
                .temperature(temperature(config))
                .numPredict(maxTokens(config))
                .timeout(DEFAULT_TIMEOUT)
                .maxRetries(0)
                .build();
    }

    /// Looks up an API key, trying each name in order.
    ///
    /// @throws IllegalStateException if no name resolves to a value
    String requireApiKey(String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }

    private static double temperature(LlmConfig config) {
        return config.temperature() != null ? config.temperature() : DEFAULT_TEMPERATURE;
    }

    private static int maxTokens(LlmConfig config) {
        return config.maxTokens() != null ? config.maxTokens() : DEFAULT_MAX_TOKENS;
    }
}
