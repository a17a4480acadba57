package io.flowcraft.adapter.langchain4j;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.flowcraft.core.capability.CapabilityException;
import io.flowcraft.core.capability.LlmCapability;
import io.flowcraft.core.capability.LlmRequest;
import io.flowcraft.core.capability.LlmResult;
import io.flowcraft.core.capability.PermanentCapabilityException;
import io.flowcraft.core.capability.TokenUsage;
import io.flowcraft.core.capability.TransientCapabilityException;
import io.flowcraft.core.output.OutputModel;
import io.flowcraft.core.profiling.ProviderResolver;
import io.flowcraft.core.profiling.ResolvedModel;
import io.flowcraft.core.tool.ToolDefinition;
import io.flowcraft.core.workflow.LlmConfig;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// {@link LlmCapability} backed by LangChain4j chat models.
///
/// Each request is sent as a system message describing the expected result
/// shape and the offered tools, followed by the resolved prompt as a user
/// message. Declared tools are also bound to the request as LangChain4j tool
/// specifications. The reply text is read into a payload by
/// `ResponsePayloadParser`.
///
/// ### Failure Classification
/// - LangChain4j `RetriableException` (rate limits, timeouts, server errors),
///   I/O failures and timeouts anywhere in the cause chain - transient
/// - `NonRetriableException` (authentication, invalid request, unknown model),
///   unsupported providers and missing credentials - permanent
///
/// @implNote Thread-safe. Models are created once per distinct
/// provider, model and settings combination and shared across runs.
///
/// @see LangChain4jModelFactory for provider wiring
public class LangChain4jLlmCapability implements LlmCapability {

    private static final Logger logger = Logger.getLogger(LangChain4jLlmCapability.class.getName());

    private final ChatModelFactory factory;
    private final Map<ModelKey, ChatModel> models = new ConcurrentHashMap<>();

    private record ModelKey(ResolvedModel model, LlmConfig config) {}

    /// Creates a capability whose models read API keys from `credentials`.
    public LangChain4jLlmCapability(Map<String, String> credentials) {
        this(new LangChain4jModelFactory(credentials));
    }

    public LangChain4jLlmCapability(ChatModelFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    @Override
    public LlmResult invoke(LlmRequest request) throws CapabilityException {
        LlmConfig config = request.config();
        ResolvedModel resolved = ProviderResolver.resolve(config.provider(), config.model());
        if (resolved.model().isEmpty()) {
            throw new PermanentCapabilityException(
                    "Node '" + request.nodeId() + "' has no model configured");
        }

        ChatModel model = model(resolved, config);
        logger.fine(
                "Node '"
                        + request.nodeId()
                        + "' calling "
                        + resolved.key()
                        + " (attempt "
                        + (request.attempt() + 1)
                        + ")");

        ChatResponse response;
        try {
            response = model.chat(chatRequest(request));
        } catch (RuntimeException e) {
            throw classify(request.nodeId(), resolved, e);
        }

        AiMessage message = response != null ? response.aiMessage() : null;
        if (message != null && message.text() == null && message.hasToolExecutionRequests()) {
            throw new PermanentCapabilityException(
                    resolved.key()
                            + " answered node '"
                            + request.nodeId()
                            + "' with tool calls only; tool execution is not supported");
        }
        if (message == null || message.text() == null) {
            throw new TransientCapabilityException(
                    "No response from " + resolved.key() + " for node '" + request.nodeId() + "'");
        }

        Map<String, Object> payload =
                ResponsePayloadParser.parse(message.text(), request.outputModel());
        return new LlmResult(payload, usage(response));
    }

    private ChatModel model(ResolvedModel resolved, LlmConfig config)
            throws PermanentCapabilityException {
        try {
            return models.computeIfAbsent(
                    new ModelKey(resolved, config), key -> factory.create(resolved, config));
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new PermanentCapabilityException(e.getMessage(), e);
        }
    }

    static ChatRequest chatRequest(LlmRequest request) {
        var builder = ChatRequest.builder().messages(messages(request));
        if (!request.tools().isEmpty()) {
            builder.toolSpecifications(
                    request.tools().stream()
                            .map(LangChain4jLlmCapability::toolSpecification)
                            .toList());
        }
        return builder.build();
    }

    static ToolSpecification toolSpecification(ToolDefinition tool) {
        var parameters = JsonObjectSchema.builder();
        for (ToolDefinition.ParameterDef param : tool.parameters()) {
            switch (param.type()) {
                case "integer" -> parameters.addIntegerProperty(param.name(), param.description());
                case "number" -> parameters.addNumberProperty(param.name(), param.description());
                case "boolean" -> parameters.addBooleanProperty(param.name(), param.description());
                case "object" ->
                        parameters.addProperty(
                                param.name(),
                                JsonObjectSchema.builder()
                                        .description(param.description())
                                        .build());
                // Item types are not declared; arrays are offered as string lists.
                case "array" ->
                        parameters.addProperty(
                                param.name(),
                                JsonArraySchema.builder()
                                        .description(param.description())
                                        .items(JsonStringSchema.builder().build())
                                        .build());
                default -> parameters.addStringProperty(param.name(), param.description());
            }
        }
        parameters.required(tool.requiredParameterNames());
        return ToolSpecification.builder()
                .name(tool.name())
                .description(tool.description())
                .parameters(parameters.build())
                .build();
    }

    static List<ChatMessage> messages(LlmRequest request) {
        return List.of(
                SystemMessage.from(systemPrompt(request.outputModel(), request.tools())),
                UserMessage.from(request.prompt()));
    }

    static String systemPrompt(OutputModel output, List<ToolDefinition> tools) {
        var sb = new StringBuilder();
        if (output.isScalar()) {
            sb.append("Respond with the ")
                    .append(output.getFields().get(0).type().describe())
                    .append(" value only, without any explanation.");
        } else {
            sb.append("Respond with a single JSON object and nothing else. Expected shape:\n")
                    .append(output.describe());
        }

        if (!tools.isEmpty()) {
            sb.append("\n\nAvailable tools:\n");
            for (ToolDefinition tool : tools) {
                sb.append("- ").append(tool.name()).append(": ").append(tool.description());
                if (!tool.parameters().isEmpty()) {
                    sb.append(" (parameters: ");
                    for (int i = 0; i < tool.parameters().size(); i++) {
                        ToolDefinition.ParameterDef param = tool.parameters().get(i);
                        if (i > 0) sb.append(", ");
                        sb.append(param.name()).append(' ').append(param.type());
                        if (!param.required()) sb.append('?');
                    }
                    sb.append(')');
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    private static TokenUsage usage(ChatResponse response) {
        var tokenUsage = response.tokenUsage();
        if (tokenUsage == null) {
            return TokenUsage.ZERO;
        }
        return new TokenUsage(
                count(tokenUsage.inputTokenCount()), count(tokenUsage.outputTokenCount()));
    }

    private static long count(Integer tokens) {
        return tokens != null ? tokens : 0L;
    }

    static CapabilityException classify(String nodeId, ResolvedModel model, RuntimeException e) {
        String message =
                model.key()
                        + " failed for node '"
                        + nodeId
                        + "': "
                        + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof NonRetriableException) {
                logger.warning(message);
                return new PermanentCapabilityException(message, e);
            }
            if (t instanceof RetriableException
                    || t instanceof TimeoutException
                    || t instanceof IOException) {
                logger.warning(message + " (will retry)");
                return new TransientCapabilityException(message, e);
            }
        }
        logger.warning(message);
        return new PermanentCapabilityException(message, e);
    }
}
