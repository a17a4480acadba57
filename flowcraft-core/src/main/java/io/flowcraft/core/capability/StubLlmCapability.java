package io.flowcraft.core.capability;

import io.flowcraft.core.output.OutputField;
import io.flowcraft.core.state.TypeDescriptor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.logging.Logger;

/// Offline {@link LlmCapability} returning scripted or generated payloads.
///
/// Useful for testing workflow logic without calling external APIs.
///
/// ### Response Resolution Order
/// 1. Next queued script for the node ({@link #respond}, {@link #fail})
/// 2. Sticky responder for the node ({@link #respondWith})
/// 3. Placeholder payload generated from the requested output shape
///
/// @implNote Thread-safe. Every request is kept in {@link #requests()} so tests
/// can assert on prompts and attempt counts.
public class StubLlmCapability implements LlmCapability {

    private static final Logger logger = Logger.getLogger(StubLlmCapability.class.getName());

    private static final TokenUsage DEFAULT_USAGE = new TokenUsage(10, 20);

    private final Map<String, Deque<Script>> scripts = new ConcurrentHashMap<>();
    private final Map<String, Function<LlmRequest, Map<String, Object>>> responders =
            new ConcurrentHashMap<>();
    private final Map<String, Duration> latencies = new ConcurrentHashMap<>();
    private final List<LlmRequest> requests = new CopyOnWriteArrayList<>();
    private volatile TokenUsage usage = DEFAULT_USAGE;

    private record Script(Map<String, Object> payload, CapabilityException failure) {}

    /// Queues a payload for the next call from a node.
    public StubLlmCapability respond(String nodeId, Map<String, Object> payload) {
        queue(nodeId).add(new Script(new LinkedHashMap<>(payload), null));
        return this;
    }

    /// Queues a failure for the next call from a node.
    public StubLlmCapability fail(String nodeId, CapabilityException failure) {
        queue(nodeId).add(new Script(null, failure));
        return this;
    }

    /// Answers every unscripted call from a node with the given function.
    public StubLlmCapability respondWith(
            String nodeId, Function<LlmRequest, Map<String, Object>> responder) {
        responders.put(nodeId, responder);
        return this;
    }

    /// Makes calls from a node block for the given time before answering.
    public StubLlmCapability latency(String nodeId, Duration latency) {
        latencies.put(nodeId, latency);
        return this;
    }

    /// Sets the token usage reported for every call.
    public StubLlmCapability usage(TokenUsage usage) {
        this.usage = Objects.requireNonNull(usage, "usage must not be null");
        return this;
    }

    /// Returns every request received, in arrival order.
    public List<LlmRequest> requests() {
        return List.copyOf(requests);
    }

    /// Returns the requests received from one node.
    public List<LlmRequest> requests(String nodeId) {
        return requests.stream().filter(r -> r.nodeId().equals(nodeId)).toList();
    }

    @Override
    public LlmResult invoke(LlmRequest request) throws CapabilityException {
        requests.add(request);
        logger.fine(
                "[STUB] Node '"
                        + request.nodeId()
                        + "' received prompt ("
                        + request.prompt().length()
                        + " chars)");

        Duration latency = latencies.get(request.nodeId());
        if (latency != null) {
            try {
                Thread.sleep(latency.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PermanentCapabilityException(
                        "Call from node '" + request.nodeId() + "' interrupted", e);
            }
        }

        Deque<Script> queued = scripts.get(request.nodeId());
        Script script = queued != null ? queued.poll() : null;
        if (script != null) {
            if (script.failure() != null) {
                throw script.failure();
            }
            return new LlmResult(script.payload(), usage);
        }

        Function<LlmRequest, Map<String, Object>> responder = responders.get(request.nodeId());
        if (responder != null) {
            return new LlmResult(responder.apply(request), usage);
        }
        return new LlmResult(placeholder(request), usage);
    }

    private Deque<Script> queue(String nodeId) {
        return scripts.computeIfAbsent(nodeId, id -> new ConcurrentLinkedDeque<>());
    }

    private static Map<String, Object> placeholder(LlmRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (OutputField field : request.outputModel().getFields()) {
            payload.put(field.name(), placeholderValue(field.name(), field.type()));
        }
        return payload;
    }

    private static Object placeholderValue(String name, TypeDescriptor type) {
        if (type instanceof TypeDescriptor.Scalar scalar) {
            return switch (scalar.kind()) {
                case STRING -> "stub " + name;
                case INTEGER -> 0L;
                case FLOAT -> 0.0;
                case BOOLEAN -> false;
            };
        }
        if (type instanceof TypeDescriptor.ListOf) {
            return new ArrayList<>();
        }
        return new LinkedHashMap<>();
    }
}
