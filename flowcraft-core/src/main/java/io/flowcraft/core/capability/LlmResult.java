package io.flowcraft.core.capability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Structured payload and token usage returned by the LLM capability.
///
/// @param payload result fields keyed by name, not null; single-scalar
///     results use the key `result`
/// @param usage token usage, not null
public record LlmResult(Map<String, Object> payload, TokenUsage usage) {

    public LlmResult {
        Objects.requireNonNull(payload, "payload must not be null");
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        usage = usage != null ? usage : TokenUsage.ZERO;
    }
}
