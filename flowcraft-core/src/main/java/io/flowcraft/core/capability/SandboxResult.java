package io.flowcraft.core.capability;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Outcome of one sandboxed code execution.
///
/// @param success whether the code ran to completion
/// @param output named values produced by the code, not null
/// @param error failure description, null on success
/// @param executionTime wall-clock time spent, not null
/// @param stdout captured standard output, may be empty
/// @param stderr captured standard error, may be empty
public record SandboxResult(
        boolean success,
        Map<String, Object> output,
        String error,
        Duration executionTime,
        String stdout,
        String stderr) {

    public SandboxResult {
        output =
                output != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(output))
                        : Map.of();
        executionTime = executionTime != null ? executionTime : Duration.ZERO;
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }

    public static SandboxResult success(Map<String, Object> output, Duration executionTime) {
        return new SandboxResult(true, output, null, executionTime, "", "");
    }

    public static SandboxResult failure(String error, Duration executionTime) {
        return new SandboxResult(false, Map.of(), error, executionTime, "", "");
    }
}
