package io.flowcraft.core.capability;

import java.time.Duration;
import java.util.Objects;

/// Resource limits for one sandboxed code execution.
///
/// @param timeout wall-clock limit, between 1 second and 1 hour
/// @param network whether outbound network access is allowed
/// @param preset resource preset interpreted by the sandbox implementation, not null
public record SandboxLimits(Duration timeout, boolean network, Preset preset) {

    public static final SandboxLimits DEFAULT =
            new SandboxLimits(Duration.ofSeconds(30), false, Preset.MEDIUM);

    private static final Duration MIN_TIMEOUT = Duration.ofSeconds(1);
    private static final Duration MAX_TIMEOUT = Duration.ofHours(1);

    /// Memory and CPU tiers, smallest first.
    public enum Preset {
        LOW,
        MEDIUM,
        HIGH,
        MAX
    }

    public SandboxLimits {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(preset, "preset must not be null");
        if (timeout.compareTo(MIN_TIMEOUT) < 0 || timeout.compareTo(MAX_TIMEOUT) > 0) {
            throw new IllegalArgumentException(
                    "sandbox timeout must be between 1s and 3600s: " + timeout);
        }
    }
}
