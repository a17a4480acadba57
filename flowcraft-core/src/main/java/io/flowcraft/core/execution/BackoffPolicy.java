package io.flowcraft.core.execution;

import io.flowcraft.core.workflow.ExecutionDefaults;
import java.time.Duration;
import java.util.Objects;

/// Bounded exponential backoff for transient capability failures.
///
/// The delay before retry `n` (zero-based) is `base * 2^n`, capped at `max`.
///
/// @param base first delay, not negative
/// @param max delay cap, not less than `base`
public record BackoffPolicy(Duration base, Duration max) {

    public BackoffPolicy {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(max, "max must not be null");
    }

    public static BackoffPolicy from(ExecutionDefaults defaults) {
        return new BackoffPolicy(defaults.backoffBase(), defaults.backoffMax());
    }

    /// Returns the delay before the given zero-based retry.
    public Duration delay(int retry) {
        if (retry < 0) {
            throw new IllegalArgumentException("retry must not be negative: " + retry);
        }
        if (base.isZero()) {
            return Duration.ZERO;
        }
        if (retry >= 62) {
            return max;
        }
        long factor = 1L << retry;
        long millis = base.toMillis();
        if (millis > max.toMillis() / factor) {
            return max;
        }
        Duration delay = Duration.ofMillis(millis * factor);
        return delay.compareTo(max) > 0 ? max : delay;
    }

    /// Blocks the calling thread between attempts.
    @FunctionalInterface
    public interface Sleeper {

        Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
