package io.flowcraft.core;

import io.flowcraft.core.profiling.Profiler;
import java.time.Duration;

/// Configuration options for the Flowcraft execution environment.
///
/// Controls pool sizing and the engine-wide defaults that workflows do not
/// declare themselves. Use the {@link Builder} for fluent configuration.
///
/// ### Default Values
/// - `runPoolSize`: `4` (concurrent runs)
/// - `branchPoolSize`: `16` (concurrent fan-out branches across all runs)
/// - `bottleneckThreshold`: `50.0` percent
/// - `stubMode`: `false`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link FlowcraftFactory}
/// and do not modify afterwards.
///
/// @see FlowcraftFactory#createEnvironment(FlowcraftConfig)
public class FlowcraftConfig {
    private int runPoolSize = 4;
    private int branchPoolSize = 16;
    private double bottleneckThreshold = Profiler.DEFAULT_THRESHOLD;
    private boolean stubMode;
    private Duration syncTimeout;

    public FlowcraftConfig() {}

    public int getRunPoolSize() {
        return runPoolSize;
    }

    public void setRunPoolSize(int runPoolSize) {
        this.runPoolSize = runPoolSize;
    }

    public int getBranchPoolSize() {
        return branchPoolSize;
    }

    public void setBranchPoolSize(int branchPoolSize) {
        this.branchPoolSize = branchPoolSize;
    }

    /// Returns the share of total run time, in percent, a node must strictly
    /// exceed to count as a bottleneck.
    public double getBottleneckThreshold() {
        return bottleneckThreshold;
    }

    public void setBottleneckThreshold(double bottleneckThreshold) {
        this.bottleneckThreshold = bottleneckThreshold;
    }

    /// Returns whether the stub LLM capability replaces real providers.
    public boolean isStubMode() {
        return stubMode;
    }

    public void setStubMode(boolean stubMode) {
        this.stubMode = stubMode;
    }

    /// Returns the synchronous wait overriding each workflow's own timeout, or
    /// null to use the workflow's.
    public Duration getSyncTimeout() {
        return syncTimeout;
    }

    public void setSyncTimeout(Duration syncTimeout) {
        this.syncTimeout = syncTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link FlowcraftConfig}.
    public static class Builder {
        private final FlowcraftConfig config = new FlowcraftConfig();

        public Builder runPoolSize(int runPoolSize) {
            config.runPoolSize = runPoolSize;
            return this;
        }

        public Builder branchPoolSize(int branchPoolSize) {
            config.branchPoolSize = branchPoolSize;
            return this;
        }

        public Builder bottleneckThreshold(double bottleneckThreshold) {
            config.bottleneckThreshold = bottleneckThreshold;
            return this;
        }

        public Builder stubMode(boolean stubMode) {
            config.stubMode = stubMode;
            return this;
        }

        public Builder syncTimeout(Duration syncTimeout) {
            config.syncTimeout = syncTimeout;
            return this;
        }

        /// Builds the configuration.
        ///
        /// @throws IllegalArgumentException if a pool size is not positive or the
        ///     threshold is outside `[0, 100]`
        public FlowcraftConfig build() {
            if (config.runPoolSize <= 0 || config.branchPoolSize <= 0) {
                throw new IllegalArgumentException(
                        "Pool sizes must be positive: run="
                                + config.runPoolSize
                                + ", branch="
                                + config.branchPoolSize);
            }
            if (config.bottleneckThreshold < 0 || config.bottleneckThreshold > 100) {
                throw new IllegalArgumentException(
                        "Bottleneck threshold must be within [0, 100]: "
                                + config.bottleneckThreshold);
            }
            return config;
        }
    }
}
