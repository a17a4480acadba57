package io.flowcraft.core.capability;

import io.flowcraft.core.execution.ExecutionRecord;
import io.flowcraft.core.profiling.BottleneckSummary;
import java.util.List;

/// Append-only store for run telemetry, keyed by run id.
///
/// The engine only appends; it never updates or deletes stored entries.
///
/// @implNote Implementations must be thread-safe. Records from parallel
/// branches of one run arrive concurrently.
///
/// @see InMemoryPersistence for the default implementation
public interface PersistenceCapability {

    /// Appends one execution record.
    ///
    /// @param runId owning run, not null
    /// @param record the record, not null
    void appendRecord(String runId, ExecutionRecord record);

    /// Appends a bottleneck summary computed for a run.
    ///
    /// @param runId owning run, not null
    /// @param summary the summary, not null
    void appendSummary(String runId, BottleneckSummary summary);

    /// Returns all records of a run in append order.
    ///
    /// @param runId the run, not null
    /// @return records, never null (empty for unknown runs)
    List<ExecutionRecord> records(String runId);

    /// Returns all summaries of a run in append order.
    ///
    /// @param runId the run, not null
    /// @return summaries, never null (empty for unknown runs)
    List<BottleneckSummary> summaries(String runId);

    /// Persistence that discards everything.
    PersistenceCapability NOOP =
            new PersistenceCapability() {
                @Override
                public void appendRecord(String runId, ExecutionRecord record) {}

                @Override
                public void appendSummary(String runId, BottleneckSummary summary) {}

                @Override
                public List<ExecutionRecord> records(String runId) {
                    return List.of();
                }

                @Override
                public List<BottleneckSummary> summaries(String runId) {
                    return List.of();
                }
            };
}
