package io.flowcraft.core.capability;

import io.flowcraft.core.execution.ExecutionRecord;
import io.flowcraft.core.profiling.BottleneckSummary;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/// In-memory {@link PersistenceCapability} (default implementation).
///
/// Thread-safe, no external dependencies.
///
/// ### Storage Structure
/// Uses two maps: runId -> records and runId -> summaries, each list append-only.
public final class InMemoryPersistence implements PersistenceCapability {

    private final Map<String, List<ExecutionRecord>> records = new ConcurrentHashMap<>();
    private final Map<String, List<BottleneckSummary>> summaries = new ConcurrentHashMap<>();

    @Override
    public void appendRecord(String runId, ExecutionRecord record) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(record, "record must not be null");
        records.computeIfAbsent(runId, id -> new CopyOnWriteArrayList<>()).add(record);
    }

    @Override
    public void appendSummary(String runId, BottleneckSummary summary) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        summaries.computeIfAbsent(runId, id -> new CopyOnWriteArrayList<>()).add(summary);
    }

    @Override
    public List<ExecutionRecord> records(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        List<ExecutionRecord> stored = records.get(runId);
        return stored != null ? List.copyOf(stored) : List.of();
    }

    @Override
    public List<BottleneckSummary> summaries(String runId) {
        Objects.requireNonNull(runId, "runId must not be null");
        List<BottleneckSummary> stored = summaries.get(runId);
        return stored != null ? List.copyOf(stored) : List.of();
    }

    /// Returns the number of runs with at least one record (useful for testing).
    public int runCount() {
        return records.size();
    }
}
