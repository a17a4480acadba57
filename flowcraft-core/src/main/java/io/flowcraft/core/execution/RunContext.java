package io.flowcraft.core.execution;

import io.flowcraft.core.capability.PersistenceCapability;
import io.flowcraft.core.compiler.CompiledGraph;
import io.flowcraft.core.profiling.CostAggregator;
import io.flowcraft.core.profiling.CostEntry;
import io.flowcraft.core.profiling.Profiler;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/// Per-run scope shared by the traversal thread and its parallel branches.
///
/// Holds everything one run accumulates: the committed records, the profiler,
/// the cost aggregator, the loop counters and the cancellation flag. Nothing
/// here is global, so concurrent runs never see each other's telemetry.
///
/// ### Contracts
/// - **Invariant**: records are append-only and never modified after commit
/// - **Invariant**: no record is committed once cancellation has been requested
/// - **Invariant**: loop counters are invisible to the declared state
/// - **Invariant**: the status moves forward only and is set to a terminal value once
///
/// @implNote Thread-safe. Records use a copy-on-write list; counters and
/// branch futures live in concurrent maps and sets.
public final class RunContext {

    private static final Logger logger = Logger.getLogger(RunContext.class.getName());

    private final String runId;
    private final CompiledGraph graph;
    private final ExecutionListener listener;
    private final Profiler profiler;
    private final CostAggregator costs;
    private final PersistenceCapability persistence;
    private final Clock clock;
    private final List<ExecutionRecord> records = new CopyOnWriteArrayList<>();
    private final Map<String, Integer> loopCounters = new ConcurrentHashMap<>();
    private final Set<Future<?>> branches = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Object commitLock = new Object();
    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.READY);

    public RunContext(
            String runId,
            CompiledGraph graph,
            ExecutionListener listener,
            Profiler profiler,
            CostAggregator costs,
            PersistenceCapability persistence,
            Clock clock) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.listener = listener != null ? listener : ExecutionListener.NOOP;
        this.profiler = Objects.requireNonNull(profiler, "profiler must not be null");
        this.costs = Objects.requireNonNull(costs, "costs must not be null");
        this.persistence = persistence != null ? persistence : PersistenceCapability.NOOP;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String getRunId() {
        return runId;
    }

    public CompiledGraph getGraph() {
        return graph;
    }

    public ExecutionListener getListener() {
        return listener;
    }

    public Profiler getProfiler() {
        return profiler;
    }

    public CostAggregator getCosts() {
        return costs;
    }

    public Clock getClock() {
        return clock;
    }

    /// Commits a record: appends it, books its cost, feeds the profiler and
    /// hands it to persistence.
    ///
    /// @param record the finished record, not null
    /// @param cost the priced call behind the record, not null
    /// @return false if the run was cancelled first; nothing is committed then
    public boolean commit(ExecutionRecord record, CostEntry cost) {
        synchronized (commitLock) {
            if (cancelled.get()) {
                return false;
            }
            records.add(record);
            costs.book(cost);
            profiler.record(record.nodeId(), record.duration(), record.cost());
        }
        try {
            persistence.appendRecord(runId, record);
        } catch (RuntimeException e) {
            logger.warning(
                    "Persisting record of node '"
                            + record.nodeId()
                            + "' in run "
                            + runId
                            + " failed: "
                            + e.getMessage());
        }
        listener.onNodeComplete(runId, record);
        return true;
    }

    /// Returns the committed records in commit order.
    public List<ExecutionRecord> records() {
        return List.copyOf(records);
    }

    /// Returns the zero-based pass the given loop is on.
    public int iteration(String loopId) {
        return loopCounters.getOrDefault(loopId, 0);
    }

    /// Counts one finished pass of a loop.
    ///
    /// @return passes finished so far
    public int completePass(String loopId) {
        return loopCounters.merge(loopId, 1, Integer::sum);
    }

    /// Clears a loop counter so a later re-entry starts from zero.
    public void resetLoop(String loopId) {
        loopCounters.remove(loopId);
    }

    public RunStatus getStatus() {
        return status.get();
    }

    /// Moves from READY to RUNNING.
    ///
    /// @return false if the run already left READY (for example, was cancelled)
    boolean start() {
        return status.compareAndSet(RunStatus.READY, RunStatus.RUNNING);
    }

    /// Moves from READY straight to CANCELLED.
    ///
    /// @return false if the run had already started
    boolean abortIfReady() {
        return status.compareAndSet(RunStatus.READY, RunStatus.CANCELLED);
    }

    /// Sets the terminal status once.
    ///
    /// @return false if a terminal status was already set
    boolean finish(RunStatus terminal) {
        RunStatus current;
        do {
            current = status.get();
            if (current.isTerminal()) {
                return false;
            }
        } while (!status.compareAndSet(current, terminal));
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /// Requests cancellation and interrupts every outstanding branch.
    ///
    /// @return false if cancellation had already been requested
    boolean cancel() {
        synchronized (commitLock) {
            if (!cancelled.compareAndSet(false, true)) {
                return false;
            }
        }
        for (Future<?> branch : branches) {
            branch.cancel(true);
        }
        return true;
    }

    /// Throws if cancellation has been requested.
    ///
    /// @throws RunCancelledException when cancelled
    public void checkCancelled() {
        if (cancelled.get()) {
            throw new RunCancelledException(runId);
        }
    }

    void trackBranch(Future<?> branch) {
        branches.add(branch);
        if (cancelled.get()) {
            branch.cancel(true);
        }
    }

    void untrackBranch(Future<?> branch) {
        branches.remove(branch);
    }
}
