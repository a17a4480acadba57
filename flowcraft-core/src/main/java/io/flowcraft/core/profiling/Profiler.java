package io.flowcraft.core.profiling;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/// Per-run accumulator of node durations and costs, with bottleneck analysis.
///
/// Recording is additive per node id: repeated invocations of one node
/// (loop iterations, retries counted as separate records) share a bucket and
/// each recording increments the call count.
///
/// ### Contracts
/// - **Invariant**: totals only grow; nothing is ever subtracted or reset
/// - **Postcondition**: {@link #bottlenecks(double)} flags a node only when
///   its share is strictly greater than the threshold
///
/// @implNote Thread-safe without locks. Buckets are created through
/// `ConcurrentHashMap.computeIfAbsent` and updated with adders and atomic
/// references, so concurrent branches never lose an update.
public final class Profiler {

    /// Default bottleneck threshold, in percent of total time.
    public static final double DEFAULT_THRESHOLD = 50.0;

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final Clock clock;

    public Profiler() {
        this(Clock.systemUTC());
    }

    public Profiler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    private static final class Bucket {
        final LongAdder nanos = new LongAdder();
        final LongAdder calls = new LongAdder();
        final DoubleAdder cost = new DoubleAdder();
        final AtomicReference<Instant> first = new AtomicReference<>();
        final AtomicReference<Instant> last = new AtomicReference<>();

        void add(Duration duration, double costUsd, Instant at) {
            nanos.add(duration.toNanos());
            calls.increment();
            cost.add(costUsd);
            first.accumulateAndGet(at, (a, b) -> a == null || b.isBefore(a) ? b : a);
            last.accumulateAndGet(at, (a, b) -> a == null || b.isAfter(a) ? b : a);
        }
    }

    /// Records one invocation of a node.
    ///
    /// @param nodeId the node, not null
    /// @param duration time spent, not null or negative
    public void record(String nodeId, Duration duration) {
        record(nodeId, duration, 0.0);
    }

    /// Records one invocation of a node with its cost.
    ///
    /// @param nodeId the node, not null
    /// @param duration time spent, not null or negative
    /// @param cost cost estimate in USD, not negative
    public void record(String nodeId, Duration duration, double cost) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative: " + duration);
        }
        buckets.computeIfAbsent(nodeId, id -> new Bucket()).add(duration, cost, clock.instant());
    }

    /// Returns the summed duration of every recorded node.
    public Duration totalTime() {
        long total = 0;
        for (Bucket bucket : buckets.values()) {
            total += bucket.nanos.sum();
        }
        return Duration.ofNanos(total);
    }

    /// Returns per-node aggregates, slowest first, ties ordered by node id.
    public List<NodeTimings> timings() {
        return buckets.entrySet().stream()
                .map(e -> toTimings(e.getKey(), e.getValue()))
                .sorted(
                        Comparator.comparing(NodeTimings::total)
                                .reversed()
                                .thenComparing(NodeTimings::nodeId))
                .toList();
    }

    /// Returns the aggregate of one node, if it was recorded.
    public Optional<NodeTimings> timings(String nodeId) {
        Bucket bucket = buckets.get(nodeId);
        return bucket != null ? Optional.of(toTimings(nodeId, bucket)) : Optional.empty();
    }

    /// Returns the node with the highest aggregated duration.
    ///
    /// @return the slowest node, or empty when nothing was recorded
    public Optional<NodeTimings> slowest() {
        List<NodeTimings> all = timings();
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(0));
    }

    /// Returns nodes whose share of total time strictly exceeds the threshold.
    ///
    /// A lone node holds 100% and is flagged for any threshold below 100.
    ///
    /// @param thresholdPercent share in percent, e.g. `50.0`
    /// @return flagged nodes, highest share first, never null
    public List<Bottleneck> bottlenecks(double thresholdPercent) {
        List<NodeTimings> all = timings();
        double totalNanos = all.stream().mapToLong(t -> t.total().toNanos()).sum();
        if (totalNanos == 0) {
            return List.of();
        }
        return all.stream()
                .filter(t -> t.total().toNanos() / totalNanos * 100.0 > thresholdPercent)
                .map(
                        t ->
                                new Bottleneck(
                                        t.nodeId(),
                                        t.total(),
                                        round2(t.total().toNanos() / totalNanos * 100.0),
                                        t.callCount(),
                                        t.average()))
                .sorted(Comparator.comparingDouble(Bottleneck::percentOfTotal).reversed())
                .toList();
    }

    /// Returns bottlenecks at {@link #DEFAULT_THRESHOLD}.
    public List<Bottleneck> bottlenecks() {
        return bottlenecks(DEFAULT_THRESHOLD);
    }

    /// Builds a full summary for a run.
    ///
    /// @param runId the run, not null
    /// @param thresholdPercent bottleneck threshold in percent
    /// @param costs cost totals to attach, may be null
    /// @return summary, never null
    public BottleneckSummary summarize(String runId, double thresholdPercent, CostReport costs) {
        List<NodeTimings> all = timings();
        return new BottleneckSummary(
                runId,
                totalTime(),
                all.size(),
                all.isEmpty() ? null : all.get(0).nodeId(),
                thresholdPercent,
                all,
                bottlenecks(thresholdPercent),
                costs);
    }

    private static NodeTimings toTimings(String nodeId, Bucket bucket) {
        long nanos = bucket.nanos.sum();
        int calls = (int) bucket.calls.sum();
        return new NodeTimings(
                nodeId,
                calls,
                Duration.ofNanos(nanos),
                Duration.ofNanos(calls == 0 ? 0 : nanos / calls),
                bucket.cost.sum(),
                bucket.first.get(),
                bucket.last.get());
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
