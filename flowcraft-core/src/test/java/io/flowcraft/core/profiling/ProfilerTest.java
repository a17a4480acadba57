package io.flowcraft.core.profiling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Profiler")
class ProfilerTest {

    private final Profiler profiler = new Profiler();

    @Nested
    @DisplayName("bottlenecks")
    class Bottlenecks {

        @Test
        @DisplayName("flags nodes strictly above the threshold")
        void shouldFlagSlowNode() {
            profiler.record("A", Duration.ofMillis(100));
            profiler.record("B", Duration.ofMillis(200));
            profiler.record("C", Duration.ofMillis(50));

            var flagged = profiler.bottlenecks(50.0);

            assertThat(flagged).singleElement()
                    .satisfies(
                            b -> {
                                assertThat(b.nodeId()).isEqualTo("B");
                                assertThat(b.percentOfTotal()).isEqualTo(57.14);
                                assertThat(b.callCount()).isEqualTo(1);
                            });
            assertThat(profiler.slowest()).get().extracting(NodeTimings::nodeId).isEqualTo("B");
            assertThat(profiler.totalTime()).isEqualTo(Duration.ofMillis(350));
        }

        @Test
        @DisplayName("does not flag a node at exactly the threshold")
        void shouldUseStrictComparison() {
            profiler.record("A", Duration.ofMillis(100));
            profiler.record("B", Duration.ofMillis(100));

            assertThat(profiler.bottlenecks(50.0)).isEmpty();
        }

        @Test
        @DisplayName("flags a lone node at 100 percent")
        void shouldFlagSingleNode() {
            profiler.record("only", Duration.ofMillis(5));

            assertThat(profiler.bottlenecks()).singleElement()
                    .satisfies(b -> assertThat(b.percentOfTotal()).isEqualTo(100.0));
        }

        @Test
        @DisplayName("is empty when nothing was recorded")
        void shouldBeEmptyWithoutRecords() {
            assertThat(profiler.bottlenecks()).isEmpty();
            assertThat(profiler.slowest()).isEmpty();
            assertThat(profiler.summarize("run", 50.0, null).slowestNode()).isNull();
        }
    }

    @Test
    @DisplayName("aggregates repeated calls of one node")
    void shouldAggregateCalls() {
        profiler.record("loop", Duration.ofMillis(30), 0.01);
        profiler.record("loop", Duration.ofMillis(10), 0.02);

        var timings = profiler.timings("loop").orElseThrow();

        assertThat(timings.callCount()).isEqualTo(2);
        assertThat(timings.total()).isEqualTo(Duration.ofMillis(40));
        assertThat(timings.average()).isEqualTo(Duration.ofMillis(20));
        assertThat(timings.cost()).isCloseTo(0.03, within(1e-9));
    }

    @Test
    @DisplayName("orders timings slowest first")
    void shouldOrderTimings() {
        profiler.record("fast", Duration.ofMillis(1));
        profiler.record("slow", Duration.ofMillis(9));

        assertThat(profiler.timings())
                .extracting(NodeTimings::nodeId)
                .containsExactly("slow", "fast");
    }

    @Test
    @DisplayName("rejects negative durations")
    void shouldRejectNegativeDuration() {
        assertThatThrownBy(() -> profiler.record("A", Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("accepts concurrent recordings without losing any")
    void shouldRecordConcurrently() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(800);
        try {
            for (int i = 0; i < 800; i++) {
                String node = "n" + (i % 4);
                pool.submit(
                        () -> {
                            profiler.record(node, Duration.ofMillis(1));
                            done.countDown();
                        });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(profiler.totalTime()).isEqualTo(Duration.ofMillis(800));
        assertThat(profiler.timings())
                .allSatisfy(t -> assertThat(t.callCount()).isEqualTo(200));
    }
}
