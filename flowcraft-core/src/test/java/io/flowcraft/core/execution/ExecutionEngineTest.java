package io.flowcraft.core.execution;

import static io.flowcraft.core.test.TestWorkflows.scoreNode;
import static io.flowcraft.core.test.TestWorkflows.spec;
import static io.flowcraft.core.test.TestWorkflows.textNode;
import static io.flowcraft.core.workflow.EdgeDeclaration.END;
import static io.flowcraft.core.workflow.EdgeDeclaration.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcraft.core.capability.InMemoryPersistence;
import io.flowcraft.core.capability.LlmRequest;
import io.flowcraft.core.capability.PermanentCapabilityException;
import io.flowcraft.core.capability.StubLlmCapability;
import io.flowcraft.core.compiler.CompiledGraph;
import io.flowcraft.core.compiler.GraphCompiler;
import io.flowcraft.core.profiling.DefaultPricingTable;
import io.flowcraft.core.state.SchemaBuildException;
import io.flowcraft.core.template.PathTemplateResolver;
import io.flowcraft.core.tool.DefaultToolRegistry;
import io.flowcraft.core.workflow.EdgeDeclaration.ConditionalRoute;
import io.flowcraft.core.workflow.EdgeDeclaration.Linear;
import io.flowcraft.core.workflow.EdgeDeclaration.LoopBack;
import io.flowcraft.core.workflow.EdgeDeclaration.ParallelFanOut;
import io.flowcraft.core.workflow.EdgeDeclaration.Route;
import io.flowcraft.core.workflow.NodeDeclaration;
import io.flowcraft.core.workflow.OutputDeclaration;
import io.flowcraft.core.workflow.WorkflowSpec;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ExecutionEngine")
class ExecutionEngineTest {

    private static final Map<String, Object> INPUTS = Map.of("topic", "tides");

    private StubLlmCapability llm;
    private InMemoryPersistence persistence;
    private ExecutorService runPool;
    private ExecutorService branchPool;
    private ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        llm = new StubLlmCapability();
        persistence = new InMemoryPersistence();
        runPool = Executors.newFixedThreadPool(2);
        branchPool = Executors.newFixedThreadPool(4);
        var nodeExecutor =
                new NodeExecutor(
                        llm,
                        new DefaultToolRegistry(),
                        null,
                        new PathTemplateResolver(),
                        duration -> {});
        engine =
                new ExecutionEngine(
                        new GraphCompiler(),
                        nodeExecutor,
                        runPool,
                        branchPool,
                        new DefaultPricingTable(),
                        persistence,
                        Clock.systemUTC(),
                        50.0);
    }

    @AfterEach
    void tearDown() {
        runPool.shutdownNow();
        branchPool.shutdownNow();
    }

    private CompiledGraph compile(WorkflowSpec.Builder builder) {
        return engine.compile(builder.build());
    }

    private CompiledGraph linear() {
        return compile(
                spec("linear")
                        .node(textNode("draft", "draft"))
                        .node(
                                NodeDeclaration.builder("summarize")
                                        .prompt("Summarize: {draft}")
                                        .outputs("summary")
                                        .build())
                        .edge(new Linear(START, "draft"))
                        .edge(new Linear("draft", "summarize"))
                        .edge(new Linear("summarize", END)));
    }

    private static ExecutionResult.Completed completed(ExecutionResult result) {
        assertThat(result).isInstanceOf(ExecutionResult.Completed.class);
        return (ExecutionResult.Completed) result;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Nested
    @DisplayName("linear runs")
    class LinearRuns {

        @Test
        @DisplayName("feed each node the state committed by the previous one")
        void shouldThreadStateThroughNodes() throws Exception {
            llm.respond("draft", Map.of("result", "Tides follow the moon."));

            var result = completed(engine.execute(linear(), INPUTS));

            assertThat(llm.requests("summarize").get(0).prompt())
                    .isEqualTo("Summarize: Tides follow the moon.");
            assertThat(result.finalState().get("draft")).isEqualTo("Tides follow the moon.");
            assertThat(result.finalState().get("summary")).isEqualTo("stub result");
            assertThat(result.records())
                    .extracting(ExecutionRecord::nodeId)
                    .containsExactly("draft", "summarize");
        }

        @Test
        @DisplayName("produce the same state and trace order for the same inputs")
        void shouldBeDeterministic() throws Exception {
            var graph = linear();

            var first = completed(engine.execute(graph, INPUTS));
            var second = completed(engine.execute(graph, INPUTS));

            assertThat(second.finalState()).isEqualTo(first.finalState());
            assertThat(second.records())
                    .extracting(ExecutionRecord::nodeId)
                    .isEqualTo(first.records().stream().map(ExecutionRecord::nodeId).toList());
            assertThat(second.runId()).isNotEqualTo(first.runId());
        }

        @Test
        @DisplayName("reject inputs missing a required field before starting")
        void shouldRejectMissingInput() {
            var graph = linear();

            assertThatThrownBy(() -> engine.submit(graph, Map.of()))
                    .isInstanceOf(SchemaBuildException.class)
                    .hasMessageContaining("topic");
            assertThat(llm.requests()).isEmpty();
        }

        @Test
        @DisplayName("fail the run and keep the failing record")
        void shouldFailRun() throws Exception {
            llm.fail("summarize", new PermanentCapabilityException("model unavailable"));

            var result = engine.execute(linear(), INPUTS);

            assertThat(result).isInstanceOf(ExecutionResult.Failure.class);
            var failure = (ExecutionResult.Failure) result;
            assertThat(failure.error()).isInstanceOf(NodeExecutionException.class);
            assertThat(((NodeExecutionException) failure.error()).getNodeId()).isEqualTo("summarize");
            assertThat(failure.lastState().get("draft")).isEqualTo("stub result");
            assertThat(failure.records()).hasSize(2);
            assertThat(engine.status(failure.runId())).isEqualTo(RunStatus.FAILED);
        }
    }

    @Nested
    @DisplayName("conditional routing")
    class Routing {

        private CompiledGraph routed() {
            return compile(
                    spec("routing")
                            .node(scoreNode("rate"))
                            .node(textNode("praise", "a"))
                            .node(textNode("fix", "b"))
                            .edge(new Linear(START, "rate"))
                            .edge(
                                    new ConditionalRoute(
                                            "rate",
                                            List.of(
                                                    new Route("score >= 8", "praise"),
                                                    new Route("score >= 5", "fix")),
                                            END))
                            .edge(new Linear("praise", END))
                            .edge(new Linear("fix", END)));
        }

        private List<String> path(long score) throws InterruptedException {
            llm.respond("rate", Map.of("result", score));
            return completed(engine.execute(routed(), INPUTS)).records().stream()
                    .map(ExecutionRecord::nodeId)
                    .toList();
        }

        @Test
        @DisplayName("takes the first route whose condition holds")
        void shouldTakeFirstMatch() throws Exception {
            assertThat(path(9)).containsExactly("rate", "praise");
            assertThat(path(6)).containsExactly("rate", "fix");
        }

        @Test
        @DisplayName("falls back to the default when nothing matches")
        void shouldTakeDefault() throws Exception {
            assertThat(path(2)).containsExactly("rate");
        }

        @Test
        @DisplayName("fails the run when a condition cannot be evaluated")
        void shouldFailOnEvaluationError() throws Exception {
            var graph =
                    compile(
                            spec("div")
                                    .node(scoreNode("rate"))
                                    .node(textNode("praise", "a"))
                                    .edge(new Linear(START, "rate"))
                                    .edge(
                                            new ConditionalRoute(
                                                    "rate",
                                                    List.of(new Route("10 / score > 1", "praise")),
                                                    END))
                                    .edge(new Linear("praise", END)));
            llm.respond("rate", Map.of("result", 0));

            var result = engine.execute(graph, INPUTS);

            assertThat(result).isInstanceOf(ExecutionResult.Failure.class);
            assertThat(((ExecutionResult.Failure) result).error())
                    .hasMessageContaining("Division by zero");
        }
    }

    @Nested
    @DisplayName("loops")
    class Loops {

        @Test
        @DisplayName("run exactly max_iterations passes when the condition never holds")
        void shouldStopAtBound() throws Exception {
            var graph =
                    compile(
                            spec("bounded")
                                    .node(scoreNode("review"))
                                    .edge(new Linear(START, "review"))
                                    .edge(new LoopBack("review", 3, "score > 100")));

            var result = completed(engine.execute(graph, INPUTS));

            assertThat(result.records()).hasSize(3);
            assertThat(result.records())
                    .extracting(ExecutionRecord::iteration)
                    .containsExactly(0, 1, 2);
        }

        @Test
        @DisplayName("exit as soon as the until condition holds")
        void shouldExitOnCondition() throws Exception {
            var graph =
                    compile(
                            spec("until")
                                    .node(textNode("draft", "draft"))
                                    .node(scoreNode("review"))
                                    .node(textNode("publish", "summary"))
                                    .edge(new Linear(START, "draft"))
                                    .edge(new Linear("draft", "review"))
                                    .edge(new LoopBack("review", "draft", 5, "score >= 8", "publish"))
                                    .edge(new Linear("publish", END)));
            llm.respond("review", Map.of("result", 3))
                    .respond("review", Map.of("result", 6))
                    .respond("review", Map.of("result", 9));

            var result = completed(engine.execute(graph, INPUTS));

            assertThat(result.records())
                    .extracting(ExecutionRecord::nodeId)
                    .containsExactly(
                            "draft", "review", "draft", "review", "draft", "review", "publish");
            assertThat(result.finalState().get("score")).isEqualTo(9L);
            assertThat(result.records().get(6).iteration()).isNull();
        }
    }

    @Nested
    @DisplayName("parallel fan-out")
    class FanOut {

        private NodeDeclaration branch(String id, String output) {
            return NodeDeclaration.builder(id)
                    .prompt(id + " sees [{a}{b}{c}] of {draft}")
                    .output(OutputDeclaration.scalar("str"))
                    .outputs(output)
                    .build();
        }

        private CompiledGraph fanOut() {
            return compile(
                    spec("fan")
                            .node(textNode("start", "draft"))
                            .node(branch("left", "a"))
                            .node(branch("middle", "b"))
                            .node(branch("right", "c"))
                            .node(
                                    NodeDeclaration.builder("merge")
                                            .prompt("{a}|{b}|{c}")
                                            .outputs("summary")
                                            .build())
                            .edge(new Linear(START, "start"))
                            .edge(
                                    new ParallelFanOut(
                                            "start", List.of("left", "middle", "right"), "merge"))
                            .edge(new Linear("merge", END)));
        }

        @Test
        @DisplayName("give every branch the same snapshot and merge at the join")
        void shouldIsolateBranches() throws Exception {
            llm.respond("start", Map.of("result", "D"))
                    .respond("left", Map.of("result", "A"))
                    .respond("middle", Map.of("result", "B"))
                    .respond("right", Map.of("result", "C"))
                    .latency("middle", Duration.ofMillis(40))
                    .latency("right", Duration.ofMillis(80));

            var result = completed(engine.execute(fanOut(), INPUTS));

            assertThat(llm.requests("left").get(0).prompt()).isEqualTo("left sees [] of D");
            assertThat(llm.requests("middle").get(0).prompt()).isEqualTo("middle sees [] of D");
            assertThat(llm.requests("right").get(0).prompt()).isEqualTo("right sees [] of D");
            assertThat(llm.requests("merge").get(0).prompt()).isEqualTo("A|B|C");
            assertThat(result.finalState().get("a")).isEqualTo("A");
            assertThat(result.finalState().get("b")).isEqualTo("B");
            assertThat(result.finalState().get("c")).isEqualTo("C");
            assertThat(result.records()).hasSize(5);
            assertThat(result.records().get(4).nodeId()).isEqualTo("merge");
        }

        @Test
        @DisplayName("wait for every branch, then fail with the branch failure")
        void shouldFailAfterAllBranchesResolve() throws Exception {
            llm.fail("left", new PermanentCapabilityException("refused"))
                    .latency("middle", Duration.ofMillis(30))
                    .latency("right", Duration.ofMillis(50));

            var result = engine.execute(fanOut(), INPUTS);

            assertThat(result).isInstanceOf(ExecutionResult.Failure.class);
            var failure = (ExecutionResult.Failure) result;
            assertThat(failure.error()).hasMessageContaining("Node 'left'");
            assertThat(failure.records())
                    .extracting(ExecutionRecord::nodeId)
                    .containsExactlyInAnyOrder("start", "left", "middle", "right");
            assertThat(llm.requests("merge")).isEmpty();
        }
    }

    @Nested
    @DisplayName("asynchronous runs")
    class AsyncRuns {

        @Test
        @DisplayName("return a handle when the synchronous wait times out")
        void shouldReturnPendingOnTimeout() throws Exception {
            llm.latency("draft", Duration.ofMillis(300));

            var result = engine.execute(linear(), INPUTS, Duration.ofMillis(20), null);

            assertThat(result).isInstanceOf(ExecutionResult.Pending.class);
            var handle = ((ExecutionResult.Pending) result).handle();
            assertThat(engine.status(handle.runId())).isIn(RunStatus.READY, RunStatus.RUNNING);
            completed(handle.await());
            assertThat(handle.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(engine.trace(handle.runId())).hasSize(2);
        }

        @Test
        @DisplayName("cancel outstanding branches and commit no record for them")
        void shouldCancelRun() throws Exception {
            var graph =
                    compile(
                            spec("cancel")
                                    .node(textNode("a", "a"))
                                    .node(textNode("b", "b"))
                                    .node(textNode("c", "c"))
                                    .node(textNode("join", "summary"))
                                    .edge(new ParallelFanOut(START, List.of("a", "b", "c"), "join"))
                                    .edge(new Linear("join", END)));
            llm.latency("b", Duration.ofSeconds(10)).latency("c", Duration.ofSeconds(10));

            var handle = engine.submit(graph, INPUTS);
            awaitCondition(
                    () -> handle.records().size() == 1 && llm.requests().size() == 3);

            assertThat(handle.cancel()).isTrue();
            var result = handle.await(Duration.ofSeconds(5));

            assertThat(result).isInstanceOf(ExecutionResult.Cancelled.class);
            assertThat(engine.status(handle.runId())).isEqualTo(RunStatus.CANCELLED);
            assertThat(engine.trace(handle.runId()))
                    .extracting(ExecutionRecord::nodeId)
                    .containsExactly("a");
            assertThat(handle.cancel()).isFalse();
        }

        @Test
        @DisplayName("drop records of branches that finish after cancellation")
        void shouldDropRecordsOfBranchesIgnoringInterrupts() throws Exception {
            var graph =
                    compile(
                            spec("stubborn")
                                    .node(textNode("a", "a"))
                                    .node(textNode("b", "b"))
                                    .node(textNode("c", "c"))
                                    .node(textNode("join", "summary"))
                                    .edge(new ParallelFanOut(START, List.of("a", "b", "c"), "join"))
                                    .edge(new Linear("join", END)));
            var settled = new CountDownLatch(2);
            Function<LlmRequest, Map<String, Object>> busy =
                    request -> {
                        long until = System.nanoTime() + Duration.ofMillis(300).toNanos();
                        while (System.nanoTime() < until) {
                            Thread.onSpinWait();
                        }
                        settled.countDown();
                        return Map.of("result", "late");
                    };
            llm.respondWith("b", busy).respondWith("c", busy);

            var handle = engine.submit(graph, INPUTS);
            awaitCondition(
                    () -> handle.records().size() == 1 && llm.requests().size() == 3);

            assertThat(handle.cancel()).isTrue();
            var result = handle.await(Duration.ofSeconds(5));
            assertThat(settled.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(50);

            assertThat(result).isInstanceOf(ExecutionResult.Cancelled.class);
            assertThat(((ExecutionResult.Cancelled) result).records())
                    .extracting(ExecutionRecord::nodeId)
                    .containsExactly("a");
            assertThat(engine.trace(handle.runId()))
                    .extracting(ExecutionRecord::nodeId)
                    .containsExactly("a");
            assertThat(persistence.records(handle.runId()))
                    .extracting(ExecutionRecord::nodeId)
                    .containsExactly("a");
            assertThat(engine.bottlenecks(handle.runId()).costs().callCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("notify listeners in lifecycle order")
        void shouldNotifyListener() throws Exception {
            List<String> events = new CopyOnWriteArrayList<>();
            var listener =
                    new ExecutionListener() {
                        @Override
                        public void onRunStart(String runId, String workflowName) {
                            events.add("start:" + workflowName);
                        }

                        @Override
                        public void onNodeComplete(String runId, ExecutionRecord record) {
                            events.add("node:" + record.nodeId());
                        }

                        @Override
                        public void onRunComplete(String runId, RunStatus status) {
                            events.add("end:" + status);
                        }
                    };

            engine.execute(linear(), INPUTS, Duration.ofSeconds(5), listener);

            assertThat(events)
                    .containsExactly("start:linear", "node:draft", "node:summarize", "end:COMPLETED");
        }
    }

    @Nested
    @DisplayName("run queries")
    class Queries {

        @Test
        @DisplayName("summarize bottlenecks and hand the summary to persistence")
        void shouldSummarizeBottlenecks() throws Exception {
            llm.latency("draft", Duration.ofMillis(60));
            var result = completed(engine.execute(linear(), INPUTS));

            var summary = engine.bottlenecks(result.runId());

            assertThat(summary.runId()).isEqualTo(result.runId());
            assertThat(summary.nodeCount()).isEqualTo(2);
            assertThat(summary.slowestNode()).isEqualTo("draft");
            assertThat(summary.bottleneckIds()).contains("draft");
            assertThat(summary.costs().callCount()).isEqualTo(2);
            assertThat(persistence.summaries(result.runId())).containsExactly(summary);
            assertThat(persistence.records(result.runId())).hasSize(2);
        }

        @Test
        @DisplayName("release ended runs and keep active ones")
        void shouldForgetEndedRuns() throws Exception {
            llm.latency("draft", Duration.ofSeconds(1));
            var active = engine.submit(linear(), INPUTS);
            var quick =
                    compile(
                            spec("quick")
                                    .node(textNode("quick", "summary"))
                                    .edge(new Linear(START, "quick"))
                                    .edge(new Linear("quick", END)));
            var ended = completed(engine.execute(quick, INPUTS));

            assertThat(engine.forget(active.runId())).isFalse();
            assertThat(engine.trace(active.runId())).isNotNull();
            assertThat(engine.forget(ended.runId())).isTrue();
            assertThatThrownBy(() -> engine.trace(ended.runId()))
                    .isInstanceOf(RunNotFoundException.class);

            completed(active.await());
            assertThat(engine.forget(active.runId())).isTrue();
            assertThat(active.records()).hasSize(2);
        }

        @Test
        @DisplayName("reject unknown run ids")
        void shouldRejectUnknownRun() {
            assertThatThrownBy(() -> engine.status("missing"))
                    .isInstanceOf(RunNotFoundException.class)
                    .hasMessage("Unknown run: missing");
            assertThatThrownBy(() -> engine.trace("missing"))
                    .isInstanceOf(RunNotFoundException.class);
            assertThatThrownBy(() -> engine.bottlenecks("missing"))
                    .isInstanceOf(RunNotFoundException.class);
        }
    }
}
