package io.flowcraft.core.execution;

import static io.flowcraft.core.test.TestWorkflows.scoreNode;
import static io.flowcraft.core.test.TestWorkflows.spec;
import static io.flowcraft.core.workflow.EdgeDeclaration.END;
import static io.flowcraft.core.workflow.EdgeDeclaration.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.flowcraft.core.capability.InMemoryPersistence;
import io.flowcraft.core.capability.PermanentCapabilityException;
import io.flowcraft.core.capability.SafetyException;
import io.flowcraft.core.capability.SandboxCapability;
import io.flowcraft.core.capability.SandboxLimits;
import io.flowcraft.core.capability.SandboxResult;
import io.flowcraft.core.capability.StubLlmCapability;
import io.flowcraft.core.capability.TokenUsage;
import io.flowcraft.core.capability.TransientCapabilityException;
import io.flowcraft.core.compiler.CompiledGraph;
import io.flowcraft.core.compiler.GraphCompiler;
import io.flowcraft.core.profiling.CostAggregator;
import io.flowcraft.core.profiling.DefaultPricingTable;
import io.flowcraft.core.profiling.Profiler;
import io.flowcraft.core.state.StateContainer;
import io.flowcraft.core.template.PathTemplateResolver;
import io.flowcraft.core.tool.DefaultToolRegistry;
import io.flowcraft.core.tool.ToolDefinition;
import io.flowcraft.core.workflow.CodeBlock;
import io.flowcraft.core.workflow.EdgeDeclaration.Linear;
import io.flowcraft.core.workflow.ExecutionDefaults;
import io.flowcraft.core.workflow.LlmConfig;
import io.flowcraft.core.workflow.NodeDeclaration;
import io.flowcraft.core.workflow.OutputDeclaration;
import io.flowcraft.core.workflow.ToolRef;
import io.flowcraft.core.workflow.WorkflowSpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("NodeExecutor")
class NodeExecutorTest {

    @Mock private SandboxCapability sandbox;

    private StubLlmCapability llm;
    private DefaultToolRegistry tools;
    private List<Duration> sleeps;
    private List<Integer> retries;
    private NodeExecutor executor;
    private InMemoryPersistence persistence;

    @BeforeEach
    void setUp() {
        llm = new StubLlmCapability();
        tools = new DefaultToolRegistry();
        sleeps = new ArrayList<>();
        retries = new ArrayList<>();
        persistence = new InMemoryPersistence();
        executor =
                new NodeExecutor(llm, tools, sandbox, new PathTemplateResolver(), sleeps::add);
    }

    private CompiledGraph graph(NodeDeclaration node, ExecutionDefaults defaults, LlmConfig llmConfig) {
        WorkflowSpec.Builder builder =
                spec("single")
                        .node(node)
                        .edge(new Linear(START, node.getId()))
                        .edge(new Linear(node.getId(), END))
                        .execution(defaults);
        if (llmConfig != null) {
            builder.llm(llmConfig);
        }
        return new GraphCompiler().compile(builder.build());
    }

    private CompiledGraph graph(NodeDeclaration node) {
        return graph(node, ExecutionDefaults.DEFAULT, null);
    }

    private RunContext context(CompiledGraph graph) {
        var pricing = new DefaultPricingTable(Map.of("gpt-4o", new DefaultPricingTable.Price(1.0, 2.0)));
        return new RunContext(
                "run-1",
                graph,
                new ExecutionListener() {
                    @Override
                    public void onRetry(String runId, String nodeId, int attempt, Throwable cause) {
                        retries.add(attempt);
                    }
                },
                new Profiler(),
                new CostAggregator(pricing),
                persistence,
                Clock.systemUTC());
    }

    private Map<String, Object> execute(CompiledGraph graph, RunContext context) {
        StateContainer state = graph.getStateSchema().create(Map.of("topic", "tides"));
        return executor.execute(graph.node(graph.getEntry()), state, context);
    }

    @Test
    @DisplayName("maps a validated result onto state and records one success")
    void shouldExecuteNode() {
        var graph = graph(scoreNode("rate"));
        var context = context(graph);
        llm.respond("rate", Map.of("result", 8));

        var updates = execute(graph, context);

        assertThat(updates).containsExactly(Map.entry("score", 8L));
        assertThat(llm.requests("rate")).singleElement()
                .satisfies(r -> assertThat(r.prompt()).isEqualTo("Rate tides"));
        assertThat(context.records()).singleElement()
                .satisfies(
                        record -> {
                            assertThat(record.succeeded()).isTrue();
                            assertThat(record.attempts()).isEqualTo(1);
                            assertThat(record.usage().inputTokens()).isEqualTo(10);
                            assertThat(record.iteration()).isNull();
                        });
        assertThat(persistence.records("run-1")).hasSize(1);
    }

    @Nested
    @DisplayName("retries")
    class Retries {

        @Test
        @DisplayName("restate the schema after an invalid payload")
        void shouldClarifyAfterValidationFailure() {
            var graph = graph(scoreNode("rate"));
            var context = context(graph);
            llm.respond("rate", Map.of("result", "very good")).respond("rate", Map.of("result", 9));

            var updates = execute(graph, context);

            assertThat(updates).containsEntry("score", 9L);
            var requests = llm.requests("rate");
            assertThat(requests).hasSize(2);
            assertThat(requests.get(1).prompt())
                    .startsWith("Rate tides")
                    .contains("Your previous response was rejected")
                    .endsWith("{\"result\": \"int\"}");
            assertThat(requests.get(1).attempt()).isEqualTo(1);
            assertThat(sleeps).isEmpty();
            assertThat(retries).containsExactly(2);
            var record = context.records().get(0);
            assertThat(record.attempts()).isEqualTo(2);
            assertThat(record.usage().inputTokens()).isEqualTo(20);
        }

        @Test
        @DisplayName("back off exponentially after transient failures")
        void shouldBackOffOnTransientFailure() {
            var graph = graph(scoreNode("rate"));
            var context = context(graph);
            llm.fail("rate", new TransientCapabilityException("rate limited"))
                    .fail("rate", new TransientCapabilityException("rate limited"))
                    .respond("rate", Map.of("result", 3));

            execute(graph, context);

            assertThat(sleeps).containsExactly(Duration.ofMillis(500), Duration.ofMillis(1000));
            assertThat(retries).containsExactly(2, 3);
            assertThat(context.records()).singleElement()
                    .satisfies(r -> assertThat(r.attempts()).isEqualTo(3));
        }

        @Test
        @DisplayName("stop once the retry budget is spent")
        void shouldFailAfterExhaustingTransientRetries() {
            var graph = graph(scoreNode("rate"), ExecutionDefaults.DEFAULT.withMaxRetries(1), null);
            var context = context(graph);
            llm.fail("rate", new TransientCapabilityException("overloaded"))
                    .fail("rate", new TransientCapabilityException("overloaded"));

            assertThatThrownBy(() -> execute(graph, context))
                    .isInstanceOf(NodeExecutionException.class)
                    .satisfies(
                            e -> assertThat(((NodeExecutionException) e).getPhase())
                                    .isEqualTo(Phase.INVOKE));
            assertThat(context.records()).singleElement()
                    .satisfies(
                            r -> {
                                assertThat(r.attempts()).isEqualTo(2);
                                assertThat(r.failedPhase()).isEqualTo(Phase.INVOKE);
                                assertThat(r.error()).contains("overloaded");
                            });
        }

        @Test
        @DisplayName("report a validation failure when every payload is invalid")
        void shouldFailValidationAfterRetries() {
            var graph = graph(scoreNode("rate"), ExecutionDefaults.DEFAULT.withMaxRetries(2), null);
            var context = context(graph);
            llm.respondWith("rate", request -> Map.of("rating", 5));

            assertThatThrownBy(() -> execute(graph, context))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessageContaining("Node 'rate' failed during validate");
            assertThat(llm.requests("rate")).hasSize(3);
            assertThat(context.records()).singleElement()
                    .satisfies(r -> assertThat(r.failedPhase()).isEqualTo(Phase.VALIDATE));
        }

        @Test
        @DisplayName("never retry permanent failures")
        void shouldNotRetryPermanentFailure() {
            var graph = graph(scoreNode("rate"));
            var context = context(graph);
            llm.fail("rate", new PermanentCapabilityException("invalid api key"));

            assertThatThrownBy(() -> execute(graph, context))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasRootCauseMessage("invalid api key");
            assertThat(llm.requests()).hasSize(1);
            assertThat(sleeps).isEmpty();
            assertThat(context.records()).hasSize(1);
        }
    }

    @Test
    @DisplayName("fails in the resolve phase on a path that is missing at run time")
    void shouldFailOnUnresolvedTemplate() {
        var node =
                NodeDeclaration.builder("rate")
                        .prompt("Rate {topic.x}")
                        .output(OutputDeclaration.scalar("int"))
                        .outputs("score")
                        .build();
        var graph = graph(node);
        var context = context(graph);

        assertThatThrownBy(() -> execute(graph, context))
                .isInstanceOf(NodeExecutionException.class)
                .hasMessageContaining("failed during resolve")
                .hasMessageContaining("Did you mean 'topic'?");
        assertThat(llm.requests()).isEmpty();
        assertThat(context.records()).singleElement()
                .satisfies(
                        r -> {
                            assertThat(r.attempts()).isZero();
                            assertThat(r.failedPhase()).isEqualTo(Phase.RESOLVE);
                        });
    }

    @Test
    @DisplayName("resolves input mappings before the prompt")
    void shouldResolveInputs() {
        var node =
                NodeDeclaration.builder("rate")
                        .input("subject", "the {topic}")
                        .prompt("Rate {subject}")
                        .output(OutputDeclaration.scalar("int"))
                        .outputs("score")
                        .build();
        var graph = graph(node);

        execute(graph, context(graph));

        assertThat(llm.requests().get(0).prompt()).isEqualTo("Rate the tides");
    }

    @Nested
    @DisplayName("tools")
    class Tools {

        private NodeDeclaration nodeWithTool(ToolRef.OnError onError) {
            return NodeDeclaration.builder("rate")
                    .prompt("Rate {topic}")
                    .output(OutputDeclaration.scalar("int"))
                    .outputs("score")
                    .tool(new ToolRef("search", onError))
                    .build();
        }

        @Test
        @DisplayName("passes registered tools to the capability")
        void shouldPassRegisteredTools() {
            tools.register(ToolDefinition.simple("search", "web search"));
            var graph = graph(nodeWithTool(ToolRef.OnError.FAIL));

            execute(graph, context(graph));

            assertThat(llm.requests().get(0).tools())
                    .extracting(ToolDefinition::name)
                    .containsExactly("search");
        }

        @Test
        @DisplayName("fails when a required tool is missing")
        void shouldFailOnMissingTool() {
            var graph = graph(nodeWithTool(ToolRef.OnError.FAIL));
            var context = context(graph);

            assertThatThrownBy(() -> execute(graph, context))
                    .isInstanceOf(NodeExecutionException.class)
                    .satisfies(
                            e -> assertThat(((NodeExecutionException) e).getPhase())
                                    .isEqualTo(Phase.RESOLVE));
            assertThat(context.records()).hasSize(1);
        }

        @Test
        @DisplayName("continues without a missing optional tool")
        void shouldContinueWithoutOptionalTool() {
            var graph = graph(nodeWithTool(ToolRef.OnError.CONTINUE));

            execute(graph, context(graph));

            assertThat(llm.requests().get(0).tools()).isEmpty();
        }
    }

    @Nested
    @DisplayName("code blocks")
    class CodeBlocks {

        private final NodeDeclaration codeNode =
                NodeDeclaration.builder("compute")
                        .code(new CodeBlock("a = topic.upper()", SandboxLimits.DEFAULT))
                        .outputs("a")
                        .build();

        @Test
        @DisplayName("run in the sandbox with state bound")
        void shouldRunSandbox() throws Exception {
            when(sandbox.run(eq("a = topic.upper()"), anyMap(), eq(SandboxLimits.DEFAULT)))
                    .thenReturn(SandboxResult.success(Map.of("a", "TIDES"), Duration.ofMillis(3)));
            var graph = graph(codeNode);

            var updates = execute(graph, context(graph));

            assertThat(updates).containsExactly(Map.entry("a", "TIDES"));
            assertThat(llm.requests()).isEmpty();
            verify(sandbox)
                    .run(any(), argThat(bindings -> "tides".equals(bindings.get("topic"))), any());
        }

        @Test
        @DisplayName("fail in the sandbox phase when the code fails")
        void shouldFailOnSandboxError() throws Exception {
            when(sandbox.run(any(), anyMap(), any()))
                    .thenReturn(SandboxResult.failure("NameError: topc", Duration.ZERO));
            var graph = graph(codeNode);
            var context = context(graph);

            assertThatThrownBy(() -> execute(graph, context))
                    .isInstanceOf(NodeExecutionException.class)
                    .hasMessageContaining("failed during sandbox")
                    .hasMessageContaining("NameError");
            assertThat(context.records()).hasSize(1);
        }

        @Test
        @DisplayName("fail in the sandbox phase on a policy violation")
        void shouldFailOnSafetyViolation() throws Exception {
            when(sandbox.run(any(), anyMap(), any()))
                    .thenThrow(new SafetyException("import of os is not allowed", "import os"));
            var graph = graph(codeNode);

            assertThatThrownBy(() -> execute(graph, context(graph)))
                    .isInstanceOf(NodeExecutionException.class)
                    .satisfies(
                            e -> assertThat(((NodeExecutionException) e).getPhase())
                                    .isEqualTo(Phase.SANDBOX));
        }
    }

    @Nested
    @DisplayName("cost attribution")
    class Costs {

        @Test
        @DisplayName("prices calls with the node config merged over the workflow default")
        void shouldMergeNodeConfig() {
            var node =
                    NodeDeclaration.builder("rate")
                            .prompt("Rate {topic}")
                            .output(OutputDeclaration.scalar("int"))
                            .outputs("score")
                            .llm(new LlmConfig(null, "gpt-4o", 0.2, null, null))
                            .build();
            var graph =
                    graph(node, ExecutionDefaults.DEFAULT, LlmConfig.of("openai", "gpt-4o-mini"));
            var context = context(graph);

            execute(graph, context);

            var config = llm.requests().get(0).config();
            assertThat(config.provider()).isEqualTo("openai");
            assertThat(config.model()).isEqualTo("gpt-4o");
            assertThat(config.temperature()).isEqualTo(0.2);
            var record = context.records().get(0);
            assertThat(record.provider()).isEqualTo("openai");
            assertThat(record.cost()).isCloseTo(0.05, within(1e-9));
        }

        @Test
        @DisplayName("books unconfigured calls to the unknown bucket at zero cost")
        void shouldUseUnknownBucket() {
            var graph = graph(scoreNode("rate"));
            var context = context(graph);

            execute(graph, context);

            var record = context.records().get(0);
            assertThat(record.provider()).isEqualTo("unknown");
            assertThat(record.cost()).isZero();
            assertThat(context.getCosts().report().byProvider()).containsEntry("unknown", 0.0);
        }
    }

    @Test
    @DisplayName("commits nothing when the run is already cancelled")
    void shouldNotRecordCancelledNode() {
        var graph = graph(scoreNode("rate"));
        var context = context(graph);
        context.cancel();

        assertThatThrownBy(() -> execute(graph, context)).isInstanceOf(RunCancelledException.class);
        assertThat(context.records()).isEmpty();
        assertThat(llm.requests()).isEmpty();
    }

    @Test
    @DisplayName("records a zero-cost success when pricing fails")
    void shouldRecordWhenPricingFails() {
        var graph =
                graph(scoreNode("rate"), ExecutionDefaults.DEFAULT, LlmConfig.of("openai", "gpt-4o"));
        var context =
                new RunContext(
                        "run-1",
                        graph,
                        ExecutionListener.NOOP,
                        new Profiler(),
                        new CostAggregator(
                                (provider, model, usage) -> {
                                    throw new IllegalStateException("pricing down");
                                }),
                        persistence,
                        Clock.systemUTC());
        llm.respond("rate", Map.of("result", 7));

        var updates = execute(graph, context);

        assertThat(updates).containsEntry("score", 7L);
        var record = context.records().get(0);
        assertThat(context.records()).hasSize(1);
        assertThat(record.succeeded()).isTrue();
        assertThat(record.provider()).isEqualTo("openai");
        assertThat(record.cost()).isZero();
        assertThat(context.getCosts().report().callCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("drops the record when the run is cancelled during a call that ignores interrupts")
    void shouldNotRecordNodeCancelledMidCall() {
        var graph = graph(scoreNode("rate"));
        var context = context(graph);
        llm.respondWith(
                "rate",
                request -> {
                    context.cancel();
                    return Map.of("result", 7);
                });

        assertThatThrownBy(() -> execute(graph, context)).isInstanceOf(RunCancelledException.class);
        assertThat(context.records()).isEmpty();
        assertThat(context.getCosts().report().callCount()).isZero();
        assertThat(persistence.records("run-1")).isEmpty();
    }

    @Test
    @DisplayName("refuses commits once cancellation was requested")
    void shouldRefuseCommitAfterCancel() {
        var graph = graph(scoreNode("rate"));
        var context = context(graph);
        var cost = context.getCosts().price(null, null, TokenUsage.ZERO);
        var now = Instant.now();
        var record =
                new ExecutionRecord(
                        "run-1",
                        "rate",
                        now,
                        now,
                        Duration.ZERO,
                        TokenUsage.ZERO,
                        0.0,
                        "unknown",
                        "",
                        null,
                        1,
                        null,
                        null);

        context.cancel();

        assertThat(context.commit(record, cost)).isFalse();
        assertThat(context.records()).isEmpty();
    }
}
