package io.flowcraft.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowcraft.adapter.langchain4j.LangChain4jLlmCapability;
import io.flowcraft.cli.execution.VerboseExecutionListener;
import io.flowcraft.cli.ui.AnsiStyles;
import io.flowcraft.core.FlowcraftConfig;
import io.flowcraft.core.FlowcraftEnvironment;
import io.flowcraft.core.FlowcraftFactory;
import io.flowcraft.core.compiler.CompiledGraph;
import io.flowcraft.core.compiler.GraphStructureException;
import io.flowcraft.core.execution.ExecutionEngine;
import io.flowcraft.core.execution.ExecutionListener;
import io.flowcraft.core.execution.ExecutionResult;
import io.flowcraft.core.profiling.BottleneckSummary;
import io.flowcraft.core.profiling.NodeTimings;
import io.flowcraft.core.state.SchemaBuildException;
import io.flowcraft.core.state.StateValidationException;
import io.flowcraft.core.workflow.WorkflowSpec;
import io.flowcraft.serialization.ExecutionReportWriter;
import io.flowcraft.serialization.WorkflowParseException;
import io.flowcraft.serialization.WorkflowParser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Runs a workflow document and prints its outcome.
///
/// ### Usage
/// ```bash
/// flowcraft run workflows/article.yaml -i topic=tides --profile
/// flowcraft run workflows/article.yaml -c inputs.json --timeout 30 --json
/// ```
///
/// Input values given with `-i` are read as JSON when they parse (`5`,
/// `true`, `["a","b"]`) and as plain strings otherwise. `-i` values override
/// keys from `-c`.
///
/// A run still going when the wait ends is cancelled; the command then
/// reports the records committed before cancellation took effect.
///
/// @see VerboseExecutionListener for `--verbose` output
@Command(name = "run", description = "Run a workflow")
public class WorkflowRunCommand extends WorkflowCommand {

    private static final int MAX_VALUE_WIDTH = 120;

    @Option(
            names = {"-i", "--input"},
            description = "Initial state value as key=value")
    private Map<String, String> inputs = new LinkedHashMap<>();

    @Option(
            names = {"-c", "--context"},
            description = "Initial state as a JSON object or a path to a JSON/YAML file")
    private String contextInput;

    @Option(
            names = {"--timeout"},
            description = "Seconds to wait before cancelling (default: the workflow's timeout)")
    private Long timeoutSeconds;

    @Option(
            names = {"--stub"},
            description = "Answer every LLM call with the offline stub")
    private boolean stub;

    @Option(
            names = {"-v", "--verbose"},
            description = "Print node progress")
    private boolean verbose;

    @Option(
            names = {"--profile"},
            description = "Print timing, bottleneck and cost report")
    private boolean profile;

    @Option(
            names = {"--threshold"},
            description = "Share of total time above which a node is a bottleneck (default: 50)")
    private Double threshold;

    @Option(
            names = {"--json"},
            description = "Print the result and reports as JSON")
    private boolean json;

    @Override
    protected int execute() {
        AnsiStyles styles = styles();

        WorkflowSpec workflow;
        Map<String, Object> initial;
        try {
            workflow = loadWorkflow();
            initial = loadInputs();
        } catch (IOException e) {
            err().printf("%s Cannot read input: %s%n", styles.crossmark(), e.getMessage());
            return EXIT_USAGE;
        } catch (WorkflowParseException e) {
            err().printf(
                    "%s %s %s%n",
                    styles.crossmark(),
                    styles.bold("Invalid workflow:"),
                    e.getMessage());
            return EXIT_USAGE;
        }

        FlowcraftConfig.Builder config = FlowcraftConfig.builder().stubMode(stub);
        if (timeoutSeconds != null) config.syncTimeout(Duration.ofSeconds(timeoutSeconds));
        if (threshold != null) config.bottleneckThreshold(threshold);

        try (FlowcraftEnvironment environment = createEnvironment(config.build())) {
            ExecutionEngine engine = environment.getEngine();
            CompiledGraph graph = engine.compile(workflow);

            if (!json) {
                String llm = environment.getConfig().isStubMode() ? "stub" : "langchain4j";
                out().printf(
                        "%s %s%n",
                        styles.checkmark(),
                        styles.bold("Workflow loaded: " + workflow.getName()));
                out().printf(
                        "  %s%n%n",
                        styles.gray(
                                "Nodes: "
                                        + graph.getNodes().size()
                                        + " "
                                        + styles.bullet()
                                        + " LLM: "
                                        + llm));
            }

            Duration timeout = environment.getConfig().getSyncTimeout();
            if (timeout == null) {
                timeout = graph.getExecutionDefaults().timeout();
            }
            ExecutionListener listener =
                    verbose ? new VerboseExecutionListener(out(), color) : ExecutionListener.NOOP;

            ExecutionResult result = engine.execute(graph, initial, timeout, listener);
            if (result instanceof ExecutionResult.Pending pending) {
                err().printf(
                        "%s Run %s still running after %ds, cancelling%n",
                        styles.warn("!"), pending.runId(), timeout.toSeconds());
                pending.handle().cancel();
                result = pending.handle().await();
            }

            if (json) {
                out().println(ExecutionReportWriter.toJson(result));
            } else {
                printResult(styles, result);
            }
            if (profile) {
                BottleneckSummary summary = engine.bottlenecks(result.runId());
                if (json) {
                    out().println(ExecutionReportWriter.toJson(summary));
                } else {
                    printProfile(styles, summary);
                }
            }
            engine.forget(result.runId());
            out().flush();
            return result instanceof ExecutionResult.Completed ? EXIT_OK : EXIT_FAILED;
        } catch (SchemaBuildException | StateValidationException e) {
            err().printf(
                    "%s %s %s%n",
                    styles.crossmark(),
                    styles.bold("Invalid inputs:"),
                    e.getMessage());
            return EXIT_USAGE;
        } catch (GraphStructureException e) {
            err().printf(
                    "%s %s %s%n",
                    styles.crossmark(),
                    styles.bold("Invalid workflow:"),
                    e.getMessage());
            return EXIT_USAGE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err().printf("%s Interrupted%n", styles.crossmark());
            return EXIT_FAILED;
        }
    }

    /// Wires the environment; LLM calls go through LangChain4j unless `--stub` is set.
    protected FlowcraftEnvironment createEnvironment(FlowcraftConfig config) {
        FlowcraftFactory.Builder builder = FlowcraftFactory.builder().config(config);
        if (!config.isStubMode()) {
            builder.llm(
                    new LangChain4jLlmCapability(FlowcraftFactory.loadCredentialsFromEnvironment()));
        }
        return builder.build();
    }

    Map<String, Object> loadInputs() throws IOException {
        Map<String, Object> values = new LinkedHashMap<>();
        if (contextInput != null && !contextInput.isBlank()) {
            values.putAll(readContext(contextInput.trim()));
        }
        ObjectMapper mapper = WorkflowParser.createMapper();
        inputs.forEach((key, value) -> values.put(key, parseValue(mapper, value)));
        return values;
    }

    private static Map<String, Object> readContext(String input) throws IOException {
        var type = new TypeReference<Map<String, Object>>() {};
        if (input.startsWith("{")) {
            return WorkflowParser.createMapper().readValue(input, type);
        }
        Path path = Path.of(input);
        String content = Files.readString(path);
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper =
                name.endsWith(".yaml") || name.endsWith(".yml")
                        ? WorkflowParser.createYamlMapper()
                        : WorkflowParser.createMapper();
        return mapper.readValue(content, type);
    }

    private static Object parseValue(ObjectMapper mapper, String raw) {
        try {
            return mapper.readValue(raw, Object.class);
        } catch (JsonProcessingException e) {
            return raw;
        }
    }

    private void printResult(AnsiStyles styles, ExecutionResult result) {
        if (result instanceof ExecutionResult.Completed completed) {
            out().printf(
                    "%n%s %s%n", styles.checkmark(), styles.bold("Workflow completed successfully!"));
            out().printf(
                    "  Run: %s %s Node runs: %d%n",
                    completed.runId(), styles.bullet(), completed.records().size());
            out().printf("%n%s%n", styles.bold("  Final state:"));
            completed
                    .finalState()
                    .asMap()
                    .forEach(
                            (key, value) ->
                                    out().printf(
                                                    "  %s %s%n",
                                                    styles.accent(key + ":"),
                                                    abbreviate(String.valueOf(value))));
        } else if (result instanceof ExecutionResult.Failure failure) {
            out().printf(
                    "%n%s %s %s%n",
                    styles.crossmark(),
                    styles.bold("Workflow failed:"),
                    failure.error().getMessage());
            out().printf(
                    "  Run: %s %s Node runs: %d%n",
                    failure.runId(), styles.bullet(), failure.records().size());
        } else if (result instanceof ExecutionResult.Cancelled cancelled) {
            out().printf("%n%s %s%n", styles.warn("!"), styles.bold("Workflow cancelled"));
            out().printf(
                    "  Run: %s %s Node runs: %d%n",
                    cancelled.runId(), styles.bullet(), cancelled.records().size());
        }
    }

    private void printProfile(AnsiStyles styles, BottleneckSummary summary) {
        long totalMs = summary.totalTime().toMillis();
        out().printf(
                "%n%s%n",
                styles.bold(
                        "  Profile (total "
                                + totalMs
                                + " ms, threshold "
                                + summary.thresholdPercent()
                                + "%)"));
        for (NodeTimings timings : summary.nodes()) {
            double share = totalMs > 0 ? 100.0 * timings.total().toMillis() / totalMs : 0.0;
            boolean flagged = summary.bottleneckIds().contains(timings.nodeId());
            out().printf(
                    "  %-24s %8d ms %6.2f%% %4d call(s)  $%.4f%s%n",
                    timings.nodeId(),
                    timings.total().toMillis(),
                    share,
                    timings.callCount(),
                    timings.cost(),
                    flagged ? "  " + styles.bottleneckTag() : "");
        }
        out().printf(
                "  %s $%.4f over %d call(s)%n",
                styles.bold("Cost:"), summary.costs().totalCost(), summary.costs().callCount());
        summary.costs()
                .byModel()
                .forEach((model, cost) -> out().printf("    %-30s $%.4f%n", model, cost));
    }

    private static String abbreviate(String text) {
        String oneLine = text.replace('\n', ' ');
        return oneLine.length() > MAX_VALUE_WIDTH
                ? oneLine.substring(0, MAX_VALUE_WIDTH) + "..."
                : oneLine;
    }
}
