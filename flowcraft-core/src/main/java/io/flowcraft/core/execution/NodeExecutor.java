package io.flowcraft.core.execution;

import io.flowcraft.core.capability.CapabilityException;
import io.flowcraft.core.capability.LlmCapability;
import io.flowcraft.core.capability.LlmRequest;
import io.flowcraft.core.capability.LlmResult;
import io.flowcraft.core.capability.SafetyException;
import io.flowcraft.core.capability.SandboxCapability;
import io.flowcraft.core.capability.SandboxResult;
import io.flowcraft.core.capability.TokenUsage;
import io.flowcraft.core.capability.TransientCapabilityException;
import io.flowcraft.core.compiler.CompiledGraph;
import io.flowcraft.core.compiler.CompiledNode;
import io.flowcraft.core.output.OutputModel;
import io.flowcraft.core.output.OutputValidationException;
import io.flowcraft.core.profiling.CostEntry;
import io.flowcraft.core.profiling.ProviderResolver;
import io.flowcraft.core.state.StateContainer;
import io.flowcraft.core.state.StateSchema;
import io.flowcraft.core.state.StateValidationException;
import io.flowcraft.core.template.TemplateResolutionException;
import io.flowcraft.core.template.TemplateResolver;
import io.flowcraft.core.tool.ToolDefinition;
import io.flowcraft.core.tool.ToolNotFoundException;
import io.flowcraft.core.tool.ToolRegistry;
import io.flowcraft.core.workflow.CodeBlock;
import io.flowcraft.core.workflow.ExecutionDefaults;
import io.flowcraft.core.workflow.LlmConfig;
import io.flowcraft.core.workflow.NodeDeclaration;
import io.flowcraft.core.workflow.ToolRef;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs one node against a state snapshot and returns its state updates.
///
/// ### Sequence
/// 1. Resolve the input mapping, then the prompt template
/// 2. Merge the node's LLM config over the workflow default
/// 3. Acquire declared tools from the registry
/// 4. Run the code block in the sandbox, when declared
/// 5. Invoke the LLM capability, when a prompt is declared, and validate the payload
/// 6. Map the validated result onto the node's `outputs`
///
/// ### Retry Policy
/// Output validation failures and transient capability failures are retried
/// up to `maxRetries` extra attempts. Validation retries restate the expected
/// schema in the prompt; transient retries back off exponentially. Permanent
/// failures end the node at once.
///
/// ### Contracts
/// - **Postcondition**: exactly one {@link ExecutionRecord} and one cost entry
///   per call, on success and on failure
/// - **Postcondition**: a call interrupted by run cancellation commits nothing
///   and throws {@link RunCancelledException}
///
/// @implNote Stateless and thread-safe; parallel branches share one instance.
public class NodeExecutor {

    private static final Logger logger = Logger.getLogger(NodeExecutor.class.getName());

    private final LlmCapability llm;
    private final ToolRegistry tools;
    private final SandboxCapability sandbox;
    private final TemplateResolver templateResolver;
    private final BackoffPolicy.Sleeper sleeper;

    /// Creates a node executor.
    ///
    /// @param llm LLM capability, not null
    /// @param tools tool registry, not null
    /// @param sandbox code sandbox, may be null when no node declares code
    /// @param templateResolver resolver for inputs and prompts, not null
    /// @param sleeper waits between transient retries, not null
    public NodeExecutor(
            LlmCapability llm,
            ToolRegistry tools,
            SandboxCapability sandbox,
            TemplateResolver templateResolver,
            BackoffPolicy.Sleeper sleeper) {
        this.llm = Objects.requireNonNull(llm, "llm must not be null");
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
        this.sandbox = sandbox;
        this.templateResolver =
                Objects.requireNonNull(templateResolver, "templateResolver must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /// Mutable bookkeeping for one call, folded into the record at the end.
    private static final class Attempt {
        Phase phase = Phase.RESOLVE;
        int attempts;
        TokenUsage usage = TokenUsage.ZERO;
        LlmConfig config;
    }

    /// Executes a node.
    ///
    /// @param node compiled node, not null
    /// @param state snapshot the node reads, not null; never modified
    /// @param context owning run, not null
    /// @return conformed state updates keyed by output field, never null
    /// @throws NodeExecutionException when the node fails
    /// @throws RunCancelledException when the run is cancelled mid-node
    public Map<String, Object> execute(CompiledNode node, StateContainer state, RunContext context) {
        context.checkCancelled();
        String runId = context.getRunId();
        String nodeId = node.id();
        CompiledGraph graph = context.getGraph();

        Attempt attempt = new Attempt();
        attempt.config = graph.getLlmDefaults();
        Instant startedAt = context.getClock().instant();
        long startNanos = System.nanoTime();
        Integer iteration = graph.enclosingLoop(nodeId).map(context::iteration).orElse(null);
        Map<String, Object> updates = null;
        NodeExecutionException failure = null;

        context.getListener().onNodeStart(runId, nodeId);
        logger.fine("Run " + runId + ": executing node '" + nodeId + "'");
        try {
            updates = run(node, state, context, attempt);
            context.checkCancelled();
        } catch (RunCancelledException e) {
            throw e;
        } catch (NodeExecutionException e) {
            if (context.isCancelled()) {
                throw new RunCancelledException(runId);
            }
            failure = e;
        } catch (TemplateResolutionException | ToolNotFoundException e) {
            failure = new NodeExecutionException(nodeId, Phase.RESOLVE, e);
        } catch (OutputValidationException | StateValidationException e) {
            failure = new NodeExecutionException(nodeId, Phase.VALIDATE, e);
        } catch (SafetyException e) {
            failure = new NodeExecutionException(nodeId, Phase.SANDBOX, e);
        } catch (CapabilityException | RuntimeException e) {
            if (context.isCancelled()) {
                throw new RunCancelledException(runId);
            }
            failure = new NodeExecutionException(nodeId, attempt.phase, e);
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        if (!commit(context, nodeId, startedAt, duration, iteration, attempt, failure)) {
            throw new RunCancelledException(runId);
        }
        if (failure != null) {
            throw failure;
        }
        return updates;
    }

    private Map<String, Object> run(
            CompiledNode node, StateContainer state, RunContext context, Attempt attempt)
            throws CapabilityException, ToolNotFoundException {
        NodeDeclaration declaration = node.declaration();
        CompiledGraph graph = context.getGraph();

        Map<String, Object> variables =
                new LinkedHashMap<>(templateResolver.resolveInputs(declaration.getInputs(), state));
        if (declaration.getLlm() != null) {
            attempt.config = declaration.getLlm().overriding(graph.getLlmDefaults());
        }
        List<ToolDefinition> toolDefinitions = acquireTools(context, declaration);

        Map<String, Object> updates = new LinkedHashMap<>();
        if (declaration.hasCode()) {
            attempt.phase = Phase.SANDBOX;
            Map<String, Object> produced =
                    runSandbox(declaration.getId(), declaration.getCode(), state, variables);
            attempt.phase = Phase.VALIDATE;
            for (String output : declaration.getOutputs()) {
                if (produced.containsKey(output)) {
                    updates.put(output, produced.get(output));
                }
            }
            produced.forEach(variables::putIfAbsent);
        }

        if (declaration.hasPrompt()) {
            attempt.phase = Phase.RESOLVE;
            String prompt = templateResolver.resolve(declaration.getPrompt(), variables, state);
            Map<String, Object> validated =
                    invoke(node, prompt, toolDefinitions, graph.getExecutionDefaults(), context, attempt);
            attempt.phase = Phase.VALIDATE;
            updates.putAll(node.outputModel().toStateUpdates(validated, declaration.getOutputs()));
        }

        attempt.phase = Phase.VALIDATE;
        StateSchema schema = graph.getStateSchema();
        Map<String, Object> conformed = new LinkedHashMap<>();
        updates.forEach((name, value) -> conformed.put(name, schema.conformField(name, value)));
        return Collections.unmodifiableMap(conformed);
    }

    private List<ToolDefinition> acquireTools(RunContext context, NodeDeclaration declaration)
            throws ToolNotFoundException {
        List<ToolDefinition> acquired = new ArrayList<>();
        for (ToolRef ref : declaration.getTools()) {
            try {
                acquired.add(tools.get(ref.name()));
            } catch (ToolNotFoundException e) {
                if (ref.onError() != ToolRef.OnError.CONTINUE) {
                    throw e;
                }
                logger.warning(
                        "Run "
                                + context.getRunId()
                                + ": node '"
                                + declaration.getId()
                                + "' continues without missing tool '"
                                + ref.name()
                                + "'");
            }
        }
        return acquired;
    }

    private Map<String, Object> runSandbox(
            String nodeId, CodeBlock code, StateContainer state, Map<String, Object> inputs)
            throws CapabilityException {
        if (sandbox == null) {
            throw new NodeExecutionException(
                    nodeId, Phase.SANDBOX, "no sandbox capability is configured");
        }
        Map<String, Object> bindings = new LinkedHashMap<>(state.asMap());
        bindings.putAll(inputs);
        SandboxResult result = sandbox.run(code.code(), bindings, code.limits());
        if (!result.success()) {
            throw new NodeExecutionException(
                    nodeId,
                    Phase.SANDBOX,
                    result.error() != null ? result.error() : "code block failed");
        }
        logger.fine(
                "Node '"
                        + nodeId
                        + "' ran code in "
                        + result.executionTime().toMillis()
                        + "ms, produced "
                        + result.output().keySet());
        return result.output();
    }

    private Map<String, Object> invoke(
            CompiledNode node,
            String basePrompt,
            List<ToolDefinition> toolDefinitions,
            ExecutionDefaults defaults,
            RunContext context,
            Attempt attempt)
            throws CapabilityException {
        String nodeId = node.id();
        OutputModel outputModel = node.outputModel();
        BackoffPolicy backoff = BackoffPolicy.from(defaults);
        String prompt = basePrompt;

        for (int i = 0; ; i++) {
            context.checkCancelled();
            attempt.phase = Phase.INVOKE;
            attempt.attempts = i + 1;
            LlmResult result;
            try {
                result =
                        llm.invoke(
                                new LlmRequest(
                                        nodeId,
                                        prompt,
                                        outputModel,
                                        toolDefinitions,
                                        attempt.config,
                                        i));
            } catch (TransientCapabilityException e) {
                if (i >= defaults.maxRetries()) {
                    throw e;
                }
                Duration delay = backoff.delay(i);
                logger.warning(
                        "Run "
                                + context.getRunId()
                                + ": node '"
                                + nodeId
                                + "' hit a transient failure ("
                                + e.getMessage()
                                + "), retrying in "
                                + delay.toMillis()
                                + "ms");
                context.getListener().onRetry(context.getRunId(), nodeId, i + 2, e);
                pause(context, delay);
                continue;
            }

            attempt.usage = attempt.usage.plus(result.usage());
            context.checkCancelled();
            attempt.phase = Phase.VALIDATE;
            try {
                return outputModel.validate(result.payload());
            } catch (OutputValidationException e) {
                if (i >= defaults.maxRetries()) {
                    throw e;
                }
                logger.warning(
                        "Run "
                                + context.getRunId()
                                + ": node '"
                                + nodeId
                                + "' returned an invalid payload ("
                                + e.getMessage()
                                + "), retrying with the schema restated");
                context.getListener().onRetry(context.getRunId(), nodeId, i + 2, e);
                prompt = clarify(basePrompt, outputModel, e);
            }
        }
    }

    private static String clarify(
            String basePrompt, OutputModel outputModel, OutputValidationException error) {
        return basePrompt
                + "\n\nYour previous response was rejected: "
                + error.getMessage()
                + "\nRespond with a JSON object matching exactly this schema: "
                + outputModel.describe();
    }

    private void pause(RunContext context, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException(context.getRunId());
        }
    }

    /// @return false if the run was cancelled before the record could be committed
    private boolean commit(
            RunContext context,
            String nodeId,
            Instant startedAt,
            Duration duration,
            Integer iteration,
            Attempt attempt,
            NodeExecutionException failure) {
        LlmConfig config = attempt.config != null ? attempt.config : LlmConfig.EMPTY;
        CostEntry cost = context.getCosts().price(config.provider(), config.model(), attempt.usage);
        ExecutionRecord record =
                new ExecutionRecord(
                        context.getRunId(),
                        nodeId,
                        startedAt,
                        startedAt.plus(duration),
                        duration,
                        attempt.usage,
                        cost.cost(),
                        cost.provider(),
                        cost.model(),
                        iteration,
                        attempt.attempts,
                        failure != null ? failure.getMessage() : null,
                        failure != null ? failure.getPhase() : null);
        if (!context.commit(record, cost)) {
            logger.fine(
                    "Run "
                            + context.getRunId()
                            + ": dropped the record of node '"
                            + nodeId
                            + "' after cancellation");
            return false;
        }
        if (failure != null) {
            logger.severe(failure.getMessage());
        } else {
            logger.fine(
                    "Run "
                            + context.getRunId()
                            + ": node '"
                            + nodeId
                            + "' completed in "
                            + duration.toMillis()
                            + "ms"
                            + (ProviderResolver.UNKNOWN.equals(cost.provider())
                                    ? ""
                                    : " via " + cost.provider()));
        }
        return true;
    }
}
