package io.flowcraft.core.execution;

import io.flowcraft.core.capability.PersistenceCapability;
import io.flowcraft.core.capability.PricingCapability;
import io.flowcraft.core.compiler.CompiledGraph;
import io.flowcraft.core.compiler.GraphCompiler;
import io.flowcraft.core.compiler.Transition;
import io.flowcraft.core.expression.ExpressionException;
import io.flowcraft.core.profiling.BottleneckSummary;
import io.flowcraft.core.profiling.CostAggregator;
import io.flowcraft.core.profiling.Profiler;
import io.flowcraft.core.state.StateContainer;
import io.flowcraft.core.workflow.EdgeDeclaration;
import io.flowcraft.core.workflow.WorkflowSpec;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Drives compiled graphs from `START` to `END`.
///
/// Each run gets its own {@link RunContext}; traversal runs on the run
/// executor and parallel branches on the separate branch executor, so a run
/// waiting at a join never starves its own branches.
///
/// ### Traversal
/// - Linear and conditional transitions run on the traversal thread, one node
///   after another; node N+1 starts only after node N's updates are committed
/// - Loops count passes in engine-private counters; reaching `max_iterations`
///   exits normally
/// - A fan-out submits each branch against the same immutable snapshot, then
///   waits for every branch before merging their disjoint updates and moving
///   to the join node
///
/// ### Failure Semantics
/// A failing branch does not cancel its siblings. The join barrier still waits
/// for all of them, then the run fails with the first branch failure; the
/// other failures are attached as suppressed exceptions.
///
/// ### Contracts
/// - **Postcondition**: every started run ends in exactly one of COMPLETED,
///   FAILED or CANCELLED
/// - **Invariant**: a synchronous timeout never aborts the run
///
/// @implNote Thread-safe. One engine serves any number of concurrent runs.
///
/// @see NodeExecutor for per-node semantics
/// @see GraphCompiler for the structural guarantees traversal relies on
public class ExecutionEngine {

    private static final Logger logger = Logger.getLogger(ExecutionEngine.class.getName());

    private final GraphCompiler compiler;
    private final NodeExecutor nodeExecutor;
    private final ExecutorService runExecutor;
    private final ExecutorService branchExecutor;
    private final PricingCapability pricing;
    private final PersistenceCapability persistence;
    private final Clock clock;
    private final double defaultThreshold;
    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();

    /// Creates an engine.
    ///
    /// @param compiler graph compiler, not null
    /// @param nodeExecutor node executor, not null
    /// @param runExecutor pool running traversals, not null
    /// @param branchExecutor pool running fan-out branches, not null; must differ
    ///     from `runExecutor` when that pool is bounded
    /// @param pricing pricing capability for cost entries, not null
    /// @param persistence record sink, may be null for none
    /// @param clock clock for record timestamps, not null
    /// @param defaultThreshold bottleneck share in percent used when none is given
    public ExecutionEngine(
            GraphCompiler compiler,
            NodeExecutor nodeExecutor,
            ExecutorService runExecutor,
            ExecutorService branchExecutor,
            PricingCapability pricing,
            PersistenceCapability persistence,
            Clock clock,
            double defaultThreshold) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.nodeExecutor = Objects.requireNonNull(nodeExecutor, "nodeExecutor must not be null");
        this.runExecutor = Objects.requireNonNull(runExecutor, "runExecutor must not be null");
        this.branchExecutor =
                Objects.requireNonNull(branchExecutor, "branchExecutor must not be null");
        this.pricing = Objects.requireNonNull(pricing, "pricing must not be null");
        this.persistence = persistence != null ? persistence : PersistenceCapability.NOOP;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultThreshold = defaultThreshold;
    }

    /// Compiles a workflow.
    ///
    /// @throws io.flowcraft.core.state.SchemaBuildException for malformed declarations
    /// @throws io.flowcraft.core.compiler.GraphStructureException for structural violations
    public CompiledGraph compile(WorkflowSpec spec) {
        return compiler.compile(spec);
    }

    /// Runs a graph and waits up to the workflow's default timeout.
    ///
    /// @see #execute(CompiledGraph, Map, Duration, ExecutionListener)
    public ExecutionResult execute(CompiledGraph graph, Map<String, ?> inputs)
            throws InterruptedException {
        return execute(graph, inputs, graph.getExecutionDefaults().timeout(), ExecutionListener.NOOP);
    }

    /// Runs a graph and waits up to `timeout` for it to end.
    ///
    /// @param graph compiled graph, not null
    /// @param inputs caller inputs for the initial state, not null
    /// @param timeout longest wait, not null
    /// @param listener lifecycle listener, may be null
    /// @return terminal result, or {@link ExecutionResult.Pending} when the wait
    ///     timed out; the run keeps going in that case
    /// @throws io.flowcraft.core.state.StateValidationException if the inputs do not fit the state
    /// @throws InterruptedException if the caller is interrupted while waiting
    public ExecutionResult execute(
            CompiledGraph graph,
            Map<String, ?> inputs,
            Duration timeout,
            ExecutionListener listener)
            throws InterruptedException {
        Objects.requireNonNull(timeout, "timeout must not be null");
        RunHandle handle = submit(graph, inputs, listener);
        ExecutionResult result = handle.await(timeout);
        if (result instanceof ExecutionResult.Pending) {
            logger.info(
                    "Run "
                            + handle.runId()
                            + " still running after "
                            + timeout.toMillis()
                            + "ms, returning a handle");
        }
        return result;
    }

    /// Starts a run in the background.
    public RunHandle submit(CompiledGraph graph, Map<String, ?> inputs) {
        return submit(graph, inputs, ExecutionListener.NOOP);
    }

    /// Starts a run in the background.
    ///
    /// The initial state is built before this method returns, so invalid
    /// inputs fail here rather than inside the run.
    ///
    /// @param graph compiled graph, not null
    /// @param inputs caller inputs for the initial state, not null
    /// @param listener lifecycle listener, may be null
    /// @return handle of the READY or RUNNING run, never null
    /// @throws io.flowcraft.core.state.StateValidationException if the inputs do not fit the state
    /// @throws io.flowcraft.core.state.SchemaBuildException if a required field is missing
    public RunHandle submit(
            CompiledGraph graph, Map<String, ?> inputs, ExecutionListener listener) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(inputs, "inputs must not be null");
        StateContainer initial = graph.getStateSchema().create(inputs);

        String runId = UUID.randomUUID().toString();
        RunContext context =
                new RunContext(
                        runId,
                        graph,
                        listener,
                        new Profiler(clock),
                        new CostAggregator(pricing),
                        persistence,
                        clock);
        CompletableFuture<ExecutionResult> outcome = new CompletableFuture<>();
        RunHandle handle = new RunHandle(context, outcome, this);
        runs.put(runId, handle);

        handle.task(runExecutor.submit(() -> outcome.complete(run(context, initial))));
        return handle;
    }

    /// Returns the status of a run.
    ///
    /// @throws RunNotFoundException for unknown ids
    public RunStatus status(String runId) {
        return handle(runId).status();
    }

    /// Returns the records a run has committed so far, in commit order.
    ///
    /// @throws RunNotFoundException for unknown ids
    public List<ExecutionRecord> trace(String runId) {
        return handle(runId).records();
    }

    /// Computes the bottleneck summary of a run with the default threshold.
    public BottleneckSummary bottlenecks(String runId) {
        return bottlenecks(runId, defaultThreshold);
    }

    /// Computes the bottleneck summary of a run and hands it to persistence.
    ///
    /// @param runId the run, not null
    /// @param thresholdPercent share of total time a node must strictly exceed
    /// @return summary over the records committed so far, never null
    /// @throws RunNotFoundException for unknown ids
    public BottleneckSummary bottlenecks(String runId, double thresholdPercent) {
        RunContext context = handle(runId).context();
        BottleneckSummary summary =
                context.getProfiler()
                        .summarize(runId, thresholdPercent, context.getCosts().report());
        try {
            persistence.appendSummary(runId, summary);
        } catch (RuntimeException e) {
            logger.warning("Persisting summary of run " + runId + " failed: " + e.getMessage());
        }
        return summary;
    }

    /// Cancels a run.
    ///
    /// @return false if the run had already ended or been cancelled
    /// @throws RunNotFoundException for unknown ids
    public boolean cancel(String runId) {
        RunHandle handle = handle(runId);
        RunContext context = handle.context();
        if (context.getStatus().isTerminal() || !context.cancel()) {
            return false;
        }
        logger.info("Cancelling run " + runId);
        if (context.abortIfReady()) {
            context.getListener().onRunComplete(runId, RunStatus.CANCELLED);
            handle.outcome().complete(new ExecutionResult.Cancelled(runId, context.records()));
        }
        Future<?> task = handle.task();
        if (task != null) {
            task.cancel(true);
        }
        return true;
    }

    /// Releases an ended run, after which its id is unknown to this engine.
    ///
    /// The engine keeps every run so that {@link #trace} and {@link #bottlenecks}
    /// stay available after it ends; callers release runs they no longer query.
    ///
    /// @return false if the run has not ended yet; it is kept then
    /// @throws RunNotFoundException for unknown ids
    public boolean forget(String runId) {
        RunHandle handle = handle(runId);
        if (!handle.status().isTerminal()) {
            return false;
        }
        runs.remove(runId, handle);
        logger.fine("Released run " + runId);
        return true;
    }

    private RunHandle handle(String runId) {
        RunHandle handle = runs.get(runId);
        if (handle == null) {
            throw new RunNotFoundException(runId);
        }
        return handle;
    }

    private ExecutionResult run(RunContext context, StateContainer initial) {
        String runId = context.getRunId();
        CompiledGraph graph = context.getGraph();
        ExecutionListener listener = context.getListener();
        if (!context.start()) {
            return new ExecutionResult.Cancelled(runId, context.records());
        }
        listener.onRunStart(runId, graph.getName());
        logger.info("Run " + runId + " of workflow '" + graph.getName() + "' started");

        StateContainer state = initial;
        String current = EdgeDeclaration.START;
        try {
            while (!CompiledGraph.isTerminal(current)) {
                context.checkCancelled();
                if (!EdgeDeclaration.START.equals(current)) {
                    Map<String, Object> updates =
                            nodeExecutor.execute(graph.node(current), state, context);
                    state = state.with(updates);
                }
                Transition transition = graph.transition(current);
                if (transition instanceof Transition.FanOut fanOut) {
                    state = fanOut(context, fanOut, state);
                    current = fanOut.join();
                } else {
                    current = next(context, current, transition, state);
                }
            }
        } catch (RunCancelledException e) {
            return cancelled(context);
        } catch (RuntimeException e) {
            if (context.isCancelled()) {
                return cancelled(context);
            }
            context.finish(RunStatus.FAILED);
            logger.severe("Run " + runId + " failed: " + e.getMessage());
            listener.onRunComplete(runId, RunStatus.FAILED);
            return new ExecutionResult.Failure(runId, e, state, context.records());
        }

        if (!context.finish(RunStatus.COMPLETED)) {
            return cancelled(context);
        }
        logger.info(
                "Run "
                        + runId
                        + " completed: "
                        + context.records().size()
                        + " node executions in "
                        + context.getProfiler().totalTime().toMillis()
                        + "ms");
        listener.onRunComplete(runId, RunStatus.COMPLETED);
        return new ExecutionResult.Completed(runId, state, context.records());
    }

    private ExecutionResult cancelled(RunContext context) {
        context.finish(RunStatus.CANCELLED);
        logger.info(
                "Run "
                        + context.getRunId()
                        + " cancelled with "
                        + context.records().size()
                        + " committed records");
        context.getListener().onRunComplete(context.getRunId(), RunStatus.CANCELLED);
        return new ExecutionResult.Cancelled(context.getRunId(), context.records());
    }

    private String next(
            RunContext context, String current, Transition transition, StateContainer state) {
        StateVariables variables = new StateVariables(state);
        try {
            if (transition instanceof Transition.Next next) {
                return next.target();
            }
            if (transition instanceof Transition.Branch branch) {
                for (Transition.Guarded route : branch.routes()) {
                    if (route.predicate().test(variables)) {
                        logger.fine(
                                "Node '"
                                        + current
                                        + "' routed to '"
                                        + route.target()
                                        + "' by "
                                        + route.predicate().source());
                        return route.target();
                    }
                }
                return branch.defaultTarget();
            }
            if (transition instanceof Transition.Loop loop) {
                int passes = context.completePass(loop.loopId());
                boolean satisfied = loop.until() != null && loop.until().test(variables);
                if (satisfied || passes >= loop.maxIterations()) {
                    context.resetLoop(loop.loopId());
                    logger.fine(
                            "Loop at '"
                                    + current
                                    + "' exits after "
                                    + passes
                                    + (satisfied ? " passes, condition met" : " passes, bound reached"));
                    return loop.exitTo();
                }
                return loop.reenter();
            }
        } catch (ExpressionException e) {
            throw new NodeExecutionException(current, Phase.RESOLVE, e);
        }
        throw new IllegalStateException("No transition from node '" + current + "'");
    }

    private StateContainer fanOut(
            RunContext context, Transition.FanOut fanOut, StateContainer snapshot) {
        CompiledGraph graph = context.getGraph();
        List<Future<Map<String, Object>>> futures = new ArrayList<>();
        for (String target : fanOut.targets()) {
            Future<Map<String, Object>> future =
                    branchExecutor.submit(
                            () -> nodeExecutor.execute(graph.node(target), snapshot, context));
            context.trackBranch(future);
            futures.add(future);
        }
        logger.fine(
                "Run "
                        + context.getRunId()
                        + " dispatched "
                        + futures.size()
                        + " branches, joining at '"
                        + fanOut.join()
                        + "'");

        Map<String, Object> merged = new LinkedHashMap<>();
        List<RuntimeException> failures = new ArrayList<>();
        boolean cancelled = false;
        for (int i = 0; i < futures.size(); i++) {
            Future<Map<String, Object>> future = futures.get(i);
            String target = fanOut.targets().get(i);
            try {
                merged.putAll(future.get());
            } catch (CancellationException e) {
                cancelled = true;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RunCancelledException) {
                    cancelled = true;
                } else if (cause instanceof RuntimeException runtime) {
                    logger.warning(
                            "Run "
                                    + context.getRunId()
                                    + ": branch '"
                                    + target
                                    + "' failed: "
                                    + cause.getMessage());
                    failures.add(runtime);
                } else {
                    failures.add(new NodeExecutionException(target, Phase.INVOKE, cause));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancel();
                throw new RunCancelledException(context.getRunId());
            } finally {
                context.untrackBranch(future);
            }
        }

        if (cancelled || context.isCancelled()) {
            throw new RunCancelledException(context.getRunId());
        }
        if (!failures.isEmpty()) {
            RuntimeException first = failures.get(0);
            failures.subList(1, failures.size()).forEach(first::addSuppressed);
            throw first;
        }
        return snapshot.with(merged);
    }
}
