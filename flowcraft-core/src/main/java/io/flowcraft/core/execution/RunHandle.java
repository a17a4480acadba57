package io.flowcraft.core.execution;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/// Handle to an asynchronous run.
///
/// {@snippet :
/// RunHandle handle = engine.submit(graph, Map.of("topic", "A"));
/// ExecutionResult result = handle.await(Duration.ofSeconds(30));
/// if (result instanceof ExecutionResult.Pending) {
///     handle.cancel();
/// }
/// }
///
/// @implNote Thread-safe. Waiting never affects the run.
public final class RunHandle {

    private final RunContext context;
    private final CompletableFuture<ExecutionResult> outcome;
    private final ExecutionEngine engine;
    private volatile Future<?> task;

    RunHandle(RunContext context, CompletableFuture<ExecutionResult> outcome, ExecutionEngine engine) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    public String runId() {
        return context.getRunId();
    }

    public RunStatus status() {
        return context.getStatus();
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    /// Returns the records committed so far.
    public List<ExecutionRecord> records() {
        return context.records();
    }

    /// Blocks until the run ends.
    ///
    /// @return terminal result, never {@link ExecutionResult.Pending}
    /// @throws InterruptedException if the waiting thread is interrupted
    public ExecutionResult await() throws InterruptedException {
        try {
            return outcome.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId() + " ended abnormally", e.getCause());
        }
    }

    /// Blocks until the run ends or the timeout elapses.
    ///
    /// @param timeout longest wait, not null
    /// @return terminal result, or {@link ExecutionResult.Pending} holding this handle
    /// @throws InterruptedException if the waiting thread is interrupted
    public ExecutionResult await(Duration timeout) throws InterruptedException {
        try {
            return outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return new ExecutionResult.Pending(this);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Run " + runId() + " ended abnormally", e.getCause());
        }
    }

    /// Cancels the run and every outstanding branch.
    ///
    /// @return false if the run had already ended or been cancelled
    public boolean cancel() {
        return engine.cancel(runId());
    }

    RunContext context() {
        return context;
    }

    CompletableFuture<ExecutionResult> outcome() {
        return outcome;
    }

    Future<?> task() {
        return task;
    }

    void task(Future<?> task) {
        this.task = task;
    }
}
