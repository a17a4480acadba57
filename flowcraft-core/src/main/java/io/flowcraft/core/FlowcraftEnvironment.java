package io.flowcraft.core;

import io.flowcraft.core.capability.LlmCapability;
import io.flowcraft.core.capability.PersistenceCapability;
import io.flowcraft.core.execution.ExecutionEngine;
import io.flowcraft.core.tool.ToolRegistry;
import java.util.concurrent.ExecutorService;

/// Container holding the wired engine and the capabilities behind it.
///
/// ### Contracts
/// - **Postcondition**: getters return the instances passed to the constructor
/// - **Invariant**: component references never change after construction
///
/// @apiNote Create instances through {@link FlowcraftFactory}.
///
/// @see FlowcraftFactory#createEnvironment()
public final class FlowcraftEnvironment implements AutoCloseable {

    private final FlowcraftConfig config;
    private final ExecutionEngine engine;
    private final LlmCapability llm;
    private final ToolRegistry toolRegistry;
    private final PersistenceCapability persistence;
    private final ExecutorService runExecutor;
    private final ExecutorService branchExecutor;

    public FlowcraftEnvironment(
            FlowcraftConfig config,
            ExecutionEngine engine,
            LlmCapability llm,
            ToolRegistry toolRegistry,
            PersistenceCapability persistence,
            ExecutorService runExecutor,
            ExecutorService branchExecutor) {
        this.config = config;
        this.engine = engine;
        this.llm = llm;
        this.toolRegistry = toolRegistry;
        this.persistence = persistence;
        this.runExecutor = runExecutor;
        this.branchExecutor = branchExecutor;
    }

    public FlowcraftConfig getConfig() {
        return config;
    }

    public ExecutionEngine getEngine() {
        return engine;
    }

    public LlmCapability getLlm() {
        return llm;
    }

    /// Returns the registry nodes acquire their tools from.
    public ToolRegistry getToolRegistry() {
        return toolRegistry;
    }

    public PersistenceCapability getPersistence() {
        return persistence;
    }

    /// Shuts down both thread pools.
    ///
    /// @implNote Calls `ExecutorService.shutdown()`, which does not block.
    /// Runs already submitted continue to completion.
    @Override
    public void close() {
        runExecutor.shutdown();
        branchExecutor.shutdown();
    }
}
