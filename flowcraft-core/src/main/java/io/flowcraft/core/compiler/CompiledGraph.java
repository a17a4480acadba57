package io.flowcraft.core.compiler;

import io.flowcraft.core.state.StateSchema;
import io.flowcraft.core.workflow.EdgeDeclaration;
import io.flowcraft.core.workflow.ExecutionDefaults;
import io.flowcraft.core.workflow.LlmConfig;
import io.flowcraft.core.workflow.WorkflowSpec;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Validated, executable form of a {@link WorkflowSpec}.
///
/// ### Contracts
/// - **Invariant**: exactly one entry edge, leaving `START`
/// - **Invariant**: every node is reachable from the entry and can reach a terminal
/// - **Invariant**: cycles only pass through {@link Transition.Loop} back-edges
/// - **Invariant**: sibling fan-out branches write disjoint state fields
///
/// Fan-out branch nodes carry no transition of their own; the engine joins
/// them at the fan-out's join node.
///
/// @implNote Immutable and thread-safe. One compiled graph may back many
/// concurrent runs.
///
/// @see GraphCompiler#compile(WorkflowSpec)
public final class CompiledGraph {

    private final WorkflowSpec spec;
    private final StateSchema stateSchema;
    private final String entry;
    private final Map<String, CompiledNode> nodes;
    private final Map<String, Transition> transitions;
    private final Set<String> branchNodes;
    private final Map<String, String> loopBodies;

    CompiledGraph(
            WorkflowSpec spec,
            StateSchema stateSchema,
            String entry,
            Map<String, CompiledNode> nodes,
            Map<String, Transition> transitions,
            Set<String> branchNodes,
            Map<String, String> loopBodies) {
        this.spec = spec;
        this.stateSchema = stateSchema;
        this.entry = entry;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.transitions = Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
        this.branchNodes = Set.copyOf(branchNodes);
        this.loopBodies = Map.copyOf(loopBodies);
    }

    public String getName() {
        return spec.getName();
    }

    public WorkflowSpec getSpec() {
        return spec;
    }

    public StateSchema getStateSchema() {
        return stateSchema;
    }

    /// Returns the id of the first node to run, or `START` when the run opens
    /// with a fan-out.
    public String getEntry() {
        return entry;
    }

    public Map<String, CompiledNode> getNodes() {
        return nodes;
    }

    /// Returns a node by id.
    ///
    /// @throws IllegalArgumentException if the id is unknown
    public CompiledNode node(String id) {
        CompiledNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + id);
        }
        return node;
    }

    /// Returns the transition leaving a node, or null for fan-out branch nodes.
    ///
    /// `START` always has a transition.
    public Transition transition(String nodeId) {
        return transitions.get(nodeId);
    }

    public boolean isBranchNode(String nodeId) {
        return branchNodes.contains(nodeId);
    }

    /// Returns the id of the innermost loop whose body contains the node.
    ///
    /// @param nodeId the node, not null
    /// @return loop id (the loop's last node), or empty outside loops
    public Optional<String> enclosingLoop(String nodeId) {
        return Optional.ofNullable(loopBodies.get(nodeId));
    }

    public LlmConfig getLlmDefaults() {
        return spec.getLlm();
    }

    public ExecutionDefaults getExecutionDefaults() {
        return spec.getExecution();
    }

    /// Returns whether `nodeId` is the reserved terminal marker.
    public static boolean isTerminal(String nodeId) {
        return Objects.equals(nodeId, EdgeDeclaration.END);
    }
}
