package io.flowcraft.core.compiler;

import io.flowcraft.core.expression.ExpressionException;
import io.flowcraft.core.expression.Predicate;
import io.flowcraft.core.output.OutputModel;
import io.flowcraft.core.output.OutputModelBuilder;
import io.flowcraft.core.state.ScalarKind;
import io.flowcraft.core.state.StateSchema;
import io.flowcraft.core.state.StateSchemaBuilder;
import io.flowcraft.core.state.TypeDescriptor;
import io.flowcraft.core.template.PathSuggester;
import io.flowcraft.core.template.PathTemplateResolver;
import io.flowcraft.core.workflow.EdgeDeclaration;
import io.flowcraft.core.workflow.NodeDeclaration;
import io.flowcraft.core.workflow.WorkflowSpec;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Compiles a {@link WorkflowSpec} into a validated {@link CompiledGraph}.
///
/// Every structural rule is checked here, once, so a run never discovers a
/// malformed graph halfway through.
///
/// ### Rules
/// - Node ids are unique and never the reserved `START`/`END`
/// - Prompt and input placeholders name a node input or a declared state field
/// - Exactly one edge leaves `START`, either linear or a parallel fan-out
/// - Each node has at most one outgoing edge; fan-out branch nodes have none
/// - Conditional routes declare a default and parse as predicates over state
/// - Loops bound their passes between 1 and 100, and the re-entry node leads back
///   to the loop's last node
/// - Sibling fan-out branches write disjoint state fields
/// - Every node is reachable from the entry and reaches `END`
/// - Cycles only pass through loop back-edges
///
/// @implNote Stateless and thread-safe.
///
/// @see CompiledGraph for the resulting invariants
public final class GraphCompiler {

    private static final Logger logger = Logger.getLogger(GraphCompiler.class.getName());

    static final int MAX_LOOP_ITERATIONS = 100;

    private static final String STATE_PREFIX = "state.";

    /// Compiles a workflow.
    ///
    /// @param spec the workflow, not null
    /// @return executable graph, never null
    /// @throws io.flowcraft.core.state.SchemaBuildException if state or output
    ///     declarations are malformed
    /// @throws GraphStructureException if the edges violate a structural rule
    public CompiledGraph compile(WorkflowSpec spec) {
        StateSchema schema = StateSchemaBuilder.build(spec.getState());
        Map<String, CompiledNode> nodes = compileNodes(spec, schema);

        Map<String, Transition> transitions = new LinkedHashMap<>();
        Map<String, EdgeDeclaration.ParallelFanOut> fanOuts = new HashMap<>();

        for (EdgeDeclaration edge : spec.getEdges()) {
            String source = edge.source();
            boolean entryEdge = EdgeDeclaration.START.equals(source);
            if (entryEdge) {
                if (!(edge instanceof EdgeDeclaration.Linear)
                        && !(edge instanceof EdgeDeclaration.ParallelFanOut)) {
                    throw new GraphStructureException(
                            "The entry edge must be linear or a parallel fan-out");
                }
                if (transitions.containsKey(source)) {
                    throw new GraphStructureException("Workflow declares more than one entry edge");
                }
            } else {
                requireNode(nodes, source, "edge source");
                if (transitions.containsKey(source)) {
                    throw new GraphStructureException(source, "declares more than one outgoing edge");
                }
            }
            transitions.put(source, compileEdge(edge, nodes, schema));
            if (edge instanceof EdgeDeclaration.ParallelFanOut fanOut) {
                fanOuts.put(source, fanOut);
            }
        }
        Transition start = transitions.get(EdgeDeclaration.START);
        if (start == null) {
            throw new GraphStructureException("Workflow declares no entry edge from START");
        }
        String entry =
                start instanceof Transition.Next next ? next.target() : EdgeDeclaration.START;

        Set<String> branchNodes = validateFanOuts(fanOuts, nodes, transitions);

        for (String nodeId : nodes.keySet()) {
            if (!transitions.containsKey(nodeId) && !branchNodes.contains(nodeId)) {
                throw new GraphStructureException(nodeId, "has no outgoing edge");
            }
        }

        Map<String, Set<String>> forward = forwardEdges(transitions, fanOuts);
        validateLoops(transitions, forward);
        validateReachability(EdgeDeclaration.START, nodes.keySet(), transitions, forward);
        validateAcyclic(EdgeDeclaration.START, forward);
        Map<String, String> loopBodies = loopBodies(transitions, forward);

        logger.fine(
                "Compiled workflow '"
                        + spec.getName()
                        + "' with "
                        + nodes.size()
                        + " nodes, entry '"
                        + entry
                        + "'");
        return new CompiledGraph(
                spec, schema, entry, nodes, transitions, branchNodes, loopBodies);
    }

    private Map<String, CompiledNode> compileNodes(WorkflowSpec spec, StateSchema schema) {
        Map<String, CompiledNode> nodes = new LinkedHashMap<>();
        for (NodeDeclaration node : spec.getNodes()) {
            String id = node.getId();
            if (EdgeDeclaration.START.equals(id) || EdgeDeclaration.END.equals(id)) {
                throw new GraphStructureException(id, "uses a reserved node id");
            }
            if (nodes.containsKey(id)) {
                throw new GraphStructureException(id, "is declared more than once");
            }
            OutputModel model = OutputModelBuilder.build(id, node.getOutput());
            validateOutputs(node, model, schema);
            validatePlaceholders(node, schema);
            nodes.put(id, new CompiledNode(node, model));
        }
        if (nodes.isEmpty()) {
            throw new GraphStructureException("Workflow declares no nodes");
        }
        return nodes;
    }

    private void validateOutputs(NodeDeclaration node, OutputModel model, StateSchema schema) {
        List<String> outputs = node.getOutputs();
        if (model.isScalar() && outputs.size() > 1) {
            throw new GraphStructureException(
                    node.getId(), "a scalar result can only be written to one state field");
        }
        for (String output : outputs) {
            StateSchema.Field field = schema.field(output);
            if (field == null) {
                throw new GraphStructureException(
                        node.getId(),
                        "writes undeclared state field '"
                                + output
                                + "'"
                                + suggestion(output, schema.fields().keySet()));
            }
            if (node.hasCode()) {
                continue;
            }
            String resultField = model.isScalar() ? OutputModel.SCALAR_FIELD : output;
            TypeDescriptor produced =
                    model.getFields().stream()
                            .filter(f -> f.name().equals(resultField))
                            .findFirst()
                            .map(f -> f.type())
                            .orElseThrow(
                                    () ->
                                            new GraphStructureException(
                                                    node.getId(),
                                                    "output '"
                                                            + output
                                                            + "' is not a field of its result"));
            if (!assignable(produced, field.type())) {
                throw new GraphStructureException(
                        node.getId(),
                        "result type "
                                + produced.describe()
                                + " cannot be stored in '"
                                + output
                                + "' of type "
                                + field.type().describe());
            }
        }
    }

    /// Input templates see state only; the prompt also sees the node's inputs.
    /// Code nodes hand their results to the prompt, so only `state.` paths in
    /// their prompts are checked.
    private void validatePlaceholders(NodeDeclaration node, StateSchema schema) {
        Set<String> stateFields = schema.fields().keySet();
        node.getInputs()
                .forEach(
                        (name, template) ->
                                checkPlaceholders(
                                        node.getId(),
                                        "input '" + name + "'",
                                        template,
                                        Set.of(),
                                        stateFields,
                                        true));
        checkPlaceholders(
                node.getId(),
                "prompt",
                node.getPrompt(),
                node.getInputs().keySet(),
                stateFields,
                !node.hasCode());
    }

    private static void checkPlaceholders(
            String nodeId,
            String where,
            String template,
            Set<String> inputs,
            Set<String> stateFields,
            boolean checkUnprefixed) {
        for (String path : PathTemplateResolver.placeholders(template)) {
            boolean explicitState = path.startsWith(STATE_PREFIX);
            String stripped = explicitState ? path.substring(STATE_PREFIX.length()) : path;
            String root = stripped.split("\\.")[0];
            if (stateFields.contains(root)) {
                continue;
            }
            if (!explicitState && (inputs.contains(root) || !checkUnprefixed)) {
                continue;
            }
            List<String> candidates = new ArrayList<>();
            if (!explicitState) {
                candidates.addAll(inputs);
            }
            candidates.addAll(stateFields);
            throw new GraphStructureException(
                    nodeId,
                    where
                            + " references unknown variable '"
                            + path
                            + "'"
                            + suggestion(root, candidates));
        }
    }

    private static boolean assignable(TypeDescriptor produced, TypeDescriptor target) {
        if (produced.describe().equals(target.describe())) {
            return true;
        }
        return produced instanceof TypeDescriptor.Scalar p
                && target instanceof TypeDescriptor.Scalar t
                && p.kind() == ScalarKind.INTEGER
                && t.kind() == ScalarKind.FLOAT;
    }

    private Transition compileEdge(
            EdgeDeclaration edge, Map<String, CompiledNode> nodes, StateSchema schema) {
        if (edge instanceof EdgeDeclaration.Linear linear) {
            requireTarget(nodes, linear.to(), linear.from());
            return new Transition.Next(linear.to());
        }
        if (edge instanceof EdgeDeclaration.ConditionalRoute route) {
            if (route.defaultTarget() == null || route.defaultTarget().isBlank()) {
                throw new GraphStructureException(route.from(), "conditional routes require a default");
            }
            requireTarget(nodes, route.defaultTarget(), route.from());
            List<Transition.Guarded> guarded = new ArrayList<>();
            for (EdgeDeclaration.Route r : route.routes()) {
                requireTarget(nodes, r.target(), route.from());
                guarded.add(
                        new Transition.Guarded(
                                compilePredicate(route.from(), r.condition(), schema), r.target()));
            }
            return new Transition.Branch(guarded, route.defaultTarget());
        }
        if (edge instanceof EdgeDeclaration.LoopBack loop) {
            if (loop.maxIterations() < 1 || loop.maxIterations() > MAX_LOOP_ITERATIONS) {
                throw new GraphStructureException(
                        loop.node(),
                        "loop max_iterations must be between 1 and "
                                + MAX_LOOP_ITERATIONS
                                + ", got "
                                + loop.maxIterations());
            }
            requireNode(nodes, loop.reenter(), "loop re-entry");
            requireTarget(nodes, loop.exitTo(), loop.node());
            Predicate until =
                    loop.until() != null && !loop.until().isBlank()
                            ? compilePredicate(loop.node(), loop.until(), schema)
                            : null;
            return new Transition.Loop(
                    loop.node(), loop.reenter(), loop.maxIterations(), until, loop.exitTo());
        }
        EdgeDeclaration.ParallelFanOut fanOut = (EdgeDeclaration.ParallelFanOut) edge;
        if (fanOut.targets().isEmpty()) {
            throw new GraphStructureException(fanOut.from(), "fan-out declares no targets");
        }
        for (String target : fanOut.targets()) {
            requireNode(nodes, target, "fan-out target");
        }
        requireNode(nodes, fanOut.join(), "fan-out join");
        return new Transition.FanOut(fanOut.targets(), fanOut.join());
    }

    private Predicate compilePredicate(String nodeId, String source, StateSchema schema) {
        Predicate predicate;
        try {
            predicate = Predicate.compile(source);
        } catch (ExpressionException e) {
            throw new GraphStructureException(nodeId, e.getMessage(), e);
        }
        for (String path : predicate.referencedPaths()) {
            String stripped =
                    path.startsWith(STATE_PREFIX) ? path.substring(STATE_PREFIX.length()) : path;
            String root = stripped.split("\\.")[0];
            if (!schema.hasField(root)) {
                throw new GraphStructureException(
                        nodeId,
                        "condition '"
                                + source
                                + "' references undeclared state field '"
                                + stripped
                                + "'"
                                + suggestion(stripped, schema.paths()));
            }
        }
        return predicate;
    }

    private Set<String> validateFanOuts(
            Map<String, EdgeDeclaration.ParallelFanOut> fanOuts,
            Map<String, CompiledNode> nodes,
            Map<String, Transition> transitions) {
        Set<String> branchNodes = new HashSet<>();
        for (EdgeDeclaration.ParallelFanOut fanOut : fanOuts.values()) {
            Map<String, String> writers = new HashMap<>();
            for (String target : fanOut.targets()) {
                if (!branchNodes.add(target)) {
                    throw new GraphStructureException(
                            target, "is a fan-out branch more than once");
                }
                if (transitions.containsKey(target)) {
                    throw new GraphStructureException(
                            target, "is a fan-out branch and cannot declare its own outgoing edge");
                }
                if (target.equals(fanOut.join()) || target.equals(fanOut.from())) {
                    throw new GraphStructureException(
                            target, "cannot be both a fan-out branch and its source or join");
                }
                for (String output : nodes.get(target).declaration().getOutputs()) {
                    String other = writers.putIfAbsent(output, target);
                    if (other != null) {
                        throw new GraphStructureException(
                                fanOut.from(),
                                "fan-out branches '"
                                        + other
                                        + "' and '"
                                        + target
                                        + "' both write state field '"
                                        + output
                                        + "'");
                    }
                }
            }
        }
        for (Map.Entry<String, Transition> entry : transitions.entrySet()) {
            for (String successor : successors(entry.getValue())) {
                if (branchNodes.contains(successor)
                        && !(entry.getValue() instanceof Transition.FanOut)) {
                    throw new GraphStructureException(
                            successor,
                            "is a fan-out branch and cannot be targeted by '"
                                    + entry.getKey()
                                    + "'");
                }
            }
        }
        return branchNodes;
    }

    /// Builds forward adjacency: every edge except loop back-edges.
    private static Map<String, Set<String>> forwardEdges(
            Map<String, Transition> transitions,
            Map<String, EdgeDeclaration.ParallelFanOut> fanOuts) {
        Map<String, Set<String>> forward = new HashMap<>();
        transitions.forEach(
                (nodeId, transition) -> {
                    Set<String> out = forward.computeIfAbsent(nodeId, k -> new LinkedHashSet<>());
                    if (transition instanceof Transition.Loop loop) {
                        out.add(loop.exitTo());
                    } else {
                        out.addAll(successors(transition));
                    }
                });
        for (EdgeDeclaration.ParallelFanOut fanOut : fanOuts.values()) {
            for (String target : fanOut.targets()) {
                forward.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(fanOut.join());
            }
        }
        return forward;
    }

    private static List<String> successors(Transition transition) {
        List<String> out = new ArrayList<>();
        if (transition instanceof Transition.Next next) {
            out.add(next.target());
        } else if (transition instanceof Transition.Branch branch) {
            branch.routes().forEach(r -> out.add(r.target()));
            out.add(branch.defaultTarget());
        } else if (transition instanceof Transition.Loop loop) {
            out.add(loop.reenter());
            out.add(loop.exitTo());
        } else if (transition instanceof Transition.FanOut fanOut) {
            out.addAll(fanOut.targets());
            out.add(fanOut.join());
        }
        return out;
    }

    private static void validateLoops(
            Map<String, Transition> transitions, Map<String, Set<String>> forward) {
        transitions.forEach(
                (nodeId, transition) -> {
                    if (transition instanceof Transition.Loop loop
                            && !loop.reenter().equals(nodeId)
                            && !reachable(loop.reenter(), forward).contains(nodeId)) {
                        throw new GraphStructureException(
                                nodeId,
                                "loop re-entry '"
                                        + loop.reenter()
                                        + "' does not lead back to the loop's last node");
                    }
                });
    }

    /// Maps every node inside a loop body to its innermost loop id.
    private static Map<String, String> loopBodies(
            Map<String, Transition> transitions, Map<String, Set<String>> forward) {
        Map<String, Set<String>> reverse = new HashMap<>();
        forward.forEach(
                (from, targets) ->
                        targets.forEach(
                                to -> reverse.computeIfAbsent(to, k -> new HashSet<>()).add(from)));
        Map<String, String> membership = new HashMap<>();
        Map<String, Integer> bodySizes = new HashMap<>();
        transitions.forEach(
                (nodeId, transition) -> {
                    if (!(transition instanceof Transition.Loop loop)) {
                        return;
                    }
                    Set<String> body = new HashSet<>(reachable(loop.reenter(), forward));
                    body.retainAll(reachable(nodeId, reverse));
                    bodySizes.put(nodeId, body.size());
                    for (String member : body) {
                        String current = membership.get(member);
                        if (current == null || bodySizes.get(current) > body.size()) {
                            membership.put(member, nodeId);
                        }
                    }
                });
        return membership;
    }

    private static void validateReachability(
            String start,
            Set<String> nodeIds,
            Map<String, Transition> transitions,
            Map<String, Set<String>> forward) {
        Map<String, Set<String>> all = new HashMap<>();
        forward.forEach((k, v) -> all.put(k, new LinkedHashSet<>(v)));
        transitions.forEach(
                (nodeId, transition) -> {
                    if (transition instanceof Transition.Loop loop) {
                        all.computeIfAbsent(nodeId, k -> new LinkedHashSet<>()).add(loop.reenter());
                    }
                });

        Set<String> fromEntry = reachable(start, all);
        for (String nodeId : nodeIds) {
            if (!fromEntry.contains(nodeId)) {
                throw new GraphStructureException(nodeId, "is not reachable from the entry");
            }
        }

        Map<String, Set<String>> reverse = new HashMap<>();
        all.forEach(
                (from, targets) ->
                        targets.forEach(
                                to -> reverse.computeIfAbsent(to, k -> new HashSet<>()).add(from)));
        if (!reverse.containsKey(EdgeDeclaration.END)) {
            throw new GraphStructureException("Workflow has no edge to END");
        }
        Set<String> toEnd = reachable(EdgeDeclaration.END, reverse);
        for (String nodeId : nodeIds) {
            if (!toEnd.contains(nodeId)) {
                throw new GraphStructureException(nodeId, "has no path to END");
            }
        }
    }

    private static void validateAcyclic(String start, Map<String, Set<String>> forward) {
        Map<String, Integer> color = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        visit(start, forward, color, path);
        for (String nodeId : forward.keySet()) {
            visit(nodeId, forward, color, path);
        }
    }

    private static void visit(
            String nodeId,
            Map<String, Set<String>> forward,
            Map<String, Integer> color,
            Deque<String> path) {
        int state = color.getOrDefault(nodeId, 0);
        if (state == 2) {
            return;
        }
        if (state == 1) {
            List<String> cycle = new ArrayList<>(path);
            Collections.reverse(cycle);
            cycle = cycle.subList(cycle.indexOf(nodeId), cycle.size());
            throw new GraphStructureException(
                    nodeId,
                    "is part of a cycle outside any loop: "
                            + String.join(" -> ", cycle)
                            + " -> "
                            + nodeId);
        }
        color.put(nodeId, 1);
        path.push(nodeId);
        for (String next : forward.getOrDefault(nodeId, Set.of())) {
            visit(next, forward, color, path);
        }
        path.pop();
        color.put(nodeId, 2);
    }

    private static Set<String> reachable(String start, Map<String, Set<String>> adjacency) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.pollFirst();
            if (seen.add(current)) {
                queue.addAll(adjacency.getOrDefault(current, Set.of()));
            }
        }
        return seen;
    }

    private static void requireNode(Map<String, CompiledNode> nodes, String id, String role) {
        if (!nodes.containsKey(id)) {
            throw new GraphStructureException(
                    "Unknown node '" + id + "' used as " + role + suggestion(id, nodes.keySet()));
        }
    }

    private static void requireTarget(Map<String, CompiledNode> nodes, String id, String from) {
        if (!EdgeDeclaration.END.equals(id) && !nodes.containsKey(id)) {
            throw new GraphStructureException(
                    from, "routes to unknown node '" + id + "'" + suggestion(id, nodes.keySet()));
        }
    }

    private static String suggestion(String value, Collection<String> candidates) {
        return PathSuggester.suggest(value, candidates)
                .map(s -> ". Did you mean '" + s + "'?")
                .orElse("");
    }
}
