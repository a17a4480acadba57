package io.flowcraft.core.workflow;

import java.util.List;
import java.util.Objects;

/// Declared control-flow edge.
///
/// ### Permitted Subtypes
/// - {@link Linear} - unconditional successor
/// - {@link ConditionalRoute} - ordered predicates with a mandatory default
/// - {@link LoopBack} - bounded re-entry while a predicate stays false
/// - {@link ParallelFanOut} - concurrent dispatch with a join barrier
///
/// {@link #START} and {@link #END} are reserved node ids marking the entry
/// and the terminal of the graph.
///
/// @see io.flowcraft.core.compiler.GraphCompiler for the structural rules
public sealed interface EdgeDeclaration {

    String START = "START";
    String END = "END";

    /// Returns the node whose completion this edge follows.
    String source();

    record Linear(String from, String to) implements EdgeDeclaration {
        public Linear {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(to, "to must not be null");
        }

        @Override
        public String source() {
            return from;
        }
    }

    /// One guarded branch of a {@link ConditionalRoute}.
    record Route(String condition, String target) {
        public Route {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(target, "target must not be null");
        }
    }

    /// Routes are tried in order; the first whose condition holds wins,
    /// otherwise `defaultTarget` is taken.
    ///
    /// @param defaultTarget fallback target; null is kept so the compiler can
    ///     reject the route set
    record ConditionalRoute(String from, List<Route> routes, String defaultTarget)
            implements EdgeDeclaration {
        public ConditionalRoute {
            Objects.requireNonNull(from, "from must not be null");
            routes = routes != null ? List.copyOf(routes) : List.of();
        }

        @Override
        public String source() {
            return from;
        }
    }

    /// After `node` completes, control re-enters `reenter` while `until` is
    /// false and fewer than `maxIterations` passes have run; otherwise it
    /// continues at `exitTo`. Reaching the bound is a normal exit.
    ///
    /// @param node last node of the loop body, not null
    /// @param reenter first node of the loop body; defaults to `node`
    /// @param maxIterations bound on body passes, between 1 and 100
    /// @param until exit predicate, may be null to always run `maxIterations` times
    /// @param exitTo successor once the loop ends; defaults to {@link #END}
    record LoopBack(String node, String reenter, int maxIterations, String until, String exitTo)
            implements EdgeDeclaration {
        public LoopBack {
            Objects.requireNonNull(node, "node must not be null");
            reenter = reenter != null ? reenter : node;
            exitTo = exitTo != null ? exitTo : END;
        }

        public LoopBack(String node, int maxIterations, String until) {
            this(node, node, maxIterations, until, END);
        }

        @Override
        public String source() {
            return node;
        }
    }

    /// After `from` completes, every target runs concurrently against the
    /// same state snapshot; `join` starts once all of them have resolved.
    record ParallelFanOut(String from, List<String> targets, String join)
            implements EdgeDeclaration {
        public ParallelFanOut {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(join, "join must not be null");
            targets = targets != null ? List.copyOf(targets) : List.of();
        }

        @Override
        public String source() {
            return from;
        }
    }
}
