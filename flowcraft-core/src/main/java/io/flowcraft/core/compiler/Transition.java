package io.flowcraft.core.compiler;

import io.flowcraft.core.expression.Predicate;
import java.util.List;

/// Compiled outgoing control flow of a node.
///
/// ### Permitted Subtypes
/// - {@link Next} - unconditional successor
/// - {@link Branch} - first matching predicate, else the default
/// - {@link Loop} - bounded re-entry into a loop body
/// - {@link FanOut} - concurrent branches joined by a barrier
public sealed interface Transition {

    record Next(String target) implements Transition {}

    record Guarded(Predicate predicate, String target) {}

    record Branch(List<Guarded> routes, String defaultTarget) implements Transition {
        public Branch {
            routes = List.copyOf(routes);
        }
    }

    /// @param loopId key of the engine-private iteration counter
    /// @param until exit predicate, null to always run `maxIterations` passes
    record Loop(String loopId, String reenter, int maxIterations, Predicate until, String exitTo)
            implements Transition {}

    record FanOut(List<String> targets, String join) implements Transition {
        public FanOut {
            targets = List.copyOf(targets);
        }
    }
}
