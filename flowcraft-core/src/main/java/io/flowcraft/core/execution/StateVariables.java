package io.flowcraft.core.execution;

import io.flowcraft.core.expression.VariableSource;
import io.flowcraft.core.state.StateContainer;

/// Exposes a state snapshot to predicates; paths may carry a `state.` prefix.
final class StateVariables implements VariableSource {

    private static final String PREFIX = "state.";

    private final StateContainer state;

    StateVariables(StateContainer state) {
        this.state = state;
    }

    @Override
    public boolean has(String path) {
        return state.contains(strip(path));
    }

    @Override
    public Object get(String path) {
        return state.valueAt(strip(path));
    }

    private static String strip(String path) {
        return path.startsWith(PREFIX) ? path.substring(PREFIX.length()) : path;
    }
}
