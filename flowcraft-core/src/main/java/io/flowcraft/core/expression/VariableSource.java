package io.flowcraft.core.expression;

/// Supplies values for path references during evaluation.
public interface VariableSource {

    /// Returns whether the path resolves to a value (null included).
    boolean has(String path);

    /// Returns the value at a path for which {@link #has(String)} is true.
    Object get(String path);
}
