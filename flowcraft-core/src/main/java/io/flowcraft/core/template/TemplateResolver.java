package io.flowcraft.core.template;

import io.flowcraft.core.state.StateContainer;
import java.util.LinkedHashMap;
import java.util.Map;

/// Resolves `{path}` variables against a node's input mapping and the workflow state.
///
/// Lookup precedence is fixed: a node-local input wins over a state path of
/// the same name.
///
/// @see PathTemplateResolver for the default implementation
public interface TemplateResolver {

    /// Substitutes every `{path}` placeholder in a template.
    ///
    /// @param template the template text, may be null (treated as empty)
    /// @param inputs node-local resolved inputs, not null (may be empty)
    /// @param state current state, not null
    /// @return resolved text, never null
    /// @throws TemplateResolutionException if a placeholder resolves to nothing
    String resolve(String template, Map<String, ?> inputs, StateContainer state);

    /// Looks up the raw value behind a single path using the same precedence.
    ///
    /// @param path a dot-path, optionally prefixed by `state.`, not null
    /// @param inputs node-local resolved inputs, not null
    /// @param state current state, not null
    /// @return the value, may be null
    /// @throws TemplateResolutionException if the path resolves to nothing
    Object lookup(String path, Map<String, ?> inputs, StateContainer state);

    /// Returns whether a path resolves, without raising on a miss.
    boolean canResolve(String path, Map<String, ?> inputs, StateContainer state);

    /// Resolves a node's input mapping (`local name -> template`) against state only.
    ///
    /// @param mapping declared input mapping, not null
    /// @param state current state, not null
    /// @return local name to resolved text, in declaration order, never null
    default Map<String, String> resolveInputs(Map<String, String> mapping, StateContainer state) {
        Map<String, String> resolved = new LinkedHashMap<>();
        mapping.forEach((name, template) -> resolved.put(name, resolve(template, Map.of(), state)));
        return resolved;
    }
}
