package io.flowcraft.core.tool;

import java.util.List;
import java.util.Objects;

/// Describes a tool a node may hand to the LLM capability.
///
/// Definitions are descriptors only; invoking a tool is the LLM capability's
/// concern.
///
/// {@snippet :
/// ToolDefinition search = ToolDefinition.of(
///         "web_search",
///         "Search the web",
///         List.of(ParameterDef.required("query", "string", "Search query")));
/// }
///
/// @param name unique tool identifier, not null or blank
/// @param description human-readable description for LLM context, not null
/// @param parameters input parameters accepted by the tool, not null (may be empty)
public record ToolDefinition(String name, String description, List<ParameterDef> parameters) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(description, "description must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
    }

    public static ToolDefinition of(
            String name, String description, List<ParameterDef> parameters) {
        return new ToolDefinition(name, description, parameters);
    }

    /// Creates a tool definition with no parameters.
    public static ToolDefinition simple(String name, String description) {
        return new ToolDefinition(name, description, List.of());
    }

    /// Returns the names of required parameters.
    public List<String> requiredParameterNames() {
        return parameters.stream().filter(ParameterDef::required).map(ParameterDef::name).toList();
    }

    /// Describes a tool parameter.
    ///
    /// @param name parameter identifier, not null
    /// @param type JSON type: string, number, integer, boolean, object, array; not null
    /// @param description human-readable description, not null
    /// @param required whether the parameter must be provided
    public record ParameterDef(String name, String type, String description, boolean required) {

        public ParameterDef {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(description, "description must not be null");
        }

        public static ParameterDef required(String name, String type, String description) {
            return new ParameterDef(name, type, description, true);
        }

        public static ParameterDef optional(String name, String type, String description) {
            return new ParameterDef(name, type, description, false);
        }
    }
}
