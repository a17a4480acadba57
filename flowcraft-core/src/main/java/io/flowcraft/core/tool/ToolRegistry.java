package io.flowcraft.core.tool;

import java.util.List;

/// Registry of tools nodes may request by name.
///
/// ### Usage
/// {@snippet :
/// ToolRegistry registry = new DefaultToolRegistry();
/// registry.register(ToolDefinition.simple("web_search", "Search the web"));
/// ToolDefinition tool = registry.get("web_search");
/// }
///
/// @implNote Implementations must be thread-safe; parallel branches of one run
/// acquire tools concurrently.
///
/// @see DefaultToolRegistry
public interface ToolRegistry {

    /// Registers a tool, replacing any tool with the same name.
    ///
    /// @param tool the tool definition, not null
    void register(ToolDefinition tool);

    /// Retrieves a tool by name.
    ///
    /// @param name the tool identifier, not null
    /// @return the tool definition, never null
    /// @throws ToolNotFoundException if no tool has that name
    ToolDefinition get(String name) throws ToolNotFoundException;

    /// Returns all registered tools.
    ///
    /// @return unmodifiable list, never null (may be empty)
    List<ToolDefinition> all();

    /// Returns whether a tool with the given name is registered.
    boolean contains(String name);

    /// Returns the number of registered tools.
    default int size() {
        return all().size();
    }
}
