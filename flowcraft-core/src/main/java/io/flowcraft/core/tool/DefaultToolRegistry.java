package io.flowcraft.core.tool;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/// Thread-safe, in-memory {@link ToolRegistry}.
///
/// @implNote Backed by a ConcurrentHashMap; safe for concurrent lookups from
/// parallel branches.
public final class DefaultToolRegistry implements ToolRegistry {

    private final Map<String, ToolDefinition> tools = new ConcurrentHashMap<>();

    public DefaultToolRegistry() {}

    /// Creates a registry holding the given tools.
    ///
    /// @param initialTools tools to register, not null
    public DefaultToolRegistry(List<ToolDefinition> initialTools) {
        Objects.requireNonNull(initialTools, "initialTools must not be null");
        initialTools.forEach(this::register);
    }

    @Override
    public void register(ToolDefinition tool) {
        Objects.requireNonNull(tool, "tool must not be null");
        tools.put(tool.name(), tool);
    }

    @Override
    public ToolDefinition get(String name) throws ToolNotFoundException {
        Objects.requireNonNull(name, "name must not be null");
        ToolDefinition tool = tools.get(name);
        if (tool == null) {
            throw new ToolNotFoundException(name);
        }
        return tool;
    }

    @Override
    public List<ToolDefinition> all() {
        return List.copyOf(tools.values());
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return tools.containsKey(name);
    }

    @Override
    public int size() {
        return tools.size();
    }
}
