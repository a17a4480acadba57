package io.flowcraft.core.tool;

import java.io.Serial;

public class ToolNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = 7302175406188235911L;

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super("Tool not found: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
