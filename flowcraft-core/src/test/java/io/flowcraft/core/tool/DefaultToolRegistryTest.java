package io.flowcraft.core.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultToolRegistry")
class DefaultToolRegistryTest {

    private DefaultToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultToolRegistry(List.of(ToolDefinition.simple("search", "web search")));
    }

    @Test
    @DisplayName("returns registered tools by name")
    void shouldReturnRegisteredTool() throws Exception {
        registry.register(
                ToolDefinition.of(
                        "fetch",
                        "fetch a url",
                        List.of(ToolDefinition.ParameterDef.required("url", "string", "target"))));

        assertThat(registry.get("fetch").requiredParameterNames()).containsExactly("url");
        assertThat(registry.contains("search")).isTrue();
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("fails with a checked exception for unknown tools")
    void shouldRejectUnknownTool() {
        assertThatThrownBy(() -> registry.get("serch"))
                .isInstanceOf(ToolNotFoundException.class)
                .hasMessageContaining("serch");
    }
}
