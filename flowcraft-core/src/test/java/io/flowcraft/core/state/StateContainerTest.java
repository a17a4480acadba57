package io.flowcraft.core.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StateContainer")
class StateContainerTest {

    private StateSchema schema;

    @BeforeEach
    void setUp() {
        var level = StateFieldDeclaration.of("level", "int");
        var flags = StateFieldDeclaration.builder("flags").type("object").field(level).build();
        schema =
                StateSchemaBuilder.build(
                        List.of(
                                StateFieldDeclaration.builder("topic").required(true).build(),
                                StateFieldDeclaration.builder("tags")
                                        .type("list[str]")
                                        .defaultValue(List.of("draft"))
                                        .build(),
                                StateFieldDeclaration.of("score", "float"),
                                StateFieldDeclaration.of("summary", "str"),
                                StateFieldDeclaration.builder("metadata")
                                        .type("object")
                                        .field(flags)
                                        .build()));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("fills defaults and leaves optional fields null")
        void shouldApplyDefaults() {
            var state = schema.create(Map.of("topic", "A"));

            assertThat(state.get("topic")).isEqualTo("A");
            assertThat(state.get("tags")).isEqualTo(List.of("draft"));
            assertThat(state.get("summary")).isNull();
            assertThat(state.asMap()).containsOnlyKeys("topic", "tags", "score", "summary", "metadata");
        }

        @Test
        @DisplayName("round-trips through its plain map form")
        void shouldRoundTrip() {
            var state =
                    schema.create(
                            Map.of(
                                    "topic", "A",
                                    "score", 7,
                                    "metadata", Map.of("flags", Map.of("level", 3))));

            var copy = schema.create(state.asMap());

            assertThat(copy).isEqualTo(state);
            assertThat(copy.get("score")).isEqualTo(7.0);
            assertThat(copy.valueAt("metadata.flags.level")).isEqualTo(3L);
        }

        @Test
        @DisplayName("fails naming a missing required field")
        void shouldRejectMissingRequired() {
            assertThatThrownBy(() -> schema.create(Map.of("score", 1.5)))
                    .isInstanceOf(SchemaBuildException.class)
                    .satisfies(e -> assertThat(((SchemaBuildException) e).getField()).isEqualTo("topic"));
        }

        @Test
        @DisplayName("rejects undeclared keys and mistyped values")
        void shouldRejectInvalidInputs() {
            assertThatThrownBy(() -> schema.create(Map.of("topic", "A", "extra", 1)))
                    .isInstanceOf(StateValidationException.class)
                    .hasMessageContaining("extra");
            assertThatThrownBy(() -> schema.create(Map.of("topic", "A", "score", "high")))
                    .isInstanceOf(StateValidationException.class);
            assertThatThrownBy(
                            () ->
                                    schema.create(
                                            Map.of(
                                                    "topic",
                                                    "A",
                                                    "metadata",
                                                    Map.of("flags", Map.of("level", "x")))))
                    .isInstanceOf(StateValidationException.class)
                    .hasMessageContaining("metadata.flags.level");
        }

        @Test
        @DisplayName("never aliases caller collections or defaults across instances")
        void shouldNotAlias() {
            var tags = new ArrayList<>(List.of("a"));
            var first = schema.create(Map.of("topic", "A", "tags", tags));
            tags.add("b");
            var second = schema.create(Map.of("topic", "B"));

            assertThat(first.get("tags")).isEqualTo(List.of("a"));
            assertThat(second.get("tags")).isEqualTo(List.of("draft"));
            assertThatThrownBy(() -> ((List<Object>) second.get("tags")).add("x"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("with")
    class With {

        @Test
        @DisplayName("returns a new container and leaves the receiver unchanged")
        void shouldCopyOnWrite() {
            var before = schema.create(Map.of("topic", "A"));

            var after = before.with(Map.of("summary", "done"));

            assertThat(after.get("summary")).isEqualTo("done");
            assertThat(before.get("summary")).isNull();
            assertThat(after).isNotSameAs(before);
        }

        @Test
        @DisplayName("validates replacement values")
        void shouldValidateUpdates() {
            var state = schema.create(Map.of("topic", "A"));

            assertThatThrownBy(() -> state.with(Map.of("score", List.of())))
                    .isInstanceOf(StateValidationException.class);
        }
    }

    @Test
    @DisplayName("resolves nested dot-paths and reports misses")
    void shouldTraversePaths() {
        var state =
                schema.create(Map.of("topic", "A", "metadata", Map.of("flags", Map.of("level", 2))));

        assertThat(state.contains("metadata.flags.level")).isTrue();
        assertThat(state.contains("metadata.flags.depth")).isFalse();
        assertThatThrownBy(() -> state.valueAt("nope")).isInstanceOf(IllegalArgumentException.class);
    }
}
