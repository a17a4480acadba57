package io.flowcraft.core.output;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcraft.core.state.SchemaBuildException;
import io.flowcraft.core.workflow.OutputDeclaration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("OutputModel")
class OutputModelTest {

    private static final OutputModel ARTICLE =
            OutputModelBuilder.build(
                    "writer",
                    OutputDeclaration.object(
                            List.of(
                                    new OutputDeclaration.Field("title", "str", "headline"),
                                    new OutputDeclaration.Field("word_count", "int", null),
                                    new OutputDeclaration.Field("tags", "list[str]", null))));

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("accepts a conformant payload unchanged")
        void shouldAcceptConformantPayload() {
            Map<String, Object> payload =
                    Map.of("title", "Hello", "word_count", 120L, "tags", List.of("a", "b"));

            var validated = ARTICLE.validate(payload);

            assertThat(validated).isEqualTo(payload);
            assertThat(ARTICLE.validate(validated)).isEqualTo(validated);
        }

        @Test
        @DisplayName("rejects a payload missing a declared field")
        void shouldRejectMissingField() {
            assertThatThrownBy(() -> ARTICLE.validate(Map.of("title", "Hello", "tags", List.of())))
                    .isInstanceOf(OutputValidationException.class)
                    .satisfies(
                            e -> {
                                var error = (OutputValidationException) e;
                                assertThat(error.getNodeId()).isEqualTo("writer");
                                assertThat(error.getField()).isEqualTo("word_count");
                                assertThat(error.getExpected()).isEqualTo("int");
                                assertThat(error.getActual()).isEqualTo("missing");
                            });
        }

        @Test
        @DisplayName("rejects fields that were not declared")
        void shouldRejectExtraField() {
            Map<String, Object> payload = new HashMap<>();
            payload.put("title", "Hello");
            payload.put("word_count", 1);
            payload.put("tags", List.of());
            payload.put("author", "me");

            assertThatThrownBy(() -> ARTICLE.validate(payload))
                    .isInstanceOf(OutputValidationException.class)
                    .hasMessageContaining("author");
        }

        @Test
        @DisplayName("normalizes numbers and booleans to declared strings only")
        void shouldNormalizeOnlyToString() {
            var validated =
                    ARTICLE.validate(Map.of("title", 42, "word_count", 3, "tags", List.of()));

            assertThat(validated.get("title")).isEqualTo("42");
            assertThatThrownBy(
                            () ->
                                    ARTICLE.validate(
                                            Map.of("title", "x", "word_count", "3", "tags", List.of())))
                    .isInstanceOf(OutputValidationException.class)
                    .satisfies(
                            e ->
                                    assertThat(((OutputValidationException) e).getField())
                                            .isEqualTo("word_count"));
        }

        @Test
        @DisplayName("rejects a null payload")
        void shouldRejectNull() {
            assertThatThrownBy(() -> ARTICLE.validate(null))
                    .isInstanceOf(OutputValidationException.class);
        }
    }

    @Nested
    @DisplayName("scalar results")
    class Scalar {

        private final OutputModel model =
                OutputModelBuilder.build("scorer", OutputDeclaration.scalar("float"));

        @Test
        @DisplayName("wrap the value in a one-field record")
        void shouldUseSingleField() {
            assertThat(model.isScalar()).isTrue();
            assertThat(model.fieldNames()).containsExactly(OutputModel.SCALAR_FIELD);
            assertThat(model.validate(Map.of("result", 7))).containsEntry("result", 7.0);
        }

        @Test
        @DisplayName("map onto the first declared output")
        void shouldMapToFirstOutput() {
            var validated = model.validate(Map.of("result", 0.5));

            assertThat(model.toStateUpdates(validated, List.of("score")))
                    .containsExactly(Map.entry("score", 0.5));
        }
    }

    @Test
    @DisplayName("copies object fields onto same-named outputs")
    void shouldMapObjectFields() {
        var validated =
                ARTICLE.validate(Map.of("title", "T", "word_count", 1, "tags", List.of("x")));

        assertThat(ARTICLE.toStateUpdates(validated, List.of("title", "tags")))
                .containsOnlyKeys("title", "tags");
    }

    @Test
    @DisplayName("describes the expected shape for prompts")
    void shouldDescribeShape() {
        assertThat(ARTICLE.describe())
                .isEqualTo("{\"title\": \"str\", \"word_count\": \"int\", \"tags\": \"list[str]\"}");
    }

    @Test
    @DisplayName("rejects object results without fields at build time")
    void shouldRejectEmptyObject() {
        assertThatThrownBy(() -> OutputModelBuilder.build("n", OutputDeclaration.object(List.of())))
                .isInstanceOf(SchemaBuildException.class);
    }
}
