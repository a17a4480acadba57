package io.flowcraft.core.expression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Predicate")
class PredicateTest {

    private static final VariableSource VARIABLES = variables();

    private static VariableSource variables() {
        Map<String, Object> values = new HashMap<>();
        values.put("score", 7L);
        values.put("ratio", 0.5);
        values.put("status", "done");
        values.put("approved", true);
        values.put("notes", null);
        values.put("tags", List.of("a"));
        values.put("meta.level", 3L);
        return new VariableSource() {
            @Override
            public boolean has(String path) {
                return values.containsKey(path);
            }

            @Override
            public Object get(String path) {
                return values.get(path);
            }
        };
    }

    @ParameterizedTest(name = "{0} is {1}")
    @CsvSource(
            delimiter = '|',
            quoteCharacter = '`',
            value = {
                "score >= 7 | true",
                "score > 7 | false",
                "score == 7.0 | true",
                "ratio * 2 == 1 | true",
                "score / 2 == 3.5 | true",
                "score % 4 == 3 | true",
                "-score < 0 | true",
                "status == 'done' and approved | true",
                "status != \"done\" or not approved | false",
                "`(score > 10 || ratio < 1) && approved` | true",
                "status + '!' == 'done!' | true",
                "'abc' < 'abd' | true",
                "notes == null | true",
                "notes == None | true",
                "tags | true",
                "meta.level >= 3 | true",
                "approved == True | true",
                "missing > 1 | false",
                "missing == null | false",
                "not missing | true"
            })
    @DisplayName("evaluates the restricted grammar")
    void shouldEvaluate(String source, boolean expected) {
        assertThat(Predicate.compile(source).test(VARIABLES)).isEqualTo(expected);
    }

    @Test
    @DisplayName("lists referenced paths in source order")
    void shouldListPaths() {
        var predicate = Predicate.compile("state.score > 3 and meta.level == score");

        assertThat(predicate.referencedPaths()).containsExactly("state.score", "meta.level", "score");
    }

    @Nested
    @DisplayName("rejects")
    class Rejects {

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "",
                    "score >",
                    "score = 7",
                    "(score > 1",
                    "__import__('os')",
                    "score > 1)",
                    "'unterminated",
                    "score ; 1"
                })
        @DisplayName("anything outside the grammar at parse time")
        void shouldRejectAtParse(String source) {
            assertThatThrownBy(() -> Predicate.compile(source))
                    .isInstanceOf(ExpressionException.class);
        }

        @Test
        @DisplayName("integer literals too large for a long")
        void shouldRejectOversizedNumber() {
            assertThatThrownBy(() -> Predicate.compile("score > 99999999999999999999"))
                    .isInstanceOf(ExpressionException.class)
                    .hasMessageContaining("Invalid number '99999999999999999999'");
        }

        @Test
        @DisplayName("division by zero at evaluation time")
        void shouldRejectDivisionByZero() {
            var predicate = Predicate.compile("score / 0 > 1");

            assertThatThrownBy(() -> predicate.test(VARIABLES))
                    .isInstanceOf(ExpressionException.class)
                    .hasMessageContaining("Division by zero");
        }

        @Test
        @DisplayName("ordering across unrelated types")
        void shouldRejectMixedOrdering() {
            var predicate = Predicate.compile("status > 3");

            assertThatThrownBy(() -> predicate.test(VARIABLES))
                    .isInstanceOf(ExpressionException.class);
        }
    }
}
