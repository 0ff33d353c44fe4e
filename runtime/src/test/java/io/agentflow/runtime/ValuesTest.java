package io.agentflow.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Values")
class ValuesTest {

    @Nested
    @DisplayName("predicates")
    class Predicates {

        @Test
        void truthiness() {
            assertThat(Values.truthy(null)).isFalse();
            assertThat(Values.truthy(Values.NULL)).isFalse();
            assertThat(Values.truthy(Values.text(""))).isFalse();
            assertThat(Values.truthy(Values.number(0L))).isFalse();
            assertThat(Values.truthy(Values.number(0.0))).isFalse();
            assertThat(Values.truthy(Values.list())).isFalse();
            assertThat(Values.truthy(Values.object())).isFalse();
            assertThat(Values.truthy(Values.bool(false))).isFalse();

            assertThat(Values.truthy(Values.text("no"))).isTrue();
            assertThat(Values.truthy(Values.number(-1L))).isTrue();
            assertThat(Values.truthy(Values.list(Values.NULL))).isTrue();
        }

        @Test
        @DisplayName("numbers are equal by value whatever their representation")
        void numericEquality() {
            assertThat(Values.eq(Values.number(1L), Values.number(1.0))).isTrue();
            assertThat(Values.eq(Values.text("1"), Values.number(1L))).isFalse();
            assertThat(Values.eq(null, Values.NULL)).isTrue();
        }

        @Test
        @DisplayName("~ ignores case, punctuation and whitespace")
        void normalizedEquality() {
            assertThat(Values.normalizedEquals(Values.text("Done."), Values.text("DONE"))).isTrue();
            assertThat(Values.normalizedEquals(Values.text("  all   done!"), Values.text("All done"))).isTrue();
            assertThat(Values.normalizedEquals(Values.text("done"), Values.text("undone"))).isFalse();
        }

        @Test
        void containment() {
            assertThat(Values.contains(Values.text("top secret plan"), Values.text("secret"))).isTrue();
            assertThat(Values.contains(Values.list(Values.number(1L), Values.number(2L)), Values.number(2.0)))
                    .isTrue();
            assertThat(Values.contains(Values.object("key", Values.NULL), Values.text("key"))).isTrue();
            assertThat(Values.contains(Values.number(12L), Values.text("1"))).isFalse();
        }

        @Test
        void ordering() {
            assertThat(Values.compare(Values.number(80L), Values.number(79.5))).isPositive();
            assertThat(Values.compare(Values.text("a"), Values.text("b"))).isNegative();
            assertThatThrownBy(() -> Values.compare(Values.text("a"), Values.number(1L)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Cannot compare STRING with NUMBER");
        }
    }

    @Nested
    @DisplayName("arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("whole results stay integral")
        void integralResults() {
            JsonNode sum = Values.add(Values.number(1.5), Values.number(1.5));

            assertThat(sum.isIntegralNumber()).isTrue();
            assertThat(sum.asLong()).isEqualTo(3);
            assertThat(Values.multiply(Values.number(4L), Values.number(2L)).asLong()).isEqualTo(8);
            assertThat(Values.negate(Values.number(5L)).asLong()).isEqualTo(-5);
        }

        @Test
        void divisionIsFloatingPoint() {
            assertThat(Values.divide(Values.number(7L), Values.number(2L)).asDouble()).isEqualTo(3.5);
            assertThatThrownBy(() -> Values.divide(Values.number(1L), Values.number(0L)))
                    .isInstanceOf(ArithmeticException.class)
                    .hasMessage("Division by zero");
        }

        @Test
        @DisplayName("+ concatenates lists and text")
        void concatenation() {
            assertThat(Values.add(Values.list(Values.number(1L)), Values.number(2L)))
                    .isEqualTo(Values.list(Values.number(1L), Values.number(2L)));
            assertThat(Values.add(Values.text("done: "), Values.number(3L)).asText()).isEqualTo("done: 3");
            assertThatThrownBy(() -> Values.add(Values.bool(true), Values.NULL))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void nonNumbersRejected() {
            assertThatThrownBy(() -> Values.subtract(Values.text("a"), Values.number(1L)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Operator '-' requires numbers, got STRING");
        }
    }

    @Nested
    @DisplayName("structure")
    class Structure {

        @Test
        @DisplayName("missing path steps yield null")
        void path() {
            JsonNode root = Values.object("a", Values.object("b", Values.number(1L)));

            assertThat(Values.path(root, "a", "b").asLong()).isEqualTo(1);
            assertThat(Values.path(root, "a", "x", "y").isNull()).isTrue();
            assertThat(Values.path(null, "a").isNull()).isTrue();
        }

        @Test
        @DisplayName("property assignment copies instead of mutating")
        void withPath() {
            JsonNode state = Values.object("count", Values.number(0L));

            JsonNode updated = Values.withPath(state, Values.number(1L), "stats", "count");

            assertThat(state).isEqualTo(Values.object("count", Values.number(0L)));
            assertThat(Values.path(updated, "stats", "count").asLong()).isEqualTo(1);
            assertThat(Values.path(updated, "count").asLong()).isZero();
        }

        @Test
        void append() {
            JsonNode list = Values.list(Values.text("a"));

            assertThat(Values.append(list, Values.text("b"))).hasSize(2);
            assertThat(list).hasSize(1);
            assertThat(Values.append(null, Values.text("x"))).isEqualTo(Values.list(Values.text("x")));
        }

        @Test
        void iterationAndFilter() {
            assertThat(Values.iterate(Values.object("a", Values.number(1L), "b", Values.number(2L))))
                    .containsExactly(Values.number(1L), Values.number(2L));
            assertThat(Values.iterate(Values.text("one"))).containsExactly(Values.text("one"));
            assertThat(Values.iterate(Values.NULL)).isEmpty();
            assertThat(Values.filter(
                            Values.list(Values.number(1L), Values.number(5L), Values.number(9L)),
                            item -> item.asLong() > 3))
                    .hasSize(2);
        }

        @Test
        void objectArguments() {
            assertThatThrownBy(() -> Values.object("lonely"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("object() requires key/value pairs, got 1");
            assertThatThrownBy(() -> Values.object(1, Values.NULL))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("object key must be a string: 1");
        }

        @Test
        void display() {
            assertThat(Values.display(Values.text("raw"))).isEqualTo("raw");
            assertThat(Values.display(Values.NULL)).isEmpty();
            assertThat(Values.display(Values.object("a", Values.number(1L)))).isEqualTo("{\"a\":1}");
        }
    }
}
