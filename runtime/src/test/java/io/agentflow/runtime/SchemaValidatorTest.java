package io.agentflow.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentflow.runtime.error.SchemaViolationException;
import io.agentflow.runtime.error.UnknownDefinitionException;
import io.agentflow.runtime.model.FieldDefinition;
import io.agentflow.runtime.model.SchemaDefinition;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaValidator")
class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator(Map.of(
            "Article", new SchemaDefinition("Article", List.of(
                    new FieldDefinition("title", "string", false, false),
                    new FieldDefinition("tags", "string", true, false),
                    new FieldDefinition("score", "float", false, true),
                    new FieldDefinition("author", "Author", false, true))),
            "Author", new SchemaDefinition("Author", List.of(
                    new FieldDefinition("name", "string", false, false),
                    new FieldDefinition("age", "int", false, true))),
            "Node", new SchemaDefinition("Node", List.of(
                    new FieldDefinition("next", "Node", false, true)))));

    private static JsonNode article(String title) {
        return Values.object("title", Values.text(title), "tags", Values.list(Values.text("ai")));
    }

    @Nested
    @DisplayName("translation to JSON Schema")
    class Translation {

        @Test
        @DisplayName("required fields are the ones not marked optional")
        void objectShape() {
            JsonNode schema = validator.toJsonSchema("Article", false);

            assertThat(schema.path("type").asText()).isEqualTo("object");
            assertThat(schema.path("required")).containsExactly(Values.text("title"), Values.text("tags"));
            assertThat(schema.path("properties").path("tags").path("type").asText()).isEqualTo("array");
            assertThat(schema.path("properties").path("tags").path("items").path("type").asText())
                    .isEqualTo("string");
            assertThat(schema.path("properties").path("score").path("type").asText()).isEqualTo("number");
        }

        @Test
        @DisplayName("nested schemas are inlined")
        void nested() {
            JsonNode author = validator.toJsonSchema("Article", false).path("properties").path("author");

            assertThat(author.path("properties").path("age").path("type").asText()).isEqualTo("integer");
            assertThat(author.path("required")).containsExactly(Values.text("name"));
        }

        @Test
        @DisplayName("a self-referencing schema stops at a plain object")
        void recursive() {
            JsonNode next = validator.toJsonSchema("Node", false).path("properties").path("next");

            assertThat(next.path("type").asText()).isEqualTo("object");
            assertThat(next.has("properties")).isFalse();
        }

        @Test
        void listWrapper() {
            JsonNode schema = validator.toJsonSchema("Author", true);

            assertThat(schema.path("type").asText()).isEqualTo("array");
            assertThat(schema.path("items").path("type").asText()).isEqualTo("object");
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        void conformingValue() {
            assertThatCode(() -> validator.validate("Article", false, article("Agents")))
                    .doesNotThrowAnyException();
            assertThatCode(() -> validator.validate("Article", true, Values.list(article("a"), article("b"))))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("a missing required field is a violation naming the field")
        void missingField() {
            JsonNode value = Values.object("tags", Values.list());

            assertThatThrownBy(() -> validator.validate("Article", false, value))
                    .isInstanceOf(SchemaViolationException.class)
                    .satisfies(thrown -> {
                        SchemaViolationException e = (SchemaViolationException) thrown;
                        assertThat(e.schemaName()).isEqualTo("Article");
                        assertThat(e.violations()).singleElement().asString().contains("title");
                        assertThat(e.getMessage()).startsWith("Output does not match schema 'Article': ");
                    });
        }

        @Test
        void wrongFieldType() {
            JsonNode value = Values.object("title", Values.text("x"), "tags", Values.list(Values.number(1L)));

            assertThatThrownBy(() -> validator.validate("Article", false, value))
                    .isInstanceOf(SchemaViolationException.class)
                    .hasMessageContaining("tags");
        }

        @Test
        @DisplayName("a single object where a list is expected is a violation")
        void listExpected() {
            assertThatThrownBy(() -> validator.validate("Article", true, article("solo")))
                    .isInstanceOf(SchemaViolationException.class);
        }

        @Test
        void unknownSchema() {
            assertThatThrownBy(() -> validator.validate("Nope", false, Values.object()))
                    .isInstanceOf(UnknownDefinitionException.class)
                    .hasMessage("Unknown schema: 'Nope'");
        }
    }
}
