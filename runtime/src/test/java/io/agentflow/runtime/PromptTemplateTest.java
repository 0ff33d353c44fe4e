package io.agentflow.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentflow.runtime.model.PromptDefinition;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PromptTemplate")
class PromptTemplateTest {

    private final Map<String, JsonNode> variables = new HashMap<>();
    private final Function<String, JsonNode> lookup = variables::get;

    private static PromptTemplate templates(PromptDefinition... prompts) {
        return new PromptTemplate(List.of(prompts).stream()
                .collect(Collectors.toMap(PromptDefinition::name, Function.identity())));
    }

    private static PromptDefinition prompt(String name, String body) {
        return new PromptDefinition(name, body, null, null, false, null, null);
    }

    @Test
    @DisplayName("variables are replaced by their display text")
    void variables() {
        variables.put("name", Values.text("Ada"));
        variables.put("count", Values.number(3L));

        String rendered = templates(prompt("greet", "Hello $name, you have ${count} new messages"))
                .render("greet", lookup);

        assertThat(rendered).isEqualTo("Hello Ada, you have 3 new messages");
    }

    @Test
    @DisplayName("a reference to another prompt inlines its rendered body")
    void composition() {
        variables.put("role", Values.text("a reviewer"));
        PromptTemplate templates = templates(
                prompt("system", "You are $role"),
                prompt("task", "$system. Review ${system}!"));

        assertThat(templates.render("task", lookup)).isEqualTo("You are a reviewer. Review You are a reviewer!");
    }

    @Test
    @DisplayName("unknown and unset names are left as written")
    void unknownNames() {
        variables.put("empty", Values.NULL);

        assertThat(templates().renderText("cost: $price and $empty", lookup)).isEqualTo("cost: $price and $empty");
    }

    @Test
    @DisplayName("dollar signs inside values are inserted literally")
    void quotedReplacement() {
        variables.put("price", Values.text("$5 \\ each"));

        assertThat(templates().renderText("costs $price", lookup)).isEqualTo("costs $5 \\ each");
    }

    @Test
    void unknownPromptRendersEmpty() {
        assertThat(templates().render("missing", lookup)).isEmpty();
    }

    @Test
    @DisplayName("prompts that include each other are rejected with the cycle")
    void cycle() {
        PromptTemplate templates = templates(prompt("a", "see $b"), prompt("b", "see $a"));

        assertThatThrownBy(() -> templates.render("a", lookup))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Prompt composition cycle: a -> b -> a");
    }
}
