package io.agentflow.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentflow.runtime.model.PromptDefinition;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders prompt bodies. {@code $name} and {@code ${name}} are replaced by the named prompt's
 * rendered body when a prompt of that name exists (prompt composition), otherwise by the
 * variable's display text. Unknown names are left untouched.
 *
 * <p>
 * Thread-safe: instances are immutable.
 */
public final class PromptTemplate {

    private static final Pattern REFERENCE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}|\\$([A-Za-z_][A-Za-z0-9_]*)");

    private final Map<String, PromptDefinition> prompts;

    public PromptTemplate(Map<String, PromptDefinition> prompts) {
        this.prompts = Map.copyOf(prompts);
    }

    /**
     * Renders a prompt by name.
     *
     * @param variables variable lookup returning {@code null} for unset names
     * @throws IllegalStateException if prompts reference each other in a cycle
     */
    public String render(String promptName, Function<String, JsonNode> variables) {
        PromptDefinition prompt = prompts.get(promptName);
        if (prompt == null) {
            return "";
        }
        return expand(prompt, variables, new ArrayDeque<>());
    }

    /** Renders arbitrary template text against the known prompts and the given variables. */
    public String renderText(String text, Function<String, JsonNode> variables) {
        return substitute(text, variables, new ArrayDeque<>());
    }

    private String expand(PromptDefinition prompt, Function<String, JsonNode> variables, Deque<String> stack) {
        if (stack.contains(prompt.name())) {
            List<String> cycle = new ArrayList<>(stack);
            Collections.reverse(cycle);
            cycle.add(prompt.name());
            throw new IllegalStateException("Prompt composition cycle: " + String.join(" -> ", cycle));
        }
        stack.push(prompt.name());
        try {
            return substitute(prompt.body(), variables, stack);
        } finally {
            stack.pop();
        }
    }

    private String substitute(String text, Function<String, JsonNode> variables, Deque<String> stack) {
        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            String replacement;
            PromptDefinition nested = prompts.get(name);
            JsonNode value = variables.apply(name);
            if (nested != null) {
                replacement = expand(nested, variables, stack);
            } else if (value != null && !value.isNull()) {
                replacement = Values.display(value);
            } else {
                replacement = matcher.group();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
