package io.agentflow.compiler.grammar;

import io.agentflow.compiler.lexer.TokenKind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable, declarative context-free grammar: named {@link Rule}s over {@link Element}s plus a
 * start rule. The same grammar object drives every parsing strategy.
 *
 * <p>
 * The static factory methods ({@link #seq}, {@link #choice}, {@link #opt}, {@link #many},
 * {@link #many1}, {@link #not}, {@link #tok}, {@link #kw}, {@link #ref}) are meant to be statically imported
 * when writing a grammar.
 *
 * <p>
 * Thread-safe: all fields are final and collections are unmodifiable.
 */
public final class Grammar {

    private final String start;
    private final Map<String, Rule> rules;

    private Grammar(String start, Map<String, Rule> rules) {
        this.start = start;
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    /**
     * A named production.
     *
     * @param name   rule name, used as the tag of parse nodes it produces
     * @param body   the rule's expression
     * @param inline {@code true} if matches splice their children into the parent node instead of
     *               producing a node of their own
     */
    public record Rule(String name, Element body, boolean inline) {
        public Rule {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }

    public static Builder builder(String start) {
        return new Builder(start);
    }

    public String start() {
        return start;
    }

    public Map<String, Rule> rules() {
        return rules;
    }

    /**
     * Looks up a rule.
     *
     * @throws IllegalArgumentException if the grammar has no such rule
     */
    public Rule rule(String name) {
        Rule rule = rules.get(name);
        if (rule == null) {
            throw new IllegalArgumentException("Unknown grammar rule: '" + name + "'");
        }
        return rule;
    }

    // ── Element factories ──

    public static Element seq(Element... elements) {
        return elements.length == 1 ? elements[0] : new Element.Sequence(Arrays.asList(elements));
    }

    public static Element choice(Element... alternatives) {
        return new Element.Choice(Arrays.asList(alternatives));
    }

    public static Element opt(Element... elements) {
        return new Element.Optional(seq(elements));
    }

    public static Element many(Element... elements) {
        return new Element.Repeat(seq(elements), 0);
    }

    public static Element many1(Element... elements) {
        return new Element.Repeat(seq(elements), 1);
    }

    public static Element not(Element... elements) {
        return new Element.Not(seq(elements));
    }

    public static Element tok(TokenKind kind) {
        return new Element.Terminal(kind);
    }

    public static Element kw(String word) {
        return new Element.Keyword(word);
    }

    public static Element ref(String name) {
        return new Element.RuleRef(name);
    }

    /** Collects rules and checks that every reference resolves. */
    public static final class Builder {

        private final String start;
        private final Map<String, Rule> rules = new LinkedHashMap<>();

        Builder(String start) {
            this.start = start;
        }

        public Builder rule(String name, Element body) {
            return add(new Rule(name, body, false));
        }

        public Builder inline(String name, Element body) {
            return add(new Rule(name, body, true));
        }

        private Builder add(Rule rule) {
            if (rules.putIfAbsent(rule.name(), rule) != null) {
                throw new IllegalStateException("Duplicate grammar rule: '" + rule.name() + "'");
            }
            return this;
        }

        /**
         * Builds the grammar.
         *
         * @throws IllegalStateException if the start rule is missing or a reference is dangling
         */
        public Grammar build() {
            if (!rules.containsKey(start)) {
                throw new IllegalStateException("Start rule not defined: '" + start + "'");
            }
            List<String> dangling = new ArrayList<>();
            for (Rule rule : rules.values()) {
                collectDangling(rule.body(), dangling);
            }
            if (!dangling.isEmpty()) {
                throw new IllegalStateException("Undefined grammar rules referenced: " + dangling);
            }
            return new Grammar(start, rules);
        }

        private void collectDangling(Element element, List<String> dangling) {
            if (element instanceof Element.RuleRef ref) {
                if (!rules.containsKey(ref.name()) && !dangling.contains(ref.name())) {
                    dangling.add(ref.name());
                }
            } else if (element instanceof Element.Sequence sequence) {
                sequence.elements().forEach(e -> collectDangling(e, dangling));
            } else if (element instanceof Element.Choice choice) {
                choice.alternatives().forEach(e -> collectDangling(e, dangling));
            } else if (element instanceof Element.Optional optional) {
                collectDangling(optional.element(), dangling);
            } else if (element instanceof Element.Repeat repeat) {
                collectDangling(repeat.element(), dangling);
            } else if (element instanceof Element.Not not) {
                collectDangling(not.element(), dangling);
            }
        }
    }
}
