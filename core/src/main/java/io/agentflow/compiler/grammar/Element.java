package io.agentflow.compiler.grammar;

import io.agentflow.compiler.lexer.Token;
import io.agentflow.compiler.lexer.TokenKind;
import java.util.List;
import java.util.Objects;

/**
 * A grammar expression. Rules are built from terminals, keywords (identifiers with a fixed
 * spelling, matched only where the grammar asks for them), references to other rules, and the
 * usual sequence, ordered choice, optional and repetition combinators, plus a negative lookahead.
 *
 * <p>
 * Elements are immutable and compared by identity when the parser caches decisions.
 */
public sealed interface Element {

    /** A token of a given kind. Newlines and block tokens are matched but not kept in the tree. */
    record Terminal(TokenKind kind) implements Element {
        public Terminal {
            Objects.requireNonNull(kind, "kind must not be null");
        }

        public boolean matches(Token token) {
            return token.kind() == kind;
        }

        public boolean kept() {
            return kind != TokenKind.NEWLINE && !kind.isSynthetic();
        }

        @Override
        public String toString() {
            return kind.description();
        }
    }

    /** An identifier token spelled {@code word}. */
    record Keyword(String word) implements Element {
        public Keyword {
            Objects.requireNonNull(word, "word must not be null");
        }

        public boolean matches(Token token) {
            return token.isWord(word);
        }

        @Override
        public String toString() {
            return "'" + word + "'";
        }
    }

    /** A reference to a named rule, resolved through the owning {@link Grammar}. */
    record RuleRef(String name) implements Element {
        public RuleRef {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Sequence(List<Element> elements) implements Element {
        public Sequence {
            elements = List.copyOf(elements);
        }
    }

    /** Ordered choice: alternatives are considered in declaration order. */
    record Choice(List<Element> alternatives) implements Element {
        public Choice {
            alternatives = List.copyOf(alternatives);
            if (alternatives.size() < 2) {
                throw new IllegalArgumentException("Choice requires at least two alternatives");
            }
        }
    }

    record Optional(Element element) implements Element {
        public Optional {
            Objects.requireNonNull(element, "element must not be null");
        }
    }

    /** Greedy repetition with a lower bound of 0 or 1. */
    record Repeat(Element element, int min) implements Element {
        public Repeat {
            Objects.requireNonNull(element, "element must not be null");
            if (min < 0 || min > 1) {
                throw new IllegalArgumentException("Repeat min must be 0 or 1, got: " + min);
            }
        }
    }

    /**
     * Negative lookahead: matches the empty input when {@code element} does not match at the
     * current position. Consumes nothing and keeps nothing in the tree.
     */
    record Not(Element element) implements Element {
        public Not {
            Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public String toString() {
            return "not " + element;
        }
    }
}
