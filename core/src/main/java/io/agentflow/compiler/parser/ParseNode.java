package io.agentflow.compiler.parser;

import io.agentflow.compiler.lexer.Token;
import io.agentflow.compiler.lexer.TokenKind;
import io.agentflow.compiler.source.SourceSpan;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Concrete parse tree node: either a rule match with children or a token leaf. Every node has a
 * source span; a rule that matched no tokens has a zero-width span at the next token.
 */
public sealed interface ParseNode {

    SourceSpan span();

    /** A match of a named grammar rule. */
    record Branch(String rule, List<ParseNode> children, SourceSpan span) implements ParseNode {

        public Branch {
            Objects.requireNonNull(rule, "rule must not be null");
            Objects.requireNonNull(span, "span must not be null");
            children = List.copyOf(children);
        }

        public boolean is(String name) {
            return rule.equals(name);
        }

        public ParseNode child(int index) {
            return children.get(index);
        }

        /** Direct children that are matches of {@code name}. */
        public List<Branch> branches(String name) {
            List<Branch> result = new ArrayList<>();
            for (ParseNode child : children) {
                if (child instanceof Branch branch && branch.is(name)) {
                    result.add(branch);
                }
            }
            return result;
        }

        /** All direct children that are rule matches. */
        public List<Branch> branches() {
            List<Branch> result = new ArrayList<>();
            for (ParseNode child : children) {
                if (child instanceof Branch branch) {
                    result.add(branch);
                }
            }
            return result;
        }

        /** First direct child matching {@code name}, or {@code null}. */
        public Branch branch(String name) {
            for (ParseNode child : children) {
                if (child instanceof Branch branch && branch.is(name)) {
                    return branch;
                }
            }
            return null;
        }

        /** Direct token children of the given kind. */
        public List<Token> tokens(TokenKind kind) {
            List<Token> result = new ArrayList<>();
            for (ParseNode child : children) {
                if (child instanceof Leaf leaf && leaf.token().kind() == kind) {
                    result.add(leaf.token());
                }
            }
            return result;
        }

        /** All direct token children. */
        public List<Token> tokens() {
            List<Token> result = new ArrayList<>();
            for (ParseNode child : children) {
                if (child instanceof Leaf leaf) {
                    result.add(leaf.token());
                }
            }
            return result;
        }

        /** {@code true} if a direct child is the keyword {@code word}. */
        public boolean hasWord(String word) {
            for (ParseNode child : children) {
                if (child instanceof Leaf leaf && leaf.token().isWord(word)) {
                    return true;
                }
            }
            return false;
        }
    }

    /** A token kept in the tree. */
    record Leaf(Token token) implements ParseNode {

        public Leaf {
            Objects.requireNonNull(token, "token must not be null");
        }

        @Override
        public SourceSpan span() {
            return token.span();
        }
    }
}
