package io.agentflow.compiler.lexer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agentflow.compiler.diagnostics.ErrorCode;
import io.agentflow.compiler.error.LexicalException;
import io.agentflow.compiler.source.SourceFile;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Lexer")
class LexerTest {

    private static List<Token> tokens(String text) {
        return new Lexer(new SourceFile("test.af", text)).tokenize();
    }

    private static List<TokenKind> kinds(String text) {
        return tokens(text).stream().map(Token::kind).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("indentation")
    class Indentation {

        @Test
        @DisplayName("indented block yields INDENT, NEWLINE before DEDENT, then EOF")
        void indentedBlock() {
            assertThat(kinds("flow main $x:\n    log $x\n"))
                    .containsExactly(
                            TokenKind.IDENT,
                            TokenKind.IDENT,
                            TokenKind.VARIABLE,
                            TokenKind.COLON,
                            TokenKind.NEWLINE,
                            TokenKind.INDENT,
                            TokenKind.IDENT,
                            TokenKind.VARIABLE,
                            TokenKind.NEWLINE,
                            TokenKind.DEDENT,
                            TokenKind.EOF);
        }

        @Test
        @DisplayName("missing trailing newline produces the same stream")
        void noTrailingNewline() {
            assertThat(kinds("flow main:\n    log 1")).isEqualTo(kinds("flow main:\n    log 1\n"));
        }

        @Test
        @DisplayName("closing two blocks at once yields two DEDENT tokens at the next line start")
        void doubleDedent() {
            String text = "flow a:\n    if $x:\n        log 1\nflow b:\n    log 2\n";
            List<Token> tokens = tokens(text);
            List<Token> dedents = tokens.stream()
                    .filter(token -> token.kind() == TokenKind.DEDENT)
                    .collect(Collectors.toList());

            assertThat(dedents).hasSize(3);
            assertThat(dedents.get(0).span().startLine()).isEqualTo(4);
            assertThat(dedents.get(1).span().startLine()).isEqualTo(4);
        }

        @Test
        @DisplayName("blank and comment-only lines never affect indentation")
        void blankAndCommentLines() {
            String text = "flow a:\n    log 1\n\n  # stray comment\n    log 2\n";

            assertThat(kinds(text)).doesNotContainSequence(TokenKind.DEDENT, TokenKind.INDENT);
            assertThat(kinds(text).stream().filter(kind -> kind == TokenKind.INDENT)).hasSize(1);
        }

        @Test
        @DisplayName("a tab advances to the next multiple of eight")
        void tabWidth() {
            String text = "flow a:\n\tlog 1\n        log 2\n";

            assertThat(kinds(text).stream().filter(kind -> kind == TokenKind.INDENT)).hasSize(1);
        }

        @Test
        @DisplayName("dedent to an unknown column is E0008")
        void mismatchedDedent() {
            assertThatThrownBy(() -> tokens("flow a:\n    log 1\n  log 2\n"))
                    .isInstanceOf(LexicalException.class)
                    .satisfies(thrown -> {
                        LexicalException e = (LexicalException) thrown;
                        assertThat(e.diagnostic().code()).isEqualTo(ErrorCode.E0008);
                        assertThat(e.diagnostic().line()).isEqualTo(3);
                        assertThat(e.diagnostic().message())
                                .isEqualTo("mismatched indentation: dedent to column 3 does not match any enclosing block");
                    });
        }

        @Test
        @DisplayName("line breaks inside brackets are ignored")
        void bracketsSpanLines() {
            assertThat(kinds("$x = [1,\n      2]\n"))
                    .containsExactly(
                            TokenKind.VARIABLE,
                            TokenKind.ASSIGN,
                            TokenKind.LBRACKET,
                            TokenKind.NUMBER,
                            TokenKind.COMMA,
                            TokenKind.NUMBER,
                            TokenKind.RBRACKET,
                            TokenKind.NEWLINE,
                            TokenKind.EOF);
        }
    }

    @Nested
    @DisplayName("literals and operators")
    class Literals {

        @Test
        void stringEscapes() {
            Token string = tokens("log \"a\\n\\\"b\\\"\"\n").get(1);

            assertThat(string.kind()).isEqualTo(TokenKind.STRING);
            assertThat(string.text()).isEqualTo("a\n\"b\"");
        }

        @Test
        @DisplayName("triple-quoted strings keep line breaks and advance the line counter")
        void rawString() {
            List<Token> tokens = tokens("prompt p: \"\"\"line one\nline two\"\"\"\nmodel m = x\n");
            Token raw = tokens.stream().filter(t -> t.kind() == TokenKind.RAW_STRING).findFirst().orElseThrow();
            Token model = tokens.stream().filter(t -> t.isWord("model")).findFirst().orElseThrow();

            assertThat(raw.text()).isEqualTo("line one\nline two");
            assertThat(raw.span().startLine()).isEqualTo(1);
            assertThat(raw.span().endLine()).isEqualTo(2);
            assertThat(model.span().startLine()).isEqualTo(3);
        }

        @Test
        void numbers() {
            List<Token> tokens = tokens("x = 42 + 3.5\n");

            assertThat(tokens.get(2).text()).isEqualTo("42");
            assertThat(tokens.get(4).text()).isEqualTo("3.5");
        }

        @Test
        @DisplayName("two-character operators win over their one-character prefixes")
        void twoCharOperators() {
            assertThat(kinds("a == b != c <= d >= e -> f < g > h = i\n"))
                    .contains(
                            TokenKind.EQ_EQ,
                            TokenKind.NOT_EQ,
                            TokenKind.LT_EQ,
                            TokenKind.GT_EQ,
                            TokenKind.ARROW,
                            TokenKind.LT,
                            TokenKind.GT,
                            TokenKind.ASSIGN);
        }

        @Test
        @DisplayName("spans are 1-based lines and 0-based columns")
        void spans() {
            Token variable = tokens("log  $name\n").get(1);

            assertThat(variable.text()).isEqualTo("name");
            assertThat(variable.span().startLine()).isEqualTo(1);
            assertThat(variable.span().startColumn()).isEqualTo(5);
            assertThat(variable.span().endColumn()).isEqualTo(10);
        }

        @Test
        void commentsProduceNoTokens() {
            assertThat(kinds("log 1 # trailing\n# whole line\n"))
                    .containsExactly(TokenKind.IDENT, TokenKind.NUMBER, TokenKind.NEWLINE, TokenKind.EOF);
        }
    }

    @Nested
    @DisplayName("lexical errors")
    class Errors {

        @Test
        void unterminatedString() {
            assertThatThrownBy(() -> tokens("log \"oops\nlog 2\n"))
                    .isInstanceOf(LexicalException.class)
                    .hasMessageContaining("unterminated string literal");
        }

        @Test
        void unterminatedRawString() {
            assertThatThrownBy(() -> tokens("prompt p: \"\"\"never closed\n"))
                    .isInstanceOf(LexicalException.class)
                    .hasMessageContaining("unterminated triple-quoted string");
        }

        @Test
        void invalidCharacter() {
            assertThatThrownBy(() -> tokens("x = 1 @ 2\n"))
                    .isInstanceOf(LexicalException.class)
                    .satisfies(thrown -> {
                        LexicalException e = (LexicalException) thrown;
                        assertThat(e.diagnostic().code()).isEqualTo(ErrorCode.E0007);
                        assertThat(e.diagnostic().message()).isEqualTo("invalid character '@'");
                        assertThat(e.diagnostic().column()).isEqualTo(7);
                    });
        }

        @Test
        void dollarWithoutName() {
            assertThatThrownBy(() -> tokens("log $ 1\n"))
                    .isInstanceOf(LexicalException.class)
                    .hasMessageContaining("invalid character '$'");
        }

        @Test
        @DisplayName("an unclosed bracket is reported where it was opened")
        void unclosedBracket() {
            assertThatThrownBy(() -> tokens("x = [1, 2\nlog 3\n"))
                    .isInstanceOf(LexicalException.class)
                    .satisfies(thrown -> {
                        LexicalException e = (LexicalException) thrown;
                        assertThat(e.diagnostic().message())
                                .isEqualTo("unterminated block: '[' opened at line 1 is never closed");
                        assertThat(e.diagnostic().line()).isEqualTo(1);
                    });
        }
    }

    @Test
    @DisplayName("each iteration starts a fresh scan")
    void iterableIsRestartable() {
        Lexer lexer = new Lexer(new SourceFile("test.af", "flow a:\n    log 1\n"));

        assertThat(lexer.tokenize()).isEqualTo(lexer.tokenize());
    }
}
