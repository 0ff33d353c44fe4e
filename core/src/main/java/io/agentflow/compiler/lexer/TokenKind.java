package io.agentflow.compiler.lexer;

/**
 * Token categories. Keywords are not token kinds: every word is an {@link #IDENT} and the grammar
 * decides from its position whether a spelling acts as a keyword.
 */
public enum TokenKind {
    IDENT("identifier"),
    VARIABLE("variable"),
    STRING("string"),
    RAW_STRING("triple-quoted string"),
    NUMBER("number"),
    EQ_EQ("'=='"),
    NOT_EQ("'!='"),
    LT_EQ("'<='"),
    GT_EQ("'>='"),
    LT("'<'"),
    GT("'>'"),
    TILDE("'~'"),
    ARROW("'->'"),
    ASSIGN("'='"),
    PLUS("'+'"),
    MINUS("'-'"),
    STAR("'*'"),
    SLASH("'/'"),
    DOT("'.'"),
    COMMA("','"),
    COLON("':'"),
    QUESTION("'?'"),
    PIPE("'|'"),
    LPAREN("'('"),
    RPAREN("')'"),
    LBRACKET("'['"),
    RBRACKET("']'"),
    LBRACE("'{'"),
    RBRACE("'}'"),
    NEWLINE("newline"),
    INDENT("indented block"),
    DEDENT("end of block"),
    EOF("end of input");

    private final String description;

    TokenKind(String description) {
        this.description = description;
    }

    /** How the kind is named in "expected X, found Y" messages. */
    public String description() {
        return description;
    }

    /** {@code true} for tokens the lexer synthesises rather than reads from the text. */
    public boolean isSynthetic() {
        return this == INDENT || this == DEDENT || this == EOF;
    }
}
