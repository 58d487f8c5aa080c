package p8lua.lexer;

public enum TokenKind {

    // trivia
    SPACE,
    NEWLINE,
    COMMENT,

    // literals
    STRING,
    NUMBER,

    NAME,
    LABEL,
    KEYWORD,
    SYMBOL;

    /** Whitespace, newlines and comments: kept for reconstruction, ignored by the grammar. */
    public boolean isTrivia() {
        return this == SPACE || this == NEWLINE || this == COMMENT;
    }
}
