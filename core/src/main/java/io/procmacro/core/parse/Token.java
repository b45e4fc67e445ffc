package io.procmacro.core.parse;

/**
 * Lexical token of the expression language.
 *
 * @param type   token type
 * @param text   source text (unescaped content for strings)
 * @param column 0-based offset in the expression source
 */
record Token(Type type, String text, int column) {

    enum Type {
        INT,
        REAL,
        STRING,
        IDENT,
        TRUE,
        FALSE,
        AND,
        OR,
        NOT,
        LPAREN,
        RPAREN,
        DOT,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        PERCENT,
        EQ,
        NE,
        LT,
        LE,
        GT,
        GE,
        EOF
    }

    @Override
    public String toString() {
        return type == Type.EOF ? "end of expression" : "'" + text + "'";
    }
}
