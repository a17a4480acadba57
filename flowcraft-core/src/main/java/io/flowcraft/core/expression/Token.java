package io.flowcraft.core.expression;

/// Lexical token of the predicate language.
///
/// @param type token type, not null
/// @param text source text (unquoted for strings), not null
/// @param position zero-based offset in the source
record Token(Type type, String text, int position) {

    enum Type {
        NUMBER,
        STRING,
        IDENTIFIER,
        TRUE,
        FALSE,
        NULL,
        AND,
        OR,
        NOT,
        EQ,
        NE,
        LT,
        LE,
        GT,
        GE,
        PLUS,
        MINUS,
        STAR,
        SLASH,
        PERCENT,
        LPAREN,
        RPAREN,
        EOF
    }
}
