package io.formulaxform.core.parse;

/** Lexical categories of formula text. */
public enum TokenType {
    IDENTIFIER,
    NUMBER,
    IF,
    ELSE,

    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    ASSIGN,
    EQUAL,
    NOT_EQUAL,
    LESS,
    LESS_EQUAL,
    GREATER,
    GREATER_EQUAL,
    AND,
    OR,
    NOT,

    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    COMMA,
    SEMICOLON,

    /** {@code #} comment; the token text excludes the marker. */
    COMMENT,
    NEWLINE,
    EOF
}
