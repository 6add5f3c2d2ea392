package io.formulaxform.core.parse;

/**
 * A lexical token with its 1-based source position.
 *
 * @param type   lexical category
 * @param text   source text (comment body for {@link TokenType#COMMENT})
 * @param line   1-based line
 * @param column 1-based column of the first character
 */
public record Token(TokenType type, String text, int line, int column) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + line + ":" + column;
    }
}
