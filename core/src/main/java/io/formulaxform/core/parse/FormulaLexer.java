package io.formulaxform.core.parse;

import io.formulaxform.core.error.FormulaSyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula text into tokens. Newlines are significant (they end statements) except
 * inside parentheses, where they are dropped so that long argument lists may wrap.
 *
 * <p>
 * Not thread-safe; create one instance per text.
 */
public final class FormulaLexer {

    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int line = 1;
    private int lineStart;
    private int parenDepth;

    public FormulaLexer(String text) {
        this.text = text == null ? "" : text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /** Convenience entry point. */
    public static List<Token> tokenize(String text) {
        return new FormulaLexer(text).tokenize();
    }

    /**
     * Tokenizes the whole text. The returned list always ends with {@link TokenType#EOF}.
     *
     * @throws FormulaSyntaxException on a character that starts no token
     */
    public List<Token> tokenize() {
        tokens.clear();
        pos = 0;
        line = 1;
        lineStart = 0;
        parenDepth = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            int column = pos - lineStart + 1;
            if (c == '\n') {
                if (parenDepth == 0) {
                    tokens.add(new Token(TokenType.NEWLINE, "\n", line, column));
                }
                pos++;
                line++;
                lineStart = pos;
            } else if (c == ' ' || c == '\t') {
                pos++;
            } else if (c == '#') {
                int end = text.indexOf('\n', pos);
                end = end < 0 ? text.length() : end;
                tokens.add(new Token(TokenType.COMMENT, text.substring(pos + 1, end), line, column));
                pos = end;
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < text.length() && Character.isDigit(peek(1)))) {
                number(column);
            } else if (Character.isLetter(c) || c == '_') {
                identifier(column);
            } else {
                operator(c, column);
            }
        }
        tokens.add(new Token(TokenType.EOF, "", line, pos - lineStart + 1));
        return List.copyOf(tokens);
    }

    private void number(int column) {
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                    pos++;
                }
            } else {
                throw new FormulaSyntaxException("malformed exponent in number", line, mark - lineStart + 1);
            }
        }
        tokens.add(new Token(TokenType.NUMBER, text.substring(start, pos), line, column));
    }

    private void identifier(int column) {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
        String word = text.substring(start, pos);
        TokenType type;
        switch (word) {
            case "if":
                type = TokenType.IF;
                break;
            case "else":
                type = TokenType.ELSE;
                break;
            default:
                type = TokenType.IDENTIFIER;
        }
        tokens.add(new Token(type, word, line, column));
    }

    private void operator(char c, int column) {
        switch (c) {
            case '+':
                single(TokenType.PLUS, column);
                break;
            case '-':
                single(TokenType.MINUS, column);
                break;
            case '*':
                single(TokenType.STAR, column);
                break;
            case '/':
                single(TokenType.SLASH, column);
                break;
            case '^':
                single(TokenType.CARET, column);
                break;
            case ',':
                single(TokenType.COMMA, column);
                break;
            case ';':
                single(TokenType.SEMICOLON, column);
                break;
            case '{':
                single(TokenType.LEFT_BRACE, column);
                break;
            case '}':
                single(TokenType.RIGHT_BRACE, column);
                break;
            case '(':
                parenDepth++;
                single(TokenType.LEFT_PAREN, column);
                break;
            case ')':
                if (parenDepth > 0) {
                    parenDepth--;
                }
                single(TokenType.RIGHT_PAREN, column);
                break;
            case '=':
                pair('=', TokenType.EQUAL, TokenType.ASSIGN, column);
                break;
            case '!':
                pair('=', TokenType.NOT_EQUAL, TokenType.NOT, column);
                break;
            case '<':
                pair('=', TokenType.LESS_EQUAL, TokenType.LESS, column);
                break;
            case '>':
                pair('=', TokenType.GREATER_EQUAL, TokenType.GREATER, column);
                break;
            case '&':
                doubled('&', TokenType.AND, column);
                break;
            case '|':
                doubled('|', TokenType.OR, column);
                break;
            default:
                throw new FormulaSyntaxException("unexpected character '" + c + "'", line, column);
        }
    }

    private void single(TokenType type, int column) {
        tokens.add(new Token(type, String.valueOf(text.charAt(pos)), line, column));
        pos++;
    }

    private void pair(char second, TokenType twoChar, TokenType oneChar, int column) {
        if (pos + 1 < text.length() && peek(1) == second) {
            tokens.add(new Token(twoChar, text.substring(pos, pos + 2), line, column));
            pos += 2;
        } else {
            single(oneChar, column);
        }
    }

    private void doubled(char c, TokenType type, int column) {
        if (pos + 1 < text.length() && peek(1) == c) {
            tokens.add(new Token(type, text.substring(pos, pos + 2), line, column));
            pos += 2;
            return;
        }
        throw new FormulaSyntaxException("expected '" + c + c + "'", line, column);
    }

    private char peek(int offset) {
        return text.charAt(pos + offset);
    }
}
