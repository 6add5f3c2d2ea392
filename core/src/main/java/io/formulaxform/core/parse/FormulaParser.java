package io.formulaxform.core.parse;

import io.formulaxform.core.error.FormulaSyntaxException;
import io.formulaxform.core.parse.ast.Expr;
import io.formulaxform.core.parse.ast.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for formula text.
 *
 * <p>
 * Statements end at a newline or {@code ;}. Conditionals take a braced body
 * ({@code if (c) { ... }}) or an unbraced one that runs up to the next {@code else}, the
 * closing {@code }} of an unbraced chain, or the end of the text. Operator precedence, lowest
 * first: {@code ||}, {@code &&}, equality, comparison, additive, multiplicative, unary, and
 * {@code ^} (right-associative).
 *
 * <p>
 * Not thread-safe; create one instance per text.
 */
public final class FormulaParser {

    private final List<Token> tokens;
    private int current;
    private int braceDepth;
    private boolean atLineStart = true;

    public FormulaParser(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Tokenizes and parses formula text.
     *
     * @throws FormulaSyntaxException on malformed text
     */
    public static FormulaProgram parse(String text) {
        return new FormulaParser(FormulaLexer.tokenize(text)).parseProgram();
    }

    /** Parses the whole token stream. */
    public FormulaProgram parseProgram() {
        List<Statement> statements = block(false);
        if (!check(TokenType.EOF)) {
            throw error(peek(), "unexpected '" + peek().text() + "'");
        }
        int end = statements.size();
        while (end > 0 && statements.get(end - 1) instanceof Statement.BlankLine) {
            end--;
        }
        return new FormulaProgram(statements.subList(0, end));
    }

    // --- statements ---

    /**
     * Parses statements up to EOF or a closing brace. An unbraced body also stops before
     * {@code else}.
     */
    private List<Statement> block(boolean unbraced) {
        List<Statement> statements = new ArrayList<>();
        while (!check(TokenType.EOF) && !check(TokenType.RIGHT_BRACE)) {
            if (unbraced && check(TokenType.ELSE)) {
                break;
            }
            if (match(TokenType.NEWLINE)) {
                if (atLineStart) {
                    statements.add(new Statement.BlankLine());
                }
                atLineStart = true;
                continue;
            }
            if (match(TokenType.SEMICOLON)) {
                continue;
            }
            atLineStart = false;
            if (check(TokenType.COMMENT)) {
                statements.add(new Statement.Comment(advance().text()));
                continue;
            }
            if (match(TokenType.IF)) {
                statements.add(conditional());
                continue;
            }
            if (check(TokenType.ELSE)) {
                throw error(peek(), "'else' without matching 'if'");
            }
            statements.add(simpleStatement());
        }
        return statements;
    }

    private Statement simpleStatement() {
        Statement statement;
        if (check(TokenType.IDENTIFIER) && peekNext().is(TokenType.ASSIGN)) {
            Token name = advance();
            advance();
            Expr value = expression();
            statement = new Statement.Assignment(
                    new Expr.Identifier(name.text(), name.line(), name.column()), value, null);
        } else {
            statement = new Statement.ExpressionStatement(expression(), null);
        }
        boolean separated = match(TokenType.SEMICOLON);
        if (check(TokenType.COMMENT)) {
            String comment = advance().text();
            return withComment(statement, comment);
        }
        if (!separated
                && !check(TokenType.NEWLINE)
                && !check(TokenType.EOF)
                && !check(TokenType.RIGHT_BRACE)
                && !check(TokenType.ELSE)) {
            throw error(peek(), "expected end of statement but found '" + peek().text() + "'");
        }
        return statement;
    }

    private static Statement withComment(Statement statement, String comment) {
        if (statement instanceof Statement.Assignment assignment) {
            return new Statement.Assignment(assignment.target(), assignment.value(), comment);
        }
        return new Statement.ExpressionStatement(((Statement.ExpressionStatement) statement).expression(), comment);
    }

    private Statement conditional() {
        List<Statement.Branch> branches = new ArrayList<>();
        List<Statement> elseBody = null;
        branches.add(new Statement.Branch(expression(), body()));
        while (skipNewlinesBefore(TokenType.ELSE)) {
            advance();
            if (match(TokenType.IF)) {
                branches.add(new Statement.Branch(expression(), body()));
            } else {
                elseBody = body();
                break;
            }
        }
        atLineStart = false;
        return new Statement.Conditional(branches, elseBody);
    }

    private List<Statement> body() {
        if (skipNewlinesBefore(TokenType.LEFT_BRACE)) {
            advance();
            braceDepth++;
            List<Statement> body = block(false);
            consume(TokenType.RIGHT_BRACE, "expected '}' to close block");
            braceDepth--;
            return trimBlankEdges(body);
        }
        List<Statement> body = block(true);
        // a stray '}' closes an unbraced chain only at top level
        if (braceDepth == 0 && check(TokenType.RIGHT_BRACE)) {
            advance();
        }
        return trimBlankEdges(body);
    }

    private static List<Statement> trimBlankEdges(List<Statement> body) {
        int end = body.size();
        while (end > 0 && body.get(end - 1) instanceof Statement.BlankLine) {
            end--;
        }
        return body.subList(0, end);
    }

    /**
     * Consumes newlines if the first token after them is {@code type}.
     *
     * @return {@code true} if the current token now is {@code type}
     */
    private boolean skipNewlinesBefore(TokenType type) {
        int i = current;
        while (tokens.get(i).is(TokenType.NEWLINE)) {
            i++;
        }
        if (tokens.get(i).is(type)) {
            current = i;
            return true;
        }
        return false;
    }

    // --- expressions ---

    private Expr expression() {
        return or();
    }

    private Expr or() {
        Expr left = and();
        while (check(TokenType.OR)) {
            String op = advance().text();
            left = new Expr.Binary(left, op, and());
        }
        return left;
    }

    private Expr and() {
        Expr left = equality();
        while (check(TokenType.AND)) {
            String op = advance().text();
            left = new Expr.Binary(left, op, equality());
        }
        return left;
    }

    private Expr equality() {
        Expr left = comparison();
        while (check(TokenType.EQUAL) || check(TokenType.NOT_EQUAL)) {
            String op = advance().text();
            left = new Expr.Binary(left, op, comparison());
        }
        return left;
    }

    private Expr comparison() {
        Expr left = additive();
        while (check(TokenType.LESS)
                || check(TokenType.LESS_EQUAL)
                || check(TokenType.GREATER)
                || check(TokenType.GREATER_EQUAL)) {
            String op = advance().text();
            left = new Expr.Binary(left, op, additive());
        }
        return left;
    }

    private Expr additive() {
        Expr left = multiplicative();
        while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
            String op = advance().text();
            left = new Expr.Binary(left, op, multiplicative());
        }
        return left;
    }

    private Expr multiplicative() {
        Expr left = unary();
        while (check(TokenType.STAR) || check(TokenType.SLASH)) {
            String op = advance().text();
            left = new Expr.Binary(left, op, unary());
        }
        return left;
    }

    private Expr unary() {
        if (check(TokenType.MINUS) || check(TokenType.PLUS) || check(TokenType.NOT)) {
            String op = advance().text();
            return new Expr.Unary(op, unary());
        }
        return power();
    }

    private Expr power() {
        Expr base = primary();
        if (check(TokenType.CARET)) {
            String op = advance().text();
            return new Expr.Binary(base, op, unary());
        }
        return base;
    }

    private Expr primary() {
        Token token = peek();
        if (match(TokenType.NUMBER)) {
            return new Expr.NumberLiteral(token.text());
        }
        if (match(TokenType.IDENTIFIER)) {
            if (match(TokenType.LEFT_PAREN)) {
                return new Expr.Call(token.text(), arguments());
            }
            return new Expr.Identifier(token.text(), token.line(), token.column());
        }
        if (match(TokenType.LEFT_PAREN)) {
            Expr inner = expression();
            consume(TokenType.RIGHT_PAREN, "expected ')'");
            return new Expr.Grouping(inner);
        }
        if (token.is(TokenType.EOF) || token.is(TokenType.NEWLINE)) {
            throw error(token, "unexpected end of expression");
        }
        throw error(token, "unexpected '" + token.text() + "'");
    }

    private List<Expr> arguments() {
        List<Expr> args = new ArrayList<>();
        if (match(TokenType.RIGHT_PAREN)) {
            return args;
        }
        do {
            args.add(expression());
        } while (match(TokenType.COMMA));
        consume(TokenType.RIGHT_PAREN, "expected ')' after arguments");
        return args;
    }

    // --- token helpers ---

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        return current + 1 < tokens.size() ? tokens.get(current + 1) : tokens.get(tokens.size() - 1);
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token advance() {
        Token token = peek();
        if (!token.is(TokenType.EOF)) {
            current++;
        }
        return token;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), message);
    }

    private static FormulaSyntaxException error(Token token, String message) {
        return new FormulaSyntaxException(message, token.line(), token.column());
    }
}
