package io.formulaxform.core.parse.ast;

import java.util.List;
import java.util.Objects;

/** Expression nodes of a parsed formula. */
public sealed interface Expr {

    /** Numeric literal, kept in its source spelling. */
    record NumberLiteral(String text) implements Expr {}

    /** Reference to a symbol. */
    record Identifier(String name, int line, int column) implements Expr {}

    /**
     * Prefix operation.
     *
     * @param operator {@code -}, {@code +} or {@code !}
     */
    record Unary(String operator, Expr operand) implements Expr {}

    /**
     * Infix operation. {@code ^} is kept as an operator here; emitters map it to a power call.
     *
     * @param operator source spelling of the operator
     */
    record Binary(Expr left, String operator, Expr right) implements Expr {}

    /**
     * Function call. The callee is a function name, never a symbol.
     *
     * @param callee    function name as written
     * @param arguments arguments in order
     */
    record Call(String callee, List<Expr> arguments) implements Expr {
        public Call {
            Objects.requireNonNull(callee, "callee must not be null");
            arguments = List.copyOf(arguments);
        }
    }

    /** Parenthesized expression, kept so the emitted text follows the author's grouping. */
    record Grouping(Expr inner) implements Expr {}
}
