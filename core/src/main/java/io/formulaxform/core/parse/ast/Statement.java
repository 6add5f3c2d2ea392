package io.formulaxform.core.parse.ast;

import java.util.List;
import java.util.Objects;

/**
 * Statement nodes of a parsed formula. Trailing comments are kept with the statement they
 * follow so the emitter can render them on the same line.
 */
public sealed interface Statement {

    /**
     * {@code target = value}.
     *
     * @param trailingComment comment text after the statement, or {@code null}
     */
    record Assignment(Expr.Identifier target, Expr value, String trailingComment) implements Statement {
        public Assignment {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /**
     * {@code if} / {@code else if} chain with an optional {@code else} body.
     *
     * @param branches condition/body pairs in source order, at least one
     * @param elseBody statements of the final {@code else}, or {@code null} when absent
     */
    record Conditional(List<Branch> branches, List<Statement> elseBody) implements Statement {
        public Conditional {
            branches = List.copyOf(branches);
            if (branches.isEmpty()) {
                throw new IllegalArgumentException("conditional needs at least one branch");
            }
            elseBody = elseBody == null ? null : List.copyOf(elseBody);
        }

        public boolean hasElse() {
            return elseBody != null;
        }
    }

    /** One guarded body of a {@link Conditional}. */
    record Branch(Expr condition, List<Statement> body) {
        public Branch {
            Objects.requireNonNull(condition, "condition must not be null");
            body = List.copyOf(body);
        }
    }

    /** Bare expression such as a function call. */
    record ExpressionStatement(Expr expression, String trailingComment) implements Statement {}

    /** Full-line comment. */
    record Comment(String text) implements Statement {}

    /** Empty source line. */
    record BlankLine() implements Statement {}
}
