package io.formulaxform.core.parse;

import io.formulaxform.core.parse.ast.Statement;
import java.util.List;

/**
 * Parsed formula: the top-level statements in source order.
 *
 * @param statements top-level statements
 */
public record FormulaProgram(List<Statement> statements) {

    public FormulaProgram {
        statements = List.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
