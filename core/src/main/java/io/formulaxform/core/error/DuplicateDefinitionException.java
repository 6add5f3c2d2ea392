package io.formulaxform.core.error;

/**
 * Thrown when a formula is registered under a key that already holds a definition. Aborts the
 * whole generation pass.
 */
public final class DuplicateDefinitionException extends FormulaLoadException {

    private static final long serialVersionUID = 1L;

    private final String priorExpression;

    public DuplicateDefinitionException(String message, String formulaKey, String priorExpression) {
        super(message, formulaKey, formulaKey);
        this.priorExpression = priorExpression;
    }

    /** Expression text of the definition that already occupies the key. */
    public String priorExpression() {
        return priorExpression;
    }
}
