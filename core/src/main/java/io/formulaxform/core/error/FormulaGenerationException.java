package io.formulaxform.core.error;

/** Abstract parent for errors raised while producing generated source text. */
public abstract class FormulaGenerationException extends FormulaException {

    private static final long serialVersionUID = 1L;

    protected FormulaGenerationException(String message, String formulaKey) {
        super(message, formulaKey, Phase.GENERATION);
    }

    protected FormulaGenerationException(String message, Throwable cause, String formulaKey) {
        super(message, cause, formulaKey, Phase.GENERATION);
    }
}
