package io.formulaxform.core.error;

/**
 * Abstract parent for errors raised while collecting formulas: reading the case file,
 * registering definitions and parsing expression text. Carries an additional {@code source}
 * field identifying the file or formula that caused the error.
 */
public abstract class FormulaLoadException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected FormulaLoadException(String message, String formulaKey, String source) {
        super(message, formulaKey, Phase.LOAD);
        this.source = source;
    }

    protected FormulaLoadException(String message, Throwable cause, String formulaKey, String source) {
        super(message, cause, formulaKey, Phase.LOAD);
        this.source = source;
    }

    /** The file path or formula identifier that caused the error. */
    public String source() {
        return source;
    }
}
