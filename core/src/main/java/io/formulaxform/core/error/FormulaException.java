package io.formulaxform.core.error;

/**
 * Abstract base for all formula-xform exceptions. Never thrown directly; use the concrete
 * subclasses under {@link FormulaLoadException} or {@link FormulaGenerationException}.
 */
public abstract class FormulaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        GENERATION
    }

    private final String formulaKey;
    private final Phase phase;

    protected FormulaException(String message, String formulaKey, Phase phase) {
        super(message);
        this.formulaKey = formulaKey;
        this.phase = phase;
    }

    protected FormulaException(String message, Throwable cause, String formulaKey, Phase phase) {
        super(message, cause);
        this.formulaKey = formulaKey;
        this.phase = phase;
    }

    /** Composite key of the formula that triggered the error, or {@code null} if not yet identified. */
    public String formulaKey() {
        return formulaKey;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
