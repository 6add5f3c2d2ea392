package io.formulaxform.core.error;

/** Thrown when a case file has invalid YAML, unknown keys, or missing required fields. */
public final class CaseParseException extends FormulaLoadException {

    private static final long serialVersionUID = 1L;

    public CaseParseException(String message, String formulaKey, String source) {
        super(message, formulaKey, source);
    }

    public CaseParseException(String message, Throwable cause, String formulaKey, String source) {
        super(message, cause, formulaKey, source);
    }
}
