package io.formulaxform.core.error;

/**
 * Thrown when formula text cannot be tokenized or parsed. Line and column are 1-based and
 * point into the formula's own expression text.
 */
public final class FormulaSyntaxException extends FormulaLoadException {

    private static final long serialVersionUID = 1L;

    private final String reason;
    private final int line;
    private final int column;

    public FormulaSyntaxException(String reason, int line, int column) {
        this(reason, line, column, null);
    }

    public FormulaSyntaxException(String reason, int line, int column, String formulaKey) {
        super(
                (formulaKey != null ? "Formula '" + formulaKey + "': " : "") + reason + " (line " + line + ", column "
                        + column + ")",
                formulaKey,
                formulaKey);
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    /** Returns a copy of this error carrying the key of the formula being parsed. */
    public FormulaSyntaxException withFormulaKey(String formulaKey) {
        FormulaSyntaxException attached = new FormulaSyntaxException(reason, line, column, formulaKey);
        attached.setStackTrace(getStackTrace());
        return attached;
    }

    /** The error description without position or formula context. */
    public String reason() {
        return reason;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
