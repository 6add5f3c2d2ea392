package io.formulaxform.core.error;

/** Thrown when a registry lookup names a key that was never registered. */
public final class DefinitionNotFoundException extends FormulaGenerationException {

    private static final long serialVersionUID = 1L;

    public DefinitionNotFoundException(String message, String formulaKey) {
        super(message, formulaKey);
    }
}
