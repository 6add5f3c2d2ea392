package io.formulaxform.core.error;

import java.util.List;

/** Thrown when a case file does not conform to the bundled case-file JSON Schema. */
public final class CaseSchemaException extends FormulaLoadException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public CaseSchemaException(String message, List<String> violations, String source) {
        super(message, null, source);
        this.violations = List.copyOf(violations);
    }

    /** Individual schema violation messages, in validator order. */
    public List<String> violations() {
        return violations;
    }
}
