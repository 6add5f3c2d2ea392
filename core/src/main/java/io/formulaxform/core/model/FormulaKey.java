package io.formulaxform.core.model;

import java.util.Objects;

/**
 * Composite registry key. Volume formulas are keyed by {@code (entity, zone)}, boundary
 * formulas by {@code (zone, field)}; both render as {@code "first::second"}.
 *
 * @param first  entity name (volume) or boundary zone label (boundary)
 * @param second volume zone label (volume) or field name (boundary)
 */
public record FormulaKey(String first, String second) {

    /** Separator used in the composite text form. */
    public static final String SEPARATOR = "::";

    public FormulaKey {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
    }

    /** Key of a volume formula defining {@code entityName} over {@code zone}. */
    public static FormulaKey volume(String entityName, String zone) {
        return new FormulaKey(entityName, zone);
    }

    /** Key of a boundary formula defining {@code fieldName} on boundary {@code zone}. */
    public static FormulaKey boundary(String zone, String fieldName) {
        return new FormulaKey(zone, fieldName);
    }

    /** Composite text form, e.g. {@code "inlet::velocity"}. */
    public String composite() {
        return first + SEPARATOR + second;
    }

    @Override
    public String toString() {
        return composite();
    }
}
