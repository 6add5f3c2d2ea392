package io.formulaxform.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A symbol the case model declares for a volume formula.
 *
 * @param name          identifier as used in the expression
 * @param defaultLiteral numeric literal bound to the name, or {@code null} when the name samples a
 *                      field
 * @param fieldName     field sampled when there is no default; defaults to {@code name}
 */
public record SymbolDescriptor(String name, String defaultLiteral, String fieldName) {

    public SymbolDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        if (defaultLiteral != null && defaultLiteral.isBlank()) {
            defaultLiteral = null;
        }
        if (defaultLiteral != null) {
            defaultLiteral = defaultLiteral.trim();
        }
        fieldName = fieldName == null || fieldName.isBlank() ? name : fieldName;
    }

    /** Descriptor without default, sampling the field of the same name. */
    public static SymbolDescriptor of(String name) {
        return new SymbolDescriptor(name, null, null);
    }

    /** Descriptor bound to a literal default. */
    public static SymbolDescriptor withDefault(String name, String literal) {
        return new SymbolDescriptor(name, literal, null);
    }

    /** Descriptor sampling the named field. */
    public static SymbolDescriptor sampling(String name, String fieldName) {
        return new SymbolDescriptor(name, null, fieldName);
    }

    /**
     * Builds a descriptor from a free-text description. A description of the form
     * {@code "name = 1.5"} carries a default (the text after the last {@code '='}); any other
     * description names the sampled field, lower-cased.
     */
    public static SymbolDescriptor fromDescription(String name, String description) {
        if (description == null || description.isBlank()) {
            return of(name);
        }
        int eq = description.lastIndexOf('=');
        if (eq >= 0) {
            return withDefault(name, description.substring(eq + 1));
        }
        return sampling(name, description.trim().toLowerCase(Locale.ROOT));
    }

    /** {@code true} if this descriptor binds a literal default. */
    public boolean hasDefault() {
        return defaultLiteral != null;
    }
}
