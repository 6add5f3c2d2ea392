package io.formulaxform.core.model;

import java.util.Objects;

/**
 * A generated translation unit.
 *
 * @param fileName file name inside the output directory
 * @param source   complete source text, empty when no formula was registered for the unit
 */
public record GeneratedUnit(String fileName, String source) {

    public static final String VOLUME_FILE = "cs_meg_volume_function.c";
    public static final String BOUNDARY_FILE = "cs_meg_boundary_function.c";

    public GeneratedUnit {
        Objects.requireNonNull(fileName, "fileName must not be null");
        source = source == null ? "" : source;
    }

    public boolean isEmpty() {
        return source.isEmpty();
    }
}
