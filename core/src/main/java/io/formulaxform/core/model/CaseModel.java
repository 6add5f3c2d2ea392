package io.formulaxform.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Formulas collected from a case, ready for one generation pass.
 *
 * @param variant  host package the code is generated for
 * @param notebook notebook parameters by name, in declared order
 * @param volume   volume formulas, in declared order
 * @param boundary boundary formulas, in declared order
 */
public record CaseModel(
        PackageVariant variant, Map<String, Double> notebook, List<VolumeFormula> volume, List<BoundaryFormula> boundary) {

    public CaseModel {
        Objects.requireNonNull(variant, "variant must not be null");
        notebook = notebook == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(notebook));
        volume = volume == null ? List.of() : List.copyOf(volume);
        boundary = boundary == null ? List.of() : List.copyOf(boundary);
    }
}
