package io.formulaxform.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * How a boundary formula's result is applied. The {@link #tag()} is the condition string the
 * generated dispatch block compares against; several kinds share a tag and are told apart by
 * the field name in the guard.
 *
 * <p>
 * The two flow-integral kinds ({@link #MASS_FLOW}, {@link #VOLUME_FLOW}) are evaluated once for
 * the whole zone; every other kind is evaluated per boundary face.
 */
public enum ConditionKind {
    NORMAL_VELOCITY("norm_formula", true, "velocity", List.of("u_norm")),
    MASS_FLOW("flow1_formula", false, "velocity", List.of("q_m")),
    VOLUME_FLOW("flow2_formula", false, "velocity", List.of("q_v")),
    DIRECTION("formula", true, "direction", List.of("dir_x", "dir_y", "dir_z")),
    TURBULENCE("formula", true, null, List.of()),
    HEAD_LOSS("formula", true, "head_loss", List.of("K")),
    HYDRAULIC_HEAD("dirichlet_formula", true, "hydraulic_head", List.of("H")),
    DIRICHLET("dirichlet_formula", true, null, List.of()),
    NEUMANN("neumann_formula", true, null, List.of("flux")),
    EXCHANGE_COEFFICIENT("exchange_coefficient_formula", true, null, List.of());

    private final String tag;
    private final boolean perElement;
    private final String defaultFieldName;
    private final List<String> fixedOutputs;

    ConditionKind(String tag, boolean perElement, String defaultFieldName, List<String> fixedOutputs) {
        this.tag = tag;
        this.perElement = perElement;
        this.defaultFieldName = defaultFieldName;
        this.fixedOutputs = fixedOutputs;
    }

    /** Condition string written into the generated guard. */
    public String tag() {
        return tag;
    }

    /** {@code true} unless the kind is a flow integral evaluated once per zone. */
    public boolean perElement() {
        return perElement;
    }

    /** Field name implied by the kind, if it implies one. */
    public Optional<String> defaultFieldName() {
        return Optional.ofNullable(defaultFieldName);
    }

    /**
     * Required outputs implied by the kind for the given field. Turbulence outputs depend on the
     * turbulence model and are resolved through {@link TurbulenceModel#requiredOutputs()}; this
     * method returns an empty list for {@link #TURBULENCE}.
     */
    public List<String> defaultOutputs(String fieldName) {
        switch (this) {
            case DIRICHLET:
                return List.of(fieldName);
            case EXCHANGE_COEFFICIENT:
                return List.of(fieldName, "hc");
            default:
                return fixedOutputs;
        }
    }

    /**
     * Resolves a kind from its enum name (case-insensitive, {@code -} accepted for {@code _}) or,
     * when unambiguous, from its tag.
     *
     * @return the kind, or empty if the text names no kind or an ambiguous tag
     */
    public static Optional<ConditionKind> fromText(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = text.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ConditionKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return Optional.of(kind);
            }
        }
        ConditionKind byTag = null;
        for (ConditionKind kind : values()) {
            if (kind.tag.equals(text.trim())) {
                if (byTag != null) {
                    return Optional.empty();
                }
                byTag = kind;
            }
        }
        return Optional.ofNullable(byTag);
    }
}
