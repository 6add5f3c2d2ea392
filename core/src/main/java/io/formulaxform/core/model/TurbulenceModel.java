package io.formulaxform.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Turbulence models accepted for turbulence boundary formulas, each with the field name of its
 * generated block and the ordered components the formula must set. Reynolds-stress components
 * follow the solver's storage order ({@code r23} before {@code r13}).
 */
public enum TurbulenceModel {
    K_EPSILON("k-epsilon", "turbulence_ke", List.of("k", "epsilon")),
    K_EPSILON_PL("k-epsilon-PL", "turbulence_ke", List.of("k", "epsilon")),
    RIJ_EPSILON("Rij-epsilon", "turbulence_rije", List.of("r11", "r22", "r33", "r12", "r23", "r13", "epsilon")),
    RIJ_SSG("Rij-SSG", "turbulence_rije", List.of("r11", "r22", "r33", "r12", "r23", "r13", "epsilon")),
    RIJ_EBRSM(
            "Rij-EBRSM",
            "turbulence_rij_ebrsm",
            List.of("r11", "r22", "r33", "r12", "r23", "r13", "epsilon", "alpha")),
    V2F_BL_V2K("v2f-BL-v2/k", "turbulence_v2f", List.of("k", "epsilon", "phi", "alpha")),
    K_OMEGA_SST("k-omega-SST", "turbulence_kw", List.of("k", "omega")),
    SPALART_ALLMARAS("Spalart-Allmaras", "turbulence_spalart", List.of("nu_tilda"));

    private final String label;
    private final String fieldName;
    private final List<String> requiredOutputs;

    TurbulenceModel(String label, String fieldName, List<String> requiredOutputs) {
        this.label = label;
        this.fieldName = fieldName;
        this.requiredOutputs = requiredOutputs;
    }

    /** Model label as written in case files, e.g. {@code k-omega-SST}. */
    public String label() {
        return label;
    }

    public String fieldName() {
        return fieldName;
    }

    public List<String> requiredOutputs() {
        return requiredOutputs;
    }

    /** Resolves a model from its label (exact match) or enum name. */
    public static Optional<TurbulenceModel> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (TurbulenceModel model : values()) {
            if (model.label.equals(text) || model.name().equalsIgnoreCase(text)) {
                return Optional.of(model);
            }
        }
        return Optional.empty();
    }
}
