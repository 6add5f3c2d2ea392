package io.formulaxform.core.model;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Host solver whose naming conventions apply to physical-constant resolution and to the
 * properties a volume formula may define.
 */
public enum PackageVariant {
    CODE_SATURNE(
            "code_saturne",
            "cs_glob_fluid_properties",
            Map.of("rho0", "ro0", "mu0", "viscl0", "p0", "p0", "cp0", "cp0"),
            Set.of("density", "molecular_viscosity", "specific_heat", "thermal_conductivity", "volume_viscosity"),
            ""),
    NEPTUNE_CFD(
            "neptune_cfd",
            "nc_phases->p_ini[PHASE_ID]",
            Map.of("rho0", "ro0", "mu0", "viscl0", "cp0", "cp0", "lambda0", "lambda0"),
            Set.of(
                    "density",
                    "molecular_viscosity",
                    "specific_heat",
                    "thermal_conductivity",
                    "d_rho_d_P",
                    "d_rho_d_h",
                    "temperature"),
            "#include \"nc_phases.h\"\n\n");

    /** Placeholder substituted with the 0-based phase index in phase-scoped accessors. */
    public static final String PHASE_PLACEHOLDER = "PHASE_ID";

    private final String id;
    private final String propertiesStruct;
    private final Map<String, String> constantMembers;
    private final Set<String> authorizedProperties;
    private final String extraIncludes;

    PackageVariant(
            String id,
            String propertiesStruct,
            Map<String, String> constantMembers,
            Set<String> authorizedProperties,
            String extraIncludes) {
        this.id = id;
        this.propertiesStruct = propertiesStruct;
        this.constantMembers = constantMembers;
        this.authorizedProperties = authorizedProperties;
        this.extraIncludes = extraIncludes;
    }

    /** Identifier used in case files, e.g. {@code code_saturne}. */
    public String id() {
        return id;
    }

    /** {@code true} if constant accessors of this variant are indexed by phase. */
    public boolean requiresPhase() {
        return propertiesStruct.contains(PHASE_PLACEHOLDER);
    }

    /** {@code true} if {@code name} is a physical constant of this variant. */
    public boolean hasConstant(String name) {
        return constantMembers.containsKey(name);
    }

    /**
     * Resolves the accessor path of a physical constant.
     *
     * @param name  constant name as used in formulas, e.g. {@code rho0}
     * @param phase phase parsed from the entity name
     * @return the accessor path, or empty if the name is no constant of this variant or the
     *     variant needs a phase and none was given
     */
    public Optional<String> constantAccessor(String name, PhaseIndex phase) {
        String member = constantMembers.get(name);
        if (member == null) {
            return Optional.empty();
        }
        if (!requiresPhase()) {
            return Optional.of(propertiesStruct + "->" + member);
        }
        if (phase instanceof PhaseIndex.Of of) {
            return Optional.of(
                    propertiesStruct.replace(PHASE_PLACEHOLDER, Integer.toString(of.index())) + "->" + member);
        }
        return Optional.empty();
    }

    /** Property names a volume formula may define under this variant. */
    public Set<String> authorizedProperties() {
        return authorizedProperties;
    }

    /** Additional include lines of the volume unit's prologue. */
    public String extraIncludes() {
        return extraIncludes;
    }

    /** Resolves a variant from its case-file identifier or enum name. */
    public static Optional<PackageVariant> fromId(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (PackageVariant variant : values()) {
            if (variant.id.equals(text) || variant.name().equalsIgnoreCase(text.replace('-', '_'))) {
                return Optional.of(variant);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
