package io.formulaxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Formula computing a physical property over a volume zone. Only the first required output is
 * bound to the result slot of the generated block.
 *
 * @param expression      expression text (multi-line)
 * @param requiredOutputs required output identifiers, never empty
 * @param symbols         known symbol descriptors, in declared order
 * @param scalars         names of scalar fields the formula may sample
 * @param entityName      owning entity (property field) name, e.g. {@code density_1}
 * @param zone            volume zone label
 */
public record VolumeFormula(
        String expression,
        List<String> requiredOutputs,
        List<SymbolDescriptor> symbols,
        List<String> scalars,
        String entityName,
        String zone)
        implements FormulaDefinition {

    /** Zone label used when a formula does not name one. */
    public static final String DEFAULT_ZONE = "all_cells";

    public VolumeFormula {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(entityName, "entityName must not be null");
        requiredOutputs = List.copyOf(Objects.requireNonNull(requiredOutputs, "requiredOutputs must not be null"));
        if (requiredOutputs.isEmpty()) {
            throw new IllegalArgumentException("volume formula for '" + entityName + "' needs a required output");
        }
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
        scalars = scalars == null ? List.of() : List.copyOf(scalars);
        zone = zone == null || zone.isBlank() ? DEFAULT_ZONE : zone;
    }

    @Override
    public FormulaKey key() {
        return FormulaKey.volume(entityName, zone);
    }

    @Override
    public String targetName() {
        return entityName;
    }

    @Override
    public boolean perElement() {
        return true;
    }

    /** Phase encoded in the entity name's numeric suffix, if any. */
    public PhaseIndex phase() {
        return PhaseIndex.parse(entityName);
    }
}
