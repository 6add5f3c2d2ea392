package io.formulaxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Formula computing a boundary condition value on a boundary zone. Every required output is
 * written into the allocated output buffer.
 *
 * @param expression      expression text (multi-line)
 * @param requiredOutputs required output identifiers in buffer order, never empty
 * @param fieldName       owning field or variable name
 * @param zone            boundary zone label
 * @param condition       how the computed values are applied
 */
public record BoundaryFormula(
        String expression, List<String> requiredOutputs, String fieldName, String zone, ConditionKind condition)
        implements FormulaDefinition {

    public BoundaryFormula {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        requiredOutputs = List.copyOf(Objects.requireNonNull(requiredOutputs, "requiredOutputs must not be null"));
        if (requiredOutputs.isEmpty()) {
            throw new IllegalArgumentException(
                    "boundary formula for '" + fieldName + "' on '" + zone + "' needs a required output");
        }
    }

    @Override
    public FormulaKey key() {
        return FormulaKey.boundary(zone, fieldName);
    }

    @Override
    public String targetName() {
        return fieldName;
    }

    @Override
    public boolean perElement() {
        return condition.perElement();
    }

    /** Number of slots the generated block allocates per element (or in total when not looped). */
    public int outputCount() {
        return requiredOutputs.size();
    }
}
