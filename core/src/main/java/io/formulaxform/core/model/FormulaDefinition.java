package io.formulaxform.core.model;

import java.util.List;

/**
 * A user-authored formula collected from the case model. Implementations are immutable and
 * known at compile time: {@link VolumeFormula} and {@link BoundaryFormula}.
 */
public sealed interface FormulaDefinition permits VolumeFormula, BoundaryFormula {

    /** Registry key of this definition. */
    FormulaKey key();

    /** Multi-line expression text as authored. */
    String expression();

    /** Identifiers whose final values are written to the result location, in declared order. */
    List<String> requiredOutputs();

    /** Name of the entity (volume) or field (boundary) the formula computes. */
    String targetName();

    /** Volume zone or boundary zone label the formula applies to. */
    String zone();

    /** {@code true} if the generated block iterates over the zone's elements. */
    boolean perElement();
}
