package io.formulaxform.core.model;

import java.util.Optional;

/**
 * Category a formula identifier resolves to. The variants are listed in resolution precedence
 * order (for names first met as a read); {@link Local} and {@link Output} are decided by
 * position rather than by lookup.
 *
 * <p>
 * Declarations are returned without indentation or trailing newline; the assembler places
 * them. {@link #elementBinding(String)} takes the name of the native element-index variable of
 * the enclosing loop ({@code c_id} or {@code f_id}).
 */
public sealed interface ResolvedSymbol {

    /** Identifier as written in the formula. */
    String name();

    /** Identifier written into generated statements. */
    default String nativeName() {
        return name();
    }

    /** Block-level declaration emitted once before the element loop. */
    default Optional<String> declaration() {
        return Optional.empty();
    }

    /** Per-element declaration emitted once at the top of the loop body. */
    default Optional<String> elementBinding(String indexVar) {
        return Optional.empty();
    }

    /** {@code true} if this symbol needs the block's shared coordinate array. */
    default boolean needsCoordinates() {
        return false;
    }

    /**
     * Time/iteration names and the circular constant.
     *
     * @param name       formula identifier ({@code t}, {@code dt}, {@code iter}, {@code pi})
     * @param nativeName identifier used in the generated code
     * @param statement  declaration statement
     */
    record Reserved(String name, String nativeName, String statement) implements ResolvedSymbol {

        /** Resolves one of the reserved names, or empty. */
        public static Optional<Reserved> lookup(String name) {
            switch (name) {
                case "t":
                    return Optional.of(new Reserved("t", "time", "const cs_real_t time = cs_glob_time_step->t_cur;"));
                case "dt":
                    return Optional.of(new Reserved("dt", "dt", "const cs_real_t dt = cs_glob_time_step->dt;"));
                case "iter":
                    return Optional.of(new Reserved("iter", "iter", "const int iter = cs_glob_time_step->nt_cur;"));
                case "pi":
                    return Optional.of(new Reserved("pi", "pi", "const cs_real_t pi = cs_math_pi;"));
                default:
                    return Optional.empty();
            }
        }

        @Override
        public Optional<String> declaration() {
            return Optional.of(statement);
        }
    }

    /**
     * Spatial coordinate of the current element's centre.
     *
     * @param name formula identifier ({@code x}, {@code y}, {@code z})
     * @param axis 0, 1 or 2
     */
    record Coordinate(String name, int axis) implements ResolvedSymbol {

        /** Resolves a coordinate name, or empty. */
        public static Optional<Coordinate> lookup(String name) {
            switch (name) {
                case "x":
                    return Optional.of(new Coordinate("x", 0));
                case "y":
                    return Optional.of(new Coordinate("y", 1));
                case "z":
                    return Optional.of(new Coordinate("z", 2));
                default:
                    return Optional.empty();
            }
        }

        @Override
        public Optional<String> elementBinding(String indexVar) {
            return Optional.of("const cs_real_t " + name + " = xyz[" + indexVar + "][" + axis + "];");
        }

        @Override
        public boolean needsCoordinates() {
            return true;
        }
    }

    /** Notebook parameter read by name at runtime. */
    record Parameter(String name) implements ResolvedSymbol {
        @Override
        public Optional<String> declaration() {
            return Optional.of(
                    "const cs_real_t " + name + " = cs_notebook_parameter_value_by_name(\"" + name + "\");");
        }
    }

    /**
     * Physical constant of the active package variant.
     *
     * @param accessor accessor path, e.g. {@code cs_glob_fluid_properties->ro0}
     */
    record Constant(String name, String accessor) implements ResolvedSymbol {
        @Override
        public Optional<String> declaration() {
            return Optional.of("const cs_real_t " + name + " = " + accessor + ";");
        }
    }

    /** Symbol bound to the literal default of its descriptor. */
    record LiteralDefault(String name, String literal) implements ResolvedSymbol {
        @Override
        public Optional<String> declaration() {
            return Optional.of("const cs_real_t " + name + " = " + literal + ";");
        }
    }

    /** Value of a field at the current element (descriptor without default, or fallback). */
    record FieldSample(String name, String fieldName) implements ResolvedSymbol {
        @Override
        public Optional<String> declaration() {
            return Optional.of(valuesPointer(name, fieldName));
        }

        @Override
        public Optional<String> elementBinding(String indexVar) {
            return Optional.of(sampleAt(name, indexVar));
        }
    }

    /** Value of a declared scalar field at the current element. */
    record ScalarSample(String name) implements ResolvedSymbol {
        @Override
        public Optional<String> declaration() {
            return Optional.of(valuesPointer(name, name));
        }

        @Override
        public Optional<String> elementBinding(String indexVar) {
            return Optional.of(sampleAt(name, indexVar));
        }
    }

    /** User temporary declared at its first assignment. */
    record Local(String name) implements ResolvedSymbol {}

    /**
     * Required output bound to a result slot at its first occurrence.
     *
     * @param index position in the formula's required-output list
     */
    record Output(String name, int index) implements ResolvedSymbol {}

    private static String valuesPointer(String name, String fieldName) {
        return "const cs_real_t *" + name + "_vals = cs_field_by_name(\"" + fieldName + "\")->val;";
    }

    private static String sampleAt(String name, String indexVar) {
        return "const cs_real_t " + name + " = " + name + "_vals[" + indexVar + "];";
    }
}
