package io.formulaxform.core.spi;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Source of notebook (user parameter) values. Generated code reads parameters by name at
 * runtime; the generator only needs to know whether a name is a parameter.
 */
@FunctionalInterface
public interface NotebookProvider {

    /** Value of the named parameter, or empty if the notebook has no such entry. */
    OptionalDouble lookup(String name);

    /** {@code true} if the notebook defines {@code name}. */
    default boolean contains(String name) {
        return lookup(name).isPresent();
    }

    /** Provider without parameters. */
    static NotebookProvider empty() {
        return name -> OptionalDouble.empty();
    }

    /** Provider backed by a fixed map. */
    static NotebookProvider of(Map<String, Double> values) {
        Map<String, Double> copy = Map.copyOf(values);
        return name -> {
            Double value = copy.get(name);
            return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
        };
    }
}
