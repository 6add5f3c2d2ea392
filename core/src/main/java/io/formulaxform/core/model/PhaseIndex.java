package io.formulaxform.core.model;

/**
 * Phase addressed by a multiphase entity name. Entity names such as {@code density_2} carry a
 * 1-based phase number after the last {@code '_'}; the index held here is 0-based. A name
 * without a numeric suffix maps to {@link None}, never to phase 0.
 */
public sealed interface PhaseIndex {

    /** {@code true} if a phase was parsed. */
    boolean isPresent();

    /** No phase could be parsed from the entity name. */
    record None() implements PhaseIndex {
        @Override
        public boolean isPresent() {
            return false;
        }
    }

    /**
     * A 0-based phase index.
     *
     * @param index 0-based index, never negative
     */
    record Of(int index) implements PhaseIndex {
        public Of {
            if (index < 0) {
                throw new IllegalArgumentException("phase index must not be negative, got: " + index);
            }
        }

        @Override
        public boolean isPresent() {
            return true;
        }
    }

    static PhaseIndex none() {
        return new None();
    }

    static PhaseIndex of(int index) {
        return new Of(index);
    }

    /**
     * Parses the trailing {@code _<N>} suffix of an entity name ({@code N >= 1}).
     *
     * @return {@code Of(N - 1)}, or {@link None} when the suffix is absent or not a positive integer
     */
    static PhaseIndex parse(String entityName) {
        if (entityName == null) {
            return none();
        }
        int sep = entityName.lastIndexOf('_');
        if (sep < 0 || sep == entityName.length() - 1) {
            return none();
        }
        String suffix = entityName.substring(sep + 1);
        for (int i = 0; i < suffix.length(); i++) {
            if (!Character.isDigit(suffix.charAt(i))) {
                return none();
            }
        }
        try {
            int number = Integer.parseInt(suffix);
            return number >= 1 ? of(number - 1) : none();
        } catch (NumberFormatException e) {
            // digits only, so this is an overflow
            return none();
        }
    }
}
