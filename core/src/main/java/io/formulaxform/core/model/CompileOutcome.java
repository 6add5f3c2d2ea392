package io.formulaxform.core.model;

import java.util.List;

/**
 * Raw result of a native compile-and-link run.
 *
 * @param exitStatus process exit status, {@code 0} on success
 * @param errorLines captured diagnostic stream, one entry per line
 */
public record CompileOutcome(int exitStatus, List<String> errorLines) {

    public CompileOutcome {
        errorLines = errorLines == null ? List.of() : List.copyOf(errorLines);
    }

    /** Successful run without diagnostics. */
    public static CompileOutcome success() {
        return new CompileOutcome(0, List.of());
    }
}
