package io.formulaxform.core.engine;

import io.formulaxform.core.model.CompileCheckResult;
import io.formulaxform.core.model.CompileOutcome;
import java.util.List;

/**
 * Reduces a native compiler's diagnostic stream to a {@link CompileCheckResult}. Every line
 * containing {@code error:} counts as one error; its message is the text after the marker
 * followed by the next line, both trimmed and newline-terminated.
 */
public final class CompileDiagnostics {

    static final String ERROR_MARKER = "error:";

    private CompileDiagnostics() {}

    /** Summarizes an outcome. A zero exit status yields no message and no error count. */
    public static CompileCheckResult summarize(CompileOutcome outcome) {
        if (outcome.exitStatus() == 0) {
            return new CompileCheckResult(0, "", 0);
        }
        List<String> lines = outcome.errorLines();
        String firstMessage = null;
        int errors = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int marker = line.lastIndexOf(ERROR_MARKER);
            if (marker < 0) {
                continue;
            }
            errors++;
            if (firstMessage == null) {
                String next = i + 1 < lines.size() ? lines.get(i + 1).trim() : "";
                firstMessage = line.substring(marker + ERROR_MARKER.length()).trim() + "\n" + next + "\n";
            }
        }
        return new CompileCheckResult(outcome.exitStatus(), firstMessage, errors);
    }
}
