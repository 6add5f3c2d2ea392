package io.formulaxform.core.model;

/**
 * Structured compile-check result handed back to the caller.
 *
 * @param exitStatus   exit status of the compile step, {@code -1} if the unit could not be written
 * @param firstMessage first diagnostic message, or empty when there was none
 * @param errorCount   number of {@code error:} lines in the diagnostic stream
 */
public record CompileCheckResult(int exitStatus, String firstMessage, int errorCount) {

    public CompileCheckResult {
        firstMessage = firstMessage == null ? "" : firstMessage;
    }

    public boolean succeeded() {
        return exitStatus == 0 && errorCount == 0;
    }
}
