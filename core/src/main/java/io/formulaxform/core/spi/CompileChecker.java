package io.formulaxform.core.spi;

import io.formulaxform.core.model.CompileOutcome;
import java.nio.file.Path;

/**
 * Native compile-and-link step run against a directory of generated units. Implementations
 * block until the native tool finishes and report its exit status and diagnostic lines; they
 * should not throw for compilation failures.
 */
@FunctionalInterface
public interface CompileChecker {

    CompileOutcome compileAndLink(Path targetDir);
}
