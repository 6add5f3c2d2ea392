package io.formulaxform.standalone.check;

import io.formulaxform.core.model.CompileOutcome;
import io.formulaxform.core.model.GeneratedUnit;
import io.formulaxform.core.spi.CompileChecker;
import io.formulaxform.standalone.config.GeneratorConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CompileChecker} running a native compiler as a child process in the target directory.
 * The compiler's standard output and error go to {@code comp.out} and {@code comp.err} inside
 * that directory; the lines of {@code comp.err} are returned as the diagnostic stream.
 *
 * <p>
 * The call blocks until the process exits; there is no timeout. A process that cannot be
 * started is reported as exit status {@code -1} with a single {@code error:} line.
 */
public final class ProcessCompileChecker implements CompileChecker {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessCompileChecker.class);

    static final String STDOUT_FILE = "comp.out";
    static final String STDERR_FILE = "comp.err";

    private final List<String> command;

    /**
     * @param command command line; {@link GeneratorConfig#UNIT_PLACEHOLDER} is replaced by the
     *                path of the volume unit
     */
    public ProcessCompileChecker(List<String> command) {
        Objects.requireNonNull(command, "command must not be null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("compile command must not be empty");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public CompileOutcome compileAndLink(Path targetDir) {
        List<String> resolved = resolve(targetDir);
        Path stderr = targetDir.resolve(STDERR_FILE);
        ProcessBuilder builder = new ProcessBuilder(resolved)
                .directory(targetDir.toFile())
                .redirectOutput(targetDir.resolve(STDOUT_FILE).toFile())
                .redirectError(stderr.toFile());
        LOG.debug("Running compile check: {}", resolved);
        int exitStatus;
        try {
            exitStatus = builder.start().waitFor();
        } catch (IOException e) {
            LOG.error("Cannot start compile command {}: {}", resolved, e.getMessage());
            return new CompileOutcome(
                    -1, List.of("error: cannot run " + resolved.get(0), String.valueOf(e.getMessage())));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new CompileOutcome(-1, List.of("error: compile check interrupted", ""));
        }
        return new CompileOutcome(exitStatus, readLines(stderr));
    }

    List<String> resolve(Path targetDir) {
        String unit = targetDir.resolve(GeneratedUnit.VOLUME_FILE).toString();
        List<String> resolved = new ArrayList<>(command.size());
        for (String part : command) {
            resolved.add(part.replace(GeneratorConfig.UNIT_PLACEHOLDER, unit));
        }
        return resolved;
    }

    private static List<String> readLines(Path file) {
        try {
            return Files.exists(file) ? Files.readAllLines(file, StandardCharsets.UTF_8) : List.of();
        } catch (IOException e) {
            LOG.warn("Cannot read compiler diagnostics {}: {}", file, e.getMessage());
            return List.of();
        }
    }
}
