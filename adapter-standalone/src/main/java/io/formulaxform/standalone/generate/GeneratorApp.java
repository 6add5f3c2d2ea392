package io.formulaxform.standalone.generate;

import io.formulaxform.core.casefile.CaseFileParser;
import io.formulaxform.core.engine.CodeGenerator;
import io.formulaxform.core.error.FormulaException;
import io.formulaxform.core.model.CaseModel;
import io.formulaxform.core.model.CompileCheckResult;
import io.formulaxform.core.model.WriteStatus;
import io.formulaxform.core.spi.CompileChecker;
import io.formulaxform.standalone.LogbackConfigurator;
import io.formulaxform.standalone.check.ProcessCompileChecker;
import io.formulaxform.standalone.config.ConfigLoadException;
import io.formulaxform.standalone.config.ConfigLoader;
import io.formulaxform.standalone.config.GeneratorConfig;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one generation pass from the command line.
 *
 * <ol>
 * <li>Load the configuration ({@code --config} or {@code formula-xform.yaml}, env overlay).
 * <li>Reconfigure Logback from {@code logging.format} and {@code logging.level}.
 * <li>Parse the case file and register its formulas.
 * <li>Optionally compile-check the volume unit in the scratch directory, then remove it.
 * <li>Write both units to the output directory.
 * </ol>
 */
public final class GeneratorApp {

    private static final Logger LOG = LoggerFactory.getLogger(GeneratorApp.class);

    /** Exit code of a successful run. */
    public static final int EXIT_OK = 0;

    /** Exit code when configuration, case file or output writing fails. */
    public static final int EXIT_FAILURE = 1;

    /** Exit code when the compile check reports errors. */
    public static final int EXIT_CHECK_FAILED = 2;

    private final Function<String, String> envLookup;
    private final Function<List<String>, CompileChecker> checkerFactory;

    public GeneratorApp(Function<String, String> envLookup, Function<List<String>, CompileChecker> checkerFactory) {
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
        this.checkerFactory = Objects.requireNonNull(checkerFactory, "checkerFactory must not be null");
    }

    /** Runs with the process environment and the native compiler. */
    public static int run(String[] args) {
        return new GeneratorApp(System::getenv, ProcessCompileChecker::new).execute(args);
    }

    /**
     * Runs one pass.
     *
     * @return {@link #EXIT_OK}, {@link #EXIT_FAILURE} or {@link #EXIT_CHECK_FAILED}
     */
    public int execute(String[] args) {
        long startTime = System.nanoTime();
        GeneratorConfig config;
        Path configPath;
        try {
            configPath = ConfigLoader.resolveConfigPath(args);
            config = ConfigLoader.load(configPath, envLookup);
        } catch (ConfigLoadException | IllegalArgumentException e) {
            LOG.error("Configuration failed: {}", e.getMessage());
            return EXIT_FAILURE;
        }
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);

        CodeGenerator generator;
        try {
            CaseModel caseModel = new CaseFileParser().parse(Path.of(config.caseFile()));
            generator = CodeGenerator.fromCase(caseModel);
            // expression syntax errors surface here, before anything is written
            generator.volumeSource();
            generator.boundarySource();
        } catch (FormulaException e) {
            LOG.error("Case {} rejected: {}", config.caseFile(), e.getMessage());
            return EXIT_FAILURE;
        }

        if (!generator.hasFormulas()) {
            LOG.info("Case {} defines no formula", config.caseFile());
        }

        if (config.checkEnabled() && !generator.volumeFormulas().isEmpty()) {
            Path tmpDir = Path.of(config.tmpDir());
            CompileCheckResult result;
            try {
                result = generator.checkVolumeSyntax(tmpDir, checkerFactory.apply(config.checkCommand()));
            } finally {
                generator.cleanDirectory(tmpDir);
            }
            if (!result.succeeded()) {
                LOG.error(
                        "Compile check failed (status {}, {} error(s)); first error:\n{}",
                        result.exitStatus(),
                        result.errorCount(),
                        result.firstMessage());
                return EXIT_CHECK_FAILED;
            }
        }

        WriteStatus status = generator.saveAll(Path.of(config.outputDir()));
        if (status == WriteStatus.FAILED) {
            LOG.error("Writing generated units to {} failed", config.outputDir());
            return EXIT_FAILURE;
        }
        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        LOG.info("Generation finished in {} ms (status {})", elapsedMs, status);
        return EXIT_OK;
    }
}
