package io.formulaxform.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Environment variables take precedence over YAML values. A variable counts as set only if its
 * trimmed value is non-empty.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path minimalConfigPath;
    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        minimalConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/minimal-config.yaml")
                .toURI());
        fullConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/full-config.yaml")
                .toURI());
        envVars.clear();
    }

    @Nested
    @DisplayName("String overrides")
    class StringOverrides {

        @Test
        @DisplayName("FXF_CASE_FILE overrides case.file")
        void caseFile() {
            envVars.put("FXF_CASE_FILE", "/cases/pipe.yaml");

            assertThat(ConfigLoader.load(minimalConfigPath, envLookup()).caseFile())
                    .isEqualTo("/cases/pipe.yaml");
        }

        @Test
        @DisplayName("FXF_OUTPUT_DIR and FXF_TMP_DIR override the directories")
        void directories() {
            envVars.put("FXF_OUTPUT_DIR", "/out");
            envVars.put("FXF_TMP_DIR", "/scratch");

            GeneratorConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.outputDir()).isEqualTo("/out");
            assertThat(config.tmpDir()).isEqualTo("/scratch");
        }

        @Test
        @DisplayName("FXF_CHECK_COMMAND is split on whitespace")
        void checkCommand() {
            envVars.put("FXF_CHECK_COMMAND", "  mpicc  -fsyntax-only {unit} ");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).checkCommand())
                    .containsExactly("mpicc", "-fsyntax-only", "{unit}");
        }

        @Test
        @DisplayName("FXF_LOG_FORMAT and FXF_LOG_LEVEL override logging")
        void logging() {
            envVars.put("FXF_LOG_FORMAT", "text");
            envVars.put("FXF_LOG_LEVEL", "WARN");

            GeneratorConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        @DisplayName("FXF_CASE_FILE supplies a case file missing from YAML")
        void supplyMissingCaseFile() throws Exception {
            Path noCase = Path.of(EnvVarOverlayTest.class
                    .getClassLoader()
                    .getResource("config/no-case-config.yaml")
                    .toURI());
            envVars.put("FXF_CASE_FILE", "case.yaml");

            assertThat(ConfigLoader.load(noCase, envLookup()).caseFile()).isEqualTo("case.yaml");
        }
    }

    @Nested
    @DisplayName("Boolean overrides")
    class BooleanOverrides {

        @Test
        @DisplayName("FXF_CHECK_ENABLED=true enables the check")
        void enable() {
            envVars.put("FXF_CHECK_ENABLED", "true");

            assertThat(ConfigLoader.load(minimalConfigPath, envLookup()).checkEnabled())
                    .isTrue();
        }

        @Test
        @DisplayName("FXF_CHECK_ENABLED=false disables a YAML-enabled check")
        void disable() {
            envVars.put("FXF_CHECK_ENABLED", "false");

            assertThat(ConfigLoader.load(fullConfigPath, envLookup()).checkEnabled())
                    .isFalse();
        }
    }

    @Nested
    @DisplayName("Unset semantics")
    class UnsetSemantics {

        @Test
        @DisplayName("empty and blank values leave YAML values in place")
        void blankIsUnset() {
            envVars.put("FXF_OUTPUT_DIR", "");
            envVars.put("FXF_LOG_LEVEL", "   ");
            envVars.put("FXF_CHECK_ENABLED", " ");

            GeneratorConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.outputDir()).isEqualTo("build/generated");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(config.checkEnabled()).isTrue();
        }
    }
}
