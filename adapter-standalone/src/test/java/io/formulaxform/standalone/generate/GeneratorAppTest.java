package io.formulaxform.standalone.generate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.formulaxform.core.model.CompileOutcome;
import io.formulaxform.core.model.GeneratedUnit;
import io.formulaxform.core.spi.CompileChecker;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("GeneratorApp")
class GeneratorAppTest {

    private static final String CASE = """
            package: code_saturne
            notebook:
              inlet_temp: 300
            volume:
              - property: density
                required: [density]
                expression: density = rho0 * (1 - 3.4e-3 * (inlet_temp - 293))
            boundary:
              - zone: inlet
                condition: mass_flow
                expression: q_m = 0.5
            """;

    @TempDir
    Path tempDir;

    private final Map<String, String> envVars = new HashMap<>();
    private final List<List<String>> requestedCommands = new ArrayList<>();
    private CompileChecker checker;
    private Path outputDir;
    private Path scratchDir;

    @BeforeEach
    void setUp() {
        checker = mock(CompileChecker.class);
        outputDir = tempDir.resolve("src");
        scratchDir = tempDir.resolve("tmp");
        envVars.put("FXF_LOG_LEVEL", "WARN");
    }

    private GeneratorApp app() {
        return new GeneratorApp(envVars::get, command -> {
            requestedCommands.add(command);
            return checker;
        });
    }

    private Path writeCase(String yaml) throws IOException {
        return Files.writeString(tempDir.resolve("case.yaml"), yaml);
    }

    private Path writeConfig(Path caseFile, boolean check) throws IOException {
        String config = "case:\n"
                + "  file: '" + caseFile + "'\n"
                + "output:\n"
                + "  dir: '" + outputDir + "'\n"
                + "check:\n"
                + "  enabled: " + check + "\n"
                + "  tmp-dir: '" + scratchDir + "'\n"
                + "  command: [cc, -fsyntax-only, '{unit}']\n";
        return Files.writeString(tempDir.resolve("formula-xform.yaml"), config);
    }

    private int run(Path config) {
        return app().execute(new String[] {"--config", config.toString()});
    }

    @Nested
    @DisplayName("Generation")
    class Generation {

        @Test
        @DisplayName("writes both units and exits 0")
        void writesBothUnits() throws IOException {
            Path config = writeConfig(writeCase(CASE), false);

            assertThat(run(config)).isEqualTo(GeneratorApp.EXIT_OK);

            assertThat(Files.readString(outputDir.resolve(GeneratedUnit.VOLUME_FILE)))
                    .contains("const cs_real_t rho0 = cs_glob_fluid_properties->ro0;")
                    .contains("f->val[c_id] = rho0 * (1 - 3.4e-3 * (inlet_temp - 293));");
            assertThat(Files.readString(outputDir.resolve(GeneratedUnit.BOUNDARY_FILE)))
                    .contains("new_vals[0] = 0.5;");
            verify(checker, never()).compileAndLink(any());
        }

        @Test
        @DisplayName("missing configuration exits 1")
        void missingConfig() {
            assertThat(run(tempDir.resolve("absent.yaml"))).isEqualTo(GeneratorApp.EXIT_FAILURE);
        }

        @Test
        @DisplayName("--config without path exits 1")
        void configWithoutPath() {
            assertThat(app().execute(new String[] {"--config"})).isEqualTo(GeneratorApp.EXIT_FAILURE);
        }

        @Test
        @DisplayName("formula syntax error exits 1 before anything is written")
        void syntaxError() throws IOException {
            Path config = writeConfig(
                    writeCase("package: code_saturne\nvolume:\n  - property: density\n    required: [density]\n"
                            + "    expression: density = (1 +\n"),
                    false);

            assertThat(run(config)).isEqualTo(GeneratorApp.EXIT_FAILURE);
            assertThat(outputDir).doesNotExist();
        }

        @Test
        @DisplayName("duplicate formula exits 1")
        void duplicate() throws IOException {
            String volume = "  - property: density\n    required: [density]\n    expression: density = 1\n";
            Path config = writeConfig(writeCase("package: code_saturne\nvolume:\n" + volume + volume), false);

            assertThat(run(config)).isEqualTo(GeneratorApp.EXIT_FAILURE);
        }

        @Test
        @DisplayName("unwritable output directory exits 1")
        void unwritableOutput() throws IOException {
            Path config = writeConfig(writeCase(CASE), false);
            Files.writeString(outputDir, "not a directory");

            assertThat(run(config)).isEqualTo(GeneratorApp.EXIT_FAILURE);
        }

        @Test
        @DisplayName("volume unit that cannot be written exits 1 even when the boundary unit is")
        void volumeUnitBlocked() throws IOException {
            Path config = writeConfig(writeCase(CASE), false);
            Path squatter = Files.createDirectories(outputDir.resolve(GeneratedUnit.VOLUME_FILE));
            Files.writeString(squatter.resolve("keep"), "x");

            assertThat(run(config)).isEqualTo(GeneratorApp.EXIT_FAILURE);
            assertThat(outputDir.resolve(GeneratedUnit.BOUNDARY_FILE)).exists();
        }
    }

    @Nested
    @DisplayName("Compile check")
    class CompileCheck {

        @Test
        @DisplayName("passing check writes the units and removes the scratch directory")
        void passingCheck() throws IOException {
            when(checker.compileAndLink(scratchDir)).thenReturn(CompileOutcome.success());
            Path config = writeConfig(writeCase(CASE), true);

            assertThat(run(config)).isEqualTo(GeneratorApp.EXIT_OK);

            assertThat(requestedCommands).containsExactly(List.of("cc", "-fsyntax-only", "{unit}"));
            assertThat(scratchDir).doesNotExist();
            assertThat(outputDir.resolve(GeneratedUnit.VOLUME_FILE)).exists();
        }

        @Test
        @DisplayName("failing check exits 2, writes nothing and removes the scratch directory")
        void failingCheck() throws IOException {
            when(checker.compileAndLink(scratchDir))
                    .thenReturn(new CompileOutcome(1, List.of("unit.c:9:3: error: 'rho1' undeclared", "  9 | rho1")));
            Path config = writeConfig(writeCase(CASE), true);

            assertThat(run(config)).isEqualTo(GeneratorApp.EXIT_CHECK_FAILED);

            assertThat(scratchDir).doesNotExist();
            assertThat(outputDir.resolve(GeneratedUnit.VOLUME_FILE)).doesNotExist();
        }

        @Test
        @DisplayName("check is skipped when the case has no volume formula")
        void noVolumeFormula() throws IOException {
            Path config = writeConfig(
                    writeCase("package: code_saturne\nboundary:\n  - zone: inlet\n    condition: mass_flow\n"
                            + "    expression: q_m = 1\n"),
                    true);

            assertThat(run(config)).isEqualTo(GeneratorApp.EXIT_OK);
            verify(checker, never()).compileAndLink(any());
            assertThat(outputDir.resolve(GeneratedUnit.BOUNDARY_FILE)).exists();
        }
    }
}
