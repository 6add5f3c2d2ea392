package io.formulaxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.formulaxform.core.error.DefinitionNotFoundException;
import io.formulaxform.core.error.DuplicateDefinitionException;
import io.formulaxform.core.model.BoundaryFormula;
import io.formulaxform.core.model.CaseModel;
import io.formulaxform.core.model.CompileCheckResult;
import io.formulaxform.core.model.CompileOutcome;
import io.formulaxform.core.model.ConditionKind;
import io.formulaxform.core.model.FormulaKey;
import io.formulaxform.core.model.GeneratedUnit;
import io.formulaxform.core.model.PackageVariant;
import io.formulaxform.core.model.VolumeFormula;
import io.formulaxform.core.model.WriteStatus;
import io.formulaxform.core.spi.CompileChecker;
import io.formulaxform.core.spi.NotebookProvider;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CodeGenerator")
class CodeGeneratorTest {

    private static final VolumeFormula DENSITY =
            new VolumeFormula("density = rho0 * (1 + x)", List.of("density"), null, null, "density", null);

    private static final BoundaryFormula INLET_FLOW =
            new BoundaryFormula("q_m = 0.5", List.of("q_m"), "velocity", "inlet", ConditionKind.MASS_FLOW);

    @TempDir
    Path tempDir;

    private CodeGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new CodeGenerator(PackageVariant.CODE_SATURNE, NotebookProvider.empty());
    }

    @Nested
    @DisplayName("Collecting formulas")
    class Collecting {

        @Test
        @DisplayName("fromCase registers every formula in declared order")
        void fromCase() {
            VolumeFormula viscosity = new VolumeFormula(
                    "molecular_viscosity = 1e-3",
                    List.of("molecular_viscosity"),
                    null,
                    null,
                    "molecular_viscosity",
                    null);
            CaseModel caseModel = new CaseModel(
                    PackageVariant.CODE_SATURNE, Map.of("p", 1.0), List.of(viscosity, DENSITY), List.of(INLET_FLOW));

            CodeGenerator fromCase = CodeGenerator.fromCase(caseModel);

            assertThat(fromCase.volumeFormulas().all()).containsExactly(viscosity, DENSITY);
            assertThat(fromCase.boundaryFormulas().all()).containsExactly(INLET_FLOW);
            assertThat(fromCase.variant()).isEqualTo(PackageVariant.CODE_SATURNE);
        }

        @Test
        @DisplayName("duplicate volume formula aborts")
        void duplicate() {
            generator.addVolume(DENSITY);

            assertThatThrownBy(() -> generator.addVolume(DENSITY)).isInstanceOf(DuplicateDefinitionException.class);
        }

        @Test
        @DisplayName("updateVolumeExpression replaces the expression only")
        void updateExpression() {
            generator.addVolume(DENSITY);

            generator.updateVolumeExpression(FormulaKey.volume("density", "all_cells"), "density = 998");

            VolumeFormula updated = generator.volumeFormulas().lookup(DENSITY.key());
            assertThat(updated.expression()).isEqualTo("density = 998");
            assertThat(updated.requiredOutputs()).isEqualTo(DENSITY.requiredOutputs());
            assertThat(generator.volumeSource()).contains("f->val[c_id] = 998;");
        }

        @Test
        @DisplayName("updateVolumeExpression of an unknown key throws")
        void updateUnknown() {
            assertThatThrownBy(() -> generator.updateVolumeExpression(FormulaKey.volume("density", "fluid"), "x"))
                    .isInstanceOf(DefinitionNotFoundException.class);
        }

        @Test
        @DisplayName("an empty generator produces empty units")
        void emptyGenerator() {
            assertThat(generator.hasFormulas()).isFalse();
            assertThat(generator.volumeUnit().isEmpty()).isTrue();
            assertThat(generator.boundaryUnit().fileName()).isEqualTo(GeneratedUnit.BOUNDARY_FILE);
        }
    }

    @Nested
    @DisplayName("Saving")
    class Saving {

        @Test
        @DisplayName("volume only: volume written, boundary skipped, combined status WRITTEN")
        void volumeOnly() throws IOException {
            generator.addVolume(DENSITY);

            assertThat(generator.saveAll(tempDir)).isEqualTo(WriteStatus.WRITTEN);
            assertThat(Files.readString(tempDir.resolve(GeneratedUnit.VOLUME_FILE))).isEqualTo(generator.volumeSource());
            assertThat(tempDir.resolve(GeneratedUnit.BOUNDARY_FILE)).doesNotExist();
        }

        @Test
        @DisplayName("both units are written into a directory created on demand")
        void bothUnits() {
            generator.addVolume(DENSITY);
            generator.addBoundary(INLET_FLOW);
            Path outputDir = tempDir.resolve("src/nested");

            assertThat(generator.saveAll(outputDir)).isEqualTo(WriteStatus.WRITTEN);
            assertThat(outputDir.resolve(GeneratedUnit.VOLUME_FILE)).exists();
            assertThat(outputDir.resolve(GeneratedUnit.BOUNDARY_FILE)).exists();
        }

        @Test
        @DisplayName("a stale unit is removed when its formulas are gone")
        void staleFileRemoved() throws IOException {
            Path stale = tempDir.resolve(GeneratedUnit.BOUNDARY_FILE);
            Files.writeString(stale, "/* previous pass */");

            assertThat(generator.saveBoundaryFunction(tempDir)).isEqualTo(WriteStatus.SKIPPED);
            assertThat(stale).doesNotExist();
            assertThat(generator.saveAll(tempDir)).isEqualTo(WriteStatus.SKIPPED);
        }

        @Test
        @DisplayName("unwritable directory is reported as FAILED")
        void unwritable() throws IOException {
            Path notADirectory = Files.writeString(tempDir.resolve("plain-file"), "x");
            generator.addVolume(DENSITY);

            assertThat(generator.saveVolumeFunction(notADirectory)).isEqualTo(WriteStatus.FAILED);
            assertThat(generator.saveAll(notADirectory).code()).isEqualTo(-1);
        }

        @Test
        @DisplayName("a failed volume unit is not hidden by a written boundary unit")
        void volumeFailureReported() throws IOException {
            Path squatter = Files.createDirectory(tempDir.resolve(GeneratedUnit.VOLUME_FILE));
            Files.writeString(squatter.resolve("keep"), "x");
            generator.addVolume(DENSITY);
            generator.addBoundary(INLET_FLOW);

            assertThat(generator.saveAll(tempDir)).isEqualTo(WriteStatus.FAILED);
            assertThat(tempDir.resolve(GeneratedUnit.BOUNDARY_FILE)).exists();
        }
    }

    @Nested
    @DisplayName("Compile check")
    class CompileCheck {

        @Test
        @DisplayName("unit is written into the scratch directory before the checker runs")
        void unitWrittenBeforeCheck() {
            generator.addVolume(DENSITY);
            Path scratch = tempDir.resolve("tmp");
            CompileChecker checker = mock(CompileChecker.class);
            when(checker.compileAndLink(scratch)).thenAnswer(invocation -> {
                assertThat(scratch.resolve(GeneratedUnit.VOLUME_FILE)).exists();
                return CompileOutcome.success();
            });

            CompileCheckResult result = generator.checkVolumeSyntax(scratch, checker);

            assertThat(result.succeeded()).isTrue();
            verify(checker).compileAndLink(scratch);
        }

        @Test
        @DisplayName("compiler errors are summarized, never thrown")
        void errorsSummarized() {
            generator.addVolume(DENSITY);
            Path scratch = tempDir.resolve("tmp");
            CompileChecker checker = mock(CompileChecker.class);
            when(checker.compileAndLink(any()))
                    .thenReturn(new CompileOutcome(
                            1,
                            List.of(
                                    "cs_meg_volume_function.c:40:7: error: 'rho0' undeclared",
                                    "   40 |   const cs_real_t rho0 = rho0;")));

            CompileCheckResult result = generator.checkVolumeSyntax(scratch, checker);

            assertThat(result.exitStatus()).isEqualTo(1);
            assertThat(result.errorCount()).isEqualTo(1);
            assertThat(result.firstMessage()).startsWith("'rho0' undeclared\n");
        }

        @Test
        @DisplayName("scratch directory that cannot be created is reported with status -1")
        void scratchNotCreatable() throws IOException {
            generator.addVolume(DENSITY);
            Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
            CompileChecker checker = mock(CompileChecker.class);

            CompileCheckResult result = generator.checkVolumeSyntax(blocker.resolve("tmp"), checker);

            assertThat(result.exitStatus()).isEqualTo(-1);
            assertThat(result.succeeded()).isFalse();
            verify(checker, never()).compileAndLink(any());
        }

        @Test
        @DisplayName("cleanDirectory removes the scratch directory and its files")
        void cleanDirectory() throws IOException {
            Path scratch = Files.createDirectories(tempDir.resolve("tmp"));
            Files.writeString(scratch.resolve("comp.err"), "");
            Files.writeString(scratch.resolve(GeneratedUnit.VOLUME_FILE), "");

            generator.cleanDirectory(scratch);

            assertThat(scratch).doesNotExist();
            generator.cleanDirectory(scratch);
        }
    }
}
