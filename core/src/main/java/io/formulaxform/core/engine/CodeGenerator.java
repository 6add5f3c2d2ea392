package io.formulaxform.core.engine;

import io.formulaxform.core.model.BoundaryFormula;
import io.formulaxform.core.model.CaseModel;
import io.formulaxform.core.model.CompileCheckResult;
import io.formulaxform.core.model.CompileOutcome;
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
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One generation pass: collects volume and boundary formulas into their registries and produces
 * the volume and boundary units from them.
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * CodeGenerator generator = CodeGenerator.fromCase(caseModel);
 * WriteStatus status = generator.saveAll(outputDir);
 * }</pre>
 *
 * <p>
 * A duplicate registration throws {@link io.formulaxform.core.error.DuplicateDefinitionException}
 * and the pass should be discarded. Instances are not thread-safe; concurrent passes each need
 * their own generator.
 */
public final class CodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(CodeGenerator.class);

    private final PackageVariant variant;
    private final BlockAssembler assembler;
    private final FormulaRegistry<VolumeFormula> volumeFormulas = new FormulaRegistry<>();
    private final FormulaRegistry<BoundaryFormula> boundaryFormulas = new FormulaRegistry<>();

    public CodeGenerator(PackageVariant variant, NotebookProvider notebook) {
        this.variant = Objects.requireNonNull(variant, "variant must not be null");
        this.assembler = new BlockAssembler(variant, notebook);
    }

    /**
     * Creates a generator holding every formula of a case, in declared order.
     *
     * @throws io.formulaxform.core.error.DuplicateDefinitionException if two formulas share a key
     */
    public static CodeGenerator fromCase(CaseModel caseModel) {
        CodeGenerator generator = new CodeGenerator(caseModel.variant(), NotebookProvider.of(caseModel.notebook()));
        caseModel.volume().forEach(generator::addVolume);
        caseModel.boundary().forEach(generator::addBoundary);
        LOG.info(
                "Collected {} volume and {} boundary formula(s) for {}",
                generator.volumeFormulas.size(),
                generator.boundaryFormulas.size(),
                caseModel.variant());
        return generator;
    }

    public void addVolume(VolumeFormula formula) {
        volumeFormulas.register(formula);
    }

    public void addBoundary(BoundaryFormula formula) {
        boundaryFormulas.register(formula);
    }

    /**
     * Replaces the expression of a registered volume formula, keeping its position.
     *
     * @throws io.formulaxform.core.error.DefinitionNotFoundException if no volume formula has
     *     that key
     */
    public void updateVolumeExpression(FormulaKey key, String expression) {
        VolumeFormula current = volumeFormulas.lookup(key);
        volumeFormulas.replace(new VolumeFormula(
                expression,
                current.requiredOutputs(),
                current.symbols(),
                current.scalars(),
                current.entityName(),
                current.zone()));
    }

    public FormulaRegistry<VolumeFormula> volumeFormulas() {
        return volumeFormulas;
    }

    public FormulaRegistry<BoundaryFormula> boundaryFormulas() {
        return boundaryFormulas;
    }

    public PackageVariant variant() {
        return variant;
    }

    /** {@code true} if at least one volume or boundary formula is registered. */
    public boolean hasFormulas() {
        return !volumeFormulas.isEmpty() || !boundaryFormulas.isEmpty();
    }

    /** Volume unit text; empty when no volume formula is registered. */
    public String volumeSource() {
        return assembler.volumeUnit(volumeFormulas.all());
    }

    /** Boundary unit text; empty when no boundary formula is registered. */
    public String boundarySource() {
        return assembler.boundaryUnit(boundaryFormulas.all());
    }

    public GeneratedUnit volumeUnit() {
        return new GeneratedUnit(GeneratedUnit.VOLUME_FILE, volumeSource());
    }

    public GeneratedUnit boundaryUnit() {
        return new GeneratedUnit(GeneratedUnit.BOUNDARY_FILE, boundarySource());
    }

    public WriteStatus saveVolumeFunction(Path directory) {
        return SourceFileWriter.write(directory, volumeUnit());
    }

    public WriteStatus saveBoundaryFunction(Path directory) {
        return SourceFileWriter.write(directory, boundaryUnit());
    }

    /**
     * Writes both units. A failure of one unit does not prevent the other from being written.
     *
     * @return {@link WriteStatus#FAILED} if either unit failed, as combined by
     *     {@link WriteStatus#combine}
     */
    public WriteStatus saveAll(Path directory) {
        WriteStatus volume = saveVolumeFunction(directory);
        WriteStatus boundary = saveBoundaryFunction(directory);
        WriteStatus combined = WriteStatus.combine(volume, boundary);
        LOG.info("Saved formulas to {}: volume={}, boundary={}", directory, volume, boundary);
        return combined;
    }

    /**
     * Writes the volume unit into {@code tmpDir} and runs the native compile step on it. Compile
     * errors are reported in the result, never thrown.
     *
     * @return the check result; exit status {@code -1} if the unit could not be written
     */
    public CompileCheckResult checkVolumeSyntax(Path tmpDir, CompileChecker checker) {
        try {
            Files.createDirectories(tmpDir);
        } catch (IOException e) {
            LOG.error("Cannot create {}: {}", tmpDir, e.getMessage());
            return new CompileCheckResult(-1, "cannot create " + tmpDir + "\n", 0);
        }
        if (SourceFileWriter.write(tmpDir, volumeUnit()) == WriteStatus.FAILED) {
            return new CompileCheckResult(-1, "cannot write " + GeneratedUnit.VOLUME_FILE + " to " + tmpDir + "\n", 0);
        }
        CompileOutcome outcome = checker.compileAndLink(tmpDir);
        CompileCheckResult result = CompileDiagnostics.summarize(outcome);
        if (result.succeeded()) {
            LOG.info("Compile check passed in {}", tmpDir);
        } else {
            LOG.warn("Compile check failed with status {} and {} error(s)", result.exitStatus(), result.errorCount());
        }
        return result;
    }

    /** Removes a temporary directory created by {@link #checkVolumeSyntax}. */
    public void cleanDirectory(Path tmpDir) {
        SourceFileWriter.cleanDirectory(tmpDir);
    }
}
