package io.formulaxform.core.engine;

import static io.formulaxform.core.engine.SourceTemplates.TAB;
import static io.formulaxform.core.engine.SourceTemplates.cString;
import static io.formulaxform.core.engine.SourceTemplates.indent;

import io.formulaxform.core.error.FormulaSyntaxException;
import io.formulaxform.core.model.BoundaryFormula;
import io.formulaxform.core.model.FormulaDefinition;
import io.formulaxform.core.model.PackageVariant;
import io.formulaxform.core.model.VolumeFormula;
import io.formulaxform.core.parse.FormulaParser;
import io.formulaxform.core.parse.FormulaProgram;
import io.formulaxform.core.spi.NotebookProvider;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns registered formulas into the two generated units.
 *
 * <p>
 * Each block is a dispatch guard holding the block-level declarations, the element loop (volume
 * always, boundary unless the condition is a flow integral) and the translated body. Blocks are
 * emitted in registry order, each behind a banner, inside the unit's fixed prologue and
 * epilogue. Assembly is a pure function of its inputs: assembling the same formula twice gives
 * identical text.
 */
public final class BlockAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(BlockAssembler.class);

    /** Depth of block-level declarations inside the guard. */
    static final int BLOCK_DEPTH = 2;

    private final PackageVariant variant;
    private final NotebookProvider notebook;

    public BlockAssembler(PackageVariant variant, NotebookProvider notebook) {
        this.variant = Objects.requireNonNull(variant, "variant must not be null");
        this.notebook = Objects.requireNonNull(notebook, "notebook must not be null");
    }

    // --- units ---

    /** Complete volume unit, or an empty string when there is no formula. */
    public String volumeUnit(List<VolumeFormula> formulas) {
        if (formulas.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(SourceTemplates.FILE_HEADER)
                .append(variant.extraIncludes())
                .append(SourceTemplates.LINKAGE_OPEN)
                .append(SourceTemplates.VOLUME_FUNCTION_HEADER);
        for (VolumeFormula formula : formulas) {
            out.append(SourceTemplates.volumeBanner(formula.entityName(), formula.zone()))
                    .append(volumeBlock(formula))
                    .append('\n');
        }
        out.append(SourceTemplates.VOLUME_RULE).append(SourceTemplates.FILE_FOOTER);
        LOG.debug("Assembled volume unit with {} block(s) for {}", formulas.size(), variant);
        return out.toString();
    }

    /** Complete boundary unit, or an empty string when there is no formula. */
    public String boundaryUnit(List<BoundaryFormula> formulas) {
        if (formulas.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(SourceTemplates.FILE_HEADER)
                .append(SourceTemplates.LINKAGE_OPEN)
                .append(SourceTemplates.BOUNDARY_FUNCTION_HEADER);
        for (BoundaryFormula formula : formulas) {
            String title = SourceTemplates.boundaryTitle(formula.fieldName(), formula.zone());
            String rule = SourceTemplates.boundaryRule(title);
            out.append(rule)
                    .append(TAB)
                    .append("/* ")
                    .append(title)
                    .append(" */\n")
                    .append(boundaryBlock(formula))
                    .append(rule)
                    .append('\n');
        }
        out.append(SourceTemplates.BOUNDARY_RETURN).append(SourceTemplates.FILE_FOOTER);
        LOG.debug("Assembled boundary unit with {} block(s)", formulas.size());
        return out.toString();
    }

    // --- blocks ---

    /** Dispatch block of one volume formula. */
    public String volumeBlock(VolumeFormula formula) {
        FormulaProgram program = parse(formula);
        SymbolTable table = SymbolClassifier.forVolume(formula, notebook, variant).classify(program);
        String body = new StatementTranslator(table, index -> "f->val[c_id]", BLOCK_DEPTH + 1).translate(program);

        StringBuilder out = new StringBuilder();
        out.append(TAB)
                .append("if (strcmp(f->name, \"")
                .append(cString(formula.entityName()))
                .append("\") == 0 && strcmp(vz->name, \"")
                .append(cString(formula.zone()))
                .append("\") == 0) {\n");
        declarations(table, SourceTemplates.VOLUME_CELL_CENTERS, out);
        out.append(indent(BLOCK_DEPTH)).append("for (cs_lnum_t e_id = 0; e_id < vz->n_cells; e_id++) {\n");
        out.append(indent(BLOCK_DEPTH + 1)).append("cs_lnum_t c_id = vz->cell_ids[e_id];\n");
        loopBody(table, "c_id", body, out);
        out.append(indent(BLOCK_DEPTH)).append("}\n");
        out.append(TAB).append("}\n");
        return out.toString();
    }

    /** Dispatch block of one boundary formula. */
    public String boundaryBlock(BoundaryFormula formula) {
        FormulaProgram program = parse(formula);
        SymbolTable table = SymbolClassifier.forBoundary(formula, notebook).classify(program);
        boolean looped = formula.perElement();
        IntFunction<String> slot =
                looped ? index -> "new_vals[" + index + " * bz->n_faces + e_id]" : index -> "new_vals[" + index + "]";
        String body = new StatementTranslator(table, slot, looped ? BLOCK_DEPTH + 1 : BLOCK_DEPTH).translate(program);

        StringBuilder out = new StringBuilder();
        out.append(TAB)
                .append("if (strcmp(field_name, \"")
                .append(cString(formula.fieldName()))
                .append("\") == 0 &&\n");
        out.append(TAB)
                .append("    strcmp(condition, \"")
                .append(cString(formula.condition().tag()))
                .append("\") == 0 &&\n");
        out.append(TAB)
                .append("    strcmp(bz->name, \"")
                .append(cString(formula.zone()))
                .append("\") == 0) {\n");
        out.append('\n');
        if (table.needsCoordinates()) {
            out.append(indent(BLOCK_DEPTH)).append(SourceTemplates.BOUNDARY_FACE_CENTERS).append("\n\n");
        }
        out.append(indent(BLOCK_DEPTH))
                .append("const int vals_size = ")
                .append(looped ? "bz->n_faces * " + formula.outputCount() : String.valueOf(formula.outputCount()))
                .append(";\n");
        out.append(indent(BLOCK_DEPTH)).append("BFT_MALLOC(new_vals, vals_size, cs_real_t);\n");
        out.append('\n');
        declarations(table, null, out);
        if (looped) {
            out.append(indent(BLOCK_DEPTH)).append("for (cs_lnum_t e_id = 0; e_id < bz->n_faces; e_id++) {\n");
            out.append(indent(BLOCK_DEPTH + 1)).append("cs_lnum_t f_id = bz->face_ids[e_id];\n");
            loopBody(table, "f_id", body, out);
            out.append(indent(BLOCK_DEPTH)).append("}\n");
        } else {
            out.append(body);
        }
        out.append(TAB).append("}\n");
        return out.toString();
    }

    /** Block-level declarations followed by a blank line; nothing when there are none. */
    private static void declarations(SymbolTable table, String coordinateArray, StringBuilder out) {
        List<String> lines = table.declarations();
        boolean coordinates = coordinateArray != null && table.needsCoordinates();
        if (coordinates) {
            out.append(indent(BLOCK_DEPTH)).append(coordinateArray).append('\n');
            if (!lines.isEmpty()) {
                out.append('\n');
            }
        }
        for (String declaration : lines) {
            out.append(indent(BLOCK_DEPTH)).append(declaration).append('\n');
        }
        if (coordinates || !lines.isEmpty()) {
            out.append('\n');
        }
    }

    private static void loopBody(SymbolTable table, String indexVar, String body, StringBuilder out) {
        for (String binding : table.elementBindings(indexVar)) {
            out.append(indent(BLOCK_DEPTH + 1)).append(binding).append('\n');
        }
        out.append('\n');
        out.append(body);
    }

    private static FormulaProgram parse(FormulaDefinition formula) {
        try {
            return FormulaParser.parse(formula.expression());
        } catch (FormulaSyntaxException e) {
            throw e.withFormulaKey(formula.key().composite());
        }
    }
}
