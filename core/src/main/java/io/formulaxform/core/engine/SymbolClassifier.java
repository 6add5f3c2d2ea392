package io.formulaxform.core.engine;

import io.formulaxform.core.model.BoundaryFormula;
import io.formulaxform.core.model.PackageVariant;
import io.formulaxform.core.model.PhaseIndex;
import io.formulaxform.core.model.ResolvedSymbol;
import io.formulaxform.core.model.SymbolDescriptor;
import io.formulaxform.core.model.VolumeFormula;
import io.formulaxform.core.parse.FormulaProgram;
import io.formulaxform.core.parse.ast.Expr;
import io.formulaxform.core.parse.ast.Statement;
import io.formulaxform.core.spi.NotebookProvider;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies every identifier of a parsed formula, walking statements in source order.
 *
 * <p>
 * A required output is an {@link ResolvedSymbol.Output}; a name first met as an assignment
 * target is a {@link ResolvedSymbol.Local}. Any other name is resolved on first occurrence by
 * trying, in order: reserved names, coordinates (looped blocks only), notebook parameters,
 * package constants, descriptor defaults, declared scalars and finally field samples. Boundary
 * formulas stop after notebook parameters; their unresolved names stay verbatim.
 *
 * <p>
 * Fallbacks never fail the pass. They are logged at WARN.
 */
public final class SymbolClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(SymbolClassifier.class);

    private final String formulaKey;
    private final List<String> requiredOutputs;
    private final Map<String, SymbolDescriptor> descriptors;
    private final List<String> scalars;
    private final NotebookProvider notebook;
    private final PackageVariant variant;
    private final PhaseIndex phase;
    private final boolean perElement;
    private final boolean volume;

    private SymbolClassifier(
            String formulaKey,
            List<String> requiredOutputs,
            List<SymbolDescriptor> descriptors,
            List<String> scalars,
            NotebookProvider notebook,
            PackageVariant variant,
            PhaseIndex phase,
            boolean perElement,
            boolean volume) {
        this.formulaKey = formulaKey;
        this.requiredOutputs = requiredOutputs;
        this.descriptors = new LinkedHashMap<>();
        for (SymbolDescriptor descriptor : descriptors) {
            this.descriptors.putIfAbsent(descriptor.name(), descriptor);
        }
        this.scalars = scalars;
        this.notebook = Objects.requireNonNull(notebook, "notebook must not be null");
        this.variant = variant;
        this.phase = phase;
        this.perElement = perElement;
        this.volume = volume;
    }

    /**
     * Classifier for a volume formula. Only the first required output is bound to the result
     * slot; further required outputs are treated as user temporaries.
     */
    public static SymbolClassifier forVolume(VolumeFormula formula, NotebookProvider notebook, PackageVariant variant) {
        return new SymbolClassifier(
                formula.key().composite(),
                formula.requiredOutputs().subList(0, 1),
                formula.symbols(),
                formula.scalars(),
                notebook,
                Objects.requireNonNull(variant, "variant must not be null"),
                formula.phase(),
                true,
                true);
    }

    /** Classifier for a boundary formula. */
    public static SymbolClassifier forBoundary(BoundaryFormula formula, NotebookProvider notebook) {
        return new SymbolClassifier(
                formula.key().composite(),
                formula.requiredOutputs(),
                List.of(),
                List.of(),
                notebook,
                null,
                PhaseIndex.none(),
                formula.perElement(),
                false);
    }

    /** Classifies all identifiers of {@code program}. Calling it twice yields equal tables. */
    public SymbolTable classify(FormulaProgram program) {
        SymbolTable table = new SymbolTable();
        for (Statement statement : program.statements()) {
            visit(statement, table);
        }
        return table;
    }

    private void visit(Statement statement, SymbolTable table) {
        if (statement instanceof Statement.Assignment assignment) {
            String target = assignment.target().name();
            if (!table.isKnown(target)) {
                int outputIndex = requiredOutputs.indexOf(target);
                table.put(
                        outputIndex >= 0
                                ? new ResolvedSymbol.Output(target, outputIndex)
                                : new ResolvedSymbol.Local(target));
            }
            visit(assignment.value(), table);
        } else if (statement instanceof Statement.Conditional conditional) {
            for (Statement.Branch branch : conditional.branches()) {
                visit(branch.condition(), table);
                for (Statement inner : branch.body()) {
                    visit(inner, table);
                }
            }
            if (conditional.hasElse()) {
                for (Statement inner : conditional.elseBody()) {
                    visit(inner, table);
                }
            }
        } else if (statement instanceof Statement.ExpressionStatement expression) {
            visit(expression.expression(), table);
        }
    }

    private void visit(Expr expr, SymbolTable table) {
        if (expr instanceof Expr.Identifier identifier) {
            if (!table.isKnown(identifier.name())) {
                classifyRead(identifier, table);
            }
        } else if (expr instanceof Expr.Unary unary) {
            visit(unary.operand(), table);
        } else if (expr instanceof Expr.Binary binary) {
            visit(binary.left(), table);
            visit(binary.right(), table);
        } else if (expr instanceof Expr.Call call) {
            for (Expr argument : call.arguments()) {
                visit(argument, table);
            }
        } else if (expr instanceof Expr.Grouping grouping) {
            visit(grouping.inner(), table);
        }
    }

    private void classifyRead(Expr.Identifier identifier, SymbolTable table) {
        String name = identifier.name();
        int outputIndex = requiredOutputs.indexOf(name);
        if (outputIndex >= 0) {
            table.put(new ResolvedSymbol.Output(name, outputIndex));
            return;
        }
        Optional<ResolvedSymbol> resolved = lookup(name, identifier);
        if (resolved.isPresent()) {
            table.put(resolved.get());
            return;
        }
        LOG.warn(
                "Formula '{}': symbol '{}' (line {}) matches no known category, emitted as written",
                formulaKey,
                name,
                identifier.line());
        table.markUnresolved(name);
    }

    private Optional<ResolvedSymbol> lookup(String name, Expr.Identifier identifier) {
        Optional<ResolvedSymbol.Reserved> reserved = ResolvedSymbol.Reserved.lookup(name);
        if (reserved.isPresent()) {
            return Optional.of(reserved.get());
        }
        if (perElement) {
            Optional<ResolvedSymbol.Coordinate> coordinate = ResolvedSymbol.Coordinate.lookup(name);
            if (coordinate.isPresent()) {
                return Optional.of(coordinate.get());
            }
        }
        if (notebook.contains(name)) {
            return Optional.of(new ResolvedSymbol.Parameter(name));
        }
        if (!volume) {
            return Optional.empty();
        }
        if (variant.hasConstant(name)) {
            Optional<String> accessor = variant.constantAccessor(name, phase);
            if (accessor.isPresent()) {
                return Optional.of(new ResolvedSymbol.Constant(name, accessor.get()));
            }
            LOG.warn(
                    "Formula '{}': constant '{}' of {} needs a phase but the entity name carries none",
                    formulaKey,
                    name,
                    variant);
        }
        SymbolDescriptor descriptor = descriptors.get(name);
        if (descriptor != null && descriptor.hasDefault()) {
            return Optional.of(new ResolvedSymbol.LiteralDefault(name, descriptor.defaultLiteral()));
        }
        if (scalars.contains(name)) {
            return Optional.of(new ResolvedSymbol.ScalarSample(name));
        }
        if (descriptor != null) {
            return Optional.of(new ResolvedSymbol.FieldSample(name, descriptor.fieldName()));
        }
        LOG.warn(
                "Formula '{}': undeclared symbol '{}' (line {}) sampled as field '{}'",
                formulaKey,
                name,
                identifier.line(),
                name);
        return Optional.of(new ResolvedSymbol.FieldSample(name, name));
    }
}
