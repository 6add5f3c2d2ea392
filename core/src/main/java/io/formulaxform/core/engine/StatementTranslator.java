package io.formulaxform.core.engine;

import io.formulaxform.core.model.ResolvedSymbol;
import io.formulaxform.core.parse.FormulaProgram;
import io.formulaxform.core.parse.ast.Expr;
import io.formulaxform.core.parse.ast.Statement;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Renders a classified formula as C statements.
 *
 * <p>
 * Every statement ends with {@code ;} and sits on its own line, indented two spaces per depth.
 * Conditionals are always rendered with braces, so the output is balanced whatever form the
 * author used. The first assignment to a local is prefixed with {@code cs_real_t}, unless it sits
 * inside a conditional: such locals are declared uninitialized just before the outermost
 * conditional holding them, so every branch and the statements after it share one. The first
 * occurrence of each required output is replaced by its result slot, later occurrences are
 * written as they are. {@code #} comments become {@code //} comments.
 *
 * <p>
 * One instance renders one program; it keeps the first-occurrence state of that rendering.
 */
public final class StatementTranslator {

    /** Local declaration qualifier. */
    static final String LOCAL_TYPE = "cs_real_t";

    /** Built-in functions renamed to their internal equivalents. */
    static final Map<String, String> FUNCTION_NAMES =
            Map.of("abs", "cs_math_fabs", "min", "cs_math_fmin", "max", "cs_math_fmax");

    private final SymbolTable table;
    private final IntFunction<String> outputSlot;
    private final int baseDepth;
    private final Set<String> declaredLocals = new HashSet<>();
    private final Set<String> boundOutputs = new HashSet<>();

    /**
     * @param table      classification of the program's identifiers
     * @param outputSlot result slot expression for a required-output index
     * @param baseDepth  indentation depth of top-level statements
     */
    public StatementTranslator(SymbolTable table, IntFunction<String> outputSlot, int baseDepth) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.outputSlot = Objects.requireNonNull(outputSlot, "outputSlot must not be null");
        this.baseDepth = baseDepth;
    }

    /** Renders all statements; each line ends with a newline. */
    public String translate(FormulaProgram program) {
        StringBuilder out = new StringBuilder();
        statements(program.statements(), baseDepth, out);
        return out.toString();
    }

    private void statements(List<Statement> statements, int depth, StringBuilder out) {
        for (Statement statement : statements) {
            statement(statement, depth, out);
        }
    }

    private void statement(Statement statement, int depth, StringBuilder out) {
        if (statement instanceof Statement.BlankLine) {
            out.append('\n');
        } else if (statement instanceof Statement.Comment comment) {
            out.append(SourceTemplates.indent(depth)).append(comment(comment.text())).append('\n');
        } else if (statement instanceof Statement.Assignment assignment) {
            out.append(SourceTemplates.indent(depth))
                    .append(target(assignment.target().name()))
                    .append(" = ")
                    .append(expression(assignment.value()))
                    .append(';');
            trailing(assignment.trailingComment(), out);
        } else if (statement instanceof Statement.ExpressionStatement expression) {
            out.append(SourceTemplates.indent(depth))
                    .append(expression(expression.expression()))
                    .append(';');
            trailing(expression.trailingComment(), out);
        } else if (statement instanceof Statement.Conditional conditional) {
            conditional(conditional, depth, out);
        }
    }

    private void conditional(Statement.Conditional conditional, int depth, StringBuilder out) {
        String indent = SourceTemplates.indent(depth);
        for (String local : undeclaredLocals(conditional, new LinkedHashSet<>())) {
            declaredLocals.add(local);
            out.append(indent).append(LOCAL_TYPE).append(' ').append(local).append(";\n");
        }
        boolean first = true;
        for (Statement.Branch branch : conditional.branches()) {
            out.append(indent)
                    .append(first ? "if (" : "} else if (")
                    .append(expression(unwrap(branch.condition())))
                    .append(") {\n");
            statements(branch.body(), depth + 1, out);
            first = false;
        }
        if (conditional.hasElse()) {
            out.append(indent).append("} else {\n");
            statements(conditional.elseBody(), depth + 1, out);
        }
        out.append(indent).append("}\n");
    }

    /** Locals first assigned somewhere inside {@code conditional}, in source order. */
    private Set<String> undeclaredLocals(Statement.Conditional conditional, Set<String> found) {
        for (Statement.Branch branch : conditional.branches()) {
            collectLocals(branch.body(), found);
        }
        if (conditional.hasElse()) {
            collectLocals(conditional.elseBody(), found);
        }
        return found;
    }

    private void collectLocals(List<Statement> statements, Set<String> found) {
        for (Statement statement : statements) {
            if (statement instanceof Statement.Assignment assignment) {
                String name = assignment.target().name();
                if (!declaredLocals.contains(name)
                        && table.resolve(name).orElse(null) instanceof ResolvedSymbol.Local) {
                    found.add(name);
                }
            } else if (statement instanceof Statement.Conditional nested) {
                undeclaredLocals(nested, found);
            }
        }
    }

    private String target(String name) {
        ResolvedSymbol symbol = table.resolve(name).orElse(null);
        if (symbol instanceof ResolvedSymbol.Local && declaredLocals.add(name)) {
            return LOCAL_TYPE + " " + name;
        }
        return identifier(name);
    }

    private String identifier(String name) {
        ResolvedSymbol symbol = table.resolve(name).orElse(null);
        if (symbol == null) {
            return name;
        }
        if (symbol instanceof ResolvedSymbol.Output output) {
            return boundOutputs.add(name) ? outputSlot.apply(output.index()) : name;
        }
        return symbol.nativeName();
    }

    private String expression(Expr expr) {
        if (expr instanceof Expr.NumberLiteral number) {
            return number.text();
        }
        if (expr instanceof Expr.Identifier identifier) {
            return identifier(identifier.name());
        }
        if (expr instanceof Expr.Grouping grouping) {
            return "(" + expression(grouping.inner()) + ")";
        }
        if (expr instanceof Expr.Unary unary) {
            String operand = expression(unary.operand());
            // keep "- -x" from turning into a decrement
            return operand.startsWith(unary.operator()) ? unary.operator() + " " + operand : unary.operator() + operand;
        }
        if (expr instanceof Expr.Binary binary) {
            if ("^".equals(binary.operator())) {
                String base = expression(unwrap(binary.left()));
                return "pow(" + base + ", " + expression(unwrap(binary.right())) + ")";
            }
            String left = expression(binary.left());
            return left + " " + binary.operator() + " " + expression(binary.right());
        }
        Expr.Call call = (Expr.Call) expr;
        StringBuilder text = new StringBuilder(FUNCTION_NAMES.getOrDefault(call.callee(), call.callee()));
        text.append('(');
        for (int i = 0; i < call.arguments().size(); i++) {
            if (i > 0) {
                text.append(", ");
            }
            text.append(expression(call.arguments().get(i)));
        }
        return text.append(')').toString();
    }

    private static Expr unwrap(Expr expr) {
        Expr inner = expr;
        while (inner instanceof Expr.Grouping grouping) {
            inner = grouping.inner();
        }
        return inner;
    }

    private static void trailing(String comment, StringBuilder out) {
        if (comment != null) {
            out.append(' ').append(comment(comment));
        }
        out.append('\n');
    }

    private static String comment(String text) {
        return "//" + text;
    }
}
