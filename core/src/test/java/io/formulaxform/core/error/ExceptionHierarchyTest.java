package io.formulaxform.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.reflect.Modifier;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Exception hierarchy")
class ExceptionHierarchyTest {

    @Nested
    @DisplayName("Structure")
    class Structure {

        @Test
        @DisplayName("base classes are abstract runtime exceptions")
        void baseClassesAreAbstract() {
            assertThat(Modifier.isAbstract(FormulaException.class.getModifiers())).isTrue();
            assertThat(Modifier.isAbstract(FormulaLoadException.class.getModifiers())).isTrue();
            assertThat(Modifier.isAbstract(FormulaGenerationException.class.getModifiers()))
                    .isTrue();
            assertThat(RuntimeException.class).isAssignableFrom(FormulaException.class);
        }

        @Test
        @DisplayName("load errors report the LOAD phase")
        void loadErrorsReportLoadPhase() {
            List<FormulaException> errors = List.of(
                    new DuplicateDefinitionException("dup", "density::all_cells", "density = 1;"),
                    new CaseParseException("bad", null, "case.yaml"),
                    new CaseSchemaException("schema", List.of("v1"), "case.yaml"),
                    new FormulaSyntaxException("unexpected ')'", 1, 5));

            assertThat(errors).allSatisfy(e -> {
                assertThat(e).isInstanceOf(FormulaLoadException.class);
                assertThat(e.phase()).isEqualTo(FormulaException.Phase.LOAD);
            });
        }

        @Test
        @DisplayName("lookup errors report the GENERATION phase")
        void notFoundReportsGenerationPhase() {
            DefinitionNotFoundException e = new DefinitionNotFoundException("missing", "inlet::velocity");

            assertThat(e).isInstanceOf(FormulaGenerationException.class);
            assertThat(e.phase()).isEqualTo(FormulaException.Phase.GENERATION);
            assertThat(e.formulaKey()).isEqualTo("inlet::velocity");
            assertThat(e.detail()).isEqualTo("missing");
        }
    }

    @Nested
    @DisplayName("Payload")
    class Payload {

        @Test
        @DisplayName("duplicate keeps the prior expression")
        void duplicateKeepsPriorExpression() {
            DuplicateDefinitionException e =
                    new DuplicateDefinitionException("dup", "density::all_cells", "density = 1;");

            assertThat(e.priorExpression()).isEqualTo("density = 1;");
            assertThat(e.source()).isEqualTo("density::all_cells");
        }

        @Test
        @DisplayName("schema error keeps the violations")
        void schemaErrorKeepsViolations() {
            CaseSchemaException e = new CaseSchemaException("schema", List.of("a", "b"), "case.yaml");

            assertThat(e.violations()).containsExactly("a", "b");
            assertThat(e.source()).isEqualTo("case.yaml");
            assertThat(e.formulaKey()).isNull();
        }

        @Test
        @DisplayName("syntax error message carries the position")
        void syntaxErrorCarriesPosition() {
            FormulaSyntaxException e = new FormulaSyntaxException("expected ')'", 3, 14);

            assertThat(e.getMessage()).isEqualTo("expected ')' (line 3, column 14)");
            assertThat(e.reason()).isEqualTo("expected ')'");
            assertThat(e.line()).isEqualTo(3);
            assertThat(e.column()).isEqualTo(14);
            assertThat(e.formulaKey()).isNull();
        }

        @Test
        @DisplayName("withFormulaKey prefixes the key and keeps the position")
        void withFormulaKeyPrefixesKey() {
            FormulaSyntaxException attached =
                    new FormulaSyntaxException("expected ')'", 3, 14).withFormulaKey("density::all_cells");

            assertThat(attached.getMessage())
                    .isEqualTo("Formula 'density::all_cells': expected ')' (line 3, column 14)");
            assertThat(attached.formulaKey()).isEqualTo("density::all_cells");
            assertThat(attached.line()).isEqualTo(3);
            assertThat(attached.column()).isEqualTo(14);
        }

        @Test
        @DisplayName("parse error keeps its cause")
        void parseErrorKeepsCause() {
            IllegalStateException cause = new IllegalStateException("boom");
            CaseParseException e = new CaseParseException("bad", cause, null, "case.yaml");

            assertThat(e.getCause()).isSameAs(cause);
            assertThat(e.source()).isEqualTo("case.yaml");
        }
    }
}
