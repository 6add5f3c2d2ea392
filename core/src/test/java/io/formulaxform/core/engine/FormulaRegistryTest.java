package io.formulaxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formulaxform.core.error.DefinitionNotFoundException;
import io.formulaxform.core.error.DuplicateDefinitionException;
import io.formulaxform.core.model.BoundaryFormula;
import io.formulaxform.core.model.ConditionKind;
import io.formulaxform.core.model.FormulaKey;
import io.formulaxform.core.model.VolumeFormula;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FormulaRegistry")
class FormulaRegistryTest {

    private FormulaRegistry<VolumeFormula> registry;

    private static VolumeFormula volume(String entity, String zone, String expression) {
        return new VolumeFormula(expression, List.of(entity), List.of(), List.of(), entity, zone);
    }

    private static BoundaryFormula massFlow(String zone, String expression) {
        return new BoundaryFormula(expression, List.of("q_m"), "velocity", zone, ConditionKind.MASS_FLOW);
    }

    @BeforeEach
    void setUp() {
        registry = new FormulaRegistry<>();
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        @DisplayName("keeps registration order")
        void keepsOrder() {
            registry.register(volume("viscosity", "all_cells", "viscosity = 1e-3;"));
            registry.register(volume("density", "all_cells", "density = 1000;"));
            registry.register(volume("density", "fluid", "density = 998;"));

            assertThat(registry.all())
                    .extracting(f -> f.key().composite())
                    .containsExactly("viscosity::all_cells", "density::all_cells", "density::fluid");
            assertThat(registry.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("duplicate key is rejected with the prior expression and leaves the registry unchanged")
        void duplicateRejected() {
            registry.register(volume("density", "all_cells", "density = 1000;"));

            assertThatThrownBy(() -> registry.register(volume("density", "all_cells", "density = 2;")))
                    .isInstanceOfSatisfying(DuplicateDefinitionException.class, e -> {
                        assertThat(e.getMessage())
                                .isEqualTo("Formula for variable density in zone all_cells was already defined:\n"
                                        + " density = 1000;");
                        assertThat(e.formulaKey()).isEqualTo("density::all_cells");
                        assertThat(e.priorExpression()).isEqualTo("density = 1000;");
                    });

            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.lookup(FormulaKey.volume("density", "all_cells")).expression())
                    .isEqualTo("density = 1000;");
        }

        @Test
        @DisplayName("null definition is rejected")
        void nullRejected() {
            assertThatThrownBy(() -> registry.register(null)).isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("boundary keys use zone and field")
        void boundaryKeys() {
            FormulaRegistry<BoundaryFormula> boundary = new FormulaRegistry<>();
            boundary.register(massFlow("inlet", "q_m = 1;"));
            boundary.register(massFlow("outlet", "q_m = 2;"));
            BoundaryFormula clash = new BoundaryFormula(
                    "u_norm = 1;", List.of("u_norm"), "velocity", "inlet", ConditionKind.NORMAL_VELOCITY);

            assertThat(boundary.contains(FormulaKey.boundary("inlet", "velocity"))).isTrue();
            assertThatThrownBy(() -> boundary.register(clash))
                    .isInstanceOf(DuplicateDefinitionException.class)
                    .hasMessageStartingWith("Formula for variable velocity in zone inlet");
        }
    }

    @Nested
    @DisplayName("lookup and replace")
    class LookupAndReplace {

        @Test
        @DisplayName("lookup of an unknown key throws")
        void lookupUnknown() {
            assertThatThrownBy(() -> registry.lookup(FormulaKey.volume("density", "all_cells")))
                    .isInstanceOf(DefinitionNotFoundException.class)
                    .hasMessage("No formula registered for 'density::all_cells'");
            assertThat(registry.find(FormulaKey.volume("density", "all_cells"))).isEmpty();
        }

        @Test
        @DisplayName("replace keeps the position")
        void replaceKeepsPosition() {
            registry.register(volume("density", "all_cells", "density = 1000;"));
            registry.register(volume("viscosity", "all_cells", "viscosity = 1e-3;"));

            registry.replace(volume("density", "all_cells", "density = 998;"));

            assertThat(registry.all())
                    .extracting(VolumeFormula::expression)
                    .containsExactly("density = 998;", "viscosity = 1e-3;");
        }

        @Test
        @DisplayName("replace of an unknown key throws")
        void replaceUnknown() {
            assertThatThrownBy(() -> registry.replace(volume("density", "all_cells", "density = 1;")))
                    .isInstanceOf(DefinitionNotFoundException.class);
            assertThat(registry.isEmpty()).isTrue();
        }
    }
}
