package org.ndlkit.script.functions;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link FunctionRegistry} and the standard function vocabulary.
 */
public class FunctionRegistryTest {

    private final FunctionRegistry registry = FunctionRegistry.standard();

    @Test
    @Tag("unit")
    void testAliasesResolveToCanonicalName() {
        assertThat(registry.find("Parameter")).map(FunctionDefinition::name).contains("LearnableParameter");
        assertThat(registry.find("relu")).map(FunctionDefinition::name).contains("RectifiedLinear");
        assertThat(registry.find("Delay")).map(FunctionDefinition::name).contains("PastValue");
    }

    @Test
    @Tag("unit")
    void testFindExactIgnoresAbbreviations() {
        assertThat(registry.findExact("Sigmoid")).isPresent();
        assertThat(registry.findExact("Sigm")).isEmpty();
        assertThat(registry.find("Sigm")).map(FunctionDefinition::name).contains("Sigmoid");
    }

    /**
     * Verifies the parameter layout of a function: which positions are graph inputs, and the
     * names of the scalar parameters.
     */
    @Test
    @Tag("unit")
    void testParameterLayout() {
        FunctionDefinition pastValue = registry.findExact("PastValue").orElseThrow();

        assertThat(pastValue.isInput(0)).isFalse();
        assertThat(pastValue.isInput(2)).isTrue();
        assertThat(pastValue.parameterName(0)).isEqualTo("rows");
        assertThat(pastValue.inputCount()).isEqualTo(1);
        assertThat(pastValue.maxParameters()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void testOnlyParametersAreLearnable() {
        assertThat(registry.all()).filteredOn(FunctionDefinition::learnable)
                .extracting(FunctionDefinition::name)
                .containsExactly("LearnableParameter");
    }

    @Test
    @Tag("unit")
    void testDuplicateRegistrationFails() {
        FunctionDefinition clash = new FunctionDefinition("Other", "Plus", List.of("@input"), 1, false);

        assertThatThrownBy(() -> registry.register(clash)).isInstanceOf(IllegalArgumentException.class);
    }
}
