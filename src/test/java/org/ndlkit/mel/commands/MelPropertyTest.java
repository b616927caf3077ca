package org.ndlkit.mel.commands;

import org.ndlkit.network.NodeRole;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSymbolException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for resolving MEL property names.
 */
public class MelPropertyTest {

    @Test
    @Tag("unit")
    void testNamesAndAliasesIgnoreCase() {
        assertThat(MelProperty.fromName("computegradient")).isEqualTo(MelProperty.COMPUTE_GRADIENT);
        assertThat(MelProperty.fromName("NeedsGradient")).isEqualTo(MelProperty.COMPUTE_GRADIENT);
        assertThat(MelProperty.fromName("Criteria")).isEqualTo(MelProperty.FINAL_CRITERION);
        assertThat(MelProperty.fromName("EVAL").role()).isEqualTo(NodeRole.EVALUATION);
    }

    /**
     * Verifies that a property accepts the same half-length abbreviations as command names.
     */
    @Test
    @Tag("unit")
    void testAbbreviatedNames() {
        assertThat(MelProperty.fromName("Compute")).isEqualTo(MelProperty.COMPUTE_GRADIENT);
        assertThat(MelProperty.fromName("FinalCrit")).isEqualTo(MelProperty.FINAL_CRITERION);
        assertThat(MelProperty.fromName("Lab")).isEqualTo(MelProperty.LABEL);
        assertThat(MelProperty.fromName("out")).isEqualTo(MelProperty.OUTPUT);
    }

    @Test
    @Tag("unit")
    void testTooShortOrUnknownNamesAreRejected() {
        for (String name : new String[] {"Co", "Fe", "Colour"}) {
            assertThatThrownBy(() -> MelProperty.fromName(name))
                    .isInstanceOf(ScriptSymbolException.class)
                    .satisfies(e -> assertThat(((ScriptSymbolException) e).getCode()).isEqualTo(ScriptErrorCode.UNKNOWN_PROPERTY));
        }
    }
}
