package org.ndlkit.script.model;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptException;
import org.ndlkit.script.api.ScriptSymbolException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SymbolTable}.
 */
public class SymbolTableTest {

    private NdlScript script;
    private SymbolTable table;

    @BeforeEach
    void setUp() {
        script = new NdlScript(new GlobalScope());
        table = script.symbols();
    }

    @Test
    @Tag("unit")
    void testLookupIgnoresCase() {
        NdlNode node = script.createNode("Hidden", "1", NodeKind.CONSTANT);
        table.add("Hidden", node);

        assertThat(table.get("HIDDEN")).isSameAs(node);
        assertThat(table.contains("hidden")).isTrue();
    }

    @Test
    @Tag("unit")
    void testUndeterminedPlaceholderMayBeReplaced() {
        NdlNode placeholder = script.createNode("x", "x", NodeKind.UNDETERMINED);
        NdlNode definition = script.createNode("x", "2", NodeKind.CONSTANT);
        table.add("x", placeholder);

        table.add("x", definition);

        assertThat(table.get("x")).isSameAs(definition);
    }

    @Test
    @Tag("unit")
    void testRedefinitionFails() {
        table.add("x", script.createNode("x", "1", NodeKind.CONSTANT));

        assertThatThrownBy(() -> table.add("X", script.createNode("X", "2", NodeKind.CONSTANT)))
                .isInstanceOf(ScriptSymbolException.class)
                .extracting(e -> ((ScriptException) e).getCode())
                .isEqualTo(ScriptErrorCode.SYMBOL_REDEFINED);
    }

    @Test
    @Tag("unit")
    void testAssignRequiresExistingSymbol() {
        NdlNode value = script.createNode("v", "1", NodeKind.CONSTANT);

        assertThatThrownBy(() -> table.assign("missing", value))
                .isInstanceOf(ScriptSymbolException.class)
                .extracting(e -> ((ScriptException) e).getCode())
                .isEqualTo(ScriptErrorCode.UNDEFINED_SYMBOL);

        table.add("p", script.createNode("p", "p", NodeKind.PARAMETER));
        table.assign("p", value);
        assertThat(table.get("p")).isSameAs(value);
    }
}
