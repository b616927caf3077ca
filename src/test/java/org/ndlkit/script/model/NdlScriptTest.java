package org.ndlkit.script.model;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptException;
import org.ndlkit.script.api.ScriptSymbolException;
import org.ndlkit.script.frontend.parser.ScriptParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for symbol resolution in {@link NdlScript}: dotted lookups into macro
 * calls, name checks and reference chains.
 */
public class NdlScriptTest {

    private GlobalScope global;
    private ScriptParser parser;

    @BeforeEach
    void setUp() {
        global = new GlobalScope();
        parser = new ScriptParser(global);
    }

    /**
     * Verifies that a dotted name is looked up in the body of the macro call named by its prefix.
     */
    @Test
    @Tag("unit")
    void testDottedLookupTraversesMacroCall() {
        NdlScript script = parser.parse("L(x) = [ W = Parameter(2, 2)\ny = Times(W, x) ]\nin = Input(2)\nl1 = L(in)", "net.ndl");

        NdlNode weights = script.findSymbol("l1.W", false);

        assertThat(weights).isNotNull();
        assertThat(weights.function().name()).isEqualTo("LearnableParameter");
        assertThat(weights.parentScript()).isSameAs(global.lookup("L").body());
    }

    @Test
    @Tag("unit")
    void testDottedLookupThroughNonMacroFails() {
        NdlScript script = parser.parse("in = Input(2)", "net.ndl");

        assertThatThrownBy(() -> script.findSymbol("in.x", false))
                .isInstanceOf(ScriptSymbolException.class)
                .extracting(e -> ((ScriptException) e).getCode())
                .isEqualTo(ScriptErrorCode.INVALID_DOT_NAME);
    }

    @Test
    @Tag("unit")
    void testGlobalConstantIsVisible() {
        global.defineConstant("hiddenDim", "512");
        NdlScript script = new NdlScript(global);

        assertThat(script.findSymbol("hiddenDim", true).value()).isEqualTo("512");
        assertThat(script.findSymbol("hiddenDim", false)).isNull();
    }

    @Test
    @Tag("unit")
    void testCheckNameCreatesFreshCallNodes() {
        parser.parse("M(x) = [ y = Tanh(x) ]", "macros.ndl");
        NdlScript script = new NdlScript(global);

        NdlNode macroCall = script.checkName("M", "first");
        NdlNode function = script.checkName("Tanh", null);

        assertThat(macroCall.kind()).isEqualTo(NodeKind.MACRO_CALL);
        assertThat(macroCall.name()).isEqualTo("first");
        assertThat(function.kind()).isEqualTo(NodeKind.FUNCTION);
        assertThat(function.name()).startsWith(GlobalScope.GENERATED_NAME_PREFIX);
        assertThat(script.checkName("NoSuchThing", null)).isNull();
    }

    @Test
    @Tag("unit")
    void testResolveReferenceFollowsChain() {
        NdlScript script = new NdlScript(global);
        NdlNode constant = script.createNode("c", "3", NodeKind.CONSTANT);
        NdlNode b = script.createNode("b", "c", NodeKind.VARIABLE);
        NdlNode a = script.createNode("a", "b", NodeKind.VARIABLE);
        script.symbols().add("c", constant);
        script.symbols().add("b", b);
        script.symbols().add("a", a);

        assertThat(NdlScript.resolveReference(a)).isSameAs(constant);
    }

    @Test
    @Tag("unit")
    void testResolveReferenceStopsAtUnboundName() {
        NdlScript script = new NdlScript(global);
        NdlNode dangling = script.createNode("a", "nowhere", NodeKind.VARIABLE);

        assertThat(NdlScript.resolveReference(dangling)).isSameAs(dangling);
    }

    @Test
    @Tag("unit")
    void testResolveReferenceDetectsCycle() {
        NdlScript script = new NdlScript(global);
        NdlNode a = script.createNode("a", "b", NodeKind.VARIABLE);
        NdlNode b = script.createNode("b", "a", NodeKind.VARIABLE);
        script.symbols().add("a", a);
        script.symbols().add("b", b);

        assertThatThrownBy(() -> NdlScript.resolveReference(a))
                .isInstanceOf(ScriptSymbolException.class)
                .extracting(e -> ((ScriptException) e).getCode())
                .isEqualTo(ScriptErrorCode.CIRCULAR_REFERENCE);
    }
}
