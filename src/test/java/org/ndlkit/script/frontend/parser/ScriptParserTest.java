package org.ndlkit.script.frontend.parser;

import org.ndlkit.script.api.ScriptArityException;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptException;
import org.ndlkit.script.api.ScriptSymbolException;
import org.ndlkit.script.api.ScriptSyntaxException;
import org.ndlkit.script.model.GlobalScope;
import org.ndlkit.script.model.NdlNode;
import org.ndlkit.script.model.NdlScript;
import org.ndlkit.script.model.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ScriptParser}: statement forms, macro definitions, symbol
 * registration and the errors raised while parsing.
 */
public class ScriptParserTest {

    private GlobalScope global;
    private ScriptParser parser;

    @BeforeEach
    void setUp() {
        global = new GlobalScope();
        parser = new ScriptParser(global);
    }

    /**
     * Verifies that an assigned call becomes a FUNCTION node registered under the assigned name,
     * with the function resolved from an abbreviation.
     */
    @Test
    @Tag("unit")
    void testAssignedCallWithAbbreviatedFunction() {
        // Act
        NdlScript script = parser.parse("features = Input(784)\nh = Sigm(features)", "net.ndl");

        // Assert
        assertThat(script.statements()).hasSize(2);
        NdlNode h = script.symbols().get("h");
        assertThat(h.kind()).isEqualTo(NodeKind.FUNCTION);
        assertThat(h.function().name()).isEqualTo("Sigmoid");
        assertThat(h.parameters()).containsExactly(script.symbols().get("features"));
    }

    @Test
    @Tag("unit")
    void testSymbolsAreCaseInsensitive() {
        NdlScript script = parser.parse("Features = Input(10)", "net.ndl");

        assertThat(script.findSymbol("FEATURES", false)).isSameAs(script.symbols().get("features"));
    }

    /**
     * Verifies that a call nested in a parameter list is hoisted as its own statement before the
     * statement that uses it.
     */
    @Test
    @Tag("unit")
    void testNestedCallIsHoisted() {
        NdlScript script = parser.parse("x = Input(10)\ny = Sigmoid(Times(x, x))", "net.ndl");

        assertThat(script.statements()).hasSize(3);
        NdlNode nested = script.statements().get(1);
        assertThat(nested.function().name()).isEqualTo("Times");
        assertThat(script.statements().get(2).parameters()).containsExactly(nested);
    }

    @Test
    @Tag("unit")
    void testForwardReferenceCreatesUndeterminedSymbol() {
        NdlScript script = parser.parse("z = Plus(a, b)\na = Input(1)", "net.ndl");

        NdlNode z = script.symbols().get("z");
        assertThat(z.parameters().get(1).kind()).isEqualTo(NodeKind.UNDETERMINED);
        assertThat(script.symbols().get("a").kind()).isEqualTo(NodeKind.FUNCTION);
        assertThat(NdlScript.resolveReference(z.parameters().get(0))).isSameAs(script.symbols().get("a"));
    }

    @Test
    @Tag("unit")
    void testConstantsArraysAndOptionalParameters() {
        NdlScript script = parser.parse("dims = [3:4]\nw = Parameter(3, 4, init=uniform, tag=feature)\nrate = 0.5", "net.ndl");

        assertThat(script.symbols().get("dims").kind()).isEqualTo(NodeKind.ARRAY);
        assertThat(script.symbols().get("dims").value()).isEqualTo("3:4");
        assertThat(script.symbols().get("rate").kind()).isEqualTo(NodeKind.CONSTANT);
        NdlNode w = script.symbols().get("w");
        assertThat(w.positionalParameters()).hasSize(2);
        assertThat(w.optionalParameters()).extracting(NdlNode::name).containsExactly("init", "tag");
        assertThat(w.findOptionalParameter("INIT").value()).isEqualTo("uniform");
    }

    @Test
    @Tag("unit")
    void testAliasAndVariableAssignments() {
        NdlScript script = parser.parse("x = Input(1)\ny = x\nz = later\nd = m.out", "net.ndl");

        assertThat(script.symbols().get("y")).isSameAs(script.symbols().get("x"));
        assertThat(script.symbols().get("z").kind()).isEqualTo(NodeKind.VARIABLE);
        assertThat(script.symbols().get("d").kind()).isEqualTo(NodeKind.DOT_PARAMETER);
    }

    /**
     * Verifies the three macro body forms and that a macro is registered in the global scope,
     * not in the script.
     */
    @Test
    @Tag("unit")
    void testMacroDefinitionForms() {
        NdlScript script = parser.parse(String.join("\n",
                "A(x) = [ y = Sigmoid(x) ]",
                "B(x, w) = { y = Times(w, x) }",
                "C(x) = Tanh(x)"), "macros.ndl");

        assertThat(script.statements()).isEmpty();
        assertThat(global.lookup("A").kind()).isEqualTo(NodeKind.MACRO);
        assertThat(global.lookup("B").formalParameters()).containsExactly("x", "w");
        NdlScript body = global.lookup("C").body();
        assertThat(body.isNoDefinitions()).isTrue();
        assertThat(body.statements()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void testMacroCallCreatesMacroCallNode() {
        NdlScript script = parser.parse("L(x) = [ y = Sigmoid(x) ]\nin = Input(2)\nout = L(in)", "net.ndl");

        NdlNode out = script.symbols().get("out");
        assertThat(out.kind()).isEqualTo(NodeKind.MACRO_CALL);
        assertThat(out.value()).isEqualTo("L");
        assertThat(out.body()).isSameAs(global.lookup("L").body());
    }

    @Test
    @Tag("unit")
    void testMacroArityIsCheckedWhileParsing() {
        assertThatThrownBy(() -> parser.parse("foo(x, y) = [ z = Plus(x, y) ]\nr = foo(1)", "net.ndl"))
                .isInstanceOf(ScriptArityException.class)
                .satisfies(e -> {
                    ScriptArityException arity = (ScriptArityException) e;
                    assertThat(arity.getExpected()).isEqualTo(2);
                    assertThat(arity.getActual()).isEqualTo(1);
                });
    }

    @Test
    @Tag("unit")
    void testFunctionArityIsCheckedWhileParsing() {
        assertThatThrownBy(() -> parser.parse("x = Input(1)\ny = Plus(x)", "net.ndl"))
                .isInstanceOf(ScriptArityException.class)
                .extracting(e -> ((ScriptException) e).getCode())
                .isEqualTo(ScriptErrorCode.PARAMETER_COUNT_MISMATCH);
    }

    @Test
    @Tag("unit")
    void testRedefinitionIsRejected() {
        assertThatThrownBy(() -> parser.parse("x = Input(1)\nx = Input(2)", "net.ndl"))
                .isInstanceOf(ScriptSymbolException.class)
                .extracting(e -> ((ScriptException) e).getCode())
                .isEqualTo(ScriptErrorCode.SYMBOL_REDEFINED);
    }

    @Test
    @Tag("unit")
    void testFunctionNameCannotBeAssigned() {
        assertThatThrownBy(() -> parser.parse("Sigmoid = Input(1)", "net.ndl"))
                .isInstanceOf(ScriptSymbolException.class)
                .extracting(e -> ((ScriptException) e).getCode())
                .isEqualTo(ScriptErrorCode.RESERVED_NAME);
    }

    @Test
    @Tag("unit")
    void testDottedAssignmentIsRejected() {
        assertThatThrownBy(() -> parser.parse("a.b = Input(1)", "net.ndl"))
                .isInstanceOf(ScriptSymbolException.class)
                .extracting(e -> ((ScriptException) e).getCode())
                .isEqualTo(ScriptErrorCode.INVALID_DOT_NAME);
    }

    @Test
    @Tag("unit")
    void testUnknownFunctionIsUndefined() {
        assertThatThrownBy(() -> parser.parse("y = Frobnicate(1)", "net.ndl"))
                .isInstanceOf(ScriptSymbolException.class)
                .extracting(e -> ((ScriptException) e).getToken())
                .isEqualTo("Frobnicate");
    }

    @Test
    @Tag("unit")
    void testCallingALocalSymbolIsNotCallable() {
        assertThatThrownBy(() -> parser.parse("x = Input(1)\ny = x(2)", "net.ndl"))
                .isInstanceOf(ScriptSymbolException.class)
                .extracting(e -> ((ScriptException) e).getCode())
                .isEqualTo(ScriptErrorCode.NOT_CALLABLE);
    }

    @Test
    @Tag("unit")
    void testMissingClosingBracket() {
        assertThatThrownBy(() -> parser.parse("x = Input(1", "net.ndl"))
                .isInstanceOf(ScriptSyntaxException.class)
                .extracting(e -> ((ScriptException) e).getCode())
                .isEqualTo(ScriptErrorCode.UNBALANCED_BRACES);
    }

    @Test
    @Tag("unit")
    void testStatementWithoutAssignment() {
        assertThatThrownBy(() -> parser.parse("x 1", "net.ndl"))
                .isInstanceOf(ScriptSyntaxException.class)
                .extracting(e -> ((ScriptException) e).getCode())
                .isEqualTo(ScriptErrorCode.INVALID_STATEMENT);
    }

    @Test
    @Tag("unit")
    void testLexicalErrorsAreRaisedTogether() {
        assertThatThrownBy(() -> parser.parse("x = Input(1) @\ny = ?", "net.ndl"))
                .isInstanceOf(ScriptSyntaxException.class)
                .hasMessageContaining("net.ndl:1")
                .hasMessageContaining("net.ndl:2")
                .extracting(e -> ((ScriptException) e).getCode())
                .isEqualTo(ScriptErrorCode.LEXICAL_ERROR);
    }

    /**
     * Verifies that {@code load} and {@code run} select the sections that make up the script,
     * with the load sections first.
     */
    @Test
    @Tag("unit")
    void testLoadAndRunSelectSections() {
        String text = String.join("\n",
                "load = macros",
                "run = network",
                "unused = [ q = Input(9) ]",
                "macros = [ L(x) = [ y = Tanh(x) ] ]",
                "network = [",
                "  in = Input(4)",
                "  out = L(in)",
                "]");

        NdlScript script = parser.parse(text, "net.ndl");

        assertThat(global.lookup("L")).isNotNull();
        assertThat(script.symbols().contains("in")).isTrue();
        assertThat(script.symbols().contains("out")).isTrue();
        assertThat(script.symbols().contains("q")).isFalse();
    }

    @Test
    @Tag("unit")
    void testSeparatorFromSettings() {
        NdlScript script = parser.parse("a = Input(1); b = Input(2); c = Plus(a, b)", "net.ndl");

        assertThat(script.statements()).hasSize(3);
    }
}
