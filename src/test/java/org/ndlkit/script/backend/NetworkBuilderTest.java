package org.ndlkit.script.backend;

import org.ndlkit.network.ComputationNetwork;
import org.ndlkit.network.ComputationNode;
import org.ndlkit.network.NetworkException;
import org.ndlkit.network.NodeRole;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSymbolException;
import org.ndlkit.script.eval.ScriptEvaluator;
import org.ndlkit.script.frontend.parser.ScriptParser;
import org.ndlkit.script.model.EvaluationPass;
import org.ndlkit.script.model.GlobalScope;
import org.ndlkit.script.model.NdlScript;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link NetworkBuilder}, which turns evaluated statements into
 * network nodes.
 */
public class NetworkBuilderTest {

    private final ScriptEvaluator evaluator = new ScriptEvaluator();

    private NetworkBuilder builderFor(String name) {
        return new NetworkBuilder(new ComputationNetwork(name));
    }

    private NdlScript parse(String text) {
        return new ScriptParser(new GlobalScope()).parse(text, "net.ndl");
    }

    private ComputationNetwork buildAll(String text) {
        NdlScript script = parse(text);
        NetworkBuilder builder = builderFor("net");
        for (EvaluationPass pass : EvaluationPass.values()) {
            evaluator.evaluate(script, builder, "", pass, null);
        }
        return builder.getNetwork();
    }

    /**
     * Verifies that literal arguments of a macro call become Constant nodes feeding the body.
     */
    @Test
    @Tag("unit")
    void testLiteralMacroArgumentsBecomeConstants() {
        // Act
        ComputationNetwork network = buildAll("foo(x,y)=[ z = Plus(x,y) ]\nfoo(1,2)");

        // Assert
        List<ComputationNode> plus = network.getNodes().stream()
                .filter(n -> n.getOperation().equals("Plus")).toList();
        assertThat(plus).hasSize(1);
        assertThat(plus.get(0).getName()).endsWith(".z");
        assertThat(plus.get(0).getInputs()).extracting(ComputationNode::getOperation)
                .containsExactly(NetworkBuilder.CONSTANT_OPERATION, NetworkBuilder.CONSTANT_OPERATION);
        assertThat(plus.get(0).getInputs()).extracting(n -> n.getAttribute("value"))
                .containsExactly("1", "2");
    }

    @Test
    @Tag("unit")
    void testScalarParametersBecomeAttributes() {
        ComputationNetwork network = buildAll("w = Parameter(3, 2, init=uniform)");

        ComputationNode w = network.getNode("w");
        assertThat(w.getOperation()).isEqualTo("LearnableParameter");
        assertThat(w.getAttributes()).containsEntry("rows", "3").containsEntry("cols", "2").containsEntry("init", "uniform");
        assertThat(w.isNeedsGradient()).isTrue();
        assertThat(w.getInputs()).isEmpty();
    }

    /**
     * Verifies that a forward reference stays unconnected after the initial pass and is connected
     * by the resolve pass.
     */
    @Test
    @Tag("unit")
    void testForwardReferenceIsResolvedInLaterPass() {
        // Arrange
        NdlScript script = parse("a = Sigmoid(b)\nb = Input(3)");
        NetworkBuilder builder = builderFor("net");

        // Act
        evaluator.evaluate(script, builder, "", EvaluationPass.INITIAL, null);
        boolean missingAfterInitial = builder.getNetwork().getNode("a").hasMissingInputs();
        evaluator.evaluate(script, builder, "", EvaluationPass.RESOLVE, null);

        // Assert
        ComputationNetwork network = builder.getNetwork();
        assertThat(missingAfterInitial).isTrue();
        assertThat(network.getNode("a").getInputs()).containsExactly(network.getNode("b"));
    }

    @Test
    @Tag("unit")
    void testUndefinedInputFailsAfterInitialPass() {
        NdlScript script = parse("a = Sigmoid(q)");
        NetworkBuilder builder = builderFor("net");
        evaluator.evaluate(script, builder, "", EvaluationPass.INITIAL, null);

        assertThatThrownBy(() -> evaluator.evaluate(script, builder, "", EvaluationPass.RESOLVE, null))
                .isInstanceOf(ScriptSymbolException.class)
                .satisfies(e -> {
                    ScriptSymbolException symbolException = (ScriptSymbolException) e;
                    assertThat(symbolException.getCode()).isEqualTo(ScriptErrorCode.UNDEFINED_SYMBOL);
                    assertThat(symbolException.getToken()).isEqualTo("q");
                });
    }

    @Test
    @Tag("unit")
    void testTagsAndGradientOverride() {
        ComputationNetwork network = buildAll(
                "f = Input(2, tag=feature)\nw = Parameter(2, 2, needGradient=false)\nout = Times(w, f, tag=output)");

        assertThat(network.getNodesInRole(NodeRole.FEATURE)).containsExactly(network.getNode("f"));
        assertThat(network.getNodesInRole(NodeRole.OUTPUT)).containsExactly(network.getNode("out"));
        assertThat(network.getNode("w").isNeedsGradient()).isFalse();
    }

    @Test
    @Tag("unit")
    void testUnknownTagIsRejected() {
        assertThatThrownBy(() -> buildAll("f = Input(2, tag=sideways)"))
                .isInstanceOf(ScriptSymbolException.class)
                .hasMessageContaining("sideways");
    }

    @Test
    @Tag("unit")
    void testTagOnMacroCallAppliesToResult() {
        ComputationNetwork network = buildAll("L(x) = [ h = Tanh(x) ]\nin = Input(2)\nl1 = L(in, tag=output)");

        assertThat(network.getNodesInRole(NodeRole.OUTPUT)).containsExactly(network.getNode("l1.h"));
    }

    @Test
    @Tag("unit")
    void testExistingNodeWithOtherOperationIsRejected() {
        NetworkBuilder builder = builderFor("net");
        builder.getNetwork().createNode("a", "Tanh");
        NdlScript script = parse("a = Input(2)");

        assertThatThrownBy(() -> evaluator.evaluate(script, builder, "", EvaluationPass.INITIAL, null))
                .isInstanceOf(NetworkException.class)
                .satisfies(e -> assertThat(((NetworkException) e).getCode()).isEqualTo(ScriptErrorCode.NODE_ALREADY_EXISTS));
    }

    @Test
    @Tag("unit")
    void testBuildIsDeterministic() {
        String text = "L(x) = [ h = Tanh(Plus(x, x)) ]\nin = Input(2)\nout = Sigmoid(L(in))";

        List<String> first = new ArrayList<>();
        buildAll(text).getNodes().forEach(n -> first.add(n.getName() + "=" + n.getOperation()));
        List<String> second = new ArrayList<>();
        buildAll(text).getNodes().forEach(n -> second.add(n.getName() + "=" + n.getOperation()));

        assertThat(second).isEqualTo(first);
    }

    /**
     * Verifies that a statement in a macro body can refer to a macro call that appears later in
     * the same body.
     */
    @Test
    @Tag("unit")
    void testForwardReferenceToMacroCallInsideMacroBody() {
        // Arrange
        String text = "L(in) = [ h = Tanh(in) ]\n"
                + "M(in) = [\n  c = Plus(a, in)\n  a = L(in)\n]\n"
                + "x = Input(2)\nm = M(x)";

        // Act
        ComputationNetwork network = buildAll(text);

        // Assert
        assertThat(network.getNode("m.c").getInputs())
                .containsExactly(network.getNode("m.a.h"), network.getNode("x"));
    }

    /**
     * Verifies that a dotted name whose head is a macro parameter reaches into the call bound to it.
     */
    @Test
    @Tag("unit")
    void testDottedNameThroughBoundMacroCall() {
        // Arrange
        String text = "L(in) = [ h = Tanh(in) ]\n"
                + "N(p) = [ o = Sigmoid(p.h) ]\n"
                + "x = Input(2)\na = L(x)\nn = N(a)";

        // Act
        ComputationNetwork network = buildAll(text);

        // Assert
        assertThat(network.getNode("n.o").getInputs()).containsExactly(network.getNode("a.h"));
    }
}
