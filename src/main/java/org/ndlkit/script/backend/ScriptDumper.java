package org.ndlkit.script.backend;

import org.ndlkit.script.eval.NodeEvaluator;
import org.ndlkit.script.eval.NodeHandles;
import org.ndlkit.script.functions.FunctionDefinition;
import org.ndlkit.script.model.EvaluationPass;
import org.ndlkit.script.model.NdlNode;
import org.ndlkit.script.model.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders the macro-expanded form of a script as text, one line per function node:
 * {@code qualifiedName = Operation(input, ..., scalar, ..., key=value)}.
 * Lines are produced during the initial pass only; handles are qualified node names.
 */
public class ScriptDumper implements NodeEvaluator<String> {

    private final NodeHandles<String> handles = new NodeHandles<>();
    private final List<String> lines = new ArrayList<>();

    @Override
    public String evaluate(NdlNode node, String baseName, EvaluationPass pass) {
        if (node.kind() != NodeKind.FUNCTION) {
            return null;
        }
        String qualified = NetworkBuilder.qualify(baseName, node.name());
        handles.put(node, qualified);
        if (pass != EvaluationPass.INITIAL) {
            return qualified;
        }

        FunctionDefinition function = node.function();
        List<NdlNode> positional = node.positionalParameters();
        List<String> arguments = new ArrayList<>();
        for (int i = 0; i < positional.size(); i++) {
            if (function.isInput(i)) {
                arguments.add(evaluateParameters(node, baseName, i, 1, pass).get(0));
            } else {
                arguments.add(NetworkBuilder.scalarText(positional.get(i)));
            }
        }
        for (NdlNode optional : node.optionalParameters()) {
            arguments.add(optional.name() + "=" + NetworkBuilder.scalarText(optional));
        }
        lines.add(qualified + " = " + function.name() + "(" + String.join(", ", arguments) + ")");
        return qualified;
    }

    /**
     * Renders a range of positional parameters; {@code start} is a positional index.
     */
    @Override
    public List<String> evaluateParameters(NdlNode node, String baseName, int start, int count, EvaluationPass pass) {
        List<NdlNode> positional = node.positionalParameters();
        List<String> rendered = new ArrayList<>();
        for (int i = start; i < start + count && i < positional.size(); i++) {
            NdlNode target = evaluateParameter(node, positional.get(i), baseName, pass);
            rendered.add(describe(target, baseName));
        }
        return rendered;
    }

    @Override
    public NodeHandles<String> handles() {
        return handles;
    }

    /**
     * @return The rendered lines, in evaluation order.
     */
    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }

    /**
     * @return The rendered lines joined with newlines.
     */
    public String text() {
        return String.join(System.lineSeparator(), lines);
    }

    private String describe(NdlNode target, String baseName) {
        String handle = handles.get(target);
        if (handle != null) {
            return handle;
        }
        return switch (target.kind()) {
            case CONSTANT -> target.value();
            case FUNCTION -> NetworkBuilder.qualify(target.parentScript().baseName(), target.name());
            case DOT_PARAMETER, VARIABLE, UNDETERMINED, PARAMETER -> NetworkBuilder.qualify(baseName, target.value());
            case MACRO_CALL, MACRO, ARRAY, OPTIONAL_PARAMETER -> target.name();
        };
    }
}
