package org.ndlkit.script.eval;

import org.ndlkit.script.api.MacroDepthExceededException;
import org.ndlkit.script.model.EvaluationPass;
import org.ndlkit.script.model.NdlNode;
import org.ndlkit.script.model.NdlScript;
import org.ndlkit.script.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Instantiates macro bodies: binds the call's arguments to the formals, evaluates the body under
 * the call's qualified name and hands the result's handle to the call node.
 */
public class MacroExpander {

    private static final Logger log = LoggerFactory.getLogger(MacroExpander.class);

    private final ScriptEvaluator scriptEvaluator;
    private final int maxCallDepth;
    private final Deque<String> callStack = new ArrayDeque<>();

    MacroExpander(ScriptEvaluator scriptEvaluator, int maxCallDepth) {
        this.scriptEvaluator = scriptEvaluator;
        this.maxCallDepth = maxCallDepth;
    }

    /**
     * Expands one macro call.
     *
     * @param call The MACRO_CALL node.
     * @param caller The script containing the call.
     * @param evaluator The host evaluator.
     * @param baseName The dotted scope prefix of the caller.
     * @param pass The current pass.
     * @param <H> The host handle type.
     * @return The node that is the result of the call, or {@code null} for an empty body.
     * @throws MacroDepthExceededException if calls nest deeper than the limit.
     * @throws org.ndlkit.script.api.ScriptArityException if the arguments do not match the formals.
     */
    public <H> NdlNode expand(NdlNode call, NdlScript caller, NodeEvaluator<H> evaluator, String baseName, EvaluationPass pass) {
        String macroName = call.value();
        if (callStack.size() >= maxCallDepth) {
            List<String> chain = new ArrayList<>(callStack);
            Collections.reverse(chain);
            chain.add(macroName);
            throw new MacroDepthExceededException(macroName, maxCallDepth, chain);
        }

        callStack.push(macroName);
        NdlScript body = call.body();
        Map<String, NdlNode> shadowed = new LinkedHashMap<>();
        try {
            evaluator.handles().clear(body.ownedNodes());
            bind(call, caller, body, shadowed);

            String callBase = baseName == null || baseName.isEmpty() ? call.name() : baseName + "." + call.name();
            log.trace("Expanding {} as {} in pass {}", macroName, callBase, pass);
            NdlNode last = scriptEvaluator.evaluate(body, evaluator, callBase, pass, null);

            NdlNode result = body.symbols().get(macroName);
            if (result == null || result.kind() == NodeKind.PARAMETER) {
                result = last;
            }
            H handle = result == null ? null : evaluator.handles().get(NdlScript.resolveReference(result));
            if (handle != null) {
                evaluator.handles().put(call, handle);
            } else {
                evaluator.handles().remove(call);
            }
            return result;
        } finally {
            restore(body, shadowed);
            callStack.pop();
        }
    }

    private void bind(NdlNode call, NdlScript caller, NdlScript body, Map<String, NdlNode> shadowed) {
        ArgumentBinder.Binding binding = ArgumentBinder.bind(call.value(), call.formalParameters(), call.parameters());
        for (Map.Entry<String, NdlNode> entry : binding.formals().entrySet()) {
            NdlNode argument = entry.getValue();
            if (argument.kind() == NodeKind.PARAMETER) {
                NdlNode bound = caller.findSymbol(argument.name(), true);
                if (bound != null) {
                    argument = bound;
                }
            }
            body.symbols().assign(entry.getKey(), argument);
        }
        // extra name=value arguments are visible for this expansion only
        for (NdlNode optional : binding.extraOptional()) {
            String name = optional.name();
            if (!shadowed.containsKey(name)) {
                shadowed.put(name, body.symbols().get(name));
            }
            if (body.symbols().contains(name)) {
                body.symbols().assign(name, optional.optionalValue());
            } else {
                body.symbols().add(name, optional.optionalValue());
            }
        }
    }

    private static void restore(NdlScript body, Map<String, NdlNode> shadowed) {
        for (Map.Entry<String, NdlNode> entry : shadowed.entrySet()) {
            if (entry.getValue() == null) {
                body.symbols().remove(entry.getKey());
            } else {
                body.symbols().assign(entry.getKey(), entry.getValue());
            }
        }
    }

    /**
     * @return The current nesting depth of macro expansion.
     */
    public int depth() {
        return callStack.size();
    }
}
