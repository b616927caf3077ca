package org.ndlkit.script.eval;

import org.ndlkit.script.model.EvaluationPass;
import org.ndlkit.script.model.NdlNode;
import org.ndlkit.script.model.NdlScript;

import java.util.List;

/**
 * The host capability driven by the {@link ScriptEvaluator}. One implementation creates network
 * nodes, another renders the expanded script as text.
 *
 * @param <H> The type of handle the host produces for an evaluated node.
 */
public interface NodeEvaluator<H> {

    /**
     * Evaluates one statement node (never a macro call; those are expanded by the evaluator).
     *
     * @param node The node to evaluate.
     * @param baseName The dotted scope prefix of the script being evaluated.
     * @param pass The current pass.
     * @return The handle for the node, or {@code null} if the node produces none.
     */
    H evaluate(NdlNode node, String baseName, EvaluationPass pass);

    /**
     * Resolves one parameter of a node to the node that carries its value.
     *
     * @param node The node owning the parameter.
     * @param parameter The parameter node.
     * @param baseName The dotted scope prefix.
     * @param pass The current pass.
     * @return The resolved node.
     */
    default NdlNode evaluateParameter(NdlNode node, NdlNode parameter, String baseName, EvaluationPass pass) {
        return NdlScript.resolveReference(parameter);
    }

    /**
     * Produces the handles of a range of positional parameters.
     *
     * @param node The node owning the parameters.
     * @param baseName The dotted scope prefix.
     * @param start The first positional index.
     * @param count How many parameters to evaluate.
     * @param pass The current pass.
     * @return One entry per parameter; entries may be {@code null} for unresolved references.
     */
    List<H> evaluateParameters(NdlNode node, String baseName, int start, int count, EvaluationPass pass);

    /**
     * Fallback lookup for names the script itself cannot resolve.
     *
     * @param name A (possibly qualified) name.
     * @return The handle, or {@code null}.
     */
    default H findSymbol(String name) {
        return null;
    }

    /**
     * Applies the {@code name=value} arguments of a macro call after the call has been expanded.
     *
     * @param node The macro call node.
     */
    default void processOptionalParameters(NdlNode node) {
    }

    /**
     * @return The handle side map of this evaluator.
     */
    NodeHandles<H> handles();
}
