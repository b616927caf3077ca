package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NodeLookup.NodeMatch;
import org.ndlkit.network.ComputationNetwork;
import org.ndlkit.network.ComputationNode;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSymbolException;
import org.ndlkit.script.functions.FunctionDefinition;
import org.ndlkit.script.functions.FunctionRegistry;
import org.ndlkit.script.model.EvaluationPass;

import java.util.List;

/**
 * Handles {@code SetPropertyForSubTree(root, ComputeGradient, value)}: sets the gradient flag of
 * every learnable node below the root.
 */
public class SetPropertyForSubTreeHandler implements IMelCommandHandler {

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(3, 3, "SetPropertyForSubTree(rootNodeName, propertyName, propertyValue)");
        arguments.allowOptions();
        MelProperty property = MelProperty.fromName(arguments.get(1));
        if (property != MelProperty.COMPUTE_GRADIENT) {
            throw new ScriptSymbolException(ScriptErrorCode.UNKNOWN_PROPERTY, arguments.get(1),
                    "Property '" + arguments.get(1) + "' cannot be set for a subtree; only "
                            + MelProperty.COMPUTE_GRADIENT.displayName() + " is supported");
        }
        boolean value = arguments.getBoolean(2);
        List<NodeMatch> roots = context.lookup().find(arguments.get(0));

        context.processor().process(roots.get(0).binding(), EvaluationPass.RESOLVE, false);
        FunctionRegistry functions = context.global().functions();
        for (NodeMatch root : roots) {
            for (ComputationNode node : ComputationNetwork.collectSubTree(root.node())) {
                if (isLearnable(functions, node)) {
                    node.setNeedsGradient(value);
                }
            }
        }
    }

    private static boolean isLearnable(FunctionRegistry functions, ComputationNode node) {
        return functions.findExact(node.getOperation()).map(FunctionDefinition::learnable).orElse(false);
    }
}
