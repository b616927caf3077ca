package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NodeLookup.NodeMatch;
import org.ndlkit.network.ComputationNetwork;
import org.ndlkit.network.ComputationNode;
import org.ndlkit.script.model.EvaluationPass;

import java.util.List;

/**
 * Handles {@code SetProperty(node, property, value)}: sets the gradient flag or adds the nodes to
 * (or removes them from) a role set.
 */
public class SetPropertyHandler implements IMelCommandHandler {

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(3, 3, "SetProperty(toNode, propertyName, propertyValue)");
        arguments.allowOptions();
        MelProperty property = MelProperty.fromName(arguments.get(1));
        boolean value = arguments.getBoolean(2);
        List<NodeMatch> matches = context.lookup().find(arguments.get(0));

        context.processor().process(matches.get(0).binding(), EvaluationPass.RESOLVE, false);
        for (NodeMatch match : matches) {
            apply(match.node(), property, value);
        }
    }

    static void apply(ComputationNode node, MelProperty property, boolean value) {
        if (property == MelProperty.COMPUTE_GRADIENT) {
            node.setNeedsGradient(value);
            return;
        }
        ComputationNetwork network = node.getNetwork();
        if (value) {
            network.addToRole(property.role(), node);
        } else {
            network.removeFromRole(property.role(), node);
        }
    }
}
