package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NetworkBinding;
import org.ndlkit.mel.NodeLookup.NodeMatch;
import org.ndlkit.network.CopyNodeFlags;
import org.ndlkit.script.model.EvaluationPass;

/**
 * Handles {@code CopySubTree(fromRoot, toModel, prefix[, copy=all|value])}. Connections inside the
 * subtree are rebuilt between the copies, so the target may be another model.
 */
public class CopySubTreeHandler implements IMelCommandHandler {

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(3, 4, "CopySubTree(fromNode, toNetwork, toNodeNamePrefix, [copy=all|value])");
        CopyNodeFlags flags = CommandOptions.copyFlags(arguments, 3);
        NodeMatch root = context.lookup().findSingle(arguments.get(0));
        NetworkBinding target = context.models().require(arguments.get(1));

        context.processor().process(root.binding(), EvaluationPass.RESOLVE, false);
        target.getNetwork().copySubTree(root.node(), arguments.get(2), flags);
    }
}
