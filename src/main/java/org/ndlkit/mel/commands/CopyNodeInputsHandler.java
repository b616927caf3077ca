package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NetworkBinding;
import org.ndlkit.mel.NodeLookup.NameMapping;
import org.ndlkit.network.CopyNodeFlags;
import org.ndlkit.script.model.EvaluationPass;

import java.util.List;

/**
 * Handles {@code CopyNodeInputs(from, to)}: gives the target node the inputs of the source node.
 */
public class CopyNodeInputsHandler implements IMelCommandHandler {

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(2, 2, "CopyNodeInputs(fromNode, toNode)");
        arguments.allowOptions();
        List<NameMapping> mappings = context.lookup().generateNames(arguments.get(0), arguments.get(1));
        NetworkBinding source = mappings.get(0).source().binding();
        CommandOptions.requireSameModel(arguments, source, arguments.get(0), mappings.get(0).targetBinding(), arguments.get(1));

        context.processor().process(source, EvaluationPass.RESOLVE, false);
        for (NameMapping mapping : mappings) {
            source.getNetwork().copyNode(mapping.source().node(), mapping.targetName(), CopyNodeFlags.CHILDREN);
        }
    }
}
