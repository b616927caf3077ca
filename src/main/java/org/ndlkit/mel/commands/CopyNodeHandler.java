package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NetworkBinding;
import org.ndlkit.mel.NodeLookup.NameMapping;
import org.ndlkit.network.CopyNodeFlags;
import org.ndlkit.script.model.EvaluationPass;

import java.util.List;

/**
 * Handles {@code CopyNode(from, to[, copy=all|value])}. With {@code copy=all} the copy keeps the
 * source's inputs, so source and target must be in the same model.
 */
public class CopyNodeHandler implements IMelCommandHandler {

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(2, 3, "CopyNode(fromNode, toNode, [copy=all|value])");
        CopyNodeFlags flags = CommandOptions.copyFlags(arguments, 2);
        List<NameMapping> mappings = context.lookup().generateNames(arguments.get(0), arguments.get(1));
        NetworkBinding source = mappings.get(0).source().binding();
        NetworkBinding target = mappings.get(0).targetBinding();
        if (flags.copiesChildren()) {
            CommandOptions.requireSameModel(arguments, source, arguments.get(0), target, arguments.get(1));
        }

        context.processor().process(source, EvaluationPass.RESOLVE, false);
        for (NameMapping mapping : mappings) {
            target.getNetwork().copyNode(mapping.source().node(), mapping.targetName(), flags);
        }
    }
}
