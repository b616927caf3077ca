package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NodeLookup.NodeMatch;
import org.ndlkit.network.ComputationNode;
import org.ndlkit.script.model.EvaluationPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles {@code DumpNode(node, file[, includeData])}; the node symbol may be a pattern.
 */
public class DumpNodeHandler implements IMelCommandHandler {

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(2, 3, "DumpNode(nodeName, fileName, [includeData=false|true])");
        boolean includeData = CommandOptions.includeData(arguments, 2);
        List<NodeMatch> matches = context.lookup().find(arguments.get(0));
        context.processor().process(matches.get(0).binding(), EvaluationPass.FINAL, false);

        List<ComputationNode> nodes = new ArrayList<>();
        for (NodeMatch match : matches) {
            nodes.add(match.node());
        }
        context.dumper().write(context.dumper().dump(nodes, includeData), context.resolvePath(arguments.get(1)));
    }
}
