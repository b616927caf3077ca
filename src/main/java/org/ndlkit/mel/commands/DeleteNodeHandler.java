package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NetworkBinding;
import org.ndlkit.mel.NodeLookup.NodeMatch;
import org.ndlkit.script.model.EvaluationPass;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Handles {@code DeleteNode(node...)} and {@code RemoveNode(node...)}. Each model's pending NDL is
 * evaluated once, before its first deletion.
 */
public class DeleteNodeHandler implements IMelCommandHandler {

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(1, Integer.MAX_VALUE, arguments.command() + "(nodeName, ...)");
        arguments.allowOptions();
        Set<NetworkBinding> processed = Collections.newSetFromMap(new IdentityHashMap<>());
        for (String symbol : arguments.positional()) {
            List<NodeMatch> matches = context.lookup().find(symbol);
            NetworkBinding binding = matches.get(0).binding();
            if (processed.add(binding)) {
                context.processor().process(binding, EvaluationPass.FINAL, false);
            }
            for (NodeMatch match : matches) {
                binding.getNetwork().deleteNode(match.node().getName());
            }
        }
    }
}
