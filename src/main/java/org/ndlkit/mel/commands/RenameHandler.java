package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NetworkBinding;
import org.ndlkit.mel.NodeLookup.NameMapping;
import org.ndlkit.network.ComputationNetwork;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSymbolException;
import org.ndlkit.script.model.EvaluationPass;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Handles {@code Rename(old, new)}. Both symbols may be patterns; all new names are checked
 * before the first node is renamed.
 */
public class RenameHandler implements IMelCommandHandler {

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(2, 2, "Rename(oldNodeName, newNodeName)");
        arguments.allowOptions();
        List<NameMapping> mappings = context.lookup().generateNames(arguments.get(0), arguments.get(1));
        NetworkBinding binding = mappings.get(0).source().binding();
        CommandOptions.requireSameModel(arguments, binding, arguments.get(0), mappings.get(0).targetBinding(), arguments.get(1));

        context.processor().process(binding, EvaluationPass.FINAL, false);
        ComputationNetwork network = binding.getNetwork();
        Set<String> newNames = new HashSet<>();
        for (NameMapping mapping : mappings) {
            String oldName = mapping.source().node().getName();
            String newName = mapping.targetName();
            if (!newNames.add(newName) || (!newName.equals(oldName) && network.containsNode(newName))) {
                throw new ScriptSymbolException(ScriptErrorCode.SYMBOL_REDEFINED, newName,
                        "Cannot rename '" + oldName + "' to '" + newName + "': the name is already taken");
            }
        }
        for (NameMapping mapping : mappings) {
            network.renameNode(mapping.source().node().getName(), mapping.targetName());
        }
    }
}
