package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NodeLookup.NodeMatch;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptStateException;
import org.ndlkit.script.model.EvaluationPass;

import java.util.List;

/**
 * Handles {@code SetNodeInput(to, inputIndex, from)}. The target symbol may be a pattern; every
 * target is checked before any input is changed.
 */
public class SetNodeInputHandler implements IMelCommandHandler {

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(3, 3, "SetNodeInput(toNode, inputIndex, inputNodeName)");
        arguments.allowOptions();
        int index = arguments.getInt(1);
        List<NodeMatch> targets = context.lookup().find(arguments.get(0));
        NodeMatch input = context.lookup().findSingle(arguments.get(2));
        for (NodeMatch target : targets) {
            CommandOptions.requireSameModel(arguments, target.binding(), arguments.get(0), input.binding(), arguments.get(2));
        }

        context.processor().process(input.binding(), EvaluationPass.RESOLVE, false);
        for (NodeMatch target : targets) {
            int inputCount = target.node().getInputCount();
            if (index < 0 || index >= inputCount) {
                throw new ScriptStateException(ScriptErrorCode.INPUT_INDEX_OUT_OF_RANGE, arguments.get(1),
                        "Input index " + index + " is out of range for '" + target.node().getName() + "' with " + inputCount + " input(s)");
            }
        }
        for (NodeMatch target : targets) {
            target.node().setInput(index, input.node());
        }
    }
}
