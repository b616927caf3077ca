package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NodeLookup.NodeMatch;
import org.ndlkit.network.ComputationNode;
import org.ndlkit.script.model.EvaluationPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles {@code SetNodeInputs(to, in1[, in2, in3])}: replaces all inputs of a single node.
 */
public class SetNodeInputsHandler implements IMelCommandHandler {

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(2, 4, "SetNodeInputs(toNode, inputNodeName1, [inputNodeName2, inputNodeName3])");
        arguments.allowOptions();
        NodeMatch target = context.lookup().findSingle(arguments.get(0));
        List<ComputationNode> inputs = new ArrayList<>();
        for (int i = 1; i < arguments.size(); i++) {
            NodeMatch input = context.lookup().findSingle(arguments.get(i));
            CommandOptions.requireSameModel(arguments, target.binding(), arguments.get(0), input.binding(), arguments.get(i));
            inputs.add(input.node());
        }

        context.processor().process(target.binding(), EvaluationPass.RESOLVE, false);
        target.node().attachInputs(inputs);
    }
}
