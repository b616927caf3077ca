package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NetworkBinding;
import org.ndlkit.script.model.EvaluationPass;

/**
 * Handles {@code DumpModel(model, file[, includeData])}.
 */
public class DumpModelHandler implements IMelCommandHandler {

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(2, 3, "DumpModel(modelName, fileName, [includeData=false|true])");
        boolean includeData = CommandOptions.includeData(arguments, 2);
        NetworkBinding binding = context.models().require(arguments.get(0));
        context.processor().process(binding, EvaluationPass.FINAL, true);
        String text = context.dumper().dump(binding.getNetwork(), includeData);
        context.dumper().write(text, context.resolvePath(arguments.get(1)));
    }
}
