package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;

/**
 * Handles {@code SetDefaultModel(model)}.
 */
public class SetDefaultModelHandler implements IMelCommandHandler {

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(1, 1, "SetDefaultModel(modelName)");
        arguments.allowOptions();
        context.models().setDefault(arguments.get(0));
    }
}
