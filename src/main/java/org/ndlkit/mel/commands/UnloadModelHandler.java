package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code UnloadModel(model...)}. Names of models that do not exist are skipped with a warning.
 */
public class UnloadModelHandler implements IMelCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(UnloadModelHandler.class);

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(1, Integer.MAX_VALUE, "UnloadModel(modelName, ...)");
        arguments.allowOptions();
        for (String modelName : arguments.positional()) {
            if (!context.models().unload(modelName)) {
                log.warn("Model '{}' does not exist", modelName);
            }
        }
    }
}
