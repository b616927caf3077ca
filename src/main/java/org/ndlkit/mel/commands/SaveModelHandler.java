package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NetworkBinding;
import org.ndlkit.script.model.EvaluationPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code SaveDefaultModel(file[, format])} and {@code SaveModel(model, file[, format])}.
 * Pending NDL is evaluated completely and the network validated before it is written.
 */
public class SaveModelHandler implements IMelCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(SaveModelHandler.class);

    private final boolean defaultModel;

    public SaveModelHandler(boolean defaultModel) {
        this.defaultModel = defaultModel;
    }

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        NetworkBinding binding;
        String fileName;
        if (defaultModel) {
            arguments.requireCount(1, 2, "SaveDefaultModel(modelFileName, [format=cntk])");
            CommandOptions.format(arguments, 1);
            binding = context.models().requireDefault();
            fileName = arguments.get(0);
        } else {
            arguments.requireCount(2, 3, "SaveModel(modelName, modelFileName, [format=cntk])");
            CommandOptions.format(arguments, 2);
            binding = context.models().require(arguments.get(0));
            fileName = arguments.get(1);
        }
        context.processor().process(binding, EvaluationPass.FINAL, true);
        context.serializer().save(binding.getNetwork(), context.resolvePath(fileName));
        log.info("Saved model '{}' to {}", binding.getModelName(), fileName);
    }
}
