package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.network.ComputationNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code LoadModel(file[, format])} and {@code LoadModelWithName(name, file[, format])}.
 * The loaded model becomes the default.
 */
public class LoadModelHandler implements IMelCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(LoadModelHandler.class);

    private final boolean withName;

    public LoadModelHandler(boolean withName) {
        this.withName = withName;
    }

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        String modelName;
        String fileName;
        if (withName) {
            arguments.requireCount(2, 3, "LoadModelWithName(modelName, modelFileName, [format=cntk])");
            CommandOptions.format(arguments, 2);
            modelName = arguments.get(0);
            fileName = arguments.get(1);
        } else {
            arguments.requireCount(1, 2, "LoadModel(modelFileName, [format=cntk])");
            CommandOptions.format(arguments, 1);
            modelName = context.settings().defaultModelName();
            fileName = arguments.get(0);
        }
        ComputationNetwork network = context.serializer().load(context.resolvePath(fileName), modelName);
        context.models().register(context.createBinding(modelName, network));
        context.models().setDefault(modelName);
        log.info("Loaded model '{}' from {} ({} nodes)", modelName, fileName, network.size());
    }
}
