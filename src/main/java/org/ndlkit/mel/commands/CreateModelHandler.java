package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NetworkBinding;
import org.ndlkit.network.ComputationNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code CreateModel()} and {@code CreateModelWithName(name)}. The new, empty model
 * always becomes the default.
 */
public class CreateModelHandler implements IMelCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(CreateModelHandler.class);

    private final boolean withName;

    public CreateModelHandler(boolean withName) {
        this.withName = withName;
    }

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        String modelName;
        if (withName) {
            arguments.requireCount(1, 1, "CreateModelWithName(modelName)");
            modelName = arguments.get(0);
        } else {
            arguments.requireCount(0, 0, "CreateModel()");
            modelName = context.settings().defaultModelName();
        }
        arguments.allowOptions();
        NetworkBinding binding = context.createBinding(modelName, new ComputationNetwork(modelName));
        context.models().register(binding);
        context.models().setDefault(modelName);
        log.info("Created model '{}'", modelName);
    }
}
