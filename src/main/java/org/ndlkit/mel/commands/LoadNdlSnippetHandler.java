package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;
import org.ndlkit.mel.NetworkBinding;
import org.ndlkit.network.ComputationNetwork;
import org.ndlkit.script.model.EvaluationPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code LoadNDLSnippet(model, file[, section])}: builds a new model from an NDL file,
 * or from one section of it, and makes it the default.
 */
public class LoadNdlSnippetHandler implements IMelCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(LoadNdlSnippetHandler.class);

    @Override
    public void execute(MelContext context, MelArguments arguments) {
        arguments.requireCount(2, 3, "LoadNDLSnippet(modelName, ndlFileName, [section])");
        arguments.allowOptions(CommandOptions.SECTION_OPTION);
        String modelName = arguments.get(0);
        String fileName = arguments.get(1);
        String section = arguments.optional(2, CommandOptions.SECTION_OPTION, null);

        String text = context.readText(fileName);
        NetworkBinding binding = context.createBinding(modelName, new ComputationNetwork(modelName));
        if (section != null) {
            context.parser().parseSection(binding.getScript(), text, fileName, section);
        } else {
            context.parser().parseInto(binding.getScript(), text, fileName);
        }
        context.processor().process(binding, EvaluationPass.INITIAL, false);

        context.models().register(binding);
        context.models().setDefault(modelName);
        log.info("Loaded NDL snippet {}{} as model '{}'", fileName, section != null ? " [" + section + "]" : "", modelName);
    }
}
