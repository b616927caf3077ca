package org.ndlkit.cli.commands;

import org.ndlkit.cli.CommandLineInterface;
import org.ndlkit.config.ScriptSettings;
import org.ndlkit.mel.ModelEditor;
import org.ndlkit.script.api.ScriptException;
import org.ndlkit.script.model.GlobalScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "edit", description = "Runs a model editing (MEL) script.")
public class EditCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(EditCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the MEL script.")
    private File file;

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() {
        ScriptSettings settings = parent.getSettings();
        Path script = file.toPath().toAbsolutePath();
        Path baseDirectory = script.getParent() != null ? script.getParent() : Path.of("");
        ModelEditor editor = new ModelEditor(settings, new GlobalScope(settings), baseDirectory);
        try {
            editor.runFile(script);
        } catch (ScriptException e) {
            log.error("{} failed [{}]: {}", file, e.getCode(), e.getMessage());
            return 1;
        }
        return 0;
    }
}
