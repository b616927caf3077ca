package org.ndlkit.cli.commands;

import org.ndlkit.cli.CommandLineInterface;
import org.ndlkit.config.ScriptSettings;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptException;
import org.ndlkit.script.api.ScriptStateException;
import org.ndlkit.script.backend.ScriptDumper;
import org.ndlkit.script.eval.ScriptEvaluator;
import org.ndlkit.script.frontend.parser.ScriptParser;
import org.ndlkit.script.model.EvaluationPass;
import org.ndlkit.script.model.GlobalScope;
import org.ndlkit.script.model.NdlScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "describe", description = "Parses an NDL file and prints the expanded statements.")
public class DescribeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DescribeCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the NDL file.")
    private File file;

    @Option(names = {"-D", "--define"}, description = "Global constants, e.g. --define hiddenDim=512.")
    private Map<String, String> defines = new LinkedHashMap<>();

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        ScriptSettings settings = parent.getSettings();
        GlobalScope global = new GlobalScope(settings);
        try {
            defines.forEach(global::defineConstant);
            String text = readFile();
            NdlScript script = new ScriptParser(global).parse(text, file.getName());
            ScriptDumper dumper = new ScriptDumper();
            new ScriptEvaluator(settings).evaluate(script, dumper, "", EvaluationPass.INITIAL, null);

            PrintWriter out = spec.commandLine().getOut();
            out.println(dumper.text());
            out.flush();
        } catch (ScriptException e) {
            log.error("{} failed [{}]: {}", file, e.getCode(), e.getMessage());
            return 1;
        }
        return 0;
    }

    private String readFile() {
        try {
            return Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScriptStateException(ScriptErrorCode.IO_ERROR, file.toString(), "Cannot read " + file, e);
        }
    }
}
