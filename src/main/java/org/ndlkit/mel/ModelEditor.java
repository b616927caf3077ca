package org.ndlkit.mel;

import org.ndlkit.config.ScriptSettings;
import org.ndlkit.mel.commands.IMelCommandHandler;
import org.ndlkit.mel.commands.MelCommandRegistry;
import org.ndlkit.network.ComputationNetwork;
import org.ndlkit.network.NetworkDumper;
import org.ndlkit.network.NetworkSerializer;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptStateException;
import org.ndlkit.script.eval.ScriptEvaluator;
import org.ndlkit.script.frontend.parser.ScriptParser;
import org.ndlkit.script.model.EvaluationPass;
import org.ndlkit.script.model.GlobalScope;
import org.ndlkit.script.model.NdlScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Interprets MEL scripts: executes commands against the registered models and appends inline
 * NDL statements to the default model.
 */
public class ModelEditor implements MelContext {

    private static final Logger log = LoggerFactory.getLogger(ModelEditor.class);

    private final ScriptSettings settings;
    private final GlobalScope global;
    private final Path baseDirectory;
    private final ModelRegistry models = new ModelRegistry();
    private final NodeLookup lookup = new NodeLookup(models);
    private final NdlProcessor processor;
    private final ScriptParser parser;
    private final NetworkSerializer serializer = new NetworkSerializer();
    private final NetworkDumper dumper = new NetworkDumper();
    private final MelCommandRegistry commands = MelCommandRegistry.initialize();

    public ModelEditor() {
        this(ScriptSettings.defaults());
    }

    public ModelEditor(ScriptSettings settings) {
        this(settings, new GlobalScope(settings), Paths.get(""));
    }

    /**
     * @param settings The script settings.
     * @param global The scope shared by all NDL parsed by this editor.
     * @param baseDirectory The directory relative file names are resolved against.
     */
    public ModelEditor(ScriptSettings settings, GlobalScope global, Path baseDirectory) {
        this.settings = settings;
        this.global = global;
        this.baseDirectory = baseDirectory;
        this.processor = new NdlProcessor(new ScriptEvaluator(settings));
        this.parser = new ScriptParser(global);
    }

    /**
     * Runs MEL text statement by statement. The first failing statement aborts the run; earlier
     * statements stay applied.
     *
     * @param text The MEL text.
     * @param sourceName The logical name of the text.
     */
    public void run(String text, String sourceName) {
        for (MelStatement statement : new CommandParser(settings.statementSeparator()).parse(text, sourceName)) {
            execute(statement);
        }
    }

    /**
     * Runs a MEL file. Relative file names inside it resolve against the editor's base directory.
     * @param file The MEL file.
     */
    public void runFile(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScriptStateException(ScriptErrorCode.IO_ERROR, file.toString(), "Cannot read " + file, e);
        }
        log.info("Running {}", file);
        run(text, file.toString());
    }

    /**
     * Executes one statement.
     * @param statement The statement.
     */
    public void execute(MelStatement statement) {
        if (!statement.isCommand()) {
            executeNdl(statement);
            return;
        }
        String name = statement.head().text();
        IMelCommandHandler handler = commands.find(name)
                .orElseThrow(() -> new ScriptStateException(ScriptErrorCode.UNKNOWN_COMMAND, name,
                        "Unknown command '" + name + "' at " + statement.head().position()));
        log.debug("{}", statement.arguments());
        handler.execute(this, statement.arguments());
    }

    private void executeNdl(MelStatement statement) {
        NetworkBinding binding = models.requireDefault();
        NdlScript script = binding.getScript();
        script.setNoDefinitions(true);
        parser.parseTokens(script, statement.ndlTokens());
        log.debug("Inline NDL '{}' added to {}", statement.head().text(), binding.getModelName());
        processor.process(binding, EvaluationPass.INITIAL, false);
    }

    @Override
    public ModelRegistry models() {
        return models;
    }

    @Override
    public NodeLookup lookup() {
        return lookup;
    }

    @Override
    public NdlProcessor processor() {
        return processor;
    }

    @Override
    public ScriptParser parser() {
        return parser;
    }

    @Override
    public NetworkSerializer serializer() {
        return serializer;
    }

    @Override
    public NetworkDumper dumper() {
        return dumper;
    }

    @Override
    public ScriptSettings settings() {
        return settings;
    }

    @Override
    public GlobalScope global() {
        return global;
    }

    @Override
    public Path resolvePath(String fileName) {
        return baseDirectory.resolve(fileName);
    }

    @Override
    public NetworkBinding createBinding(String modelName, ComputationNetwork network) {
        return new NetworkBinding(modelName, network, global);
    }

    @Override
    public String readText(String fileName) {
        Path file = resolvePath(fileName);
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScriptStateException(ScriptErrorCode.IO_ERROR, fileName, "Cannot read " + file, e);
        }
    }
}
