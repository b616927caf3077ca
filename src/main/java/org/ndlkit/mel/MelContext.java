package org.ndlkit.mel;

import org.ndlkit.config.ScriptSettings;
import org.ndlkit.network.ComputationNetwork;
import org.ndlkit.network.NetworkDumper;
import org.ndlkit.network.NetworkSerializer;
import org.ndlkit.script.frontend.parser.ScriptParser;
import org.ndlkit.script.model.GlobalScope;

import java.nio.file.Path;

/**
 * The editor state available to command handlers.
 */
public interface MelContext {

    ModelRegistry models();

    NodeLookup lookup();

    NdlProcessor processor();

    ScriptParser parser();

    NetworkSerializer serializer();

    NetworkDumper dumper();

    ScriptSettings settings();

    GlobalScope global();

    /**
     * @param fileName A file name as written in a command, relative to the editor's base directory.
     * @return The resolved path.
     */
    Path resolvePath(String fileName);

    /**
     * Creates a binding for a network without registering it.
     * @param modelName The model name.
     * @param network The network.
     * @return The binding.
     */
    NetworkBinding createBinding(String modelName, ComputationNetwork network);

    /**
     * @param fileName A file name as written in a command.
     * @return The file content.
     * @throws org.ndlkit.script.api.ScriptStateException with {@code IO_ERROR} if the file cannot be read.
     */
    String readText(String fileName);
}
