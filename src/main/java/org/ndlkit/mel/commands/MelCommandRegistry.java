package org.ndlkit.mel.commands;

import org.ndlkit.script.functions.NameMatcher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A registry for MEL command handlers. Commands are matched by exact name or alias first,
 * otherwise by abbreviation in registration order.
 */
public class MelCommandRegistry {

    /**
     * A registered command.
     * @param name The command name.
     * @param alias The short form, or {@code null}.
     * @param handler The handler.
     */
    public record Entry(String name, String alias, IMelCommandHandler handler) {
    }

    private final List<Entry> entries = new ArrayList<>();

    /**
     * Registers a command handler.
     * @param name The command name (e.g., "CopyNode").
     * @param alias The alias (e.g., "Copy"), or {@code null}.
     * @param handler The handler for the command.
     */
    public void register(String name, String alias, IMelCommandHandler handler) {
        entries.add(new Entry(name, alias, handler));
    }

    /**
     * Resolves a (possibly abbreviated) command name.
     * @param token The command name as written.
     * @return An {@link Optional} containing the handler if a command matches, otherwise empty.
     */
    public Optional<IMelCommandHandler> find(String token) {
        return findEntry(token).map(Entry::handler);
    }

    /**
     * @param token The command name as written.
     * @return The matching entry, if any.
     */
    public Optional<Entry> findEntry(String token) {
        return NameMatcher.find(token, entries, Entry::name, Entry::alias);
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Initializes the registry with all built-in commands.
     * @return A new instance of {@link MelCommandRegistry} with all handlers registered.
     */
    public static MelCommandRegistry initialize() {
        MelCommandRegistry registry = new MelCommandRegistry();
        // model lifecycle
        registry.register("CreateModel", null, new CreateModelHandler(false));
        registry.register("CreateModelWithName", null, new CreateModelHandler(true));
        registry.register("LoadModel", null, new LoadModelHandler(false));
        registry.register("LoadModelWithName", null, new LoadModelHandler(true));
        registry.register("LoadNDLSnippet", null, new LoadNdlSnippetHandler());
        registry.register("SaveDefaultModel", null, new SaveModelHandler(true));
        registry.register("SaveModel", null, new SaveModelHandler(false));
        registry.register("SetDefaultModel", null, new SetDefaultModelHandler());
        registry.register("UnloadModel", null, new UnloadModelHandler());
        registry.register("DumpModel", "Dump", new DumpModelHandler());
        registry.register("DumpNode", null, new DumpNodeHandler());

        // node editing
        registry.register("CopyNode", "Copy", new CopyNodeHandler());
        registry.register("CopySubTree", null, new CopySubTreeHandler());
        registry.register("CopyNodeInputs", "CopyInputs", new CopyNodeInputsHandler());
        registry.register("SetNodeInput", "SetInput", new SetNodeInputHandler());
        registry.register("SetNodeInputs", "SetInputs", new SetNodeInputsHandler());
        registry.register("SetProperty", null, new SetPropertyHandler());
        registry.register("SetPropertyForSubTree", null, new SetPropertyForSubTreeHandler());
        DeleteNodeHandler deleteHandler = new DeleteNodeHandler();
        registry.register("RemoveNode", "Remove", deleteHandler);
        registry.register("DeleteNode", "Delete", deleteHandler);
        registry.register("Rename", null, new RenameHandler());
        return registry;
    }
}
