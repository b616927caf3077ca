package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.MelContext;

/**
 * Interface for all MEL command handlers.
 */
@FunctionalInterface
public interface IMelCommandHandler {
    /**
     * Executes a command.
     * @param context The editor state (models, lookup, parser and file access).
     * @param arguments The command arguments as written.
     */
    void execute(MelContext context, MelArguments arguments);
}
