package org.ndlkit.mel;

import org.ndlkit.script.frontend.lexer.Token;

import java.util.List;

/**
 * One MEL statement: either a command call or an inline NDL statement.
 *
 * @param head The first token of the statement (the command or the assigned name).
 * @param arguments The command arguments; {@code null} for NDL statements.
 * @param ndlTokens The tokens of an NDL statement terminated by END_OF_FILE; {@code null} for commands.
 */
public record MelStatement(Token head, MelArguments arguments, List<Token> ndlTokens) {

    public static MelStatement command(Token head, MelArguments arguments) {
        return new MelStatement(head, arguments, null);
    }

    public static MelStatement ndl(Token head, List<Token> tokens) {
        return new MelStatement(head, null, List.copyOf(tokens));
    }

    public boolean isCommand() {
        return arguments != null;
    }
}
