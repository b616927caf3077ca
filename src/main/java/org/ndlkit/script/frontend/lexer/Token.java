package org.ndlkit.script.frontend.lexer;

/**
 * Represents a single token extracted from script text by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token, including quotes for strings.
 * @param value The processed value: the unquoted content of a string, the text otherwise.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param sourceName The logical name of the script the token comes from.
 */
public record Token(
        TokenType type,
        String text,
        String value,
        int line,
        int column,
        String sourceName
) {
    /**
     * @return The position of this token formatted for error messages.
     */
    public String position() {
        return sourceName + ":" + line + ":" + column;
    }
}
