package org.ndlkit.script.diagnostics;

/**
 * A single diagnostic message produced while scanning or parsing a script.
 *
 * @param type The type of the diagnostic.
 * @param message The diagnostic message.
 * @param sourceName The logical name of the script (file name or {@code <memory>}).
 * @param line The line of the issue.
 * @param column The column of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String sourceName,
        int line,
        int column
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents the script from being used. */
        ERROR,
        /** A warning that does not stop processing. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, sourceName, line, column, message);
    }
}
