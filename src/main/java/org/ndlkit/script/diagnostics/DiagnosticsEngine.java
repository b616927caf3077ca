package org.ndlkit.script.diagnostics;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSyntaxException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics reported by the lexer so that all problems of a script text are reported
 * together instead of one at a time.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param sourceName The script in which the error occurred.
     * @param line The line of the error.
     * @param column The column of the error.
     */
    public void reportError(String message, String sourceName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, sourceName, line, column));
    }

    /**
     * @return {@code true} if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return An unmodifiable view of all collected diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All collected diagnostics as one formatted string.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Raises a {@link ScriptSyntaxException} carrying the summary if any error was reported.
     */
    public void throwIfErrors() {
        if (hasErrors()) {
            throw new ScriptSyntaxException(ScriptErrorCode.LEXICAL_ERROR, null, summary());
        }
    }
}
