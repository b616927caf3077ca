package org.ndlkit.script.api;

/**
 * Raised for malformed statements: a missing '=' sign, unbalanced braces, stray tokens or
 * arguments that cannot be converted.
 */
public class ScriptSyntaxException extends ScriptException {

    public ScriptSyntaxException(ScriptErrorCode code, String token, String message) {
        super(code, token, message);
    }
}
