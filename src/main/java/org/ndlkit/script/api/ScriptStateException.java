package org.ndlkit.script.api;

/**
 * Raised for missing models or nodes, a missing default model, unknown commands and failures of
 * the files a command reads or writes.
 */
public class ScriptStateException extends ScriptException {

    public ScriptStateException(ScriptErrorCode code, String token, String message) {
        super(code, token, message);
    }

    public ScriptStateException(ScriptErrorCode code, String token, String message, Throwable cause) {
        super(code, token, message, cause);
    }
}
