package org.ndlkit.script.api;

/**
 * Raised for undefined, ambiguous or redefined symbols.
 */
public class ScriptSymbolException extends ScriptException {

    public ScriptSymbolException(ScriptErrorCode code, String token, String message) {
        super(code, token, message);
    }
}
