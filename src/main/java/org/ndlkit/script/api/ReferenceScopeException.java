package org.ndlkit.script.api;

/**
 * Raised when the operands of a single command belong to different networks.
 */
public class ReferenceScopeException extends ScriptException {

    public ReferenceScopeException(String token, String message) {
        super(ScriptErrorCode.NETWORK_MISMATCH, token, message);
    }
}
