package org.ndlkit.network;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptStateException;

/**
 * Raised when an operation on a {@link ComputationNetwork} violates its structure.
 */
public class NetworkException extends ScriptStateException {

    public NetworkException(ScriptErrorCode code, String token, String message) {
        super(code, token, message);
    }
}
