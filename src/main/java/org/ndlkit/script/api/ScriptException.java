package org.ndlkit.script.api;

/**
 * Base class of every error raised by the script layer.
 * <p>
 * Errors are raised where they are detected and abort the current top-level operation. Hosts
 * catch them at the command loop boundary.
 */
public class ScriptException extends RuntimeException {

    private final ScriptErrorCode code;
    private final String token;

    /**
     * Constructs a new script exception.
     * @param code The error code.
     * @param token The offending token, or {@code null} if there is none.
     * @param message The detail message.
     */
    public ScriptException(ScriptErrorCode code, String token, String message) {
        super(message);
        this.code = code;
        this.token = token;
    }

    /**
     * Constructs a new script exception with a cause.
     * @param code The error code.
     * @param token The offending token, or {@code null} if there is none.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ScriptException(ScriptErrorCode code, String token, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.token = token;
    }

    /**
     * @return The error code of this exception.
     */
    public ScriptErrorCode getCode() {
        return code;
    }

    /**
     * @return The offending token, or {@code null}.
     */
    public String getToken() {
        return token;
    }
}
