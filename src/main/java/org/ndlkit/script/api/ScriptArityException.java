package org.ndlkit.script.api;

/**
 * Raised when a macro, function or command is called with the wrong number of parameters.
 */
public class ScriptArityException extends ScriptException {

    private final int expected;
    private final int actual;

    /**
     * @param callee The name of the called macro, function or command.
     * @param expected The number of parameters expected (the minimum if a range is allowed).
     * @param actual The number of parameters supplied.
     * @param message The detail message, which should mention both counts.
     */
    public ScriptArityException(String callee, int expected, int actual, String message) {
        super(ScriptErrorCode.PARAMETER_COUNT_MISMATCH, callee, message);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
