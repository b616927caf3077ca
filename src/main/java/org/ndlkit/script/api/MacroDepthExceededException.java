package org.ndlkit.script.api;

import java.util.List;

/**
 * Raised when macro calls nest deeper than the configured limit, which usually means a macro
 * calls itself directly or through other macros.
 */
public class MacroDepthExceededException extends ScriptSymbolException {

    private final List<String> callChain;

    /**
     * @param macroName The macro whose call exceeded the limit.
     * @param limit The configured limit.
     * @param callChain The names of the macros being expanded, outermost first.
     */
    public MacroDepthExceededException(String macroName, int limit, List<String> callChain) {
        super(ScriptErrorCode.MACRO_DEPTH_EXCEEDED, macroName,
                String.format("Macro call depth limit of %d exceeded calling '%s' (call chain: %s)",
                        limit, macroName, String.join(" -> ", callChain)));
        this.callChain = List.copyOf(callChain);
    }

    /**
     * @return The macro names that were being expanded, outermost first.
     */
    public List<String> getCallChain() {
        return callChain;
    }
}
