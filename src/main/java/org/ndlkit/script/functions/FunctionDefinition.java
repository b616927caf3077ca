package org.ndlkit.script.functions;

import java.util.List;

/**
 * Describes one built-in NDL function.
 *
 * @param name The canonical name, used as the operation of the created network node.
 * @param alias An alternate name, or {@code null}.
 * @param parameters The positional parameter names; a leading '@' marks a graph input.
 * @param requiredParameters How many leading positional parameters must be supplied.
 * @param learnable Whether nodes created by this function are trained (need a gradient).
 */
public record FunctionDefinition(
        String name,
        String alias,
        List<String> parameters,
        int requiredParameters,
        boolean learnable
) {

    /** Marks a parameter that is connected as a graph input. */
    public static final String INPUT_MARKER = "@";

    public FunctionDefinition {
        parameters = List.copyOf(parameters);
        if (requiredParameters < 0 || requiredParameters > parameters.size()) {
            throw new IllegalArgumentException("Invalid required parameter count for " + name + ": " + requiredParameters);
        }
    }

    /**
     * @param index A positional parameter index.
     * @return {@code true} if the parameter at the index is a graph input.
     */
    public boolean isInput(int index) {
        return index < parameters.size() && parameters.get(index).startsWith(INPUT_MARKER);
    }

    /**
     * @param index A positional parameter index.
     * @return The parameter name without the input marker.
     */
    public String parameterName(int index) {
        String raw = parameters.get(index);
        return raw.startsWith(INPUT_MARKER) ? raw.substring(INPUT_MARKER.length()) : raw;
    }

    /**
     * @return The number of graph inputs this function takes.
     */
    public int inputCount() {
        int count = 0;
        for (int i = 0; i < parameters.size(); i++) {
            if (isInput(i)) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return The maximum number of positional parameters.
     */
    public int maxParameters() {
        return parameters.size();
    }
}
