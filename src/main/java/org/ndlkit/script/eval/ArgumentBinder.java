package org.ndlkit.script.eval;

import org.ndlkit.script.api.ScriptArityException;
import org.ndlkit.script.functions.FunctionDefinition;
import org.ndlkit.script.model.NdlNode;
import org.ndlkit.script.model.NodeKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches the arguments of a call against the parameters of the callee. The parser uses it to
 * reject bad calls before evaluation; the macro expander uses it to bind formals per call.
 */
public final class ArgumentBinder {

    private ArgumentBinder() {
        // Utility class
    }

    /**
     * The result of binding the arguments of a macro call.
     *
     * @param formals Each formal parameter name mapped to its argument node, in formal order.
     * @param extraOptional {@code name=value} arguments that do not name a formal parameter.
     */
    public record Binding(Map<String, NdlNode> formals, List<NdlNode> extraOptional) {
    }

    /**
     * Binds macro call arguments to formal parameters. Named arguments that match a formal bind by
     * name; the positional arguments then fill the remaining formals in order.
     *
     * @param callee The name of the macro, for error messages.
     * @param formalParameters The formal parameter names.
     * @param arguments The call's parameter nodes.
     * @return The binding.
     * @throws ScriptArityException if the positional arguments do not fill the remaining formals exactly.
     */
    public static Binding bind(String callee, List<String> formalParameters, List<NdlNode> arguments) {
        Map<String, NdlNode> named = new LinkedHashMap<>();
        List<NdlNode> extra = new ArrayList<>();
        List<NdlNode> positional = new ArrayList<>();
        for (NdlNode argument : arguments) {
            if (argument.kind() == NodeKind.OPTIONAL_PARAMETER) {
                String formal = findFormal(formalParameters, argument.name());
                if (formal != null) {
                    named.put(formal, argument.optionalValue());
                } else {
                    extra.add(argument);
                }
            } else {
                positional.add(argument);
            }
        }

        List<String> remaining = new ArrayList<>();
        for (String formal : formalParameters) {
            if (!named.containsKey(formal)) {
                remaining.add(formal);
            }
        }
        if (remaining.size() != positional.size()) {
            int supplied = named.size() + positional.size();
            throw new ScriptArityException(callee, formalParameters.size(), supplied,
                    "Macro '" + callee + "' expects " + formalParameters.size() + " parameter(s) but got " + supplied);
        }

        Map<String, NdlNode> bound = new LinkedHashMap<>();
        int next = 0;
        for (String formal : formalParameters) {
            NdlNode value = named.get(formal);
            bound.put(formal, value != null ? value : positional.get(next++));
        }
        return new Binding(bound, extra);
    }

    /**
     * Checks the positional argument count of a function call.
     * @param call The FUNCTION node.
     * @throws ScriptArityException if too few or too many positional parameters were given.
     */
    public static void checkFunctionArity(NdlNode call) {
        FunctionDefinition function = call.function();
        int actual = call.positionalParameters().size();
        if (actual < function.requiredParameters()) {
            throw new ScriptArityException(function.name(), function.requiredParameters(), actual,
                    "Function '" + function.name() + "' expects at least " + function.requiredParameters()
                            + " parameter(s) but got " + actual);
        }
        if (actual > function.maxParameters()) {
            throw new ScriptArityException(function.name(), function.maxParameters(), actual,
                    "Function '" + function.name() + "' expects at most " + function.maxParameters()
                            + " parameter(s) but got " + actual);
        }
    }

    private static String findFormal(List<String> formalParameters, String name) {
        for (String formal : formalParameters) {
            if (formal.equalsIgnoreCase(name)) {
                return formal;
            }
        }
        return null;
    }
}
