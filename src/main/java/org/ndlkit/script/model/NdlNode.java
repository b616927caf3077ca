package org.ndlkit.script.model;

import org.ndlkit.script.functions.FunctionDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One node of a parsed NDL script.
 * <p>
 * Nodes are created through {@link NdlScript#createNode}, which records them in the script's arena.
 * The evaluation handle of a node is kept by the evaluator in a {@code NodeHandles} side map, not here.
 */
public final class NdlNode {

    private final String name;
    private final String value;
    private final NodeKind kind;
    private final NdlScript parentScript;
    private final List<NdlNode> parameters = new ArrayList<>();
    private List<String> formalParameters = List.of();
    private NdlScript body;
    private FunctionDefinition function;
    private NdlNode optionalValue;

    NdlNode(String name, String value, NodeKind kind, NdlScript parentScript) {
        this.name = name;
        this.value = value;
        this.kind = kind;
        this.parentScript = parentScript;
    }

    public String name() {
        return name;
    }

    /**
     * @return The raw value: literal text, canonical function name, macro name or referenced symbol.
     */
    public String value() {
        return value;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * @return The script whose arena owns this node.
     */
    public NdlScript parentScript() {
        return parentScript;
    }

    /**
     * @return The ordered parameters, positional and optional.
     */
    public List<NdlNode> parameters() {
        return Collections.unmodifiableList(parameters);
    }

    public void addParameter(NdlNode parameter) {
        parameters.add(parameter);
    }

    /**
     * @return Only the positional parameters, in order.
     */
    public List<NdlNode> positionalParameters() {
        List<NdlNode> positional = new ArrayList<>();
        for (NdlNode parameter : parameters) {
            if (parameter.kind != NodeKind.OPTIONAL_PARAMETER) {
                positional.add(parameter);
            }
        }
        return positional;
    }

    /**
     * @return Only the {@code name=value} parameters, in order.
     */
    public List<NdlNode> optionalParameters() {
        List<NdlNode> optional = new ArrayList<>();
        for (NdlNode parameter : parameters) {
            if (parameter.kind == NodeKind.OPTIONAL_PARAMETER) {
                optional.add(parameter);
            }
        }
        return optional;
    }

    /**
     * Finds an optional parameter by name, ignoring case.
     * @param optionalName The parameter name.
     * @return The parameter node, or {@code null}.
     */
    public NdlNode findOptionalParameter(String optionalName) {
        for (NdlNode parameter : parameters) {
            if (parameter.kind == NodeKind.OPTIONAL_PARAMETER && parameter.name.equalsIgnoreCase(optionalName)) {
                return parameter;
            }
        }
        return null;
    }

    /**
     * @return The formal parameter names of a macro or macro call; empty otherwise.
     */
    public List<String> formalParameters() {
        return formalParameters;
    }

    public void setFormalParameters(List<String> formalParameters) {
        this.formalParameters = List.copyOf(formalParameters);
    }

    /**
     * @return The body script of a macro or macro call, or {@code null}.
     */
    public NdlScript body() {
        return body;
    }

    public void setBody(NdlScript body) {
        this.body = body;
    }

    /**
     * @return The matched built-in function of a FUNCTION node, or {@code null}.
     */
    public FunctionDefinition function() {
        return function;
    }

    public void setFunction(FunctionDefinition function) {
        this.function = function;
    }

    /**
     * @return The parsed value of an OPTIONAL_PARAMETER node, or {@code null}.
     */
    public NdlNode optionalValue() {
        return optionalValue;
    }

    public void setOptionalValue(NdlNode optionalValue) {
        this.optionalValue = optionalValue;
    }

    @Override
    public String toString() {
        return kind + " " + name + (value != null && !value.equals(name) ? "=" + value : "");
    }
}
