package org.ndlkit.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of a {@link ComputationNetwork}: a named operation with ordered inputs and textual
 * attributes. Inputs may be {@code null} while forward references are unresolved.
 */
public class ComputationNode {

    private final ComputationNetwork network;
    private final String operation;
    private final List<ComputationNode> inputs = new ArrayList<>();
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private String name;
    private boolean needsGradient;

    ComputationNode(ComputationNetwork network, String name, String operation) {
        this.network = network;
        this.name = name;
        this.operation = operation;
    }

    public String getName() {
        return name;
    }

    void setName(String name) {
        this.name = name;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return The network this node belongs to.
     */
    public ComputationNetwork getNetwork() {
        return network;
    }

    /**
     * @return The inputs in order; entries may be {@code null}.
     */
    public List<ComputationNode> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    public int getInputCount() {
        return inputs.size();
    }

    public ComputationNode getInput(int index) {
        return inputs.get(index);
    }

    /**
     * Replaces all inputs.
     * @param newInputs The inputs; {@code null} entries mark unresolved inputs.
     */
    public void attachInputs(List<ComputationNode> newInputs) {
        inputs.clear();
        inputs.addAll(newInputs);
    }

    /**
     * Replaces one input.
     * @param index The input index.
     * @param input The new input.
     * @throws IndexOutOfBoundsException if the index is outside the current inputs.
     */
    public void setInput(int index, ComputationNode input) {
        inputs.set(index, input);
    }

    /**
     * @return {@code true} if any input is still unconnected.
     */
    public boolean hasMissingInputs() {
        return inputs.contains(null);
    }

    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public void setAttribute(String key, String value) {
        attributes.put(key, value);
    }

    void replaceAttributes(Map<String, String> values) {
        attributes.clear();
        attributes.putAll(values);
    }

    public boolean isNeedsGradient() {
        return needsGradient;
    }

    public void setNeedsGradient(boolean needsGradient) {
        this.needsGradient = needsGradient;
    }

    @Override
    public String toString() {
        return name + "=" + operation;
    }
}
