package org.ndlkit.mel;

import org.ndlkit.network.ComputationNetwork;
import org.ndlkit.script.backend.NetworkBuilder;
import org.ndlkit.script.model.EvaluationPass;
import org.ndlkit.script.model.GlobalScope;
import org.ndlkit.script.model.NdlNode;
import org.ndlkit.script.model.NdlScript;

import java.util.EnumMap;
import java.util.Map;

/**
 * A model registered with the editor: one network, the NDL script that feeds it (created on first
 * use) and, per pass, the last statement already evaluated.
 */
public class NetworkBinding {

    private final String modelName;
    private final ComputationNetwork network;
    private final GlobalScope global;
    private final NetworkBuilder builder;
    private final Map<EvaluationPass, NdlNode> lastNodes = new EnumMap<>(EvaluationPass.class);
    private NdlScript script;

    public NetworkBinding(String modelName, ComputationNetwork network, GlobalScope global) {
        this.modelName = modelName;
        this.network = network;
        this.global = global;
        this.builder = new NetworkBuilder(network);
    }

    public String getModelName() {
        return modelName;
    }

    public ComputationNetwork getNetwork() {
        return network;
    }

    /**
     * @return The evaluator that turns this binding's statements into network nodes.
     */
    public NetworkBuilder getBuilder() {
        return builder;
    }

    /**
     * @return The script of this binding, created on first access.
     */
    public NdlScript getScript() {
        if (script == null) {
            script = new NdlScript(global);
        }
        return script;
    }

    public boolean hasScript() {
        return script != null;
    }

    /**
     * @param pass A pass.
     * @return The last statement evaluated in that pass, or {@code null}.
     */
    public NdlNode getLastNode(EvaluationPass pass) {
        return lastNodes.get(pass);
    }

    public void setLastNode(EvaluationPass pass, NdlNode node) {
        if (node == null) {
            lastNodes.remove(pass);
        } else {
            lastNodes.put(pass, node);
        }
    }

    /**
     * Drops the script, the network content and the evaluation state.
     */
    public void release() {
        if (script != null) {
            script.clear();
            script = null;
        }
        network.clear();
        builder.handles().clear();
        lastNodes.clear();
    }

    @Override
    public String toString() {
        return "NetworkBinding[" + modelName + "]";
    }
}
