package org.ndlkit.script.backend;

import org.ndlkit.network.ComputationNetwork;
import org.ndlkit.network.ComputationNode;
import org.ndlkit.network.NetworkException;
import org.ndlkit.network.NodeRole;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSymbolException;
import org.ndlkit.script.eval.NodeEvaluator;
import org.ndlkit.script.eval.NodeHandles;
import org.ndlkit.script.functions.FunctionDefinition;
import org.ndlkit.script.model.EvaluationPass;
import org.ndlkit.script.model.NdlNode;
import org.ndlkit.script.model.NdlScript;
import org.ndlkit.script.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Creates the nodes of a {@link ComputationNetwork} from evaluated NDL statements.
 * <p>
 * The initial pass creates nodes and connects the inputs that are already known; later passes
 * fill the inputs that were forward references. Inputs that are already connected are never
 * replaced, so edits made between passes survive.
 */
public class NetworkBuilder implements NodeEvaluator<ComputationNode> {

    private static final Logger log = LoggerFactory.getLogger(NetworkBuilder.class);

    /** Operation of the nodes created for literal inputs. */
    public static final String CONSTANT_OPERATION = "Constant";
    /** Optional parameter assigning a role to the node. */
    public static final String TAG_PARAMETER = "tag";
    /** Optional parameter overriding whether the node is trained. */
    public static final String GRADIENT_PARAMETER = "needGradient";

    private static final Map<String, NodeRole> TAGS = Map.ofEntries(
            Map.entry("feature", NodeRole.FEATURE),
            Map.entry("features", NodeRole.FEATURE),
            Map.entry("label", NodeRole.LABEL),
            Map.entry("labels", NodeRole.LABEL),
            Map.entry("criterion", NodeRole.FINAL_CRITERION),
            Map.entry("criteria", NodeRole.FINAL_CRITERION),
            Map.entry("finalcriterion", NodeRole.FINAL_CRITERION),
            Map.entry("eval", NodeRole.EVALUATION),
            Map.entry("evaluation", NodeRole.EVALUATION),
            Map.entry("output", NodeRole.OUTPUT),
            Map.entry("outputs", NodeRole.OUTPUT));

    private final ComputationNetwork network;
    private final NodeHandles<ComputationNode> handles = new NodeHandles<>();

    public NetworkBuilder(ComputationNetwork network) {
        this.network = network;
    }

    public ComputationNetwork getNetwork() {
        return network;
    }

    @Override
    public ComputationNode evaluate(NdlNode node, String baseName, EvaluationPass pass) {
        if (node.kind() != NodeKind.FUNCTION) {
            return null;
        }
        ComputationNode computationNode = handles.get(node);
        if (computationNode == null) {
            String qualified = qualify(baseName, node.name());
            computationNode = network.getNode(qualified);
            if (computationNode == null) {
                computationNode = create(node, qualified);
            } else if (!computationNode.getOperation().equals(node.function().name())) {
                throw new NetworkException(ScriptErrorCode.NODE_ALREADY_EXISTS, qualified,
                        "Node '" + qualified + "' already exists with operation " + computationNode.getOperation());
            }
            handles.put(node, computationNode);
        }

        List<NdlNode> inputParameters = inputParameters(node);
        List<ComputationNode> inputs = evaluateParameters(node, baseName, 0, inputParameters.size(), pass);
        if (computationNode.getInputCount() == 0) {
            computationNode.attachInputs(inputs);
        } else {
            for (int i = 0; i < inputs.size() && i < computationNode.getInputCount(); i++) {
                if (computationNode.getInput(i) == null && inputs.get(i) != null) {
                    computationNode.setInput(i, inputs.get(i));
                }
            }
        }

        if (pass != EvaluationPass.INITIAL) {
            for (int i = 0; i < computationNode.getInputCount(); i++) {
                if (computationNode.getInput(i) == null && i < inputParameters.size()) {
                    String symbol = referencedName(inputParameters.get(i));
                    throw new ScriptSymbolException(ScriptErrorCode.UNDEFINED_SYMBOL, symbol,
                            "Undefined symbol '" + symbol + "' used as input " + i + " of '" + computationNode.getName() + "'");
                }
            }
        }
        return computationNode;
    }

    /**
     * Returns the handles of the graph inputs of a function node. Indices count graph inputs only,
     * not scalar parameters.
     */
    @Override
    public List<ComputationNode> evaluateParameters(NdlNode node, String baseName, int start, int count, EvaluationPass pass) {
        List<NdlNode> inputParameters = inputParameters(node);
        List<ComputationNode> result = new ArrayList<>();
        for (int i = start; i < start + count && i < inputParameters.size(); i++) {
            NdlNode target = evaluateParameter(node, inputParameters.get(i), baseName, pass);
            result.add(handleOf(target, baseName));
        }
        return result;
    }

    @Override
    public ComputationNode findSymbol(String name) {
        return network.getNode(name);
    }

    @Override
    public void processOptionalParameters(NdlNode node) {
        ComputationNode result = handles.get(node);
        if (result == null) {
            return;
        }
        for (NdlNode optional : node.optionalParameters()) {
            if (TAG_PARAMETER.equalsIgnoreCase(optional.name())) {
                applyTag(result, optional);
            }
        }
    }

    @Override
    public NodeHandles<ComputationNode> handles() {
        return handles;
    }

    private ComputationNode create(NdlNode node, String qualified) {
        FunctionDefinition function = node.function();
        ComputationNode created = network.createNode(qualified, function.name());
        created.setNeedsGradient(function.learnable());

        List<NdlNode> positional = node.positionalParameters();
        for (int i = 0; i < positional.size(); i++) {
            if (!function.isInput(i)) {
                created.setAttribute(function.parameterName(i), scalarText(positional.get(i)));
            }
        }
        for (NdlNode optional : node.optionalParameters()) {
            if (TAG_PARAMETER.equalsIgnoreCase(optional.name())) {
                applyTag(created, optional);
            } else if (GRADIENT_PARAMETER.equalsIgnoreCase(optional.name())) {
                created.setNeedsGradient(Boolean.parseBoolean(scalarText(optional)));
            } else {
                created.setAttribute(optional.name(), scalarText(optional));
            }
        }
        log.trace("Created {} = {}", qualified, function.name());
        return created;
    }

    private ComputationNode handleOf(NdlNode target, String baseName) {
        ComputationNode handle = handles.get(target);
        if (handle != null) {
            return handle;
        }
        switch (target.kind()) {
            case CONSTANT:
                return materializeConstant(target);
            case FUNCTION:
                // a forward reference to a statement of the same script
                return network.getNode(qualify(target.parentScript().baseName(), target.name()));
            case MACRO_CALL:
                // a forward reference to a call whose handle was cleared for this expansion
                return callResult(target, qualify(target.parentScript().baseName(), target.name()),
                        new IdentityHashMap<>());
            case DOT_PARAMETER:
                ComputationNode local = findSymbol(qualify(baseName, target.value()));
                if (local == null) {
                    local = throughBoundCall(target);
                }
                return local != null ? local : findSymbol(target.value());
            case VARIABLE:
            case UNDETERMINED:
            case PARAMETER:
                ComputationNode qualified = findSymbol(qualify(baseName, target.value()));
                return qualified != null ? qualified : findSymbol(target.value());
            case MACRO:
            case ARRAY:
            case OPTIONAL_PARAMETER:
            default:
                return null;
        }
    }

    /**
     * Finds the network node a macro call produced, by name, from the statement its body returns.
     *
     * @param call The MACRO_CALL node.
     * @param callName The qualified name the call was expanded under.
     * @param visited Calls already followed, for recursive macros.
     * @return The node, or {@code null} if the body result has no network node yet.
     */
    private ComputationNode callResult(NdlNode call, String callName, Map<NdlNode, Boolean> visited) {
        NdlScript body = call.body();
        if (body == null || visited.put(call, Boolean.TRUE) != null) {
            return null;
        }
        NdlNode result = body.symbols().get(call.value());
        if (result == null || result.kind() == NodeKind.PARAMETER) {
            List<NdlNode> statements = body.statements();
            if (statements.isEmpty()) {
                return null;
            }
            result = statements.get(statements.size() - 1);
        }
        NdlNode resolved = NdlScript.resolveReference(result);
        if (resolved.parentScript() != body) {
            return null;
        }
        if (resolved.kind() == NodeKind.FUNCTION) {
            return network.getNode(qualify(callName, resolved.name()));
        }
        if (resolved.kind() == NodeKind.MACRO_CALL) {
            return callResult(resolved, qualify(callName, resolved.name()), visited);
        }
        return null;
    }

    /**
     * Resolves {@code p.rest} where {@code p} is bound to a macro call, by naming the node
     * {@code rest} inside that call's expansion.
     */
    private ComputationNode throughBoundCall(NdlNode dotted) {
        String path = dotted.value();
        int dot = path.indexOf('.');
        if (dot <= 0 || dot == path.length() - 1) {
            return null;
        }
        NdlNode head = dotted.parentScript().findSymbol(path.substring(0, dot), true);
        if (head == null) {
            return null;
        }
        NdlNode call = NdlScript.resolveReference(head);
        if (call.kind() != NodeKind.MACRO_CALL) {
            return null;
        }
        String callName = qualify(call.parentScript().baseName(), call.name());
        return network.getNode(qualify(callName, path.substring(dot + 1)));
    }

    private ComputationNode materializeConstant(NdlNode constant) {
        String qualified = qualify(constant.parentScript().baseName(), constant.name());
        ComputationNode node = network.getNode(qualified);
        if (node == null) {
            node = network.createNode(qualified, CONSTANT_OPERATION);
            node.setAttribute("value", constant.value());
        }
        handles.put(constant, node);
        return node;
    }

    private void applyTag(ComputationNode node, NdlNode tag) {
        String value = scalarText(tag);
        NodeRole role = TAGS.get(value.toLowerCase(Locale.ROOT));
        if (role == null) {
            throw new ScriptSymbolException(ScriptErrorCode.UNKNOWN_PROPERTY, value,
                    "Unknown tag '" + value + "' on node '" + node.getName() + "'");
        }
        network.addToRole(role, node);
    }

    private static List<NdlNode> inputParameters(NdlNode node) {
        FunctionDefinition function = node.function();
        List<NdlNode> positional = node.positionalParameters();
        List<NdlNode> inputs = new ArrayList<>();
        for (int i = 0; i < positional.size(); i++) {
            if (function.isInput(i)) {
                inputs.add(positional.get(i));
            }
        }
        return inputs;
    }

    /**
     * @param parameter A scalar parameter.
     * @return The text of the value the parameter resolves to.
     */
    static String scalarText(NdlNode parameter) {
        NdlNode resolved = NdlScript.resolveReference(parameter);
        return switch (resolved.kind()) {
            case FUNCTION, MACRO_CALL, MACRO -> resolved.name();
            case CONSTANT, ARRAY, VARIABLE, UNDETERMINED, DOT_PARAMETER, PARAMETER, OPTIONAL_PARAMETER -> resolved.value();
        };
    }

    static String referencedName(NdlNode parameter) {
        return switch (parameter.kind()) {
            case VARIABLE, UNDETERMINED, DOT_PARAMETER, PARAMETER -> parameter.value();
            default -> parameter.name();
        };
    }

    /**
     * @param baseName A dotted scope prefix, possibly empty.
     * @param name A node name.
     * @return The qualified name.
     */
    public static String qualify(String baseName, String name) {
        return baseName == null || baseName.isEmpty() ? name : baseName + "." + name;
    }
}
