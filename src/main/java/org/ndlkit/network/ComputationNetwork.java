package org.ndlkit.network;

import org.ndlkit.script.api.ScriptErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An in-memory computation graph: named nodes, their input connections and the role sets
 * (features, labels, criteria, evaluation and output nodes).
 */
public class ComputationNetwork {

    private static final Logger log = LoggerFactory.getLogger(ComputationNetwork.class);

    /** Operation of the node that breaks cycles in recurrent networks. */
    public static final String DELAY_OPERATION = "PastValue";

    private final String name;
    private final Map<String, ComputationNode> nodes = new LinkedHashMap<>();
    private final Map<NodeRole, Set<ComputationNode>> roles = new EnumMap<>(NodeRole.class);

    public ComputationNetwork(String name) {
        this.name = name;
        for (NodeRole role : NodeRole.values()) {
            roles.put(role, new LinkedHashSet<>());
        }
    }

    public String getName() {
        return name;
    }

    /**
     * Creates a node.
     * @param nodeName The unique node name.
     * @param operation The operation name.
     * @return The new node.
     * @throws NetworkException if the name is taken.
     */
    public ComputationNode createNode(String nodeName, String operation) {
        if (nodes.containsKey(nodeName)) {
            throw new NetworkException(ScriptErrorCode.NODE_ALREADY_EXISTS, nodeName,
                    "Node '" + nodeName + "' already exists in network '" + name + "'");
        }
        ComputationNode node = new ComputationNode(this, nodeName, operation);
        nodes.put(nodeName, node);
        return node;
    }

    /**
     * @param nodeName A node name.
     * @return The node, or {@code null}.
     */
    public ComputationNode getNode(String nodeName) {
        return nodes.get(nodeName);
    }

    /**
     * @param nodeName A node name.
     * @return The node.
     * @throws NetworkException if no node has that name.
     */
    public ComputationNode requireNode(String nodeName) {
        ComputationNode node = nodes.get(nodeName);
        if (node == null) {
            throw new NetworkException(ScriptErrorCode.NODE_NOT_FOUND, nodeName,
                    "Node '" + nodeName + "' not found in network '" + name + "'");
        }
        return node;
    }

    public boolean containsNode(String nodeName) {
        return nodes.containsKey(nodeName);
    }

    /**
     * @return All nodes in creation order.
     */
    public Collection<ComputationNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Renames a node; the node object, its connections and role memberships are unchanged.
     * @param oldName The current name.
     * @param newName The new name.
     * @throws NetworkException if the old name is unknown or the new name is taken.
     */
    public void renameNode(String oldName, String newName) {
        ComputationNode node = requireNode(oldName);
        if (oldName.equals(newName)) {
            return;
        }
        if (nodes.containsKey(newName)) {
            throw new NetworkException(ScriptErrorCode.NODE_ALREADY_EXISTS, newName,
                    "Cannot rename '" + oldName + "': node '" + newName + "' already exists");
        }
        // rebuild to keep the creation order stable
        Map<String, ComputationNode> reordered = new LinkedHashMap<>();
        for (Map.Entry<String, ComputationNode> entry : nodes.entrySet()) {
            reordered.put(entry.getKey().equals(oldName) ? newName : entry.getKey(), entry.getValue());
        }
        nodes.clear();
        nodes.putAll(reordered);
        node.setName(newName);
        log.debug("Renamed {} to {} in {}", oldName, newName, name);
    }

    /**
     * Deletes a node. Inputs of other nodes that pointed to it become unconnected.
     * @param nodeName The node to delete.
     * @throws NetworkException if the node does not exist.
     */
    public void deleteNode(String nodeName) {
        ComputationNode node = requireNode(nodeName);
        nodes.remove(nodeName);
        for (Set<ComputationNode> members : roles.values()) {
            members.remove(node);
        }
        for (ComputationNode other : nodes.values()) {
            for (int i = 0; i < other.getInputCount(); i++) {
                if (other.getInput(i) == node) {
                    other.setInput(i, null);
                }
            }
        }
        log.debug("Deleted {} from {}", nodeName, name);
    }

    /**
     * Copies a node into this network. When the target name already exists the source is copied
     * onto that node, which must have the same operation.
     *
     * @param source The node to copy, possibly from another network.
     * @param toName The name of the copy.
     * @param flags What to copy; children can only be copied within one network.
     * @return The target node.
     * @throws NetworkException if children are copied across networks or the operations differ.
     */
    public ComputationNode copyNode(ComputationNode source, String toName, CopyNodeFlags flags) {
        if (flags.copiesChildren() && source.getNetwork() != this) {
            throw new NetworkException(ScriptErrorCode.NETWORK_MISMATCH, source.getName(),
                    "Inputs of '" + source.getName() + "' cannot be copied into network '" + name + "'");
        }
        ComputationNode target = nodes.get(toName);
        if (target == null) {
            target = createNode(toName, source.getOperation());
        } else if (!target.getOperation().equals(source.getOperation())) {
            throw new NetworkException(ScriptErrorCode.NODE_ALREADY_EXISTS, toName,
                    "Cannot copy " + source.getOperation() + " node '" + source.getName()
                            + "' onto " + target.getOperation() + " node '" + toName + "'");
        }
        if (target == source) {
            return target;
        }
        if (flags.copiesValue()) {
            target.replaceAttributes(source.getAttributes());
            target.setNeedsGradient(source.isNeedsGradient());
        }
        if (flags.copiesChildren()) {
            target.attachInputs(source.getInputs());
        }
        return target;
    }

    /**
     * Copies the subtree below a root (the root and everything reachable through its inputs) into
     * this network, prefixing every name. Connections inside the subtree are mapped to the copies.
     *
     * @param root The subtree root, possibly from another network.
     * @param prefix Prepended to every copied node name.
     * @param flags What to copy.
     * @return The copies, in the order the subtree was visited.
     * @throws NetworkException if a target name is already taken.
     */
    public List<ComputationNode> copySubTree(ComputationNode root, String prefix, CopyNodeFlags flags) {
        List<ComputationNode> subTree = collectSubTree(root);
        for (ComputationNode node : subTree) {
            String target = prefix + node.getName();
            if (nodes.containsKey(target)) {
                throw new NetworkException(ScriptErrorCode.NODE_ALREADY_EXISTS, target,
                        "Node '" + target + "' already exists in network '" + name + "'");
            }
        }

        Map<ComputationNode, ComputationNode> copies = new IdentityHashMap<>();
        List<ComputationNode> created = new ArrayList<>();
        for (ComputationNode node : subTree) {
            ComputationNode copy = createNode(prefix + node.getName(), node.getOperation());
            if (flags.copiesValue()) {
                copy.replaceAttributes(node.getAttributes());
                copy.setNeedsGradient(node.isNeedsGradient());
            }
            copies.put(node, copy);
            created.add(copy);
        }
        if (flags.copiesChildren()) {
            for (ComputationNode node : subTree) {
                List<ComputationNode> mapped = new ArrayList<>();
                for (ComputationNode input : node.getInputs()) {
                    mapped.add(input == null ? null : copies.get(input));
                }
                copies.get(node).attachInputs(mapped);
            }
        }
        log.debug("Copied {} node(s) below {} into {} with prefix '{}'", created.size(), root.getName(), name, prefix);
        return created;
    }

    /**
     * Collects a root and every node reachable through its inputs, inputs before their consumers.
     * @param root The subtree root.
     * @return The subtree nodes, each once.
     */
    public static List<ComputationNode> collectSubTree(ComputationNode root) {
        List<ComputationNode> ordered = new ArrayList<>();
        Set<ComputationNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        visit(root, visited, ordered);
        return ordered;
    }

    private static void visit(ComputationNode node, Set<ComputationNode> visited, List<ComputationNode> ordered) {
        if (node == null || !visited.add(node)) {
            return;
        }
        for (ComputationNode input : node.getInputs()) {
            visit(input, visited, ordered);
        }
        ordered.add(node);
    }

    public void addToRole(NodeRole role, ComputationNode node) {
        roles.get(role).add(node);
    }

    public void removeFromRole(NodeRole role, ComputationNode node) {
        roles.get(role).remove(node);
    }

    /**
     * @param role A role.
     * @return The members of the role, in insertion order.
     */
    public List<ComputationNode> getNodesInRole(NodeRole role) {
        return List.copyOf(roles.get(role));
    }

    /**
     * @param node A node of this network.
     * @return The roles the node is a member of.
     */
    public Set<NodeRole> getRoles(ComputationNode node) {
        Set<NodeRole> result = EnumSet.noneOf(NodeRole.class);
        for (Map.Entry<NodeRole, Set<ComputationNode>> entry : roles.entrySet()) {
            if (entry.getValue().contains(node)) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    /**
     * Checks that every input is connected to a node of this network and that cycles only pass
     * through delay nodes.
     * @throws NetworkException describing the first problem found.
     */
    public void validate() {
        for (ComputationNode node : nodes.values()) {
            for (int i = 0; i < node.getInputCount(); i++) {
                ComputationNode input = node.getInput(i);
                if (input == null) {
                    throw new NetworkException(ScriptErrorCode.NETWORK_VALIDATION_FAILED, node.getName(),
                            "Input " + i + " of node '" + node.getName() + "' is not connected");
                }
                if (input.getNetwork() != this || nodes.get(input.getName()) != input) {
                    throw new NetworkException(ScriptErrorCode.NETWORK_VALIDATION_FAILED, node.getName(),
                            "Input " + i + " of node '" + node.getName() + "' is not part of network '" + name + "'");
                }
            }
        }
        Map<ComputationNode, Integer> state = new IdentityHashMap<>();
        for (ComputationNode node : nodes.values()) {
            checkCycles(node, state);
        }
        log.debug("Network {} validated: {} node(s)", name, nodes.size());
    }

    private void checkCycles(ComputationNode node, Map<ComputationNode, Integer> state) {
        Integer current = state.get(node);
        if (current != null) {
            if (current == 1) {
                throw new NetworkException(ScriptErrorCode.NETWORK_VALIDATION_FAILED, node.getName(),
                        "Node '" + node.getName() + "' is part of a cycle without a " + DELAY_OPERATION + " node");
            }
            return;
        }
        state.put(node, 1);
        if (!DELAY_OPERATION.equals(node.getOperation())) {
            for (ComputationNode input : node.getInputs()) {
                checkCycles(input, state);
            }
        }
        state.put(node, 2);
    }

    /**
     * Removes all nodes and role memberships.
     */
    public void clear() {
        nodes.clear();
        for (Set<ComputationNode> members : roles.values()) {
            members.clear();
        }
    }

    @Override
    public String toString() {
        return "ComputationNetwork[" + name + ", " + nodes.size() + " nodes]";
    }
}
