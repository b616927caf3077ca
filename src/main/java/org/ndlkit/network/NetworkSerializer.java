package org.ndlkit.network;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Saves networks as pretty-printed JSON and loads them back.
 */
public class NetworkSerializer {

    private static final Logger log = LoggerFactory.getLogger(NetworkSerializer.class);

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    record SavedNode(String name, String operation, List<String> inputs, Map<String, String> attributes,
                     boolean needsGradient) {
    }

    record SavedNetwork(String name, List<SavedNode> nodes, Map<NodeRole, List<String>> roles) {
    }

    /**
     * Writes a network to a file.
     * @param network The network.
     * @param file The target file; parent directories are created.
     * @throws ScriptStateException with {@code IO_ERROR} if the file cannot be written.
     */
    public void save(ComputationNetwork network, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                gson.toJson(toSaved(network), writer);
            }
            log.info("Saved network '{}' ({} nodes) to {}", network.getName(), network.size(), file);
        } catch (IOException e) {
            throw new ScriptStateException(ScriptErrorCode.IO_ERROR, file.toString(),
                    "Failed to write model file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a network from a file.
     * @param file The model file.
     * @param networkName The name of the created network.
     * @return The network.
     * @throws ScriptStateException with {@code MODEL_LOAD_FAILED} if the content is malformed,
     *         or {@code IO_ERROR} if the file cannot be read.
     */
    public ComputationNetwork load(Path file, String networkName) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            SavedNetwork saved = gson.fromJson(reader, SavedNetwork.class);
            ComputationNetwork network = fromSaved(saved, networkName, file.toString());
            log.info("Loaded network '{}' ({} nodes) from {}", networkName, network.size(), file);
            return network;
        } catch (JsonParseException | IllegalStateException | NetworkException e) {
            throw new ScriptStateException(ScriptErrorCode.MODEL_LOAD_FAILED, file.toString(),
                    "Malformed model file " + file + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ScriptStateException(ScriptErrorCode.IO_ERROR, file.toString(),
                    "Failed to read model file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * @param network The network.
     * @return The JSON text of the network.
     */
    public String toJson(ComputationNetwork network) {
        return gson.toJson(toSaved(network));
    }

    private SavedNetwork toSaved(ComputationNetwork network) {
        List<SavedNode> nodes = new ArrayList<>();
        for (ComputationNode node : network.getNodes()) {
            List<String> inputs = new ArrayList<>();
            for (ComputationNode input : node.getInputs()) {
                inputs.add(input == null ? null : input.getName());
            }
            nodes.add(new SavedNode(node.getName(), node.getOperation(), inputs,
                    new LinkedHashMap<>(node.getAttributes()), node.isNeedsGradient()));
        }
        Map<NodeRole, List<String>> roles = new LinkedHashMap<>();
        for (NodeRole role : NodeRole.values()) {
            List<String> members = new ArrayList<>();
            for (ComputationNode member : network.getNodesInRole(role)) {
                members.add(member.getName());
            }
            if (!members.isEmpty()) {
                roles.put(role, members);
            }
        }
        return new SavedNetwork(network.getName(), nodes, roles);
    }

    private ComputationNetwork fromSaved(SavedNetwork saved, String networkName, String source) {
        if (saved == null || saved.nodes() == null) {
            throw new IllegalStateException("no nodes in " + source);
        }
        ComputationNetwork network = new ComputationNetwork(networkName);
        for (SavedNode node : saved.nodes()) {
            if (node == null || node.name() == null || node.operation() == null) {
                throw new IllegalStateException("node without name or operation");
            }
            ComputationNode created = network.createNode(node.name(), node.operation());
            if (node.attributes() != null) {
                node.attributes().forEach(created::setAttribute);
            }
            created.setNeedsGradient(node.needsGradient());
        }
        for (SavedNode node : saved.nodes()) {
            List<ComputationNode> inputs = new ArrayList<>();
            if (node.inputs() != null) {
                for (String input : node.inputs()) {
                    inputs.add(input == null ? null : resolve(network, input, node.name()));
                }
            }
            network.getNode(node.name()).attachInputs(inputs);
        }
        if (saved.roles() != null) {
            for (Map.Entry<NodeRole, List<String>> entry : saved.roles().entrySet()) {
                if (entry.getKey() == null) {
                    throw new IllegalStateException("unknown role");
                }
                if (entry.getValue() == null) {
                    throw new IllegalStateException("no member list for role " + entry.getKey());
                }
                for (String member : entry.getValue()) {
                    network.addToRole(entry.getKey(), resolve(network, member, entry.getKey().name()));
                }
            }
        }
        return network;
    }

    private static ComputationNode resolve(ComputationNetwork network, String name, String referencedBy) {
        if (name == null) {
            throw new IllegalStateException("'" + referencedBy + "' refers to a node without name");
        }
        ComputationNode node = network.getNode(name);
        if (node == null) {
            throw new IllegalStateException("'" + referencedBy + "' refers to unknown node '" + name + "'");
        }
        return node;
    }
}
