package org.ndlkit.network;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptStateException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders networks and nodes as human readable text.
 */
public class NetworkDumper {

    /**
     * Renders nodes, one block each.
     * @param nodes The nodes to render.
     * @param includeData Whether to include the attributes.
     * @return The text.
     */
    public String dump(Collection<ComputationNode> nodes, boolean includeData) {
        StringBuilder text = new StringBuilder();
        for (ComputationNode node : nodes) {
            text.append(node.getName()).append(" = ").append(node.getOperation()).append(System.lineSeparator());
            List<String> inputs = new ArrayList<>();
            for (ComputationNode input : node.getInputs()) {
                inputs.add(input == null ? "<unconnected>" : input.getName());
            }
            text.append("    inputs: [").append(String.join(", ", inputs)).append(']').append(System.lineSeparator());
            text.append("    needsGradient: ").append(node.isNeedsGradient()).append(System.lineSeparator());
            Set<NodeRole> roles = node.getNetwork().getRoles(node);
            if (!roles.isEmpty()) {
                text.append("    roles: ").append(roles).append(System.lineSeparator());
            }
            if (includeData) {
                for (Map.Entry<String, String> attribute : node.getAttributes().entrySet()) {
                    text.append("    ").append(attribute.getKey()).append(": ").append(attribute.getValue())
                            .append(System.lineSeparator());
                }
            }
        }
        return text.toString();
    }

    /**
     * Renders a whole network with a header line.
     * @param network The network.
     * @param includeData Whether to include the attributes.
     * @return The text.
     */
    public String dump(ComputationNetwork network, boolean includeData) {
        return "# network " + network.getName() + " (" + network.size() + " nodes)" + System.lineSeparator()
                + dump(network.getNodes(), includeData);
    }

    /**
     * Writes text to a file.
     * @param text The rendered text.
     * @param file The target file; parent directories are created.
     * @throws ScriptStateException with {@code IO_ERROR} if the file cannot be written.
     */
    public void write(String text, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ScriptStateException(ScriptErrorCode.IO_ERROR, file.toString(),
                    "Failed to write dump file " + file + ": " + e.getMessage(), e);
        }
    }
}
