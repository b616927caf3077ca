package org.ndlkit.network;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptStateException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for saving and loading networks with the {@link NetworkSerializer}.
 */
public class NetworkSerializerTest {

    @TempDir
    Path tempDir;

    private final NetworkSerializer serializer = new NetworkSerializer();

    /**
     * Verifies that a saved network loads with the same nodes, connections, attributes and roles.
     */
    @Test
    @Tag("unit")
    void testSaveAndLoadPreservesGraph() {
        // Arrange
        ComputationNetwork network = new ComputationNetwork("net");
        ComputationNode x = network.createNode("x", "Input");
        ComputationNode w = network.createNode("w", "LearnableParameter");
        w.setAttribute("rows", "3");
        w.setNeedsGradient(true);
        ComputationNode t = network.createNode("t", "Times");
        t.attachInputs(List.of(w, x));
        network.addToRole(NodeRole.FEATURE, x);
        network.addToRole(NodeRole.OUTPUT, t);
        Path file = tempDir.resolve("models/net.json");

        // Act
        serializer.save(network, file);
        ComputationNetwork loaded = serializer.load(file, "copy");

        // Assert
        assertThat(loaded.getName()).isEqualTo("copy");
        assertThat(loaded.getNodes()).extracting(ComputationNode::getName).containsExactly("x", "w", "t");
        assertThat(loaded.getNode("t").getInputs()).containsExactly(loaded.getNode("w"), loaded.getNode("x"));
        assertThat(loaded.getNode("w").getAttribute("rows")).isEqualTo("3");
        assertThat(loaded.getNode("w").isNeedsGradient()).isTrue();
        assertThat(loaded.getNodesInRole(NodeRole.FEATURE)).containsExactly(loaded.getNode("x"));
        assertThat(loaded.getNodesInRole(NodeRole.OUTPUT)).containsExactly(loaded.getNode("t"));
    }

    @Test
    @Tag("unit")
    void testMissingFileIsIoError() {
        assertThatThrownBy(() -> serializer.load(tempDir.resolve("absent.json"), "m"))
                .isInstanceOf(ScriptStateException.class)
                .satisfies(e -> assertThat(((ScriptStateException) e).getCode()).isEqualTo(ScriptErrorCode.IO_ERROR));
    }

    @Test
    @Tag("unit")
    void testDanglingInputIsMalformed() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{\"name\":\"m\",\"nodes\":[{\"name\":\"a\",\"operation\":\"Tanh\",\"inputs\":[\"ghost\"]}]}");

        assertThatThrownBy(() -> serializer.load(file, "m"))
                .isInstanceOf(ScriptStateException.class)
                .hasMessageContaining("ghost")
                .satisfies(e -> assertThat(((ScriptStateException) e).getCode()).isEqualTo(ScriptErrorCode.MODEL_LOAD_FAILED));
    }

    @Test
    @Tag("unit")
    void testInvalidJsonIsMalformed() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertThatThrownBy(() -> serializer.load(file, "m"))
                .isInstanceOf(ScriptStateException.class)
                .satisfies(e -> assertThat(((ScriptStateException) e).getCode()).isEqualTo(ScriptErrorCode.MODEL_LOAD_FAILED));
    }

    /**
     * Verifies that null entries in the node list or the role map abort loading as a malformed model.
     */
    @Test
    @Tag("unit")
    void testNullEntriesAreMalformed() throws IOException {
        // Arrange
        Path nullNode = tempDir.resolve("null-node.json");
        Files.writeString(nullNode, "{\"nodes\":[null]}");
        Path nullRole = tempDir.resolve("null-role.json");
        Files.writeString(nullRole, "{\"nodes\":[],\"roles\":{\"FEATURE\":null}}");
        Path nullMember = tempDir.resolve("null-member.json");
        Files.writeString(nullMember, "{\"nodes\":[],\"roles\":{\"FEATURE\":[null]}}");

        // Act & Assert
        for (Path file : List.of(nullNode, nullRole, nullMember)) {
            assertThatThrownBy(() -> serializer.load(file, "m"))
                    .isInstanceOf(ScriptStateException.class)
                    .satisfies(e -> assertThat(((ScriptStateException) e).getCode()).isEqualTo(ScriptErrorCode.MODEL_LOAD_FAILED));
        }
    }
}
