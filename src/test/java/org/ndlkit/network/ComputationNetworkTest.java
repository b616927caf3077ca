package org.ndlkit.network;

import org.ndlkit.script.api.ScriptErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the graph operations of {@link ComputationNetwork}.
 */
public class ComputationNetworkTest {

    private ComputationNetwork network;
    private ComputationNode x;
    private ComputationNode w;
    private ComputationNode times;

    @BeforeEach
    void setUp() {
        network = new ComputationNetwork("net");
        x = network.createNode("x", "Input");
        w = network.createNode("w", "LearnableParameter");
        w.setAttribute("rows", "2");
        w.setNeedsGradient(true);
        times = network.createNode("t", "Times");
        times.attachInputs(List.of(w, x));
    }

    @Test
    @Tag("unit")
    void testDuplicateNameIsRejected() {
        assertThatThrownBy(() -> network.createNode("x", "Input"))
                .isInstanceOf(NetworkException.class)
                .satisfies(e -> assertThat(((NetworkException) e).getCode()).isEqualTo(ScriptErrorCode.NODE_ALREADY_EXISTS));
    }

    /**
     * Verifies that renaming keeps the node object, its consumers and its position.
     */
    @Test
    @Tag("unit")
    void testRenameKeepsIdentityAndOrder() {
        // Act
        network.renameNode("w", "weights");

        // Assert
        assertThat(network.getNode("weights")).isSameAs(w);
        assertThat(network.containsNode("w")).isFalse();
        assertThat(w.getName()).isEqualTo("weights");
        assertThat(times.getInput(0)).isSameAs(w);
        assertThat(network.getNodes()).extracting(ComputationNode::getName).containsExactly("x", "weights", "t");
    }

    @Test
    @Tag("unit")
    void testRenameOntoExistingNameFails() {
        assertThatThrownBy(() -> network.renameNode("w", "x")).isInstanceOf(NetworkException.class);
        assertThat(network.getNode("w")).isSameAs(w);
    }

    @Test
    @Tag("unit")
    void testDeleteDisconnectsConsumersAndRoles() {
        network.addToRole(NodeRole.FEATURE, x);

        network.deleteNode("x");

        assertThat(network.containsNode("x")).isFalse();
        assertThat(times.getInputs()).containsExactly(w, null);
        assertThat(times.hasMissingInputs()).isTrue();
        assertThat(network.getNodesInRole(NodeRole.FEATURE)).isEmpty();
    }

    @Test
    @Tag("unit")
    void testRequireUnknownNodeFails() {
        assertThatThrownBy(() -> network.requireNode("missing"))
                .isInstanceOf(NetworkException.class)
                .satisfies(e -> assertThat(((NetworkException) e).getToken()).isEqualTo("missing"));
    }

    /**
     * Verifies the three copy modes within one network.
     */
    @Test
    @Tag("unit")
    void testCopyNodeFlags() {
        // Act
        ComputationNode valueOnly = network.copyNode(times, "t2", CopyNodeFlags.VALUE);
        ComputationNode all = network.copyNode(w, "w2", CopyNodeFlags.ALL);
        ComputationNode childrenOnly = network.copyNode(times, "t3", CopyNodeFlags.CHILDREN);

        // Assert
        assertThat(valueOnly.getOperation()).isEqualTo("Times");
        assertThat(valueOnly.getInputs()).isEmpty();
        assertThat(all.getAttributes()).containsEntry("rows", "2");
        assertThat(all.isNeedsGradient()).isTrue();
        assertThat(childrenOnly.getInputs()).containsExactly(w, x);
    }

    @Test
    @Tag("unit")
    void testCopyOntoDifferentOperationFails() {
        assertThatThrownBy(() -> network.copyNode(times, "x", CopyNodeFlags.VALUE))
                .isInstanceOf(NetworkException.class)
                .hasMessageContaining("Times");
    }

    @Test
    @Tag("unit")
    void testCopyChildrenAcrossNetworksFails() {
        ComputationNetwork other = new ComputationNetwork("other");

        assertThatThrownBy(() -> other.copyNode(times, "t", CopyNodeFlags.ALL))
                .isInstanceOf(NetworkException.class)
                .satisfies(e -> assertThat(((NetworkException) e).getCode()).isEqualTo(ScriptErrorCode.NETWORK_MISMATCH));
        assertThat(other.size()).isZero();
    }

    /**
     * Verifies that a subtree copied into another network is wired to the copies, not the originals.
     */
    @Test
    @Tag("unit")
    void testCopySubTreeRemapsInputs() {
        // Arrange
        ComputationNetwork other = new ComputationNetwork("other");

        // Act
        List<ComputationNode> copies = other.copySubTree(times, "c.", CopyNodeFlags.ALL);

        // Assert
        assertThat(copies).extracting(ComputationNode::getName).containsExactly("c.w", "c.x", "c.t");
        ComputationNode copiedTimes = other.getNode("c.t");
        assertThat(copiedTimes.getInputs()).containsExactly(other.getNode("c.w"), other.getNode("c.x"));
        assertThat(other.getNode("c.w").isNeedsGradient()).isTrue();
        assertThat(times.getInputs()).containsExactly(w, x);
    }

    @Test
    @Tag("unit")
    void testCopySubTreeChecksNamesBeforeCopying() {
        network.createNode("c.t", "Times");

        assertThatThrownBy(() -> network.copySubTree(times, "c.", CopyNodeFlags.ALL)).isInstanceOf(NetworkException.class);
        assertThat(network.containsNode("c.w")).isFalse();
    }

    @Test
    @Tag("unit")
    void testCollectSubTreeVisitsInputsFirst() {
        assertThat(ComputationNetwork.collectSubTree(times)).containsExactly(w, x, times);
    }

    @Test
    @Tag("unit")
    void testValidateRejectsUnconnectedInput() {
        times.attachInputs(Arrays.asList(w, null));

        assertThatThrownBy(() -> network.validate())
                .isInstanceOf(NetworkException.class)
                .satisfies(e -> assertThat(((NetworkException) e).getCode()).isEqualTo(ScriptErrorCode.NETWORK_VALIDATION_FAILED));
    }

    /**
     * Verifies that a cycle is only accepted when it passes through a delay node.
     */
    @Test
    @Tag("unit")
    void testCyclesNeedDelayNode() {
        // Arrange
        ComputationNode plus = network.createNode("p", "Plus");
        ComputationNode delay = network.createNode("d", ComputationNetwork.DELAY_OPERATION);
        plus.attachInputs(List.of(times, delay));
        delay.attachInputs(List.of(plus));

        // Act & Assert
        network.validate();

        delay.attachInputs(List.of());
        ComputationNode sigmoid = network.createNode("s", "Sigmoid");
        sigmoid.attachInputs(List.of(plus));
        plus.attachInputs(List.of(times, sigmoid));
        assertThatThrownBy(() -> network.validate())
                .isInstanceOf(NetworkException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    @Tag("unit")
    void testRoles() {
        network.addToRole(NodeRole.OUTPUT, times);
        network.addToRole(NodeRole.EVALUATION, times);
        network.removeFromRole(NodeRole.EVALUATION, times);

        assertThat(network.getRoles(times)).containsExactly(NodeRole.OUTPUT);
        assertThat(network.getNodesInRole(NodeRole.OUTPUT)).containsExactly(times);
    }
}
