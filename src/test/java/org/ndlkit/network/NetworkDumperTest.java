package org.ndlkit.network;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class NetworkDumperTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("unit")
    void testDumpListsNodesWithOptionalData() {
        ComputationNetwork network = new ComputationNetwork("net");
        ComputationNode w = network.createNode("w", "LearnableParameter");
        w.setAttribute("rows", "3");
        ComputationNode t = network.createNode("t", "Times");
        t.attachInputs(Arrays.asList(w, null));
        network.addToRole(NodeRole.OUTPUT, t);
        NetworkDumper dumper = new NetworkDumper();

        String withoutData = dumper.dump(network, false);
        String withData = dumper.dump(network, true);

        assertThat(withoutData).startsWith("# network net (2 nodes)")
                .contains("t = Times")
                .contains("inputs: [w, <unconnected>]")
                .contains("roles: [OUTPUT]")
                .doesNotContain("rows: 3");
        assertThat(withData).contains("rows: 3");
    }

    @Test
    @Tag("unit")
    void testWriteCreatesParentDirectories() throws IOException {
        Path file = tempDir.resolve("out/dump.txt");

        new NetworkDumper().write("text", file);

        assertThat(Files.readString(file)).isEqualTo("text");
        assertThat(List.of(file.getParent().toFile().list())).containsExactly("dump.txt");
    }
}
