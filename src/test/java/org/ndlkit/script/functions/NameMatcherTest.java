package org.ndlkit.script.functions;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the abbreviation rules of {@link NameMatcher}.
 */
public class NameMatcherTest {

    private record Entry(String name, String alias) {
    }

    private static final List<Entry> ENTRIES = List.of(
            new Entry("CreateModel", null),
            new Entry("CreateModelWithName", null),
            new Entry("DumpModel", "Dump"),
            new Entry("DumpNode", null));

    private static Optional<Entry> find(String token) {
        return NameMatcher.find(token, ENTRIES, Entry::name, Entry::alias);
    }

    @Test
    @Tag("unit")
    void testExactMatchIgnoresCase() {
        assertThat(NameMatcher.matches("dumpmodel", "DumpModel", "Dump")).isTrue();
        assertThat(NameMatcher.isExact("DUMP", "DumpModel", "Dump")).isTrue();
    }

    /**
     * Verifies that a prefix must be at least half as long as the canonical name.
     */
    @Test
    @Tag("unit")
    void testPrefixNeedsHalfTheNameLength() {
        assertThat(NameMatcher.matches("Du", "DumpModel", "Dump")).isFalse();
        assertThat(NameMatcher.matches("Dum", "DumpModel", "Dump")).isFalse();
        assertThat(NameMatcher.matches("DumpM", "DumpModel", "Dump")).isTrue();
        assertThat(NameMatcher.matches("Sigm", "Sigmoid", null)).isTrue();
        assertThat(NameMatcher.matches("Sig", "Sigmoid", null)).isTrue();
        assertThat(NameMatcher.matches("Si", "Sigmoid", null)).isFalse();
    }

    @Test
    @Tag("unit")
    void testNonPrefixDoesNotMatch() {
        assertThat(NameMatcher.matches("ModelDump", "DumpModel", "Dump")).isFalse();
        assertThat(NameMatcher.matches("DumpModels", "DumpModel", "Dump")).isFalse();
    }

    /**
     * Verifies that an exact match wins over an earlier abbreviation and that otherwise the first
     * entry in table order wins.
     */
    @Test
    @Tag("unit")
    void testFindPrefersExactThenTableOrder() {
        assertThat(find("CreateModelWithName")).map(Entry::name).contains("CreateModelWithName");
        assertThat(find("CreateModel")).map(Entry::name).contains("CreateModel");
        assertThat(find("CreateMod")).map(Entry::name).contains("CreateModel");
        assertThat(find("Dump")).map(Entry::name).contains("DumpModel");
        assertThat(find("DumpN")).map(Entry::name).contains("DumpNode");
        assertThat(find("Du")).isEmpty();
    }
}
