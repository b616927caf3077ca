package org.ndlkit.mel;

import org.ndlkit.network.ComputationNetwork;
import org.ndlkit.network.ComputationNode;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptStateException;
import org.ndlkit.script.api.ScriptSyntaxException;
import org.ndlkit.script.model.NdlNode;
import org.ndlkit.script.model.NdlScript;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves MEL node symbols. A symbol is {@code model.node} when {@code model} is a registered
 * model and {@code node} otherwise, which then refers to the default model. The node part may
 * contain one {@code *} wildcard.
 */
public class NodeLookup {

    /** The wildcard character in node patterns. */
    public static final char WILDCARD = '*';

    private final ModelRegistry models;

    /**
     * A parsed symbol: the model it refers to and the node name or pattern within it.
     */
    public record Target(NetworkBinding binding, String nodeName) {
        public boolean isPattern() {
            return nodeName.indexOf(WILDCARD) >= 0;
        }
    }

    /**
     * A node found for a symbol.
     *
     * @param binding The model containing the node.
     * @param node The node.
     * @param wildcardPart The text the wildcard matched, or {@code null} for plain names.
     */
    public record NodeMatch(NetworkBinding binding, ComputationNode node, String wildcardPart) {
    }

    /**
     * A source node paired with the name generated for it from a target pattern.
     */
    public record NameMapping(NodeMatch source, NetworkBinding targetBinding, String targetName) {
    }

    public NodeLookup(ModelRegistry models) {
        this.models = models;
    }

    /**
     * Splits a symbol into model and node part.
     * @param symbol The symbol as written.
     * @return The target.
     * @throws ScriptStateException if the symbol names no model and there is no default model.
     */
    public Target parse(String symbol) {
        int dot = symbol.indexOf('.');
        if (dot > 0) {
            NetworkBinding binding = models.find(symbol.substring(0, dot));
            if (binding != null) {
                return new Target(binding, symbol.substring(dot + 1));
            }
        }
        return new Target(models.requireDefault(), symbol);
    }

    /**
     * Finds all nodes a symbol denotes. The network is consulted first, then the NDL symbols of
     * the model's script.
     *
     * @param symbol The symbol, possibly with a wildcard.
     * @return The matches, never empty.
     * @throws ScriptStateException if nothing matches.
     */
    public List<NodeMatch> find(String symbol) {
        Target target = parse(symbol);
        List<NodeMatch> matches = new ArrayList<>();
        ComputationNetwork network = target.binding().getNetwork();
        if (target.isPattern()) {
            String pattern = target.nodeName();
            int star = pattern.indexOf(WILDCARD);
            if (pattern.indexOf(WILDCARD, star + 1) >= 0) {
                throw new ScriptSyntaxException(ScriptErrorCode.INVALID_VALUE, symbol,
                        "Only one '" + WILDCARD + "' is allowed in '" + symbol + "'");
            }
            String prefix = pattern.substring(0, star);
            String suffix = pattern.substring(star + 1);
            for (ComputationNode node : network.getNodes()) {
                String name = node.getName();
                if (name.length() >= prefix.length() + suffix.length() && name.startsWith(prefix) && name.endsWith(suffix)) {
                    matches.add(new NodeMatch(target.binding(), node, name.substring(prefix.length(), name.length() - suffix.length())));
                }
            }
        } else {
            ComputationNode node = network.getNode(target.nodeName());
            if (node == null) {
                node = findThroughScript(target.binding(), target.nodeName());
            }
            if (node != null) {
                matches.add(new NodeMatch(target.binding(), node, null));
            }
        }
        if (matches.isEmpty()) {
            throw new ScriptStateException(ScriptErrorCode.NODE_NOT_FOUND, symbol, "Symbol '" + symbol + "' not found");
        }
        return matches;
    }

    /**
     * Finds the single node a symbol denotes.
     * @param symbol The symbol.
     * @return The match.
     * @throws ScriptStateException if the symbol matches no node or several.
     */
    public NodeMatch findSingle(String symbol) {
        List<NodeMatch> matches = find(symbol);
        if (matches.size() != 1) {
            throw new ScriptStateException(ScriptErrorCode.AMBIGUOUS_NODE_PATTERN, symbol,
                    "Symbol '" + symbol + "' must denote a single node but matches " + matches.size());
        }
        return matches.get(0);
    }

    /**
     * Pairs the nodes of a source symbol with the names generated from a target pattern.
     * @param fromSymbol The source symbol, possibly with a wildcard.
     * @param toSymbol The target symbol; must contain a wildcard when the source does.
     * @return One mapping per source node.
     */
    public List<NameMapping> generateNames(String fromSymbol, String toSymbol) {
        List<NodeMatch> sources = find(fromSymbol);
        Target target = parse(toSymbol);
        if (parse(fromSymbol).isPattern() && !target.isPattern()) {
            throw new ScriptSyntaxException(ScriptErrorCode.INVALID_VALUE, toSymbol,
                    "Target '" + toSymbol + "' must contain '" + WILDCARD + "' when the source '" + fromSymbol + "' does");
        }
        List<NameMapping> mappings = new ArrayList<>();
        for (NodeMatch source : sources) {
            mappings.add(new NameMapping(source, target.binding(), generateName(target.nodeName(), source.wildcardPart())));
        }
        return mappings;
    }

    /**
     * @param pattern A target name, possibly with a wildcard.
     * @param wildcardPart The text matched by the source wildcard, or {@code null}.
     * @return The pattern with its wildcard replaced.
     */
    public static String generateName(String pattern, String wildcardPart) {
        int star = pattern.indexOf(WILDCARD);
        if (star < 0 || wildcardPart == null) {
            return pattern;
        }
        return pattern.substring(0, star) + wildcardPart + pattern.substring(star + 1);
    }

    private static ComputationNode findThroughScript(NetworkBinding binding, String name) {
        if (!binding.hasScript() || name.indexOf('.') >= 0) {
            return null;
        }
        NdlNode symbol = binding.getScript().findSymbol(name, false);
        if (symbol == null) {
            return null;
        }
        return binding.getBuilder().handles().get(NdlScript.resolveReference(symbol));
    }
}
