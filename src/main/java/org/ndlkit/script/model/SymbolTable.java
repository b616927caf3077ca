package org.ndlkit.script.model;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSymbolException;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A case-insensitive map from symbol names to nodes.
 */
public class SymbolTable {

    private final Map<String, NdlNode> symbols = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    /**
     * Defines a new symbol.
     * @param name The symbol name.
     * @param node The node it denotes.
     * @throws ScriptSymbolException if the name is already bound to anything but an undetermined placeholder.
     */
    public void add(String name, NdlNode node) {
        NdlNode existing = symbols.get(name);
        if (existing != null && existing != node && existing.kind() != NodeKind.UNDETERMINED) {
            throw new ScriptSymbolException(ScriptErrorCode.SYMBOL_REDEFINED, name,
                    "Symbol '" + name + "' is already defined");
        }
        symbols.put(name, node);
    }

    /**
     * Rebinds an existing symbol.
     * @param name The symbol name.
     * @param node The new node.
     * @throws ScriptSymbolException if the symbol does not exist.
     */
    public void assign(String name, NdlNode node) {
        if (!symbols.containsKey(name)) {
            throw new ScriptSymbolException(ScriptErrorCode.UNDEFINED_SYMBOL, name,
                    "Cannot assign to undefined symbol '" + name + "'");
        }
        symbols.put(name, node);
    }

    /**
     * @param name The symbol name.
     * @return The bound node, or {@code null}.
     */
    public NdlNode get(String name) {
        return symbols.get(name);
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    public NdlNode remove(String name) {
        return symbols.remove(name);
    }

    public Collection<NdlNode> nodes() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    public int size() {
        return symbols.size();
    }

    public void clear() {
        symbols.clear();
    }
}
