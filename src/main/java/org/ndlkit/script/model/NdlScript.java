package org.ndlkit.script.model;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSymbolException;
import org.ndlkit.script.functions.FunctionDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A parsed NDL script: ordered statements, the arena of nodes it created and its symbol table.
 * <p>
 * Macro bodies are scripts as well; their {@link #macroName()} names the macro they implement.
 */
public final class NdlScript {

    private final GlobalScope global;
    private final String macroName;
    private final List<NdlNode> statements = new ArrayList<>();
    private final List<NdlNode> ownedNodes = new ArrayList<>();
    private final SymbolTable symbols = new SymbolTable();
    private boolean noDefinitions;
    private String baseName = "";

    /**
     * Creates a top-level script.
     * @param global The global scope holding macros and constants.
     */
    public NdlScript(GlobalScope global) {
        this(global, null);
    }

    /**
     * Creates a script, optionally as the body of a macro.
     * @param global The global scope holding macros and constants.
     * @param macroName The macro this script implements, or {@code null}.
     */
    public NdlScript(GlobalScope global, String macroName) {
        this.global = global;
        this.macroName = macroName;
    }

    /**
     * Creates a node owned by this script.
     * @param name The node name, or {@code null} to generate one.
     * @param value The raw value.
     * @param kind The node kind.
     * @return The new node.
     */
    public NdlNode createNode(String name, String value, NodeKind kind) {
        String nodeName = name != null ? name : global.generateName();
        NdlNode node = new NdlNode(nodeName, value, kind, this);
        ownedNodes.add(node);
        return node;
    }

    public void addStatement(NdlNode node) {
        statements.add(node);
    }

    public List<NdlNode> statements() {
        return Collections.unmodifiableList(statements);
    }

    /**
     * @return Every node this script created, in creation order.
     */
    public List<NdlNode> ownedNodes() {
        return Collections.unmodifiableList(ownedNodes);
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public GlobalScope global() {
        return global;
    }

    public String macroName() {
        return macroName;
    }

    /**
     * @return {@code true} if macro definitions are not allowed and every {@code name(...)} is a call.
     */
    public boolean isNoDefinitions() {
        return noDefinitions;
    }

    public void setNoDefinitions(boolean noDefinitions) {
        this.noDefinitions = noDefinitions;
    }

    /**
     * @return The dotted scope prefix applied while this script is being evaluated.
     */
    public String baseName() {
        return baseName;
    }

    public void setBaseName(String baseName) {
        this.baseName = baseName == null ? "" : baseName;
    }

    /**
     * Looks up a symbol, following dotted names into the bodies of macro calls.
     * @param name The symbol name, possibly dotted.
     * @param searchGlobal Whether to fall back to the global scope.
     * @return The node, or {@code null} if the name is unknown.
     * @throws ScriptSymbolException if a dotted name traverses something other than a macro call.
     */
    public NdlNode findSymbol(String name, boolean searchGlobal) {
        NdlNode direct = symbols.get(name);
        if (direct != null) {
            return direct;
        }
        int dot = name.indexOf('.');
        if (dot > 0 && dot < name.length() - 1) {
            NdlNode scope = findSymbol(name.substring(0, dot), searchGlobal);
            if (scope != null) {
                if (scope.kind() != NodeKind.MACRO_CALL || scope.body() == null) {
                    throw new ScriptSymbolException(ScriptErrorCode.INVALID_DOT_NAME, name,
                            "'" + scope.name() + "' in '" + name + "' is not a macro call");
                }
                return scope.body().findSymbol(name.substring(dot + 1), false);
            }
        }
        if (searchGlobal && global != null && global.script() != this) {
            return global.script().findSymbol(name, false);
        }
        return null;
    }

    /**
     * Resolves a name the way the parser does: local scope, then the global scope, then the
     * function table. A macro found in the global scope is returned wrapped in a fresh
     * MACRO_CALL node, a function in a fresh FUNCTION node.
     *
     * @param name The name as written.
     * @param nodeName The name for a fresh call node, or {@code null} to generate one.
     * @return The existing or fresh node, or {@code null} if the name is unknown.
     */
    public NdlNode checkName(String name, String nodeName) {
        NdlNode local = findSymbol(name, false);
        if (local != null) {
            return local;
        }
        NdlNode globalNode = global.lookup(name);
        if (globalNode != null) {
            if (globalNode.kind() == NodeKind.MACRO) {
                NdlNode call = createNode(nodeName, globalNode.name(), NodeKind.MACRO_CALL);
                call.setFormalParameters(globalNode.formalParameters());
                call.setBody(globalNode.body());
                return call;
            }
            return globalNode;
        }
        Optional<FunctionDefinition> function = global.functions().find(name);
        if (function.isPresent()) {
            NdlNode call = createNode(nodeName, function.get().name(), NodeKind.FUNCTION);
            call.setFunction(function.get());
            return call;
        }
        return null;
    }

    /**
     * Follows a chain of references (variables, bound parameters, forward references and optional
     * parameter values) to the node that carries the value.
     * <p>
     * The chain stops at constants, calls, arrays, dotted references and at references that are
     * not (yet) bound to anything else.
     *
     * @param node The node to resolve.
     * @return The end of the reference chain.
     * @throws ScriptSymbolException if the references form a cycle.
     */
    public static NdlNode resolveReference(NdlNode node) {
        Map<NdlNode, Boolean> visited = new IdentityHashMap<>();
        NdlNode current = node;
        visited.put(current, Boolean.TRUE);
        while (true) {
            NdlNode next;
            switch (current.kind()) {
                case VARIABLE:
                case PARAMETER:
                case UNDETERMINED:
                    next = current.parentScript().findSymbol(current.value(), true);
                    break;
                case OPTIONAL_PARAMETER:
                    next = current.optionalValue();
                    break;
                case CONSTANT:
                case FUNCTION:
                case MACRO:
                case MACRO_CALL:
                case ARRAY:
                case DOT_PARAMETER:
                default:
                    return current;
            }
            if (next == null || next == current) {
                return current;
            }
            if (visited.put(next, Boolean.TRUE) != null) {
                throw new ScriptSymbolException(ScriptErrorCode.CIRCULAR_REFERENCE, node.name(),
                        "Circular reference while resolving '" + node.name() + "'");
            }
            current = next;
        }
    }

    /**
     * Removes all statements, nodes and symbols.
     */
    public void clear() {
        statements.clear();
        ownedNodes.clear();
        symbols.clear();
    }

    @Override
    public String toString() {
        return macroName != null ? "macro " + macroName : "script(" + statements.size() + " statements)";
    }
}
