package org.ndlkit.script.model;

import org.ndlkit.config.ScriptSettings;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSymbolException;
import org.ndlkit.script.functions.FunctionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Holds the macro definitions and global constants shared by all scripts parsed against it,
 * together with the function table, the settings and the counter for generated node names.
 */
public final class GlobalScope {

    private static final Logger log = LoggerFactory.getLogger(GlobalScope.class);

    /** Prefix of generated node names. */
    public static final String GENERATED_NAME_PREFIX = "unnamed";

    private final ScriptSettings settings;
    private final FunctionRegistry functions;
    private final NdlScript script;
    private int nameCounter = 0;

    public GlobalScope() {
        this(ScriptSettings.defaults());
    }

    public GlobalScope(ScriptSettings settings) {
        this(settings, FunctionRegistry.standard());
    }

    public GlobalScope(ScriptSettings settings, FunctionRegistry functions) {
        this.settings = settings;
        this.functions = functions;
        this.script = new NdlScript(this);
    }

    /**
     * @return A fresh name for an unnamed node.
     */
    public String generateName() {
        return GENERATED_NAME_PREFIX + nameCounter++;
    }

    /**
     * Registers a macro.
     * @param name The macro name.
     * @param formalParameters The formal parameter names.
     * @param body The parsed body.
     * @return The MACRO node.
     * @throws ScriptSymbolException if the name is a known macro, global symbol or function.
     */
    public NdlNode defineMacro(String name, List<String> formalParameters, NdlScript body) {
        if (script.symbols().contains(name)) {
            throw new ScriptSymbolException(ScriptErrorCode.SYMBOL_REDEFINED, name,
                    "Macro '" + name + "' is already defined");
        }
        if (functions.findExact(name).isPresent()) {
            throw new ScriptSymbolException(ScriptErrorCode.RESERVED_NAME, name,
                    "Macro '" + name + "' has the name of a built-in function");
        }
        NdlNode macro = script.createNode(name, name, NodeKind.MACRO);
        macro.setFormalParameters(formalParameters);
        macro.setBody(body);
        script.symbols().add(name, macro);
        log.debug("Defined macro {}({})", name, String.join(", ", formalParameters));
        return macro;
    }

    /**
     * Registers a global constant visible from every script.
     * @param name The constant name.
     * @param value The literal text.
     * @return The CONSTANT node.
     * @throws ScriptSymbolException if the name is already defined.
     */
    public NdlNode defineConstant(String name, String value) {
        if (functions.findExact(name).isPresent()) {
            throw new ScriptSymbolException(ScriptErrorCode.RESERVED_NAME, name,
                    "'" + name + "' is the name of a built-in function");
        }
        NdlNode constant = script.createNode(name, value, NodeKind.CONSTANT);
        script.symbols().add(name, constant);
        return constant;
    }

    /**
     * @param name A symbol name.
     * @return The macro or constant of that name, or {@code null}.
     */
    public NdlNode lookup(String name) {
        return script.symbols().get(name);
    }

    public NdlScript script() {
        return script;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public ScriptSettings settings() {
        return settings;
    }

    /**
     * Forgets all macros and constants and restarts name generation.
     */
    public void clear() {
        script.clear();
        nameCounter = 0;
    }
}
