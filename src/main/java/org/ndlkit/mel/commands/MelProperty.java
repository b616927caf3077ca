package org.ndlkit.mel.commands;

import org.ndlkit.network.NodeRole;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSymbolException;
import org.ndlkit.script.functions.NameMatcher;

import java.util.List;

/**
 * Node properties settable from MEL.
 */
public enum MelProperty {
    COMPUTE_GRADIENT("ComputeGradient", "NeedsGradient", null),
    FEATURE("Feature", null, NodeRole.FEATURE),
    LABEL("Label", null, NodeRole.LABEL),
    FINAL_CRITERION("FinalCriterion", "Criteria", NodeRole.FINAL_CRITERION),
    EVALUATION("Evaluation", "Eval", NodeRole.EVALUATION),
    OUTPUT("Output", null, NodeRole.OUTPUT);

    private final String displayName;
    private final String alias;
    private final NodeRole role;

    MelProperty(String displayName, String alias, NodeRole role) {
        this.displayName = displayName;
        this.alias = alias;
        this.role = role;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * @return The role set this property toggles, or {@code null} for the gradient flag.
     */
    public NodeRole role() {
        return role;
    }

    /**
     * @param name A property name or alias, case-insensitive, possibly abbreviated.
     * @return The property.
     * @throws ScriptSymbolException if no property has that name.
     */
    public static MelProperty fromName(String name) {
        return NameMatcher.find(name, List.of(values()), p -> p.displayName, p -> p.alias)
                .orElseThrow(() -> new ScriptSymbolException(ScriptErrorCode.UNKNOWN_PROPERTY, name,
                        "Invalid property '" + name + "' is not supported"));
    }
}
