package org.ndlkit.script.eval;

import org.ndlkit.config.ScriptSettings;
import org.ndlkit.script.model.EvaluationPass;
import org.ndlkit.script.model.NdlNode;
import org.ndlkit.script.model.NdlScript;
import org.ndlkit.script.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives the evaluation of a script's statements, in order, for one pass. Macro calls are
 * expanded through the {@link MacroExpander}; every other statement goes to the host's
 * {@link NodeEvaluator}. Running the passes in order is up to the caller.
 */
public class ScriptEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ScriptEvaluator.class);

    private final MacroExpander macroExpander;

    public ScriptEvaluator() {
        this(ScriptSettings.defaults());
    }

    public ScriptEvaluator(ScriptSettings settings) {
        this.macroExpander = new MacroExpander(this, settings.maxMacroCallDepth());
    }

    /**
     * Evaluates the statements of a script for one pass.
     *
     * @param script The script.
     * @param evaluator The host evaluator.
     * @param baseName The dotted scope prefix for the duration of the call.
     * @param pass The pass.
     * @param skipThrough Statements up to and including this node are skipped; {@code null} evaluates all.
     * @param <H> The host handle type.
     * @return The last node evaluated, or {@code skipThrough} if nothing was evaluated.
     */
    public <H> NdlNode evaluate(NdlScript script, NodeEvaluator<H> evaluator, String baseName,
                                EvaluationPass pass, NdlNode skipThrough) {
        String savedBaseName = script.baseName();
        script.setBaseName(baseName);
        try {
            boolean skipping = skipThrough != null;
            NdlNode last = skipThrough;
            List<NdlNode> statements = new ArrayList<>(script.statements());
            for (NdlNode node : statements) {
                if (skipping) {
                    skipping = node != skipThrough;
                    continue;
                }
                if (node.kind() == NodeKind.MACRO_CALL) {
                    macroExpander.expand(node, script, evaluator, baseName, pass);
                    evaluator.processOptionalParameters(node);
                } else {
                    evaluator.evaluate(node, baseName, pass);
                }
                last = node;
            }
            log.trace("Evaluated {} in pass {} up to {}", script, pass, last);
            return last;
        } finally {
            script.setBaseName(savedBaseName);
        }
    }

    public MacroExpander macroExpander() {
        return macroExpander;
    }
}
