package org.ndlkit.mel;

import org.ndlkit.script.eval.ScriptEvaluator;
import org.ndlkit.script.model.EvaluationPass;
import org.ndlkit.script.model.NdlNode;

/**
 * Brings a binding's network up to date with its script: runs every pass up to a given one,
 * each resuming after the statement it last evaluated.
 */
public class NdlProcessor {

    private final ScriptEvaluator evaluator;

    public NdlProcessor(ScriptEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * @param binding The binding to process.
     * @param until The last pass to run.
     * @param fullValidation Whether to validate the network after the final pass.
     * @throws org.ndlkit.network.NetworkException if validation fails.
     */
    public void process(NetworkBinding binding, EvaluationPass until, boolean fullValidation) {
        if (binding.hasScript()) {
            for (EvaluationPass pass : EvaluationPass.values()) {
                if (pass.compareTo(until) > 0) {
                    break;
                }
                NdlNode last = evaluator.evaluate(binding.getScript(), binding.getBuilder(), "", pass,
                        binding.getLastNode(pass));
                binding.setLastNode(pass, last);
            }
        }
        if (fullValidation && until == EvaluationPass.FINAL) {
            binding.getNetwork().validate();
        }
    }
}
