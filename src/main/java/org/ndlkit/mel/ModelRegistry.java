package org.ndlkit.mel;

import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * The models known to the editor, by case-insensitive name, plus the current default model.
 */
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, NetworkBinding> models = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private NetworkBinding defaultBinding;

    /**
     * Registers a binding under its model name, releasing a binding previously registered there.
     * @param binding The binding.
     */
    public void register(NetworkBinding binding) {
        NetworkBinding previous = models.put(binding.getModelName(), binding);
        if (previous != null && previous != binding) {
            log.info("Replacing model '{}'", binding.getModelName());
            if (defaultBinding == previous) {
                defaultBinding = binding;
            }
            previous.release();
        }
    }

    /**
     * @param name A model name.
     * @return The binding, or {@code null}.
     */
    public NetworkBinding find(String name) {
        return models.get(name);
    }

    /**
     * @param name A model name.
     * @return The binding.
     * @throws ScriptStateException if no model has that name.
     */
    public NetworkBinding require(String name) {
        NetworkBinding binding = models.get(name);
        if (binding == null) {
            throw new ScriptStateException(ScriptErrorCode.MODEL_NOT_FOUND, name, "Model '" + name + "' does not exist");
        }
        return binding;
    }

    public boolean contains(String name) {
        return models.containsKey(name);
    }

    /**
     * Makes a registered model the default.
     * @param name The model name.
     * @throws ScriptStateException if no model has that name.
     */
    public void setDefault(String name) {
        defaultBinding = require(name);
        log.debug("Default model is now '{}'", defaultBinding.getModelName());
    }

    /**
     * @return The default binding, or {@code null}.
     */
    public NetworkBinding getDefault() {
        return defaultBinding;
    }

    /**
     * @return The default binding.
     * @throws ScriptStateException if there is no default model.
     */
    public NetworkBinding requireDefault() {
        if (defaultBinding == null) {
            throw new ScriptStateException(ScriptErrorCode.NO_DEFAULT_MODEL, null,
                    "No default model; create or load a model first");
        }
        return defaultBinding;
    }

    /**
     * Unregisters and releases a model. Unloading the default model clears the default.
     * @param name The model name.
     * @return {@code false} if no model had that name.
     */
    public boolean unload(String name) {
        NetworkBinding binding = models.remove(name);
        if (binding == null) {
            return false;
        }
        if (binding == defaultBinding) {
            defaultBinding = null;
        }
        binding.release();
        log.info("Unloaded model '{}'", binding.getModelName());
        return true;
    }
}
