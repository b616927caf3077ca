package org.ndlkit.config;

import com.typesafe.config.Config;

/**
 * Tunables of the script layer, read from the {@code ndlkit} block of the configuration.
 *
 * @param statementSeparator The character separating statements on one line.
 * @param maxMacroCallDepth The deepest allowed nesting of macro calls.
 * @param defaultModelName The model name used by {@code CreateModel} and {@code LoadModel}.
 */
public record ScriptSettings(char statementSeparator, int maxMacroCallDepth, String defaultModelName) {

    public static final char DEFAULT_SEPARATOR = ';';
    public static final int DEFAULT_MAX_MACRO_CALL_DEPTH = 64;
    public static final String DEFAULT_MODEL_NAME = "default";

    private static final String RESERVED_CHARACTERS = "()[]{},:=\"'#.*$_+-";

    public ScriptSettings {
        if (Character.isLetterOrDigit(statementSeparator) || Character.isWhitespace(statementSeparator)
                || RESERVED_CHARACTERS.indexOf(statementSeparator) >= 0) {
            throw new IllegalArgumentException("Invalid statement separator: '" + statementSeparator + "'");
        }
        if (maxMacroCallDepth < 1) {
            throw new IllegalArgumentException("max-call-depth must be positive, got " + maxMacroCallDepth);
        }
        if (defaultModelName == null || defaultModelName.isBlank()) {
            throw new IllegalArgumentException("default-model-name must not be blank");
        }
    }

    /**
     * @return The settings used when no configuration is supplied.
     */
    public static ScriptSettings defaults() {
        return new ScriptSettings(DEFAULT_SEPARATOR, DEFAULT_MAX_MACRO_CALL_DEPTH, DEFAULT_MODEL_NAME);
    }

    /**
     * Reads the settings from a configuration, falling back to the defaults for missing keys.
     * @param config The application configuration (the root, not the {@code ndlkit} block).
     * @return The settings.
     * @throws IllegalArgumentException if a value is invalid.
     */
    public static ScriptSettings fromConfig(final Config config) {
        final String separatorPath = "ndlkit.script.statement-separator";
        final String depthPath = "ndlkit.macro.max-call-depth";
        final String modelPath = "ndlkit.mel.default-model-name";

        char separator = DEFAULT_SEPARATOR;
        if (config.hasPath(separatorPath)) {
            String raw = config.getString(separatorPath);
            if (raw.length() != 1) {
                throw new IllegalArgumentException("statement-separator must be a single character, got '" + raw + "'");
            }
            separator = raw.charAt(0);
        }
        int depth = config.hasPath(depthPath) ? config.getInt(depthPath) : DEFAULT_MAX_MACRO_CALL_DEPTH;
        String model = config.hasPath(modelPath) ? config.getString(modelPath) : DEFAULT_MODEL_NAME;
        return new ScriptSettings(separator, depth, model);
    }
}
