package org.ndlkit.mel;

import org.ndlkit.script.api.ScriptArityException;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSyntaxException;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The arguments of one MEL command: positional values in order and {@code name=value} options.
 */
public final class MelArguments {

    private static final Set<String> TRUE_VALUES = Set.of("true", "t", "yes", "y", "1", "on");
    private static final Set<String> FALSE_VALUES = Set.of("false", "f", "no", "n", "0", "off");

    private final String command;
    private final List<String> positional;
    private final Map<String, String> named = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public MelArguments(String command, List<String> positional, Map<String, String> named) {
        this.command = command;
        this.positional = List.copyOf(positional);
        this.named.putAll(named);
    }

    public String command() {
        return command;
    }

    public int size() {
        return positional.size();
    }

    public String get(int index) {
        return positional.get(index);
    }

    public List<String> positional() {
        return positional;
    }

    public Map<String, String> named() {
        return Collections.unmodifiableMap(named);
    }

    /**
     * Checks the number of positional arguments.
     * @param min The minimum count.
     * @param max The maximum count.
     * @param usage The command signature, shown in the error message.
     * @throws ScriptArityException if the count is outside the range.
     */
    public void requireCount(int min, int max, String usage) {
        if (positional.size() < min || positional.size() > max) {
            throw new ScriptArityException(command, min, positional.size(),
                    "Invalid number of parameters (" + positional.size() + ") for " + command + ". Valid parameters: " + usage);
        }
    }

    /**
     * Rejects options other than the given ones.
     * @param allowed The allowed option names.
     * @throws ScriptSyntaxException naming the first unknown option.
     */
    public void allowOptions(String... allowed) {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        names.addAll(List.of(allowed));
        for (String option : named.keySet()) {
            if (!names.contains(option)) {
                throw new ScriptSyntaxException(ScriptErrorCode.INVALID_VALUE, option,
                        "Unknown option '" + option + "' for " + command);
            }
        }
    }

    /**
     * Reads a value that may be given positionally or as an option.
     * @param index The positional index.
     * @param option The option name.
     * @param defaultValue The value when neither is present.
     * @return The value.
     */
    public String optional(int index, String option, String defaultValue) {
        if (index < positional.size()) {
            return positional.get(index);
        }
        String value = named.get(option);
        return value != null ? value : defaultValue;
    }

    /**
     * @param index A positional index.
     * @return The argument as an integer.
     * @throws ScriptSyntaxException if it is not an integer.
     */
    public int getInt(int index) {
        String text = positional.get(index);
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new ScriptSyntaxException(ScriptErrorCode.INVALID_VALUE, text,
                    "Expected an integer for parameter " + (index + 1) + " of " + command + " but got '" + text + "'");
        }
    }

    /**
     * @param index A positional index.
     * @return The argument as a boolean.
     * @throws ScriptSyntaxException if it is not a boolean.
     */
    public boolean getBoolean(int index) {
        return parseBoolean(positional.get(index));
    }

    /**
     * @param text A boolean literal such as {@code true}, {@code f} or {@code 1}.
     * @return The value.
     * @throws ScriptSyntaxException if the text is not a boolean.
     */
    public boolean parseBoolean(String text) {
        String normalized = text.toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return true;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return false;
        }
        throw new ScriptSyntaxException(ScriptErrorCode.INVALID_VALUE, text,
                "Expected a boolean for " + command + " but got '" + text + "'");
    }

    @Override
    public String toString() {
        return command + positional + (named.isEmpty() ? "" : named);
    }
}
