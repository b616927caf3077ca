package org.ndlkit.mel.commands;

import org.ndlkit.mel.MelArguments;
import org.ndlkit.mel.NetworkBinding;
import org.ndlkit.network.CopyNodeFlags;
import org.ndlkit.script.api.ReferenceScopeException;
import org.ndlkit.script.api.ScriptErrorCode;
import org.ndlkit.script.api.ScriptSyntaxException;

import java.util.Locale;
import java.util.Set;

/**
 * Option parsing and checks shared by several commands.
 */
final class CommandOptions {

    static final String FORMAT_OPTION = "format";
    static final String COPY_OPTION = "copy";
    static final String INCLUDE_DATA_OPTION = "includeData";
    static final String SECTION_OPTION = "section";

    /** Model file formats; both names denote the JSON model format. */
    static final Set<String> MODEL_FORMATS = Set.of("cntk", "json");

    private CommandOptions() {
    }

    /**
     * Validates the optional model format at {@code index}.
     */
    static String format(MelArguments arguments, int index) {
        arguments.allowOptions(FORMAT_OPTION);
        String format = arguments.optional(index, FORMAT_OPTION, "cntk");
        if (!MODEL_FORMATS.contains(format.toLowerCase(Locale.ROOT))) {
            throw new ScriptSyntaxException(ScriptErrorCode.INVALID_VALUE, format,
                    "Invalid model format '" + format + "' for " + arguments.command() + "; expected one of " + MODEL_FORMATS);
        }
        return format;
    }

    static CopyNodeFlags copyFlags(MelArguments arguments, int index) {
        arguments.allowOptions(COPY_OPTION);
        String copy = arguments.optional(index, COPY_OPTION, "all");
        return switch (copy.toLowerCase(Locale.ROOT)) {
            case "all" -> CopyNodeFlags.ALL;
            case "value" -> CopyNodeFlags.VALUE;
            default -> throw new ScriptSyntaxException(ScriptErrorCode.INVALID_VALUE, copy,
                    "Invalid copy option '" + copy + "' for " + arguments.command() + "; expected all or value");
        };
    }

    static boolean includeData(MelArguments arguments, int index) {
        arguments.allowOptions(INCLUDE_DATA_OPTION);
        return arguments.parseBoolean(arguments.optional(index, INCLUDE_DATA_OPTION, "false"));
    }

    /**
     * @throws ReferenceScopeException if the two symbols belong to different models.
     */
    static void requireSameModel(MelArguments arguments, NetworkBinding first, String firstSymbol,
                                 NetworkBinding second, String secondSymbol) {
        if (first != second) {
            throw new ReferenceScopeException(secondSymbol, arguments.command() + " requires symbols from the same network; '"
                    + firstSymbol + "' and '" + secondSymbol + "' belong to different networks");
        }
    }
}
