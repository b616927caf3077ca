package org.ndlkit.script.functions;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Case-insensitive abbreviation matching shared by the function table and the MEL command
 * vocabulary.
 * <p>
 * A token matches an entry when it equals the entry's name or alias ignoring case, or when it is a
 * case-insensitive prefix of the name or alias that is at least half as long as the name.
 * An exact match always wins; otherwise the first matching entry in table order is chosen.
 */
public final class NameMatcher {

    private NameMatcher() {
        // Utility class
    }

    /**
     * Checks whether a token abbreviates a name or its alias.
     * @param token The token as written.
     * @param name The canonical name.
     * @param alias The alternate name, or {@code null}.
     * @return {@code true} if the token matches.
     */
    public static boolean matches(String token, String name, String alias) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        if (isExact(token, name, alias)) {
            return true;
        }
        int minimum = name.length() / 2;
        if (token.length() < minimum) {
            return false;
        }
        return isPrefix(token, name) || (alias != null && isPrefix(token, alias));
    }

    /**
     * Checks whether a token equals a name or its alias, ignoring case.
     * @param token The token as written.
     * @param name The canonical name.
     * @param alias The alternate name, or {@code null}.
     * @return {@code true} on an exact match.
     */
    public static boolean isExact(String token, String name, String alias) {
        return token.equalsIgnoreCase(name) || (alias != null && token.equalsIgnoreCase(alias));
    }

    /**
     * Finds the entry a token refers to.
     * @param token The token as written.
     * @param entries The candidate entries in table order.
     * @param name Extracts the canonical name of an entry.
     * @param alias Extracts the alias of an entry (may return {@code null}).
     * @param <T> The entry type.
     * @return The matched entry, or empty if none matches.
     */
    public static <T> Optional<T> find(String token, List<T> entries, Function<T, String> name, Function<T, String> alias) {
        if (token == null) {
            return Optional.empty();
        }
        for (T entry : entries) {
            if (isExact(token, name.apply(entry), alias.apply(entry))) {
                return Optional.of(entry);
            }
        }
        for (T entry : entries) {
            if (matches(token, name.apply(entry), alias.apply(entry))) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    private static boolean isPrefix(String token, String candidate) {
        return token.length() <= candidate.length() && candidate.regionMatches(true, 0, token, 0, token.length());
    }
}
