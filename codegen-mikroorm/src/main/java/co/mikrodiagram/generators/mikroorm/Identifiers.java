package co.mikrodiagram.generators.mikroorm;

import java.util.regex.Pattern;

/**
 * Identifier and indentation helpers shared by all generators.
 */
public final class Identifiers {

    private static final Pattern INVALID_CHARS = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern UNDERSCORE_RUNS = Pattern.compile("_+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    private Identifiers() {
    }

    /**
     * Turn arbitrary user text into a valid TypeScript class identifier.
     *
     * <ol>
     *   <li>every character outside {@code [A-Za-z0-9_]} becomes {@code _}</li>
     *   <li>runs of {@code _} collapse to one</li>
     *   <li>leading and trailing {@code _} are stripped</li>
     *   <li>{@code _} is prepended when the result is empty or starts with a digit</li>
     * </ol>
     *
     * <p>Total and idempotent: {@code sanitize(sanitize(s)).equals(sanitize(s))}.
     * A {@code null} name sanitizes to {@code "_"}.
     */
    public static String sanitize(String name) {
        String sanitized = name == null ? "" : INVALID_CHARS.matcher(name).replaceAll("_");
        sanitized = UNDERSCORE_RUNS.matcher(sanitized).replaceAll("_");
        sanitized = EDGE_UNDERSCORES.matcher(sanitized).replaceAll("");
        if (sanitized.isEmpty() || Character.isDigit(sanitized.charAt(0))) {
            sanitized = "_" + sanitized;
        }
        return sanitized;
    }

    /** {@code level * size} spaces. */
    public static String indent(int level, int size) {
        return " ".repeat(level * size);
    }
}
