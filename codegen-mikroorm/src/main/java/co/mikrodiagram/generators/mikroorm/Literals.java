package co.mikrodiagram.generators.mikroorm;

import java.util.regex.Pattern;

/**
 * Classification and quoting of literal text destined for TypeScript source.
 */
final class Literals {

    // Same grammar JavaScript's Number() accepts after trimming whitespace.
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern RADIX = Pattern.compile("0[xX][0-9a-fA-F]+|0[oO][0-7]+|0[bB][01]+");
    private static final Pattern INFINITY = Pattern.compile("[+-]?Infinity");

    private Literals() {
    }

    /**
     * True when {@code value} is non-empty and JavaScript's {@code Number(value)} would not be
     * {@code NaN}. Blank-but-non-empty text counts as numeric, as it does in JavaScript.
     */
    static boolean isNumeric(String value) {
        if (value == null || value.isEmpty()) return false;
        String trimmed = value.strip();
        if (trimmed.isEmpty()) return true;
        return DECIMAL.matcher(trimmed).matches()
            || RADIX.matcher(trimmed).matches()
            || INFINITY.matcher(trimmed).matches();
    }

    /** Double-quote {@code value}, escaping backslashes and double quotes. */
    static String quote(String value) {
        String escaped = value.replace("\\", "\\\\").replace("\"", "\\\"");
        return "\"" + escaped + "\"";
    }

    /**
     * Render a property default. Numbers, {@code true}, {@code false} and expressions starting
     * with {@code new } or {@code () =>} pass through; anything else becomes a string literal.
     */
    static String defaultValue(String value) {
        if ("true".equals(value)
            || "false".equals(value)
            || isNumeric(value)
            || value.startsWith("new ")
            || value.startsWith("() =>")) {
            return value;
        }
        return quote(value);
    }
}
