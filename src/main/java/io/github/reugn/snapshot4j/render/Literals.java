package io.github.reugn.snapshot4j.render;

import java.util.Locale;

/**
 * Canonical Java literal text for scalar values.
 *
 * <p>Every method is a pure function of its argument, so two renders of equal values always
 * produce the same characters. Output is plain ASCII: characters outside the printable ASCII
 * range are written as {@code \}{@code uXXXX} escapes.
 *
 * <p><b>Examples:</b>
 * <ul>
 *   <li>{@code stringLiteral("a\"b")} → {@code "a\"b"}</li>
 *   <li>{@code charLiteral('\n')} → {@code '\n'}</li>
 *   <li>{@code doubleLiteral(100)} → {@code 100.0}</li>
 *   <li>{@code doubleLiteral(0.00001)} → {@code 1.0E-5}</li>
 *   <li>{@code floatLiteral(1.5f)} → {@code 1.5F}</li>
 *   <li>{@code byteLiteral((byte) -1)} → {@code (byte) 0xFF}</li>
 * </ul>
 */
public final class Literals {

    private Literals() {
    }

    // ==================== TEXT ====================

    /**
     * Quotes and escapes a string as a Java string literal.
     *
     * @param s the string
     * @return the literal, including the surrounding double quotes
     */
    public static String stringLiteral(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            sb.append(c == '\'' ? "'" : escapeChar(c));
        }
        return sb.append('"').toString();
    }

    /**
     * Quotes and escapes a character as a Java char literal.
     *
     * @param c the character
     * @return the literal, including the surrounding single quotes
     */
    public static String charLiteral(char c) {
        return "'" + (c == '"' ? "\"" : escapeChar(c)) + "'";
    }

    /**
     * Escapes a single character for use inside a Java literal.
     *
     * <p>Line terminators use their short escapes; a {@code \}{@code u000A} escape would be
     * translated before the literal is lexed and break the source.
     *
     * @param c the character to escape
     * @return the escaped representation
     */
    static String escapeChar(char c) {
        return switch (c) {
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            case '\b' -> "\\b";
            case '\f' -> "\\f";
            case '\\' -> "\\\\";
            case '"' -> "\\\"";
            case '\'' -> "\\'";
            default -> c < 0x20 || c > 0x7E
                    ? String.format(Locale.ROOT, "\\u%04x", (int) c)
                    : String.valueOf(c);
        };
    }

    // ==================== NUMBERS ====================

    public static String intLiteral(int value) {
        return Integer.toString(value);
    }

    public static String longLiteral(long value) {
        return value + "L";
    }

    public static String shortLiteral(short value) {
        return "(short) " + value;
    }

    /**
     * Formats a byte as a hexadecimal literal, casting values that do not fit a positive
     * {@code int} literal in the byte range.
     *
     * @param value the byte
     * @return {@code 0x7F} for 127, {@code (byte) 0x80} for -128
     */
    public static String byteLiteral(byte value) {
        String hex = String.format(Locale.ROOT, "0x%02X", value & 0xFF);
        return value < 0 ? "(byte) " + hex : hex;
    }

    /**
     * Formats a byte as a stand-alone expression of type {@code byte}.
     *
     * @param value the byte
     * @return {@code (byte) 0x04} for 4, {@code (byte) 0xFF} for -1
     */
    public static String byteValueLiteral(byte value) {
        String literal = byteLiteral(value);
        return value < 0 ? literal : "(byte) " + literal;
    }

    /**
     * Formats a double in canonical form.
     *
     * <p>Plain decimal notation is used unless the magnitude is below {@code 1e-3} or at least
     * {@code 1e7}, where the shortest scientific form is used. Non-finite values become
     * {@link Double} constant references.
     *
     * @param value the double
     * @return the literal or constant reference text
     */
    public static String doubleLiteral(double value) {
        if (Double.isNaN(value)) {
            return "Double.NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
        }
        return Double.toString(value);
    }

    public static String floatLiteral(float value) {
        if (Float.isNaN(value)) {
            return "Float.NaN";
        }
        if (Float.isInfinite(value)) {
            return value > 0 ? "Float.POSITIVE_INFINITY" : "Float.NEGATIVE_INFINITY";
        }
        return Float.toString(value) + "F";
    }

    // ==================== NAMES ====================

    /**
     * Capitalizes the first letter of a string.
     *
     * @param str the string to capitalize
     * @return the string with first letter uppercase, or unchanged if null/empty
     */
    public static String capitalize(String str) {
        if (str == null || str.isEmpty()) return str;
        return Character.toUpperCase(str.charAt(0)) + str.substring(1);
    }
}
