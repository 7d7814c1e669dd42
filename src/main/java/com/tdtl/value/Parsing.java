package com.tdtl.value;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Strict text parsers behind {@link Node.StringNode#to(Type)}. Each returns
 * {@code null} when the text is not a valid literal, never throws.
 *
 * <p>The accepted grammars are narrower than the JDK's: no surrounding whitespace,
 * no {@code d}/{@code f} suffixes and ASCII digits only.
 */
final class Parsing {

    private static final Pattern DECIMAL_FLOAT =
        Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Pattern HEX_FLOAT =
        Pattern.compile("[+-]?0[xX]([0-9a-fA-F]+\\.?[0-9a-fA-F]*|\\.[0-9a-fA-F]+)[pP][+-]?\\d+");

    private Parsing() {}

    static Boolean parseBool(String text) {
        return switch (text) {
            case "1", "t", "T", "true", "TRUE", "True" -> Boolean.TRUE;
            case "0", "f", "F", "false", "FALSE", "False" -> Boolean.FALSE;
            default -> null;
        };
    }

    static Long parseInt(String text) {
        int start = 0;
        if (!text.isEmpty() && (text.charAt(0) == '+' || text.charAt(0) == '-')) {
            start = 1;
        }
        if (start == text.length()) {
            return null;
        }
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            // overflow
            return null;
        }
    }

    static Double parseFloat(String text) {
        Double special = parseSpecial(text);
        if (special != null) {
            return special;
        }
        if (!DECIMAL_FLOAT.matcher(text).matches() && !HEX_FLOAT.matcher(text).matches()) {
            return null;
        }
        double parsed = Double.parseDouble(text);
        return Double.isInfinite(parsed) ? null : parsed;
    }

    private static Double parseSpecial(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        boolean negative = false;
        if (lower.startsWith("+") || lower.startsWith("-")) {
            negative = lower.charAt(0) == '-';
            lower = lower.substring(1);
        }
        return switch (lower) {
            case "inf", "infinity" -> negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            case "nan" -> Double.NaN;
            default -> null;
        };
    }
}
