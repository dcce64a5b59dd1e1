package com.raditha.astcore.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Helpers for the textual form of C-family literals.
 */
public class Literals {

    private static final List<String> LITERAL_PREFIXES = List.of("", "u8", "u", "U", "L");

    private static final Pattern INT_PATTERN = Pattern.compile(
            "[+-]?(0[xX][0-9a-fA-F']+|0[bB][01']+|[0-9][0-9']*)"
                    + "([uU]([lL]{1,2}|[zZ])?|([lL]{1,2}|[zZ])[uU]?|i64|ui64)?");

    private static final Pattern DECIMAL_FLOAT_PATTERN = Pattern.compile(
            "[+-]?(([0-9][0-9']*\\.[0-9']*|\\.[0-9][0-9']*)([eE][+-]?[0-9]+)?|[0-9][0-9']*[eE][+-]?[0-9]+)[fFlL]?");

    private static final Pattern HEX_FLOAT_PATTERN = Pattern.compile(
            "[+-]?0[xX]([0-9a-fA-F']*\\.?[0-9a-fA-F']*)[pP][+-]?[0-9]+[fFlL]?");

    private Literals() {
        /* this is only a utility class */
    }

    /**
     * Whether the text is a literal delimited by the quote character and
     * starting with the given encoding prefix.
     */
    public static boolean isPrefixStringCharLiteral(String str, char quote, String prefix) {
        if (str.isEmpty() || str.charAt(str.length() - 1) != quote) {
            return false;
        }
        return str.length() + 1 > prefix.length() && str.startsWith(prefix + quote);
    }

    public static boolean isStringLiteral(String str) {
        return isStringCharLiteral(str, '"');
    }

    public static boolean isCharLiteral(String str) {
        return isStringCharLiteral(str, '\'');
    }

    private static boolean isStringCharLiteral(String str, char quote) {
        for (String prefix : LITERAL_PREFIXES) {
            if (isPrefixStringCharLiteral(str, quote, prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The content between the quotes of a string literal, or "" when the
     * text is not a string literal.
     */
    public static String getStringLiteral(String str) {
        if (isStringLiteral(str)) {
            return getStringCharLiteral(str, '"');
        }
        return "";
    }

    public static String getCharLiteral(String str) {
        if (isCharLiteral(str)) {
            return getStringCharLiteral(str, '\'');
        }
        return "";
    }

    private static String getStringCharLiteral(String str, char quote) {
        int quotePos = str.indexOf(quote);
        int end = Math.max(quotePos + 1, str.length() - 1);
        return str.substring(quotePos + 1, end);
    }

    /**
     * Replace C escape sequences with the characters they denote.
     * Unknown escapes keep the escaped character.
     */
    public static String replaceEscapeSequences(String source) {
        StringBuilder result = new StringBuilder(source.length());
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c != '\\' || i + 1 >= source.length()) {
                result.append(c);
                i++;
                continue;
            }
            char e = source.charAt(i + 1);
            i += 2;
            switch (e) {
                case 'n' -> result.append('\n');
                case 'r' -> result.append('\r');
                case 't' -> result.append('\t');
                case 'a' -> result.append('\u0007');
                case 'b' -> result.append('\b');
                case 'f' -> result.append('\f');
                case 'v' -> result.append('\u000B');
                case 'e' -> result.append('\u001B');
                case 'x' -> {
                    int start = i;
                    while (i < source.length() && Character.digit(source.charAt(i), 16) >= 0) {
                        i++;
                    }
                    if (start == i) {
                        result.append('x');
                    } else {
                        result.append((char) (Integer.parseInt(source.substring(start, i), 16) & 0xFF));
                    }
                }
                default -> {
                    if (e >= '0' && e <= '7') {
                        int value = e - '0';
                        int digits = 1;
                        while (digits < 3 && i < source.length()
                                && source.charAt(i) >= '0' && source.charAt(i) <= '7') {
                            value = value * 8 + (source.charAt(i) - '0');
                            i++;
                            digits++;
                        }
                        result.append((char) (value & 0xFF));
                    } else {
                        result.append(e);
                    }
                }
            }
        }
        return result.toString();
    }

    /**
     * Preprocessor notion of a number: a digit, or a sign or dot followed by a digit.
     */
    public static boolean isNumberLike(String str) {
        if (str.isEmpty()) {
            return false;
        }
        char c = str.charAt(0);
        if (Character.isDigit(c)) {
            return true;
        }
        return str.length() > 1 && (c == '-' || c == '+' || c == '.') && Character.isDigit(str.charAt(1));
    }

    public static boolean isInt(String str) {
        return INT_PATTERN.matcher(str).matches();
    }

    public static boolean isFloat(String str) {
        return DECIMAL_FLOAT_PATTERN.matcher(str).matches() || HEX_FLOAT_PATTERN.matcher(str).matches();
    }

    /**
     * Render a floating point value with 12 significant digits, always
     * keeping a decimal point.
     */
    public static String formatFloat(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0.0) {
            return "0.0";
        }
        String s = new BigDecimal(value).round(new MathContext(12)).stripTrailingZeros().toPlainString();
        if (s.indexOf('.') < 0) {
            s += ".0";
        }
        return s;
    }
}
