package com.plexus.core.ops;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Canonical text for constant literals, following Python's {@code repr} rules so that
 * equal constants always produce equal text regardless of how they were written.
 */
public final class PyLiterals {

    private PyLiterals() {}

    // -----------------------------------------------------------------------
    // Numbers
    // -----------------------------------------------------------------------

    public static boolean isFloatToken(String token) {
        String t = token.toLowerCase(Locale.ROOT);
        if (t.startsWith("0x") || t.startsWith("0o") || t.startsWith("0b")) return false;
        return t.contains(".") || t.contains("e");
    }

    /**
     * @throws IllegalArgumentException for a malformed integer token
     */
    public static String canonicalInt(String token) {
        String t = stripUnderscores(token).toLowerCase(Locale.ROOT);
        try {
            if (t.startsWith("0x")) return new BigInteger(t.substring(2), 16).toString();
            if (t.startsWith("0o")) return new BigInteger(t.substring(2), 8).toString();
            if (t.startsWith("0b")) return new BigInteger(t.substring(2), 2).toString();
            if (t.length() > 1 && t.charAt(0) == '0' && !t.chars().allMatch(c -> c == '0')) {
                throw new IllegalArgumentException(
                        "leading zeros in decimal integer literals are not permitted: " + token);
            }
            return new BigInteger(t).toString();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid integer literal: " + token, e);
        }
    }

    /**
     * @throws IllegalArgumentException for a malformed float token
     */
    public static String canonicalFloat(String token) {
        String t = stripUnderscores(token);
        try {
            return floatRepr(Double.parseDouble(t));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid float literal: " + token, e);
        }
    }

    /**
     * Shortest round-tripping text in Python's layout: fixed notation when the decimal
     * exponent lies in (-4, 16], scientific with a signed two-digit exponent otherwise.
     */
    public static String floatRepr(double d) {
        if (Double.isInfinite(d)) return d > 0 ? "1e309" : "-1e309";
        if (Double.isNaN(d)) throw new IllegalArgumentException("NaN has no literal form");
        if (d == 0.0) return (1.0 / d < 0) ? "-0.0" : "0.0";

        String sign = d < 0 ? "-" : "";
        BigDecimal bd = shortestDigits(Math.abs(d));
        String digits = bd.unscaledValue().toString();
        int decpt = digits.length() - bd.scale();

        StringBuilder sb = new StringBuilder(sign);
        if (decpt > -4 && decpt <= 16) {
            if (decpt <= 0) {
                sb.append("0.").append("0".repeat(-decpt)).append(digits);
            } else if (decpt >= digits.length()) {
                sb.append(digits).append("0".repeat(decpt - digits.length())).append(".0");
            } else {
                sb.append(digits, 0, decpt).append('.').append(digits.substring(decpt));
            }
        } else {
            sb.append(digits.charAt(0));
            if (digits.length() > 1) sb.append('.').append(digits.substring(1));
            int exp = decpt - 1;
            sb.append('e').append(exp < 0 ? '-' : '+');
            int abs = Math.abs(exp);
            if (abs < 10) sb.append('0');
            sb.append(abs);
        }
        return sb.toString();
    }

    /** Fewest significant digits that still read back as {@code d}, nearest candidate first. */
    private static BigDecimal shortestDigits(double d) {
        BigDecimal exact = new BigDecimal(d);
        for (int precision = 1; precision < 17; precision++) {
            BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            if (candidate.doubleValue() == d) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    private static String stripUnderscores(String token) {
        if (token.startsWith("_") || token.endsWith("_") || token.contains("__")) {
            throw new IllegalArgumentException("invalid numeric literal: " + token);
        }
        return token.replace("_", "");
    }

    // -----------------------------------------------------------------------
    // Strings
    // -----------------------------------------------------------------------

    /** Lower-cased prefix letters of a string token, e.g. {@code "r"} for {@code r'\d'}. */
    public static String stringPrefix(String token) {
        int i = 0;
        while (i < token.length() && token.charAt(i) != '\'' && token.charAt(i) != '"') i++;
        return token.substring(0, i).toLowerCase(Locale.ROOT);
    }

    /**
     * Decodes a complete string token (prefix, quotes and body) into its value.
     *
     * @throws IllegalArgumentException on a bad escape sequence
     */
    public static String decodeString(String token) {
        String prefix = stringPrefix(token);
        boolean raw = prefix.indexOf('r') >= 0;
        String rest = token.substring(prefix.length());
        int quoteLen = (rest.startsWith("'''") || rest.startsWith("\"\"\"")) ? 3 : 1;
        String body = rest.substring(quoteLen, rest.length() - quoteLen);
        return raw ? body : unescape(body);
    }

    private static String unescape(String body) {
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char e = body.charAt(i + 1);
            i += 2;
            switch (e) {
                case '\n' -> { }
                case '\\' -> sb.append('\\');
                case '\'' -> sb.append('\'');
                case '"'  -> sb.append('"');
                case 'a'  -> sb.append('\u0007');
                case 'b'  -> sb.append('\b');
                case 'f'  -> sb.append('\f');
                case 'n'  -> sb.append('\n');
                case 'r'  -> sb.append('\r');
                case 't'  -> sb.append('\t');
                case 'v'  -> sb.append('\u000b');
                case 'x'  -> { sb.appendCodePoint(hex(body, i, 2)); i += 2; }
                case 'u'  -> { sb.appendCodePoint(hex(body, i, 4)); i += 4; }
                case 'U'  -> { sb.appendCodePoint(hex(body, i, 8)); i += 8; }
                case 'N'  -> throw new IllegalArgumentException("named unicode escapes are not supported");
                default -> {
                    if (e >= '0' && e <= '7') {
                        int start = i - 1;
                        int end = start;
                        while (end < body.length() && end < start + 3
                                && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        sb.appendCodePoint(Integer.parseInt(body.substring(start, end), 8));
                        i = end;
                    } else {
                        sb.append('\\').append(e);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static int hex(String body, int from, int len) {
        if (from + len > body.length()) {
            throw new IllegalArgumentException("truncated \\x/\\u/\\U escape");
        }
        try {
            int cp = Integer.parseUnsignedInt(body.substring(from, from + len), 16);
            if (!Character.isValidCodePoint(cp)) {
                throw new IllegalArgumentException("illegal Unicode character in escape");
            }
            return cp;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("malformed hex escape", e);
        }
    }

    /** Python {@code repr} of a str value. */
    public static String stringRepr(String value) {
        char quote = (value.indexOf('\'') >= 0 && value.indexOf('"') < 0) ? '"' : '\'';
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append(quote);
        value.codePoints().forEach(cp -> {
            if (cp == quote || cp == '\\') {
                sb.append('\\').appendCodePoint(cp);
            } else if (cp == '\t') {
                sb.append("\\t");
            } else if (cp == '\n') {
                sb.append("\\n");
            } else if (cp == '\r') {
                sb.append("\\r");
            } else if (isPrintable(cp)) {
                sb.appendCodePoint(cp);
            } else if (cp <= 0xff) {
                sb.append(String.format("\\x%02x", cp));
            } else if (cp <= 0xffff) {
                sb.append(String.format("\\u%04x", cp));
            } else {
                sb.append(String.format("\\U%08x", cp));
            }
        });
        sb.append(quote);
        return sb.toString();
    }

    private static boolean isPrintable(int cp) {
        if (cp == ' ') return true;
        switch (Character.getType(cp)) {
            case Character.CONTROL:
            case Character.FORMAT:
            case Character.SURROGATE:
            case Character.PRIVATE_USE:
            case Character.UNASSIGNED:
            case Character.LINE_SEPARATOR:
            case Character.PARAGRAPH_SEPARATOR:
            case Character.SPACE_SEPARATOR:
                return false;
            default:
                return true;
        }
    }
}
