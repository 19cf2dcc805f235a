package me.christianrobert.pysourcegen.unparser.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats Java values as Python literal source, following the rules of Python's {@code repr()}.
 *
 * <p>Every literal produced here reads back in Python as the same value.</p>
 */
public final class PythonLiterals {

    private static final String INFINITY = "1e309";

    // no quote character to escape
    private static final char NO_QUOTE = 0;

    private PythonLiterals() {
    }

    // ========== STRINGS ==========

    /**
     * Quotes a string the way {@code repr(str)} does: single quotes unless the text contains a
     * single quote and no double quote.
     */
    public static String quote(String s) {
        char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        return quote + escape(s, quote) + quote;
    }

    /**
     * Quotes a string for Python 2 source, which is ASCII unless a coding line says otherwise.
     * ASCII text is quoted as by {@link #quote(String)}; other text becomes a {@code u'...'}
     * literal with every non-ASCII character escaped, as {@code repr(unicode)} writes it.
     */
    public static String quotePython2(String s) {
        if (isAscii(s)) {
            return quote(s);
        }
        char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        return "u" + quote + escape(s, quote, false, true) + quote;
    }

    /**
     * Escapes backslashes, the given quote character, line breaks, tabs and control characters.
     * Printable non-ASCII characters are kept as they are.
     */
    public static String escape(String s, char quote) {
        return escape(s, quote, false, false);
    }

    private static String escape(String s, char quote, boolean keepNewlines, boolean asciiOnly) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        for (int i = 0; i < s.length(); ) {
            int c = s.codePointAt(i);
            i += Character.charCount(c);
            if (c == '\\') {
                sb.append("\\\\");
            } else if (quote != NO_QUOTE && c == quote) {
                sb.append('\\').append((char) c);
            } else if (c == '\n') {
                sb.append(keepNewlines ? "\n" : "\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c < 0x20 || c == 0x7f || (c >= 0x80 && c < 0xa0)) {
                sb.append(String.format("\\x%02x", c));
            } else if (asciiOnly && c >= 0x80) {
                sb.append(unicodeEscape(c));
            } else if (Character.isISOControl(c) || Character.getType(c) == Character.UNASSIGNED
                    || Character.getType(c) == Character.SURROGATE) {
                sb.append(unicodeEscape(c));
            } else {
                sb.appendCodePoint(c);
            }
        }
        return sb.toString();
    }

    private static String unicodeEscape(int c) {
        if (c < 0x100) {
            return String.format("\\x%02x", c);
        }
        if (c < 0x10000) {
            return String.format("\\u%04x", c);
        }
        return String.format("\\U%08x", c);
    }

    private static boolean isAscii(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) >= 0x80) {
                return false;
            }
        }
        return true;
    }

    /**
     * Renders a docstring between triple quotes.
     *
     * <p>The body is escaped like any string literal except that line breaks stay real line
     * breaks. Uses {@code """} unless the text contains that sequence, in which case {@code '''}
     * is used; if both sequences occur, the double quotes of every {@code """} run are escaped.
     * A trailing quote that would merge with the closing delimiter is escaped as well.</p>
     */
    public static String docstring(String s) {
        return docstring(s, false);
    }

    /**
     * Docstring for Python 2 source: non-ASCII text is escaped and gets the {@code u} prefix.
     */
    public static String docstringPython2(String s) {
        return isAscii(s) ? docstring(s, false) : "u" + docstring(s, true);
    }

    private static String docstring(String s, boolean asciiOnly) {
        String body = escape(s, NO_QUOTE, true, asciiOnly);
        String delimiter = "\"\"\"";
        if (body.contains("\"\"\"")) {
            if (!body.contains("'''")) {
                delimiter = "'''";
            } else {
                body = body.replace("\"\"\"", "\\\"\\\"\\\"");
            }
        }
        char closing = delimiter.charAt(0);
        int last = body.length() - 1;
        if (last >= 0 && body.charAt(last) == closing && !isEscaped(body, last)) {
            body = body.substring(0, last) + "\\" + closing;
        }
        return delimiter + body + delimiter;
    }

    /**
     * True if the character at {@code index} follows an odd run of backslashes.
     */
    private static boolean isEscaped(String s, int index) {
        int count = 0;
        for (int i = index - 1; i >= 0 && s.charAt(i) == '\\'; i--) {
            count++;
        }
        return count % 2 == 1;
    }

    /**
     * Quotes bytes the way {@code repr(bytes)} does, e.g. {@code b'ab\x00'}.
     */
    public static String bytes(byte[] value) {
        boolean hasSingle = false;
        boolean hasDouble = false;
        for (byte v : value) {
            hasSingle |= v == '\'';
            hasDouble |= v == '"';
        }
        return bytes(value, hasSingle && !hasDouble ? '"' : '\'');
    }

    /**
     * Quotes bytes with the given quote character.
     */
    public static String bytes(byte[] value, char quote) {
        StringBuilder sb = new StringBuilder("b").append(quote);
        for (byte v : value) {
            int c = v & 0xff;
            if (c == '\\') {
                sb.append("\\\\");
            } else if (c == quote) {
                sb.append('\\').append((char) c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c < 0x20 || c >= 0x7f) {
                sb.append(String.format("\\x%02x", c));
            } else {
                sb.append((char) c);
            }
        }
        return sb.append(quote).toString();
    }

    // ========== NUMBERS ==========

    /**
     * Renders a number literal. Integers print their digits, floating point values follow
     * Python's float repr (shortest round-trip digits, scientific notation outside 1e-4..1e16).
     */
    public static String number(Number n) {
        if (n instanceof Double || n instanceof Float) {
            return floatRepr(n.doubleValue());
        }
        if (n instanceof BigDecimal) {
            return floatRepr(n.doubleValue());
        }
        if (n instanceof BigInteger) {
            return n.toString();
        }
        return Long.toString(n.longValue());
    }

    static String floatRepr(double d) {
        if (Double.isNaN(d)) {
            return "(" + INFINITY + " - " + INFINITY + ")";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? INFINITY : "-" + INFINITY;
        }
        String sign = (d < 0 || (d == 0.0 && 1.0 / d < 0)) ? "-" : "";
        double abs = Math.abs(d);
        if (abs == 0.0) {
            return sign + "0.0";
        }

        BigDecimal decimal = shortestDecimal(abs);
        String digits = decimal.unscaledValue().toString();
        int exponent = digits.length() - 1 - decimal.scale();

        if (exponent >= -4 && exponent < 16) {
            String plain = decimal.toPlainString();
            if (plain.indexOf('.') < 0) {
                plain = plain + ".0";
            }
            return sign + plain;
        }

        StringBuilder sb = new StringBuilder(sign).append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int absExponent = Math.abs(exponent);
        if (absExponent < 10) {
            sb.append('0');
        }
        return sb.append(absExponent).toString();
    }

    private static final RoundingMode[] CANDIDATE_ROUNDINGS =
            {RoundingMode.HALF_EVEN, RoundingMode.FLOOR, RoundingMode.CEILING};

    /**
     * Fewest significant digits that read back as {@code d}; among equally short candidates the
     * one nearest the exact binary value wins. {@code Double.toString} is not always shortest.
     */
    private static BigDecimal shortestDecimal(double d) {
        BigDecimal exact = new BigDecimal(d);
        for (int precision = 1; precision <= 17; precision++) {
            BigDecimal best = null;
            for (RoundingMode mode : CANDIDATE_ROUNDINGS) {
                BigDecimal candidate = exact.round(new MathContext(precision, mode));
                if (candidate.doubleValue() == d && (best == null
                        || candidate.subtract(exact).abs().compareTo(best.subtract(exact).abs()) < 0)) {
                    best = candidate;
                }
            }
            if (best != null) {
                return best.stripTrailingZeros();
            }
        }
        return exact.stripTrailingZeros();
    }
}
