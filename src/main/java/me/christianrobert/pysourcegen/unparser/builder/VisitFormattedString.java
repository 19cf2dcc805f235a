package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.context.MalformedNodeException;
import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;
import me.christianrobert.pysourcegen.unparser.util.PythonLiterals;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Static helper for visiting f-strings (3.6).
 *
 * <p>A JoinedStr is written as {@code f'...'}. Literal parts are escaped for the single quote and
 * their braces doubled; FormattedValue parts become replacement fields.</p>
 *
 * <p>Python 3.6 reads an f-string as a plain string before parsing its expressions, so a string
 * literal nested in a field takes the double quote and may contain neither quote, a backslash
 * nor {@code #}. An f-string nested in a field takes the free quote the same way. Nodes that
 * cannot be written under these rules are rejected.</p>
 *
 * <pre>
 * f'Hello {name!r:&gt;10}, {{literal}}'
 * f'{d["key"]}'
 * </pre>
 */
public class VisitFormattedString {

    // conversion codes as stored by the parser: ord('s'), ord('r'), ord('a')
    private static final int NO_CONVERSION = -1;

    private static final char[] QUOTES = {'\'', '"'};

    private static final Set<NodeKind> BRACE_OPENERS =
            EnumSet.of(NodeKind.DICT, NodeKind.SET, NodeKind.SET_COMP, NodeKind.DICT_COMP);

    public static void vJoinedStr(Node node, PythonSourceBuilder b) {
        fString(node, node.getNodes("values"), b);
    }

    /**
     * A replacement field outside a JoinedStr still needs the f-string wrapper to be valid source.
     */
    public static void vFormattedValue(Node node, PythonSourceBuilder b) {
        fString(node, List.of(node), b);
    }

    /**
     * Renders a string literal that sits inside a replacement field, using the quote no
     * enclosing f-string has taken.
     */
    static String nestedLiteral(Node node, String text, PythonSourceBuilder b) {
        char quote = freeQuote(node, b);
        String body = PythonLiterals.escape(text, quote);
        rejectExpressionEscapes(node, body, b);
        return quote + body + quote;
    }

    /**
     * Rejects literal source an enclosing f-string cannot hold: a backslash, a {@code #}, or the
     * quote of any open f-string.
     */
    static void rejectExpressionEscapes(Node node, String source, PythonSourceBuilder b) {
        if (source.indexOf('\\') >= 0 || source.indexOf('#') >= 0) {
            throw b.unsupportedConstruct(node, "s", "Backslash or '#' inside an f-string expression");
        }
        for (char quote : QUOTES) {
            if (b.isStringQuoteOpen(quote) && source.indexOf(quote) >= 0) {
                throw b.unsupportedConstruct(node, "s", "Quote " + quote + " inside an f-string expression");
            }
        }
    }

    // ========== QUOTES ==========

    private static void fString(Node node, List<Node> parts, PythonSourceBuilder b) {
        char quote = outerQuote(node, b);
        b.write("f" + quote);
        b.openStringQuote(quote);
        try {
            parts(node, parts, quote, b);
        } finally {
            b.closeStringQuote();
        }
        b.write(String.valueOf(quote));
    }

    private static char outerQuote(Node node, PythonSourceBuilder b) {
        return b.isInsideFormattedString() ? freeQuote(node, b) : '\'';
    }

    static char freeQuote(Node node, PythonSourceBuilder b) {
        if (!b.isStringQuoteOpen('\'')) {
            return '\'';
        }
        if (!b.isStringQuoteOpen('"')) {
            return '"';
        }
        throw b.unsupportedConstruct(node, "value", "String literal nested in f-strings using both quotes");
    }

    // ========== PARTS ==========

    private static void parts(Node joined, List<Node> parts, char quote, PythonSourceBuilder b) {
        for (Node part : parts) {
            if (part.getKind() == NodeKind.STR) {
                b.write(literal(part, quote, b));
            } else if (part.getKind() == NodeKind.FORMATTED_VALUE) {
                field(part, quote, b);
            } else {
                throw new MalformedNodeException("JoinedStr part must be Str or FormattedValue but was "
                        + part.getKind().getTypeName(), joined.getKind(), "values", b.getVersion().label());
            }
        }
    }

    private static void field(Node node, char quote, PythonSourceBuilder b) {
        Node value = node.requireNode("value");
        // "{{" would read back as an escaped brace
        b.write(BRACE_OPENERS.contains(value.getKind()) ? "{ " : "{");
        b.visit(value);

        int conversion = node.getInt("conversion", NO_CONVERSION);
        if (conversion != NO_CONVERSION) {
            if (conversion != 's' && conversion != 'r' && conversion != 'a') {
                throw new MalformedNodeException("Unknown f-string conversion " + conversion,
                        node.getKind(), "conversion", b.getVersion().label());
            }
            b.write("!" + (char) conversion);
        }

        if (node.has("format_spec")) {
            Node spec = node.requireNode("format_spec");
            b.write(":");
            if (spec.getKind() == NodeKind.JOINED_STR) {
                parts(spec, spec.getNodes("values"), quote, b);
            } else if (spec.getKind() == NodeKind.STR) {
                b.write(literal(spec, quote, b));
            } else {
                throw new MalformedNodeException("Format spec must be JoinedStr but was "
                        + spec.getKind().getTypeName(), node.getKind(), "format_spec", b.getVersion().label());
            }
        }
        b.write("}");
    }

    private static String literal(Node part, char quote, PythonSourceBuilder b) {
        String escaped = PythonLiterals.escape(part.requireString("s"), quote);
        if (b.getFormattedStringDepth() > 1) {
            // this f-string is itself part of an enclosing f-string's expression
            rejectExpressionEscapes(part, escaped, b);
        }
        return escaped.replace("{", "{{").replace("}", "}}");
    }
}
