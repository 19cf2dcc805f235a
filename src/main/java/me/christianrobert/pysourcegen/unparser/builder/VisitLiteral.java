package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.util.PythonLiterals;

/**
 * Static helper for visiting literal constants.
 *
 * <ul>
 *   <li>Num: Python repr of the number ({@code 42}, {@code 0.5}, {@code 1e+16})</li>
 *   <li>Str: Python repr of the string ({@code 'it\'s'} becomes {@code "it's"}); 2.x writes
 *       text with non-ASCII characters as an escaped {@code u'...'} literal</li>
 *   <li>Bytes (3.0+): {@code b'...'}</li>
 *   <li>NameConstant (3.4+): {@code True}, {@code False}, {@code None}</li>
 *   <li>Ellipsis: {@code ...}</li>
 * </ul>
 */
public class VisitLiteral {

    public static void vNum(Node node, PythonSourceBuilder b) {
        b.write(PythonLiterals.number(node.requireNumber("n")));
    }

    public static void vStr(Node node, PythonSourceBuilder b) {
        b.write(PythonLiterals.quotePython2(node.requireString("s")));
    }

    /**
     * 3.x strings are unicode; inside an f-string field the literal takes the free quote.
     */
    public static void vUnicodeStr(Node node, PythonSourceBuilder b) {
        String s = node.requireString("s");
        if (b.isInsideFormattedString()) {
            b.write(VisitFormattedString.nestedLiteral(node, s, b));
        } else {
            b.write(PythonLiterals.quote(s));
        }
    }

    public static void vBytes(Node node, PythonSourceBuilder b) {
        Object value = node.require("s");
        if (!(value instanceof byte[])) {
            throw b.unsupportedConstruct(node, "s", "Bytes literal holding " + value.getClass().getSimpleName());
        }
        byte[] bytes = (byte[]) value;
        if (b.isInsideFormattedString()) {
            String literal = PythonLiterals.bytes(bytes, VisitFormattedString.freeQuote(node, b));
            // b + quote + body + quote
            VisitFormattedString.rejectExpressionEscapes(node, literal.substring(2, literal.length() - 1), b);
            b.write(literal);
        } else {
            b.write(PythonLiterals.bytes(bytes));
        }
    }

    public static void vNameConstant(Node node, PythonSourceBuilder b) {
        Object value = node.get("value");
        if (value == null) {
            b.write("None");
        } else if (value instanceof Boolean) {
            b.write((Boolean) value ? "True" : "False");
        } else {
            // already spelled out, e.g. read from a tree dump
            b.write(String.valueOf(value));
        }
    }

    public static void vEllipsis(Node node, PythonSourceBuilder b) {
        b.write("...");
    }
}
