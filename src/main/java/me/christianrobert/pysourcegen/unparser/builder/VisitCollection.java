package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.context.MalformedNodeException;
import me.christianrobert.pysourcegen.unparser.node.Node;

import java.util.List;

/**
 * Static helper for visiting collection displays.
 *
 * <pre>
 * Tuple  (a, b)   (a,)   ()
 * List   [a, b]
 * Set    {a, b}
 * Dict   {k: v, **other}
 * </pre>
 *
 * <p>A one-element tuple keeps its trailing comma so it does not read back as a parenthesized
 * expression.</p>
 */
public class VisitCollection {

    public static void vTuple(Node node, PythonSourceBuilder b) {
        List<Node> elts = node.getNodes("elts");
        b.write("(");
        b.commaSeparated(elts);
        b.write(elts.size() == 1 ? ",)" : ")");
    }

    public static void vList(Node node, PythonSourceBuilder b) {
        sequence(node, b, "[", "]");
    }

    public static void vSet(Node node, PythonSourceBuilder b) {
        List<Node> elts = node.getNodes("elts");
        if (elts.isEmpty()) {
            // {} would be a dict
            throw new MalformedNodeException("Set display needs at least one element",
                    node.getKind(), "elts", b.getVersion().label());
        }
        sequence(node, b, "{", "}");
    }

    /**
     * Dict entries: {@code key: value}, or {@code **value} where the key is absent (3.5 unpacking).
     */
    public static void vDict(Node node, PythonSourceBuilder b) {
        List<Node> keys = node.getNodes("keys");
        List<Node> values = node.getNodes("values");
        if (keys.size() != values.size()) {
            throw new MalformedNodeException(
                    "Dict has " + keys.size() + " keys for " + values.size() + " values",
                    node.getKind(), "values", b.getVersion().label());
        }

        b.write("{");
        for (int idx = 0; idx < keys.size(); idx++) {
            if (idx > 0) {
                b.write(", ");
            }
            Node key = keys.get(idx);
            if (key != null) {
                b.visit(key);
                b.write(": ");
            } else {
                b.write("**");
            }
            b.visit(values.get(idx));
        }
        b.write("}");
    }

    private static void sequence(Node node, PythonSourceBuilder b, String left, String right) {
        b.write(left);
        b.commaSeparated(node.getNodes("elts"));
        b.write(right);
    }
}
