package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;

/**
 * Static helper for the remaining expression kinds.
 *
 * <pre>
 * lambda x, y=1: x + y
 * body if test else orelse
 * yield value
 * yield from value       (3.3)
 * await value            (3.5)
 * `value`                (Python 2 repr)
 * </pre>
 */
public class VisitExpression {

    public static void vLambda(Node node, PythonSourceBuilder b) {
        b.write("lambda ");
        b.visit(node.requireNode("args"));
        b.write(": ");
        b.visit(node.requireNode("body"));
    }

    public static void vIfExp(Node node, PythonSourceBuilder b) {
        b.visit(node.requireNode("body"));
        b.write(" if ");
        b.visit(node.requireNode("test"));
        b.write(" else ");
        b.visit(node.requireNode("orelse"));
    }

    public static void vYield(Node node, PythonSourceBuilder b) {
        b.write("yield");
        if (node.has("value")) {
            b.write(" ");
            b.visit(node.requireNode("value"));
        }
    }

    public static void vYieldFrom(Node node, PythonSourceBuilder b) {
        b.write("yield from ");
        b.visit(node.requireNode("value"));
    }

    public static void vAwait(Node node, PythonSourceBuilder b) {
        b.write("await ");
        b.visit(node.requireNode("value"));
    }

    public static void vRepr(Node node, PythonSourceBuilder b) {
        b.write("`");
        b.visit(node.requireNode("value"));
        b.write("`");
    }
}
