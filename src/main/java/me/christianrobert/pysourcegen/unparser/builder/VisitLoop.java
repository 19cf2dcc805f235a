package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;

/**
 * Static helper for visiting loops.
 *
 * <pre>
 * [async] for target in iter:
 *     body
 * else:
 *     orelse
 *
 * while test:
 *     body
 * else:
 *     orelse
 * </pre>
 */
public class VisitLoop {

    public static void vFor(Node node, PythonSourceBuilder b) {
        forLoop(node, b, null);
    }

    public static void vAsyncFor(Node node, PythonSourceBuilder b) {
        forLoop(node, b, "async");
    }

    public static void vWhile(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("while ");
        b.visit(node.requireNode("test"));
        b.write(":");
        b.bodyOrElse(node);
    }

    private static void forLoop(Node node, PythonSourceBuilder b, String prefix) {
        b.newline(node);
        if (prefix != null) {
            b.write(prefix + " ");
        }
        b.write("for ");
        b.visit(node.requireNode("target"));
        b.write(" in ");
        b.visit(node.requireNode("iter"));
        b.write(":");
        b.bodyOrElse(node);
    }
}
