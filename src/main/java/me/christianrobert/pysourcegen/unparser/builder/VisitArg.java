package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;

/**
 * Static helper for visiting Python 3 {@code arg} nodes: {@code name} or {@code name: annotation}.
 * A default, if any, is written after this by the enclosing parameter list.
 */
public class VisitArg {

    public static void v(Node node, PythonSourceBuilder b) {
        b.write(node.requireString("arg"));
        if (node.has("annotation")) {
            b.write(": ");
            b.visit(node.requireNode("annotation"));
        }
    }
}
