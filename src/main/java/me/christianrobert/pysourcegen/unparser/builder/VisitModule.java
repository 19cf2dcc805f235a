package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;

/**
 * Static helper for visiting tree roots.
 *
 * <p>A {@code Module} renders its statements at indentation level zero; each statement starts its
 * own line. An {@code Expression} (eval-mode root) renders its single expression.</p>
 */
public class VisitModule {

    public static void v(Node node, PythonSourceBuilder b) {
        for (Node statement : node.getNodes("body")) {
            b.visit(statement);
        }
    }

    public static void vExpression(Node node, PythonSourceBuilder b) {
        b.visit(node.requireNode("body"));
    }
}
