package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;

import java.util.List;

/**
 * Static helper for visiting try statements and exception handlers.
 *
 * <h3>Python 2 (and 3.0 to 3.2) trees:</h3>
 * <pre>
 * TryFinally(body=[TryExcept(body, handlers, orelse)], finalbody)
 * </pre>
 *
 * <h3>Python 3.3+ trees:</h3>
 * <pre>
 * Try(body, handlers, orelse, finalbody)
 * </pre>
 *
 * <h3>Python:</h3>
 * <pre>
 * try:
 *     body
 * except Type as name:
 *     handler
 * else:
 *     orelse
 * finally:
 *     finalbody
 * </pre>
 */
public class VisitTry {

    public static void vTryExcept(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("try:");
        b.body(node.getNodes("body"));
        handlersAndElse(node, b);
    }

    public static void vTryFinally(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("try:");
        b.body(node.getNodes("body"));
        finallyBlock(node, b);
    }

    /**
     * Unified try statement of Python 3.3.
     */
    public static void vTry(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("try:");
        b.body(node.getNodes("body"));
        handlersAndElse(node, b);
        finallyBlock(node, b);
    }

    /**
     * Python 2 handler: the bound name is an expression node ({@code except E as e:}).
     */
    public static void vExceptHandler(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("except");
        if (node.has("type")) {
            b.write(" ");
            b.visit(node.requireNode("type"));
            if (node.has("name")) {
                b.write(" as ");
                b.visit(node.requireNode("name"));
            }
        }
        b.write(":");
        b.body(node.getNodes("body"));
    }

    /**
     * Python 3 handler: the bound name is an identifier.
     */
    public static void vExceptHandlerIdentifier(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("except");
        if (node.has("type")) {
            b.write(" ");
            b.visit(node.requireNode("type"));
            if (node.has("name")) {
                b.write(" as " + node.getString("name"));
            }
        }
        b.write(":");
        b.body(node.getNodes("body"));
    }

    private static void handlersAndElse(Node node, PythonSourceBuilder b) {
        for (Node handler : node.getNodes("handlers")) {
            b.visit(handler);
        }
        List<Node> orelse = node.getNodes("orelse");
        if (!orelse.isEmpty()) {
            b.newline();
            b.write("else:");
            b.body(orelse);
        }
    }

    private static void finallyBlock(Node node, PythonSourceBuilder b) {
        List<Node> finalbody = node.getNodes("finalbody");
        if (!finalbody.isEmpty()) {
            b.newline();
            b.write("finally:");
            b.body(finalbody);
        }
    }
}
