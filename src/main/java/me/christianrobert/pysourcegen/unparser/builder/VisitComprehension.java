package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;

/**
 * Static helper for visiting comprehensions and generator expressions.
 *
 * <pre>
 * [elt for target in iter if cond]
 * (elt for target in iter)
 * {elt for target in iter}
 * {key: value for target in iter}
 * [elt async for target in aiter]      (3.6)
 * </pre>
 */
public class VisitComprehension {

    public static void vListComp(Node node, PythonSourceBuilder b) {
        element(node, b, "[", "]");
    }

    public static void vGeneratorExp(Node node, PythonSourceBuilder b) {
        element(node, b, "(", ")");
    }

    public static void vSetComp(Node node, PythonSourceBuilder b) {
        element(node, b, "{", "}");
    }

    public static void vDictComp(Node node, PythonSourceBuilder b) {
        b.write("{");
        b.visit(node.requireNode("key"));
        b.write(": ");
        b.visit(node.requireNode("value"));
        generators(node, b);
        b.write("}");
    }

    /**
     * One {@code for ... in ... if ...} clause, written with a leading space.
     */
    public static void v(Node node, PythonSourceBuilder b) {
        if (node.getBoolean("is_async", false)) {
            throw b.unsupportedConstruct(node, "is_async", "Asynchronous comprehension");
        }
        b.write(" for ");
        clause(node, b);
    }

    /**
     * 3.6 clause: {@code async for} when {@code is_async} is set.
     */
    public static void vAsync(Node node, PythonSourceBuilder b) {
        b.write(node.getBoolean("is_async", false) ? " async for " : " for ");
        clause(node, b);
    }

    private static void clause(Node node, PythonSourceBuilder b) {
        b.visit(node.requireNode("target"));
        b.write(" in ");
        b.visit(node.requireNode("iter"));
        for (Node condition : node.getNodes("ifs")) {
            b.write(" if ");
            b.visit(condition);
        }
    }

    private static void element(Node node, PythonSourceBuilder b, String left, String right) {
        b.write(left);
        b.visit(node.requireNode("elt"));
        generators(node, b);
        b.write(right);
    }

    private static void generators(Node node, PythonSourceBuilder b) {
        for (Node generator : node.getNodes("generators")) {
            b.visit(generator);
        }
    }
}
