package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;

/**
 * Static helper for visiting function definitions.
 *
 * <h3>Python structure:</h3>
 * <pre>
 * {@literal @}decorator
 * [async] def name(arguments) [-> returns]:
 *     body
 * </pre>
 *
 * <p>The parameter list is rendered by the dialect's {@code arguments} rule. Return annotations
 * exist from Python 3.0 on; the 2.x rule rejects a {@code returns} field.</p>
 */
public class VisitFunctionDef {

    /**
     * Python 2 definition: no return annotation.
     */
    public static void v(Node node, PythonSourceBuilder b) {
        if (node.has("returns")) {
            throw b.unsupportedConstruct(node, "returns", "Return annotation");
        }
        definition(node, b, null, false);
    }

    /**
     * Python 3 definition with optional {@code -> returns}.
     */
    public static void vAnnotated(Node node, PythonSourceBuilder b) {
        definition(node, b, null, true);
    }

    /**
     * {@code async def} (Python 3.5).
     */
    public static void vAsync(Node node, PythonSourceBuilder b) {
        definition(node, b, "async", true);
    }

    private static void definition(Node node, PythonSourceBuilder b, String prefix, boolean withReturns) {
        String name = node.requireString("name");

        // STEP 1: decorators, each on its own line
        b.decorators(node);

        // STEP 2: header
        b.newline(node);
        if (prefix != null) {
            b.write(prefix + " ");
        }
        b.write("def " + name + "(", node);
        b.visit(node.requireNode("args"));
        b.write(")");

        // STEP 3: return annotation (Python 3)
        if (withReturns && node.has("returns")) {
            b.write(" -> ");
            b.visit(node.requireNode("returns"));
        }
        b.write(":");

        // STEP 4: body
        b.body(node.getNodes("body"));
    }
}
