package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;

/**
 * Static helper for visiting raise statements.
 *
 * <h3>Python 2 fields:</h3>
 * <pre>
 * raise type, inst, tback
 * </pre>
 *
 * <h3>Python 3 fields:</h3>
 * <pre>
 * raise exc from cause
 * </pre>
 *
 * <p>Both field sets are accepted by every dialect; {@code exc} wins when present.
 * A raise without any field re-raises the active exception.</p>
 */
public class VisitRaise {

    public static void v(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("raise");
        if (node.has("exc")) {
            b.write(" ");
            b.visit(node.requireNode("exc"));
            if (node.has("cause")) {
                b.write(" from ");
                b.visit(node.requireNode("cause"));
            }
        } else if (node.has("type")) {
            b.write(" ");
            b.visit(node.requireNode("type"));
            if (node.has("inst")) {
                b.write(", ");
                b.visit(node.requireNode("inst"));
            } else if (node.has("tback")) {
                b.write(", None");
            }
            if (node.has("tback")) {
                b.write(", ");
                b.visit(node.requireNode("tback"));
            }
        }
    }
}
