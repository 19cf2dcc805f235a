package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;

import java.util.List;

/**
 * Static helper for visiting if statements.
 *
 * <h3>Tree structure:</h3>
 * <pre>
 * If(test, body, orelse=[If(test2, body2, orelse=[...])])
 * </pre>
 *
 * <h3>Python:</h3>
 * <pre>
 * if test:
 *     body
 * elif test2:
 *     body2
 * else:
 *     ...
 * </pre>
 *
 * <p>An {@code orelse} holding exactly one {@code If} is folded into an {@code elif} branch.</p>
 */
public class VisitIf {

    public static void v(Node node, PythonSourceBuilder b) {
        // STEP 1: if test:
        b.newline(node);
        b.write("if ");
        b.visit(node.requireNode("test"));
        b.write(":");
        b.body(node.getNodes("body"));

        // STEP 2: elif / else chain
        Node current = node;
        List<Node> orelse = current.getNodes("orelse");
        while (!orelse.isEmpty()) {
            if (orelse.size() == 1 && orelse.get(0).getKind() == NodeKind.IF) {
                current = orelse.get(0);
                b.newline(current);
                b.write("elif ");
                b.visit(current.requireNode("test"));
                b.write(":");
                b.body(current.getNodes("body"));
                orelse = current.getNodes("orelse");
            } else {
                b.newline();
                b.write("else:");
                b.body(orelse);
                break;
            }
        }
    }
}
