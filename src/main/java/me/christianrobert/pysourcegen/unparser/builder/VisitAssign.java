package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.context.MalformedNodeException;
import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;

import java.util.List;

/**
 * Static helper for visiting assignment statements.
 *
 * <pre>
 * a = b = value          (Assign, chained targets)
 * a += value             (AugAssign, token from the binary table)
 * a: int = value         (AnnAssign, Python 3.6)
 * </pre>
 */
public class VisitAssign {

    public static void v(Node node, PythonSourceBuilder b) {
        List<Node> targets = node.getNodes("targets");
        if (targets.isEmpty()) {
            throw new MalformedNodeException(
                    "Assign needs at least one target", node.getKind(), "targets");
        }
        b.newline(node);
        for (int idx = 0; idx < targets.size(); idx++) {
            if (idx > 0) {
                b.write(" = ");
            }
            b.visit(targets.get(idx));
        }
        b.write(" = ");
        b.visit(node.requireNode("value"));
    }

    public static void vAugmented(Node node, PythonSourceBuilder b) {
        String token = b.binaryToken(node.requireOperator("op"));
        b.newline(node);
        b.visit(node.requireNode("target"));
        b.write(" " + token + "= ");
        b.visit(node.requireNode("value"));
    }

    /**
     * Annotated assignment. A name target with {@code simple == 0} was parenthesized in the
     * source ({@code (x): int}) and is rendered that way again.
     */
    public static void vAnnotated(Node node, PythonSourceBuilder b) {
        Node target = node.requireNode("target");
        boolean parenthesize = target.getKind() == NodeKind.NAME && node.getInt("simple", 1) == 0;

        b.newline(node);
        if (parenthesize) {
            b.write("(");
        }
        b.visit(target);
        if (parenthesize) {
            b.write(")");
        }
        b.write(": ");
        b.visit(node.requireNode("annotation"));
        if (node.has("value")) {
            b.write(" = ");
            b.visit(node.requireNode("value"));
        }
    }
}
