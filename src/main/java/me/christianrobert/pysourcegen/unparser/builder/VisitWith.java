package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.context.MalformedNodeException;
import me.christianrobert.pysourcegen.unparser.node.Node;

import java.util.List;

/**
 * Static helper for visiting with statements.
 *
 * <p>Before Python 3.3 a {@code With} node holds a single {@code context_expr} /
 * {@code optional_vars} pair; from 3.3 on it holds a list of {@code withitem} nodes.</p>
 */
public class VisitWith {

    /**
     * {@code with expr as vars:} (single context manager).
     */
    public static void v(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("with ");
        b.visit(node.requireNode("context_expr"));
        if (node.has("optional_vars")) {
            b.write(" as ");
            b.visit(node.requireNode("optional_vars"));
        }
        b.write(":");
        b.body(node.getNodes("body"));
    }

    /**
     * {@code with a as x, b as y:} (Python 3.3 items).
     */
    public static void vItems(Node node, PythonSourceBuilder b) {
        withItems(node, b, null);
    }

    public static void vAsync(Node node, PythonSourceBuilder b) {
        withItems(node, b, "async");
    }

    public static void vWithitem(Node node, PythonSourceBuilder b) {
        b.visit(node.requireNode("context_expr"));
        if (node.has("optional_vars")) {
            b.write(" as ");
            b.visit(node.requireNode("optional_vars"));
        }
    }

    private static void withItems(Node node, PythonSourceBuilder b, String prefix) {
        List<Node> items = node.getNodes("items");
        if (items.isEmpty()) {
            throw new MalformedNodeException(node.getKind().getTypeName() + " needs at least one item",
                    node.getKind(), "items", b.getVersion().label());
        }
        b.newline(node);
        if (prefix != null) {
            b.write(prefix + " ");
        }
        b.write("with ");
        b.commaSeparated(items);
        b.write(":");
        b.body(node.getNodes("body"));
    }
}
