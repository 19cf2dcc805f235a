package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;
import me.christianrobert.pysourcegen.unparser.util.PythonLiterals;

/**
 * Static helper for visiting expression statements.
 *
 * <p>A bare string literal statement is a docstring and renders between triple quotes;
 * any other expression renders on its own line. 2.x docstrings with non-ASCII text carry the
 * {@code u} prefix.</p>
 */
public class VisitExpr {

    public static void v(Node node, PythonSourceBuilder b) {
        Node value = node.requireNode("value");
        b.newline(node);
        if (value.getKind() == NodeKind.STR) {
            b.write(PythonLiterals.docstringPython2(value.requireString("s")), value);
        } else {
            b.visit(value);
        }
    }

    public static void vUnicode(Node node, PythonSourceBuilder b) {
        Node value = node.requireNode("value");
        b.newline(node);
        if (value.getKind() == NodeKind.STR) {
            b.write(PythonLiterals.docstring(value.requireString("s")), value);
        } else {
            b.visit(value);
        }
    }
}
