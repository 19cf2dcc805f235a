package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;

/**
 * Static helper for visiting subscripts and slices.
 *
 * <pre>
 * value[index]
 * value[lower:upper:step]
 * value[a:b, c]          (ExtSlice)
 * </pre>
 */
public class VisitSubscript {

    public static void v(Node node, PythonSourceBuilder b) {
        b.visit(node.requireNode("value"));
        b.write("[");
        b.visit(node.requireNode("slice"));
        b.write("]");
    }

    public static void vIndex(Node node, PythonSourceBuilder b) {
        b.visit(node.requireNode("value"));
    }

    public static void vSlice(Node node, PythonSourceBuilder b) {
        if (node.has("lower")) {
            b.visit(node.requireNode("lower"));
        }
        b.write(":");
        if (node.has("upper")) {
            b.visit(node.requireNode("upper"));
        }
        if (node.has("step")) {
            b.write(":");
            Node step = node.requireNode("step");
            // Python 2 parses a[::] with a Name('None') step
            boolean noneName = step.getKind() == NodeKind.NAME && "None".equals(step.getString("id"));
            if (!noneName) {
                b.visit(step);
            }
        }
    }

    public static void vExtSlice(Node node, PythonSourceBuilder b) {
        Separator comma = b.separator(",");
        for (Node dim : node.getNodes("dims")) {
            comma.next();
            b.visit(dim);
        }
    }
}
