package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;

/**
 * Static helper for visiting names and attribute access.
 *
 * <p>Names are written with their own line number, so a name on a later input line moves the
 * output to that line as well.</p>
 */
public class VisitName {

    public static void v(Node node, PythonSourceBuilder b) {
        b.write(node.requireString("id"), node);
    }

    public static void vAttribute(Node node, PythonSourceBuilder b) {
        b.visit(node.requireNode("value"));
        b.write("." + node.requireString("attr"));
    }

    public static void vStarred(Node node, PythonSourceBuilder b) {
        b.write("*");
        b.visit(node.requireNode("value"));
    }
}
