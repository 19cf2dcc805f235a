package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;

import java.util.List;

/**
 * Static helper for visiting one-line statements without nested blocks.
 */
public class VisitSimpleStatement {

    public static void vPass(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("pass", node);
    }

    public static void vBreak(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("break");
    }

    public static void vContinue(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("continue");
    }

    public static void vReturn(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("return");
        if (node.has("value")) {
            b.write(" ");
            b.visit(node.requireNode("value"));
        }
    }

    public static void vDelete(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("del ");
        b.commaSeparated(node.getNodes("targets"));
    }

    public static void vGlobal(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("global " + String.join(", ", node.getStrings("names")));
    }

    public static void vNonlocal(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("nonlocal " + String.join(", ", node.getStrings("names")));
    }

    public static void vAssert(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("assert ");
        b.visit(node.requireNode("test"));
        if (node.has("msg")) {
            b.write(", ");
            b.visit(node.requireNode("msg"));
        }
    }

    /**
     * Python 2 print statement: {@code print >> dest, a, b,} (trailing comma when {@code nl} is false).
     */
    public static void vPrint(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("print ");
        Separator comma = b.separator(", ");
        if (node.has("dest")) {
            comma.next();
            b.write(">> ");
            b.visit(node.requireNode("dest"));
        }
        List<Node> values = node.getNodes("values");
        for (Node value : values) {
            comma.next();
            b.visit(value);
        }
        if (!node.getBoolean("nl", true)) {
            b.write(",");
        }
    }

    /**
     * Python 2 exec statement: {@code exec code in globals, locals}.
     */
    public static void vExec(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("exec ");
        b.visit(node.requireNode("body"));
        if (node.has("globals")) {
            b.write(" in ");
            b.visit(node.requireNode("globals"));
            if (node.has("locals")) {
                b.write(", ");
                b.visit(node.requireNode("locals"));
            }
        }
    }
}
