package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;

/**
 * Static helper for visiting import statements.
 *
 * <pre>
 * import os, os.path as osp
 * from ..package.module import name as alias, other
 * </pre>
 */
public class VisitImport {

    public static void v(Node node, PythonSourceBuilder b) {
        b.newline(node);
        b.write("import ");
        b.commaSeparated(node.getNodes("names"));
    }

    public static void vFrom(Node node, PythonSourceBuilder b) {
        b.newline(node);

        StringBuilder imports = new StringBuilder();
        for (Node alias : node.getNodes("names")) {
            if (imports.length() > 0) {
                imports.append(", ");
            }
            imports.append(aliasText(alias));
        }

        String dots = ".".repeat(Math.max(0, node.getInt("level", 0)));
        String module = node.has("module") ? node.getString("module") : "";
        b.write("from " + dots + module + " import " + imports);
    }

    public static void vAlias(Node node, PythonSourceBuilder b) {
        b.write(aliasText(node));
    }

    private static String aliasText(Node alias) {
        String name = alias.requireString("name");
        String asname = alias.getString("asname");
        return asname != null && !asname.isEmpty() ? name + " as " + asname : name;
    }
}
