package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;

/**
 * Static helper for visiting class definitions.
 *
 * <h3>Python 2:</h3>
 * <pre>
 * class Name(Base1, Base2):
 * </pre>
 *
 * <h3>Python 3:</h3>
 * <pre>
 * class Name(Base1, metaclass=Meta, *extra_bases, **extra_keywords):
 * </pre>
 *
 * <p>The parenthesis is only written when at least one base entry exists.</p>
 */
public class VisitClassDef {

    /**
     * Python 2 class: positional bases only. Keyword entries cannot be expressed and are rejected.
     */
    public static void v(Node node, PythonSourceBuilder b) {
        if (!node.getNodes("keywords").isEmpty()) {
            throw b.unsupportedConstruct(node, "keywords", "Keyword base arguments in a class definition");
        }
        if (node.has("starargs") || node.has("kwargs")) {
            throw b.unsupportedConstruct(node, node.has("starargs") ? "starargs" : "kwargs",
                    "Star arguments in a class definition");
        }

        Separator parenOrComma = header(node, b);
        for (Node base : node.getNodes("bases")) {
            openOrComma(parenOrComma, b);
            b.visit(base);
        }
        finish(node, b, parenOrComma);
    }

    /**
     * Python 3 class: positional bases, then keywords, then {@code *starargs} and {@code **kwargs}
     * (the latter two only exist in 3.0 to 3.4 trees).
     */
    public static void vWithKeywords(Node node, PythonSourceBuilder b) {
        Separator parenOrComma = header(node, b);
        for (Node base : node.getNodes("bases")) {
            openOrComma(parenOrComma, b);
            b.visit(base);
        }
        for (Node keyword : node.getNodes("keywords")) {
            openOrComma(parenOrComma, b);
            b.visit(keyword);
        }
        if (node.has("starargs")) {
            openOrComma(parenOrComma, b);
            b.write("*");
            b.visit(node.requireNode("starargs"));
        }
        if (node.has("kwargs")) {
            openOrComma(parenOrComma, b);
            b.write("**");
            b.visit(node.requireNode("kwargs"));
        }
        finish(node, b, parenOrComma);
    }

    private static Separator header(Node node, PythonSourceBuilder b) {
        String name = node.requireString("name");
        b.decorators(node);
        b.newline(node);
        b.write("class " + name, node);
        return b.separator(", ");
    }

    private static void openOrComma(Separator parenOrComma, PythonSourceBuilder b) {
        if (!parenOrComma.hasItems()) {
            b.write("(");
        }
        parenOrComma.next();
    }

    private static void finish(Node node, PythonSourceBuilder b, Separator parenOrComma) {
        b.write(parenOrComma.hasItems() ? "):" : ":");
        b.body(node.getNodes("body"));
    }
}
