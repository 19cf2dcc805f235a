package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for visiting calls and keyword arguments.
 *
 * <h3>Argument order up to Python 3.4:</h3>
 * <pre>
 * f(positional..., name=value..., *starargs, **kwargs)
 * </pre>
 *
 * <h3>Argument order from Python 3.5:</h3>
 * <pre>
 * f(positional..., name=value..., *spread..., **spread...)
 * </pre>
 * <p>In 3.5 trees spreads live in {@code args} (as {@code Starred}) and {@code keywords}
 * (keywords without a name); they are deferred to the end of the argument list.</p>
 */
public class VisitCall {

    public static void v(Node node, PythonSourceBuilder b) {
        b.visit(node.requireNode("func"));
        b.write("(");

        Separator comma = b.separator(", ");
        for (Node arg : node.getNodes("args")) {
            comma.next();
            b.visit(arg);
        }
        for (Node keyword : node.getNodes("keywords")) {
            comma.next();
            b.visit(keyword);
        }
        if (node.has("starargs")) {
            comma.next();
            b.write("*");
            b.visit(node.requireNode("starargs"));
        }
        if (node.has("kwargs")) {
            comma.next();
            b.write("**");
            b.visit(node.requireNode("kwargs"));
        }

        b.write(")");
    }

    /**
     * Python 3.5 ordering: explicit positionals, named keywords, starred spreads, keyword spreads.
     */
    public static void vDeferredSpreads(Node node, PythonSourceBuilder b) {
        // 3.5 trees carry spreads in args and keywords only
        if (node.has("starargs")) {
            throw b.unsupportedConstruct(node, "starargs", "Call starargs field");
        }
        if (node.has("kwargs")) {
            throw b.unsupportedConstruct(node, "kwargs", "Call kwargs field");
        }

        b.visit(node.requireNode("func"));
        b.write("(");

        Separator comma = b.separator(", ");
        List<Node> starArgs = new ArrayList<>();
        List<Node> keywordSpreads = new ArrayList<>();

        for (Node arg : node.getNodes("args")) {
            if (arg.getKind() == NodeKind.STARRED) {
                starArgs.add(arg);
            } else {
                comma.next();
                b.visit(arg);
            }
        }
        for (Node keyword : node.getNodes("keywords")) {
            if (keyword.has("arg")) {
                comma.next();
                b.visit(keyword);
            } else {
                keywordSpreads.add(keyword);
            }
        }
        for (Node starArg : starArgs) {
            comma.next();
            b.visit(starArg);
        }
        for (Node keywordSpread : keywordSpreads) {
            comma.next();
            b.visit(keywordSpread);
        }

        b.write(")");
    }

    /**
     * {@code name=value}, or {@code **value} for a keyword without a name.
     */
    public static void vKeyword(Node node, PythonSourceBuilder b) {
        if (node.has("arg")) {
            b.write(node.getString("arg") + "=");
        } else {
            b.write("**");
        }
        b.visit(node.requireNode("value"));
    }
}
