package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.context.MalformedNodeException;
import me.christianrobert.pysourcegen.unparser.node.Node;

import java.util.List;

/**
 * Static helper for visiting parameter lists ({@code arguments} nodes) of functions and lambdas.
 *
 * <p>Given N positional parameters and D trailing defaults, the first N-D parameters render bare
 * and the last D as {@code name=default}. The variadic positional parameter follows with one
 * {@code *}, then (Python 3) keyword-only parameters, then the variadic keyword parameter with
 * {@code **}. Commas are written by a one-shot separator so absent parts never leave a stray
 * comma; an empty list renders nothing.</p>
 *
 * <h3>Field shapes per version:</h3>
 * <ul>
 *   <li>2.x: {@code args} are expression nodes (usually {@code Name}), {@code vararg}/{@code kwarg} are identifiers</li>
 *   <li>3.0 to 3.3: {@code args} and {@code kwonlyargs} are {@code arg} nodes, {@code vararg}/{@code kwarg} identifiers</li>
 *   <li>3.4+: {@code vararg}/{@code kwarg} are {@code arg} nodes too</li>
 * </ul>
 *
 * <p>Fields from another version's shape are rejected, never skipped.</p>
 */
public class VisitArguments {

    /**
     * Python 2 parameter list.
     */
    public static void v(Node node, PythonSourceBuilder b) {
        if (!node.getNodes("kwonlyargs").isEmpty() || !node.getNodes("kw_defaults").isEmpty()) {
            throw b.unsupportedConstruct(node, "kwonlyargs", "Keyword-only parameter");
        }
        rejectAnnotationField(node, "varargannotation", b);
        rejectAnnotationField(node, "kwargannotation", b);

        Separator comma = b.separator(", ");
        positional(node, b, comma);
        identifierParameter(node, "vararg", "*", b, comma);
        identifierParameter(node, "kwarg", "**", b, comma);
    }

    /**
     * Python 3.0 parameter list with keyword-only parameters. Up to 3.3 the variadic parameters
     * are identifiers whose annotations sit in separate fields.
     */
    public static void vKeywordOnly(Node node, PythonSourceBuilder b) {
        Separator comma = b.separator(", ");
        positional(node, b, comma);
        identifierParameter(node, "vararg", "*", b, comma);
        annotation(node, "vararg", "varargannotation", b);
        keywordOnly(node, b, comma);
        identifierParameter(node, "kwarg", "**", b, comma);
        annotation(node, "kwarg", "kwargannotation", b);
    }

    /**
     * Python 3.4 parameter list: variadic parameters are {@code arg} nodes and may be annotated.
     */
    public static void vArgNodes(Node node, PythonSourceBuilder b) {
        // annotations live on the vararg and kwarg nodes now
        rejectAnnotationField(node, "varargannotation", b);
        rejectAnnotationField(node, "kwargannotation", b);

        Separator comma = b.separator(", ");
        positional(node, b, comma);
        nodeParameter(node, "vararg", "*", b, comma);
        keywordOnly(node, b, comma);
        nodeParameter(node, "kwarg", "**", b, comma);
    }

    private static void positional(Node node, PythonSourceBuilder b, Separator comma) {
        List<Node> args = node.getNodes("args");
        List<Node> defaults = node.getNodes("defaults");
        if (defaults.size() > args.size()) {
            throw new MalformedNodeException(
                    "arguments has " + defaults.size() + " defaults for " + args.size() + " positional parameters",
                    node.getKind(), "defaults", b.getVersion().label());
        }

        // defaults pair with the tail of the parameter list
        int firstDefault = args.size() - defaults.size();
        for (int i = 0; i < args.size(); i++) {
            comma.next();
            b.visit(args.get(i));
            if (i >= firstDefault) {
                b.write("=");
                b.visit(defaults.get(i - firstDefault));
            }
        }
    }

    private static void keywordOnly(Node node, PythonSourceBuilder b, Separator comma) {
        List<Node> kwonlyargs = node.getNodes("kwonlyargs");
        if (kwonlyargs.isEmpty()) {
            return;
        }
        List<Node> kwDefaults = node.getNodes("kw_defaults");
        if (!kwDefaults.isEmpty() && kwDefaults.size() != kwonlyargs.size()) {
            throw new MalformedNodeException(
                    "arguments has " + kwDefaults.size() + " kw_defaults for " + kwonlyargs.size() + " keyword-only parameters",
                    node.getKind(), "kw_defaults", b.getVersion().label());
        }

        // a bare star separates keyword-only parameters when there is no *args
        if (!node.has("vararg")) {
            comma.next();
            b.write("*");
        }
        for (int i = 0; i < kwonlyargs.size(); i++) {
            comma.next();
            b.visit(kwonlyargs.get(i));
            Node defaultValue = kwDefaults.isEmpty() ? null : kwDefaults.get(i);
            if (defaultValue != null) {
                b.write("=");
                b.visit(defaultValue);
            }
        }
    }

    private static void identifierParameter(Node node, String field, String marker,
                                            PythonSourceBuilder b, Separator comma) {
        if (node.has(field)) {
            comma.next();
            b.write(marker + node.getString(field));
        }
    }

    private static void annotation(Node node, String parameterField, String annotationField,
                                   PythonSourceBuilder b) {
        if (!node.has(annotationField)) {
            return;
        }
        if (!node.has(parameterField)) {
            throw new MalformedNodeException(annotationField + " without " + parameterField,
                    node.getKind(), annotationField, b.getVersion().label());
        }
        b.write(": ");
        b.visit(node.requireNode(annotationField));
    }

    private static void rejectAnnotationField(Node node, String annotationField, PythonSourceBuilder b) {
        if (node.has(annotationField)) {
            throw b.unsupportedConstruct(node, annotationField, "Field " + annotationField);
        }
    }

    private static void nodeParameter(Node node, String field, String marker,
                                      PythonSourceBuilder b, Separator comma) {
        if (node.has(field)) {
            comma.next();
            b.write(marker);
            b.visit(node.requireNode(field));
        }
    }
}
