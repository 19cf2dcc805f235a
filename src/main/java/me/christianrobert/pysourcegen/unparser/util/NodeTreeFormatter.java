package me.christianrobert.pysourcegen.unparser.util;

import me.christianrobert.pysourcegen.unparser.node.Node;

import java.util.List;
import java.util.Map;

/**
 * Formats syntax trees into human-readable, indented text representation.
 *
 * <p>Useful for debugging and understanding what a tree dump actually contains.</p>
 *
 * <p>Example output:</p>
 * <pre>
 * Module
 *   body:
 *     FunctionDef [line 1] name='f'
 *       args:
 *         arguments
 *           args:
 *             Name [line 1] id='a' ctx='Param'
 *       body:
 *         Return [line 2]
 *           value:
 *             Name [line 2] id='a' ctx='Load'
 * </pre>
 */
public class NodeTreeFormatter {

    private static final String INDENT = "  ";
    private static final int MAX_TEXT_LENGTH = 50;

    /**
     * Formats a tree into human-readable text.
     *
     * @param tree Root of the tree
     * @return Formatted string representation
     */
    public static String format(Node tree) {
        if (tree == null) {
            return "(null tree)";
        }
        StringBuilder sb = new StringBuilder();
        formatNode(tree, 0, sb);
        return sb.toString();
    }

    private static void formatNode(Node node, int depth, StringBuilder sb) {
        indent(depth, sb);
        sb.append(node.getKind().getTypeName());
        if (node.hasLineno()) {
            sb.append(" [line ").append(node.getLineno()).append("]");
        }

        // scalars inline, children below
        for (Map.Entry<String, Object> field : node.getFields().entrySet()) {
            Object value = field.getValue();
            if (!(value instanceof Node) && !(value instanceof List) && value != null) {
                sb.append(" ").append(field.getKey()).append("=").append(scalar(value));
            }
        }
        sb.append("\n");

        for (Map.Entry<String, Object> field : node.getFields().entrySet()) {
            Object value = field.getValue();
            if (value instanceof Node) {
                indent(depth + 1, sb);
                sb.append(field.getKey()).append(":\n");
                formatNode((Node) value, depth + 2, sb);
            } else if (value instanceof List && !((List<?>) value).isEmpty()) {
                indent(depth + 1, sb);
                sb.append(field.getKey()).append(":\n");
                for (Object element : (List<?>) value) {
                    if (element instanceof Node) {
                        formatNode((Node) element, depth + 2, sb);
                    } else {
                        indent(depth + 2, sb);
                        sb.append(element == null ? "None" : scalar(element)).append("\n");
                    }
                }
            }
        }
    }

    private static String scalar(Object value) {
        if (value instanceof String) {
            return "'" + escapeAndTruncate((String) value) + "'";
        }
        if (value instanceof byte[]) {
            return escapeAndTruncate(PythonLiterals.bytes((byte[]) value));
        }
        return String.valueOf(value);
    }

    private static void indent(int depth, StringBuilder sb) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
    }

    /**
     * Escapes and truncates text for display.
     */
    private static String escapeAndTruncate(String text) {
        text = text.replace("\n", "\\n")
                   .replace("\r", "\\r")
                   .replace("\t", "\\t");

        if (text.length() > MAX_TEXT_LENGTH) {
            text = text.substring(0, MAX_TEXT_LENGTH) + "...";
        }
        return text;
    }
}
