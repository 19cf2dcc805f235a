package me.christianrobert.pysourcegen.unparser.context;

import me.christianrobert.pysourcegen.unparser.node.NodeKind;

/**
 * Exception thrown when a syntax tree cannot be rendered to source.
 * Captures the node kind and dialect involved in the failure.
 *
 * <p>Rendering is a pure function of tree, dialect and options, so every subclass is fatal for
 * the current render; there is no partial output.</p>
 */
public class UnparseException extends RuntimeException {

    private final NodeKind nodeKind;
    private final String dialect;

    public UnparseException(String message) {
        this(message, null, null);
    }

    public UnparseException(String message, NodeKind nodeKind, String dialect) {
        super(message);
        this.nodeKind = nodeKind;
        this.dialect = dialect;
    }

    public NodeKind getNodeKind() {
        return nodeKind;
    }

    public String getDialect() {
        return dialect;
    }

    /**
     * Short name of the error kind, e.g. "UnsupportedNodeKind".
     */
    public String getErrorKind() {
        return "UnparseError";
    }

    /**
     * Gets a detailed error message including node kind and dialect.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getErrorKind()).append(": ").append(getMessage());
        if (nodeKind != null) {
            sb.append("\nNode kind: ").append(nodeKind.getTypeName());
        }
        if (dialect != null) {
            sb.append("\nDialect: Python ").append(dialect);
        }
        return sb.toString();
    }
}
