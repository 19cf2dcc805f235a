package me.christianrobert.pysourcegen.unparser.context;

import me.christianrobert.pysourcegen.unparser.node.NodeKind;

/**
 * A node is missing a field its kind mandates, holds a field value of the wrong shape,
 * or uses a construct the active dialect cannot express for its kind.
 */
public class MalformedNodeException extends UnparseException {

    private final String field;

    public MalformedNodeException(String message, NodeKind nodeKind, String field) {
        super(message, nodeKind, null);
        this.field = field;
    }

    public MalformedNodeException(String message, NodeKind nodeKind, String field, String dialect) {
        super(message, nodeKind, dialect);
        this.field = field;
    }

    /**
     * @return the offending field name, or null if the problem is not tied to one field
     */
    public String getField() {
        return field;
    }

    @Override
    public String getErrorKind() {
        return "MalformedNode";
    }

    @Override
    public String getDetailedMessage() {
        String detailed = super.getDetailedMessage();
        if (field != null) {
            detailed += "\nField: " + field;
        }
        return detailed;
    }

    public static MalformedNodeException missingField(NodeKind kind, String field) {
        return new MalformedNodeException(kind.getTypeName() + " is missing mandatory field '" + field + "'",
                kind, field);
    }

    public static MalformedNodeException wrongShape(NodeKind kind, String field, String expected, Object actual) {
        String actualType = actual == null ? "null" : actual.getClass().getSimpleName();
        return new MalformedNodeException(kind.getTypeName() + "." + field + " must be " + expected
                + " but was " + actualType, kind, field);
    }
}
