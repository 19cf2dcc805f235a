package me.christianrobert.pysourcegen.unparser.context;

import me.christianrobert.pysourcegen.unparser.node.NodeKind;

/**
 * The active dialect has no rendering rule for a visited node's kind.
 */
public class UnsupportedNodeKindException extends UnparseException {

    public UnsupportedNodeKindException(NodeKind nodeKind, String dialect) {
        super("Node kind " + nodeKind.getTypeName() + " is not supported by Python " + dialect,
                nodeKind, dialect);
    }

    @Override
    public String getErrorKind() {
        return "UnsupportedNodeKind";
    }
}
