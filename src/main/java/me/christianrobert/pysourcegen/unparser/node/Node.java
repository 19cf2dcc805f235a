package me.christianrobert.pysourcegen.unparser.node;

import me.christianrobert.pysourcegen.unparser.context.MalformedNodeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable Python syntax tree node.
 *
 * <p>A node has a kind, a set of named fields restricted to {@link NodeKind#fields()}, and an
 * optional source line number. Field values are scalars ({@code String}, {@code Number},
 * {@code Boolean}, {@code byte[]}, {@link Operator}), child nodes, or lists of those.
 * List elements may be null (e.g. absent keyword-only defaults).</p>
 *
 * <p>Typed accessors raise {@link MalformedNodeException} when a field holds a value of the wrong
 * shape, and the {@code require*} variants also when a mandatory field is absent.</p>
 */
public final class Node {

    private final NodeKind kind;
    private final Map<String, Object> fields;
    private final Integer lineno;

    private Node(NodeKind kind, Map<String, Object> fields, Integer lineno) {
        this.kind = kind;
        this.fields = Collections.unmodifiableMap(fields);
        this.lineno = lineno;
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    /**
     * Creates a node without fields, e.g. {@code Pass} or {@code Ellipsis}.
     */
    public static Node of(NodeKind kind) {
        return new Builder(kind).build();
    }

    public NodeKind getKind() {
        return kind;
    }

    /**
     * @return the source line number, or null if the node carries none
     */
    public Integer getLineno() {
        return lineno;
    }

    public boolean hasLineno() {
        return lineno != null;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    /**
     * True if the field is present and not null.
     */
    public boolean has(String field) {
        return fields.get(field) != null;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public Object require(String field) {
        Object value = fields.get(field);
        if (value == null) {
            throw MalformedNodeException.missingField(kind, field);
        }
        return value;
    }

    // ========== CHILD NODES ==========

    public Node getNode(String field) {
        Object value = fields.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Node)) {
            throw MalformedNodeException.wrongShape(kind, field, "a node", value);
        }
        return (Node) value;
    }

    public Node requireNode(String field) {
        Node node = getNode(field);
        if (node == null) {
            throw MalformedNodeException.missingField(kind, field);
        }
        return node;
    }

    /**
     * @return the child nodes of a list field; an absent field reads as an empty list
     */
    public List<Node> getNodes(String field) {
        return listOf(field, Node.class, "a list of nodes");
    }

    // ========== SCALARS ==========

    public String getString(String field) {
        Object value = fields.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw MalformedNodeException.wrongShape(kind, field, "a string", value);
        }
        return (String) value;
    }

    public String requireString(String field) {
        String value = getString(field);
        if (value == null) {
            throw MalformedNodeException.missingField(kind, field);
        }
        return value;
    }

    public List<String> getStrings(String field) {
        return listOf(field, String.class, "a list of strings");
    }

    public Operator requireOperator(String field) {
        Object value = require(field);
        if (!(value instanceof Operator)) {
            throw MalformedNodeException.wrongShape(kind, field, "an operator", value);
        }
        return (Operator) value;
    }

    public List<Operator> getOperators(String field) {
        return listOf(field, Operator.class, "a list of operators");
    }

    public Number requireNumber(String field) {
        Object value = require(field);
        if (!(value instanceof Number)) {
            throw MalformedNodeException.wrongShape(kind, field, "a number", value);
        }
        return (Number) value;
    }

    /**
     * Reads an integer-like flag field, e.g. {@code ImportFrom.level} or {@code AnnAssign.simple}.
     * Booleans read as 0/1.
     */
    public int getInt(String field, int defaultValue) {
        Object value = fields.get(field);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (!(value instanceof Number)) {
            throw MalformedNodeException.wrongShape(kind, field, "an integer", value);
        }
        return ((Number) value).intValue();
    }

    public boolean getBoolean(String field, boolean defaultValue) {
        Object value = fields.get(field);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        if (!(value instanceof Boolean)) {
            throw MalformedNodeException.wrongShape(kind, field, "a boolean", value);
        }
        return (Boolean) value;
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> listOf(String field, Class<T> elementType, String expected) {
        Object value = fields.get(field);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw MalformedNodeException.wrongShape(kind, field, expected, value);
        }
        List<?> list = (List<?>) value;
        for (Object element : list) {
            if (element != null && !elementType.isInstance(element)) {
                throw MalformedNodeException.wrongShape(kind, field, expected, element);
            }
        }
        return (List<T>) list;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.getTypeName()).append("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (!(entry.getValue() instanceof Node) && !(entry.getValue() instanceof List)) {
                if (!first) {
                    sb.append(", ");
                }
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }
        if (lineno != null) {
            sb.append(first ? "" : ", ").append("lineno=").append(lineno);
        }
        return sb.append("}").toString();
    }

    /**
     * Builder validating field names against the node kind.
     */
    public static final class Builder {

        private final NodeKind kind;
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private Integer lineno;

        private Builder(NodeKind kind) {
            if (kind == null) {
                throw new IllegalArgumentException("Node kind cannot be null");
            }
            this.kind = kind;
        }

        public Builder field(String name, Object value) {
            if (!kind.hasField(name)) {
                throw new IllegalArgumentException(
                        "Node kind " + kind.getTypeName() + " has no field '" + name + "', expected one of " + kind.fields());
            }
            if (value instanceof List) {
                // copy so later changes to the caller's list do not leak into the tree
                fields.put(name, Collections.unmodifiableList(new ArrayList<>((List<?>) value)));
            } else {
                fields.put(name, value);
            }
            return this;
        }

        public Builder lineno(Integer lineno) {
            if (lineno != null && lineno < 0) {
                throw new IllegalArgumentException("Line number cannot be negative: " + lineno);
            }
            this.lineno = lineno;
            return this;
        }

        public Node build() {
            return new Node(kind, new LinkedHashMap<>(fields), lineno);
        }
    }
}
