package me.christianrobert.pysourcegen.unparser.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;
import me.christianrobert.pysourcegen.unparser.node.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads syntax trees from the JSON form produced by a Python {@code ast} dump.
 *
 * <p>Every object carries its type name under {@code _type}; all other members are fields of
 * that node kind. Example:</p>
 * <pre>
 * {"_type": "BinOp", "lineno": 1,
 *  "left":  {"_type": "Name", "id": "a", "ctx": {"_type": "Load"}},
 *  "op":    {"_type": "Add"},
 *  "right": {"_type": "Num", "n": 1}}
 * </pre>
 *
 * <p>Conversion rules:</p>
 * <ul>
 *   <li>Operator objects become {@link Operator} values</li>
 *   <li>Expression contexts (Load, Store, ...) become their name as a string</li>
 *   <li>Integral numbers become {@code Long} (or {@code BigInteger} when too large), others {@code Double}</li>
 *   <li>{@code {"_bytes": "..."}} becomes a {@code byte[]}, one byte per ISO-8859-1 character</li>
 *   <li>Column offsets and end positions are dropped; only {@code lineno} is kept</li>
 * </ul>
 */
@ApplicationScoped
public class NodeJsonReader {

    private static final Logger log = LoggerFactory.getLogger(NodeJsonReader.class);

    static final String TYPE = "_type";
    static final String BYTES = "_bytes";
    private static final String LINENO = "lineno";

    private static final Set<String> IGNORED = Set.of(
            "col_offset", "end_lineno", "end_col_offset", "type_comment");

    private static final Set<String> CONTEXTS = Set.of(
            "Load", "Store", "Del", "AugLoad", "AugStore", "Param");

    private final ObjectMapper objectMapper;

    public NodeJsonReader() {
        this(new ObjectMapper());
    }

    public NodeJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses JSON text into a tree.
     *
     * @throws IllegalArgumentException if the text is not valid JSON or does not describe a tree
     */
    public Node read(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new IllegalArgumentException("Tree JSON cannot be empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid tree JSON: " + e.getOriginalMessage(), e);
        }
        return read(root);
    }

    /**
     * Converts an already parsed JSON document into a tree.
     *
     * @throws IllegalArgumentException if the root is not a node object
     */
    public Node read(JsonNode root) {
        Object value = convert(root, "$");
        if (!(value instanceof Node)) {
            throw new IllegalArgumentException("Tree JSON root must be a node object with '" + TYPE + "'");
        }
        Node node = (Node) value;
        log.debug("Read {} tree from JSON", node.getKind().getTypeName());
        return node;
    }

    private Object convert(JsonNode json, String path) {
        if (json == null || json.isNull()) {
            return null;
        }
        if (json.isObject()) {
            return convertObject(json, path);
        }
        if (json.isArray()) {
            List<Object> list = new ArrayList<>(json.size());
            for (int i = 0; i < json.size(); i++) {
                list.add(convert(json.get(i), path + "[" + i + "]"));
            }
            return list;
        }
        if (json.isBoolean()) {
            return json.booleanValue();
        }
        if (json.isIntegralNumber()) {
            return json.canConvertToLong() ? (Object) json.longValue() : json.bigIntegerValue();
        }
        if (json.isNumber()) {
            return json.doubleValue();
        }
        if (json.isTextual()) {
            return json.textValue();
        }
        throw new IllegalArgumentException("Unsupported JSON value at " + path + ": " + json.getNodeType());
    }

    private Object convertObject(JsonNode json, String path) {
        if (json.has(BYTES)) {
            return json.get(BYTES).asText().getBytes(StandardCharsets.ISO_8859_1);
        }
        JsonNode typeNode = json.get(TYPE);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new IllegalArgumentException("Object at " + path + " has no '" + TYPE + "' member");
        }
        String typeName = typeNode.textValue();

        Operator operator = Operator.fromTypeName(typeName);
        if (operator != null) {
            return operator;
        }
        if (CONTEXTS.contains(typeName)) {
            return typeName;
        }
        NodeKind kind = NodeKind.fromTypeName(typeName);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown node type '" + typeName + "' at " + path);
        }

        Node.Builder builder = Node.builder(kind);
        Iterator<Map.Entry<String, JsonNode>> members = json.fields();
        while (members.hasNext()) {
            Map.Entry<String, JsonNode> member = members.next();
            String name = member.getKey();
            if (TYPE.equals(name) || IGNORED.contains(name)) {
                continue;
            }
            if (LINENO.equals(name)) {
                if (member.getValue().isIntegralNumber()) {
                    builder.lineno(member.getValue().intValue());
                }
                continue;
            }
            builder.field(name, convert(member.getValue(), path + "." + name));
        }
        return builder.build();
    }
}
