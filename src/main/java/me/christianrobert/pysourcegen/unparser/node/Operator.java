package me.christianrobert.pysourcegen.unparser.node;

import java.util.HashMap;
import java.util.Map;

/**
 * Operator kinds of the Python grammar.
 *
 * <p>The operator family (boolean, binary, comparison, unary) a node uses is decided by the
 * node kind holding it, not by the operator. Which token an operator renders as is looked up
 * in the dialect's symbol tables.</p>
 */
public enum Operator {

    // boolean
    AND("And"),
    OR("Or"),

    // binary
    ADD("Add"),
    SUB("Sub"),
    MULT("Mult"),
    MAT_MULT("MatMult"),
    DIV("Div"),
    FLOOR_DIV("FloorDiv"),
    MOD("Mod"),
    POW("Pow"),
    L_SHIFT("LShift"),
    R_SHIFT("RShift"),
    BIT_OR("BitOr"),
    BIT_AND("BitAnd"),
    BIT_XOR("BitXor"),

    // comparison
    EQ("Eq"),
    NOT_EQ("NotEq"),
    LT("Lt"),
    LT_E("LtE"),
    GT("Gt"),
    GT_E("GtE"),
    IS("Is"),
    IS_NOT("IsNot"),
    IN("In"),
    NOT_IN("NotIn"),

    // unary
    INVERT("Invert"),
    NOT("Not"),
    U_ADD("UAdd"),
    U_SUB("USub");

    private static final Map<String, Operator> BY_TYPE_NAME = new HashMap<>();

    static {
        for (Operator op : values()) {
            BY_TYPE_NAME.put(op.typeName, op);
        }
    }

    private final String typeName;

    Operator(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    /**
     * @return the operator for an {@code ast} class name such as "Add", or null if unknown
     */
    public static Operator fromTypeName(String typeName) {
        return BY_TYPE_NAME.get(typeName);
    }

    @Override
    public String toString() {
        return typeName;
    }
}
