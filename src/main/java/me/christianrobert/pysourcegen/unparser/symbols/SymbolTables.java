package me.christianrobert.pysourcegen.unparser.symbols;

import me.christianrobert.pysourcegen.unparser.node.Operator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable operator → token tables for the four operator families.
 *
 * <p>Tables may be subsets of the operator enumeration: a dialect only knows the operators of
 * its grammar version. A missing entry is reported by the caller at render time.</p>
 *
 * <p>{@link #base()} holds the Python 2.6 operators; later dialects extend it through
 * {@link #extend(OperatorFamily, Map)}.</p>
 */
public final class SymbolTables {

    private static final SymbolTables BASE = createBase();

    private final Map<OperatorFamily, Map<Operator, String>> tables;

    private SymbolTables(Map<OperatorFamily, Map<Operator, String>> tables) {
        this.tables = tables;
    }

    public static SymbolTables base() {
        return BASE;
    }

    private static SymbolTables createBase() {
        Map<OperatorFamily, Map<Operator, String>> tables = new EnumMap<>(OperatorFamily.class);

        Map<Operator, String> bool = new EnumMap<>(Operator.class);
        bool.put(Operator.AND, "and");
        bool.put(Operator.OR, "or");
        tables.put(OperatorFamily.BOOLEAN, Collections.unmodifiableMap(bool));

        Map<Operator, String> binary = new EnumMap<>(Operator.class);
        binary.put(Operator.ADD, "+");
        binary.put(Operator.SUB, "-");
        binary.put(Operator.MULT, "*");
        binary.put(Operator.DIV, "/");
        binary.put(Operator.FLOOR_DIV, "//");
        binary.put(Operator.MOD, "%");
        binary.put(Operator.L_SHIFT, "<<");
        binary.put(Operator.R_SHIFT, ">>");
        binary.put(Operator.BIT_OR, "|");
        binary.put(Operator.BIT_AND, "&");
        binary.put(Operator.BIT_XOR, "^");
        binary.put(Operator.POW, "**");
        tables.put(OperatorFamily.BINARY, Collections.unmodifiableMap(binary));

        Map<Operator, String> comparison = new EnumMap<>(Operator.class);
        comparison.put(Operator.EQ, "==");
        comparison.put(Operator.GT, ">");
        comparison.put(Operator.GT_E, ">=");
        comparison.put(Operator.IN, "in");
        comparison.put(Operator.IS, "is");
        comparison.put(Operator.IS_NOT, "is not");
        comparison.put(Operator.LT, "<");
        comparison.put(Operator.LT_E, "<=");
        comparison.put(Operator.NOT_EQ, "!=");
        comparison.put(Operator.NOT_IN, "not in");
        tables.put(OperatorFamily.COMPARISON, Collections.unmodifiableMap(comparison));

        Map<Operator, String> unary = new EnumMap<>(Operator.class);
        unary.put(Operator.INVERT, "~");
        unary.put(Operator.NOT, "not");
        unary.put(Operator.U_ADD, "+");
        unary.put(Operator.U_SUB, "-");
        tables.put(OperatorFamily.UNARY, Collections.unmodifiableMap(unary));

        return new SymbolTables(Collections.unmodifiableMap(tables));
    }

    /**
     * Returns a new instance with the given entries added to (or replacing entries of) one family.
     * This instance is left unchanged.
     */
    public SymbolTables extend(OperatorFamily family, Map<Operator, String> additions) {
        if (additions.isEmpty()) {
            return this;
        }
        Map<OperatorFamily, Map<Operator, String>> copy = new EnumMap<>(tables);
        Map<Operator, String> merged = new EnumMap<>(Operator.class);
        merged.putAll(tables.get(family));
        merged.putAll(additions);
        copy.put(family, Collections.unmodifiableMap(merged));
        return new SymbolTables(Collections.unmodifiableMap(copy));
    }

    /**
     * @return the token for the operator, or null if the family's table has no entry
     */
    public String lookup(OperatorFamily family, Operator operator) {
        return tables.get(family).get(operator);
    }

    public boolean contains(OperatorFamily family, Operator operator) {
        return tables.get(family).containsKey(operator);
    }

    public Map<Operator, String> table(OperatorFamily family) {
        return tables.get(family);
    }
}
