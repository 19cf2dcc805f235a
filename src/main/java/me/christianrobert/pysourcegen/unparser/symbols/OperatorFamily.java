package me.christianrobert.pysourcegen.unparser.symbols;

/**
 * The four operator families, each with its own symbol table.
 */
public enum OperatorFamily {
    BOOLEAN("boolean"),
    BINARY("binary"),
    COMPARISON("comparison"),
    UNARY("unary");

    private final String label;

    OperatorFamily(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
