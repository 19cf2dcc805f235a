package me.christianrobert.pysourcegen.unparser.context;

import me.christianrobert.pysourcegen.unparser.node.Operator;
import me.christianrobert.pysourcegen.unparser.symbols.OperatorFamily;

/**
 * An operator kind is absent from the symbol table of the family being rendered.
 */
public class UnsupportedOperatorException extends UnparseException {

    private final Operator operator;
    private final OperatorFamily family;

    public UnsupportedOperatorException(Operator operator, OperatorFamily family, String dialect) {
        super("Operator " + operator + " has no " + family.getLabel() + " token in Python " + dialect,
                null, dialect);
        this.operator = operator;
        this.family = family;
    }

    public Operator getOperator() {
        return operator;
    }

    public OperatorFamily getFamily() {
        return family;
    }

    @Override
    public String getErrorKind() {
        return "UnsupportedOperator";
    }
}
