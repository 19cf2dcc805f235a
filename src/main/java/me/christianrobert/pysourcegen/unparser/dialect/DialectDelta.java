package me.christianrobert.pysourcegen.unparser.dialect;

import me.christianrobert.pysourcegen.unparser.node.NodeKind;
import me.christianrobert.pysourcegen.unparser.node.Operator;
import me.christianrobert.pysourcegen.unparser.symbols.OperatorFamily;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The syntax changes one Python version makes over its predecessor: rules added or replaced
 * per node kind, and operator tokens added per family.
 */
public final class DialectDelta {

    private static final DialectDelta EMPTY = builder().build();

    private final Map<NodeKind, RenderRule> rules;
    private final Map<OperatorFamily, Map<Operator, String>> operators;

    private DialectDelta(Map<NodeKind, RenderRule> rules, Map<OperatorFamily, Map<Operator, String>> operators) {
        this.rules = Collections.unmodifiableMap(rules);
        this.operators = Collections.unmodifiableMap(operators);
    }

    public static DialectDelta empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<NodeKind, RenderRule> getRules() {
        return rules;
    }

    public Map<OperatorFamily, Map<Operator, String>> getOperators() {
        return operators;
    }

    public boolean isEmpty() {
        return rules.isEmpty() && operators.isEmpty();
    }

    public static final class Builder {

        private final Map<NodeKind, RenderRule> rules = new EnumMap<>(NodeKind.class);
        private final Map<OperatorFamily, Map<Operator, String>> operators = new EnumMap<>(OperatorFamily.class);

        private Builder() {
        }

        public Builder rule(NodeKind kind, RenderRule rule) {
            if (rules.containsKey(kind)) {
                throw new IllegalStateException("Rule for " + kind + " is already defined in this delta");
            }
            rules.put(kind, rule);
            return this;
        }

        public Builder operator(OperatorFamily family, Operator operator, String token) {
            operators.computeIfAbsent(family, f -> new EnumMap<>(Operator.class)).put(operator, token);
            return this;
        }

        public DialectDelta build() {
            Map<OperatorFamily, Map<Operator, String>> frozen = new EnumMap<>(OperatorFamily.class);
            operators.forEach((family, table) -> frozen.put(family, Collections.unmodifiableMap(new EnumMap<>(table))));
            return new DialectDelta(new EnumMap<>(rules), frozen);
        }
    }
}
