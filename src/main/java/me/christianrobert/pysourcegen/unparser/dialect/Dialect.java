package me.christianrobert.pysourcegen.unparser.dialect;

import me.christianrobert.pysourcegen.unparser.context.UnsupportedNodeKindException;
import me.christianrobert.pysourcegen.unparser.context.UnsupportedOperatorException;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;
import me.christianrobert.pysourcegen.unparser.node.Operator;
import me.christianrobert.pysourcegen.unparser.symbols.OperatorFamily;
import me.christianrobert.pysourcegen.unparser.symbols.SymbolTables;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Fully resolved, immutable rule set of one Python version.
 *
 * <p>Instances are produced by {@link DialectChain#resolve(PythonVersion)}; they are safe to share
 * between threads and render calls.</p>
 */
public final class Dialect {

    private final PythonVersion version;
    private final Map<NodeKind, RenderRule> rules;
    private final SymbolTables symbols;

    Dialect(PythonVersion version, Map<NodeKind, RenderRule> rules, SymbolTables symbols) {
        this.version = version;
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
        this.symbols = symbols;
    }

    public PythonVersion getVersion() {
        return version;
    }

    public SymbolTables getSymbols() {
        return symbols;
    }

    public boolean supports(NodeKind kind) {
        return rules.containsKey(kind);
    }

    public Set<NodeKind> supportedKinds() {
        return rules.keySet();
    }

    /**
     * @throws UnsupportedNodeKindException if this dialect has no rule for the kind
     */
    public RenderRule ruleFor(NodeKind kind) {
        RenderRule rule = rules.get(kind);
        if (rule == null) {
            throw new UnsupportedNodeKindException(kind, version.label());
        }
        return rule;
    }

    /**
     * @throws UnsupportedOperatorException if the family's table has no token for the operator
     */
    public String token(OperatorFamily family, Operator operator) {
        String token = symbols.lookup(family, operator);
        if (token == null) {
            throw new UnsupportedOperatorException(operator, family, version.label());
        }
        return token;
    }

    @Override
    public String toString() {
        return "Dialect{python=" + version.label() + ", rules=" + rules.size() + "}";
    }
}
