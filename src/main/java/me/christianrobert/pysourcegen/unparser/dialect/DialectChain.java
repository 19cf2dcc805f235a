package me.christianrobert.pysourcegen.unparser.dialect;

import me.christianrobert.pysourcegen.unparser.node.NodeKind;
import me.christianrobert.pysourcegen.unparser.node.Operator;
import me.christianrobert.pysourcegen.unparser.symbols.OperatorFamily;
import me.christianrobert.pysourcegen.unparser.symbols.SymbolTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered chain of Python versions, each defined as a delta over its predecessor.
 *
 * <p>The effective rule set of a version is the base rule set folded with every delta from the
 * first version of the chain up to and including that version; a later delta replaces an earlier
 * rule for the same node kind. All versions are resolved once, when the chain is built, so that
 * selecting a dialect is a map lookup.</p>
 *
 * <pre>
 * base rules ─▶ Δ2.6 ─▶ Δ2.7 ─▶ Δ3.0 ─▶ ... ─▶ Δ3.6
 *                 │       │       │              │
 *               2.6     2.7     3.0            3.6    (resolved dialects)
 * </pre>
 */
public final class DialectChain {

    private static final Logger log = LoggerFactory.getLogger(DialectChain.class);

    private final Map<PythonVersion, Dialect> resolved;

    private DialectChain(Map<PythonVersion, Dialect> resolved) {
        this.resolved = Collections.unmodifiableMap(resolved);
    }

    public static Builder builder(Map<NodeKind, RenderRule> baseRules, SymbolTables baseSymbols) {
        return new Builder(baseRules, baseSymbols);
    }

    /**
     * Returns the resolved dialect of a version.
     *
     * @throws IllegalArgumentException if the version is not part of this chain
     */
    public Dialect resolve(PythonVersion version) {
        Dialect dialect = resolved.get(version);
        if (dialect == null) {
            throw new IllegalArgumentException("Python " + version + " is not part of this dialect chain");
        }
        return dialect;
    }

    public List<PythonVersion> versions() {
        return new ArrayList<>(resolved.keySet());
    }

    public static final class Builder {

        private final Map<NodeKind, RenderRule> baseRules;
        private final SymbolTables baseSymbols;
        private final Map<PythonVersion, DialectDelta> deltas = new LinkedHashMap<>();
        private PythonVersion last;

        private Builder(Map<NodeKind, RenderRule> baseRules, SymbolTables baseSymbols) {
            this.baseRules = new EnumMap<>(baseRules);
            this.baseSymbols = baseSymbols;
        }

        /**
         * Appends a version to the chain. Versions must be added oldest first.
         */
        public Builder version(PythonVersion version, DialectDelta delta) {
            if (last != null && version.compareTo(last) <= 0) {
                throw new IllegalArgumentException(
                        "Python " + version + " must come after Python " + last + " in the dialect chain");
            }
            deltas.put(version, delta);
            last = version;
            return this;
        }

        public DialectChain build() {
            if (deltas.isEmpty()) {
                throw new IllegalStateException("A dialect chain needs at least one version");
            }
            Map<NodeKind, RenderRule> rules = new EnumMap<>(baseRules);
            SymbolTables symbols = baseSymbols;
            Map<PythonVersion, Dialect> resolved = new EnumMap<>(PythonVersion.class);

            for (Map.Entry<PythonVersion, DialectDelta> entry : deltas.entrySet()) {
                DialectDelta delta = entry.getValue();
                rules.putAll(delta.getRules());
                for (Map.Entry<OperatorFamily, Map<Operator, String>> ops : delta.getOperators().entrySet()) {
                    symbols = symbols.extend(ops.getKey(), ops.getValue());
                }
                resolved.put(entry.getKey(), new Dialect(entry.getKey(), rules, symbols));
                log.debug("Resolved Python {} dialect: {} rules ({} from its delta)",
                        entry.getKey(), rules.size(), delta.getRules().size());
            }
            return new DialectChain(resolved);
        }
    }
}
