package me.christianrobert.pysourcegen.unparser.dialect;

import me.christianrobert.pysourcegen.unparser.builder.PythonSourceBuilder;
import me.christianrobert.pysourcegen.unparser.context.UnsupportedNodeKindException;
import me.christianrobert.pysourcegen.unparser.context.UnsupportedOperatorException;
import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;
import me.christianrobert.pysourcegen.unparser.node.Operator;
import me.christianrobert.pysourcegen.unparser.symbols.OperatorFamily;
import me.christianrobert.pysourcegen.unparser.symbols.SymbolTables;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DialectChain folding with small hand-made rule sets.
 */
class DialectChainTest {

    private static final Node PASS = Node.of(NodeKind.PASS);
    private static final Node BREAK = Node.of(NodeKind.BREAK);

    private static Map<NodeKind, RenderRule> baseRules() {
        Map<NodeKind, RenderRule> rules = new EnumMap<>(NodeKind.class);
        rules.put(NodeKind.PASS, (node, b) -> b.write("base-pass"));
        return rules;
    }

    private static String render(Dialect dialect, Node node) {
        return new PythonSourceBuilder(dialect, "    ").build(node);
    }

    @Test
    void laterDeltaOverridesEarlierRule() {
        DialectChain chain = DialectChain.builder(baseRules(), SymbolTables.base())
                .version(PythonVersion.PY26, DialectDelta.empty())
                .version(PythonVersion.PY27, DialectDelta.builder()
                        .rule(NodeKind.PASS, (node, b) -> b.write("pass-27"))
                        .build())
                .version(PythonVersion.PY30, DialectDelta.builder()
                        .rule(NodeKind.PASS, (node, b) -> b.write("pass-30"))
                        .build())
                .build();

        assertEquals("base-pass", render(chain.resolve(PythonVersion.PY26), PASS));
        assertEquals("pass-27", render(chain.resolve(PythonVersion.PY27), PASS));
        assertEquals("pass-30", render(chain.resolve(PythonVersion.PY30), PASS));
    }

    @Test
    void kindAddedLaterIsUnsupportedBefore() {
        DialectChain chain = DialectChain.builder(baseRules(), SymbolTables.base())
                .version(PythonVersion.PY26, DialectDelta.empty())
                .version(PythonVersion.PY27, DialectDelta.builder()
                        .rule(NodeKind.BREAK, (node, b) -> b.write("break"))
                        .build())
                .build();

        assertThrows(UnsupportedNodeKindException.class, () -> render(chain.resolve(PythonVersion.PY26), BREAK));
        assertEquals("break", render(chain.resolve(PythonVersion.PY27), BREAK));
        assertFalse(chain.resolve(PythonVersion.PY26).supports(NodeKind.BREAK));
    }

    @Test
    void operatorAddedLaterIsUnsupportedBefore() {
        DialectChain chain = DialectChain.builder(baseRules(), SymbolTables.base())
                .version(PythonVersion.PY34, DialectDelta.empty())
                .version(PythonVersion.PY35, DialectDelta.builder()
                        .operator(OperatorFamily.BINARY, Operator.MAT_MULT, "@")
                        .build())
                .build();

        Dialect py34 = chain.resolve(PythonVersion.PY34);
        UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class,
                () -> py34.token(OperatorFamily.BINARY, Operator.MAT_MULT));
        assertEquals(Operator.MAT_MULT, e.getOperator());
        assertEquals(OperatorFamily.BINARY, e.getFamily());
        assertEquals("@", chain.resolve(PythonVersion.PY35).token(OperatorFamily.BINARY, Operator.MAT_MULT));
    }

    @Test
    void versionsMustBeAddedInOrder() {
        DialectChain.Builder builder = DialectChain.builder(baseRules(), SymbolTables.base())
                .version(PythonVersion.PY30, DialectDelta.empty());

        assertThrows(IllegalArgumentException.class, () -> builder.version(PythonVersion.PY27, DialectDelta.empty()));
        assertThrows(IllegalArgumentException.class, () -> builder.version(PythonVersion.PY30, DialectDelta.empty()));
    }

    @Test
    void emptyChainIsRejected() {
        assertThrows(IllegalStateException.class,
                () -> DialectChain.builder(baseRules(), SymbolTables.base()).build());
    }

    @Test
    void versionOutsideChainIsRejected() {
        DialectChain chain = DialectChain.builder(baseRules(), SymbolTables.base())
                .version(PythonVersion.PY26, DialectDelta.empty())
                .build();

        assertThrows(IllegalArgumentException.class, () -> chain.resolve(PythonVersion.PY36));
        assertEquals(List.of(PythonVersion.PY26), chain.versions());
    }

    @Test
    void duplicateRuleInOneDeltaIsRejected() {
        DialectDelta.Builder delta = DialectDelta.builder().rule(NodeKind.PASS, (node, b) -> b.write("a"));

        assertThrows(IllegalStateException.class, () -> delta.rule(NodeKind.PASS, (node, b) -> b.write("b")));
    }

    @Test
    void resolvedDialectIsNotAffectedByLaterChanges() {
        Map<NodeKind, RenderRule> rules = baseRules();
        DialectChain chain = DialectChain.builder(rules, SymbolTables.base())
                .version(PythonVersion.PY26, DialectDelta.empty())
                .build();

        rules.put(NodeKind.BREAK, (node, b) -> b.write("break"));

        assertFalse(chain.resolve(PythonVersion.PY26).supports(NodeKind.BREAK));
        assertThrows(UnsupportedOperationException.class,
                () -> chain.resolve(PythonVersion.PY26).supportedKinds().add(NodeKind.BREAK));
    }
}
