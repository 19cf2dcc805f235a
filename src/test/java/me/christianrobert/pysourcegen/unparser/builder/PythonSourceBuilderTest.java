package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.context.MalformedNodeException;
import me.christianrobert.pysourcegen.unparser.context.UnsupportedNodeKindException;
import me.christianrobert.pysourcegen.unparser.dialect.PythonDialects;
import me.christianrobert.pysourcegen.unparser.dialect.PythonVersion;
import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static me.christianrobert.pysourcegen.unparser.PyNodes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PythonSourceBuilder: line reconciliation, indentation and dispatch.
 */
class PythonSourceBuilderTest {

    private PythonSourceBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new PythonSourceBuilder(PythonDialects.forVersion(PythonVersion.PY27), "    ");
    }

    // ========== LINE RECONCILIATION ==========

    @Test
    void firstStatementHasNoLeadingNewline() {
        String source = builder.build(module(pass(1)));

        assertEquals("pass", source);
    }

    @Test
    void siblingStatementsWithoutLineNumbersAreSeparatedByOneLineBreak() {
        String source = builder.build(module(pass(), pass()));

        assertEquals("pass\npass", source);
    }

    @Test
    void gapInLineNumbersProducesBlankLines() {
        // Given: statements on lines 1 and 4
        Node tree = module(pass(1), pass(4));

        // When
        String source = builder.build(tree);

        // Then: L2 - L1 - 1 = 2 blank lines
        assertEquals("pass\n\n\npass", source);
    }

    @Test
    void firstStatementOnLaterLineIsPrecededByBlankLines() {
        String source = builder.build(module(pass(3)));

        assertEquals("\n\npass", source);
    }

    @Test
    void decreasingLineNumbersNeverRemoveOutput() {
        String source = builder.build(module(pass(5), pass(2)));

        assertEquals("\n\n\n\npass\npass", source);
    }

    @Test
    void nameOnLaterLineMovesOutputDown() {
        // Given: x = (newline) y  with y on line 2
        Node tree = module(assign(name("x", 1), name("y", 2)));

        String source = builder.build(tree);

        assertEquals("x = \ny", source);
        assertEquals(2, builder.getCursor().getLine());
    }

    // ========== INDENTATION ==========

    @Test
    void nestedBodiesAreIndentedPerLevel() {
        Node inner = functionDef("g", noArguments(), pass());
        Node outer = functionDef("f", noArguments(), inner);

        String source = builder.build(module(outer));

        assertEquals("def f():\n    def g():\n        pass", source);
        assertEquals(0, builder.getCursor().getIndentation(), "Indentation should be back at zero");
    }

    @Test
    void customIndentUnitIsUsed() {
        PythonSourceBuilder tabs = new PythonSourceBuilder(PythonDialects.forVersion(PythonVersion.PY27), "\t");

        String source = tabs.build(module(functionDef("f", noArguments(), pass())));

        assertEquals("def f():\n\tpass", source);
    }

    // ========== DISPATCH ==========

    @Test
    void missingChildNodeIsMalformed() {
        Node statement = Node.builder(NodeKind.RETURN).build();
        Node broken = Node.builder(NodeKind.EXPR).build();

        assertEquals("return", builder.build(module(statement)));
        PythonSourceBuilder other = new PythonSourceBuilder(PythonDialects.forVersion(PythonVersion.PY27), "    ");
        MalformedNodeException e = assertThrows(MalformedNodeException.class, () -> other.build(module(broken)));
        assertEquals(NodeKind.EXPR, e.getNodeKind());
        assertEquals("value", e.getField());
    }

    @Test
    void kindWithoutRuleIsUnsupported() {
        Node nonlocal = Node.builder(NodeKind.NONLOCAL).field("names", java.util.List.of("x")).build();

        UnsupportedNodeKindException e = assertThrows(UnsupportedNodeKindException.class,
                () -> builder.build(module(nonlocal)));
        assertEquals(NodeKind.NONLOCAL, e.getNodeKind());
        assertEquals("2.7", e.getDialect());
    }

    @Test
    void builderRendersOnlyOnce() {
        builder.build(module(pass()));

        assertThrows(IllegalStateException.class, () -> builder.build(module(pass())));
    }

    @Test
    void separatorWritesBetweenItemsOnly() {
        Separator comma = builder.separator(", ");
        assertFalse(comma.hasItems());

        comma.next();
        builder.write("a");
        comma.next();
        builder.write("b");

        assertTrue(comma.hasItems());
        assertEquals("a, b", builder.build(Node.builder(NodeKind.MODULE).build()));
    }

    @Test
    void dedentBelowZeroIsRejected() {
        assertThrows(IllegalStateException.class, () -> new RenderCursor().dedent());
    }
}
