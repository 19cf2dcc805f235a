package me.christianrobert.pysourcegen.unparser;

import me.christianrobert.pysourcegen.unparser.context.MalformedNodeException;
import me.christianrobert.pysourcegen.unparser.context.UnsupportedOperatorException;
import me.christianrobert.pysourcegen.unparser.dialect.PythonVersion;
import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;
import me.christianrobert.pysourcegen.unparser.node.Operator;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import static me.christianrobert.pysourcegen.unparser.PyNodes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for expression rendering: operators, displays, comprehensions, subscripts and literals.
 */
class ExpressionRenderingTest {

    private static String render(Node expression) {
        return render(expression, PythonVersion.PY36);
    }

    private static String render(Node expression, PythonVersion version) {
        Node root = Node.builder(NodeKind.EXPRESSION).field("body", expression).build();
        return SourceGenerator.toSource(root, version);
    }

    // ========== OPERATOR TESTS ==========

    @Test
    void binaryOperationsAreNotParenthesized() {
        Node sum = binOp(binOp(name("a"), Operator.ADD, name("b")), Operator.MULT, num(2));

        assertEquals("a + b * 2", render(sum));
    }

    @Test
    void booleanOperationIsParenthesized() {
        Node bool = Node.builder(NodeKind.BOOL_OP)
                .field("op", Operator.OR).field("values", list(name("a"), name("b"), name("c")))
                .build();

        assertEquals("(a or b or c)", render(bool));
    }

    @Test
    void unaryOperations() {
        Node not = Node.builder(NodeKind.UNARY_OP).field("op", Operator.NOT).field("operand", name("x")).build();
        Node neg = Node.builder(NodeKind.UNARY_OP).field("op", Operator.U_SUB).field("operand", num(1)).build();
        Node inv = Node.builder(NodeKind.UNARY_OP).field("op", Operator.INVERT).field("operand", name("m")).build();

        assertEquals("(not x)", render(not));
        assertEquals("(-1)", render(neg));
        assertEquals("(~m)", render(inv));
    }

    @Test
    void chainedComparison() {
        Node compare = Node.builder(NodeKind.COMPARE)
                .field("left", num(0))
                .field("ops", Arrays.asList(Operator.LT_E, Operator.NOT_IN))
                .field("comparators", list(name("x"), name("ys")))
                .build();

        assertEquals("0 <= x not in ys", render(compare));
    }

    @Test
    void comparisonWithMismatchedOperatorsIsMalformed() {
        Node compare = Node.builder(NodeKind.COMPARE)
                .field("left", num(0))
                .field("ops", List.of(Operator.LT))
                .field("comparators", list(name("x"), name("y")))
                .build();

        assertThrows(MalformedNodeException.class, () -> render(compare));
    }

    @Test
    void operatorOfWrongFamilyIsUnsupported() {
        Node bad = binOp(name("a"), Operator.AND, name("b"));

        UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class, () -> render(bad));
        assertEquals(Operator.AND, e.getOperator());
        assertEquals("UnsupportedOperator", e.getErrorKind());
    }

    // ========== DISPLAY TESTS ==========

    @Test
    void tuples() {
        assertEquals("()", render(tuple()));
        assertEquals("(a,)", render(tuple(name("a"))));
        assertEquals("(a, b)", render(tuple(name("a"), name("b"))));
    }

    @Test
    void listAndDict() {
        Node listNode = Node.builder(NodeKind.LIST).field("elts", list(num(1), num(2))).field("ctx", "Load").build();
        Node dict = Node.builder(NodeKind.DICT)
                .field("keys", Arrays.asList(str("a"), null))
                .field("values", list(num(1), name("rest")))
                .build();

        assertEquals("[1, 2]", render(listNode));
        assertEquals("{'a': 1, **rest}", render(dict));
        assertEquals("{}", render(Node.builder(NodeKind.DICT).field("keys", list()).field("values", list()).build()));
    }

    @Test
    void emptySetIsMalformed() {
        Node set = Node.builder(NodeKind.SET).field("elts", list()).build();

        assertThrows(MalformedNodeException.class, () -> render(set));
    }

    // ========== COMPREHENSION TESTS ==========

    @Test
    void listComprehensionWithConditions() {
        Node comp = Node.builder(NodeKind.LIST_COMP)
                .field("elt", binOp(name("x"), Operator.POW, num(2)))
                .field("generators", list(comprehension(name("x"), name("xs"), name("p"), name("q"))))
                .build();

        assertEquals("[x ** 2 for x in xs if p if q]", render(comp));
    }

    @Test
    void generatorWithNestedClauses() {
        Node gen = Node.builder(NodeKind.GENERATOR_EXP)
                .field("elt", name("y"))
                .field("generators", list(comprehension(name("x"), name("xs")), comprehension(name("y"), name("x"))))
                .build();

        assertEquals("(y for x in xs for y in x)", render(gen));
    }

    @Test
    void asyncComprehensionFrom36() {
        Node clause = Node.builder(NodeKind.COMPREHENSION)
                .field("target", name("x")).field("iter", name("aiter")).field("ifs", list()).field("is_async", 1)
                .build();
        Node comp = Node.builder(NodeKind.LIST_COMP).field("elt", name("x")).field("generators", list(clause)).build();

        assertEquals("[x async for x in aiter]", render(comp));
        MalformedNodeException e = assertThrows(MalformedNodeException.class, () -> render(comp, PythonVersion.PY35));
        assertEquals("is_async", e.getField());
    }

    // ========== ACCESS TESTS ==========

    @Test
    void attributeAndIndex() {
        Node attr = Node.builder(NodeKind.ATTRIBUTE).field("value", name("os")).field("attr", "path").field("ctx", "Load").build();
        Node index = Node.builder(NodeKind.INDEX).field("value", num(0)).build();
        Node subscript = Node.builder(NodeKind.SUBSCRIPT).field("value", attr).field("slice", index).field("ctx", "Load").build();

        assertEquals("os.path[0]", render(subscript));
    }

    @Test
    void slices() {
        Node full = Node.builder(NodeKind.SLICE).field("lower", num(1)).field("upper", num(5)).field("step", num(2)).build();
        Node open = Node.builder(NodeKind.SLICE).build();
        Node noneStep = Node.builder(NodeKind.SLICE).field("step", name("None")).build();

        assertEquals("a[1:5:2]", render(subscript(full)));
        assertEquals("a[:]", render(subscript(open)));
        assertEquals("a[::]", render(subscript(noneStep)));
    }

    @Test
    void extendedSlice() {
        Node dims = Node.builder(NodeKind.EXT_SLICE)
                .field("dims", list(Node.builder(NodeKind.SLICE).field("upper", num(2)).build(),
                        Node.builder(NodeKind.INDEX).field("value", num(3)).build()))
                .build();

        assertEquals("a[:2,3]", render(subscript(dims)));
    }

    private static Node subscript(Node slice) {
        return Node.builder(NodeKind.SUBSCRIPT).field("value", name("a")).field("slice", slice).field("ctx", "Load").build();
    }

    // ========== MISC EXPRESSION TESTS ==========

    @Test
    void lambdaAndConditional() {
        Node lambda = Node.builder(NodeKind.LAMBDA)
                .field("args", arguments(list(name("x")), list()))
                .field("body", Node.builder(NodeKind.IF_EXP).field("test", name("x")).field("body", num(1)).field("orelse", num(0)).build())
                .build();

        assertEquals("lambda x: 1 if x else 0", render(lambda, PythonVersion.PY27));
    }

    @Test
    void yieldWithAndWithoutValue() {
        assertEquals("yield", render(Node.of(NodeKind.YIELD)));
        assertEquals("yield x", render(Node.builder(NodeKind.YIELD).field("value", name("x")).build()));
    }

    @Test
    void backquoteRepr() {
        assertEquals("`x`", render(Node.builder(NodeKind.REPR).field("value", name("x")).build(), PythonVersion.PY26));
    }

    @Test
    void ellipsisAndNameConstants() {
        assertEquals("...", render(Node.of(NodeKind.ELLIPSIS)));
        assertEquals("None", render(Node.builder(NodeKind.NAME_CONSTANT).field("value", null).build()));
        assertEquals("False", render(Node.builder(NodeKind.NAME_CONSTANT).field("value", false).build()));
    }

    // ========== LITERAL TESTS ==========

    @Test
    void numbers() {
        assertEquals("42", render(num(42)));
        assertEquals("123456789012345678901234567890", render(num(new BigInteger("123456789012345678901234567890"))));
        assertEquals("0.5", render(num(0.5)));
        assertEquals("1e+16", render(num(1e16)));
        assertEquals("1e309", render(num(Double.POSITIVE_INFINITY)));
    }

    @Test
    void strings() {
        assertEquals("'hello'", render(str("hello")));
        assertEquals("\"it's\"", render(str("it's")));
        assertEquals("'line\\nbreak'", render(str("line\nbreak")));
        assertEquals("'caf\u00e9'", render(str("caf\u00e9")));
    }

    @Test
    void bareStringStatementIsDocstringButNestedStringIsNot() {
        Node call = call(name("f"), list(str("x")), list());

        assertEquals("\"\"\"x\"\"\"", SourceGenerator.toSource(module(expr(str("x"))), PythonVersion.PY36));
        assertEquals("f('x')", SourceGenerator.toSource(module(expr(call)), PythonVersion.PY36));
    }

    @Test
    void bytesMustHoldBytes() {
        Node bytes = Node.builder(NodeKind.BYTES).field("s", "text").build();

        assertThrows(MalformedNodeException.class, () -> render(bytes));
    }
}
