package me.christianrobert.pysourcegen.unparser;

import me.christianrobert.pysourcegen.unparser.context.MalformedNodeException;
import me.christianrobert.pysourcegen.unparser.dialect.PythonVersion;
import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;
import me.christianrobert.pysourcegen.unparser.node.Operator;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static me.christianrobert.pysourcegen.unparser.PyNodes.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for definitions and calls: signatures, decorators, class headers and argument ordering.
 */
class FunctionAndClassRenderingTest {

    // ========== FUNCTION TESTS ==========

    @Test
    void functionWithDefaultAndReturn() {
        // Given: def f(a, b=1): return a + b  (Python 2 parameters are Name nodes)
        Node args = arguments(list(name("a", 1), name("b", 1)), list(num(1)));
        Node body = Node.builder(NodeKind.RETURN)
                .field("value", binOp(name("a", 2), Operator.ADD, name("b", 2)))
                .lineno(2)
                .build();
        Node function = Node.builder(NodeKind.FUNCTION_DEF)
                .field("name", "f").field("args", args).field("body", list(body)).field("decorator_list", list())
                .lineno(1)
                .build();

        // When
        String source = SourceGenerator.toSource(module(function), PythonVersion.PY26);

        // Then
        assertEquals("def f(a, b=1):\n    return a + b", source);
    }

    @Test
    void emptyParameterList() {
        Node function = functionDef("f", noArguments(), pass());

        for (PythonVersion version : PythonVersion.values()) {
            assertEquals("def f():\n    pass", SourceGenerator.toSource(module(function), version));
        }
    }

    @Test
    void defaultsPairWithTrailingParameters() {
        Node args = arguments(list(name("a"), name("b"), name("c"), name("d")), list(num(3), num(4)));

        String source = SourceGenerator.toSource(module(functionDef("f", args, pass())), PythonVersion.PY27);

        assertEquals("def f(a, b, c=3, d=4):\n    pass", source);
    }

    @Test
    void moreDefaultsThanParametersIsMalformed() {
        Node args = arguments(list(name("a")), list(num(1), num(2)));

        assertThrows(MalformedNodeException.class,
                () -> SourceGenerator.toSource(module(functionDef("f", args, pass())), PythonVersion.PY27));
    }

    @Test
    void python2VariadicParameters() {
        Node args = Node.builder(NodeKind.ARGUMENTS)
                .field("args", list(name("a"))).field("defaults", list())
                .field("vararg", "rest").field("kwarg", "options")
                .build();

        String source = SourceGenerator.toSource(module(functionDef("f", args, pass())), PythonVersion.PY26);

        assertEquals("def f(a, *rest, **options):\n    pass", source);
    }

    @Test
    void keywordOnlyParametersWithBareStar() {
        Node args = Node.builder(NodeKind.ARGUMENTS)
                .field("args", list(arg("a"))).field("defaults", list())
                .field("kwonlyargs", list(arg("key"), arg("flag")))
                .field("kw_defaults", Arrays.asList(null, Node.builder(NodeKind.NAME_CONSTANT).field("value", false).build()))
                .build();

        String source = SourceGenerator.toSource(module(functionDef("f", args, pass())), PythonVersion.PY36);

        assertEquals("def f(a, *, key, flag=False):\n    pass", source);
    }

    @Test
    void annotatedVariadicParametersFrom34() {
        Node args = Node.builder(NodeKind.ARGUMENTS)
                .field("args", list(arg("a", name("int")))).field("defaults", list(num(0)))
                .field("vararg", arg("rest", name("str")))
                .field("kwonlyargs", list(arg("key")))
                .field("kw_defaults", Arrays.asList((Node) null))
                .field("kwarg", arg("options"))
                .build();

        String source = SourceGenerator.toSource(module(functionDef("f", args, pass())), PythonVersion.PY34);

        assertEquals("def f(a: int=0, *rest: str, key, **options):\n    pass", source);
    }

    @Test
    void annotatedVariadicIdentifiersBefore34() {
        Node args = Node.builder(NodeKind.ARGUMENTS)
                .field("args", list()).field("defaults", list())
                .field("vararg", "rest").field("varargannotation", name("str"))
                .build();

        String source = SourceGenerator.toSource(module(functionDef("f", args, pass())), PythonVersion.PY33);

        assertEquals("def f(*rest: str):\n    pass", source);
    }

    @Test
    void returnAnnotationFrom30() {
        Node function = Node.builder(NodeKind.FUNCTION_DEF)
                .field("name", "f").field("args", noArguments()).field("body", list(pass()))
                .field("returns", name("int"))
                .build();

        assertEquals("def f() -> int:\n    pass", SourceGenerator.toSource(module(function), PythonVersion.PY30));
    }

    @Test
    void returnAnnotationFailsBefore30() {
        Node function = Node.builder(NodeKind.FUNCTION_DEF)
                .field("name", "g").field("args", arguments(list(name("a")), list())).field("body", list(pass()))
                .field("returns", name("int"))
                .build();

        MalformedNodeException e = assertThrows(MalformedNodeException.class,
                () -> SourceGenerator.toSource(module(function), PythonVersion.PY27));
        assertEquals("returns", e.getField());
        assertEquals("2.7", e.getDialect());
    }

    @Test
    void keywordOnlyParametersFailBefore30() {
        // Given: def g(a, *, k) as a 3.x tree
        Node args = Node.builder(NodeKind.ARGUMENTS)
                .field("args", list(name("a"))).field("defaults", list())
                .field("kwonlyargs", list(name("k"))).field("kw_defaults", Arrays.asList((Node) null))
                .build();

        MalformedNodeException e = assertThrows(MalformedNodeException.class,
                () -> SourceGenerator.toSource(module(functionDef("g", args, pass())), PythonVersion.PY27));
        assertEquals("kwonlyargs", e.getField());
    }

    @Test
    void variadicAnnotationsFailBefore30() {
        Node args = Node.builder(NodeKind.ARGUMENTS)
                .field("args", list()).field("defaults", list())
                .field("kwarg", "options").field("kwargannotation", name("dict"))
                .build();

        MalformedNodeException e = assertThrows(MalformedNodeException.class,
                () -> SourceGenerator.toSource(module(functionDef("f", args, pass())), PythonVersion.PY26));
        assertEquals("kwargannotation", e.getField());
    }

    @Test
    void separateVariadicAnnotationFieldsFailFrom34() {
        Node args = Node.builder(NodeKind.ARGUMENTS)
                .field("args", list()).field("defaults", list())
                .field("vararg", arg("rest")).field("varargannotation", name("str"))
                .build();

        MalformedNodeException e = assertThrows(MalformedNodeException.class,
                () -> SourceGenerator.toSource(module(functionDef("f", args, pass())), PythonVersion.PY34));
        assertEquals("varargannotation", e.getField());
    }

    @Test
    void variadicAnnotationWithoutParameterIsMalformed() {
        Node args = Node.builder(NodeKind.ARGUMENTS)
                .field("args", list()).field("defaults", list())
                .field("varargannotation", name("str"))
                .build();

        MalformedNodeException e = assertThrows(MalformedNodeException.class,
                () -> SourceGenerator.toSource(module(functionDef("f", args, pass())), PythonVersion.PY33));
        assertEquals("varargannotation", e.getField());
    }

    @Test
    void decoratorsOnePerLine() {
        Node decorated = Node.builder(NodeKind.FUNCTION_DEF)
                .field("name", "f").field("args", noArguments()).field("body", list(pass()))
                .field("decorator_list", list(name("staticmethod"), call(name("cache"), list(num(8)), list())))
                .build();

        String source = SourceGenerator.toSource(module(decorated), PythonVersion.PY27);

        assertEquals("@staticmethod\n@cache(8)\ndef f():\n    pass", source);
    }

    @Test
    void functionWithoutNameIsMalformed() {
        Node function = Node.builder(NodeKind.FUNCTION_DEF).field("args", noArguments()).field("body", list(pass())).build();

        MalformedNodeException e = assertThrows(MalformedNodeException.class,
                () -> SourceGenerator.toSource(module(function), PythonVersion.PY27));
        assertEquals("name", e.getField());
        assertEquals("MalformedNode", e.getErrorKind());
    }

    // ========== CLASS TESTS ==========

    @Test
    void classWithKeywordBaseArgumentsFrom30() {
        Node cls = classDef("C", list(name("Base1")), list(keyword("meta", name("M"))), pass());

        assertEquals("class C(Base1, meta=M):\n    pass", SourceGenerator.toSource(module(cls), PythonVersion.PY30));
        assertEquals("class C(Base1, meta=M):\n    pass", SourceGenerator.toSource(module(cls), PythonVersion.PY36));
    }

    @Test
    void classWithKeywordBaseArgumentsFailsBefore30() {
        Node cls = classDef("C", list(name("Base1")), list(keyword("meta", name("M"))), pass());

        MalformedNodeException e = assertThrows(MalformedNodeException.class,
                () -> SourceGenerator.toSource(module(cls), PythonVersion.PY27));
        assertEquals("keywords", e.getField());
        assertEquals("2.7", e.getDialect());
    }

    @Test
    void classWithoutBases() {
        Node cls = classDef("Empty", list(), list(), pass());

        assertEquals("class Empty:\n    pass", SourceGenerator.toSource(module(cls), PythonVersion.PY26));
    }

    @Test
    void classWithStarArgumentsInPython3() {
        Node cls = Node.builder(NodeKind.CLASS_DEF)
                .field("name", "C").field("bases", list()).field("keywords", list())
                .field("starargs", name("bases")).field("kwargs", name("kw"))
                .field("body", list(pass()))
                .build();

        assertEquals("class C(*bases, **kw):\n    pass", SourceGenerator.toSource(module(cls), PythonVersion.PY32));
    }

    @Test
    void methodsAreNestedInClassBody() {
        Node method = functionDef("run", arguments(list(arg("self")), list()), pass());
        Node cls = classDef("Job", list(name("object")), list(), method);

        assertEquals("class Job(object):\n    def run(self):\n        pass",
                SourceGenerator.toSource(module(cls), PythonVersion.PY36));
    }

    // ========== CALL TESTS ==========

    @Test
    void python2CallOrdering() {
        Node callNode = Node.builder(NodeKind.CALL)
                .field("func", name("f"))
                .field("args", list(name("a")))
                .field("keywords", list(keyword("k", num(1))))
                .field("starargs", name("rest"))
                .field("kwargs", name("options"))
                .build();

        assertEquals("f(a, k=1, *rest, **options)", SourceGenerator.toSource(module(expr(callNode)), PythonVersion.PY27));
    }

    @Test
    void python35CallDefersSpreads() {
        // Given: f(*xs, a, **kw, k=1) in tree order
        Node callNode = call(name("f"),
                list(starred(name("xs")), name("a")),
                list(keyword(null, name("kw")), keyword("k", num(1))));

        String source = SourceGenerator.toSource(module(expr(callNode)), PythonVersion.PY35);

        assertEquals("f(a, k=1, *xs, **kw)", source);
    }

    @Test
    void python35CallRejectsLegacySpreadFields() {
        // Given: f(a) with Python 2 style starargs and kwargs fields
        Node callNode = Node.builder(NodeKind.CALL)
                .field("func", name("f"))
                .field("args", list(name("a")))
                .field("keywords", list())
                .field("starargs", name("rest"))
                .field("kwargs", name("kw"))
                .build();

        MalformedNodeException e = assertThrows(MalformedNodeException.class,
                () -> SourceGenerator.toSource(module(expr(callNode)), PythonVersion.PY35));
        assertEquals("starargs", e.getField());
        assertEquals("3.5", e.getDialect());
    }

    @Test
    void python35CallRejectsKwargsField() {
        Node callNode = Node.builder(NodeKind.CALL)
                .field("func", name("f")).field("args", list()).field("keywords", list())
                .field("kwargs", name("kw"))
                .build();

        MalformedNodeException e = assertThrows(MalformedNodeException.class,
                () -> SourceGenerator.toSource(module(expr(callNode)), PythonVersion.PY36));
        assertEquals("kwargs", e.getField());
    }

    @Test
    void noArgumentCall() {
        assertEquals("f()", SourceGenerator.toSource(module(expr(call(name("f"), list(), list()))), PythonVersion.PY26));
    }
}
