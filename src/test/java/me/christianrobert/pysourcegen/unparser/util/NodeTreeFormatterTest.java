package me.christianrobert.pysourcegen.unparser.util;

import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeTreeFormatterTest {

    @Test
    void formatsNestedTree() {
        Node name = Node.builder(NodeKind.NAME).field("id", "x").field("ctx", "Load").lineno(2).build();
        Node ret = Node.builder(NodeKind.RETURN).field("value", name).lineno(2).build();
        Node module = Node.builder(NodeKind.MODULE).field("body", List.of(ret)).build();

        String expected = "Module\n"
                + "  body:\n"
                + "    Return [line 2]\n"
                + "      value:\n"
                + "        Name [line 2] id='x' ctx='Load'\n";

        assertEquals(expected, NodeTreeFormatter.format(module));
    }

    @Test
    void listsScalarElementsAndNulls() {
        Node global = Node.builder(NodeKind.GLOBAL).field("names", List.of("a", "b")).build();

        assertEquals("Global\n  names:\n    'a'\n    'b'\n", NodeTreeFormatter.format(global));
    }

    @Test
    void escapesAndTruncatesLongText() {
        Node str = Node.builder(NodeKind.STR).field("s", "line\n" + "x".repeat(60)).build();

        String formatted = NodeTreeFormatter.format(str);

        assertTrue(formatted.startsWith("Str s='line\\n"));
        assertTrue(formatted.endsWith("...'\n"));
    }

    @Test
    void nullTree() {
        assertEquals("(null tree)", NodeTreeFormatter.format(null));
    }
}
