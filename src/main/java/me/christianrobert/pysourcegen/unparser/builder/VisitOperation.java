package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.context.MalformedNodeException;
import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.Operator;

import java.util.List;

/**
 * Static helper for visiting operator expressions.
 *
 * <p>Tokens come from the dialect's symbol tables; an operator missing from the table of its
 * family fails the render. Boolean and unary operations are parenthesized, binary operations and
 * comparisons are not.</p>
 *
 * <pre>
 * BoolOp   (a and b and c)
 * BinOp    a + b
 * UnaryOp  (-a)   (not a)
 * Compare  a &lt; b &lt;= c
 * </pre>
 */
public class VisitOperation {

    public static void vBoolOp(Node node, PythonSourceBuilder b) {
        String token = b.booleanToken(node.requireOperator("op"));
        List<Node> values = node.getNodes("values");
        b.write("(");
        for (int idx = 0; idx < values.size(); idx++) {
            if (idx > 0) {
                b.write(" " + token + " ");
            }
            b.visit(values.get(idx));
        }
        b.write(")");
    }

    public static void vBinOp(Node node, PythonSourceBuilder b) {
        String token = b.binaryToken(node.requireOperator("op"));
        b.visit(node.requireNode("left"));
        b.write(" " + token + " ");
        b.visit(node.requireNode("right"));
    }

    public static void vUnaryOp(Node node, PythonSourceBuilder b) {
        Operator op = node.requireOperator("op");
        String token = b.unaryToken(op);
        b.write("(");
        b.write(token);
        if (op == Operator.NOT) {
            b.write(" ");
        }
        b.visit(node.requireNode("operand"));
        b.write(")");
    }

    public static void vCompare(Node node, PythonSourceBuilder b) {
        List<Operator> ops = node.getOperators("ops");
        List<Node> comparators = node.getNodes("comparators");
        if (ops.size() != comparators.size()) {
            throw new MalformedNodeException(
                    "Compare has " + ops.size() + " operators for " + comparators.size() + " comparators",
                    node.getKind(), "comparators", b.getVersion().label());
        }

        b.visit(node.requireNode("left"));
        for (int idx = 0; idx < ops.size(); idx++) {
            b.write(" " + b.comparisonToken(ops.get(idx)) + " ");
            b.visit(comparators.get(idx));
        }
    }
}
