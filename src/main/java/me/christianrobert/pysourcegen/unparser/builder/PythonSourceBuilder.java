package me.christianrobert.pysourcegen.unparser.builder;

import me.christianrobert.pysourcegen.unparser.context.MalformedNodeException;
import me.christianrobert.pysourcegen.unparser.dialect.Dialect;
import me.christianrobert.pysourcegen.unparser.dialect.PythonVersion;
import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.node.Operator;
import me.christianrobert.pysourcegen.unparser.symbols.OperatorFamily;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Renders one syntax tree to Python source under one dialect.
 *
 * <p>An instance owns all mutable state of a single render call (output fragments and
 * {@link RenderCursor}) and is passed explicitly to every {@code Visit*} rule. Create a new
 * instance per tree; {@link #build(Node)} may only be called once.</p>
 *
 * <p>Line reconciliation: whenever text is written for a node that carries a line number ahead
 * of the cursor, line breaks are inserted until the output reaches that line. Blank lines of the
 * input are reproduced this way even though the original spacing is not.</p>
 */
public class PythonSourceBuilder {

    // no logging is desired, one line per node would flood the log

    private final Dialect dialect;
    private final String indentUnit;
    private final OutputBuffer buffer = new OutputBuffer();
    private final RenderCursor cursor = new RenderCursor();
    private final Deque<Character> openStringQuotes = new ArrayDeque<>();
    private boolean used;

    /**
     * @param dialect Resolved dialect providing rules and operator tokens
     * @param indentUnit Text written once per nesting level (e.g. four spaces)
     */
    public PythonSourceBuilder(Dialect dialect, String indentUnit) {
        if (dialect == null) {
            throw new IllegalArgumentException("Dialect cannot be null");
        }
        if (indentUnit == null) {
            throw new IllegalArgumentException("Indent unit cannot be null");
        }
        this.dialect = dialect;
        this.indentUnit = indentUnit;
    }

    /**
     * Renders the tree and returns the assembled source.
     */
    public String build(Node root) {
        if (used) {
            throw new IllegalStateException("PythonSourceBuilder renders a single tree; create a new instance");
        }
        used = true;
        visit(root);
        return buffer.join();
    }

    // ========== DISPATCH ==========

    /**
     * Renders a node with the active dialect's rule for its kind.
     *
     * @throws me.christianrobert.pysourcegen.unparser.context.UnsupportedNodeKindException if the dialect has no rule
     */
    public void visit(Node node) {
        if (node == null) {
            throw new MalformedNodeException("Cannot render a missing node", null, null, dialect.getVersion().label());
        }
        dialect.ruleFor(node.getKind()).render(node, this);
    }

    // ========== TEXT EMISSION ==========

    public void write(String text) {
        write(text, null);
    }

    /**
     * Writes text after reconciling the pending newline and, if given, the node's line number.
     */
    public void write(String text, Node node) {
        correctLineNumber(node);
        append(text);
    }

    /**
     * Requests a line break and reconciles immediately against the node's line number.
     */
    public void newline(Node node) {
        cursor.requestNewline();
        correctLineNumber(node);
    }

    public void newline() {
        newline(null);
    }

    private void correctLineNumber(Node node) {
        if (cursor.isNewlinePending()) {
            writeNewline();
        }
        if (node != null && node.hasLineno()) {
            addMissingLines(node.getLineno());
        }
    }

    private void addMissingLines(int lineno) {
        // non-monotonic line numbers (decorators, multi-line text) yield a negative gap: write nothing
        int missing = lineno - cursor.getLine();
        for (int i = 0; i < missing; i++) {
            writeNewline();
        }
    }

    private void writeNewline() {
        String indentation = indentUnit.repeat(cursor.getIndentation());
        if (buffer.isEmpty()) {
            append(indentation);
        } else {
            append("\n" + indentation);
        }
        cursor.clearNewline();
    }

    private void append(String text) {
        cursor.startOutput();
        buffer.append(text);
        int breaks = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                breaks++;
            }
        }
        cursor.advanceLines(breaks);
    }

    // ========== BLOCKS ==========

    /**
     * Renders statements one level deeper than the current block.
     */
    public void body(List<Node> statements) {
        cursor.requestNewline();
        cursor.indent();
        for (Node statement : statements) {
            visit(statement);
        }
        cursor.dedent();
    }

    /**
     * Renders {@code body} and, when {@code orelse} is not empty, an {@code else:} block.
     */
    public void bodyOrElse(Node node) {
        body(node.getNodes("body"));
        List<Node> orelse = node.getNodes("orelse");
        if (!orelse.isEmpty()) {
            newline();
            write("else:");
            body(orelse);
        }
    }

    /**
     * Renders {@code @decorator} lines of a function or class definition.
     */
    public void decorators(Node node) {
        for (Node decorator : node.getNodes("decorator_list")) {
            newline(decorator);
            write("@");
            visit(decorator);
        }
    }

    /**
     * Visits the nodes separated by {@code ", "}.
     */
    public void commaSeparated(List<Node> nodes) {
        Separator comma = separator(", ");
        for (Node node : nodes) {
            comma.next();
            visit(node);
        }
    }

    public Separator separator(String text) {
        return new Separator(this, text);
    }

    // ========== OPERATORS ==========

    public String booleanToken(Operator operator) {
        return dialect.token(OperatorFamily.BOOLEAN, operator);
    }

    public String binaryToken(Operator operator) {
        return dialect.token(OperatorFamily.BINARY, operator);
    }

    public String comparisonToken(Operator operator) {
        return dialect.token(OperatorFamily.COMPARISON, operator);
    }

    public String unaryToken(Operator operator) {
        return dialect.token(OperatorFamily.UNARY, operator);
    }

    // ========== F-STRINGS ==========

    /**
     * Marks an f-string as open with the given quote; string literals rendered before the matching
     * {@link #closeStringQuote()} sit inside its replacement fields.
     */
    public void openStringQuote(char quote) {
        openStringQuotes.push(quote);
    }

    public void closeStringQuote() {
        openStringQuotes.pop();
    }

    public boolean isInsideFormattedString() {
        return !openStringQuotes.isEmpty();
    }

    public int getFormattedStringDepth() {
        return openStringQuotes.size();
    }

    public boolean isStringQuoteOpen(char quote) {
        return openStringQuotes.contains(quote);
    }

    // ========== STATE ==========

    public Dialect getDialect() {
        return dialect;
    }

    public PythonVersion getVersion() {
        return dialect.getVersion();
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    public RenderCursor getCursor() {
        return cursor;
    }

    /**
     * Creates the exception for a construct this dialect's rule cannot express.
     */
    public MalformedNodeException unsupportedConstruct(Node node, String field, String what) {
        return new MalformedNodeException(what + " is not supported by Python " + getVersion().label(),
                node.getKind(), field, getVersion().label());
    }
}
