package me.christianrobert.pysourcegen.unparser.builder;

/**
 * Write position of one render call: indentation depth, number of output lines accounted for,
 * and whether a line break has been requested but not yet written.
 *
 * <p>The line count is 0 before the first fragment, 1 once output has started, and grows by one
 * per line break written. It never decreases.</p>
 */
public final class RenderCursor {

    private int indentation;
    private int line;
    private boolean newlinePending;

    public int getIndentation() {
        return indentation;
    }

    public void indent() {
        indentation++;
    }

    public void dedent() {
        if (indentation == 0) {
            throw new IllegalStateException("Indentation cannot go below zero");
        }
        indentation--;
    }

    public int getLine() {
        return line;
    }

    void startOutput() {
        if (line == 0) {
            line = 1;
        }
    }

    void advanceLines(int count) {
        line += count;
    }

    public boolean isNewlinePending() {
        return newlinePending;
    }

    void requestNewline() {
        newlinePending = true;
    }

    void clearNewline() {
        newlinePending = false;
    }

    @Override
    public String toString() {
        return "RenderCursor{indentation=" + indentation + ", line=" + line + ", newlinePending=" + newlinePending + "}";
    }
}
