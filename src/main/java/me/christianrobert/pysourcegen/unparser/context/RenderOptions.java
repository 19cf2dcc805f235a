package me.christianrobert.pysourcegen.unparser.context;

/**
 * Options of a single render call.
 */
public final class RenderOptions {

    public static final String DEFAULT_INDENT_UNIT = "    ";

    private static final RenderOptions DEFAULTS = new RenderOptions(DEFAULT_INDENT_UNIT);

    private final String indentUnit;

    private RenderOptions(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    /**
     * Four spaces per indentation level.
     */
    public static RenderOptions defaults() {
        return DEFAULTS;
    }

    /**
     * @param indentUnit Text written once per nesting level, e.g. {@code "\t"}
     */
    public static RenderOptions withIndentUnit(String indentUnit) {
        if (indentUnit == null) {
            throw new IllegalArgumentException("Indent unit cannot be null");
        }
        return new RenderOptions(indentUnit);
    }

    /**
     * @param width Number of spaces per nesting level
     */
    public static RenderOptions withIndentWidth(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("Indent width cannot be negative: " + width);
        }
        return new RenderOptions(" ".repeat(width));
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    @Override
    public String toString() {
        return "RenderOptions{indentUnit='" + indentUnit + "'}";
    }
}
