package me.christianrobert.pysourcegen.unparser;

import me.christianrobert.pysourcegen.unparser.builder.PythonSourceBuilder;
import me.christianrobert.pysourcegen.unparser.context.RenderOptions;
import me.christianrobert.pysourcegen.unparser.dialect.Dialect;
import me.christianrobert.pysourcegen.unparser.dialect.PythonDialects;
import me.christianrobert.pysourcegen.unparser.dialect.PythonVersion;
import me.christianrobert.pysourcegen.unparser.node.Node;

/**
 * Entry point for rendering a syntax tree to Python source.
 *
 * <p>Each call creates its own {@link PythonSourceBuilder}, so concurrent calls need no
 * synchronization. Failures surface as subclasses of
 * {@link me.christianrobert.pysourcegen.unparser.context.UnparseException}.</p>
 */
public final class SourceGenerator {

    private SourceGenerator() {
    }

    /**
     * Renders with the latest dialect and four-space indentation.
     */
    public static String toSource(Node root) {
        return toSource(root, PythonVersion.latest());
    }

    public static String toSource(Node root, PythonVersion version) {
        return toSource(root, PythonDialects.forVersion(version), RenderOptions.defaults());
    }

    public static String toSource(Node root, PythonVersion version, String indentUnit) {
        return toSource(root, PythonDialects.forVersion(version), RenderOptions.withIndentUnit(indentUnit));
    }

    public static String toSource(Node root, Dialect dialect, RenderOptions options) {
        return new PythonSourceBuilder(dialect, options.getIndentUnit()).build(root);
    }
}
