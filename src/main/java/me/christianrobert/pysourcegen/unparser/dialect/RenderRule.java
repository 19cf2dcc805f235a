package me.christianrobert.pysourcegen.unparser.dialect;

import me.christianrobert.pysourcegen.unparser.builder.PythonSourceBuilder;
import me.christianrobert.pysourcegen.unparser.node.Node;

/**
 * Renders one node kind. Rules write through the builder of the current render call and
 * recurse into children with {@link PythonSourceBuilder#visit(Node)}.
 */
@FunctionalInterface
public interface RenderRule {

    void render(Node node, PythonSourceBuilder b);
}
