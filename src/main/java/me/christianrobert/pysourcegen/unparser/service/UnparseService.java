package me.christianrobert.pysourcegen.unparser.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.pysourcegen.config.service.ConfigService;
import me.christianrobert.pysourcegen.unparser.SourceGenerator;
import me.christianrobert.pysourcegen.unparser.context.RenderOptions;
import me.christianrobert.pysourcegen.unparser.context.UnparseException;
import me.christianrobert.pysourcegen.unparser.context.UnparseResult;
import me.christianrobert.pysourcegen.unparser.dialect.PythonDialects;
import me.christianrobert.pysourcegen.unparser.dialect.PythonVersion;
import me.christianrobert.pysourcegen.unparser.json.NodeJsonReader;
import me.christianrobert.pysourcegen.unparser.node.Node;
import me.christianrobert.pysourcegen.unparser.util.NodeTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Service wrapper around {@link SourceGenerator}.
 *
 * <p>Resolves the dialect from a version label (falling back to the configured default), applies
 * the configured indentation and turns render failures into {@link UnparseResult} values.</p>
 *
 * <pre>
 * JSON tree ─▶ NodeJsonReader ─▶ Node ─▶ SourceGenerator (dialect, options) ─▶ Python source
 * </pre>
 */
@ApplicationScoped
public class UnparseService {

    private static final Logger log = LoggerFactory.getLogger(UnparseService.class);

    @Inject
    ConfigService configService;

    @Inject
    NodeJsonReader nodeJsonReader;

    /**
     * Renders a tree without tree output.
     *
     * @param root Tree to render
     * @param version Version label such as "2.7" or "3.6"; blank selects the configured default
     */
    public UnparseResult unparse(Node root, String version) {
        return unparse(root, version, false);
    }

    /**
     * Renders a tree with optional tree output.
     *
     * @param root Tree to render
     * @param version Version label; blank selects the configured default
     * @param includeTree Whether to include a formatted tree in the result (for debugging)
     */
    public UnparseResult unparse(Node root, String version, boolean includeTree) {
        PythonVersion pythonVersion;
        try {
            pythonVersion = resolveVersion(version);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected version '{}': {}", version, e.getMessage());
            return UnparseResult.failure(version, "UnknownVersion", e.getMessage());
        }
        String label = pythonVersion.label();

        if (root == null) {
            return UnparseResult.failure(label, "MalformedNode", "Tree cannot be null");
        }

        String tree = null;
        if (includeTree || configService.isIncludeTree()) {
            log.debug("Generating tree representation");
            tree = NodeTreeFormatter.format(root);
        }

        RenderOptions options = configService.getRenderOptions();
        log.debug("Rendering {} tree as Python {} with {}", root.getKind().getTypeName(), label, options);

        try {
            String source = SourceGenerator.toSource(root, PythonDialects.forVersion(pythonVersion), options);
            log.info("Successfully rendered {} tree as Python {}", root.getKind().getTypeName(), label);
            log.trace("Python source: {}", source);

            if (tree != null) {
                return UnparseResult.successWithTree(label, source, tree);
            }
            return UnparseResult.success(label, source);

        } catch (UnparseException e) {
            log.error("Rendering failed: {}", e.getDetailedMessage());
            if (tree != null) {
                return UnparseResult.failureWithTree(label, e, tree);
            }
            return UnparseResult.failure(label, e);
        }
    }

    /**
     * Reads a JSON tree dump and renders it.
     */
    public UnparseResult unparseJson(String json, String version, boolean includeTree) {
        Node root;
        try {
            root = nodeJsonReader.read(json);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid tree JSON: {}", e.getMessage());
            return UnparseResult.failure(version, "InvalidTree", e.getMessage());
        }
        return unparse(root, version, includeTree);
    }

    /**
     * Version labels of the standard dialect chain, oldest first.
     */
    public List<String> supportedVersions() {
        return PythonDialects.standard().versions().stream()
                .map(PythonVersion::label)
                .collect(Collectors.toList());
    }

    private PythonVersion resolveVersion(String version) {
        if (version == null || version.trim().isEmpty()) {
            return configService.getDefaultVersion();
        }
        return PythonVersion.fromLabel(version.trim());
    }
}
