package me.christianrobert.pysourcegen.unparser.context;

/**
 * Result of an unparse operation.
 * Contains either the generated Python source or an error message.
 * Optionally includes a tree representation of the input for debugging.
 */
public class UnparseResult {

    private final boolean success;
    private final String source;
    private final String errorMessage;
    private final String errorKind;
    private final String version;
    private final String tree;  // Optional tree representation (null by default)

    private UnparseResult(boolean success, String source, String errorMessage, String errorKind,
                          String version, String tree) {
        this.success = success;
        this.source = source;
        this.errorMessage = errorMessage;
        this.errorKind = errorKind;
        this.version = version;
        this.tree = tree;
    }

    /**
     * Creates a successful result.
     */
    public static UnparseResult success(String version, String source) {
        return new UnparseResult(true, source, null, null, version, null);
    }

    /**
     * Creates a successful result with tree.
     */
    public static UnparseResult successWithTree(String version, String source, String tree) {
        return new UnparseResult(true, source, null, null, version, tree);
    }

    /**
     * Creates a failed result for input that never reached the renderer (bad JSON, unknown version).
     */
    public static UnparseResult failure(String version, String errorKind, String errorMessage) {
        return new UnparseResult(false, null, errorMessage, errorKind, version, null);
    }

    /**
     * Creates a failed result from an exception.
     */
    public static UnparseResult failure(String version, UnparseException exception) {
        return new UnparseResult(false, null, exception.getDetailedMessage(), exception.getErrorKind(), version, null);
    }

    /**
     * Creates a failed result from an exception with tree.
     */
    public static UnparseResult failureWithTree(String version, UnparseException exception, String tree) {
        return new UnparseResult(false, null, exception.getDetailedMessage(), exception.getErrorKind(), version, tree);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getSource() {
        return source;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public String getVersion() {
        return version;
    }

    public String getTree() {
        return tree;
    }

    public boolean hasTree() {
        return tree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "UnparseResult{success=true, version=" + version + ", source='" + source + "'" +
                   (tree != null ? ", hasTree=true" : "") + "}";
        } else {
            return "UnparseResult{success=false, version=" + version + ", error='" + errorMessage + "'" +
                   (tree != null ? ", hasTree=true" : "") + "}";
        }
    }
}
