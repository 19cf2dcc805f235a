package me.christianrobert.pysourcegen.unparser.node;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Closed enumeration of the Python syntax tree node kinds this generator knows about.
 *
 * <p>Each kind carries the name used by the Python {@code ast} module (e.g. {@code FunctionDef})
 * and the fixed set of field names a node of that kind may hold. The union of the fields of all
 * grammar versions is listed; whether a field is rendered depends on the active dialect.</p>
 *
 * <p>Which dialect first renders a kind is decided by the dialect chain, not here.</p>
 */
public enum NodeKind {

    // ========== MODULES ==========
    MODULE("Module", "body"),
    EXPRESSION("Expression", "body"),

    // ========== STATEMENTS ==========
    FUNCTION_DEF("FunctionDef", "name", "args", "body", "decorator_list", "returns"),
    ASYNC_FUNCTION_DEF("AsyncFunctionDef", "name", "args", "body", "decorator_list", "returns"),
    CLASS_DEF("ClassDef", "name", "bases", "keywords", "starargs", "kwargs", "body", "decorator_list"),
    RETURN("Return", "value"),
    DELETE("Delete", "targets"),
    ASSIGN("Assign", "targets", "value"),
    AUG_ASSIGN("AugAssign", "target", "op", "value"),
    ANN_ASSIGN("AnnAssign", "target", "annotation", "value", "simple"),
    PRINT("Print", "dest", "values", "nl"),
    FOR("For", "target", "iter", "body", "orelse"),
    ASYNC_FOR("AsyncFor", "target", "iter", "body", "orelse"),
    WHILE("While", "test", "body", "orelse"),
    IF("If", "test", "body", "orelse"),
    WITH("With", "context_expr", "optional_vars", "items", "body"),
    ASYNC_WITH("AsyncWith", "items", "body"),
    RAISE("Raise", "type", "inst", "tback", "exc", "cause"),
    TRY_EXCEPT("TryExcept", "body", "handlers", "orelse"),
    TRY_FINALLY("TryFinally", "body", "finalbody"),
    TRY("Try", "body", "handlers", "orelse", "finalbody"),
    ASSERT("Assert", "test", "msg"),
    IMPORT("Import", "names"),
    IMPORT_FROM("ImportFrom", "module", "names", "level"),
    EXEC("Exec", "body", "globals", "locals"),
    GLOBAL("Global", "names"),
    NONLOCAL("Nonlocal", "names"),
    EXPR("Expr", "value"),
    PASS("Pass"),
    BREAK("Break"),
    CONTINUE("Continue"),

    // ========== EXPRESSIONS ==========
    BOOL_OP("BoolOp", "op", "values"),
    BIN_OP("BinOp", "left", "op", "right"),
    UNARY_OP("UnaryOp", "op", "operand"),
    LAMBDA("Lambda", "args", "body"),
    IF_EXP("IfExp", "test", "body", "orelse"),
    DICT("Dict", "keys", "values"),
    SET("Set", "elts"),
    LIST_COMP("ListComp", "elt", "generators"),
    SET_COMP("SetComp", "elt", "generators"),
    DICT_COMP("DictComp", "key", "value", "generators"),
    GENERATOR_EXP("GeneratorExp", "elt", "generators"),
    AWAIT("Await", "value"),
    YIELD("Yield", "value"),
    YIELD_FROM("YieldFrom", "value"),
    COMPARE("Compare", "left", "ops", "comparators"),
    CALL("Call", "func", "args", "keywords", "starargs", "kwargs"),
    REPR("Repr", "value"),
    NUM("Num", "n"),
    STR("Str", "s"),
    BYTES("Bytes", "s"),
    NAME_CONSTANT("NameConstant", "value"),
    ELLIPSIS("Ellipsis"),
    JOINED_STR("JoinedStr", "values"),
    FORMATTED_VALUE("FormattedValue", "value", "conversion", "format_spec"),
    ATTRIBUTE("Attribute", "value", "attr", "ctx"),
    SUBSCRIPT("Subscript", "value", "slice", "ctx"),
    STARRED("Starred", "value", "ctx"),
    NAME("Name", "id", "ctx"),
    LIST("List", "elts", "ctx"),
    TUPLE("Tuple", "elts", "ctx"),

    // ========== SLICES ==========
    SLICE("Slice", "lower", "upper", "step"),
    EXT_SLICE("ExtSlice", "dims"),
    INDEX("Index", "value"),

    // ========== HELPER NODES ==========
    COMPREHENSION("comprehension", "target", "iter", "ifs", "is_async"),
    EXCEPT_HANDLER("ExceptHandler", "type", "name", "body"),
    ARGUMENTS("arguments", "args", "vararg", "varargannotation", "kwonlyargs", "kw_defaults",
            "kwarg", "kwargannotation", "defaults"),
    ARG("arg", "arg", "annotation"),
    KEYWORD("keyword", "arg", "value"),
    ALIAS("alias", "name", "asname"),
    WITHITEM("withitem", "context_expr", "optional_vars");

    private static final Map<String, NodeKind> BY_TYPE_NAME = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            BY_TYPE_NAME.put(kind.typeName, kind);
        }
    }

    private final String typeName;
    private final Set<String> fields;

    NodeKind(String typeName, String... fields) {
        this.typeName = typeName;
        this.fields = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(fields)));
    }

    /**
     * Name of this kind in the Python {@code ast} module.
     */
    public String getTypeName() {
        return typeName;
    }

    /**
     * Field names a node of this kind may carry, in declaration order.
     */
    public Set<String> fields() {
        return fields;
    }

    public boolean hasField(String field) {
        return fields.contains(field);
    }

    /**
     * Looks up a kind by its {@code ast} type name.
     *
     * @param typeName Type name such as "FunctionDef" or "comprehension"
     * @return the kind, or null if the name is unknown
     */
    public static NodeKind fromTypeName(String typeName) {
        return BY_TYPE_NAME.get(typeName);
    }

    @Override
    public String toString() {
        return typeName;
    }
}
