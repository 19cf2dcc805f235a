package me.christianrobert.pysourcegen.unparser.dialect;

import me.christianrobert.pysourcegen.unparser.builder.VisitArg;
import me.christianrobert.pysourcegen.unparser.builder.VisitArguments;
import me.christianrobert.pysourcegen.unparser.builder.VisitAssign;
import me.christianrobert.pysourcegen.unparser.builder.VisitCall;
import me.christianrobert.pysourcegen.unparser.builder.VisitClassDef;
import me.christianrobert.pysourcegen.unparser.builder.VisitCollection;
import me.christianrobert.pysourcegen.unparser.builder.VisitComprehension;
import me.christianrobert.pysourcegen.unparser.builder.VisitExpr;
import me.christianrobert.pysourcegen.unparser.builder.VisitExpression;
import me.christianrobert.pysourcegen.unparser.builder.VisitFormattedString;
import me.christianrobert.pysourcegen.unparser.builder.VisitFunctionDef;
import me.christianrobert.pysourcegen.unparser.builder.VisitIf;
import me.christianrobert.pysourcegen.unparser.builder.VisitImport;
import me.christianrobert.pysourcegen.unparser.builder.VisitLiteral;
import me.christianrobert.pysourcegen.unparser.builder.VisitLoop;
import me.christianrobert.pysourcegen.unparser.builder.VisitModule;
import me.christianrobert.pysourcegen.unparser.builder.VisitName;
import me.christianrobert.pysourcegen.unparser.builder.VisitOperation;
import me.christianrobert.pysourcegen.unparser.builder.VisitRaise;
import me.christianrobert.pysourcegen.unparser.builder.VisitSimpleStatement;
import me.christianrobert.pysourcegen.unparser.builder.VisitSubscript;
import me.christianrobert.pysourcegen.unparser.builder.VisitTry;
import me.christianrobert.pysourcegen.unparser.builder.VisitWith;
import me.christianrobert.pysourcegen.unparser.node.NodeKind;
import me.christianrobert.pysourcegen.unparser.node.Operator;
import me.christianrobert.pysourcegen.unparser.symbols.OperatorFamily;
import me.christianrobert.pysourcegen.unparser.symbols.SymbolTables;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The standard Python 2.6 to 3.6 dialect chain.
 *
 * <p>Each version only lists what its grammar added or changed; everything else is inherited from
 * the previous version. The chain is built once per class load.</p>
 */
public final class PythonDialects {

    private static final DialectChain STANDARD = DialectChain.builder(baseRules(), SymbolTables.base())
            .version(PythonVersion.PY26, DialectDelta.empty())
            .version(PythonVersion.PY27, python27())
            .version(PythonVersion.PY30, python30())
            .version(PythonVersion.PY31, DialectDelta.empty())
            .version(PythonVersion.PY32, DialectDelta.empty())
            .version(PythonVersion.PY33, python33())
            .version(PythonVersion.PY34, python34())
            .version(PythonVersion.PY35, python35())
            .version(PythonVersion.PY36, python36())
            .build();

    private PythonDialects() {
    }

    public static DialectChain standard() {
        return STANDARD;
    }

    public static Dialect forVersion(PythonVersion version) {
        return STANDARD.resolve(version);
    }

    public static Dialect latest() {
        return forVersion(PythonVersion.latest());
    }

    // ========== 2.6 ==========

    static Map<NodeKind, RenderRule> baseRules() {
        Map<NodeKind, RenderRule> rules = new EnumMap<>(NodeKind.class);

        // modules
        rules.put(NodeKind.MODULE, VisitModule::v);
        rules.put(NodeKind.EXPRESSION, VisitModule::vExpression);

        // statements
        rules.put(NodeKind.FUNCTION_DEF, VisitFunctionDef::v);
        rules.put(NodeKind.CLASS_DEF, VisitClassDef::v);
        rules.put(NodeKind.RETURN, VisitSimpleStatement::vReturn);
        rules.put(NodeKind.DELETE, VisitSimpleStatement::vDelete);
        rules.put(NodeKind.ASSIGN, VisitAssign::v);
        rules.put(NodeKind.AUG_ASSIGN, VisitAssign::vAugmented);
        rules.put(NodeKind.PRINT, VisitSimpleStatement::vPrint);
        rules.put(NodeKind.FOR, VisitLoop::vFor);
        rules.put(NodeKind.WHILE, VisitLoop::vWhile);
        rules.put(NodeKind.IF, VisitIf::v);
        rules.put(NodeKind.WITH, VisitWith::v);
        rules.put(NodeKind.RAISE, VisitRaise::v);
        rules.put(NodeKind.TRY_EXCEPT, VisitTry::vTryExcept);
        rules.put(NodeKind.TRY_FINALLY, VisitTry::vTryFinally);
        rules.put(NodeKind.ASSERT, VisitSimpleStatement::vAssert);
        rules.put(NodeKind.IMPORT, VisitImport::v);
        rules.put(NodeKind.IMPORT_FROM, VisitImport::vFrom);
        rules.put(NodeKind.EXEC, VisitSimpleStatement::vExec);
        rules.put(NodeKind.GLOBAL, VisitSimpleStatement::vGlobal);
        rules.put(NodeKind.EXPR, VisitExpr::v);
        rules.put(NodeKind.PASS, VisitSimpleStatement::vPass);
        rules.put(NodeKind.BREAK, VisitSimpleStatement::vBreak);
        rules.put(NodeKind.CONTINUE, VisitSimpleStatement::vContinue);

        // expressions
        rules.put(NodeKind.BOOL_OP, VisitOperation::vBoolOp);
        rules.put(NodeKind.BIN_OP, VisitOperation::vBinOp);
        rules.put(NodeKind.UNARY_OP, VisitOperation::vUnaryOp);
        rules.put(NodeKind.COMPARE, VisitOperation::vCompare);
        rules.put(NodeKind.LAMBDA, VisitExpression::vLambda);
        rules.put(NodeKind.IF_EXP, VisitExpression::vIfExp);
        rules.put(NodeKind.YIELD, VisitExpression::vYield);
        rules.put(NodeKind.REPR, VisitExpression::vRepr);
        rules.put(NodeKind.DICT, VisitCollection::vDict);
        rules.put(NodeKind.LIST, VisitCollection::vList);
        rules.put(NodeKind.TUPLE, VisitCollection::vTuple);
        rules.put(NodeKind.LIST_COMP, VisitComprehension::vListComp);
        rules.put(NodeKind.GENERATOR_EXP, VisitComprehension::vGeneratorExp);
        rules.put(NodeKind.CALL, VisitCall::v);
        rules.put(NodeKind.NUM, VisitLiteral::vNum);
        rules.put(NodeKind.STR, VisitLiteral::vStr);
        rules.put(NodeKind.ELLIPSIS, VisitLiteral::vEllipsis);
        rules.put(NodeKind.ATTRIBUTE, VisitName::vAttribute);
        rules.put(NodeKind.SUBSCRIPT, VisitSubscript::v);
        rules.put(NodeKind.NAME, VisitName::v);
        rules.put(NodeKind.SLICE, VisitSubscript::vSlice);
        rules.put(NodeKind.EXT_SLICE, VisitSubscript::vExtSlice);
        rules.put(NodeKind.INDEX, VisitSubscript::vIndex);

        // helper nodes
        rules.put(NodeKind.COMPREHENSION, VisitComprehension::v);
        rules.put(NodeKind.EXCEPT_HANDLER, VisitTry::vExceptHandler);
        rules.put(NodeKind.ARGUMENTS, VisitArguments::v);
        rules.put(NodeKind.KEYWORD, VisitCall::vKeyword);
        rules.put(NodeKind.ALIAS, VisitImport::vAlias);

        return Collections.unmodifiableMap(rules);
    }

    // ========== 2.7 ==========

    private static DialectDelta python27() {
        return DialectDelta.builder()
                .rule(NodeKind.SET, VisitCollection::vSet)
                .rule(NodeKind.SET_COMP, VisitComprehension::vSetComp)
                .rule(NodeKind.DICT_COMP, VisitComprehension::vDictComp)
                .build();
    }

    // ========== 3.x ==========

    private static DialectDelta python30() {
        return DialectDelta.builder()
                .rule(NodeKind.NONLOCAL, VisitSimpleStatement::vNonlocal)
                .rule(NodeKind.STARRED, VisitName::vStarred)
                .rule(NodeKind.BYTES, VisitLiteral::vBytes)
                .rule(NodeKind.STR, VisitLiteral::vUnicodeStr)
                .rule(NodeKind.EXPR, VisitExpr::vUnicode)
                .rule(NodeKind.ARG, VisitArg::v)
                .rule(NodeKind.CLASS_DEF, VisitClassDef::vWithKeywords)
                .rule(NodeKind.FUNCTION_DEF, VisitFunctionDef::vAnnotated)
                .rule(NodeKind.EXCEPT_HANDLER, VisitTry::vExceptHandlerIdentifier)
                .rule(NodeKind.ARGUMENTS, VisitArguments::vKeywordOnly)
                .build();
    }

    private static DialectDelta python33() {
        return DialectDelta.builder()
                .rule(NodeKind.TRY, VisitTry::vTry)
                .rule(NodeKind.WITHITEM, VisitWith::vWithitem)
                .rule(NodeKind.YIELD_FROM, VisitExpression::vYieldFrom)
                .rule(NodeKind.WITH, VisitWith::vItems)
                .build();
    }

    private static DialectDelta python34() {
        return DialectDelta.builder()
                .rule(NodeKind.NAME_CONSTANT, VisitLiteral::vNameConstant)
                .rule(NodeKind.ARGUMENTS, VisitArguments::vArgNodes)
                .build();
    }

    private static DialectDelta python35() {
        return DialectDelta.builder()
                .rule(NodeKind.ASYNC_FUNCTION_DEF, VisitFunctionDef::vAsync)
                .rule(NodeKind.ASYNC_FOR, VisitLoop::vAsyncFor)
                .rule(NodeKind.ASYNC_WITH, VisitWith::vAsync)
                .rule(NodeKind.AWAIT, VisitExpression::vAwait)
                .rule(NodeKind.CALL, VisitCall::vDeferredSpreads)
                .operator(OperatorFamily.BINARY, Operator.MAT_MULT, "@")
                .build();
    }

    private static DialectDelta python36() {
        return DialectDelta.builder()
                .rule(NodeKind.JOINED_STR, VisitFormattedString::vJoinedStr)
                .rule(NodeKind.FORMATTED_VALUE, VisitFormattedString::vFormattedValue)
                .rule(NodeKind.ANN_ASSIGN, VisitAssign::vAnnotated)
                .rule(NodeKind.COMPREHENSION, VisitComprehension::vAsync)
                .build();
    }
}
