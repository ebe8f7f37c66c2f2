package com.docforge.core.inference;

import com.docforge.core.model.InferredType;
import com.docforge.core.model.ReturnInfo;
import com.docforge.core.parser.AstWalker;
import com.docforge.core.parser.PythonAst.Attribute;
import com.docforge.core.parser.PythonAst.BinOp;
import com.docforge.core.parser.PythonAst.BoolOp;
import com.docforge.core.parser.PythonAst.Call;
import com.docforge.core.parser.PythonAst.Compare;
import com.docforge.core.parser.PythonAst.Comprehension;
import com.docforge.core.parser.PythonAst.Constant;
import com.docforge.core.parser.PythonAst.DictExpr;
import com.docforge.core.parser.PythonAst.Expr;
import com.docforge.core.parser.PythonAst.FunctionDef;
import com.docforge.core.parser.PythonAst.IfExp;
import com.docforge.core.parser.PythonAst.ListExpr;
import com.docforge.core.parser.PythonAst.Name;
import com.docforge.core.parser.PythonAst.Return;
import com.docforge.core.parser.PythonAst.SetExpr;
import com.docforge.core.parser.PythonAst.Stmt;
import com.docforge.core.parser.PythonAst.TupleExpr;
import com.docforge.core.parser.PythonAst.UnaryOp;
import com.docforge.core.parser.PythonAst.Yield;
import com.docforge.core.parser.PythonAst.YieldFrom;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Infers a return type from the expressions a function returns or yields.
 *
 * <p>Each expression is classified on its own (literals, displays, comparisons, arithmetic
 * over classified operands, well-known builtin calls, parameters whose type is known). One
 * distinct non-{@code None} type gives that type, widened to {@code T | None} when a bare or
 * {@code None} return also exists. Anything unclassifiable, or more than one distinct type,
 * gives {@link InferredType#UNKNOWN}. Generators are reported as {@code Iterator[T]}, or
 * {@code Iterator} when the yielded type is not clear.
 */
public class ReturnTypeInferrer {

    private static final String NONE = "None";

    private static final Map<String, String> BUILTIN_RESULTS = Map.ofEntries(
        Map.entry("len", "int"),
        Map.entry("int", "int"),
        Map.entry("hash", "int"),
        Map.entry("ord", "int"),
        Map.entry("round", "int"),
        Map.entry("str", "str"),
        Map.entry("repr", "str"),
        Map.entry("chr", "str"),
        Map.entry("format", "str"),
        Map.entry("float", "float"),
        Map.entry("bool", "bool"),
        Map.entry("isinstance", "bool"),
        Map.entry("issubclass", "bool"),
        Map.entry("callable", "bool"),
        Map.entry("hasattr", "bool"),
        Map.entry("all", "bool"),
        Map.entry("any", "bool"),
        Map.entry("list", "list"),
        Map.entry("sorted", "list"),
        Map.entry("dict", "dict"),
        Map.entry("set", "set"),
        Map.entry("frozenset", "frozenset"),
        Map.entry("tuple", "tuple"),
        Map.entry("bytes", "bytes")
    );

    private static final Set<String> STRING_TO_STRING = Set.of(
        "upper", "lower", "strip", "lstrip", "rstrip", "replace", "join", "format", "title",
        "capitalize", "casefold", "zfill", "center", "ljust", "rjust"
    );

    private static final Set<String> STRING_TO_BOOL = Set.of(
        "startswith", "endswith", "isdigit", "isalpha", "isalnum", "isspace"
    );

    private static final Set<String> NUMERIC = Set.of("int", "float", "int | float");

    /**
     * Infers the return type of {@code function}.
     *
     * @param function function node
     * @param returns extracted return info, or null
     * @param parameterTypes known type per parameter name (declared or inferred)
     * @return return info with {@code inferredType} set, or null when {@code returns} is null
     */
    public ReturnInfo infer(FunctionDef function, ReturnInfo returns, Map<String, String> parameterTypes) {
        if (returns == null || returns.declaredType() != null) {
            return returns;
        }
        List<Stmt> body = function.body().statements();
        if (returns.isGenerator()) {
            return returns.withInferredType(generatorType(body, parameterTypes));
        }
        Set<String> types = new LinkedHashSet<>();
        boolean returnsNone = false;
        for (Return statement : AstWalker.collectInScope(body, Return.class)) {
            String type = statement.value() == null ? NONE : classify(statement.value(), parameterTypes);
            if (type == null) {
                return returns.withInferredType(InferredType.UNKNOWN);
            }
            if (type.equals(NONE)) {
                returnsNone = true;
            } else {
                types.add(type);
            }
        }
        if (types.size() != 1) {
            return returns.withInferredType(InferredType.UNKNOWN);
        }
        String type = types.iterator().next();
        return returns.withInferredType(InferredType.of(returnsNone ? type + " | None" : type));
    }

    private InferredType generatorType(List<Stmt> body,
                                       Map<String, String> parameterTypes) {
        if (!AstWalker.collectInScope(body, YieldFrom.class).isEmpty()) {
            return InferredType.of("Iterator");
        }
        Set<String> types = new LinkedHashSet<>();
        for (Yield yield : AstWalker.collectInScope(body, Yield.class)) {
            String type = yield.value() == null ? NONE : classify(yield.value(), parameterTypes);
            if (type == null) {
                return InferredType.of("Iterator");
            }
            types.add(type);
        }
        if (types.size() != 1) {
            return InferredType.of("Iterator");
        }
        return InferredType.of("Iterator[" + types.iterator().next() + "]");
    }

    /**
     * Classifies one expression.
     *
     * @param expr expression
     * @param parameterTypes known parameter types
     * @return type name, {@code "None"}, or null if unclassifiable
     */
    String classify(Expr expr, Map<String, String> parameterTypes) {
        if (expr instanceof Constant constant) {
            return switch (constant.kind()) {
                case INT -> "int";
                case FLOAT -> "float";
                case COMPLEX -> "complex";
                case STRING, FSTRING -> "str";
                case BYTES -> "bytes";
                case TRUE, FALSE -> "bool";
                case NONE -> NONE;
                case ELLIPSIS -> null;
            };
        }
        if (expr instanceof ListExpr) {
            return "list";
        }
        if (expr instanceof DictExpr) {
            return "dict";
        }
        if (expr instanceof SetExpr) {
            return "set";
        }
        if (expr instanceof TupleExpr) {
            return "tuple";
        }
        if (expr instanceof Comprehension comprehension) {
            return switch (comprehension.kind()) {
                case LIST -> "list";
                case SET -> "set";
                case DICT -> "dict";
                case GENERATOR -> "Iterator";
            };
        }
        if (expr instanceof Compare) {
            return "bool";
        }
        if (expr instanceof UnaryOp unary) {
            if (unary.op().equals("not")) {
                return "bool";
            }
            String operand = classify(unary.operand(), parameterTypes);
            return operand != null && NUMERIC.contains(operand) ? operand : null;
        }
        if (expr instanceof BinOp binary) {
            return classifyBinary(binary, parameterTypes);
        }
        if (expr instanceof BoolOp bool) {
            return sameType(bool.values(), parameterTypes);
        }
        if (expr instanceof IfExp conditional) {
            return sameType(List.of(conditional.body(), conditional.orElse()), parameterTypes);
        }
        if (expr instanceof Name name) {
            return parameterTypes.get(name.id());
        }
        if (expr instanceof Call call) {
            return classifyCall(call, parameterTypes);
        }
        return null;
    }

    private String classifyBinary(BinOp binary, Map<String, String> parameterTypes) {
        String left = classify(binary.left(), parameterTypes);
        String right = classify(binary.right(), parameterTypes);
        if (left == null || right == null) {
            return null;
        }
        if (NUMERIC.contains(left) && NUMERIC.contains(right)) {
            if (binary.op().equals("/")) {
                return "float";
            }
            if (left.equals(right)) {
                return left;
            }
            if (left.equals("int | float") || right.equals("int | float")) {
                return "int | float";
            }
            return "float";
        }
        if (left.equals("str") && (binary.op().equals("%") || (binary.op().equals("+") && right.equals("str")))) {
            return "str";
        }
        if (binary.op().equals("*") && (left.equals("str") && right.equals("int")
            || left.equals("int") && right.equals("str"))) {
            return "str";
        }
        if (binary.op().equals("+") && left.equals(right) && (left.equals("list") || left.equals("tuple"))) {
            return left;
        }
        return null;
    }

    private String classifyCall(Call call, Map<String, String> parameterTypes) {
        if (call.func() instanceof Name name) {
            return BUILTIN_RESULTS.get(name.id());
        }
        if (call.func() instanceof Attribute method) {
            String receiver = classify(method.value(), parameterTypes);
            if ("str".equals(receiver)) {
                if (STRING_TO_STRING.contains(method.attr())) {
                    return "str";
                }
                if (STRING_TO_BOOL.contains(method.attr())) {
                    return "bool";
                }
                if (method.attr().equals("split") || method.attr().equals("splitlines")) {
                    return "list";
                }
            }
        }
        return null;
    }

    private String sameType(List<Expr> exprs, Map<String, String> parameterTypes) {
        String type = null;
        for (Expr expr : exprs) {
            String current = classify(expr, parameterTypes);
            if (current == null || (type != null && !type.equals(current))) {
                return null;
            }
            type = current;
        }
        return type;
    }
}
