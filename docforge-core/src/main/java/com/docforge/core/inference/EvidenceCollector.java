package com.docforge.core.inference;

import com.docforge.core.parser.AstWalker;
import com.docforge.core.parser.PythonAst.Arg;
import com.docforge.core.parser.PythonAst.Attribute;
import com.docforge.core.parser.PythonAst.AugAssign;
import com.docforge.core.parser.PythonAst.BinOp;
import com.docforge.core.parser.PythonAst.Call;
import com.docforge.core.parser.PythonAst.Compare;
import com.docforge.core.parser.PythonAst.Comprehension;
import com.docforge.core.parser.PythonAst.ComprehensionClause;
import com.docforge.core.parser.PythonAst.Constant;
import com.docforge.core.parser.PythonAst.ConstantKind;
import com.docforge.core.parser.PythonAst.DictExpr;
import com.docforge.core.parser.PythonAst.Expr;
import com.docforge.core.parser.PythonAst.For;
import com.docforge.core.parser.PythonAst.FunctionDef;
import com.docforge.core.parser.PythonAst.ListExpr;
import com.docforge.core.parser.PythonAst.Name;
import com.docforge.core.parser.PythonAst.Node;
import com.docforge.core.parser.PythonAst.Subscript;
import com.docforge.core.parser.PythonAst.TupleExpr;
import com.docforge.core.parser.PythonAst.UnaryOp;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects usage evidence for the parameters of one function.
 *
 * <p>Only the function's own scope is inspected; nested functions, classes and lambdas are
 * skipped. Results are keyed in declaration order and every tag set is an {@link EnumSet},
 * so repeated runs on the same body produce identical results.
 */
public class EvidenceCollector {

    private static final Set<String> ARITHMETIC_OPERATORS = Set.of("+", "-", "*", "/", "//", "%", "**", "@");

    private static final Set<String> ORDERING_OPERATORS = Set.of("<", ">", "<=", ">=");

    private static final Set<String> MAPPING_METHODS = Set.of(
        "keys", "values", "items", "get", "setdefault", "popitem"
    );

    private static final Set<String> SEQUENCE_METHODS = Set.of(
        "append", "extend", "insert", "sort", "reverse"
    );

    private static final Set<String> SET_METHODS = Set.of(
        "add", "discard", "union", "intersection", "difference", "symmetric_difference",
        "issubset", "issuperset", "isdisjoint"
    );

    private static final Set<String> STRING_METHODS = Set.of(
        "upper", "lower", "strip", "lstrip", "rstrip", "split", "rsplit", "splitlines",
        "startswith", "endswith", "replace", "format", "encode", "find", "rfind", "casefold",
        "title", "capitalize", "isdigit", "isalpha", "isalnum", "isspace", "zfill", "center",
        "ljust", "rjust", "partition", "rpartition"
    );

    private static final Set<String> ITERATING_BUILTINS = Set.of(
        "enumerate", "sorted", "reversed", "zip", "sum", "min", "max", "any", "all",
        "list", "tuple", "set", "frozenset", "map", "filter", "iter"
    );

    /**
     * Collects evidence for every parameter of {@code function}.
     *
     * @param function function node
     * @return tags per parameter name, in declaration order
     */
    public Map<String, Set<EvidenceTag>> collect(FunctionDef function) {
        Map<String, Set<EvidenceTag>> evidence = new LinkedHashMap<>();
        for (Arg arg : function.args()) {
            Set<EvidenceTag> tags = EnumSet.noneOf(EvidenceTag.class);
            addDefaultEvidence(arg.defaultValue(), tags);
            evidence.put(arg.name(), tags);
        }
        AstWalker.walkScope(function.body().statements(), node -> {
            inspect(node, evidence);
            return true;
        });
        return evidence;
    }

    private void addDefaultEvidence(Expr defaultValue, Set<EvidenceTag> tags) {
        if (defaultValue instanceof Constant constant) {
            switch (constant.kind()) {
                case INT, FLOAT, COMPLEX -> tags.add(EvidenceTag.NUMERIC_DEFAULT);
                case STRING, FSTRING -> tags.add(EvidenceTag.STRING_DEFAULT);
                case TRUE, FALSE -> tags.add(EvidenceTag.BOOL_DEFAULT);
                default -> {
                    // None, bytes and ellipsis say nothing about the intended type
                }
            }
        } else if (defaultValue instanceof ListExpr) {
            tags.add(EvidenceTag.LIST_DEFAULT);
        } else if (defaultValue instanceof DictExpr) {
            tags.add(EvidenceTag.DICT_DEFAULT);
        } else if (defaultValue instanceof UnaryOp unary && unary.operand() instanceof Constant constant
            && isNumeric(constant)) {
            tags.add(EvidenceTag.NUMERIC_DEFAULT);
        }
    }

    private void inspect(Node node, Map<String, Set<EvidenceTag>> evidence) {
        if (node instanceof Subscript subscript) {
            Set<EvidenceTag> tags = tagsFor(subscript.value(), evidence);
            if (tags != null) {
                boolean stringKey = subscript.index() instanceof Constant constant
                    && constant.kind() == ConstantKind.STRING;
                tags.add(stringKey ? EvidenceTag.KEY_ACCESS : EvidenceTag.INDEXED);
            }
        } else if (node instanceof Attribute attribute) {
            Set<EvidenceTag> tags = tagsFor(attribute.value(), evidence);
            if (tags != null) {
                tags.add(EvidenceTag.ATTRIBUTE);
            }
        } else if (node instanceof Call call) {
            inspectCall(call, evidence);
        } else if (node instanceof BinOp binary && ARITHMETIC_OPERATORS.contains(binary.op())) {
            inspectArithmetic(binary.op(), binary.left(), binary.right(), true, evidence);
            inspectArithmetic(binary.op(), binary.right(), binary.left(), false, evidence);
        } else if (node instanceof AugAssign assignment && ARITHMETIC_OPERATORS.contains(assignment.op())) {
            inspectArithmetic(assignment.op(), assignment.target(), assignment.value(), true, evidence);
            inspectArithmetic(assignment.op(), assignment.value(), assignment.target(), false, evidence);
        } else if (node instanceof UnaryOp unary && !unary.op().equals("not")) {
            Set<EvidenceTag> tags = tagsFor(unary.operand(), evidence);
            if (tags != null) {
                tags.add(EvidenceTag.ARITHMETIC);
            }
        } else if (node instanceof Compare compare) {
            inspectComparison(compare, evidence);
        } else if (node instanceof For loop) {
            addTag(loop.iter(), EvidenceTag.ITERATED, evidence);
        } else if (node instanceof ComprehensionClause clause) {
            addTag(clause.iter(), EvidenceTag.ITERATED, evidence);
        }
    }

    private void inspectCall(Call call, Map<String, Set<EvidenceTag>> evidence) {
        addTag(call.func(), EvidenceTag.CALLED, evidence);
        if (call.func() instanceof Attribute method) {
            Set<EvidenceTag> tags = tagsFor(method.value(), evidence);
            if (tags != null) {
                EvidenceTag tag = methodTag(method.attr());
                if (tag != null) {
                    tags.add(tag);
                }
            }
            if (method.attr().equals("join") && isString(method.value()) && !call.args().isEmpty()) {
                addTag(call.args().get(0), EvidenceTag.ITERATED, evidence);
            }
            return;
        }
        if (call.func() instanceof Name builtin && !call.args().isEmpty()) {
            if (builtin.id().equals("len")) {
                addTag(call.args().get(0), EvidenceTag.SIZED, evidence);
            } else if (ITERATING_BUILTINS.contains(builtin.id())) {
                int first = builtin.id().equals("map") || builtin.id().equals("filter") ? 1 : 0;
                List<Expr> args = call.args();
                boolean single = builtin.id().equals("min") || builtin.id().equals("max");
                if (single && args.size() != 1) {
                    return;
                }
                for (int i = first; i < args.size(); i++) {
                    addTag(args.get(i), EvidenceTag.ITERATED, evidence);
                }
            }
        }
    }

    private static EvidenceTag methodTag(String method) {
        if (MAPPING_METHODS.contains(method)) {
            return EvidenceTag.MAPPING_METHOD;
        }
        if (SEQUENCE_METHODS.contains(method)) {
            return EvidenceTag.SEQUENCE_MUTATION;
        }
        if (SET_METHODS.contains(method)) {
            return EvidenceTag.SET_METHOD;
        }
        if (STRING_METHODS.contains(method)) {
            return EvidenceTag.STRING_METHOD;
        }
        return null;
    }

    private void inspectArithmetic(String op, Expr operand, Expr other, boolean operandIsLeft,
                                   Map<String, Set<EvidenceTag>> evidence) {
        Set<EvidenceTag> tags = tagsFor(operand, evidence);
        if (tags == null) {
            return;
        }
        if (isString(other)) {
            switch (op) {
                case "+" -> tags.add(EvidenceTag.STRING_OPERAND);
                // "-" * width repeats the string, so the operand is a count
                case "*" -> tags.add(EvidenceTag.ARITHMETIC);
                case "%" -> {
                    if (operandIsLeft) {
                        tags.add(EvidenceTag.STRING_OPERAND);
                    }
                }
                default -> {
                    // no other operator combines meaningfully with a string literal
                }
            }
            return;
        }
        if (other instanceof ListExpr || other instanceof TupleExpr || other instanceof Comprehension) {
            return;
        }
        tags.add(EvidenceTag.ARITHMETIC);
    }

    private void inspectComparison(Compare compare, Map<String, Set<EvidenceTag>> evidence) {
        Expr left = compare.left();
        for (int i = 0; i < compare.ops().size(); i++) {
            String op = compare.ops().get(i);
            Expr right = compare.comparators().get(i);
            if (op.equals("in") || op.equals("not in")) {
                addTag(right, EvidenceTag.MEMBERSHIP, evidence);
                if (isString(right)) {
                    addTag(left, EvidenceTag.STRING_OPERAND, evidence);
                }
            } else if (ORDERING_OPERATORS.contains(op) || op.equals("==") || op.equals("!=")) {
                compareWithLiteral(left, right, evidence);
                compareWithLiteral(right, left, evidence);
            }
            left = right;
        }
    }

    private void compareWithLiteral(Expr operand, Expr other, Map<String, Set<EvidenceTag>> evidence) {
        if (isString(other)) {
            addTag(operand, EvidenceTag.STRING_OPERAND, evidence);
        } else if (other instanceof Constant constant && isNumeric(constant)) {
            addTag(operand, EvidenceTag.NUMERIC_COMPARISON, evidence);
        }
    }

    private static void addTag(Expr expr, EvidenceTag tag, Map<String, Set<EvidenceTag>> evidence) {
        Set<EvidenceTag> tags = tagsFor(expr, evidence);
        if (tags != null) {
            tags.add(tag);
        }
    }

    private static Set<EvidenceTag> tagsFor(Expr expr, Map<String, Set<EvidenceTag>> evidence) {
        if (expr instanceof Name name) {
            return evidence.get(name.id());
        }
        return null;
    }

    private static boolean isString(Expr expr) {
        return expr instanceof Constant constant
            && (constant.kind() == ConstantKind.STRING || constant.kind() == ConstantKind.FSTRING);
    }

    private static boolean isNumeric(Constant constant) {
        return constant.kind() == ConstantKind.INT || constant.kind() == ConstantKind.FLOAT
            || constant.kind() == ConstantKind.COMPLEX;
    }
}
