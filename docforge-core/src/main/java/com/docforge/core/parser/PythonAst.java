package com.docforge.core.parser;

import com.docforge.core.model.ParameterKind;
import com.docforge.core.model.SourceSpan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Syntax tree node types for Python source code.
 *
 * <p>Every node carries the {@link SourceSpan} it was parsed from and lists its direct
 * children in source order, which is all {@link AstWalker} needs to traverse the tree.
 * The tree is structural: it keeps enough to find definitions, signatures, control flow
 * and the expressions type inference looks at, but not comments or exact literal values.
 *
 * @see PythonAstParser
 */
public final class PythonAst {

    private PythonAst() {
        // Utility class - no instantiation
    }

    /**
     * Common contract of every node.
     */
    public interface Node {
        SourceSpan span();

        List<Node> children();
    }

    /** A statement. */
    public interface Stmt extends Node {
    }

    /** An expression. */
    public interface Expr extends Node {
    }

    /** Kind of a literal constant. */
    public enum ConstantKind {
        INT, FLOAT, COMPLEX, STRING, BYTES, FSTRING, TRUE, FALSE, NONE, ELLIPSIS
    }

    /** Kind of a comprehension or generator expression. */
    public enum ComprehensionKind {
        LIST, SET, DICT, GENERATOR
    }

    static List<Node> nodes(Object... parts) {
        List<Node> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node node) {
                result.add(node);
            } else if (part instanceof Suite suite) {
                result.addAll(suite.statements());
            } else if (part instanceof Collection<?> collection) {
                for (Object item : collection) {
                    if (item instanceof Node node) {
                        result.add(node);
                    }
                }
            }
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Structure

    /**
     * A parsed source file.
     *
     * @param body top-level statements
     * @param span whole text
     */
    public record Module(List<Stmt> body, SourceSpan span) implements Node {
        public Module {
            body = List.copyOf(body);
        }

        @Override
        public List<Node> children() {
            return nodes(body);
        }
    }

    /**
     * Body of a compound statement.
     *
     * @param statements statements in order
     * @param inline true if the body follows the colon on the header line
     * @param bodyStart offset right after the header: after the colon for inline bodies,
     *                  after the header line break otherwise
     */
    public record Suite(List<Stmt> statements, boolean inline, int bodyStart) {
        public Suite {
            statements = List.copyOf(statements);
        }

        public Stmt first() {
            return statements.get(0);
        }
    }

    /**
     * A function parameter.
     *
     * @param name name without star prefix
     * @param kind binding kind (never {@link ParameterKind#RECEIVER}, which is decided by context)
     * @param annotation annotation expression, or null
     * @param defaultValue default expression, or null
     * @param span parameter text
     */
    public record Arg(String name, ParameterKind kind, Expr annotation, Expr defaultValue, SourceSpan span)
        implements Node {
        public Arg {
            Objects.requireNonNull(name, "name must not be null");
        }

        public Arg withKind(ParameterKind newKind) {
            return new Arg(name, newKind, annotation, defaultValue, span);
        }

        @Override
        public List<Node> children() {
            return nodes(annotation, defaultValue);
        }
    }

    // ------------------------------------------------------------------
    // Definitions

    /**
     * A {@code def} or {@code async def}.
     *
     * <p>Example:
     * <pre>{@code
     * @cache
     * async def fetch(url: str, *, retries=3) -> bytes:
     *     ...
     * }</pre>
     *
     * @param name function name
     * @param args parameters in declaration order
     * @param returns return annotation, or null
     * @param body function body
     * @param decorators decorator expressions in source order
     * @param isAsync true for {@code async def}
     * @param span from the {@code def} (or {@code async}) keyword to the end of the body
     */
    public record FunctionDef(
        String name,
        List<Arg> args,
        Expr returns,
        Suite body,
        List<Expr> decorators,
        boolean isAsync,
        SourceSpan span
    ) implements Stmt {
        public FunctionDef {
            args = List.copyOf(args);
            decorators = List.copyOf(decorators);
        }

        @Override
        public List<Node> children() {
            return nodes(decorators, args, returns, body);
        }
    }

    /**
     * A {@code class} definition.
     *
     * @param name class name
     * @param bases positional base expressions
     * @param keywords keyword arguments such as {@code metaclass=ABCMeta}
     * @param body class body
     * @param decorators decorator expressions in source order
     * @param span from the {@code class} keyword to the end of the body
     */
    public record ClassDef(
        String name,
        List<Expr> bases,
        List<Keyword> keywords,
        Suite body,
        List<Expr> decorators,
        SourceSpan span
    ) implements Stmt {
        public ClassDef {
            bases = List.copyOf(bases);
            keywords = List.copyOf(keywords);
            decorators = List.copyOf(decorators);
        }

        @Override
        public List<Node> children() {
            return nodes(decorators, bases, keywords, body);
        }
    }

    // ------------------------------------------------------------------
    // Simple statements

    public record Return(Expr value, SourceSpan span) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    /**
     * A {@code raise} statement.
     *
     * @param exc raised expression, or null for a bare re-raise
     * @param cause expression after {@code from}, or null
     * @param span statement text
     */
    public record Raise(Expr exc, Expr cause, SourceSpan span) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(exc, cause);
        }
    }

    public record Assert(Expr test, Expr message, SourceSpan span) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(test, message);
        }
    }

    public record Delete(List<Expr> targets, SourceSpan span) implements Stmt {
        public Delete {
            targets = List.copyOf(targets);
        }

        @Override
        public List<Node> children() {
            return nodes(targets);
        }
    }

    /**
     * {@code pass}, {@code break} or {@code continue}.
     *
     * @param keyword statement keyword
     * @param span statement text
     */
    public record ControlStatement(String keyword, SourceSpan span) implements Stmt {
        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * {@code global} or {@code nonlocal}.
     *
     * @param keyword statement keyword
     * @param names declared names
     * @param span statement text
     */
    public record ScopeDeclaration(String keyword, List<String> names, SourceSpan span) implements Stmt {
        public ScopeDeclaration {
            names = List.copyOf(names);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * An {@code import} or {@code from ... import} statement, kept as text.
     *
     * @param text statement source
     * @param span statement text
     */
    public record Import(String text, SourceSpan span) implements Stmt {
        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    public record TypeAlias(String name, Expr value, SourceSpan span) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    /**
     * Plain assignment, possibly chained ({@code a = b = value}).
     *
     * @param targets assignment targets from left to right
     * @param value assigned value
     * @param span statement text
     */
    public record Assign(List<Expr> targets, Expr value, SourceSpan span) implements Stmt {
        public Assign {
            targets = List.copyOf(targets);
        }

        @Override
        public List<Node> children() {
            return nodes(targets, value);
        }
    }

    /**
     * Augmented assignment such as {@code total += x}.
     *
     * @param target assignment target
     * @param op operator without the trailing {@code =}
     * @param value right operand
     * @param span statement text
     */
    public record AugAssign(Expr target, String op, Expr value, SourceSpan span) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(target, value);
        }
    }

    public record AnnAssign(Expr target, Expr annotation, Expr value, SourceSpan span) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(target, annotation, value);
        }
    }

    public record ExprStatement(Expr value, SourceSpan span) implements Stmt {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    // ------------------------------------------------------------------
    // Compound statements

    /**
     * An {@code if} statement. An {@code elif} chain is stored as a nested {@code If} that is
     * the only statement of {@code orElse}.
     *
     * @param test condition
     * @param body statements run when the condition holds
     * @param orElse {@code elif}/{@code else} statements, possibly empty
     * @param span statement text
     */
    public record If(Expr test, Suite body, List<Stmt> orElse, SourceSpan span) implements Stmt {
        public If {
            orElse = List.copyOf(orElse);
        }

        @Override
        public List<Node> children() {
            return nodes(test, body, orElse);
        }
    }

    public record While(Expr test, Suite body, List<Stmt> orElse, SourceSpan span) implements Stmt {
        public While {
            orElse = List.copyOf(orElse);
        }

        @Override
        public List<Node> children() {
            return nodes(test, body, orElse);
        }
    }

    public record For(Expr target, Expr iter, Suite body, List<Stmt> orElse, boolean isAsync, SourceSpan span)
        implements Stmt {
        public For {
            orElse = List.copyOf(orElse);
        }

        @Override
        public List<Node> children() {
            return nodes(target, iter, body, orElse);
        }
    }

    public record Try(
        Suite body,
        List<ExceptHandler> handlers,
        List<Stmt> orElse,
        List<Stmt> finalBody,
        SourceSpan span
    ) implements Stmt {
        public Try {
            handlers = List.copyOf(handlers);
            orElse = List.copyOf(orElse);
            finalBody = List.copyOf(finalBody);
        }

        @Override
        public List<Node> children() {
            return nodes(body, handlers, orElse, finalBody);
        }
    }

    /**
     * One {@code except} clause.
     *
     * @param type caught expression, or null for a bare {@code except:}
     * @param name name bound with {@code as}, or null
     * @param body handler body
     * @param span clause text
     */
    public record ExceptHandler(Expr type, String name, Suite body, SourceSpan span) implements Node {
        @Override
        public List<Node> children() {
            return nodes(type, body);
        }
    }

    public record With(List<WithItem> items, Suite body, boolean isAsync, SourceSpan span) implements Stmt {
        public With {
            items = List.copyOf(items);
        }

        @Override
        public List<Node> children() {
            return nodes(items, body);
        }
    }

    public record WithItem(Expr context, Expr target, SourceSpan span) implements Node {
        @Override
        public List<Node> children() {
            return nodes(context, target);
        }
    }

    public record Match(Expr subject, List<MatchCase> cases, SourceSpan span) implements Stmt {
        public Match {
            cases = List.copyOf(cases);
        }

        @Override
        public List<Node> children() {
            return nodes(subject, cases);
        }
    }

    /**
     * One {@code case} block. Patterns are kept as source text.
     *
     * @param pattern pattern source
     * @param guard {@code if} guard, or null
     * @param body case body
     * @param span clause text
     */
    public record MatchCase(String pattern, Expr guard, Suite body, SourceSpan span) implements Node {
        @Override
        public List<Node> children() {
            return nodes(guard, body);
        }
    }

    // ------------------------------------------------------------------
    // Expressions

    public record Name(String id, SourceSpan span) implements Expr {
        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * A literal. For string kinds {@code text} is the literal body without prefix and quotes
     * (adjacent literals concatenated); for the others it is the source text.
     *
     * @param kind constant kind
     * @param text literal body or source text
     * @param span literal text
     */
    public record Constant(ConstantKind kind, String text, SourceSpan span) implements Expr {
        public boolean isString() {
            return kind == ConstantKind.STRING || kind == ConstantKind.FSTRING || kind == ConstantKind.BYTES;
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    public record Attribute(Expr value, String attr, SourceSpan span) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public record Subscript(Expr value, Expr index, SourceSpan span) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(value, index);
        }
    }

    public record Slice(Expr lower, Expr upper, Expr step, SourceSpan span) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(lower, upper, step);
        }
    }

    /**
     * A call.
     *
     * @param func called expression
     * @param args positional arguments, {@link Starred} for {@code *it}
     * @param keywords keyword arguments, null-named for {@code **mapping}
     * @param span call text
     */
    public record Call(Expr func, List<Expr> args, List<Keyword> keywords, SourceSpan span) implements Expr {
        public Call {
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        @Override
        public List<Node> children() {
            return nodes(func, args, keywords);
        }
    }

    public record Keyword(String name, Expr value, SourceSpan span) implements Node {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public record Starred(Expr value, SourceSpan span) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public record BinOp(Expr left, String op, Expr right, SourceSpan span) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(left, right);
        }
    }

    public record UnaryOp(String op, Expr operand, SourceSpan span) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(operand);
        }
    }

    /**
     * A chain of {@code and} or {@code or}.
     *
     * @param op {@code "and"} or {@code "or"}
     * @param values operands, at least two
     * @param span expression text
     */
    public record BoolOp(String op, List<Expr> values, SourceSpan span) implements Expr {
        public BoolOp {
            values = List.copyOf(values);
        }

        @Override
        public List<Node> children() {
            return nodes(values);
        }
    }

    /**
     * A comparison chain such as {@code a < b <= c} or {@code x not in items}.
     *
     * @param left first operand
     * @param ops operators, {@code "not in"} and {@code "is not"} as single entries
     * @param comparators remaining operands, one per operator
     * @param span expression text
     */
    public record Compare(Expr left, List<String> ops, List<Expr> comparators, SourceSpan span) implements Expr {
        public Compare {
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
        }

        @Override
        public List<Node> children() {
            return nodes(left, comparators);
        }
    }

    public record IfExp(Expr test, Expr body, Expr orElse, SourceSpan span) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(body, test, orElse);
        }
    }

    public record Lambda(List<Arg> args, Expr body, SourceSpan span) implements Expr {
        public Lambda {
            args = List.copyOf(args);
        }

        @Override
        public List<Node> children() {
            return nodes(args, body);
        }
    }

    public record NamedExpr(Expr target, Expr value, SourceSpan span) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(target, value);
        }
    }

    public record Await(Expr value, SourceSpan span) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public record Yield(Expr value, SourceSpan span) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public record YieldFrom(Expr value, SourceSpan span) implements Expr {
        @Override
        public List<Node> children() {
            return nodes(value);
        }
    }

    public record TupleExpr(List<Expr> elements, SourceSpan span) implements Expr {
        public TupleExpr {
            elements = List.copyOf(elements);
        }

        @Override
        public List<Node> children() {
            return nodes(elements);
        }
    }

    public record ListExpr(List<Expr> elements, SourceSpan span) implements Expr {
        public ListExpr {
            elements = List.copyOf(elements);
        }

        @Override
        public List<Node> children() {
            return nodes(elements);
        }
    }

    public record SetExpr(List<Expr> elements, SourceSpan span) implements Expr {
        public SetExpr {
            elements = List.copyOf(elements);
        }

        @Override
        public List<Node> children() {
            return nodes(elements);
        }
    }

    public record DictExpr(List<DictItem> items, SourceSpan span) implements Expr {
        public DictExpr {
            items = List.copyOf(items);
        }

        @Override
        public List<Node> children() {
            return nodes(items);
        }
    }

    /**
     * One dictionary display entry.
     *
     * @param key key expression, or null for {@code **mapping}
     * @param value value expression
     * @param span entry text
     */
    public record DictItem(Expr key, Expr value, SourceSpan span) implements Node {
        @Override
        public List<Node> children() {
            return nodes(key, value);
        }
    }

    /**
     * A comprehension or generator expression.
     *
     * @param kind display kind
     * @param element produced element (the key for dict comprehensions)
     * @param value produced value for dict comprehensions, null otherwise
     * @param clauses {@code for} clauses in order
     * @param span expression text
     */
    public record Comprehension(
        ComprehensionKind kind,
        Expr element,
        Expr value,
        List<ComprehensionClause> clauses,
        SourceSpan span
    ) implements Expr {
        public Comprehension {
            clauses = List.copyOf(clauses);
        }

        @Override
        public List<Node> children() {
            return nodes(element, value, clauses);
        }
    }

    public record ComprehensionClause(
        Expr target,
        Expr iter,
        List<Expr> conditions,
        boolean isAsync,
        SourceSpan span
    ) implements Node {
        public ComprehensionClause {
            conditions = List.copyOf(conditions);
        }

        @Override
        public List<Node> children() {
            return nodes(target, iter, conditions);
        }
    }
}
