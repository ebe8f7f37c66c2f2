package com.docforge.core.parser;

import com.docforge.core.model.ParameterKind;
import com.docforge.core.model.SourceSpan;
import com.docforge.core.parser.PythonAst.AnnAssign;
import com.docforge.core.parser.PythonAst.Arg;
import com.docforge.core.parser.PythonAst.Assert;
import com.docforge.core.parser.PythonAst.Assign;
import com.docforge.core.parser.PythonAst.Attribute;
import com.docforge.core.parser.PythonAst.AugAssign;
import com.docforge.core.parser.PythonAst.Await;
import com.docforge.core.parser.PythonAst.BinOp;
import com.docforge.core.parser.PythonAst.BoolOp;
import com.docforge.core.parser.PythonAst.Call;
import com.docforge.core.parser.PythonAst.ClassDef;
import com.docforge.core.parser.PythonAst.Compare;
import com.docforge.core.parser.PythonAst.Comprehension;
import com.docforge.core.parser.PythonAst.ComprehensionClause;
import com.docforge.core.parser.PythonAst.ComprehensionKind;
import com.docforge.core.parser.PythonAst.Constant;
import com.docforge.core.parser.PythonAst.ConstantKind;
import com.docforge.core.parser.PythonAst.ControlStatement;
import com.docforge.core.parser.PythonAst.Delete;
import com.docforge.core.parser.PythonAst.DictExpr;
import com.docforge.core.parser.PythonAst.DictItem;
import com.docforge.core.parser.PythonAst.ExceptHandler;
import com.docforge.core.parser.PythonAst.Expr;
import com.docforge.core.parser.PythonAst.ExprStatement;
import com.docforge.core.parser.PythonAst.For;
import com.docforge.core.parser.PythonAst.FunctionDef;
import com.docforge.core.parser.PythonAst.If;
import com.docforge.core.parser.PythonAst.IfExp;
import com.docforge.core.parser.PythonAst.Import;
import com.docforge.core.parser.PythonAst.Keyword;
import com.docforge.core.parser.PythonAst.Lambda;
import com.docforge.core.parser.PythonAst.ListExpr;
import com.docforge.core.parser.PythonAst.Match;
import com.docforge.core.parser.PythonAst.MatchCase;
import com.docforge.core.parser.PythonAst.Module;
import com.docforge.core.parser.PythonAst.Name;
import com.docforge.core.parser.PythonAst.NamedExpr;
import com.docforge.core.parser.PythonAst.Node;
import com.docforge.core.parser.PythonAst.Raise;
import com.docforge.core.parser.PythonAst.Return;
import com.docforge.core.parser.PythonAst.ScopeDeclaration;
import com.docforge.core.parser.PythonAst.SetExpr;
import com.docforge.core.parser.PythonAst.Slice;
import com.docforge.core.parser.PythonAst.Starred;
import com.docforge.core.parser.PythonAst.Stmt;
import com.docforge.core.parser.PythonAst.Subscript;
import com.docforge.core.parser.PythonAst.Suite;
import com.docforge.core.parser.PythonAst.Try;
import com.docforge.core.parser.PythonAst.TupleExpr;
import com.docforge.core.parser.PythonAst.TypeAlias;
import com.docforge.core.parser.PythonAst.UnaryOp;
import com.docforge.core.parser.PythonAst.While;
import com.docforge.core.parser.PythonAst.With;
import com.docforge.core.parser.PythonAst.WithItem;
import com.docforge.core.parser.PythonAst.Yield;
import com.docforge.core.parser.PythonAst.YieldFrom;
import com.docforge.parser.Python3Lexer;
import com.docforge.parser.Python3Parser;
import com.docforge.parser.Python3ParserBaseVisitor;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts a {@link Python3Parser} parse tree into the {@link PythonAst} model.
 *
 * <p>Expression rules are handled by the visitor methods; statements are collected by plain
 * methods because one statement rule can yield several nodes ({@code a = 1; b = 2}).
 * Spans run from the first token of a construct to its last visible token, so a block's
 * trailing NEWLINE and DEDENT tokens never widen a definition.
 */
final class PythonAstBuilder extends Python3ParserBaseVisitor<Node> {

    private final SourceText text;
    private final TokenStream tokens;

    PythonAstBuilder(SourceText text, TokenStream tokens) {
        this.text = text;
        this.tokens = tokens;
    }

    Module module(Python3Parser.File_inputContext ctx) {
        List<Stmt> body = new ArrayList<>();
        for (Python3Parser.StmtContext stmt : ctx.stmt()) {
            body.addAll(statements(stmt));
        }
        return new Module(body, new SourceSpan(0, text.length(), 1, text.lineOf(text.length())));
    }

    // ------------------------------------------------------------------
    // Statements

    private List<Stmt> statements(Python3Parser.StmtContext ctx) {
        if (ctx.compound_stmt() != null) {
            return List.of(compound(ctx.compound_stmt()));
        }
        return simpleStatements(ctx.simple_stmts());
    }

    private List<Stmt> simpleStatements(Python3Parser.Simple_stmtsContext ctx) {
        List<Stmt> statements = new ArrayList<>();
        for (Python3Parser.Simple_stmtContext stmt : ctx.simple_stmt()) {
            statements.add(simple(stmt));
        }
        return statements;
    }

    private Stmt compound(Python3Parser.Compound_stmtContext ctx) {
        if (ctx.if_stmt() != null) {
            return ifChain(ctx.if_stmt(), 0);
        }
        if (ctx.while_stmt() != null) {
            return whileStatement(ctx.while_stmt());
        }
        if (ctx.for_stmt() != null) {
            return forStatement(ctx.for_stmt(), null);
        }
        if (ctx.try_stmt() != null) {
            return tryStatement(ctx.try_stmt());
        }
        if (ctx.with_stmt() != null) {
            return withStatement(ctx.with_stmt(), null);
        }
        if (ctx.funcdef() != null) {
            return functionDef(ctx.funcdef(), null, List.of());
        }
        if (ctx.classdef() != null) {
            return classDef(ctx.classdef(), List.of());
        }
        if (ctx.decorated() != null) {
            return decorated(ctx.decorated());
        }
        if (ctx.async_stmt() != null) {
            return asyncStatement(ctx.async_stmt());
        }
        return match(ctx.match_stmt());
    }

    private Stmt asyncStatement(Python3Parser.Async_stmtContext ctx) {
        Token async = ctx.ASYNC().getSymbol();
        if (ctx.funcdef() != null) {
            return functionDef(ctx.funcdef(), async, List.of());
        }
        if (ctx.with_stmt() != null) {
            return withStatement(ctx.with_stmt(), async);
        }
        return forStatement(ctx.for_stmt(), async);
    }

    private Stmt decorated(Python3Parser.DecoratedContext ctx) {
        List<Expr> decorators = new ArrayList<>();
        for (Python3Parser.DecoratorContext decorator : ctx.decorator()) {
            decorators.add(expr(decorator.namedexpr_test()));
        }
        if (ctx.classdef() != null) {
            return classDef(ctx.classdef(), decorators);
        }
        if (ctx.funcdef() != null) {
            return functionDef(ctx.funcdef(), null, decorators);
        }
        Python3Parser.Async_funcdefContext async = ctx.async_funcdef();
        return functionDef(async.funcdef(), async.ASYNC().getSymbol(), decorators);
    }

    private FunctionDef functionDef(Python3Parser.FuncdefContext ctx, Token async, List<Expr> decorators) {
        List<Arg> args = ctx.parameters().typedargslist() == null
            ? List.of()
            : parameters(ctx.parameters().typedargslist());
        Expr returns = ctx.test() == null ? null : expr(ctx.test());
        Token start = async != null ? async : ctx.getStart();
        return new FunctionDef(ctx.name().getText(), args, returns, suite(ctx.block()), decorators,
            async != null, span(start, ctx.getStop()));
    }

    private List<Arg> parameters(Python3Parser.TypedargslistContext ctx) {
        List<Arg> args = new ArrayList<>();
        ParameterKind kind = ParameterKind.POSITIONAL_OR_KEYWORD;
        for (Python3Parser.TypedargContext arg : ctx.typedarg()) {
            if (arg.DIV() != null) {
                args.replaceAll(previous -> previous.withKind(ParameterKind.POSITIONAL_ONLY));
            } else if (arg.kwargs_param() != null) {
                Python3Parser.TfpdefContext def = arg.kwargs_param().tfpdef();
                args.add(new Arg(def.name().getText(), ParameterKind.VAR_KEYWORD, optional(def.test()), null,
                    span(arg)));
            } else if (arg.star_param() != null) {
                Python3Parser.Star_paramContext star = arg.star_param();
                if (star.name() != null) {
                    Expr annotation = star.star_expr() != null ? expr(star.star_expr()) : optional(star.test());
                    args.add(new Arg(star.name().getText(), ParameterKind.VAR_POSITIONAL, annotation, null,
                        span(arg)));
                }
                kind = ParameterKind.KEYWORD_ONLY;
            } else {
                Python3Parser.TfpdefContext def = arg.tfpdef();
                args.add(new Arg(def.name().getText(), kind, optional(def.test()), optional(arg.test()),
                    span(arg)));
            }
        }
        return args;
    }

    private List<Arg> lambdaParameters(Python3Parser.VarargslistContext ctx) {
        List<Arg> args = new ArrayList<>();
        ParameterKind kind = ParameterKind.POSITIONAL_OR_KEYWORD;
        for (Python3Parser.VarargContext arg : ctx.vararg()) {
            if (arg.DIV() != null) {
                args.replaceAll(previous -> previous.withKind(ParameterKind.POSITIONAL_ONLY));
            } else if (arg.POWER() != null) {
                args.add(new Arg(arg.name().getText(), ParameterKind.VAR_KEYWORD, null, null, span(arg)));
            } else if (arg.STAR() != null) {
                if (arg.name() != null) {
                    args.add(new Arg(arg.name().getText(), ParameterKind.VAR_POSITIONAL, null, null, span(arg)));
                }
                kind = ParameterKind.KEYWORD_ONLY;
            } else {
                args.add(new Arg(arg.name().getText(), kind, null, optional(arg.test()), span(arg)));
            }
        }
        return args;
    }

    private ClassDef classDef(Python3Parser.ClassdefContext ctx, List<Expr> decorators) {
        List<Expr> bases = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        if (ctx.arglist() != null) {
            arguments(ctx.arglist(), bases, keywords);
        }
        return new ClassDef(ctx.name().getText(), bases, keywords, suite(ctx.block()), decorators, span(ctx));
    }

    private If ifChain(Python3Parser.If_stmtContext ctx, int branch) {
        Token start = branch == 0 ? ctx.IF().getSymbol() : ctx.ELIF(branch - 1).getSymbol();
        Expr test = expr(ctx.namedexpr_test(branch));
        Suite body = suite(ctx.block(branch));
        List<Stmt> orElse;
        if (branch + 1 < ctx.namedexpr_test().size()) {
            orElse = List.of(ifChain(ctx, branch + 1));
        } else if (ctx.ELSE() != null) {
            orElse = suite(ctx.block(branch + 1)).statements();
        } else {
            orElse = List.of();
        }
        return new If(test, body, orElse, span(start, ctx.getStop()));
    }

    private While whileStatement(Python3Parser.While_stmtContext ctx) {
        List<Stmt> orElse = ctx.ELSE() != null ? suite(ctx.block(1)).statements() : List.of();
        return new While(expr(ctx.namedexpr_test()), suite(ctx.block(0)), orElse, span(ctx));
    }

    private For forStatement(Python3Parser.For_stmtContext ctx, Token async) {
        List<Stmt> orElse = ctx.ELSE() != null ? suite(ctx.block(1)).statements() : List.of();
        Token start = async != null ? async : ctx.getStart();
        return new For(expr(ctx.exprlist()), expr(ctx.testlist_star_expr()), suite(ctx.block(0)), orElse,
            async != null, span(start, ctx.getStop()));
    }

    private Try tryStatement(Python3Parser.Try_stmtContext ctx) {
        List<ExceptHandler> handlers = new ArrayList<>();
        for (Python3Parser.Except_clauseContext clause : ctx.except_clause()) {
            String name = clause.name() == null ? null : clause.name().getText();
            handlers.add(new ExceptHandler(optional(clause.test()), name, suite(clause.block()), span(clause)));
        }
        List<Stmt> orElse = ctx.ELSE() != null ? suite(blockAfter(ctx, ctx.ELSE())).statements() : List.of();
        List<Stmt> finalBody = ctx.FINALLY() != null
            ? suite(blockAfter(ctx, ctx.FINALLY())).statements()
            : List.of();
        return new Try(suite(ctx.block(0)), handlers, orElse, finalBody, span(ctx));
    }

    private With withStatement(Python3Parser.With_stmtContext ctx, Token async) {
        List<WithItem> items = new ArrayList<>();
        for (Python3Parser.With_itemContext item : ctx.with_item()) {
            items.add(new WithItem(expr(item.test()), optional(item.expr()), span(item)));
        }
        Token start = async != null ? async : ctx.getStart();
        return new With(items, suite(ctx.block()), async != null, span(start, ctx.getStop()));
    }

    private Match match(Python3Parser.Match_stmtContext ctx) {
        requireSoftKeyword(ctx.NAME(), "match");
        List<MatchCase> cases = new ArrayList<>();
        for (Python3Parser.Case_blockContext block : ctx.case_block()) {
            requireSoftKeyword(block.NAME(), "case");
            String pattern = text.slice(startOffset(block.patterns().getStart()),
                endOffset(block.patterns().getStop()));
            Expr guard = block.guard() == null ? null : expr(block.guard().namedexpr_test());
            cases.add(new MatchCase(pattern, guard, suite(block.block()), span(block)));
        }
        return new Match(expr(ctx.testlist_star_expr()), cases, span(ctx));
    }

    private Suite suite(Python3Parser.BlockContext block) {
        ParserRuleContext parent = block.getParent();
        int index = parent.children.indexOf(block);
        Token colon = ((TerminalNode) parent.getChild(index - 1)).getSymbol();
        if (block.simple_stmts() != null) {
            return new Suite(simpleStatements(block.simple_stmts()), true, endOffset(colon));
        }
        List<Stmt> statements = new ArrayList<>();
        for (Python3Parser.StmtContext stmt : block.stmt()) {
            statements.addAll(statements(stmt));
        }
        return new Suite(statements, false, endOffset(block.NEWLINE().getSymbol()));
    }

    private static Python3Parser.BlockContext blockAfter(ParserRuleContext parent, TerminalNode keyword) {
        for (int i = parent.children.indexOf(keyword) + 1; i < parent.getChildCount(); i++) {
            if (parent.getChild(i) instanceof Python3Parser.BlockContext block) {
                return block;
            }
        }
        throw new IllegalStateException("No block after '" + keyword.getText() + "'");
    }

    private Stmt simple(Python3Parser.Simple_stmtContext ctx) {
        if (ctx.expr_stmt() != null) {
            return expressionStatement(ctx.expr_stmt());
        }
        if (ctx.return_stmt() != null) {
            Python3Parser.Return_stmtContext ret = ctx.return_stmt();
            return new Return(optional(ret.testlist_star_expr()), span(ret));
        }
        if (ctx.import_stmt() != null) {
            SourceSpan span = span(ctx.import_stmt());
            return new Import(span.text(text.source()), span);
        }
        if (ctx.pass_stmt() != null || ctx.break_stmt() != null || ctx.continue_stmt() != null) {
            return new ControlStatement(ctx.getText(), span(ctx));
        }
        if (ctx.raise_stmt() != null) {
            Python3Parser.Raise_stmtContext raise = ctx.raise_stmt();
            Expr exc = raise.test().isEmpty() ? null : expr(raise.test(0));
            Expr cause = raise.test().size() > 1 ? expr(raise.test(1)) : null;
            return new Raise(exc, cause, span(raise));
        }
        if (ctx.global_stmt() != null) {
            return new ScopeDeclaration("global", names(ctx.global_stmt().name()), span(ctx));
        }
        if (ctx.nonlocal_stmt() != null) {
            return new ScopeDeclaration("nonlocal", names(ctx.nonlocal_stmt().name()), span(ctx));
        }
        if (ctx.del_stmt() != null) {
            Expr targets = expr(ctx.del_stmt().exprlist());
            List<Expr> list = targets instanceof TupleExpr tuple ? tuple.elements() : List.of(targets);
            return new Delete(list, span(ctx));
        }
        if (ctx.assert_stmt() != null) {
            Python3Parser.Assert_stmtContext check = ctx.assert_stmt();
            Expr message = check.test().size() > 1 ? expr(check.test(1)) : null;
            return new Assert(expr(check.test(0)), message, span(check));
        }
        Python3Parser.Type_aliasContext alias = ctx.type_alias();
        requireSoftKeyword(alias.NAME(), "type");
        return new TypeAlias(alias.name().getText(), expr(alias.test()), span(alias));
    }

    private Stmt expressionStatement(Python3Parser.Expr_stmtContext ctx) {
        List<Python3Parser.Assign_valueContext> values = ctx.assign_value();
        Expr first = expr(values.get(0));
        if (ctx.annassign() != null) {
            Python3Parser.AnnassignContext ann = ctx.annassign();
            return new AnnAssign(first, expr(ann.test()), optional(ann.assign_value()), span(ctx));
        }
        if (ctx.augassign() != null) {
            String op = ctx.augassign().getText();
            return new AugAssign(first, op.substring(0, op.length() - 1), expr(values.get(1)), span(ctx));
        }
        if (!ctx.ASSIGN().isEmpty()) {
            List<Expr> targets = new ArrayList<>();
            for (int i = 0; i < values.size() - 1; i++) {
                targets.add(expr(values.get(i)));
            }
            return new Assign(targets, expr(values.get(values.size() - 1)), span(ctx));
        }
        return new ExprStatement(first, span(ctx));
    }

    private static List<String> names(List<Python3Parser.NameContext> names) {
        List<String> result = new ArrayList<>();
        for (Python3Parser.NameContext name : names) {
            result.add(name.getText());
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Expressions

    @Override
    public Node visitAssign_value(Python3Parser.Assign_valueContext ctx) {
        return ctx.yield_expr() != null ? visit(ctx.yield_expr()) : visit(ctx.testlist_star_expr());
    }

    @Override
    public Node visitYield_expr(Python3Parser.Yield_exprContext ctx) {
        if (ctx.FROM() != null) {
            return new YieldFrom(expr(ctx.test()), span(ctx));
        }
        return new Yield(optional(ctx.testlist_star_expr()), span(ctx));
    }

    @Override
    public Node visitTestlist_star_expr(Python3Parser.Testlist_star_exprContext ctx) {
        return sequence(ctx);
    }

    @Override
    public Node visitExprlist(Python3Parser.ExprlistContext ctx) {
        return sequence(ctx);
    }

    @Override
    public Node visitNamedexpr_test(Python3Parser.Namedexpr_testContext ctx) {
        if (ctx.WALRUS() != null) {
            return new NamedExpr(expr(ctx.test(0)), expr(ctx.test(1)), span(ctx));
        }
        return visit(ctx.test(0));
    }

    @Override
    public Node visitTest(Python3Parser.TestContext ctx) {
        if (ctx.lambdef() != null) {
            return visit(ctx.lambdef());
        }
        if (ctx.IF() != null) {
            return new IfExp(expr(ctx.or_test(1)), expr(ctx.or_test(0)), expr(ctx.test()), span(ctx));
        }
        return visit(ctx.or_test(0));
    }

    @Override
    public Node visitLambdef(Python3Parser.LambdefContext ctx) {
        List<Arg> args = ctx.varargslist() == null ? List.of() : lambdaParameters(ctx.varargslist());
        return new Lambda(args, expr(ctx.test()), span(ctx));
    }

    @Override
    public Node visitOr_test(Python3Parser.Or_testContext ctx) {
        return boolChain("or", ctx, ctx.and_test());
    }

    @Override
    public Node visitAnd_test(Python3Parser.And_testContext ctx) {
        return boolChain("and", ctx, ctx.not_test());
    }

    @Override
    public Node visitNot_test(Python3Parser.Not_testContext ctx) {
        if (ctx.NOT() != null) {
            return new UnaryOp("not", expr(ctx.not_test()), span(ctx));
        }
        return visit(ctx.comparison());
    }

    @Override
    public Node visitComparison(Python3Parser.ComparisonContext ctx) {
        if (ctx.comp_op().isEmpty()) {
            return visit(ctx.expr(0));
        }
        List<String> ops = new ArrayList<>();
        for (Python3Parser.Comp_opContext op : ctx.comp_op()) {
            List<String> words = new ArrayList<>();
            for (int i = 0; i < op.getChildCount(); i++) {
                words.add(op.getChild(i).getText());
            }
            ops.add(String.join(" ", words));
        }
        List<Expr> comparators = new ArrayList<>();
        for (int i = 1; i < ctx.expr().size(); i++) {
            comparators.add(expr(ctx.expr(i)));
        }
        return new Compare(expr(ctx.expr(0)), ops, comparators, span(ctx));
    }

    @Override
    public Node visitStar_expr(Python3Parser.Star_exprContext ctx) {
        return new Starred(expr(ctx.expr()), span(ctx));
    }

    @Override
    public Node visitExpr(Python3Parser.ExprContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public Node visitXor_expr(Python3Parser.Xor_exprContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public Node visitAnd_expr(Python3Parser.And_exprContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public Node visitShift_expr(Python3Parser.Shift_exprContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public Node visitArith_expr(Python3Parser.Arith_exprContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public Node visitTerm(Python3Parser.TermContext ctx) {
        return binaryChain(ctx);
    }

    @Override
    public Node visitFactor(Python3Parser.FactorContext ctx) {
        if (ctx.power() != null) {
            return visit(ctx.power());
        }
        return new UnaryOp(ctx.getChild(0).getText(), expr(ctx.factor()), span(ctx));
    }

    @Override
    public Node visitPower(Python3Parser.PowerContext ctx) {
        if (ctx.POWER() != null) {
            return new BinOp(expr(ctx.await_primary()), "**", expr(ctx.factor()), span(ctx));
        }
        return visit(ctx.await_primary());
    }

    @Override
    public Node visitAwait_primary(Python3Parser.Await_primaryContext ctx) {
        if (ctx.AWAIT() != null) {
            return new Await(expr(ctx.primary()), span(ctx));
        }
        return visit(ctx.primary());
    }

    @Override
    public Node visitPrimary(Python3Parser.PrimaryContext ctx) {
        Expr result = expr(ctx.atom());
        Token start = ctx.getStart();
        for (Python3Parser.TrailerContext trailer : ctx.trailer()) {
            SourceSpan span = span(start, trailer.getStop());
            if (trailer.DOT() != null) {
                result = new Attribute(result, trailer.name().getText(), span);
            } else if (trailer.OPEN_BRACK() != null) {
                result = new Subscript(result, expr(trailer.subscriptlist()), span);
            } else {
                List<Expr> args = new ArrayList<>();
                List<Keyword> keywords = new ArrayList<>();
                if (trailer.arglist() != null) {
                    arguments(trailer.arglist(), args, keywords);
                }
                result = new Call(result, args, keywords, span);
            }
        }
        return result;
    }

    @Override
    public Node visitSubscriptlist(Python3Parser.SubscriptlistContext ctx) {
        if (ctx.subscript_().size() == 1 && ctx.COMMA().isEmpty()) {
            return visit(ctx.subscript_(0));
        }
        List<Expr> items = new ArrayList<>();
        for (Python3Parser.Subscript_Context item : ctx.subscript_()) {
            items.add(expr(item));
        }
        return new TupleExpr(items, span(ctx));
    }

    @Override
    public Node visitSubscript_(Python3Parser.Subscript_Context ctx) {
        if (ctx.star_expr() != null) {
            return visit(ctx.star_expr());
        }
        if (ctx.COLON() == null) {
            return visit(ctx.namedexpr_test());
        }
        int colon = ctx.COLON().getSymbol().getTokenIndex();
        Expr lower = null;
        Expr upper = null;
        for (Python3Parser.TestContext bound : ctx.test()) {
            if (bound.getStart().getTokenIndex() < colon) {
                lower = expr(bound);
            } else {
                upper = expr(bound);
            }
        }
        Expr step = ctx.sliceop() == null ? null : optional(ctx.sliceop().test());
        return new Slice(lower, upper, step, span(ctx));
    }

    @Override
    public Node visitAtom(Python3Parser.AtomContext ctx) {
        if (ctx.name() != null) {
            return new Name(ctx.name().getText(), span(ctx));
        }
        if (ctx.NUMBER() != null) {
            String number = ctx.NUMBER().getText();
            return new Constant(numberKind(number), number, span(ctx));
        }
        if (ctx.strings() != null) {
            return visit(ctx.strings());
        }
        if (ctx.NONE() != null) {
            return new Constant(ConstantKind.NONE, "None", span(ctx));
        }
        if (ctx.TRUE() != null) {
            return new Constant(ConstantKind.TRUE, "True", span(ctx));
        }
        if (ctx.FALSE() != null) {
            return new Constant(ConstantKind.FALSE, "False", span(ctx));
        }
        if (ctx.ELLIPSIS() != null) {
            return new Constant(ConstantKind.ELLIPSIS, "...", span(ctx));
        }
        if (ctx.OPEN_PAREN() != null) {
            return parenthesized(ctx);
        }
        if (ctx.OPEN_BRACK() != null) {
            Python3Parser.Testlist_compContext list = ctx.testlist_comp();
            if (list == null) {
                return new ListExpr(List.of(), span(ctx));
            }
            if (list.comp_for() != null) {
                return new Comprehension(ComprehensionKind.LIST, expr(list.getChild(0)), null,
                    clauses(list.comp_for()), span(ctx));
            }
            return new ListExpr(elements(list), span(ctx));
        }
        return braceDisplay(ctx);
    }

    private Expr parenthesized(Python3Parser.AtomContext ctx) {
        if (ctx.yield_expr() != null) {
            return expr(ctx.yield_expr());
        }
        Python3Parser.Testlist_compContext list = ctx.testlist_comp();
        if (list == null) {
            return new TupleExpr(List.of(), span(ctx));
        }
        if (list.comp_for() != null) {
            return new Comprehension(ComprehensionKind.GENERATOR, expr(list.getChild(0)), null,
                clauses(list.comp_for()), span(ctx));
        }
        List<Expr> items = elements(list);
        if (items.size() == 1 && list.COMMA().isEmpty()) {
            return items.get(0);
        }
        return new TupleExpr(items, span(ctx));
    }

    private Expr braceDisplay(Python3Parser.AtomContext ctx) {
        Python3Parser.DictorsetmakerContext maker = ctx.dictorsetmaker();
        if (maker == null) {
            return new DictExpr(List.of(), span(ctx));
        }
        if (!maker.dict_item().isEmpty()) {
            if (maker.comp_for() != null) {
                Python3Parser.Dict_itemContext item = maker.dict_item(0);
                if (item.POWER() != null) {
                    throw syntaxError(item.getStart());
                }
                return new Comprehension(ComprehensionKind.DICT, expr(item.test(0)), expr(item.test(1)),
                    clauses(maker.comp_for()), span(ctx));
            }
            List<DictItem> items = new ArrayList<>();
            for (Python3Parser.Dict_itemContext item : maker.dict_item()) {
                if (item.POWER() != null) {
                    items.add(new DictItem(null, expr(item.expr()), span(item)));
                } else {
                    items.add(new DictItem(expr(item.test(0)), expr(item.test(1)), span(item)));
                }
            }
            return new DictExpr(items, span(ctx));
        }
        if (maker.comp_for() != null) {
            return new Comprehension(ComprehensionKind.SET, expr(maker.getChild(0)), null,
                clauses(maker.comp_for()), span(ctx));
        }
        List<Expr> items = new ArrayList<>();
        for (ParseTree child : maker.children) {
            if (child instanceof Python3Parser.Namedexpr_testContext || child instanceof Python3Parser.Star_exprContext) {
                items.add(expr(child));
            }
        }
        return new SetExpr(items, span(ctx));
    }

    @Override
    public Node visitStrings(Python3Parser.StringsContext ctx) {
        StringBuilder body = new StringBuilder();
        ConstantKind kind = ConstantKind.STRING;
        for (ParseTree part : ctx.children) {
            if (part instanceof Python3Parser.FstringContext fstring) {
                kind = ConstantKind.FSTRING;
                body.append(text.slice(endOffset(fstring.FSTRING_START().getSymbol()),
                    startOffset(fstring.FSTRING_END().getSymbol())));
            } else {
                String literal = part.getText();
                if (prefixOf(literal).contains("b") && kind == ConstantKind.STRING) {
                    kind = ConstantKind.BYTES;
                }
                body.append(literalBody(literal));
            }
        }
        return new Constant(kind, body.toString(), span(ctx));
    }

    private void arguments(Python3Parser.ArglistContext ctx, List<Expr> args, List<Keyword> keywords) {
        for (Python3Parser.ArgumentContext argument : ctx.argument()) {
            if (argument.ASSIGN() != null) {
                keywords.add(new Keyword(argument.name().getText(), expr(argument.test()), span(argument)));
            } else if (argument.POWER() != null) {
                keywords.add(new Keyword(null, expr(argument.test()), span(argument)));
            } else if (argument.STAR() != null) {
                args.add(new Starred(expr(argument.test()), span(argument)));
            } else if (argument.comp_for() != null) {
                args.add(new Comprehension(ComprehensionKind.GENERATOR, expr(argument.namedexpr_test()), null,
                    clauses(argument.comp_for()), span(argument)));
            } else {
                args.add(expr(argument.namedexpr_test()));
            }
        }
    }

    private List<ComprehensionClause> clauses(Python3Parser.Comp_forContext first) {
        List<ComprehensionClause> clauses = new ArrayList<>();
        Python3Parser.Comp_forContext current = first;
        while (current != null) {
            Python3Parser.Comp_forContext next = null;
            List<Expr> conditions = new ArrayList<>();
            ParserRuleContext last = current.or_test();
            Python3Parser.Comp_iterContext iter = current.comp_iter();
            while (iter != null) {
                if (iter.comp_for() != null) {
                    next = iter.comp_for();
                    break;
                }
                Python3Parser.Comp_ifContext condition = iter.comp_if();
                conditions.add(expr(condition.or_test()));
                last = condition.or_test();
                iter = condition.comp_iter();
            }
            clauses.add(new ComprehensionClause(expr(current.exprlist()), expr(current.or_test()), conditions,
                current.ASYNC() != null, span(current.getStart(), last.getStop())));
            current = next;
        }
        return clauses;
    }

    private List<Expr> elements(Python3Parser.Testlist_compContext ctx) {
        List<Expr> items = new ArrayList<>();
        for (ParseTree child : ctx.children) {
            if (child instanceof Python3Parser.Namedexpr_testContext || child instanceof Python3Parser.Star_exprContext) {
                items.add(expr(child));
            }
        }
        return items;
    }

    /** A comma-separated list: a single item without a trailing comma stands for itself. */
    private Expr sequence(ParserRuleContext ctx) {
        List<Expr> items = new ArrayList<>();
        boolean comma = false;
        for (ParseTree child : ctx.children) {
            if (child instanceof TerminalNode) {
                comma = true;
            } else {
                items.add(expr(child));
            }
        }
        if (items.size() == 1 && !comma) {
            return items.get(0);
        }
        return new TupleExpr(items, span(ctx));
    }

    private Expr boolChain(String op, ParserRuleContext ctx, List<? extends ParserRuleContext> operands) {
        if (operands.size() == 1) {
            return expr(operands.get(0));
        }
        List<Expr> values = new ArrayList<>();
        for (ParserRuleContext operand : operands) {
            values.add(expr(operand));
        }
        return new BoolOp(op, values, span(ctx));
    }

    /** Left-associative operand (operator operand)* chain. */
    private Expr binaryChain(ParserRuleContext ctx) {
        Expr left = expr(ctx.getChild(0));
        for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
            ParserRuleContext right = (ParserRuleContext) ctx.getChild(i + 1);
            left = new BinOp(left, ctx.getChild(i).getText(), expr(right), span(ctx.getStart(), right.getStop()));
        }
        return left;
    }

    private Expr expr(ParseTree tree) {
        return (Expr) visit(tree);
    }

    private Expr optional(ParseTree tree) {
        return tree == null ? null : expr(tree);
    }

    // ------------------------------------------------------------------
    // Literals

    /**
     * Strips prefix and quotes from a single string literal token.
     *
     * @param literal literal as written, for example {@code r"""text"""}
     * @return text between the quotes, escapes untouched
     */
    static String literalBody(String literal) {
        int prefixLength = prefixOf(literal).length();
        String quoted = literal.substring(prefixLength);
        int quoteLength = quoted.length() >= 6
            && (quoted.startsWith("\"\"\"") || quoted.startsWith("'''")) ? 3 : 1;
        return quoted.substring(quoteLength, quoted.length() - quoteLength);
    }

    private static String prefixOf(String literal) {
        int i = 0;
        while (i < literal.length() && Character.isLetter(literal.charAt(i))) {
            i++;
        }
        return literal.substring(0, i).toLowerCase(Locale.ROOT);
    }

    private static ConstantKind numberKind(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.endsWith("j")) {
            return ConstantKind.COMPLEX;
        }
        if (lower.startsWith("0x") || lower.startsWith("0o") || lower.startsWith("0b")) {
            return ConstantKind.INT;
        }
        if (lower.contains(".") || lower.contains("e")) {
            return ConstantKind.FLOAT;
        }
        return ConstantKind.INT;
    }

    // ------------------------------------------------------------------
    // Positions

    private SourceSpan span(ParserRuleContext ctx) {
        return span(ctx.getStart(), ctx.getStop());
    }

    private SourceSpan span(Token start, Token stop) {
        int from = startOffset(start);
        int to = from;
        for (int i = stop.getTokenIndex(); i >= start.getTokenIndex(); i--) {
            Token token = tokens.get(i);
            if (isVisible(token)) {
                to = Math.max(from, endOffset(token));
                break;
            }
        }
        return new SourceSpan(from, to, text.lineOf(from), text.lineOf(Math.max(from, to - 1)));
    }

    private static boolean isVisible(Token token) {
        int type = token.getType();
        return token.getChannel() == Token.DEFAULT_CHANNEL
            && type != Python3Lexer.NEWLINE
            && type != Python3Lexer.INDENT
            && type != Python3Lexer.DEDENT
            && type != Token.EOF;
    }

    private int startOffset(Token token) {
        return text.offset(token.getStartIndex());
    }

    private int endOffset(Token token) {
        return text.offset(token.getStopIndex() + 1);
    }

    private void requireSoftKeyword(TerminalNode node, String keyword) {
        if (!keyword.equals(node.getText())) {
            throw syntaxError(node.getSymbol());
        }
    }

    private static SourceParseException syntaxError(Token token) {
        return new SourceParseException("invalid syntax", token.getLine(), token.getCharPositionInLine() + 1);
    }
}
