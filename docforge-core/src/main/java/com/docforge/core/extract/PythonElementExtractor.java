package com.docforge.core.extract;

import com.docforge.core.model.CodeElement;
import com.docforge.core.model.ElementKind;
import com.docforge.core.model.ExceptionInfo;
import com.docforge.core.model.ExistingDoc;
import com.docforge.core.model.InsertionPoint;
import com.docforge.core.model.Modifier;
import com.docforge.core.model.Parameter;
import com.docforge.core.model.ParameterKind;
import com.docforge.core.model.ReturnInfo;
import com.docforge.core.parser.AstWalker;
import com.docforge.core.parser.PythonAst.Arg;
import com.docforge.core.parser.PythonAst.Attribute;
import com.docforge.core.parser.PythonAst.Call;
import com.docforge.core.parser.PythonAst.ClassDef;
import com.docforge.core.parser.PythonAst.Constant;
import com.docforge.core.parser.PythonAst.ConstantKind;
import com.docforge.core.parser.PythonAst.ExceptHandler;
import com.docforge.core.parser.PythonAst.Expr;
import com.docforge.core.parser.PythonAst.ExprStatement;
import com.docforge.core.parser.PythonAst.For;
import com.docforge.core.parser.PythonAst.FunctionDef;
import com.docforge.core.parser.PythonAst.If;
import com.docforge.core.parser.PythonAst.Match;
import com.docforge.core.parser.PythonAst.MatchCase;
import com.docforge.core.parser.PythonAst.Module;
import com.docforge.core.parser.PythonAst.Name;
import com.docforge.core.parser.PythonAst.Raise;
import com.docforge.core.parser.PythonAst.Return;
import com.docforge.core.parser.PythonAst.Stmt;
import com.docforge.core.parser.PythonAst.Suite;
import com.docforge.core.parser.PythonAst.Try;
import com.docforge.core.parser.PythonAst.TupleExpr;
import com.docforge.core.parser.PythonAst.While;
import com.docforge.core.parser.PythonAst.With;
import com.docforge.core.parser.PythonAst.Yield;
import com.docforge.core.parser.PythonAst.YieldFrom;
import com.docforge.core.parser.PythonAstParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts documentable elements from Python source.
 *
 * <p>Walks the tree produced by {@link PythonAstParser} in source order. Definitions inside
 * {@code if}, {@code try}, {@code with} and loop bodies are found as well. Methods of a class
 * are qualified by the class name, functions nested in functions by the enclosing function.
 *
 * <p>Facts captured per element:
 * <ul>
 *   <li>parameters with annotation and default text; {@code self}/{@code cls} as receiver</li>
 *   <li>return info from annotations, value returns and yields</li>
 *   <li>exception kinds from {@code raise} sites in the element's own scope</li>
 *   <li>an existing leading string literal as {@link ExistingDoc}</li>
 *   <li>the {@link InsertionPoint} after the header line (after the decorators)</li>
 * </ul>
 */
public class PythonElementExtractor implements ElementExtractor {

    private static final Logger log = LoggerFactory.getLogger(PythonElementExtractor.class);

    private static final String DEFAULT_INDENT_UNIT = "    ";
    private static final int DIGEST_MAX_LINES = 6;
    private static final int DIGEST_MAX_CALLS = 8;
    private static final int DIGEST_MAX_LENGTH = 480;

    @Override
    public ExtractionResult extract(String source) {
        Module module = PythonAstParser.parse(source);
        List<ExtractedElement> elements = new ArrayList<>();
        new Visitor(source, elements).visitBlock(module.body(), Scope.MODULE);
        log.debug("Extracted {} elements", elements.size());
        return new ExtractionResult(source, module, elements);
    }

    /**
     * Lexical position of a definition.
     *
     * @param prefix qualified name of the enclosing definition, empty at module level
     * @param inClass true if directly inside a class body
     * @param nested true if inside any function or class
     */
    private record Scope(String prefix, boolean inClass, boolean nested) {
        static final Scope MODULE = new Scope("", false, false);

        String qualify(String name) {
            return prefix.isEmpty() ? name : prefix + "." + name;
        }
    }

    private static final class Visitor {
        private final String source;
        private final List<ExtractedElement> elements;

        Visitor(String source, List<ExtractedElement> elements) {
            this.source = source;
            this.elements = elements;
        }

        void visitBlock(List<Stmt> statements, Scope scope) {
            for (Stmt statement : statements) {
                visitStatement(statement, scope);
            }
        }

        private void visitStatement(Stmt statement, Scope scope) {
            if (statement instanceof FunctionDef function) {
                String qualifiedName = scope.qualify(function.name());
                elements.add(new ExtractedElement(function(function, qualifiedName, scope), function));
                visitBlock(function.body().statements(), new Scope(qualifiedName, false, true));
            } else if (statement instanceof ClassDef type) {
                String qualifiedName = scope.qualify(type.name());
                elements.add(new ExtractedElement(type(type, qualifiedName, scope), type));
                visitBlock(type.body().statements(), new Scope(qualifiedName, true, true));
            } else if (statement instanceof If branch) {
                visitBlock(branch.body().statements(), scope);
                visitBlock(branch.orElse(), scope);
            } else if (statement instanceof While loop) {
                visitBlock(loop.body().statements(), scope);
                visitBlock(loop.orElse(), scope);
            } else if (statement instanceof For loop) {
                visitBlock(loop.body().statements(), scope);
                visitBlock(loop.orElse(), scope);
            } else if (statement instanceof Try block) {
                visitBlock(block.body().statements(), scope);
                for (ExceptHandler handler : block.handlers()) {
                    visitBlock(handler.body().statements(), scope);
                }
                visitBlock(block.orElse(), scope);
                visitBlock(block.finalBody(), scope);
            } else if (statement instanceof With block) {
                visitBlock(block.body().statements(), scope);
            } else if (statement instanceof Match match) {
                for (MatchCase matchCase : match.cases()) {
                    visitBlock(matchCase.body().statements(), scope);
                }
            }
        }

        private CodeElement function(FunctionDef function, String qualifiedName, Scope scope) {
            Set<String> decoratorNames = decoratorNames(function.decorators());
            Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
            if (function.isAsync()) {
                modifiers.add(Modifier.ASYNC);
            }
            addDecoratorModifiers(decoratorNames, modifiers);
            if (scope.nested() && !scope.inClass()) {
                modifiers.add(Modifier.NESTED);
            }

            ElementKind kind = ElementKind.FUNCTION;
            if (scope.inClass()) {
                kind = function.name().equals("__init__") ? ElementKind.CONSTRUCTOR : ElementKind.METHOD;
            }

            List<Stmt> body = function.body().statements();
            boolean generator = !AstWalker.collectInScope(body, Yield.class).isEmpty()
                || !AstWalker.collectInScope(body, YieldFrom.class).isEmpty();
            if (generator) {
                modifiers.add(Modifier.GENERATOR);
            }

            List<Parameter> parameters = parameters(function.args(),
                scope.inClass() && !modifiers.contains(Modifier.STATIC_METHOD));
            ReturnInfo returns = kind == ElementKind.CONSTRUCTOR ? null : returns(function, generator);

            return new CodeElement(kind, function.name(), qualifiedName, parameters, returns,
                raises(body), existingDoc(function.body()), function.span(),
                insertionPoint(function.body(), function.span().startOffset()), 1, modifiers,
                decoratorTexts(function.decorators()), digest(function.body()));
        }

        private CodeElement type(ClassDef type, String qualifiedName, Scope scope) {
            Set<Modifier> modifiers = EnumSet.noneOf(Modifier.class);
            addDecoratorModifiers(decoratorNames(type.decorators()), modifiers);
            if (scope.nested()) {
                modifiers.add(Modifier.NESTED);
            }
            boolean abstractBase = type.bases().stream().map(this::dottedName)
                .anyMatch(name -> name.equals("ABC") || name.endsWith(".ABC"))
                || type.keywords().stream().anyMatch(keyword -> "metaclass".equals(keyword.name())
                    && dottedName(keyword.value()).endsWith("ABCMeta"));
            if (abstractBase) {
                modifiers.add(Modifier.ABSTRACT);
            }
            return new CodeElement(ElementKind.CLASS, type.name(), qualifiedName, List.of(), null,
                List.of(), existingDoc(type.body()), type.span(),
                insertionPoint(type.body(), type.span().startOffset()), 1, modifiers,
                decoratorTexts(type.decorators()), digest(type.body()));
        }

        private List<Parameter> parameters(List<Arg> args, boolean hasReceiver) {
            List<Parameter> parameters = new ArrayList<>();
            for (int i = 0; i < args.size(); i++) {
                Arg arg = args.get(i);
                ParameterKind kind = arg.kind();
                if (i == 0 && hasReceiver
                    && (kind == ParameterKind.POSITIONAL_OR_KEYWORD || kind == ParameterKind.POSITIONAL_ONLY)) {
                    kind = ParameterKind.RECEIVER;
                }
                parameters.add(new Parameter(arg.name(), kind, textOf(arg.annotation()),
                    textOf(arg.defaultValue()), null));
            }
            return parameters;
        }

        private ReturnInfo returns(FunctionDef function, boolean generator) {
            String declared = textOf(function.returns());
            boolean valueReturn = false;
            boolean multiValue = false;
            for (Return statement : AstWalker.collectInScope(function.body().statements(), Return.class)) {
                Expr value = statement.value();
                if (value == null || isNone(value)) {
                    continue;
                }
                valueReturn = true;
                if (value instanceof TupleExpr tuple && !tuple.elements().isEmpty()) {
                    multiValue = true;
                }
            }
            boolean declaresValue = declared != null && !declared.equals("None");
            if (!generator && !valueReturn && !declaresValue) {
                return null;
            }
            return new ReturnInfo(declared, null, generator, multiValue);
        }

        private List<ExceptionInfo> raises(List<Stmt> body) {
            Set<String> boundNames = new HashSet<>();
            for (ExceptHandler handler : AstWalker.collectInScope(body, ExceptHandler.class)) {
                if (handler.name() != null) {
                    boundNames.add(handler.name());
                }
            }
            List<ExceptionInfo> raises = new ArrayList<>();
            for (Raise raise : AstWalker.collectInScope(body, Raise.class)) {
                if (raise.exc() == null) {
                    continue;
                }
                Expr target = raise.exc() instanceof Call call ? call.func() : raise.exc();
                if (!(target instanceof Name) && !(target instanceof Attribute)) {
                    continue;
                }
                String kind = dottedName(target);
                if (boundNames.contains(kind)) {
                    continue;
                }
                raises.add(new ExceptionInfo(kind, messageOf(raise.exc())));
            }
            return raises;
        }

        private String messageOf(Expr raised) {
            if (raised instanceof Call call && !call.args().isEmpty()
                && call.args().get(0) instanceof Constant constant
                && constant.kind() == ConstantKind.STRING && !constant.text().isBlank()) {
                return constant.text().strip();
            }
            return null;
        }

        private ExistingDoc existingDoc(Suite body) {
            if (body.statements().isEmpty()) {
                return null;
            }
            if (body.first() instanceof ExprStatement statement
                && statement.value() instanceof Constant constant
                && constant.kind() == ConstantKind.STRING) {
                String raw = constant.span().text(source);
                return new ExistingDoc(raw, Docstrings.clean(constant.text()), constant.span());
            }
            return null;
        }

        private InsertionPoint insertionPoint(Suite body, int headerOffset) {
            if (body.inline()) {
                String headerIndent = Docstrings.indentationAt(source, headerOffset);
                String unit = headerIndent.contains("\t") ? "\t" : DEFAULT_INDENT_UNIT;
                return new InsertionPoint(body.bodyStart(), headerIndent + unit, true);
            }
            String indent = Docstrings.indentationAt(source, body.first().span().startOffset());
            return new InsertionPoint(body.bodyStart(), indent, false);
        }

        private String digest(Suite body) {
            List<Stmt> statements = body.statements();
            int first = existingDoc(body) != null ? 1 : 0;
            if (statements.size() <= first) {
                return "";
            }
            int start = statements.get(first).span().startOffset();
            int end = statements.get(statements.size() - 1).span().endOffset();
            List<String> lines = new ArrayList<>();
            for (String line : source.substring(start, end).split("\r\n|\r|\n")) {
                if (!line.isBlank() && lines.size() < DIGEST_MAX_LINES) {
                    lines.add(line.strip());
                }
            }
            Set<String> calls = new LinkedHashSet<>();
            for (Call call : AstWalker.collectInScope(statements.subList(first, statements.size()), Call.class)) {
                String name = dottedName(call.func());
                if (!name.isEmpty() && calls.size() < DIGEST_MAX_CALLS) {
                    calls.add(name);
                }
            }
            StringBuilder digest = new StringBuilder(String.join("\n", lines));
            if (!calls.isEmpty()) {
                digest.append("\ncalls: ").append(String.join(", ", calls));
            }
            return digest.length() > DIGEST_MAX_LENGTH ? digest.substring(0, DIGEST_MAX_LENGTH) : digest.toString();
        }

        private Set<String> decoratorNames(List<Expr> decorators) {
            Set<String> names = new LinkedHashSet<>();
            for (Expr decorator : decorators) {
                Expr target = decorator instanceof Call call ? call.func() : decorator;
                names.add(dottedName(target));
            }
            return names;
        }

        private void addDecoratorModifiers(Set<String> decoratorNames, Set<Modifier> modifiers) {
            if (decoratorNames.isEmpty()) {
                return;
            }
            modifiers.add(Modifier.DECORATED);
            for (String name : decoratorNames) {
                String last = name.substring(name.lastIndexOf('.') + 1);
                switch (last) {
                    case "staticmethod" -> modifiers.add(Modifier.STATIC_METHOD);
                    case "classmethod" -> modifiers.add(Modifier.CLASS_METHOD);
                    case "property", "cached_property", "setter", "getter", "deleter" ->
                        modifiers.add(Modifier.PROPERTY);
                    case "abstractmethod" -> modifiers.add(Modifier.ABSTRACT);
                    default -> {
                        // other decorators only mark the element as decorated
                    }
                }
            }
        }

        private List<String> decoratorTexts(List<Expr> decorators) {
            return decorators.stream().map(decorator -> decorator.span().text(source)).toList();
        }

        private String dottedName(Expr expr) {
            if (expr instanceof Name name) {
                return name.id();
            }
            if (expr instanceof Attribute attribute) {
                String owner = dottedName(attribute.value());
                return owner.isEmpty() ? attribute.attr() : owner + "." + attribute.attr();
            }
            return "";
        }

        private String textOf(Expr expr) {
            return expr == null ? null : expr.span().text(source);
        }

        private static boolean isNone(Expr expr) {
            return expr instanceof Constant constant && constant.kind() == ConstantKind.NONE;
        }
    }
}
