package dev.directives.engine;

import dev.directives.ast.ClassDef;
import dev.directives.ast.ClassMember;
import dev.directives.ast.ClassMember.MethodDefinition;
import dev.directives.ast.ClassMember.MethodKind;
import dev.directives.ast.ClassMember.PropertyDefinition;
import dev.directives.ast.ClassMember.StaticBlock;
import dev.directives.ast.Expression;
import dev.directives.ast.Expression.ArrowFunctionExpression;
import dev.directives.ast.Expression.CallExpression;
import dev.directives.ast.Expression.ClassExpression;
import dev.directives.ast.Expression.FunctionExpression;
import dev.directives.ast.Expression.Identifier;
import dev.directives.ast.Expression.MemberExpression;
import dev.directives.ast.Expression.NewExpression;
import dev.directives.ast.Expression.ObjectExpression;
import dev.directives.ast.Expression.SpreadElement;
import dev.directives.ast.Expression.SuperExpression;
import dev.directives.ast.Expression.ThisExpression;
import dev.directives.ast.Function;
import dev.directives.ast.FunctionNode;
import dev.directives.ast.Node;
import dev.directives.ast.Nodes;
import dev.directives.ast.ObjectMember;
import dev.directives.ast.ObjectMember.MethodProperty;
import dev.directives.ast.ObjectMember.Property;
import dev.directives.ast.Pattern;
import dev.directives.ast.Pattern.PatternProperty;
import dev.directives.ast.Program;
import dev.directives.ast.Span;
import dev.directives.ast.Statement;
import dev.directives.ast.Statement.ClassDeclaration;
import dev.directives.ast.Statement.ExportAllDeclaration;
import dev.directives.ast.Statement.ExportDefaultDeclaration;
import dev.directives.ast.Statement.ExportNamedDeclaration;
import dev.directives.ast.Statement.ExportSpecifier;
import dev.directives.ast.Statement.FunctionDeclaration;
import dev.directives.ast.Statement.ReturnStatement;
import dev.directives.ast.Statement.VariableDeclaration;
import dev.directives.ast.Statement.VariableDeclarator;
import dev.directives.model.ClassSerializationEntry;
import dev.directives.model.Diagnostic;
import dev.directives.model.DiagnosticKind;
import dev.directives.model.Directive;
import dev.directives.model.FunctionKind;
import dev.directives.model.FunctionShape;
import dev.directives.model.Placement;
import dev.directives.model.StepFunction;
import dev.directives.model.TransformConfig;
import dev.directives.model.WorkflowFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classification pass: finds every step and workflow function in a module, validates it, names it
 * and assigns its identity. Read-only over the tree; everything it learns goes into {@link ModuleFacts}.
 *
 * <p>Naming follows where a function sits. Module-level functions use their binding. Nested ones
 * are qualified by the chain of enclosing functions, classes and object-literal keys, joined with
 * {@code /} in identities and with {@code $} in hoisted identifiers. Unnamed nested steps become
 * {@code _anonymousStep0}, {@code _anonymousStep1}, ... in discovery order.
 */
public final class FunctionClassifier {

    private static final Logger log = LoggerFactory.getLogger(FunctionClassifier.class);

    private static final String ANONYMOUS_STEP = "_anonymousStep";
    private static final String DEFAULT_EXPORT = "default";
    private static final String DEFAULT_BINDING = "__default";

    private final IdentityGenerator identity;
    private final ClassSerializationRegistrar.HookAliases aliases;
    private final NameAllocator allocator;
    private final Set<String> declaredNames;

    private final Map<FunctionNode, StepFunction> steps = new IdentityHashMap<>();
    private final Map<FunctionNode, WorkflowFunction> workflows = new IdentityHashMap<>();
    private final Map<FunctionNode, FunctionRef> refs = new IdentityHashMap<>();
    private final List<FunctionNode> stepOrder = new ArrayList<>();
    private final List<FunctionNode> workflowOrder = new ArrayList<>();
    private final Set<FunctionNode> insideStep = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<FunctionNode> insideWorkflow = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<FunctionNode> implicit = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<ClassSerializationEntry> classes = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<String, String> exportNames = new HashMap<>();

    private Directive moduleDirective;
    private String defaultBinding;
    private int anonymousSteps;

    private FunctionClassifier(IdentityGenerator identity, List<Statement> body) {
        this.identity = identity;
        this.aliases = ClassSerializationRegistrar.collectAliases(body);
        this.declaredNames = mentionedNames(body);
        this.allocator = new NameAllocator(declaredNames);
    }

    public static ModuleFacts classify(Program program, TransformConfig config) {
        List<Statement> body = program.body();
        var classifier = new FunctionClassifier(IdentityGenerator.forModule(config), body);
        ModuleFacts facts = classifier.run(body);
        log.debug("Classified {}: {} step(s), {} workflow(s), {} class(es), {} diagnostic(s)",
            config.normalizedFilename(), facts.steps().size(), facts.workflows().size(), facts.classes().size(),
            facts.diagnostics().size());
        return facts;
    }

    private ModuleFacts run(List<Statement> body) {
        DirectiveScanner.ModuleScan moduleScan = DirectiveScanner.scanModule(body);
        diagnostics.addAll(moduleScan.diagnostics());
        moduleDirective = moduleScan.directive();
        collectExportNames(body);
        if (moduleDirective != null) {
            markImplicitExports(body);
        }
        Scope root = Scope.module();
        for (Statement statement : body) {
            topLevel(statement, root);
        }
        return new ModuleFacts(moduleDirective, moduleScan.honoredStatements(), steps, workflows, refs, stepOrder,
            workflowOrder, insideStep, insideWorkflow, classes, defaultBinding, declaredNames, diagnostics);
    }

    // ---- module level ------------------------------------------------------------------------

    private void topLevel(Statement statement, Scope scope) {
        if (statement instanceof ExportNamedDeclaration export && export.declaration() != null) {
            topLevel(export.declaration(), scope);
        } else if (statement instanceof FunctionDeclaration declaration) {
            String name = declaration.function().id().name();
            topLevelFunction(declaration.function(), name, name, exportKey(name), FunctionShape.DECLARATION,
                declaration.span(), scope);
        } else if (statement instanceof VariableDeclaration declaration) {
            for (VariableDeclarator declarator : declaration.declarations()) {
                topLevelDeclarator(declarator, scope);
            }
        } else if (statement instanceof ClassDeclaration declaration) {
            ClassDef definition = declaration.definition();
            classBody(definition, definition.id() == null ? null : definition.id().name(), true, scope);
        } else if (statement instanceof ExportDefaultDeclaration export) {
            defaultExport(export, scope);
        } else {
            visitStatement(statement, scope);
        }
    }

    private void topLevelDeclarator(VariableDeclarator declarator, Scope scope) {
        if (!(declarator.id() instanceof Identifier id)) {
            visitNode(declarator.id(), scope);
            visitOptional(declarator.init(), scope, null);
            return;
        }
        String name = id.name();
        Expression init = declarator.init();
        if (init instanceof FunctionExpression expression) {
            topLevelFunction(expression.function(), name, name, exportKey(name), FunctionShape.EXPRESSION,
                declarator.span(), scope);
        } else if (init instanceof ArrowFunctionExpression arrow) {
            topLevelFunction(arrow, name, name, exportKey(name), FunctionShape.ARROW, declarator.span(), scope);
        } else if (init instanceof ClassExpression expression) {
            classBody(expression.definition(), name, true, scope);
        } else {
            visitOptional(init, scope.withObjectPath(List.of(name)), NameHint.binding(name));
        }
    }

    private void defaultExport(ExportDefaultDeclaration export, Scope scope) {
        Node declaration = export.declaration();
        if (declaration instanceof FunctionDeclaration function) {
            Identifier id = function.function().id();
            if (id != null) {
                topLevelFunction(function.function(), id.name(), id.name(), DEFAULT_EXPORT, FunctionShape.DECLARATION,
                    function.span(), scope);
            } else {
                anonymousDefault(function.function(), FunctionShape.DECLARATION, function.span(), scope);
            }
        } else if (declaration instanceof ClassDeclaration classDeclaration) {
            ClassDef definition = classDeclaration.definition();
            classBody(definition, definition.id() == null ? null : definition.id().name(), true, scope);
        } else if (declaration instanceof FunctionExpression expression) {
            anonymousDefault(expression.function(), FunctionShape.EXPRESSION, expression.span(), scope);
        } else if (declaration instanceof ArrowFunctionExpression arrow) {
            anonymousDefault(arrow, FunctionShape.ARROW, arrow.span(), scope);
        } else if (declaration instanceof Expression expression) {
            visitExpression(expression, scope.withObjectPath(List.of(DEFAULT_EXPORT)), null);
        }
    }

    private void anonymousDefault(FunctionNode function, FunctionShape shape, Span span, Scope scope) {
        if (!DirectiveScanner.hasDirective(function) && !implicit.contains(function)) {
            visitFunction(function, scope.enter(List.of(), function));
            return;
        }
        if (defaultBinding == null) {
            defaultBinding = allocator.allocate(DEFAULT_BINDING);
        }
        topLevelFunction(function, DEFAULT_EXPORT, defaultBinding, DEFAULT_EXPORT, shape, span, scope);
    }

    private void topLevelFunction(FunctionNode function, String qualifiedName, String binding, String exportKey,
                                  FunctionShape shape, Span span, Scope scope) {
        Directive directive = directiveOf(function);
        Segment segment = Segment.of(qualifiedName);
        if (directive == null || !accepts(function, directive, span)) {
            visitFunction(function, scope.enter(List.of(segment), function));
            return;
        }
        if (directive.kind() == FunctionKind.WORKFLOW) {
            if (reportForbidden(function, directive)) {
                visitFunction(function, scope.enter(List.of(segment), function));
                return;
            }
            var workflow = new WorkflowFunction(exportKey, binding, qualifiedName, identity.workflow(qualifiedName),
                span, shape, Placement.TOP_LEVEL);
            workflows.put(function, workflow);
            refs.put(function, new FunctionRef.Binding(binding));
            visitFunction(function, scope.enter(List.of(segment), function).inWorkflow(qualifiedName));
            workflowOrder.add(function);
        } else {
            var step = new StepFunction(qualifiedName, identity.step(qualifiedName), List.of(), span, shape,
                Placement.TOP_LEVEL, null);
            steps.put(function, step);
            refs.put(function, new FunctionRef.Binding(binding));
            visitFunction(function, scope.enter(List.of(segment), function).inStep(function));
            stepOrder.add(function);
        }
    }

    // ---- classes -----------------------------------------------------------------------------

    private void classBody(ClassDef definition, String className, boolean moduleLevel, Scope scope) {
        visitOptional(definition.superClass(), scope.withoutObjectPath(), null);
        boolean ownsSteps = false;
        for (ClassMember member : definition.body()) {
            if (member instanceof MethodDefinition method) {
                ownsSteps |= classMethod(method, className, moduleLevel, scope);
            } else if (member instanceof PropertyDefinition property) {
                if (property.computed()) {
                    visitExpression(property.key(), scope.withoutObjectPath(), null);
                }
                String name = Nodes.propertyName(property.key(), property.computed());
                Scope inner = className == null ? scope : scope.withSegment(Segment.of(className));
                visitOptional(property.value(), inner.withoutObjectPath(), name == null ? null : NameHint.binding(name));
            } else {
                Scope inner = className == null ? scope : scope.withSegment(Segment.of(className));
                ((StaticBlock) member).body().forEach(statement -> visitStatement(statement, inner));
            }
        }
        if (moduleLevel && className != null) {
            boolean custom = ClassSerializationRegistrar.hasCustomSerialization(definition, aliases);
            if (custom || ownsSteps) {
                classes.add(new ClassSerializationEntry(className, identity.classId(className), custom, ownsSteps));
            }
        }
    }

    /** Classifies one method; returns true when it became a step. */
    private boolean classMethod(MethodDefinition method, String className, boolean moduleLevel, Scope scope) {
        if (method.computed()) {
            visitExpression(method.key(), scope.withoutObjectPath(), null);
        }
        Function function = method.value();
        String memberName = Nodes.propertyName(method.key(), method.computed());
        String qualifiedName = className == null || memberName == null ? null
            : className + (method.isStatic() ? "." : "#") + memberName;
        List<Segment> segments = qualifiedName == null
            ? (memberName == null ? List.of() : List.of(Segment.of(memberName)))
            : List.of(new Segment(qualifiedName, className + "$" + memberName));
        Scope inner = scope.enter(segments, function);

        Directive directive = directiveOf(function);
        if (directive == null) {
            visitFunction(function, inner);
            return false;
        }
        String problem = methodProblem(method, directive, qualifiedName, moduleLevel);
        if (problem != null) {
            diagnostics.add(Diagnostic.of(DiagnosticKind.MISPLACED_DIRECTIVE, method.span(), problem));
            visitFunction(function, inner);
            return false;
        }
        if (!function.async()) {
            diagnostics.add(Diagnostic.of(DiagnosticKind.NON_ASYNC_FUNCTION, method.span(), directive));
            visitFunction(function, inner);
            return false;
        }
        Placement placement = method.isStatic() ? Placement.STATIC_METHOD : Placement.INSTANCE_METHOD;
        FunctionShape shape = method.isStatic() ? FunctionShape.STATIC_METHOD : FunctionShape.INSTANCE_METHOD;
        FunctionRef ref = method.isStatic()
            ? new FunctionRef.StaticMember(className, memberName)
            : new FunctionRef.PrototypeMember(className, memberName);
        if (directive.kind() == FunctionKind.WORKFLOW) {
            workflows.put(function, new WorkflowFunction(qualifiedName, ref.displayName(), qualifiedName,
                identity.workflow(qualifiedName), method.span(), shape, placement));
            refs.put(function, ref);
            visitFunction(function, inner.inWorkflow(qualifiedName));
            workflowOrder.add(function);
            return false;
        }
        steps.put(function, new StepFunction(qualifiedName, identity.step(qualifiedName), List.of(), method.span(),
            shape, placement, null));
        refs.put(function, ref);
        visitFunction(function, inner.inStep(function));
        stepOrder.add(function);
        return true;
    }

    private static String methodProblem(MethodDefinition method, Directive directive, String qualifiedName,
                                        boolean moduleLevel) {
        if (method.kind() != MethodKind.METHOD) {
            return "Getters, setters and constructors cannot be marked with " + directive;
        }
        if (directive.kind() == FunctionKind.WORKFLOW && !method.isStatic()) {
            return "Instance methods cannot be marked with " + directive + "; only static methods can be workflows";
        }
        if (!moduleLevel || qualifiedName == null) {
            return "Methods marked with " + directive
                + " must have a static name and belong to a named class declared at module level";
        }
        return null;
    }

    // ---- nested functions --------------------------------------------------------------------

    private void nestedFunction(FunctionNode function, NameHint hint, FunctionShape shape, Span span, Scope scope) {
        Directive directive = directiveOf(function);
        List<Segment> own = hint == null ? List.of() : hint.segments();
        if (directive == null || !accepts(function, directive, span)) {
            visitFunction(function, scope.enter(own, function));
            return;
        }
        if (directive.kind() == FunctionKind.WORKFLOW) {
            diagnostics.add(Diagnostic.of(DiagnosticKind.MISPLACED_DIRECTIVE, span,
                "Functions marked with " + directive + " must be declared at module level or as static methods"));
            visitFunction(function, scope.enter(own, function));
            return;
        }
        if (reportForbidden(function, directive)) {
            visitFunction(function, scope.enter(own, function));
            return;
        }
        List<Segment> segments = new ArrayList<>(scope.chain());
        segments.addAll(hint == null ? List.of(Segment.of(ANONYMOUS_STEP + anonymousSteps++)) : own);
        String qualifiedName = Segment.joinIds(segments);
        String hoistedName = allocator.allocate(Segment.joinIdentifiers(segments));
        List<String> closure = new ArrayList<>(new TreeSet<>(ClosureAnalyzer.freeVariables(function)));
        closure.retainAll(scope.functionBindings());

        steps.put(function, new StepFunction(qualifiedName, identity.step(qualifiedName), closure, span, shape,
            Placement.NESTED, scope.enclosingWorkflow()));
        refs.put(function, new FunctionRef.Binding(hoistedName));
        markEnclosure(function, scope);
        visitFunction(function, scope.replaceChain(segments, function).inStep(function));
        stepOrder.add(function);
    }

    private void markEnclosure(FunctionNode function, Scope scope) {
        if (scope.enclosingStep() != null) {
            insideStep.add(function);
        }
        if (scope.enclosingWorkflow() != null) {
            insideWorkflow.add(function);
        }
    }

    /** Directive carried by the function itself, or the module directive for an exported function. */
    private Directive directiveOf(FunctionNode function) {
        DirectiveScanner.FunctionScan scan = DirectiveScanner.scanFunction(function);
        diagnostics.addAll(scan.diagnostics());
        if (scan.found()) {
            return scan.directive();
        }
        return implicit.contains(function) ? moduleDirective : null;
    }

    private boolean accepts(FunctionNode function, Directive directive, Span span) {
        if (!function.async()) {
            diagnostics.add(Diagnostic.of(DiagnosticKind.NON_ASYNC_FUNCTION, span, directive));
            return false;
        }
        return true;
    }

    private boolean reportForbidden(FunctionNode function, Directive directive) {
        Node body = function instanceof ArrowFunctionExpression arrow ? arrow.body() : function.blockBody();
        Node offending = findForbidden(body);
        if (offending == null) {
            return false;
        }
        String what = offending instanceof ThisExpression ? "this"
            : offending instanceof SuperExpression ? "super" : "arguments";
        String kind = directive.kind() == FunctionKind.STEP ? "step" : "workflow";
        diagnostics.add(Diagnostic.of(DiagnosticKind.FORBIDDEN_EXPRESSION, offending.span(), what, kind));
        return true;
    }

    /** First {@code this}, {@code super} or {@code arguments}, looking through arrows only. */
    static Node findForbidden(Node node) {
        if (node == null || node instanceof Function || node instanceof ClassDef) {
            return null;
        }
        if (node instanceof ThisExpression || node instanceof SuperExpression) {
            return node;
        }
        if (node instanceof Identifier id) {
            return id.name().equals("arguments") ? node : null;
        }
        if (node instanceof MemberExpression member && !member.computed()) {
            return findForbidden(member.object());
        }
        if (node instanceof Property property && !property.computed()) {
            return findForbidden(property.value());
        }
        if (node instanceof PatternProperty property && !property.computed()) {
            return findForbidden(property.value());
        }
        for (Node child : Nodes.children(node)) {
            Node found = findForbidden(child);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    // ---- generic traversal -------------------------------------------------------------------

    private void visitFunction(FunctionNode function, Scope inner) {
        for (Pattern param : function.params()) {
            visitNode(param, inner);
        }
        if (function instanceof ArrowFunctionExpression arrow && !(arrow.body() instanceof Statement)) {
            visitExpression((Expression) arrow.body(), inner.withObjectPath(List.of()), null);
            return;
        }
        for (Statement statement : function.blockBody().body()) {
            visitStatement(statement, inner);
        }
    }

    private void visitStatement(Statement statement, Scope scope) {
        if (statement instanceof FunctionDeclaration declaration) {
            String name = declaration.function().id() == null ? null : declaration.function().id().name();
            nestedFunction(declaration.function(), name == null ? null : NameHint.binding(name),
                FunctionShape.DECLARATION, declaration.span(), scope);
        } else if (statement instanceof VariableDeclaration declaration) {
            for (VariableDeclarator declarator : declaration.declarations()) {
                if (declarator.id() instanceof Identifier id) {
                    visitOptional(declarator.init(), scope.withObjectPath(List.of(id.name())),
                        NameHint.binding(id.name()));
                } else {
                    visitNode(declarator.id(), scope);
                    visitOptional(declarator.init(), scope.withoutObjectPath(), null);
                }
            }
        } else if (statement instanceof ClassDeclaration declaration) {
            ClassDef definition = declaration.definition();
            classBody(definition, definition.id() == null ? null : definition.id().name(), false, scope);
        } else if (statement instanceof ReturnStatement ret) {
            visitOptional(ret.argument(), scope.withObjectPath(List.of()), null);
        } else {
            for (Node child : Nodes.children(statement)) {
                visitNode(child, scope.withoutObjectPath());
            }
        }
    }

    private void visitNode(Node node, Scope scope) {
        if (node instanceof Statement statement) {
            visitStatement(statement, scope);
        } else if (node instanceof Expression expression) {
            visitExpression(expression, scope, null);
        } else if (node instanceof ClassDef definition) {
            classBody(definition, definition.id() == null ? null : definition.id().name(), false, scope);
        } else if (node != null) {
            for (Node child : Nodes.children(node)) {
                visitNode(child, scope);
            }
        }
    }

    private void visitOptional(Expression expression, Scope scope, NameHint hint) {
        if (expression != null) {
            visitExpression(expression, scope, hint);
        }
    }

    private void visitExpression(Expression expression, Scope scope, NameHint hint) {
        if (expression instanceof FunctionExpression e) {
            NameHint name = hint != null ? hint
                : e.function().id() == null ? null : NameHint.binding(e.function().id().name());
            FunctionShape shape = hint != null && hint.fromProperty() ? FunctionShape.OBJECT_PROPERTY
                : FunctionShape.EXPRESSION;
            nestedFunction(e.function(), name, shape, e.span(), scope);
        } else if (expression instanceof ArrowFunctionExpression e) {
            FunctionShape shape = hint != null && hint.fromProperty() ? FunctionShape.OBJECT_PROPERTY
                : FunctionShape.ARROW;
            nestedFunction(e, hint, shape, e.span(), scope);
        } else if (expression instanceof ObjectExpression e) {
            for (ObjectMember member : e.properties()) {
                objectMember(member, scope);
            }
        } else if (expression instanceof CallExpression e) {
            visitExpression(e.callee(), scope.withoutObjectPath(), null);
            for (Expression argument : e.arguments()) {
                visitExpression(argument, scope, null);
            }
        } else if (expression instanceof NewExpression e) {
            visitExpression(e.callee(), scope.withoutObjectPath(), null);
            for (Expression argument : e.arguments()) {
                visitExpression(argument, scope.withoutObjectPath(), null);
            }
        } else if (expression instanceof ClassExpression e) {
            ClassDef definition = e.definition();
            String name = definition.id() != null ? definition.id().name()
                : hint != null && !hint.fromProperty() ? hint.name() : null;
            classBody(definition, name, false, scope);
        } else {
            for (Node child : Nodes.children(expression)) {
                visitNode(child, scope.withoutObjectPath());
            }
        }
    }

    private void objectMember(ObjectMember member, Scope scope) {
        if (member instanceof Property property) {
            if (property.computed()) {
                visitExpression(property.key(), scope.withoutObjectPath(), null);
            }
            String name = Nodes.propertyName(property.key(), property.computed());
            if (scope.objectPath() != null && name != null) {
                var path = new ArrayList<>(scope.objectPath());
                NameHint hint = NameHint.property(path, name);
                path.add(name);
                visitExpression(property.value(), scope.withObjectPath(path), hint);
            } else {
                visitExpression(property.value(), scope.withoutObjectPath(), null);
            }
        } else if (member instanceof MethodProperty method) {
            if (method.computed()) {
                visitExpression(method.key(), scope.withoutObjectPath(), null);
            }
            String name = Nodes.propertyName(method.key(), method.computed());
            if (scope.objectPath() != null && name != null) {
                nestedFunction(method.value(), NameHint.property(scope.objectPath(), name), FunctionShape.OBJECT_METHOD,
                    method.span(), scope.withoutObjectPath());
            } else {
                nestedFunction(method.value(), null, FunctionShape.EXPRESSION, method.span(),
                    scope.withoutObjectPath());
            }
        } else {
            visitExpression(((SpreadElement) member).argument(), scope.withoutObjectPath(), null);
        }
    }

    // ---- module directive --------------------------------------------------------------------

    private void collectExportNames(List<Statement> body) {
        for (Statement statement : body) {
            if (statement instanceof ExportDefaultDeclaration export && export.declaration() instanceof Identifier id) {
                exportNames.putIfAbsent(id.name(), DEFAULT_EXPORT);
            } else if (statement instanceof ExportNamedDeclaration export && export.source() == null) {
                for (ExportSpecifier specifier : export.specifiers()) {
                    exportNames.putIfAbsent(specifier.local(), specifier.exported());
                }
            }
        }
    }

    private String exportKey(String binding) {
        return exportNames.getOrDefault(binding, binding);
    }

    /**
     * Under a module-level directive every export must be an async function; those become implicit
     * steps or workflows.
     */
    private void markImplicitExports(List<Statement> body) {
        Map<String, FunctionNode> functions = topLevelFunctions(body);
        for (Statement statement : body) {
            if (statement instanceof ExportAllDeclaration all) {
                invalidExport(all.span(), "Re-exporting everything from '" + all.source().value() + "' is not allowed");
            } else if (statement instanceof ExportNamedDeclaration export) {
                if (export.source() != null) {
                    invalidExport(export.span(), "Re-exports from '" + export.source().value() + "' are not allowed");
                } else if (export.declaration() != null) {
                    implicitDeclaration(export.declaration());
                } else {
                    for (ExportSpecifier specifier : export.specifiers()) {
                        markImplicit(functions.get(specifier.local()), specifier.exported(), specifier.span());
                    }
                }
            } else if (statement instanceof ExportDefaultDeclaration export) {
                Node declaration = export.declaration();
                FunctionNode function = null;
                if (declaration instanceof FunctionDeclaration d) {
                    function = d.function();
                } else if (declaration instanceof FunctionExpression e) {
                    function = e.function();
                } else if (declaration instanceof ArrowFunctionExpression arrow) {
                    function = arrow;
                } else if (declaration instanceof Identifier id) {
                    function = functions.get(id.name());
                }
                markImplicit(function, DEFAULT_EXPORT, export.span());
            }
        }
    }

    private void implicitDeclaration(Statement declaration) {
        if (declaration instanceof FunctionDeclaration d) {
            markImplicit(d.function(), d.function().id().name(), d.span());
        } else if (declaration instanceof VariableDeclaration variables) {
            for (VariableDeclarator declarator : variables.declarations()) {
                String name = declarator.id() instanceof Identifier id ? id.name() : "destructured binding";
                markImplicit(asFunction(declarator.init()), name, declarator.span());
            }
        } else if (declaration instanceof ClassDeclaration classDeclaration) {
            String name = classDeclaration.definition().id() == null ? DEFAULT_EXPORT
                : classDeclaration.definition().id().name();
            invalidExport(classDeclaration.span(), "Class '" + name + "' cannot be exported");
        }
    }

    private void markImplicit(FunctionNode function, String exportName, Span span) {
        if (function == null || !function.async()) {
            invalidExport(span, "Export '" + exportName + "' is not an async function");
            return;
        }
        implicit.add(function);
    }

    private void invalidExport(Span span, String detail) {
        diagnostics.add(Diagnostic.of(DiagnosticKind.INVALID_EXPORT, span, moduleDirective, detail));
    }

    private static Map<String, FunctionNode> topLevelFunctions(List<Statement> body) {
        var functions = new LinkedHashMap<String, FunctionNode>();
        for (Statement statement : body) {
            Statement declaration = statement instanceof ExportNamedDeclaration export && export.declaration() != null
                ? export.declaration() : statement;
            if (declaration instanceof FunctionDeclaration d && d.function().id() != null) {
                functions.put(d.function().id().name(), d.function());
            } else if (declaration instanceof VariableDeclaration variables) {
                for (VariableDeclarator declarator : variables.declarations()) {
                    FunctionNode function = asFunction(declarator.init());
                    if (declarator.id() instanceof Identifier id && function != null) {
                        functions.put(id.name(), function);
                    }
                }
            }
        }
        return functions;
    }

    private static FunctionNode asFunction(Expression expression) {
        if (expression instanceof FunctionExpression e) {
            return e.function();
        }
        if (expression instanceof ArrowFunctionExpression arrow) {
            return arrow;
        }
        return null;
    }

    private static Set<String> mentionedNames(List<Statement> body) {
        var names = new HashSet<String>();
        for (Statement statement : body) {
            Nodes.walk(statement, node -> {
                if (node instanceof Identifier id) {
                    names.add(id.name());
                }
                return true;
            });
        }
        return names;
    }

    // ---- context -----------------------------------------------------------------------------

    /** One link of a qualified name: its identity text and its identifier-safe text. */
    private record Segment(String id, String identifier) {

        static Segment of(String name) {
            return new Segment(name, name);
        }

        static String joinIds(List<Segment> segments) {
            var joined = new StringBuilder();
            for (Segment segment : segments) {
                if (joined.length() > 0) {
                    joined.append('/');
                }
                joined.append(segment.id());
            }
            return joined.toString();
        }

        static String joinIdentifiers(List<Segment> segments) {
            var joined = new StringBuilder();
            for (Segment segment : segments) {
                if (joined.length() > 0) {
                    joined.append('$');
                }
                joined.append(segment.identifier());
            }
            return joined.toString();
        }
    }

    /**
     * Name a function would take at its position: a variable binding, or an object key under a path of
     * enclosing keys.
     */
    private record NameHint(List<String> path, String name, boolean fromProperty) {

        static NameHint binding(String name) {
            return new NameHint(List.of(), name, false);
        }

        static NameHint property(List<String> path, String name) {
            return new NameHint(List.copyOf(path), name, true);
        }

        List<Segment> segments() {
            var segments = new ArrayList<Segment>();
            path.forEach(p -> segments.add(Segment.of(p)));
            segments.add(Segment.of(name));
            return segments;
        }
    }

    /**
     * Immutable traversal context.
     *
     * @param objectPath       keys leading to the current object literal, or null where keys do not name
     *                         functions
     * @param functionBindings names bound by enclosing functions; only these can be closure variables
     */
    private record Scope(
        List<Segment> chain,
        List<String> objectPath,
        Set<String> functionBindings,
        FunctionNode enclosingStep,
        String enclosingWorkflow
    ) {

        static Scope module() {
            return new Scope(List.of(), null, Set.of(), null, null);
        }

        Scope withObjectPath(List<String> path) {
            return new Scope(chain, List.copyOf(path), functionBindings, enclosingStep, enclosingWorkflow);
        }

        Scope withoutObjectPath() {
            return objectPath == null ? this
                : new Scope(chain, null, functionBindings, enclosingStep, enclosingWorkflow);
        }

        Scope withSegment(Segment segment) {
            var extended = new ArrayList<>(chain);
            extended.add(segment);
            return new Scope(extended, objectPath, functionBindings, enclosingStep, enclosingWorkflow);
        }

        /** Scope for the body of {@code function}, whose own name contributes {@code segments}. */
        Scope enter(List<Segment> segments, FunctionNode function) {
            var extended = new ArrayList<>(chain);
            extended.addAll(segments);
            return replaceChain(extended, function);
        }

        Scope replaceChain(List<Segment> newChain, FunctionNode function) {
            var bindings = new HashSet<>(functionBindings);
            bindings.addAll(ClosureAnalyzer.declaredNames(function));
            return new Scope(List.copyOf(newChain), null, bindings, enclosingStep, enclosingWorkflow);
        }

        Scope inStep(FunctionNode step) {
            return new Scope(chain, objectPath, functionBindings, step, enclosingWorkflow);
        }

        Scope inWorkflow(String workflow) {
            return new Scope(chain, objectPath, functionBindings, enclosingStep, workflow);
        }
    }
}
