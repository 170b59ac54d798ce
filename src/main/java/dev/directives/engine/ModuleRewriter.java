package dev.directives.engine;

import dev.directives.ast.ClassDef;
import dev.directives.ast.ClassMember;
import dev.directives.ast.ClassMember.MethodDefinition;
import dev.directives.ast.ClassMember.StaticBlock;
import dev.directives.ast.Expression;
import dev.directives.ast.Expression.ArrowFunctionExpression;
import dev.directives.ast.Expression.FunctionExpression;
import dev.directives.ast.Expression.Identifier;
import dev.directives.ast.Function;
import dev.directives.ast.FunctionNode;
import dev.directives.ast.Node;
import dev.directives.ast.Nodes;
import dev.directives.ast.ObjectMember;
import dev.directives.ast.ObjectMember.MethodProperty;
import dev.directives.ast.ObjectMember.Property;
import dev.directives.ast.Pattern;
import dev.directives.ast.Span;
import dev.directives.ast.Statement;
import dev.directives.ast.Statement.BlockStatement;
import dev.directives.ast.Statement.ExportDefaultDeclaration;
import dev.directives.ast.Statement.FunctionDeclaration;
import dev.directives.ast.Statement.ReturnStatement;
import dev.directives.ast.Statement.VariableDeclaration;
import dev.directives.ast.Statement.VariableKind;
import dev.directives.ast.TreeRewriter;
import dev.directives.model.CompilationMode;
import dev.directives.model.FunctionKind;
import dev.directives.model.StepFunction;
import dev.directives.model.WorkflowFunction;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites every classified function of one module according to its {@link Strategy}. Module-level
 * statements may grow trailing statements (workflow ids, step proxies for class methods); nested step
 * bodies relocated to module level are collected in post-order for {@link HoistingPass}.
 *
 * <p>Instances are single-use.
 */
final class ModuleRewriter extends TreeRewriter<ModuleRewriter.Context> {

    /** Whether the statement list being rewritten is the module body. */
    enum Context { MODULE, NESTED }

    record Result(List<Statement> body, List<Statement> hoisted) {
        Result {
            body = List.copyOf(body);
            hoisted = List.copyOf(hoisted);
        }
    }

    private final ModuleFacts facts;
    private final CompilationMode mode;
    private final List<Statement> hoisted = new ArrayList<>();
    private final List<Statement> trailing = new ArrayList<>();
    private boolean used;

    ModuleRewriter(ModuleFacts facts, CompilationMode mode) {
        this.facts = facts;
        this.mode = mode;
    }

    Result rewrite(List<Statement> body) {
        if (used) {
            throw new IllegalStateException("ModuleRewriter instances are single-use");
        }
        used = true;
        List<Statement> rewritten = statements(body, Context.MODULE);
        return new Result(rewritten, hoisted);
    }

    @Override
    protected List<Statement> expand(Statement statement, Context ctx) {
        if (facts.isModuleDirective(statement)) {
            return List.of();
        }
        if (ctx == Context.NESTED) {
            return List.of(statement(statement, ctx));
        }
        var out = new ArrayList<Statement>();
        if (statement instanceof ExportDefaultDeclaration export) {
            out.addAll(defaultExport(export));
        } else {
            out.add(statement(statement, Context.NESTED));
        }
        out.addAll(trailing);
        trailing.clear();
        return out;
    }

    @Override
    public Statement statement(Statement statement, Context ctx) {
        if (statement instanceof FunctionDeclaration declaration) {
            return functionDeclaration(declaration);
        }
        return super.statement(statement, Context.NESTED);
    }

    @Override
    public Expression expression(Expression expression, Context ctx) {
        FunctionNode function = null;
        if (expression instanceof FunctionExpression e) {
            function = e.function();
        } else if (expression instanceof ArrowFunctionExpression arrow) {
            function = arrow;
        }
        if (function == null || !facts.isClassified(function)) {
            return super.expression(expression, Context.NESTED);
        }
        if (facts.isWorkflow(function)) {
            return asExpression(workflowFunction(function), expression.span());
        }
        StepFunction step = facts.step(function);
        return switch (strategy(step)) {
            case HOIST_AND_REFERENCE -> Identifier.of(hoist(function, step));
            case PROXY -> RuntimeContract.stepProxy(step.id(), step.closureVariables());
            default -> asExpression(stripped(function), expression.span());
        };
    }

    @Override
    public ObjectMember objectMember(ObjectMember member, Context ctx) {
        if (!(member instanceof MethodProperty method) || !facts.isStep(method.value())) {
            return super.objectMember(member, Context.NESTED);
        }
        Expression key = method.computed() ? expression(method.key(), Context.NESTED) : method.key();
        StepFunction step = facts.step(method.value());
        return switch (strategy(step)) {
            case HOIST_AND_REFERENCE ->
                new Property(key, method.computed(), Identifier.of(hoist(method.value(), step)), false, method.span());
            case PROXY -> new Property(key, method.computed(),
                RuntimeContract.stepProxy(step.id(), step.closureVariables()), false, method.span());
            default -> new MethodProperty(key, method.computed(), (Function) stripped(method.value()), method.kind(),
                method.span());
        };
    }

    @Override
    public ClassDef classDef(ClassDef classDef, Context ctx) {
        Expression superClass = classDef.superClass() == null ? null
            : expression(classDef.superClass(), Context.NESTED);
        var members = new ArrayList<ClassMember>();
        for (ClassMember member : classDef.body()) {
            if (!(member instanceof MethodDefinition method) || !facts.isClassified(method.value())) {
                members.add(classMember(member, Context.NESTED));
            } else if (facts.isWorkflow(method.value())) {
                members.add(method.withValue((Function) workflowFunction(method.value())));
            } else {
                StepFunction step = facts.step(method.value());
                if (strategy(step) == Strategy.PROXY) {
                    trailing.add(RuntimeContract.assignStepProxy(step.id(), facts.ref(method.value())));
                } else {
                    members.add(method.withValue((Function) stripped(method.value())));
                }
            }
        }
        return new ClassDef(classDef.id(), superClass, members, classDef.span());
    }

    @Override
    public ClassMember classMember(ClassMember member, Context ctx) {
        if (member instanceof StaticBlock block) {
            return new StaticBlock(statements(block.body(), Context.NESTED), block.span());
        }
        return super.classMember(member, Context.NESTED);
    }

    @Override
    public BlockStatement block(BlockStatement block, Context ctx) {
        return super.block(block, Context.NESTED);
    }

    // ---- per-shape rewrites ------------------------------------------------------------------

    private Statement functionDeclaration(FunctionDeclaration declaration) {
        Function function = declaration.function();
        if (!facts.isClassified(function)) {
            return new FunctionDeclaration(function(function, Context.NESTED), declaration.span());
        }
        String name = function.id() != null ? function.id().name() : facts.ref(function).displayName();
        if (facts.isWorkflow(function)) {
            return new FunctionDeclaration(named((Function) workflowFunction(function), name), declaration.span());
        }
        StepFunction step = facts.step(function);
        return switch (strategy(step)) {
            case HOIST_AND_REFERENCE ->
                VariableDeclaration.single(VariableKind.VAR, name, Identifier.of(hoist(function, step)));
            case PROXY -> VariableDeclaration.single(VariableKind.VAR, name,
                RuntimeContract.stepProxy(step.id(), step.closureVariables()));
            default -> new FunctionDeclaration(named((Function) stripped(function), name), declaration.span());
        };
    }

    /**
     * {@code export default} of a classified function. Anonymous functions get the synthesized binding
     * so that generated statements can name them.
     */
    private List<Statement> defaultExport(ExportDefaultDeclaration export) {
        Node declaration = export.declaration();
        if (declaration instanceof FunctionDeclaration function && facts.isClassified(function.function())) {
            Statement rewritten = functionDeclaration(function);
            if (rewritten instanceof FunctionDeclaration) {
                return List.of(new ExportDefaultDeclaration(rewritten, export.span()));
            }
            String name = ((VariableDeclaration) rewritten).declarations().get(0).id() instanceof Identifier id
                ? id.name() : facts.defaultBinding();
            return List.of(rewritten, new ExportDefaultDeclaration(Identifier.of(name), export.span()));
        }
        FunctionNode function = declaration instanceof FunctionExpression e ? e.function()
            : declaration instanceof ArrowFunctionExpression arrow ? arrow : null;
        if (function != null && facts.isClassified(function) && facts.defaultBinding() != null) {
            Expression value = expression((Expression) declaration, Context.NESTED);
            String binding = facts.defaultBinding();
            return List.of(VariableDeclaration.single(VariableKind.CONST, binding, value),
                new ExportDefaultDeclaration(Identifier.of(binding), export.span()));
        }
        return List.of(super.statement(export, Context.NESTED));
    }

    /** Workflow functions keep their shape; the body is kept or stubbed, and the id is attached. */
    private FunctionNode workflowFunction(FunctionNode function) {
        WorkflowFunction workflow = facts.workflow(function);
        FunctionRef ref = facts.ref(function);
        Strategy strategy = StrategyTable.select(FunctionKind.WORKFLOW, workflow.placement(), mode);
        trailing.add(RuntimeContract.assignWorkflowId(workflow.id(), ref));
        if (strategy == Strategy.REGISTER_WORKFLOW) {
            trailing.add(RuntimeContract.registerWorkflow(workflow.id(), ref));
            return stripped(function);
        }
        if (mode == CompilationMode.STEP) {
            hoistNestedSteps(function);
        }
        List<Pattern> params = patterns(function.params(), Context.NESTED);
        return withBody(function, RuntimeContract.directInvocationStub(stubName(workflow, ref)), params);
    }

    /** Anonymous default exports are named by their export key, not the synthesized binding. */
    private String stubName(WorkflowFunction workflow, FunctionRef ref) {
        String displayName = ref.displayName();
        return displayName.equals(facts.defaultBinding()) ? workflow.exportKey() : displayName;
    }

    /**
     * Hoists the steps nested in a workflow whose body is replaced by a stub, so that they are still
     * registered. Steps nested in a hoisted step are handled when that step is hoisted.
     */
    private void hoistNestedSteps(FunctionNode workflow) {
        Nodes.walk(workflow, node -> {
            if (node instanceof FunctionNode nested && facts.isStep(nested)) {
                StepFunction step = facts.step(nested);
                if (strategy(step) == Strategy.HOIST_AND_REFERENCE) {
                    hoist(nested, step);
                    return false;
                }
            }
            return true;
        });
    }

    /**
     * Moves the step body to module level under its allocated name and returns that name. The body
     * is rewritten first, so steps nested inside it are hoisted ahead of it.
     */
    private String hoist(FunctionNode function, StepFunction step) {
        String name = ((FunctionRef.Binding) facts.ref(function)).name();
        List<Pattern> params = patterns(function.params(), Context.NESTED);
        List<Statement> prelude = step.hasClosure()
            ? List.of(RuntimeContract.closureVariablesPrelude(step.closureVariables(),
                ClosureAnalyzer.reassignsFreeVariable(function)))
            : List.of();
        Node body = hoistedBody(function, prelude);
        boolean generator = function instanceof Function f && f.generator();

        switch (step.shape()) {
            case ARROW -> hoisted.add(VariableDeclaration.single(VariableKind.VAR, name,
                new ArrowFunctionExpression(params, body, true, Span.SYNTHETIC)));
            case OBJECT_PROPERTY, OBJECT_METHOD -> hoisted.add(VariableDeclaration.single(VariableKind.VAR, name,
                new FunctionExpression(new Function(null, params, asBlock(body), true, generator, Span.SYNTHETIC),
                    Span.SYNTHETIC)));
            default -> {
                if (function instanceof ArrowFunctionExpression) {
                    hoisted.add(VariableDeclaration.single(VariableKind.VAR, name,
                        new ArrowFunctionExpression(params, body, true, Span.SYNTHETIC)));
                } else {
                    hoisted.add(new FunctionDeclaration(
                        new Function(Identifier.of(name), params, asBlock(body), true, generator, Span.SYNTHETIC),
                        Span.SYNTHETIC));
                }
            }
        }
        return name;
    }

    private Node hoistedBody(FunctionNode function, List<Statement> prelude) {
        BlockStatement block = function.blockBody();
        if (block == null) {
            Expression value = expression((Expression) ((ArrowFunctionExpression) function).body(), Context.NESTED);
            if (prelude.isEmpty()) {
                return value;
            }
            var statements = new ArrayList<>(prelude);
            statements.add(new ReturnStatement(value, Span.SYNTHETIC));
            return BlockStatement.of(statements);
        }
        BlockStatement rewritten = block(DirectiveScanner.stripDirective(block), Context.NESTED);
        if (prelude.isEmpty()) {
            return rewritten;
        }
        var statements = new ArrayList<>(prelude);
        statements.addAll(rewritten.body());
        return rewritten.withBody(statements);
    }

    /** The function with its directive removed and its body rewritten. */
    private FunctionNode stripped(FunctionNode function) {
        List<Pattern> params = patterns(function.params(), Context.NESTED);
        if (function instanceof ArrowFunctionExpression arrow && arrow.blockBody() == null) {
            return new ArrowFunctionExpression(params, expression((Expression) arrow.body(), Context.NESTED),
                arrow.async(), arrow.span());
        }
        return withBody(function, block(DirectiveScanner.stripDirective(function.blockBody()), Context.NESTED), params);
    }

    private Strategy strategy(StepFunction step) {
        return StrategyTable.select(FunctionKind.STEP, step.placement(), mode);
    }

    private static FunctionNode withBody(FunctionNode function, BlockStatement body, List<Pattern> params) {
        if (function instanceof Function f) {
            return new Function(f.id(), params, body, f.async(), f.generator(), f.span());
        }
        ArrowFunctionExpression arrow = (ArrowFunctionExpression) function;
        return new ArrowFunctionExpression(params, body, arrow.async(), arrow.span());
    }

    private static Function named(Function function, String name) {
        return function.id() == null ? function.withId(Identifier.of(name)) : function;
    }

    private static Expression asExpression(FunctionNode function, Span span) {
        return function instanceof Function f ? new FunctionExpression(f, span) : (ArrowFunctionExpression) function;
    }

    private static BlockStatement asBlock(Node body) {
        if (body instanceof BlockStatement block) {
            return block;
        }
        return BlockStatement.of(List.of(new ReturnStatement((Expression) body, Span.SYNTHETIC)));
    }
}
