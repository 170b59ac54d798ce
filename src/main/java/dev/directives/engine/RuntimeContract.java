package dev.directives.engine;

import dev.directives.ast.Expression;
import dev.directives.ast.Expression.ArrowFunctionExpression;
import dev.directives.ast.Expression.AssignmentExpression;
import dev.directives.ast.Expression.CallExpression;
import dev.directives.ast.Expression.Identifier;
import dev.directives.ast.Expression.MemberExpression;
import dev.directives.ast.Expression.NewExpression;
import dev.directives.ast.Expression.ObjectExpression;
import dev.directives.ast.Expression.StringLiteral;
import dev.directives.ast.ObjectMember;
import dev.directives.ast.ObjectMember.Property;
import dev.directives.ast.Pattern;
import dev.directives.ast.Pattern.ObjectPattern;
import dev.directives.ast.Pattern.PatternProperty;
import dev.directives.ast.Span;
import dev.directives.ast.Statement;
import dev.directives.ast.Statement.BlockStatement;
import dev.directives.ast.Statement.ExpressionStatement;
import dev.directives.ast.Statement.ImportDeclaration;
import dev.directives.ast.Statement.ImportKind;
import dev.directives.ast.Statement.ImportSpecifier;
import dev.directives.ast.Statement.ThrowStatement;
import dev.directives.ast.Statement.VariableDeclaration;
import dev.directives.ast.Statement.VariableDeclarator;
import dev.directives.ast.Statement.VariableKind;

import java.util.ArrayList;
import java.util.List;

/**
 * The call surface generated code uses to reach the workflow runtime, and builders for each
 * generated statement. The runtime modules themselves live outside this project.
 */
public final class RuntimeContract {

    public static final String PRIVATE_MODULE = "workflow/internal/private";
    public static final String CLASS_SERIALIZATION_MODULE = "workflow/internal/class-serialization";
    public static final String START_MODULE = "workflow/api";

    public static final String REGISTER_STEP = "registerStepFunction";
    public static final String GET_CLOSURE_VARS = "__private_getClosureVars";
    public static final String REGISTER_CLASS = "registerSerializationClass";

    public static final String USE_STEP_SYMBOL = "WORKFLOW_USE_STEP";
    public static final String WORKFLOW_REGISTRY = "__private_workflows";
    public static final String WORKFLOW_ID_PROPERTY = "workflowId";

    public static final String SERIALIZE_SYMBOL = "workflow-serialize";
    public static final String DESERIALIZE_SYMBOL = "workflow-deserialize";
    public static final String SERIALIZE_EXPORT = "WORKFLOW_SERIALIZE";
    public static final String DESERIALIZE_EXPORT = "WORKFLOW_DESERIALIZE";

    public static final String METADATA_PREFIX = "__internal_workflows";

    private RuntimeContract() {}

    /** {@code globalThis[Symbol.for("WORKFLOW_USE_STEP")]("id")}, plus a capture thunk when needed. */
    public static Expression stepProxy(String stepId, List<String> closureVariables) {
        Expression accessor = MemberExpression.index(Identifier.of("globalThis"), symbolFor(USE_STEP_SYMBOL));
        if (closureVariables.isEmpty()) {
            return CallExpression.of(accessor, StringLiteral.of(stepId));
        }
        var members = new ArrayList<ObjectMember>();
        for (String name : closureVariables) {
            members.add(new Property(Identifier.of(name), false, Identifier.of(name), true, Span.SYNTHETIC));
        }
        var captures = new ArrowFunctionExpression(List.of(), new ObjectExpression(members, Span.SYNTHETIC), false,
            Span.SYNTHETIC);
        return CallExpression.of(accessor, StringLiteral.of(stepId), captures);
    }

    public static Expression symbolFor(String key) {
        return CallExpression.of(MemberExpression.dot(Identifier.of("Symbol"), "for"), StringLiteral.of(key));
    }

    public static Statement registerStep(String stepId, FunctionRef target) {
        return call(REGISTER_STEP, StringLiteral.of(stepId), target.toExpression());
    }

    public static Statement registerClass(String classId, String className) {
        return call(REGISTER_CLASS, StringLiteral.of(classId), Identifier.of(className));
    }

    /** {@code target.workflowId = "id";} */
    public static Statement assignWorkflowId(String workflowId, FunctionRef target) {
        return assign(MemberExpression.dot(target.toExpression(), WORKFLOW_ID_PROPERTY), StringLiteral.of(workflowId));
    }

    /** {@code globalThis.__private_workflows.set("id", target);} */
    public static Statement registerWorkflow(String workflowId, FunctionRef target) {
        Expression registry = MemberExpression.dot(Identifier.of("globalThis"), WORKFLOW_REGISTRY);
        return new ExpressionStatement(
            CallExpression.of(MemberExpression.dot(registry, "set"), StringLiteral.of(workflowId),
                target.toExpression()),
            Span.SYNTHETIC);
    }

    /** {@code target = globalThis[Symbol.for("WORKFLOW_USE_STEP")]("id");} */
    public static Statement assignStepProxy(String stepId, FunctionRef target) {
        return assign((Pattern) target.toExpression(), stepProxy(stepId, List.of()));
    }

    /** Body that replaces a workflow when it must not run outside the durable runtime. */
    public static BlockStatement directInvocationStub(String displayName) {
        String message = "You attempted to execute workflow " + displayName
            + " function directly. To start a workflow, use start(" + displayName + ") from " + START_MODULE;
        var error = new NewExpression(Identifier.of("Error"), List.of(StringLiteral.of(message)), Span.SYNTHETIC);
        return BlockStatement.of(List.of(new ThrowStatement(error, Span.SYNTHETIC)));
    }

    /**
     * {@code const { a, b } = __private_getClosureVars();}, declared with {@code let} when the step body
     * assigns to one of the captured names.
     */
    public static Statement closureVariablesPrelude(List<String> closureVariables, boolean reassigned) {
        var properties = new ArrayList<PatternProperty>();
        for (String name : closureVariables) {
            properties.add(new PatternProperty(Identifier.of(name), false, Identifier.of(name), true, Span.SYNTHETIC));
        }
        Pattern pattern = new ObjectPattern(properties, null, Span.SYNTHETIC);
        var declarator = new VariableDeclarator(pattern, CallExpression.of(Identifier.of(GET_CLOSURE_VARS)),
            Span.SYNTHETIC);
        VariableKind kind = reassigned ? VariableKind.LET : VariableKind.CONST;
        return new VariableDeclaration(kind, List.of(declarator), Span.SYNTHETIC);
    }

    public static ImportDeclaration namedImport(String module, List<String> names) {
        var specifiers = new ArrayList<ImportSpecifier>();
        for (String name : names) {
            specifiers.add(new ImportSpecifier(ImportKind.NAMED, name, Identifier.of(name), Span.SYNTHETIC));
        }
        return new ImportDeclaration(specifiers, StringLiteral.of(module), Span.SYNTHETIC);
    }

    private static Statement call(String function, Expression... arguments) {
        return new ExpressionStatement(CallExpression.of(Identifier.of(function), arguments), Span.SYNTHETIC);
    }

    private static Statement assign(Pattern target, Expression value) {
        return new ExpressionStatement(new AssignmentExpression("=", target, value, Span.SYNTHETIC), Span.SYNTHETIC);
    }
}
