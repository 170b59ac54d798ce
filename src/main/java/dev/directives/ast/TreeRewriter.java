package dev.directives.ast;

import dev.directives.ast.ClassMember.MethodDefinition;
import dev.directives.ast.ClassMember.PropertyDefinition;
import dev.directives.ast.ClassMember.StaticBlock;
import dev.directives.ast.Expression.*;
import dev.directives.ast.ObjectMember.MethodProperty;
import dev.directives.ast.ObjectMember.Property;
import dev.directives.ast.Pattern.*;
import dev.directives.ast.Statement.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Bottom-up tree rewriting with an explicit context value threaded through the recursion.
 *
 * <p>Every method rebuilds its node from rewritten children. Subclasses override the hooks they
 * care about and pass a derived context down instead of mutating shared state.
 *
 * @param <C> context type handed to every hook
 */
public abstract class TreeRewriter<C> {

    /** Rewrites a statement list; each statement may expand into zero or more statements. */
    public List<Statement> statements(List<Statement> statements, C ctx) {
        var out = new ArrayList<Statement>(statements.size());
        for (Statement statement : statements) {
            out.addAll(expand(statement, ctx));
        }
        return out;
    }

    protected List<Statement> expand(Statement statement, C ctx) {
        return List.of(statement(statement, ctx));
    }

    public Statement statement(Statement statement, C ctx) {
        if (statement instanceof ExpressionStatement s) {
            return new ExpressionStatement(expression(s.expression(), ctx), s.span());
        }
        if (statement instanceof BlockStatement s) {
            return block(s, ctx);
        }
        if (statement instanceof ReturnStatement s) {
            return new ReturnStatement(optional(s.argument(), ctx), s.span());
        }
        if (statement instanceof IfStatement s) {
            return new IfStatement(expression(s.test(), ctx), statement(s.consequent(), ctx),
                s.alternate() == null ? null : statement(s.alternate(), ctx), s.span());
        }
        if (statement instanceof ForStatement s) {
            return new ForStatement(forHead(s.init(), ctx), optional(s.test(), ctx), optional(s.update(), ctx),
                statement(s.body(), ctx), s.span());
        }
        if (statement instanceof ForInStatement s) {
            return new ForInStatement(forHead(s.left(), ctx), expression(s.right(), ctx),
                statement(s.body(), ctx), s.span());
        }
        if (statement instanceof ForOfStatement s) {
            return new ForOfStatement(forHead(s.left(), ctx), expression(s.right(), ctx),
                statement(s.body(), ctx), s.await(), s.span());
        }
        if (statement instanceof WhileStatement s) {
            return new WhileStatement(expression(s.test(), ctx), statement(s.body(), ctx), s.span());
        }
        if (statement instanceof DoWhileStatement s) {
            return new DoWhileStatement(statement(s.body(), ctx), expression(s.test(), ctx), s.span());
        }
        if (statement instanceof ThrowStatement s) {
            return new ThrowStatement(expression(s.argument(), ctx), s.span());
        }
        if (statement instanceof TryStatement s) {
            CatchClause handler = s.handler() == null ? null : new CatchClause(
                s.handler().param() == null ? null : pattern(s.handler().param(), ctx),
                block(s.handler().body(), ctx), s.handler().span());
            return new TryStatement(block(s.block(), ctx), handler,
                s.finalizer() == null ? null : block(s.finalizer(), ctx), s.span());
        }
        if (statement instanceof SwitchStatement s) {
            var cases = new ArrayList<SwitchCase>();
            for (SwitchCase c : s.cases()) {
                cases.add(new SwitchCase(optional(c.test(), ctx), statements(c.consequent(), ctx), c.span()));
            }
            return new SwitchStatement(expression(s.discriminant(), ctx), cases, s.span());
        }
        if (statement instanceof LabeledStatement s) {
            return new LabeledStatement(s.label(), statement(s.body(), ctx), s.span());
        }
        if (statement instanceof VariableDeclaration s) {
            return variableDeclaration(s, ctx);
        }
        if (statement instanceof FunctionDeclaration s) {
            return new FunctionDeclaration(function(s.function(), ctx), s.span());
        }
        if (statement instanceof ClassDeclaration s) {
            return new ClassDeclaration(classDef(s.definition(), ctx), s.span());
        }
        if (statement instanceof ExportNamedDeclaration s) {
            if (s.declaration() == null) {
                return s;
            }
            return new ExportNamedDeclaration(statement(s.declaration(), ctx), s.specifiers(), s.source(), s.span());
        }
        if (statement instanceof ExportDefaultDeclaration s) {
            Node declaration = s.declaration();
            Node rewritten = declaration instanceof Statement inner
                ? statement(inner, ctx)
                : expression((Expression) declaration, ctx);
            return new ExportDefaultDeclaration(rewritten, s.span());
        }
        // Leaves: empty, break, continue, debugger, import, export-all, comments.
        return statement;
    }

    public BlockStatement block(BlockStatement block, C ctx) {
        return block.withBody(statements(block.body(), ctx));
    }

    public VariableDeclaration variableDeclaration(VariableDeclaration declaration, C ctx) {
        var declarators = new ArrayList<VariableDeclarator>();
        for (VariableDeclarator d : declaration.declarations()) {
            declarators.add(variableDeclarator(d, ctx));
        }
        return new VariableDeclaration(declaration.kind(), declarators, declaration.span());
    }

    public VariableDeclarator variableDeclarator(VariableDeclarator declarator, C ctx) {
        return new VariableDeclarator(pattern(declarator.id(), ctx), optional(declarator.init(), ctx),
            declarator.span());
    }

    protected Node forHead(Node head, C ctx) {
        if (head == null) {
            return null;
        }
        if (head instanceof VariableDeclaration declaration) {
            return variableDeclaration(declaration, ctx);
        }
        if (head instanceof Expression expression && !(head instanceof Identifier)
            && !(head instanceof MemberExpression)) {
            return expression(expression, ctx);
        }
        return pattern((Pattern) head, ctx);
    }

    public Expression expression(Expression expression, C ctx) {
        if (expression instanceof TemplateLiteral e) {
            return new TemplateLiteral(e.quasis(), expressions(e.expressions(), ctx), e.span());
        }
        if (expression instanceof TaggedTemplateExpression e) {
            return new TaggedTemplateExpression(expression(e.tag(), ctx),
                (TemplateLiteral) expression(e.quasi(), ctx), e.span());
        }
        if (expression instanceof ArrayExpression e) {
            return new ArrayExpression(expressions(e.elements(), ctx), e.span());
        }
        if (expression instanceof ObjectExpression e) {
            var members = new ArrayList<ObjectMember>();
            for (ObjectMember member : e.properties()) {
                members.add(objectMember(member, ctx));
            }
            return new ObjectExpression(members, e.span());
        }
        if (expression instanceof FunctionExpression e) {
            return new FunctionExpression(function(e.function(), ctx), e.span());
        }
        if (expression instanceof ArrowFunctionExpression e) {
            return arrow(e, ctx);
        }
        if (expression instanceof ClassExpression e) {
            return new ClassExpression(classDef(e.definition(), ctx), e.span());
        }
        if (expression instanceof UnaryExpression e) {
            return new UnaryExpression(e.operator(), expression(e.argument(), ctx), e.span());
        }
        if (expression instanceof UpdateExpression e) {
            return new UpdateExpression(e.operator(), e.prefix(), expression(e.argument(), ctx), e.span());
        }
        if (expression instanceof BinaryExpression e) {
            return new BinaryExpression(e.operator(), expression(e.left(), ctx), expression(e.right(), ctx), e.span());
        }
        if (expression instanceof AssignmentExpression e) {
            return new AssignmentExpression(e.operator(), pattern(e.left(), ctx), expression(e.right(), ctx),
                e.span());
        }
        if (expression instanceof ConditionalExpression e) {
            return new ConditionalExpression(expression(e.test(), ctx), expression(e.consequent(), ctx),
                expression(e.alternate(), ctx), e.span());
        }
        if (expression instanceof CallExpression e) {
            return new CallExpression(expression(e.callee(), ctx), expressions(e.arguments(), ctx), e.optional(),
                e.span());
        }
        if (expression instanceof NewExpression e) {
            return new NewExpression(expression(e.callee(), ctx), expressions(e.arguments(), ctx), e.span());
        }
        if (expression instanceof MemberExpression e) {
            return new MemberExpression(expression(e.object(), ctx),
                e.computed() ? expression(e.property(), ctx) : e.property(), e.computed(), e.optional(), e.span());
        }
        if (expression instanceof SequenceExpression e) {
            return new SequenceExpression(expressions(e.expressions(), ctx), e.span());
        }
        if (expression instanceof AwaitExpression e) {
            return new AwaitExpression(expression(e.argument(), ctx), e.span());
        }
        if (expression instanceof YieldExpression e) {
            return new YieldExpression(optional(e.argument(), ctx), e.delegate(), e.span());
        }
        if (expression instanceof SpreadElement e) {
            return new SpreadElement(expression(e.argument(), ctx), e.span());
        }
        if (expression instanceof ImportExpression e) {
            return new ImportExpression(expression(e.source(), ctx), e.span());
        }
        // Identifiers, literals, this, super, meta properties.
        return expression;
    }

    protected List<Expression> expressions(List<Expression> expressions, C ctx) {
        var out = new ArrayList<Expression>(expressions.size());
        for (Expression e : expressions) {
            out.add(optional(e, ctx));
        }
        return out;
    }

    private Expression optional(Expression expression, C ctx) {
        return expression == null ? null : expression(expression, ctx);
    }

    public Expression arrow(ArrowFunctionExpression arrow, C ctx) {
        var params = patterns(arrow.params(), ctx);
        Node body = arrow.body() instanceof BlockStatement block
            ? block(block, ctx)
            : expression((Expression) arrow.body(), ctx);
        return new ArrowFunctionExpression(params, body, arrow.async(), arrow.span());
    }

    public Function function(Function function, C ctx) {
        return new Function(function.id(), patterns(function.params(), ctx), block(function.body(), ctx),
            function.async(), function.generator(), function.span());
    }

    protected List<Pattern> patterns(List<Pattern> patterns, C ctx) {
        var out = new ArrayList<Pattern>(patterns.size());
        for (Pattern p : patterns) {
            out.add(p == null ? null : pattern(p, ctx));
        }
        return out;
    }

    public Pattern pattern(Pattern pattern, C ctx) {
        if (pattern instanceof MemberExpression member) {
            return (Pattern) expression(member, ctx);
        }
        if (pattern instanceof ObjectPattern p) {
            var properties = new ArrayList<PatternProperty>();
            for (PatternProperty property : p.properties()) {
                Expression key = property.computed() ? expression(property.key(), ctx) : property.key();
                properties.add(new PatternProperty(key, property.computed(), pattern(property.value(), ctx),
                    property.shorthand(), property.span()));
            }
            RestElement rest = p.rest() == null ? null : (RestElement) pattern(p.rest(), ctx);
            return new ObjectPattern(properties, rest, p.span());
        }
        if (pattern instanceof ArrayPattern p) {
            return new ArrayPattern(patterns(p.elements(), ctx), p.span());
        }
        if (pattern instanceof AssignmentPattern p) {
            return new AssignmentPattern(pattern(p.left(), ctx), expression(p.right(), ctx), p.span());
        }
        if (pattern instanceof RestElement p) {
            return new RestElement(pattern(p.argument(), ctx), p.span());
        }
        return pattern;
    }

    public ClassDef classDef(ClassDef classDef, C ctx) {
        Expression superClass = classDef.superClass() == null ? null : expression(classDef.superClass(), ctx);
        return new ClassDef(classDef.id(), superClass, classMembers(classDef.body(), ctx), classDef.span());
    }

    protected List<ClassMember> classMembers(List<ClassMember> members, C ctx) {
        var out = new ArrayList<ClassMember>(members.size());
        for (ClassMember member : members) {
            out.add(classMember(member, ctx));
        }
        return out;
    }

    public ClassMember classMember(ClassMember member, C ctx) {
        if (member instanceof MethodDefinition m) {
            Expression key = m.computed() ? expression(m.key(), ctx) : m.key();
            return new MethodDefinition(key, m.computed(), function(m.value(), ctx), m.kind(), m.isStatic(),
                m.span());
        }
        if (member instanceof PropertyDefinition p) {
            Expression key = p.computed() ? expression(p.key(), ctx) : p.key();
            return new PropertyDefinition(key, p.computed(), optional(p.value(), ctx), p.isStatic(), p.span());
        }
        StaticBlock block = (StaticBlock) member;
        return new StaticBlock(statements(block.body(), ctx), block.span());
    }

    public ObjectMember objectMember(ObjectMember member, C ctx) {
        if (member instanceof Property p) {
            Expression key = p.computed() ? expression(p.key(), ctx) : p.key();
            Expression value = expression(p.value(), ctx);
            boolean shorthand = p.shorthand() && value instanceof Identifier id && key instanceof Identifier k
                && id.name().equals(k.name());
            return new Property(key, p.computed(), value, shorthand, p.span());
        }
        if (member instanceof MethodProperty m) {
            Expression key = m.computed() ? expression(m.key(), ctx) : m.key();
            return new MethodProperty(key, m.computed(), function(m.value(), ctx), m.kind(), m.span());
        }
        SpreadElement spread = (SpreadElement) member;
        return new SpreadElement(expression(spread.argument(), ctx), spread.span());
    }
}
