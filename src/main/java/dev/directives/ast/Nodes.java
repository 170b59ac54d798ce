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
import java.util.function.Predicate;

/**
 * Read-only structural access to the tree.
 */
public final class Nodes {

    private Nodes() {}

    /**
     * Pre-order walk. The visitor returns {@code false} to skip the children of the node it was given.
     */
    public static void walk(Node root, Predicate<Node> visitor) {
        if (root == null || !visitor.test(root)) {
            return;
        }
        for (Node child : children(root)) {
            walk(child, visitor);
        }
    }

    /**
     * Direct children in source order. Null slots (holes, absent optional parts) are omitted.
     */
    public static List<Node> children(Node node) {
        var out = new ArrayList<Node>();
        if (node instanceof Program program) {
            out.addAll(program.body());
        } else if (node instanceof Statement statement) {
            statementChildren(statement, out);
        } else if (node instanceof Expression expression) {
            expressionChildren(expression, out);
        } else if (node instanceof Pattern pattern) {
            patternChildren(pattern, out);
        } else if (node instanceof Function function) {
            add(out, function.id());
            out.addAll(function.params());
            out.add(function.body());
        } else if (node instanceof ClassDef classDef) {
            add(out, classDef.id());
            add(out, classDef.superClass());
            out.addAll(classDef.body());
        } else if (node instanceof MethodDefinition method) {
            out.add(method.key());
            out.add(method.value());
        } else if (node instanceof PropertyDefinition property) {
            out.add(property.key());
            add(out, property.value());
        } else if (node instanceof StaticBlock block) {
            out.addAll(block.body());
        } else if (node instanceof Property property) {
            out.add(property.key());
            out.add(property.value());
        } else if (node instanceof MethodProperty method) {
            out.add(method.key());
            out.add(method.value());
        } else if (node instanceof PatternProperty property) {
            out.add(property.key());
            out.add(property.value());
        } else if (node instanceof VariableDeclarator declarator) {
            out.add(declarator.id());
            add(out, declarator.init());
        } else if (node instanceof CatchClause clause) {
            add(out, clause.param());
            out.add(clause.body());
        } else if (node instanceof SwitchCase switchCase) {
            add(out, switchCase.test());
            out.addAll(switchCase.consequent());
        } else if (node instanceof ImportSpecifier specifier) {
            out.add(specifier.local());
        }
        return out;
    }

    private static void statementChildren(Statement statement, List<Node> out) {
        if (statement instanceof ExpressionStatement s) {
            out.add(s.expression());
        } else if (statement instanceof BlockStatement s) {
            out.addAll(s.body());
        } else if (statement instanceof ReturnStatement s) {
            add(out, s.argument());
        } else if (statement instanceof IfStatement s) {
            out.add(s.test());
            out.add(s.consequent());
            add(out, s.alternate());
        } else if (statement instanceof ForStatement s) {
            add(out, s.init());
            add(out, s.test());
            add(out, s.update());
            out.add(s.body());
        } else if (statement instanceof ForInStatement s) {
            out.add(s.left());
            out.add(s.right());
            out.add(s.body());
        } else if (statement instanceof ForOfStatement s) {
            out.add(s.left());
            out.add(s.right());
            out.add(s.body());
        } else if (statement instanceof WhileStatement s) {
            out.add(s.test());
            out.add(s.body());
        } else if (statement instanceof DoWhileStatement s) {
            out.add(s.body());
            out.add(s.test());
        } else if (statement instanceof ThrowStatement s) {
            out.add(s.argument());
        } else if (statement instanceof TryStatement s) {
            out.add(s.block());
            add(out, s.handler());
            add(out, s.finalizer());
        } else if (statement instanceof SwitchStatement s) {
            out.add(s.discriminant());
            out.addAll(s.cases());
        } else if (statement instanceof LabeledStatement s) {
            out.add(s.body());
        } else if (statement instanceof VariableDeclaration s) {
            out.addAll(s.declarations());
        } else if (statement instanceof FunctionDeclaration s) {
            out.add(s.function());
        } else if (statement instanceof ClassDeclaration s) {
            out.add(s.definition());
        } else if (statement instanceof ImportDeclaration s) {
            out.addAll(s.specifiers());
        } else if (statement instanceof ExportNamedDeclaration s) {
            add(out, s.declaration());
        } else if (statement instanceof ExportDefaultDeclaration s) {
            out.add(s.declaration());
        }
    }

    private static void expressionChildren(Expression expression, List<Node> out) {
        if (expression instanceof TemplateLiteral e) {
            out.addAll(e.expressions());
        } else if (expression instanceof TaggedTemplateExpression e) {
            out.add(e.tag());
            out.add(e.quasi());
        } else if (expression instanceof ArrayExpression e) {
            for (Expression element : e.elements()) {
                add(out, element);
            }
        } else if (expression instanceof ObjectExpression e) {
            out.addAll(e.properties());
        } else if (expression instanceof FunctionExpression e) {
            out.add(e.function());
        } else if (expression instanceof ArrowFunctionExpression e) {
            out.addAll(e.params());
            out.add(e.body());
        } else if (expression instanceof ClassExpression e) {
            out.add(e.definition());
        } else if (expression instanceof UnaryExpression e) {
            out.add(e.argument());
        } else if (expression instanceof UpdateExpression e) {
            out.add(e.argument());
        } else if (expression instanceof BinaryExpression e) {
            out.add(e.left());
            out.add(e.right());
        } else if (expression instanceof AssignmentExpression e) {
            out.add(e.left());
            out.add(e.right());
        } else if (expression instanceof ConditionalExpression e) {
            out.add(e.test());
            out.add(e.consequent());
            out.add(e.alternate());
        } else if (expression instanceof CallExpression e) {
            out.add(e.callee());
            out.addAll(e.arguments());
        } else if (expression instanceof NewExpression e) {
            out.add(e.callee());
            out.addAll(e.arguments());
        } else if (expression instanceof MemberExpression e) {
            out.add(e.object());
            out.add(e.property());
        } else if (expression instanceof SequenceExpression e) {
            out.addAll(e.expressions());
        } else if (expression instanceof AwaitExpression e) {
            out.add(e.argument());
        } else if (expression instanceof YieldExpression e) {
            add(out, e.argument());
        } else if (expression instanceof SpreadElement e) {
            out.add(e.argument());
        } else if (expression instanceof ImportExpression e) {
            out.add(e.source());
        }
    }

    private static void patternChildren(Pattern pattern, List<Node> out) {
        if (pattern instanceof ObjectPattern p) {
            out.addAll(p.properties());
            add(out, p.rest());
        } else if (pattern instanceof ArrayPattern p) {
            for (Pattern element : p.elements()) {
                add(out, element);
            }
        } else if (pattern instanceof AssignmentPattern p) {
            out.add(p.left());
            out.add(p.right());
        } else if (pattern instanceof RestElement p) {
            out.add(p.argument());
        }
        // Identifier and MemberExpression are handled as expressions.
    }

    private static void add(List<Node> out, Node node) {
        if (node != null) {
            out.add(node);
        }
    }

    /**
     * Names introduced by a binding pattern, in source order.
     */
    public static List<String> boundNames(Pattern pattern) {
        var names = new ArrayList<String>();
        collectBoundNames(pattern, names);
        return names;
    }

    private static void collectBoundNames(Pattern pattern, List<String> names) {
        if (pattern instanceof Identifier id) {
            names.add(id.name());
        } else if (pattern instanceof ObjectPattern p) {
            for (PatternProperty property : p.properties()) {
                collectBoundNames(property.value(), names);
            }
            if (p.rest() != null) {
                collectBoundNames(p.rest(), names);
            }
        } else if (pattern instanceof ArrayPattern p) {
            for (Pattern element : p.elements()) {
                if (element != null) {
                    collectBoundNames(element, names);
                }
            }
        } else if (pattern instanceof AssignmentPattern p) {
            collectBoundNames(p.left(), names);
        } else if (pattern instanceof RestElement p) {
            collectBoundNames(p.argument(), names);
        }
    }

    /**
     * Static name of a non-computed property key (identifier, string or number), or null.
     */
    public static String propertyName(Expression key, boolean computed) {
        if (key instanceof StringLiteral s) {
            return s.value();
        }
        if (computed) {
            return null;
        }
        if (key instanceof Identifier id) {
            return id.name();
        }
        if (key instanceof NumberLiteral n) {
            return n.raw();
        }
        return null;
    }
}
