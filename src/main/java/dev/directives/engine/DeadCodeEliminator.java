package dev.directives.engine;

import dev.directives.ast.ClassDef;
import dev.directives.ast.ClassMember.MethodDefinition;
import dev.directives.ast.ClassMember.PropertyDefinition;
import dev.directives.ast.Expression;
import dev.directives.ast.Expression.ArrowFunctionExpression;
import dev.directives.ast.Expression.BooleanLiteral;
import dev.directives.ast.Expression.Identifier;
import dev.directives.ast.Expression.MemberExpression;
import dev.directives.ast.Expression.NullLiteral;
import dev.directives.ast.Expression.NumberLiteral;
import dev.directives.ast.Expression.RegExpLiteral;
import dev.directives.ast.Function;
import dev.directives.ast.Node;
import dev.directives.ast.Nodes;
import dev.directives.ast.ObjectMember.MethodProperty;
import dev.directives.ast.ObjectMember.Property;
import dev.directives.ast.Pattern;
import dev.directives.ast.Pattern.ArrayPattern;
import dev.directives.ast.Pattern.AssignmentPattern;
import dev.directives.ast.Pattern.ObjectPattern;
import dev.directives.ast.Pattern.PatternProperty;
import dev.directives.ast.Pattern.RestElement;
import dev.directives.ast.Statement;
import dev.directives.ast.Statement.BreakStatement;
import dev.directives.ast.Statement.CatchClause;
import dev.directives.ast.Statement.ContinueStatement;
import dev.directives.ast.Statement.EmptyStatement;
import dev.directives.ast.Statement.ExportNamedDeclaration;
import dev.directives.ast.Statement.ExportSpecifier;
import dev.directives.ast.Statement.ExpressionStatement;
import dev.directives.ast.Statement.FunctionDeclaration;
import dev.directives.ast.Statement.ImportDeclaration;
import dev.directives.ast.Statement.ImportSpecifier;
import dev.directives.ast.Statement.LabeledStatement;
import dev.directives.ast.Statement.VariableDeclaration;
import dev.directives.ast.Statement.VariableDeclarator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes module-level code that nothing references any more once step or workflow bodies were
 * replaced: unused non-exported functions, unused variables, bare expression statements and unused
 * import specifiers. Runs to a fixpoint, so removing one declaration can free
 * the ones it referenced.
 *
 * <p>Only module-level statements are candidates. Classes and side-effect imports are never removed. A
 * variable declaration goes once none of its bound names is referenced, whatever its initializer does,
 * so setup that only steps used leaves the workflow and client bundles together with its imports.
 */
public final class DeadCodeEliminator {

    private static final Logger log = LoggerFactory.getLogger(DeadCodeEliminator.class);

    private DeadCodeEliminator() {}

    /**
     * @param keep names that must survive even when unreferenced (step and workflow bindings,
     *             hoisted names, registered classes)
     */
    public static List<Statement> eliminate(List<Statement> body, Set<String> keep) {
        List<Statement> current = body;
        int removed = 0;
        while (true) {
            var next = pass(current, keep);
            if (next.size() == current.size() && sameStatements(next, current)) {
                break;
            }
            removed += current.size() - next.size();
            current = next;
        }
        if (removed > 0) {
            log.debug("Dead code elimination dropped {} module-level statement(s)", removed);
        }
        return current;
    }

    private static List<Statement> pass(List<Statement> body, Set<String> keep) {
        List<Set<String>> references = new ArrayList<>(body.size());
        for (Statement statement : body) {
            var names = new HashSet<String>();
            collect(statement, names);
            references.add(names);
        }
        var out = new ArrayList<Statement>(body.size());
        for (int i = 0; i < body.size(); i++) {
            Statement statement = body.get(i);
            Statement kept = prune(statement, referencedOutside(references, i), keep);
            if (kept != null) {
                out.add(kept);
            }
        }
        return out;
    }

    /** The statement, a smaller version of it, or null when it can go. */
    private static Statement prune(Statement statement, Set<String> used, Set<String> keep) {
        if (statement instanceof EmptyStatement) {
            return null;
        }
        if (statement instanceof ExpressionStatement expression) {
            return isInert(expression.expression()) ? null : statement;
        }
        if (statement instanceof FunctionDeclaration declaration) {
            String name = declaration.function().id().name();
            return used.contains(name) || keep.contains(name) ? statement : null;
        }
        if (statement instanceof VariableDeclaration declaration) {
            for (VariableDeclarator declarator : declaration.declarations()) {
                for (String name : Nodes.boundNames(declarator.id())) {
                    if (used.contains(name) || keep.contains(name)) {
                        return statement;
                    }
                }
            }
            return null;
        }
        if (statement instanceof ImportDeclaration declaration && !declaration.specifiers().isEmpty()) {
            var specifiers = new ArrayList<ImportSpecifier>();
            for (ImportSpecifier specifier : declaration.specifiers()) {
                String local = specifier.local().name();
                if (used.contains(local) || keep.contains(local)) {
                    specifiers.add(specifier);
                }
            }
            if (specifiers.isEmpty()) {
                return null;
            }
            return specifiers.size() == declaration.specifiers().size() ? statement
                : new ImportDeclaration(specifiers, declaration.source(), declaration.span());
        }
        return statement;
    }

    private static Set<String> referencedOutside(List<Set<String>> references, int index) {
        var names = new HashSet<String>();
        for (int i = 0; i < references.size(); i++) {
            if (i != index) {
                names.addAll(references.get(i));
            }
        }
        return names;
    }

    private static boolean sameStatements(List<Statement> a, List<Statement> b) {
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) {
                return false;
            }
        }
        return true;
    }

    /** Expression statements with no effect at all: a bare name or a non-string literal. */
    private static boolean isInert(Expression expression) {
        return expression instanceof Identifier
            || expression instanceof NumberLiteral
            || expression instanceof BooleanLiteral
            || expression instanceof NullLiteral
            || expression instanceof RegExpLiteral;
    }

    // ---- references --------------------------------------------------------------------------

    /** Adds every name {@code node} reads, skipping binding positions and static property names. */
    static void collect(Node node, Set<String> out) {
        if (node == null) {
            return;
        }
        if (node instanceof Identifier id) {
            out.add(id.name());
        } else if (node instanceof MemberExpression member) {
            collect(member.object(), out);
            if (member.computed()) {
                collect(member.property(), out);
            }
        } else if (node instanceof Property property) {
            collectKey(property.key(), property.computed(), out);
            collect(property.value(), out);
        } else if (node instanceof MethodProperty method) {
            collectKey(method.key(), method.computed(), out);
            collect(method.value(), out);
        } else if (node instanceof MethodDefinition method) {
            collectKey(method.key(), method.computed(), out);
            collect(method.value(), out);
        } else if (node instanceof PropertyDefinition property) {
            collectKey(property.key(), property.computed(), out);
            collect(property.value(), out);
        } else if (node instanceof PatternProperty property) {
            collectKey(property.key(), property.computed(), out);
            collect(property.value(), out);
        } else if (node instanceof Function function) {
            function.params().forEach(param -> collectBinding(param, out));
            collect(function.body(), out);
        } else if (node instanceof ArrowFunctionExpression arrow) {
            arrow.params().forEach(param -> collectBinding(param, out));
            collect(arrow.body(), out);
        } else if (node instanceof ClassDef classDef) {
            collect(classDef.superClass(), out);
            classDef.body().forEach(member -> collect(member, out));
        } else if (node instanceof VariableDeclarator declarator) {
            collectBinding(declarator.id(), out);
            collect(declarator.init(), out);
        } else if (node instanceof CatchClause clause) {
            if (clause.param() != null) {
                collectBinding(clause.param(), out);
            }
            collect(clause.body(), out);
        } else if (node instanceof ExportNamedDeclaration export) {
            collect(export.declaration(), out);
            if (export.source() == null) {
                for (ExportSpecifier specifier : export.specifiers()) {
                    out.add(specifier.local());
                }
            }
        } else if (node instanceof ImportDeclaration || node instanceof BreakStatement
            || node instanceof ContinueStatement) {
            return;
        } else if (node instanceof LabeledStatement labeled) {
            collect(labeled.body(), out);
        } else {
            for (Node child : Nodes.children(node)) {
                collect(child, out);
            }
        }
    }

    private static void collectKey(Expression key, boolean computed, Set<String> out) {
        if (computed) {
            collect(key, out);
        }
    }

    private static void collectBinding(Pattern pattern, Set<String> out) {
        if (pattern instanceof ObjectPattern object) {
            for (PatternProperty property : object.properties()) {
                collectKey(property.key(), property.computed(), out);
                collectBinding(property.value(), out);
            }
            if (object.rest() != null) {
                collectBinding(object.rest(), out);
            }
        } else if (pattern instanceof ArrayPattern array) {
            for (Pattern element : array.elements()) {
                if (element != null) {
                    collectBinding(element, out);
                }
            }
        } else if (pattern instanceof AssignmentPattern assignment) {
            collectBinding(assignment.left(), out);
            collect(assignment.right(), out);
        } else if (pattern instanceof RestElement rest) {
            collectBinding(rest.argument(), out);
        } else if (pattern instanceof MemberExpression member) {
            collect(member, out);
        }
    }
}
