package dev.directives.engine;

import dev.directives.ast.ClassDef;
import dev.directives.ast.ClassMember;
import dev.directives.ast.ClassMember.MethodDefinition;
import dev.directives.ast.ClassMember.PropertyDefinition;
import dev.directives.ast.ClassMember.StaticBlock;
import dev.directives.ast.Expression;
import dev.directives.ast.Expression.*;
import dev.directives.ast.Function;
import dev.directives.ast.FunctionNode;
import dev.directives.ast.Node;
import dev.directives.ast.Nodes;
import dev.directives.ast.ObjectMember;
import dev.directives.ast.ObjectMember.MethodProperty;
import dev.directives.ast.ObjectMember.Property;
import dev.directives.ast.Pattern;
import dev.directives.ast.Pattern.ArrayPattern;
import dev.directives.ast.Pattern.AssignmentPattern;
import dev.directives.ast.Pattern.ObjectPattern;
import dev.directives.ast.Pattern.PatternProperty;
import dev.directives.ast.Pattern.RestElement;
import dev.directives.ast.Statement;
import dev.directives.ast.Statement.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the closure variables of a function: identifiers it reads or writes that are bound
 * neither inside it nor by the host environment.
 *
 * <p>Nested helper functions are analysed as part of their parent, since the parent carries them
 * along when it is relocated. Nested functions that carry their own directive are skipped: they are
 * relocated separately and capture for themselves.
 */
public final class ClosureAnalyzer {

    /** Host-environment globals never treated as closure variables. */
    static final Set<String> GLOBALS = Set.of(
        "globalThis", "window", "self", "global", "undefined", "NaN", "Infinity",
        "Object", "Function", "Array", "String", "Number", "Boolean", "Symbol", "BigInt", "Math", "JSON", "Date",
        "RegExp", "Error", "TypeError", "RangeError", "SyntaxError", "ReferenceError", "EvalError", "URIError",
        "AggregateError", "Promise", "Proxy", "Reflect", "Map", "Set", "WeakMap", "WeakSet", "WeakRef",
        "FinalizationRegistry", "ArrayBuffer", "SharedArrayBuffer", "DataView", "Atomics",
        "Int8Array", "Uint8Array", "Uint8ClampedArray", "Int16Array", "Uint16Array", "Int32Array", "Uint32Array",
        "Float32Array", "Float64Array", "BigInt64Array", "BigUint64Array", "Intl",
        "console", "process", "Buffer", "require", "module", "exports", "__dirname", "__filename",
        "fetch", "Request", "Response", "Headers", "FormData", "URL", "URLSearchParams", "TextEncoder",
        "TextDecoder", "AbortController", "AbortSignal", "Blob", "File", "ReadableStream", "WritableStream",
        "TransformStream", "Event", "EventTarget", "crypto", "performance", "navigator", "structuredClone",
        "setTimeout", "clearTimeout", "setInterval", "clearInterval", "setImmediate", "clearImmediate",
        "queueMicrotask", "atob", "btoa", "encodeURI", "encodeURIComponent", "decodeURI", "decodeURIComponent",
        "escape", "unescape", "isNaN", "isFinite", "parseInt", "parseFloat", "eval");

    private ClosureAnalyzer() {}

    /** Sorted, de-duplicated free variables of {@code function}, globals excluded. */
    public static List<String> freeVariables(FunctionNode function) {
        var walker = new Walker(function);
        walker.function(function, null);
        var names = new TreeSet<>(walker.free);
        names.removeAll(GLOBALS);
        return new ArrayList<>(names);
    }

    /** Whether {@code function} assigns to, or increments, one of its free variables. */
    public static boolean reassignsFreeVariable(FunctionNode function) {
        var walker = new Walker(function);
        walker.function(function, null);
        return walker.written.stream().anyMatch(name -> !GLOBALS.contains(name));
    }

    /**
     * Names bound anywhere inside {@code function} without crossing into nested functions: parameters,
     * variables, nested declarations and catch parameters.
     */
    public static Set<String> declaredNames(FunctionNode function) {
        var names = new LinkedHashSet<String>();
        if (function instanceof Function f && f.id() != null) {
            names.add(f.id().name());
        }
        for (Pattern param : function.params()) {
            names.addAll(Nodes.boundNames(param));
        }
        Node body = function instanceof ArrowFunctionExpression arrow ? arrow.body() : function.blockBody();
        if (!(body instanceof BlockStatement)) {
            return names;
        }
        Nodes.walk(body, node -> {
            if (node instanceof FunctionDeclaration declaration) {
                if (declaration.function().id() != null) {
                    names.add(declaration.function().id().name());
                }
                return false;
            }
            if (node instanceof ClassDeclaration declaration) {
                if (declaration.definition().id() != null) {
                    names.add(declaration.definition().id().name());
                }
                return false;
            }
            if (node instanceof Function || node instanceof ArrowFunctionExpression || node instanceof ClassExpression) {
                return false;
            }
            if (node instanceof VariableDeclarator declarator) {
                names.addAll(Nodes.boundNames(declarator.id()));
            } else if (node instanceof CatchClause clause && clause.param() != null) {
                names.addAll(Nodes.boundNames(clause.param()));
            }
            return true;
        });
        return names;
    }

    /** Scope-aware walk recording references that resolve to no enclosing scope. */
    private static final class Walker {

        private final FunctionNode root;
        private final Deque<Set<String>> scopes = new ArrayDeque<>();
        private final Set<String> free = new LinkedHashSet<>();
        private final Set<String> written = new HashSet<>();

        Walker(FunctionNode root) {
            this.root = root;
        }

        void function(FunctionNode function, String selfName) {
            if (function != root && DirectiveScanner.hasDirective(function)) {
                return;
            }
            var scope = new HashSet<String>();
            if (selfName != null) {
                scope.add(selfName);
            }
            if (function instanceof Function) {
                scope.add("arguments");
            }
            for (Pattern param : function.params()) {
                scope.addAll(Nodes.boundNames(param));
            }
            BlockStatement block = function.blockBody();
            if (block != null) {
                scope.addAll(varNames(block.body()));
            }
            scopes.push(scope);
            for (Pattern param : function.params()) {
                bindingPattern(param);
            }
            if (block != null) {
                block(block.body());
            } else {
                expression((Expression) ((ArrowFunctionExpression) function).body());
            }
            scopes.pop();
        }

        private void block(List<Statement> statements) {
            scopes.push(lexicalNames(statements));
            for (Statement statement : statements) {
                statement(statement);
            }
            scopes.pop();
        }

        private void statement(Statement statement) {
            if (statement instanceof ExpressionStatement s) {
                expression(s.expression());
            } else if (statement instanceof BlockStatement s) {
                block(s.body());
            } else if (statement instanceof ReturnStatement s) {
                optional(s.argument());
            } else if (statement instanceof IfStatement s) {
                expression(s.test());
                statement(s.consequent());
                if (s.alternate() != null) {
                    statement(s.alternate());
                }
            } else if (statement instanceof ForStatement s) {
                scopes.push(headNames(s.init()));
                if (s.init() instanceof VariableDeclaration declaration) {
                    declaration(declaration);
                } else if (s.init() instanceof Expression init) {
                    expression(init);
                }
                optional(s.test());
                optional(s.update());
                statement(s.body());
                scopes.pop();
            } else if (statement instanceof ForInStatement s) {
                loopHead(s.left(), s.right(), s.body());
            } else if (statement instanceof ForOfStatement s) {
                loopHead(s.left(), s.right(), s.body());
            } else if (statement instanceof WhileStatement s) {
                expression(s.test());
                statement(s.body());
            } else if (statement instanceof DoWhileStatement s) {
                statement(s.body());
                expression(s.test());
            } else if (statement instanceof ThrowStatement s) {
                expression(s.argument());
            } else if (statement instanceof TryStatement s) {
                block(s.block().body());
                if (s.handler() != null) {
                    var scope = new HashSet<String>();
                    if (s.handler().param() != null) {
                        scope.addAll(Nodes.boundNames(s.handler().param()));
                    }
                    scopes.push(scope);
                    if (s.handler().param() != null) {
                        bindingPattern(s.handler().param());
                    }
                    block(s.handler().body().body());
                    scopes.pop();
                }
                if (s.finalizer() != null) {
                    block(s.finalizer().body());
                }
            } else if (statement instanceof SwitchStatement s) {
                expression(s.discriminant());
                var all = new ArrayList<Statement>();
                s.cases().forEach(c -> all.addAll(c.consequent()));
                scopes.push(lexicalNames(all));
                for (SwitchCase c : s.cases()) {
                    optional(c.test());
                    c.consequent().forEach(this::statement);
                }
                scopes.pop();
            } else if (statement instanceof LabeledStatement s) {
                statement(s.body());
            } else if (statement instanceof VariableDeclaration s) {
                declaration(s);
            } else if (statement instanceof FunctionDeclaration s) {
                function(s.function(), null);
            } else if (statement instanceof ClassDeclaration s) {
                classDef(s.definition());
            } else if (statement instanceof ExportNamedDeclaration s && s.declaration() != null) {
                statement(s.declaration());
            } else if (statement instanceof ExportDefaultDeclaration s) {
                if (s.declaration() instanceof Statement inner) {
                    statement(inner);
                } else {
                    expression((Expression) s.declaration());
                }
            }
        }

        private void loopHead(Node left, Expression right, Statement body) {
            scopes.push(headNames(left));
            if (left instanceof VariableDeclaration declaration) {
                declaration(declaration);
            } else {
                assignmentTarget((Pattern) left);
            }
            expression(right);
            statement(body);
            scopes.pop();
        }

        private void declaration(VariableDeclaration declaration) {
            for (VariableDeclarator declarator : declaration.declarations()) {
                bindingPattern(declarator.id());
                optional(declarator.init());
            }
        }

        private void expression(Expression expression) {
            if (expression instanceof Identifier id) {
                reference(id.name());
            } else if (expression instanceof TemplateLiteral e) {
                e.expressions().forEach(this::expression);
            } else if (expression instanceof TaggedTemplateExpression e) {
                expression(e.tag());
                expression(e.quasi());
            } else if (expression instanceof ArrayExpression e) {
                e.elements().forEach(this::optional);
            } else if (expression instanceof ObjectExpression e) {
                e.properties().forEach(this::objectMember);
            } else if (expression instanceof FunctionExpression e) {
                function(e.function(), e.function().id() == null ? null : e.function().id().name());
            } else if (expression instanceof ArrowFunctionExpression e) {
                function(e, null);
            } else if (expression instanceof ClassExpression e) {
                classDef(e.definition());
            } else if (expression instanceof UnaryExpression e) {
                expression(e.argument());
            } else if (expression instanceof UpdateExpression e) {
                if (e.argument() instanceof Identifier id) {
                    write(id.name());
                } else {
                    expression(e.argument());
                }
            } else if (expression instanceof BinaryExpression e) {
                expression(e.left());
                expression(e.right());
            } else if (expression instanceof AssignmentExpression e) {
                assignmentTarget(e.left());
                expression(e.right());
            } else if (expression instanceof ConditionalExpression e) {
                expression(e.test());
                expression(e.consequent());
                expression(e.alternate());
            } else if (expression instanceof CallExpression e) {
                expression(e.callee());
                e.arguments().forEach(this::expression);
            } else if (expression instanceof NewExpression e) {
                expression(e.callee());
                e.arguments().forEach(this::expression);
            } else if (expression instanceof MemberExpression e) {
                expression(e.object());
                if (e.computed()) {
                    expression(e.property());
                }
            } else if (expression instanceof SequenceExpression e) {
                e.expressions().forEach(this::expression);
            } else if (expression instanceof AwaitExpression e) {
                expression(e.argument());
            } else if (expression instanceof YieldExpression e) {
                optional(e.argument());
            } else if (expression instanceof SpreadElement e) {
                expression(e.argument());
            } else if (expression instanceof ImportExpression e) {
                expression(e.source());
            }
        }

        private void objectMember(ObjectMember member) {
            if (member instanceof Property p) {
                if (p.computed()) {
                    expression(p.key());
                }
                expression(p.value());
            } else if (member instanceof MethodProperty m) {
                if (m.computed()) {
                    expression(m.key());
                }
                function(m.value(), null);
            } else {
                expression(((SpreadElement) member).argument());
            }
        }

        private void classDef(ClassDef classDef) {
            var scope = new HashSet<String>();
            if (classDef.id() != null) {
                scope.add(classDef.id().name());
            }
            scopes.push(scope);
            optional(classDef.superClass());
            for (ClassMember member : classDef.body()) {
                if (member instanceof MethodDefinition m) {
                    if (m.computed()) {
                        expression(m.key());
                    }
                    function(m.value(), null);
                } else if (member instanceof PropertyDefinition p) {
                    if (p.computed()) {
                        expression(p.key());
                    }
                    optional(p.value());
                } else {
                    block(((StaticBlock) member).body());
                }
            }
            scopes.pop();
        }

        private void bindingPattern(Pattern pattern) {
            if (pattern instanceof ObjectPattern p) {
                for (PatternProperty property : p.properties()) {
                    if (property.computed()) {
                        expression(property.key());
                    }
                    bindingPattern(property.value());
                }
                if (p.rest() != null) {
                    bindingPattern(p.rest());
                }
            } else if (pattern instanceof ArrayPattern p) {
                p.elements().forEach(e -> {
                    if (e != null) {
                        bindingPattern(e);
                    }
                });
            } else if (pattern instanceof AssignmentPattern p) {
                bindingPattern(p.left());
                expression(p.right());
            } else if (pattern instanceof RestElement p) {
                bindingPattern(p.argument());
            } else if (pattern instanceof MemberExpression m) {
                expression(m);
            }
        }

        private void assignmentTarget(Pattern pattern) {
            if (pattern instanceof Identifier id) {
                write(id.name());
            } else if (pattern instanceof MemberExpression m) {
                expression(m);
            } else if (pattern instanceof ObjectPattern p) {
                for (PatternProperty property : p.properties()) {
                    if (property.computed()) {
                        expression(property.key());
                    }
                    assignmentTarget(property.value());
                }
                if (p.rest() != null) {
                    assignmentTarget(p.rest());
                }
            } else if (pattern instanceof ArrayPattern p) {
                p.elements().forEach(e -> {
                    if (e != null) {
                        assignmentTarget(e);
                    }
                });
            } else if (pattern instanceof AssignmentPattern p) {
                assignmentTarget(p.left());
                expression(p.right());
            } else if (pattern instanceof RestElement p) {
                assignmentTarget(p.argument());
            }
        }

        private void optional(Expression expression) {
            if (expression != null) {
                expression(expression);
            }
        }

        private void write(String name) {
            if (reference(name)) {
                written.add(name);
            }
        }

        /** Records {@code name} when no enclosing scope binds it; returns whether it was free. */
        private boolean reference(String name) {
            for (Set<String> scope : scopes) {
                if (scope.contains(name)) {
                    return false;
                }
            }
            free.add(name);
            return true;
        }
    }

    private static Set<String> headNames(Node head) {
        var names = new HashSet<String>();
        if (head instanceof VariableDeclaration declaration && declaration.kind() != VariableKind.VAR) {
            declaration.declarations().forEach(d -> names.addAll(Nodes.boundNames(d.id())));
        }
        return names;
    }

    /** Block-scoped names a statement list introduces. */
    private static Set<String> lexicalNames(List<Statement> statements) {
        var names = new HashSet<String>();
        for (Statement statement : statements) {
            if (statement instanceof VariableDeclaration declaration && declaration.kind() != VariableKind.VAR) {
                declaration.declarations().forEach(d -> names.addAll(Nodes.boundNames(d.id())));
            } else if (statement instanceof FunctionDeclaration declaration && declaration.function().id() != null) {
                names.add(declaration.function().id().name());
            } else if (statement instanceof ClassDeclaration declaration && declaration.definition().id() != null) {
                names.add(declaration.definition().id().name());
            }
        }
        return names;
    }

    /** {@code var} names hoisted to the enclosing function. */
    private static Set<String> varNames(List<Statement> statements) {
        var names = new HashSet<String>();
        for (Statement statement : statements) {
            collectVarNames(statement, names);
        }
        return names;
    }

    private static void collectVarNames(Statement statement, Set<String> names) {
        if (statement == null) {
            return;
        }
        if (statement instanceof VariableDeclaration s) {
            if (s.kind() == VariableKind.VAR) {
                s.declarations().forEach(d -> names.addAll(Nodes.boundNames(d.id())));
            }
        } else if (statement instanceof BlockStatement s) {
            s.body().forEach(inner -> collectVarNames(inner, names));
        } else if (statement instanceof IfStatement s) {
            collectVarNames(s.consequent(), names);
            collectVarNames(s.alternate(), names);
        } else if (statement instanceof ForStatement s) {
            if (s.init() instanceof VariableDeclaration init) {
                collectVarNames(init, names);
            }
            collectVarNames(s.body(), names);
        } else if (statement instanceof ForInStatement s) {
            if (s.left() instanceof VariableDeclaration left) {
                collectVarNames(left, names);
            }
            collectVarNames(s.body(), names);
        } else if (statement instanceof ForOfStatement s) {
            if (s.left() instanceof VariableDeclaration left) {
                collectVarNames(left, names);
            }
            collectVarNames(s.body(), names);
        } else if (statement instanceof WhileStatement s) {
            collectVarNames(s.body(), names);
        } else if (statement instanceof DoWhileStatement s) {
            collectVarNames(s.body(), names);
        } else if (statement instanceof TryStatement s) {
            collectVarNames(s.block(), names);
            if (s.handler() != null) {
                collectVarNames(s.handler().body(), names);
            }
            collectVarNames(s.finalizer(), names);
        } else if (statement instanceof SwitchStatement s) {
            s.cases().forEach(c -> c.consequent().forEach(inner -> collectVarNames(inner, names)));
        } else if (statement instanceof LabeledStatement s) {
            collectVarNames(s.body(), names);
        }
    }
}
