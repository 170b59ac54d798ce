package dev.directives.engine;

import dev.directives.ast.Expression.Identifier;
import dev.directives.ast.Expression.ObjectExpression;
import dev.directives.ast.Expression.StringLiteral;
import dev.directives.ast.FunctionNode;
import dev.directives.ast.Nodes;
import dev.directives.ast.ObjectMember;
import dev.directives.ast.ObjectMember.Property;
import dev.directives.ast.Span;
import dev.directives.ast.Statement;
import dev.directives.ast.Statement.BlockStatement;
import dev.directives.ast.Statement.ExpressionStatement;
import dev.directives.ast.Statement.ImportDeclaration;
import dev.directives.ast.Statement.TryStatement;
import dev.directives.ast.Statement.VariableDeclaration;
import dev.directives.ast.Statement.VariableKind;
import dev.directives.model.Diagnostic;
import dev.directives.model.DiagnosticKind;
import dev.directives.model.Directive;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds {@code "use step"} / {@code "use workflow"} directives in function bodies and at module level,
 * and reports directives that are misplaced or look misspelled.
 *
 * <p>A directive counts only as the first statement of its scope. Functions that use resource-cleanup
 * declarations are lowered into {@code const env = { stack, error, hasError }; try {...} catch {...}
 * finally {...}}; for those the directive is expected as the first statement of the try block.
 */
public final class DirectiveScanner {

    private static final Set<String> USING_LOWERING_KEYS = Set.of("stack", "error", "hasError");

    private DirectiveScanner() {}

    /** Result of scanning one function body. {@code directive} is null when none was honored. */
    public record FunctionScan(Directive directive, Span directiveSpan, List<Diagnostic> diagnostics) {
        public FunctionScan {
            diagnostics = List.copyOf(diagnostics);
        }

        public boolean found() {
            return directive != null;
        }
    }

    /**
     * Result of scanning the module prologue.
     *
     * @param honoredStatements the directive statements the transform removes
     */
    public record ModuleScan(Directive directive, List<Statement> honoredStatements, List<Diagnostic> diagnostics) {
        public ModuleScan {
            honoredStatements = List.copyOf(honoredStatements);
            diagnostics = List.copyOf(diagnostics);
        }

        public boolean found() {
            return directive != null;
        }
    }

    public static FunctionScan scanFunction(FunctionNode function) {
        BlockStatement body = function.blockBody();
        if (body == null) {
            return new FunctionScan(null, null, List.of());
        }
        var diagnostics = new ArrayList<Diagnostic>();
        Directive found = null;
        Span span = null;
        boolean directivePosition = true;
        List<Statement> statements = prologue(body.body());
        for (int i = 0; i < statements.size(); i++) {
            Statement statement = statements.get(i);
            String text = directiveText(statement);
            if (text == null) {
                directivePosition = false;
                continue;
            }
            Optional<Directive> directive = Directive.fromText(text);
            if (directive.isPresent()) {
                if (i == 0) {
                    found = directive.get();
                    span = statement.span();
                } else {
                    diagnostics.add(Diagnostic.of(DiagnosticKind.MISPLACED_DIRECTIVE, statement.span(),
                        "Directive " + directive.get() + " must be the first statement of the function body"));
                }
            } else if (directivePosition) {
                closestDirective(text).ifPresent(match -> diagnostics.add(
                    Diagnostic.of(DiagnosticKind.MISSPELLED_DIRECTIVE, statement.span(), match, text)));
            }
        }
        return new FunctionScan(found, span, diagnostics);
    }

    /** Cheap check used where only the presence of an honored directive matters. */
    public static boolean hasDirective(FunctionNode function) {
        return scanFunction(function).found();
    }

    public static ModuleScan scanModule(List<Statement> body) {
        var diagnostics = new ArrayList<Diagnostic>();
        var honored = new ArrayList<Statement>();
        Directive directive = null;
        boolean directivePosition = true;
        int index = 0;
        for (Statement statement : body) {
            if (statement instanceof ImportDeclaration) {
                continue;
            }
            String text = directiveText(statement);
            int position = index++;
            if (text == null) {
                directivePosition = false;
                continue;
            }
            Optional<Directive> match = Directive.fromText(text);
            if (match.isEmpty()) {
                if (directivePosition) {
                    closestDirective(text).ifPresent(closest -> diagnostics.add(
                        Diagnostic.of(DiagnosticKind.MISSPELLED_DIRECTIVE, statement.span(), closest, text)));
                }
                directivePosition = false;
                continue;
            }
            if (position == 0) {
                directive = match.get();
                honored.add(statement);
            } else if (directive != null && directivePosition) {
                if (match.get() == directive) {
                    honored.add(statement);
                } else {
                    diagnostics.add(Diagnostic.of(DiagnosticKind.MISPLACED_DIRECTIVE, statement.span(),
                        "A module cannot be marked with both " + directive + " and " + match.get()
                            + "; " + match.get() + " is ignored"));
                }
            } else {
                diagnostics.add(Diagnostic.of(DiagnosticKind.MISPLACED_DIRECTIVE, statement.span(),
                    "Module-level directive " + match.get() + " must come before any other statement"));
                directivePosition = false;
            }
        }
        return new ModuleScan(directive, honored, diagnostics);
    }

    /**
     * The body without its honored directive. Bodies without one are returned unchanged.
     */
    public static BlockStatement stripDirective(BlockStatement body) {
        List<Statement> statements = body.body();
        if (isUsingLowering(statements)) {
            TryStatement lowered = (TryStatement) statements.get(1);
            BlockStatement block = lowered.block();
            if (!block.body().isEmpty() && isHonoredDirective(block.body().get(0))) {
                var rewritten = new ArrayList<>(statements);
                rewritten.set(1, new TryStatement(block.withBody(block.body().subList(1, block.body().size())),
                    lowered.handler(), lowered.finalizer(), lowered.span()));
                return body.withBody(rewritten);
            }
            return body;
        }
        if (!statements.isEmpty() && isHonoredDirective(statements.get(0))) {
            return body.withBody(statements.subList(1, statements.size()));
        }
        return body;
    }

    /**
     * The statements whose head holds the directive: the body itself, or the try block of a
     * resource-cleanup lowering.
     */
    static List<Statement> prologue(List<Statement> statements) {
        if (isUsingLowering(statements)) {
            return ((TryStatement) statements.get(1)).block().body();
        }
        return statements;
    }

    static boolean isUsingLowering(List<Statement> statements) {
        if (statements.size() < 2
            || !(statements.get(0) instanceof VariableDeclaration declaration)
            || !(statements.get(1) instanceof TryStatement lowered)) {
            return false;
        }
        if (declaration.kind() != VariableKind.CONST || declaration.declarations().size() != 1
            || !(declaration.declarations().get(0).id() instanceof Identifier)
            || !(declaration.declarations().get(0).init() instanceof ObjectExpression env)) {
            return false;
        }
        if (lowered.handler() == null || lowered.finalizer() == null) {
            return false;
        }
        if (env.properties().size() != USING_LOWERING_KEYS.size()) {
            return false;
        }
        var keys = new HashSet<String>();
        for (ObjectMember member : env.properties()) {
            if (!(member instanceof Property property)) {
                return false;
            }
            keys.add(Nodes.propertyName(property.key(), property.computed()));
        }
        return keys.equals(USING_LOWERING_KEYS);
    }

    static String directiveText(Statement statement) {
        if (statement instanceof ExpressionStatement expression && expression.expression() instanceof StringLiteral s) {
            return s.value();
        }
        return null;
    }

    private static boolean isHonoredDirective(Statement statement) {
        String text = directiveText(statement);
        return text != null && Directive.fromText(text).isPresent();
    }

    /** The directive one edit away from {@code text}, if any. */
    static Optional<Directive> closestDirective(String text) {
        for (Directive directive : Directive.values()) {
            if (editDistance(text, directive.text()) == 1) {
                return Optional.of(directive);
            }
        }
        return Optional.empty();
    }

    static int editDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
