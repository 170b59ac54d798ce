package dev.directives.ast;

import dev.directives.ast.Expression.Identifier;
import dev.directives.ast.Expression.StringLiteral;

import java.util.List;

/**
 * Statements and module-level declarations.
 */
public sealed interface Statement extends Node {

    record ExpressionStatement(Expression expression, Span span) implements Statement {}

    record BlockStatement(List<Statement> body, Span span) implements Statement {
        public BlockStatement {
            body = List.copyOf(body);
        }

        public static BlockStatement of(List<Statement> body) {
            return new BlockStatement(body, Span.SYNTHETIC);
        }

        public BlockStatement withBody(List<Statement> statements) {
            return new BlockStatement(statements, span);
        }
    }

    record EmptyStatement(Span span) implements Statement {}

    record ReturnStatement(Expression argument, Span span) implements Statement {}

    record IfStatement(Expression test, Statement consequent, Statement alternate, Span span) implements Statement {}

    /** {@code init} is a {@link VariableDeclaration}, an {@link Expression} or null. */
    record ForStatement(Node init, Expression test, Expression update, Statement body, Span span) implements Statement {}

    /** {@code left} is a {@link VariableDeclaration} or a {@link Pattern}. */
    record ForInStatement(Node left, Expression right, Statement body, Span span) implements Statement {}

    record ForOfStatement(Node left, Expression right, Statement body, boolean await, Span span) implements Statement {}

    record WhileStatement(Expression test, Statement body, Span span) implements Statement {}

    record DoWhileStatement(Statement body, Expression test, Span span) implements Statement {}

    record ThrowStatement(Expression argument, Span span) implements Statement {}

    record TryStatement(BlockStatement block, CatchClause handler, BlockStatement finalizer, Span span)
        implements Statement {}

    record CatchClause(Pattern param, BlockStatement body, Span span) implements Node {}

    record BreakStatement(Identifier label, Span span) implements Statement {}

    record ContinueStatement(Identifier label, Span span) implements Statement {}

    record SwitchStatement(Expression discriminant, List<SwitchCase> cases, Span span) implements Statement {
        public SwitchStatement {
            cases = List.copyOf(cases);
        }
    }

    record SwitchCase(Expression test, List<Statement> consequent, Span span) implements Node {
        public SwitchCase {
            consequent = List.copyOf(consequent);
        }
    }

    record LabeledStatement(Identifier label, Statement body, Span span) implements Statement {}

    record DebuggerStatement(Span span) implements Statement {}

    enum VariableKind {
        VAR, LET, CONST;

        public String keyword() {
            return name().toLowerCase();
        }
    }

    record VariableDeclaration(VariableKind kind, List<VariableDeclarator> declarations, Span span)
        implements Statement {
        public VariableDeclaration {
            declarations = List.copyOf(declarations);
        }

        public static VariableDeclaration single(VariableKind kind, String name, Expression init) {
            return new VariableDeclaration(kind,
                List.of(new VariableDeclarator(Identifier.of(name), init, Span.SYNTHETIC)), Span.SYNTHETIC);
        }
    }

    record VariableDeclarator(Pattern id, Expression init, Span span) implements Node {
        public VariableDeclarator withInit(Expression newInit) {
            return new VariableDeclarator(id, newInit, span);
        }
    }

    record FunctionDeclaration(Function function, Span span) implements Statement {}

    record ClassDeclaration(ClassDef definition, Span span) implements Statement {}

    enum ImportKind { NAMED, DEFAULT, NAMESPACE }

    /** For {@code NAMED} specifiers {@code imported} is the exported name; otherwise null. */
    record ImportSpecifier(ImportKind kind, String imported, Identifier local, Span span) implements Node {}

    record ImportDeclaration(List<ImportSpecifier> specifiers, StringLiteral source, Span span) implements Statement {
        public ImportDeclaration {
            specifiers = List.copyOf(specifiers);
        }
    }

    record ExportSpecifier(String local, String exported, Span span) implements Node {}

    /** Either {@code declaration} is set, or {@code specifiers} (optionally re-exported from {@code source}). */
    record ExportNamedDeclaration(
        Statement declaration,
        List<ExportSpecifier> specifiers,
        StringLiteral source,
        Span span
    ) implements Statement {
        public ExportNamedDeclaration {
            specifiers = List.copyOf(specifiers);
        }

        public static ExportNamedDeclaration of(Statement declaration) {
            return new ExportNamedDeclaration(declaration, List.of(), null, Span.SYNTHETIC);
        }
    }

    /**
     * {@code declaration} is a {@link FunctionDeclaration} or {@link ClassDeclaration} (whose id may be
     * null), or an {@link Expression}.
     */
    record ExportDefaultDeclaration(Node declaration, Span span) implements Statement {}

    record ExportAllDeclaration(String exported, StringLiteral source, Span span) implements Statement {}

    /** Block comment emitted as its own statement, e.g. the module metadata annotation. */
    record MetadataComment(String text, Span span) implements Statement {}
}
