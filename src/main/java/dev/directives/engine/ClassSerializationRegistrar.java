package dev.directives.engine;

import dev.directives.ast.ClassDef;
import dev.directives.ast.ClassMember;
import dev.directives.ast.ClassMember.MethodDefinition;
import dev.directives.ast.ClassMember.PropertyDefinition;
import dev.directives.ast.Expression;
import dev.directives.ast.Expression.CallExpression;
import dev.directives.ast.Expression.Identifier;
import dev.directives.ast.Expression.MemberExpression;
import dev.directives.ast.Expression.StringLiteral;
import dev.directives.ast.Statement;
import dev.directives.ast.Statement.ExportNamedDeclaration;
import dev.directives.ast.Statement.ImportDeclaration;
import dev.directives.ast.Statement.ImportKind;
import dev.directives.ast.Statement.ImportSpecifier;
import dev.directives.ast.Statement.VariableDeclaration;
import dev.directives.ast.Statement.VariableDeclarator;
import dev.directives.ast.Statement.VariableKind;
import dev.directives.model.ClassSerializationEntry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Detects classes with custom serialization hooks and builds the class-serialization registrations.
 *
 * <p>A hook is a static member whose computed key is {@code Symbol.for("workflow-serialize")} or
 * {@code Symbol.for("workflow-deserialize")}, written directly or through a module-level constant
 * holding that symbol, or through an import of {@code WORKFLOW_SERIALIZE} / {@code WORKFLOW_DESERIALIZE}.
 */
public final class ClassSerializationRegistrar {

    private ClassSerializationRegistrar() {}

    /** Local names that resolve to the serialize and deserialize symbols. */
    public record HookAliases(Set<String> serialize, Set<String> deserialize) {
        public HookAliases {
            serialize = Set.copyOf(serialize);
            deserialize = Set.copyOf(deserialize);
        }
    }

    public static HookAliases collectAliases(List<Statement> body) {
        var serialize = new HashSet<String>();
        var deserialize = new HashSet<String>();
        for (Statement statement : body) {
            Statement declaration = statement instanceof ExportNamedDeclaration export ? export.declaration() : statement;
            if (declaration instanceof ImportDeclaration importDeclaration) {
                for (ImportSpecifier specifier : importDeclaration.specifiers()) {
                    if (specifier.kind() != ImportKind.NAMED) {
                        continue;
                    }
                    if (RuntimeContract.SERIALIZE_EXPORT.equals(specifier.imported())) {
                        serialize.add(specifier.local().name());
                    } else if (RuntimeContract.DESERIALIZE_EXPORT.equals(specifier.imported())) {
                        deserialize.add(specifier.local().name());
                    }
                }
            } else if (declaration instanceof VariableDeclaration variables && variables.kind() == VariableKind.CONST) {
                for (VariableDeclarator declarator : variables.declarations()) {
                    if (!(declarator.id() instanceof Identifier id)) {
                        continue;
                    }
                    String symbol = symbolKey(declarator.init());
                    if (RuntimeContract.SERIALIZE_SYMBOL.equals(symbol)) {
                        serialize.add(id.name());
                    } else if (RuntimeContract.DESERIALIZE_SYMBOL.equals(symbol)) {
                        deserialize.add(id.name());
                    }
                }
            }
        }
        return new HookAliases(serialize, deserialize);
    }

    /** True when the class defines both the serialize and the deserialize hook. */
    public static boolean hasCustomSerialization(ClassDef classDef, HookAliases aliases) {
        boolean serialize = false;
        boolean deserialize = false;
        for (ClassMember member : classDef.body()) {
            Expression key = null;
            if (member instanceof MethodDefinition method && method.isStatic() && method.computed()) {
                key = method.key();
            } else if (member instanceof PropertyDefinition property && property.isStatic() && property.computed()) {
                key = property.key();
            }
            String hook = hookSymbol(key, aliases);
            if (RuntimeContract.SERIALIZE_SYMBOL.equals(hook)) {
                serialize = true;
            } else if (RuntimeContract.DESERIALIZE_SYMBOL.equals(hook)) {
                deserialize = true;
            }
        }
        return serialize && deserialize;
    }

    public static List<Statement> registrations(List<ClassSerializationEntry> entries) {
        var statements = new ArrayList<Statement>();
        for (ClassSerializationEntry entry : entries) {
            statements.add(RuntimeContract.registerClass(entry.id(), entry.className()));
        }
        return statements;
    }

    static String hookSymbol(Expression key, HookAliases aliases) {
        if (key instanceof Identifier id) {
            if (aliases.serialize().contains(id.name())) {
                return RuntimeContract.SERIALIZE_SYMBOL;
            }
            if (aliases.deserialize().contains(id.name())) {
                return RuntimeContract.DESERIALIZE_SYMBOL;
            }
            return null;
        }
        return symbolKey(key);
    }

    /** The key of a {@code Symbol.for("...")} call, or null. */
    static String symbolKey(Expression expression) {
        if (expression instanceof CallExpression call
            && call.callee() instanceof MemberExpression callee
            && !callee.computed()
            && callee.object() instanceof Identifier object && object.name().equals("Symbol")
            && callee.property() instanceof Identifier property && property.name().equals("for")
            && call.arguments().size() == 1
            && call.arguments().get(0) instanceof StringLiteral key) {
            return key.value();
        }
        return null;
    }
}
