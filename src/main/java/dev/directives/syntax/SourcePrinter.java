package dev.directives.syntax;

import dev.directives.ast.ClassDef;
import dev.directives.ast.ClassMember;
import dev.directives.ast.ClassMember.MethodDefinition;
import dev.directives.ast.ClassMember.MethodKind;
import dev.directives.ast.ClassMember.PropertyDefinition;
import dev.directives.ast.ClassMember.StaticBlock;
import dev.directives.ast.Expression;
import dev.directives.ast.Expression.*;
import dev.directives.ast.Function;
import dev.directives.ast.Node;
import dev.directives.ast.ObjectMember;
import dev.directives.ast.ObjectMember.MethodProperty;
import dev.directives.ast.ObjectMember.Property;
import dev.directives.ast.Pattern;
import dev.directives.ast.Pattern.*;
import dev.directives.ast.Program;
import dev.directives.ast.Statement;
import dev.directives.ast.Statement.*;

import java.util.List;
import java.util.Map;

/**
 * Prints a tree back to JavaScript source with four-space indentation. Parentheses are inserted
 * wherever operator precedence requires them.
 */
public class SourcePrinter {

    private static final int SEQUENCE = 0;
    private static final int ASSIGNMENT = 1;
    private static final int CONDITIONAL = 2;
    private static final int BINARY_BASE = 2;
    private static final int UNARY = 15;
    private static final int POSTFIX = 16;
    private static final int CALL = 17;
    private static final int PRIMARY = 18;

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
        Map.entry("??", 1), Map.entry("||", 2), Map.entry("&&", 3),
        Map.entry("|", 4), Map.entry("^", 5), Map.entry("&", 6),
        Map.entry("==", 7), Map.entry("!=", 7), Map.entry("===", 7), Map.entry("!==", 7),
        Map.entry("<", 8), Map.entry(">", 8), Map.entry("<=", 8), Map.entry(">=", 8),
        Map.entry("instanceof", 8), Map.entry("in", 8),
        Map.entry("<<", 9), Map.entry(">>", 9), Map.entry(">>>", 9),
        Map.entry("+", 10), Map.entry("-", 10),
        Map.entry("*", 11), Map.entry("/", 11), Map.entry("%", 11),
        Map.entry("**", 12)
    );

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    public static String print(Program program) {
        var printer = new SourcePrinter();
        for (Statement statement : program.body()) {
            printer.statementLine(statement);
        }
        return printer.out.toString();
    }

    public static String print(Statement statement) {
        var printer = new SourcePrinter();
        printer.statement(statement);
        return printer.out.toString();
    }

    public static String print(Expression expression) {
        var printer = new SourcePrinter();
        printer.expression(expression, SEQUENCE);
        return printer.out.toString();
    }

    // ---------------------------------------------------------------- statements

    private void statementLine(Statement statement) {
        indent();
        statement(statement);
        out.append('\n');
    }

    private void statement(Statement statement) {
        if (statement instanceof ExpressionStatement s) {
            if (needsStatementParens(s.expression())) {
                out.append('(');
                expression(s.expression(), SEQUENCE);
                out.append(')');
            } else {
                expression(s.expression(), SEQUENCE);
            }
            out.append(';');
        } else if (statement instanceof BlockStatement s) {
            block(s.body());
        } else if (statement instanceof EmptyStatement) {
            out.append(';');
        } else if (statement instanceof ReturnStatement s) {
            out.append("return");
            if (s.argument() != null) {
                out.append(' ');
                expression(s.argument(), SEQUENCE);
            }
            out.append(';');
        } else if (statement instanceof IfStatement s) {
            out.append("if (");
            expression(s.test(), SEQUENCE);
            out.append(") ");
            statement(s.consequent());
            if (s.alternate() != null) {
                if (s.consequent() instanceof BlockStatement) {
                    out.append(" else ");
                } else {
                    out.append('\n');
                    indent();
                    out.append("else ");
                }
                statement(s.alternate());
            }
        } else if (statement instanceof ForStatement s) {
            out.append("for (");
            if (s.init() instanceof VariableDeclaration declaration) {
                variableDeclaration(declaration);
            } else if (s.init() instanceof Expression init) {
                expression(init, SEQUENCE);
            }
            out.append(';');
            if (s.test() != null) {
                out.append(' ');
                expression(s.test(), SEQUENCE);
            }
            out.append(';');
            if (s.update() != null) {
                out.append(' ');
                expression(s.update(), SEQUENCE);
            }
            out.append(") ");
            statement(s.body());
        } else if (statement instanceof ForInStatement s) {
            out.append("for (");
            forLeft(s.left());
            out.append(" in ");
            expression(s.right(), SEQUENCE);
            out.append(") ");
            statement(s.body());
        } else if (statement instanceof ForOfStatement s) {
            out.append(s.await() ? "for await (" : "for (");
            forLeft(s.left());
            out.append(" of ");
            expression(s.right(), ASSIGNMENT);
            out.append(") ");
            statement(s.body());
        } else if (statement instanceof WhileStatement s) {
            out.append("while (");
            expression(s.test(), SEQUENCE);
            out.append(") ");
            statement(s.body());
        } else if (statement instanceof DoWhileStatement s) {
            out.append("do ");
            statement(s.body());
            out.append(" while (");
            expression(s.test(), SEQUENCE);
            out.append(");");
        } else if (statement instanceof ThrowStatement s) {
            out.append("throw ");
            expression(s.argument(), SEQUENCE);
            out.append(';');
        } else if (statement instanceof TryStatement s) {
            out.append("try ");
            block(s.block().body());
            if (s.handler() != null) {
                out.append(" catch ");
                if (s.handler().param() != null) {
                    out.append('(');
                    pattern(s.handler().param());
                    out.append(") ");
                }
                block(s.handler().body().body());
            }
            if (s.finalizer() != null) {
                out.append(" finally ");
                block(s.finalizer().body());
            }
        } else if (statement instanceof BreakStatement s) {
            out.append("break");
            if (s.label() != null) {
                out.append(' ').append(s.label().name());
            }
            out.append(';');
        } else if (statement instanceof ContinueStatement s) {
            out.append("continue");
            if (s.label() != null) {
                out.append(' ').append(s.label().name());
            }
            out.append(';');
        } else if (statement instanceof SwitchStatement s) {
            switchStatement(s);
        } else if (statement instanceof LabeledStatement s) {
            out.append(s.label().name()).append(": ");
            statement(s.body());
        } else if (statement instanceof DebuggerStatement) {
            out.append("debugger;");
        } else if (statement instanceof VariableDeclaration s) {
            variableDeclaration(s);
            out.append(';');
        } else if (statement instanceof FunctionDeclaration s) {
            function(s.function());
        } else if (statement instanceof ClassDeclaration s) {
            classDef(s.definition());
        } else if (statement instanceof ImportDeclaration s) {
            importDeclaration(s);
        } else if (statement instanceof ExportNamedDeclaration s) {
            exportNamed(s);
        } else if (statement instanceof ExportDefaultDeclaration s) {
            out.append("export default ");
            if (s.declaration() instanceof Statement declaration) {
                statement(declaration);
            } else {
                expression((Expression) s.declaration(), ASSIGNMENT);
                out.append(';');
            }
        } else if (statement instanceof ExportAllDeclaration s) {
            out.append("export *");
            if (s.exported() != null) {
                out.append(" as ").append(moduleName(s.exported()));
            }
            out.append(" from ");
            string(s.source().value());
            out.append(';');
        } else if (statement instanceof MetadataComment s) {
            out.append("/**").append(s.text()).append("*/;");
        } else {
            throw new IllegalArgumentException("Unsupported statement " + statement.getClass().getSimpleName());
        }
    }

    private void forLeft(Node left) {
        if (left instanceof VariableDeclaration declaration) {
            variableDeclaration(declaration);
        } else {
            pattern((Pattern) left);
        }
    }

    private void block(List<Statement> body) {
        if (body.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{\n");
        depth++;
        for (Statement statement : body) {
            statementLine(statement);
        }
        depth--;
        indent();
        out.append('}');
    }

    private void switchStatement(SwitchStatement s) {
        out.append("switch (");
        expression(s.discriminant(), SEQUENCE);
        out.append(") {\n");
        depth++;
        for (SwitchCase switchCase : s.cases()) {
            indent();
            if (switchCase.test() == null) {
                out.append("default:\n");
            } else {
                out.append("case ");
                expression(switchCase.test(), SEQUENCE);
                out.append(":\n");
            }
            depth++;
            for (Statement statement : switchCase.consequent()) {
                statementLine(statement);
            }
            depth--;
        }
        depth--;
        indent();
        out.append('}');
    }

    private void variableDeclaration(VariableDeclaration declaration) {
        out.append(declaration.kind().keyword()).append(' ');
        List<VariableDeclarator> declarators = declaration.declarations();
        for (int i = 0; i < declarators.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            pattern(declarators.get(i).id());
            if (declarators.get(i).init() != null) {
                out.append(" = ");
                expression(declarators.get(i).init(), ASSIGNMENT);
            }
        }
    }

    private void importDeclaration(ImportDeclaration s) {
        out.append("import ");
        if (!s.specifiers().isEmpty()) {
            boolean first = true;
            boolean inBraces = false;
            for (ImportSpecifier specifier : s.specifiers()) {
                if (specifier.kind() == ImportKind.NAMED) {
                    out.append(first ? "{ " : inBraces ? ", " : ", { ");
                    inBraces = true;
                    String local = specifier.local().name();
                    if (specifier.imported().equals(local)) {
                        out.append(local);
                    } else {
                        out.append(moduleName(specifier.imported())).append(" as ").append(local);
                    }
                } else {
                    if (!first) {
                        out.append(", ");
                    }
                    if (specifier.kind() == ImportKind.NAMESPACE) {
                        out.append("* as ");
                    }
                    out.append(specifier.local().name());
                }
                first = false;
            }
            if (inBraces) {
                out.append(" }");
            }
            out.append(" from ");
        }
        string(s.source().value());
        out.append(';');
    }

    private void exportNamed(ExportNamedDeclaration s) {
        out.append("export ");
        if (s.declaration() != null) {
            statement(s.declaration());
            return;
        }
        if (s.specifiers().isEmpty()) {
            out.append("{}");
        } else {
            out.append("{ ");
            for (int i = 0; i < s.specifiers().size(); i++) {
                ExportSpecifier specifier = s.specifiers().get(i);
                if (i > 0) {
                    out.append(", ");
                }
                out.append(moduleName(specifier.local()));
                if (!specifier.local().equals(specifier.exported())) {
                    out.append(" as ").append(moduleName(specifier.exported()));
                }
            }
            out.append(" }");
        }
        if (s.source() != null) {
            out.append(" from ");
            string(s.source().value());
        }
        out.append(';');
    }

    private static String moduleName(String name) {
        return isIdentifierName(name) ? name : quote(name);
    }

    // ---------------------------------------------------------------- functions and classes

    private void function(Function function) {
        if (function.async()) {
            out.append("async ");
        }
        out.append("function");
        if (function.generator()) {
            out.append('*');
        }
        if (function.id() != null) {
            out.append(' ').append(function.id().name());
        }
        parameters(function.params());
        out.append(' ');
        block(function.body().body());
    }

    private void parameters(List<Pattern> params) {
        out.append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            pattern(params.get(i));
        }
        out.append(')');
    }

    private void classDef(ClassDef definition) {
        out.append("class");
        if (definition.id() != null) {
            out.append(' ').append(definition.id().name());
        }
        if (definition.superClass() != null) {
            out.append(" extends ");
            expression(definition.superClass(), CALL);
        }
        out.append(' ');
        if (definition.body().isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{\n");
        depth++;
        for (ClassMember member : definition.body()) {
            indent();
            classMember(member);
            out.append('\n');
        }
        depth--;
        indent();
        out.append('}');
    }

    private void classMember(ClassMember member) {
        if (member instanceof MethodDefinition method) {
            if (method.isStatic()) {
                out.append("static ");
            }
            method(method.key(), method.computed(), method.value(), method.kind());
        } else if (member instanceof PropertyDefinition property) {
            if (property.isStatic()) {
                out.append("static ");
            }
            propertyKey(property.key(), property.computed());
            if (property.value() != null) {
                out.append(" = ");
                expression(property.value(), ASSIGNMENT);
            }
            out.append(';');
        } else if (member instanceof StaticBlock block) {
            out.append("static ");
            block(block.body());
        }
    }

    private void method(Expression key, boolean computed, Function value, MethodKind kind) {
        if (kind == MethodKind.GET) {
            out.append("get ");
        } else if (kind == MethodKind.SET) {
            out.append("set ");
        }
        if (value.async()) {
            out.append("async ");
        }
        if (value.generator()) {
            out.append('*');
        }
        propertyKey(key, computed);
        parameters(value.params());
        out.append(' ');
        block(value.body().body());
    }

    private void propertyKey(Expression key, boolean computed) {
        if (computed) {
            out.append('[');
            expression(key, ASSIGNMENT);
            out.append(']');
        } else if (key instanceof Identifier id) {
            out.append(id.name());
        } else {
            expression(key, PRIMARY);
        }
    }

    // ---------------------------------------------------------------- patterns

    private void pattern(Pattern pattern) {
        if (pattern instanceof Identifier id) {
            out.append(id.name());
        } else if (pattern instanceof MemberExpression member) {
            expression(member, CALL);
        } else if (pattern instanceof ObjectPattern object) {
            if (object.properties().isEmpty() && object.rest() == null) {
                out.append("{}");
                return;
            }
            out.append("{ ");
            boolean first = true;
            for (PatternProperty property : object.properties()) {
                if (!first) {
                    out.append(", ");
                }
                first = false;
                patternProperty(property);
            }
            if (object.rest() != null) {
                if (!first) {
                    out.append(", ");
                }
                pattern(object.rest());
            }
            out.append(" }");
        } else if (pattern instanceof ArrayPattern array) {
            out.append('[');
            List<Pattern> elements = array.elements();
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                if (elements.get(i) != null) {
                    pattern(elements.get(i));
                }
            }
            if (!elements.isEmpty() && elements.get(elements.size() - 1) == null) {
                out.append(',');
            }
            out.append(']');
        } else if (pattern instanceof AssignmentPattern assignment) {
            pattern(assignment.left());
            out.append(" = ");
            expression(assignment.right(), ASSIGNMENT);
        } else if (pattern instanceof RestElement rest) {
            out.append("...");
            pattern(rest.argument());
        }
    }

    private void patternProperty(PatternProperty property) {
        String keyName = property.computed() ? null : identifierKey(property.key());
        Pattern value = property.value();
        if (keyName != null && value instanceof Identifier id && id.name().equals(keyName)) {
            out.append(keyName);
            return;
        }
        if (keyName != null && value instanceof AssignmentPattern assignment
            && assignment.left() instanceof Identifier id && id.name().equals(keyName)) {
            pattern(assignment);
            return;
        }
        propertyKey(property.key(), property.computed());
        out.append(": ");
        pattern(value);
    }

    private static String identifierKey(Expression key) {
        return key instanceof Identifier id ? id.name() : null;
    }

    // ---------------------------------------------------------------- expressions

    private void expression(Expression expression, int minPrecedence) {
        boolean parens = precedence(expression) < minPrecedence;
        if (parens) {
            out.append('(');
        }
        printExpression(expression);
        if (parens) {
            out.append(')');
        }
    }

    private static int precedence(Expression expression) {
        if (expression instanceof SequenceExpression) {
            return SEQUENCE;
        }
        if (expression instanceof AssignmentExpression || expression instanceof ArrowFunctionExpression
            || expression instanceof YieldExpression || expression instanceof SpreadElement) {
            return ASSIGNMENT;
        }
        if (expression instanceof ConditionalExpression) {
            return CONDITIONAL;
        }
        if (expression instanceof BinaryExpression binary) {
            return BINARY_BASE + BINARY_PRECEDENCE.get(binary.operator());
        }
        if (expression instanceof UnaryExpression || expression instanceof AwaitExpression) {
            return UNARY;
        }
        if (expression instanceof UpdateExpression update) {
            return update.prefix() ? UNARY : POSTFIX;
        }
        if (expression instanceof CallExpression || expression instanceof MemberExpression
            || expression instanceof NewExpression || expression instanceof TaggedTemplateExpression
            || expression instanceof ImportExpression) {
            return CALL;
        }
        return PRIMARY;
    }

    private void printExpression(Expression expression) {
        if (expression instanceof Identifier e) {
            out.append(e.name());
        } else if (expression instanceof StringLiteral e) {
            string(e.value());
        } else if (expression instanceof NumberLiteral e) {
            out.append(e.raw());
        } else if (expression instanceof BooleanLiteral e) {
            out.append(e.value());
        } else if (expression instanceof NullLiteral) {
            out.append("null");
        } else if (expression instanceof RegExpLiteral e) {
            out.append('/').append(e.pattern()).append('/').append(e.flags());
        } else if (expression instanceof TemplateLiteral e) {
            template(e);
        } else if (expression instanceof TaggedTemplateExpression e) {
            expression(e.tag(), CALL);
            template(e.quasi());
        } else if (expression instanceof ThisExpression) {
            out.append("this");
        } else if (expression instanceof SuperExpression) {
            out.append("super");
        } else if (expression instanceof ArrayExpression e) {
            array(e);
        } else if (expression instanceof ObjectExpression e) {
            object(e);
        } else if (expression instanceof FunctionExpression e) {
            function(e.function());
        } else if (expression instanceof ArrowFunctionExpression e) {
            arrow(e);
        } else if (expression instanceof ClassExpression e) {
            classDef(e.definition());
        } else if (expression instanceof UnaryExpression e) {
            out.append(e.operator());
            boolean keyword = Character.isLetter(e.operator().charAt(0));
            int mark = out.length();
            if (keyword) {
                out.append(' ');
            }
            expression(e.argument(), UNARY);
            if (!keyword && out.length() > mark && (out.charAt(mark) == '+' || out.charAt(mark) == '-')) {
                out.insert(mark, ' ');
            }
        } else if (expression instanceof UpdateExpression e) {
            if (e.prefix()) {
                out.append(e.operator());
                expression(e.argument(), UNARY);
            } else {
                expression(e.argument(), POSTFIX);
                out.append(e.operator());
            }
        } else if (expression instanceof BinaryExpression e) {
            binary(e);
        } else if (expression instanceof AssignmentExpression e) {
            pattern(e.left());
            out.append(' ').append(e.operator()).append(' ');
            expression(e.right(), ASSIGNMENT);
        } else if (expression instanceof ConditionalExpression e) {
            expression(e.test(), CONDITIONAL + 1);
            out.append(" ? ");
            expression(e.consequent(), ASSIGNMENT);
            out.append(" : ");
            expression(e.alternate(), ASSIGNMENT);
        } else if (expression instanceof CallExpression e) {
            expression(e.callee(), CALL);
            if (e.optional()) {
                out.append("?.");
            }
            arguments(e.arguments());
        } else if (expression instanceof NewExpression e) {
            out.append("new ");
            boolean wrap = containsCall(e.callee());
            if (wrap) {
                out.append('(');
                printExpression(e.callee());
                out.append(')');
            } else {
                expression(e.callee(), CALL);
            }
            arguments(e.arguments());
        } else if (expression instanceof MemberExpression e) {
            member(e);
        } else if (expression instanceof SequenceExpression e) {
            for (int i = 0; i < e.expressions().size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                expression(e.expressions().get(i), ASSIGNMENT);
            }
        } else if (expression instanceof AwaitExpression e) {
            out.append("await ");
            expression(e.argument(), UNARY);
        } else if (expression instanceof YieldExpression e) {
            out.append(e.delegate() ? "yield*" : "yield");
            if (e.argument() != null) {
                out.append(' ');
                expression(e.argument(), ASSIGNMENT);
            }
        } else if (expression instanceof SpreadElement e) {
            out.append("...");
            expression(e.argument(), ASSIGNMENT);
        } else if (expression instanceof MetaProperty e) {
            out.append(e.meta()).append('.').append(e.property());
        } else if (expression instanceof ImportExpression e) {
            out.append("import(");
            expression(e.source(), ASSIGNMENT);
            out.append(')');
        } else {
            throw new IllegalArgumentException("Unsupported expression " + expression.getClass().getSimpleName());
        }
    }

    private void binary(BinaryExpression e) {
        int precedence = precedence(e);
        boolean rightAssociative = e.operator().equals("**");
        if (mixesNullish(e.operator(), e.left())) {
            out.append('(');
            printExpression(e.left());
            out.append(')');
        } else {
            expression(e.left(), rightAssociative ? precedence + 1 : precedence);
        }
        out.append(' ').append(e.operator()).append(' ');
        if (mixesNullish(e.operator(), e.right())) {
            out.append('(');
            printExpression(e.right());
            out.append(')');
        } else {
            expression(e.right(), rightAssociative ? precedence : precedence + 1);
        }
    }

    /** {@code ??} cannot be combined with {@code ||} or {@code &&} without parentheses. */
    private static boolean mixesNullish(String operator, Expression operand) {
        if (!(operand instanceof BinaryExpression inner)) {
            return false;
        }
        boolean outerNullish = operator.equals("??");
        boolean innerNullish = inner.operator().equals("??");
        boolean outerLogical = operator.equals("||") || operator.equals("&&");
        boolean innerLogical = inner.operator().equals("||") || inner.operator().equals("&&");
        return (outerNullish && innerLogical) || (outerLogical && innerNullish);
    }

    private void member(MemberExpression e) {
        if (e.object() instanceof NumberLiteral) {
            out.append('(');
            printExpression(e.object());
            out.append(')');
        } else {
            expression(e.object(), CALL);
        }
        if (e.computed()) {
            out.append(e.optional() ? "?.[" : "[");
            expression(e.property(), SEQUENCE);
            out.append(']');
        } else {
            out.append(e.optional() ? "?." : ".");
            out.append(((Identifier) e.property()).name());
        }
    }

    private static boolean containsCall(Expression callee) {
        Expression current = callee;
        while (true) {
            if (current instanceof CallExpression) {
                return true;
            }
            if (current instanceof MemberExpression member) {
                current = member.object();
            } else if (current instanceof TaggedTemplateExpression tagged) {
                current = tagged.tag();
            } else {
                return false;
            }
        }
    }

    private void arguments(List<Expression> arguments) {
        out.append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            expression(arguments.get(i), ASSIGNMENT);
        }
        out.append(')');
    }

    private void arrow(ArrowFunctionExpression e) {
        if (e.async()) {
            out.append("async ");
        }
        parameters(e.params());
        out.append(" => ");
        if (e.body() instanceof BlockStatement block) {
            block(block.body());
        } else {
            Expression body = (Expression) e.body();
            if (needsStatementParens(body)) {
                out.append('(');
                expression(body, ASSIGNMENT);
                out.append(')');
            } else {
                expression(body, ASSIGNMENT);
            }
        }
    }

    private void array(ArrayExpression e) {
        out.append('[');
        List<Expression> elements = e.elements();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            if (elements.get(i) != null) {
                expression(elements.get(i), ASSIGNMENT);
            }
        }
        if (!elements.isEmpty() && elements.get(elements.size() - 1) == null) {
            out.append(',');
        }
        out.append(']');
    }

    private void object(ObjectExpression e) {
        if (e.properties().isEmpty()) {
            out.append("{}");
            return;
        }
        boolean multiline = e.properties().stream().anyMatch(SourcePrinter::hasBody);
        if (!multiline) {
            out.append("{ ");
            for (int i = 0; i < e.properties().size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                objectMember(e.properties().get(i));
            }
            out.append(" }");
            return;
        }
        out.append("{\n");
        depth++;
        for (int i = 0; i < e.properties().size(); i++) {
            indent();
            objectMember(e.properties().get(i));
            if (i < e.properties().size() - 1) {
                out.append(',');
            }
            out.append('\n');
        }
        depth--;
        indent();
        out.append('}');
    }

    private static boolean hasBody(ObjectMember member) {
        if (member instanceof MethodProperty) {
            return true;
        }
        if (member instanceof Property property) {
            Expression value = property.value();
            return value instanceof FunctionExpression || value instanceof ArrowFunctionExpression
                || value instanceof ClassExpression || value instanceof ObjectExpression object
                && object.properties().stream().anyMatch(SourcePrinter::hasBody);
        }
        return false;
    }

    private void objectMember(ObjectMember member) {
        if (member instanceof Property property) {
            String keyName = property.computed() ? null : identifierKey(property.key());
            if (keyName != null && property.value() instanceof Identifier id && id.name().equals(keyName)) {
                out.append(keyName);
                return;
            }
            propertyKey(property.key(), property.computed());
            out.append(": ");
            expression(property.value(), ASSIGNMENT);
        } else if (member instanceof MethodProperty method) {
            method(method.key(), method.computed(), method.value(), method.kind());
        } else if (member instanceof SpreadElement spread) {
            out.append("...");
            expression(spread.argument(), ASSIGNMENT);
        }
    }

    private void template(TemplateLiteral e) {
        out.append('`');
        for (int i = 0; i < e.quasis().size(); i++) {
            out.append(e.quasis().get(i));
            if (i < e.expressions().size()) {
                out.append("${");
                expression(e.expressions().get(i), SEQUENCE);
                out.append('}');
            }
        }
        out.append('`');
    }

    /**
     * True when the expression, printed at the start of a statement or arrow body, would be read as a
     * block, declaration or pattern instead.
     */
    private static boolean needsStatementParens(Expression expression) {
        Expression leftmost = expression;
        while (true) {
            if (leftmost instanceof ObjectExpression || leftmost instanceof FunctionExpression
                || leftmost instanceof ClassExpression) {
                return true;
            }
            if (leftmost instanceof AssignmentExpression assignment) {
                if (assignment.left() instanceof ObjectPattern) {
                    return true;
                }
                if (!(assignment.left() instanceof MemberExpression member)) {
                    return false;
                }
                leftmost = member;
            } else if (leftmost instanceof BinaryExpression binary) {
                leftmost = binary.left();
            } else if (leftmost instanceof CallExpression call) {
                leftmost = call.callee();
            } else if (leftmost instanceof MemberExpression member) {
                leftmost = member.object();
            } else if (leftmost instanceof ConditionalExpression conditional) {
                leftmost = conditional.test();
            } else if (leftmost instanceof SequenceExpression sequence) {
                leftmost = sequence.expressions().get(0);
            } else if (leftmost instanceof UpdateExpression update && !update.prefix()) {
                leftmost = update.argument();
            } else if (leftmost instanceof TaggedTemplateExpression tagged) {
                leftmost = tagged.tag();
            } else {
                return false;
            }
        }
    }

    private void string(String value) {
        out.append(quote(value));
    }

    static String quote(String value) {
        var quoted = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\r' -> quoted.append("\\r");
                case '\t' -> quoted.append("\\t");
                case '\u2028' -> quoted.append("\\u2028");
                case '\u2029' -> quoted.append("\\u2029");
                default -> {
                    if (c < 0x20) {
                        quoted.append(String.format("\\x%02x", (int) c));
                    } else {
                        quoted.append(c);
                    }
                }
            }
        }
        return quoted.append('"').toString();
    }

    private static boolean isIdentifierName(String name) {
        if (name.isEmpty() || !Lexer.isIdentifierStart(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!Lexer.isIdentifierPart(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private void indent() {
        out.append(INDENT.repeat(depth));
    }
}
