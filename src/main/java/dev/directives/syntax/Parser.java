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
import dev.directives.ast.Nodes;
import dev.directives.ast.ObjectMember;
import dev.directives.ast.ObjectMember.MethodProperty;
import dev.directives.ast.ObjectMember.Property;
import dev.directives.ast.Pattern;
import dev.directives.ast.Pattern.*;
import dev.directives.ast.Program;
import dev.directives.ast.Span;
import dev.directives.ast.Statement;
import dev.directives.ast.Statement.*;
import dev.directives.syntax.Token.TemplateSubstitution;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive-descent parser producing the transformer's tree. Parenthesized expressions are not
 * kept as nodes; {@link SourcePrinter} re-derives parentheses from operator precedence.
 */
public class Parser {

    private static final Set<String> RESERVED = Set.of(
        "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete", "do", "else",
        "export", "extends", "false", "finally", "for", "function", "if", "import", "in", "instanceof", "new",
        "null", "return", "super", "switch", "this", "throw", "true", "try", "typeof", "var", "void", "while",
        "with"
    );

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
        Map.entry("??", 1), Map.entry("||", 2), Map.entry("&&", 3),
        Map.entry("|", 4), Map.entry("^", 5), Map.entry("&", 6),
        Map.entry("==", 7), Map.entry("!=", 7), Map.entry("===", 7), Map.entry("!==", 7),
        Map.entry("<", 8), Map.entry(">", 8), Map.entry("<=", 8), Map.entry(">=", 8),
        Map.entry("<<", 9), Map.entry(">>", 9), Map.entry(">>>", 9),
        Map.entry("+", 10), Map.entry("-", 10),
        Map.entry("*", 11), Map.entry("/", 11), Map.entry("%", 11),
        Map.entry("**", 12)
    );

    private static final int RELATIONAL = 8;

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
        "=", "+=", "-=", "*=", "/=", "%=", "**=", "<<=", ">>=", ">>>=", "&=", "|=", "^=", "&&=", "||=", "??="
    );

    private record PropertyKey(Expression key, boolean computed) {}

    private final String source;
    private final List<Token> tokens;
    private int current = 0;
    private boolean inAsync;
    private boolean inGenerator;
    private boolean allowIn = true;

    public Parser(String source) {
        this(source, new Lexer(source).tokenize());
    }

    Parser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    public static Program parse(String source) {
        return new Parser(source).parseProgram();
    }

    public Program parseProgram() {
        // top-level await is allowed in modules
        inAsync = true;
        var body = new ArrayList<Statement>();
        boolean module = false;
        while (!isAtEnd()) {
            Statement statement = parseStatementListItem();
            if (statement instanceof ImportDeclaration || statement instanceof ExportNamedDeclaration
                || statement instanceof ExportDefaultDeclaration || statement instanceof ExportAllDeclaration) {
                module = true;
            }
            body.add(statement);
        }
        return new Program(body, module ? Program.SourceType.MODULE : Program.SourceType.SCRIPT,
            new Span(0, source.length(), 1, 1));
    }

    // ---------------------------------------------------------------- statements

    private Statement parseStatementListItem() {
        Token t = peek();
        if (t.type() == TokenType.IDENTIFIER) {
            if (t.value().equals("import") && !peekAt(1).isPunctuator("(") && !peekAt(1).isPunctuator(".")) {
                return parseImport();
            }
            if (t.value().equals("export")) {
                return parseExport();
            }
            if (t.value().equals("function") || isAsyncFunction()) {
                return parseFunctionDeclaration(true);
            }
            if (t.value().equals("class")) {
                ClassDef definition = parseClass(true);
                return new ClassDeclaration(definition, spanFrom(t));
            }
            if (t.value().equals("var") || t.value().equals("const") || isLetDeclaration()) {
                VariableDeclaration declaration = parseVariableDeclaration();
                consumeSemicolon();
                return new VariableDeclaration(declaration.kind(), declaration.declarations(), spanFrom(t));
            }
        }
        return parseStatement();
    }

    private Statement parseStatement() {
        Token t = peek();
        if (t.isPunctuator("{")) {
            return parseBlock();
        }
        if (t.isPunctuator(";")) {
            advance();
            return new EmptyStatement(spanFrom(t));
        }
        if (t.type() == TokenType.IDENTIFIER) {
            switch (t.value()) {
                case "if":
                    return parseIf();
                case "for":
                    return parseFor();
                case "while":
                    return parseWhile();
                case "do":
                    return parseDoWhile();
                case "return":
                    return parseReturn();
                case "throw":
                    return parseThrow();
                case "try":
                    return parseTry();
                case "break":
                case "continue":
                    return parseJump();
                case "switch":
                    return parseSwitch();
                case "debugger":
                    advance();
                    consumeSemicolon();
                    return new DebuggerStatement(spanFrom(t));
                default:
                    if (!RESERVED.contains(t.value()) && peekAt(1).isPunctuator(":")) {
                        Identifier label = parseBindingIdentifier();
                        advance();
                        Statement body = check("function") ? parseFunctionDeclaration(true) : parseStatement();
                        return new LabeledStatement(label, body, spanFrom(t));
                    }
            }
        }
        Expression expression = parseExpression();
        consumeSemicolon();
        return new ExpressionStatement(expression, spanFrom(t));
    }

    private BlockStatement parseBlock() {
        Token start = expect("{");
        var body = new ArrayList<Statement>();
        while (!check("}")) {
            if (isAtEnd()) {
                throw error(peek(), "Expected '}'");
            }
            body.add(parseStatementListItem());
        }
        advance();
        return new BlockStatement(body, spanFrom(start));
    }

    private VariableDeclaration parseVariableDeclaration() {
        Token start = advance();
        VariableKind kind = VariableKind.valueOf(start.value().toUpperCase());
        var declarators = new ArrayList<VariableDeclarator>();
        do {
            Token declStart = peek();
            Pattern id = parseBindingTarget();
            Expression init = match("=") ? parseAssignment() : null;
            declarators.add(new VariableDeclarator(id, init, spanFrom(declStart)));
        } while (match(","));
        return new VariableDeclaration(kind, declarators, spanFrom(start));
    }

    private Statement parseIf() {
        Token start = advance();
        expect("(");
        Expression test = withIn(this::parseExpression);
        expect(")");
        Statement consequent = parseStatement();
        Statement alternate = match("else") ? parseStatement() : null;
        return new IfStatement(test, consequent, alternate, spanFrom(start));
    }

    private Statement parseFor() {
        Token start = advance();
        boolean isAwait = match("await");
        expect("(");
        Node init = null;
        if (!check(";")) {
            boolean savedIn = allowIn;
            allowIn = false;
            try {
                if (check("var") || check("const") || isLetDeclaration()) {
                    init = parseVariableDeclaration();
                } else {
                    init = parseExpression();
                }
            } finally {
                allowIn = savedIn;
            }
            if (check("of") || check("in")) {
                boolean of = advance().value().equals("of");
                Node left = init instanceof VariableDeclaration ? init : toPattern((Expression) init);
                Expression right = of ? withIn(this::parseAssignment) : withIn(this::parseExpression);
                expect(")");
                Statement body = parseStatement();
                return of
                    ? new ForOfStatement(left, right, body, isAwait, spanFrom(start))
                    : new ForInStatement(left, right, body, spanFrom(start));
            }
        }
        expect(";");
        Expression test = check(";") ? null : withIn(this::parseExpression);
        expect(";");
        Expression update = check(")") ? null : withIn(this::parseExpression);
        expect(")");
        Statement body = parseStatement();
        return new ForStatement(init, test, update, body, spanFrom(start));
    }

    private Statement parseWhile() {
        Token start = advance();
        expect("(");
        Expression test = withIn(this::parseExpression);
        expect(")");
        return new WhileStatement(test, parseStatement(), spanFrom(start));
    }

    private Statement parseDoWhile() {
        Token start = advance();
        Statement body = parseStatement();
        expect("while");
        expect("(");
        Expression test = withIn(this::parseExpression);
        expect(")");
        match(";");
        return new DoWhileStatement(body, test, spanFrom(start));
    }

    private Statement parseReturn() {
        Token start = advance();
        Expression argument = null;
        if (!check(";") && !check("}") && !isAtEnd() && !peek().newlineBefore()) {
            argument = parseExpression();
        }
        consumeSemicolon();
        return new ReturnStatement(argument, spanFrom(start));
    }

    private Statement parseThrow() {
        Token start = advance();
        if (peek().newlineBefore()) {
            throw error(peek(), "Illegal newline after throw");
        }
        Expression argument = parseExpression();
        consumeSemicolon();
        return new ThrowStatement(argument, spanFrom(start));
    }

    private Statement parseTry() {
        Token start = advance();
        BlockStatement block = parseBlock();
        CatchClause handler = null;
        BlockStatement finalizer = null;
        if (check("catch")) {
            Token catchStart = advance();
            Pattern param = null;
            if (match("(")) {
                param = parseBindingTarget();
                expect(")");
            }
            handler = new CatchClause(param, parseBlock(), spanFrom(catchStart));
        }
        if (match("finally")) {
            finalizer = parseBlock();
        }
        if (handler == null && finalizer == null) {
            throw error(peek(), "Missing catch or finally after try");
        }
        return new TryStatement(block, handler, finalizer, spanFrom(start));
    }

    private Statement parseJump() {
        Token start = advance();
        Identifier label = null;
        if (peek().type() == TokenType.IDENTIFIER && !peek().newlineBefore() && !RESERVED.contains(peek().value())) {
            label = parseBindingIdentifier();
        }
        consumeSemicolon();
        return start.value().equals("break")
            ? new BreakStatement(label, spanFrom(start))
            : new ContinueStatement(label, spanFrom(start));
    }

    private Statement parseSwitch() {
        Token start = advance();
        expect("(");
        Expression discriminant = withIn(this::parseExpression);
        expect(")");
        expect("{");
        var cases = new ArrayList<SwitchCase>();
        while (!match("}")) {
            Token caseStart = peek();
            Expression test = null;
            if (match("case")) {
                test = withIn(this::parseExpression);
            } else {
                expect("default");
            }
            expect(":");
            var consequent = new ArrayList<Statement>();
            while (!check("case") && !check("default") && !check("}")) {
                if (isAtEnd()) {
                    throw error(peek(), "Expected '}'");
                }
                consequent.add(parseStatementListItem());
            }
            cases.add(new SwitchCase(test, consequent, spanFrom(caseStart)));
        }
        return new SwitchStatement(discriminant, cases, spanFrom(start));
    }

    // ---------------------------------------------------------------- modules

    private Statement parseImport() {
        Token start = advance();
        if (peek().type() == TokenType.STRING) {
            StringLiteral from = parseStringLiteral();
            skipImportAttributes();
            consumeSemicolon();
            return new ImportDeclaration(List.of(), from, spanFrom(start));
        }
        var specifiers = new ArrayList<ImportSpecifier>();
        if (peek().type() == TokenType.IDENTIFIER) {
            Token specStart = peek();
            Identifier local = parseBindingIdentifier();
            specifiers.add(new ImportSpecifier(ImportKind.DEFAULT, null, local, spanFrom(specStart)));
            if (!match(",")) {
                return finishImport(start, specifiers);
            }
        }
        if (check("*")) {
            Token specStart = advance();
            expect("as");
            Identifier local = parseBindingIdentifier();
            specifiers.add(new ImportSpecifier(ImportKind.NAMESPACE, null, local, spanFrom(specStart)));
        } else {
            expect("{");
            while (!match("}")) {
                Token specStart = peek();
                String imported = parseModuleExportName();
                Identifier local = match("as")
                    ? parseBindingIdentifier()
                    : new Identifier(imported, spanFrom(specStart));
                specifiers.add(new ImportSpecifier(ImportKind.NAMED, imported, local, spanFrom(specStart)));
                if (!check("}")) {
                    expect(",");
                }
            }
        }
        return finishImport(start, specifiers);
    }

    private Statement finishImport(Token start, List<ImportSpecifier> specifiers) {
        expect("from");
        StringLiteral from = parseStringLiteral();
        skipImportAttributes();
        consumeSemicolon();
        return new ImportDeclaration(specifiers, from, spanFrom(start));
    }

    private void skipImportAttributes() {
        if ((check("with") || check("assert")) && peekAt(1).isPunctuator("{") && !peek().newlineBefore()) {
            advance();
            advance();
            while (!match("}")) {
                if (isAtEnd()) {
                    throw error(peek(), "Expected '}'");
                }
                advance();
            }
        }
    }

    private Statement parseExport() {
        Token start = advance();
        if (match("default")) {
            Token declStart = peek();
            Node declaration;
            if (check("function") || isAsyncFunction()) {
                declaration = parseFunctionDeclaration(false);
            } else if (check("class")) {
                ClassDef definition = parseClass(false);
                declaration = new ClassDeclaration(definition, spanFrom(declStart));
            } else {
                declaration = withIn(this::parseAssignment);
                consumeSemicolon();
            }
            return new ExportDefaultDeclaration(declaration, spanFrom(start));
        }
        if (match("*")) {
            String exported = match("as") ? parseModuleExportName() : null;
            expect("from");
            StringLiteral from = parseStringLiteral();
            skipImportAttributes();
            consumeSemicolon();
            return new ExportAllDeclaration(exported, from, spanFrom(start));
        }
        if (match("{")) {
            var specifiers = new ArrayList<ExportSpecifier>();
            while (!match("}")) {
                Token specStart = peek();
                String local = parseModuleExportName();
                String exported = match("as") ? parseModuleExportName() : local;
                specifiers.add(new ExportSpecifier(local, exported, spanFrom(specStart)));
                if (!check("}")) {
                    expect(",");
                }
            }
            StringLiteral from = null;
            if (match("from")) {
                from = parseStringLiteral();
                skipImportAttributes();
            }
            consumeSemicolon();
            return new ExportNamedDeclaration(null, specifiers, from, spanFrom(start));
        }
        Token declStart = peek();
        Statement declaration;
        if (check("var") || check("const") || check("let")) {
            VariableDeclaration variables = parseVariableDeclaration();
            consumeSemicolon();
            declaration = new VariableDeclaration(variables.kind(), variables.declarations(), spanFrom(declStart));
        } else if (check("function") || isAsyncFunction()) {
            declaration = parseFunctionDeclaration(true);
        } else if (check("class")) {
            declaration = new ClassDeclaration(parseClass(true), spanFrom(declStart));
        } else {
            throw error(peek(), "Unexpected token after export");
        }
        return new ExportNamedDeclaration(declaration, List.of(), null, spanFrom(start));
    }

    private String parseModuleExportName() {
        Token t = advance();
        if (t.type() == TokenType.STRING || t.type() == TokenType.IDENTIFIER) {
            return t.value();
        }
        throw error(t, "Expected export name");
    }

    // ---------------------------------------------------------------- functions and classes

    private FunctionDeclaration parseFunctionDeclaration(boolean requireId) {
        Token start = peek();
        Function function = parseFunction(requireId);
        return new FunctionDeclaration(function, spanFrom(start));
    }

    private Function parseFunction(boolean requireId) {
        Token start = peek();
        boolean async = match("async");
        expect("function");
        boolean generator = match("*");
        Identifier id = null;
        if (peek().type() == TokenType.IDENTIFIER) {
            id = parseBindingIdentifier();
        } else if (requireId) {
            throw error(peek(), "Expected function name");
        }
        return parseFunctionRest(start, id, async, generator);
    }

    private Function parseFunctionRest(Token start, Identifier id, boolean async, boolean generator) {
        boolean savedAsync = inAsync;
        boolean savedGenerator = inGenerator;
        inAsync = async;
        inGenerator = generator;
        try {
            List<Pattern> params = parseParams();
            BlockStatement body = withIn(this::parseBlock);
            return new Function(id, params, body, async, generator, spanFrom(start));
        } finally {
            inAsync = savedAsync;
            inGenerator = savedGenerator;
        }
    }

    private List<Pattern> parseParams() {
        expect("(");
        var params = new ArrayList<Pattern>();
        while (!match(")")) {
            Token start = peek();
            if (match("...")) {
                params.add(new RestElement(parseBindingTarget(), spanFrom(start)));
            } else {
                params.add(parseBindingElement());
            }
            if (!check(")")) {
                expect(",");
            }
        }
        return params;
    }

    private ClassDef parseClass(boolean requireId) {
        Token start = expect("class");
        Identifier id = null;
        if (peek().type() == TokenType.IDENTIFIER && !check("extends")) {
            id = parseBindingIdentifier();
        } else if (requireId) {
            throw error(peek(), "Expected class name");
        }
        Expression superClass = null;
        if (match("extends")) {
            Token superStart = peek();
            superClass = parseCallTail(superStart, parsePrimary(), true);
        }
        expect("{");
        var members = new ArrayList<ClassMember>();
        while (!match("}")) {
            if (isAtEnd()) {
                throw error(peek(), "Expected '}'");
            }
            if (match(";")) {
                continue;
            }
            members.add(parseClassMember());
        }
        return new ClassDef(id, superClass, members, spanFrom(start));
    }

    private ClassMember parseClassMember() {
        Token start = peek();
        boolean isStatic = false;
        if (check("static") && !isMemberKeyTerminator(peekAt(1))) {
            advance();
            isStatic = true;
            if (check("{")) {
                boolean savedAsync = inAsync;
                inAsync = false;
                try {
                    BlockStatement block = parseBlock();
                    return new StaticBlock(block.body(), spanFrom(start));
                } finally {
                    inAsync = savedAsync;
                }
            }
        }
        boolean async = false;
        if (check("async") && !isMemberKeyTerminator(peekAt(1)) && !peekAt(1).newlineBefore()) {
            advance();
            async = true;
        }
        boolean generator = match("*");
        MethodKind kind = MethodKind.METHOD;
        if ((check("get") || check("set")) && !async && !generator && !isMemberKeyTerminator(peekAt(1))) {
            kind = advance().value().equals("get") ? MethodKind.GET : MethodKind.SET;
        }
        PropertyKey key = parsePropertyKey();
        if (check("(")) {
            if (!isStatic && kind == MethodKind.METHOD && !key.computed()
                && "constructor".equals(Nodes.propertyName(key.key(), false))) {
                kind = MethodKind.CONSTRUCTOR;
            }
            Function value = parseFunctionRest(peek(), null, async, generator);
            return new MethodDefinition(key.key(), key.computed(), value, kind, isStatic, spanFrom(start));
        }
        if (async || generator || kind != MethodKind.METHOD) {
            throw error(peek(), "Expected '('");
        }
        Expression value = null;
        if (match("=")) {
            boolean savedAsync = inAsync;
            inAsync = false;
            try {
                value = withIn(this::parseAssignment);
            } finally {
                inAsync = savedAsync;
            }
        }
        consumeSemicolon();
        return new PropertyDefinition(key.key(), key.computed(), value, isStatic, spanFrom(start));
    }

    private static boolean isMemberKeyTerminator(Token token) {
        return token.isPunctuator("(") || token.isPunctuator("=") || token.isPunctuator(";")
            || token.isPunctuator("}") || token.isPunctuator(":") || token.isPunctuator(",")
            || token.type() == TokenType.EOF;
    }

    private PropertyKey parsePropertyKey() {
        Token t = peek();
        if (match("[")) {
            Expression key = withIn(this::parseAssignment);
            expect("]");
            return new PropertyKey(key, true);
        }
        advance();
        return switch (t.type()) {
            case STRING -> new PropertyKey(new StringLiteral(t.value(), spanFrom(t)), false);
            case NUMBER -> new PropertyKey(new NumberLiteral(t.value(), spanFrom(t)), false);
            case IDENTIFIER, PRIVATE_NAME -> new PropertyKey(new Identifier(t.value(), spanFrom(t)), false);
            default -> throw error(t, "Expected property name");
        };
    }

    // ---------------------------------------------------------------- patterns

    private Pattern parseBindingElement() {
        Token start = peek();
        Pattern target = parseBindingTarget();
        if (match("=")) {
            return new AssignmentPattern(target, withIn(this::parseAssignment), spanFrom(start));
        }
        return target;
    }

    private Pattern parseBindingTarget() {
        Token start = peek();
        if (match("[")) {
            var elements = new ArrayList<Pattern>();
            while (!match("]")) {
                if (match(",")) {
                    elements.add(null);
                    continue;
                }
                Token elementStart = peek();
                if (match("...")) {
                    elements.add(new RestElement(parseBindingTarget(), spanFrom(elementStart)));
                } else {
                    elements.add(parseBindingElement());
                }
                if (!check("]")) {
                    expect(",");
                }
            }
            return new ArrayPattern(elements, spanFrom(start));
        }
        if (match("{")) {
            var properties = new ArrayList<PatternProperty>();
            RestElement rest = null;
            while (!match("}")) {
                Token propertyStart = peek();
                if (match("...")) {
                    rest = new RestElement(parseBindingIdentifier(), spanFrom(propertyStart));
                } else {
                    PropertyKey key = parsePropertyKey();
                    if (match(":")) {
                        properties.add(new PatternProperty(key.key(), key.computed(), parseBindingElement(), false,
                            spanFrom(propertyStart)));
                    } else {
                        if (key.computed() || !(key.key() instanceof Identifier name)) {
                            throw error(peek(), "Expected ':'");
                        }
                        Pattern value = new Identifier(name.name(), name.span());
                        if (match("=")) {
                            value = new AssignmentPattern(value, withIn(this::parseAssignment), spanFrom(propertyStart));
                        }
                        properties.add(new PatternProperty(key.key(), false, value, true, spanFrom(propertyStart)));
                    }
                }
                if (!check("}")) {
                    expect(",");
                }
            }
            return new ObjectPattern(properties, rest, spanFrom(start));
        }
        return parseBindingIdentifier();
    }

    private Pattern toPattern(Expression expression) {
        if (expression instanceof Identifier id) {
            return id;
        }
        if (expression instanceof MemberExpression member) {
            return member;
        }
        if (expression instanceof ArrayExpression array) {
            var elements = new ArrayList<Pattern>();
            for (Expression element : array.elements()) {
                if (element == null) {
                    elements.add(null);
                } else if (element instanceof SpreadElement spread) {
                    elements.add(new RestElement(toPattern(spread.argument()), spread.span()));
                } else {
                    elements.add(toPattern(element));
                }
            }
            return new ArrayPattern(elements, array.span());
        }
        if (expression instanceof ObjectExpression object) {
            var properties = new ArrayList<PatternProperty>();
            RestElement rest = null;
            for (ObjectMember member : object.properties()) {
                if (member instanceof SpreadElement spread) {
                    rest = new RestElement(toPattern(spread.argument()), spread.span());
                } else if (member instanceof Property property) {
                    properties.add(new PatternProperty(property.key(), property.computed(), toPattern(property.value()),
                        property.shorthand(), property.span()));
                } else {
                    throw new ParseException("Invalid destructuring target", member.span().line(),
                        member.span().column());
                }
            }
            return new ObjectPattern(properties, rest, object.span());
        }
        if (expression instanceof AssignmentExpression assignment && assignment.operator().equals("=")) {
            return new AssignmentPattern(assignment.left(), assignment.right(), assignment.span());
        }
        throw new ParseException("Invalid assignment target", expression.span().line(), expression.span().column());
    }

    // ---------------------------------------------------------------- expressions

    private Expression parseExpression() {
        Token start = peek();
        Expression first = parseAssignment();
        if (!check(",")) {
            return first;
        }
        var expressions = new ArrayList<Expression>();
        expressions.add(first);
        while (match(",")) {
            expressions.add(parseAssignment());
        }
        return new SequenceExpression(expressions, spanFrom(start));
    }

    private Expression parseAssignment() {
        Token start = peek();
        if (isArrowAhead()) {
            return parseArrow();
        }
        if (inGenerator && check("yield")) {
            return parseYield();
        }
        Expression left = parseConditional();
        Token op = peek();
        if (op.type() == TokenType.PUNCTUATOR && ASSIGNMENT_OPERATORS.contains(op.value())) {
            advance();
            Pattern target;
            if (op.value().equals("=")) {
                target = toPattern(left);
            } else if (left instanceof Identifier || left instanceof MemberExpression) {
                target = (Pattern) left;
            } else {
                throw error(op, "Invalid assignment target");
            }
            Expression right = parseAssignment();
            return new AssignmentExpression(op.value(), target, right, spanFrom(start));
        }
        return left;
    }

    private boolean isArrowAhead() {
        Token first = peek();
        if (first.is("async") && first.type() == TokenType.IDENTIFIER && !peekAt(1).newlineBefore()) {
            Token next = peekAt(1);
            if (next.type() == TokenType.IDENTIFIER && !next.value().equals("function")
                && peekAt(2).isPunctuator("=>")) {
                return true;
            }
            if (next.isPunctuator("(")) {
                int close = matchingParen(current + 1);
                return close > 0 && tokenAt(close + 1).isPunctuator("=>");
            }
        }
        if (first.type() == TokenType.IDENTIFIER && !RESERVED.contains(first.value())
            && peekAt(1).isPunctuator("=>")) {
            return true;
        }
        if (first.isPunctuator("(")) {
            int close = matchingParen(current);
            return close > 0 && tokenAt(close + 1).isPunctuator("=>") && !tokenAt(close + 1).newlineBefore();
        }
        return false;
    }

    private int matchingParen(int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isPunctuator("(")) {
                depth++;
            } else if (t.isPunctuator(")")) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private Expression parseArrow() {
        Token start = peek();
        boolean async = false;
        if (check("async") && !peekAt(1).isPunctuator("=>")) {
            advance();
            async = true;
        }
        boolean savedAsync = inAsync;
        boolean savedGenerator = inGenerator;
        inAsync = async;
        inGenerator = false;
        try {
            List<Pattern> params = check("(") ? parseParams() : List.of(parseBindingIdentifier());
            expect("=>");
            Node body = check("{") ? withIn(this::parseBlock) : parseAssignment();
            return new ArrowFunctionExpression(params, body, async, spanFrom(start));
        } finally {
            inAsync = savedAsync;
            inGenerator = savedGenerator;
        }
    }

    private Expression parseYield() {
        Token start = advance();
        boolean delegate = match("*");
        Expression argument = null;
        Token next = peek();
        boolean ends = next.isPunctuator(")") || next.isPunctuator("]") || next.isPunctuator("}")
            || next.isPunctuator(",") || next.isPunctuator(";") || next.isPunctuator(":")
            || next.type() == TokenType.EOF || next.newlineBefore();
        if (delegate || !ends) {
            argument = parseAssignment();
        }
        return new YieldExpression(argument, delegate, spanFrom(start));
    }

    private Expression parseConditional() {
        Token start = peek();
        Expression test = parseBinary(1);
        if (!match("?")) {
            return test;
        }
        Expression consequent = withIn(this::parseAssignment);
        expect(":");
        Expression alternate = parseAssignment();
        return new ConditionalExpression(test, consequent, alternate, spanFrom(start));
    }

    private Expression parseBinary(int minPrecedence) {
        Token start = peek();
        Expression left = parseUnary();
        while (true) {
            Token op = peek();
            Integer precedence = binaryPrecedence(op);
            if (precedence == null || precedence < minPrecedence) {
                return left;
            }
            advance();
            // exponentiation is right-associative
            Expression right = parseBinary(op.value().equals("**") ? precedence : precedence + 1);
            left = new BinaryExpression(op.value(), left, right, spanFrom(start));
        }
    }

    private Integer binaryPrecedence(Token op) {
        if (op.type() == TokenType.PUNCTUATOR) {
            return BINARY_PRECEDENCE.get(op.value());
        }
        if (op.type() == TokenType.IDENTIFIER) {
            if (op.value().equals("instanceof") || (op.value().equals("in") && allowIn)) {
                return RELATIONAL;
            }
        }
        return null;
    }

    private Expression parseUnary() {
        Token start = peek();
        boolean unaryPunctuator = start.type() == TokenType.PUNCTUATOR
            && Set.of("!", "~", "+", "-").contains(start.value());
        boolean unaryKeyword = start.type() == TokenType.IDENTIFIER
            && Set.of("typeof", "void", "delete").contains(start.value());
        if (unaryPunctuator || unaryKeyword) {
            advance();
            return new UnaryExpression(start.value(), parseUnary(), spanFrom(start));
        }
        if (start.isPunctuator("++") || start.isPunctuator("--")) {
            advance();
            return new UpdateExpression(start.value(), true, parseUnary(), spanFrom(start));
        }
        if (inAsync && start.is("await") && start.type() == TokenType.IDENTIFIER) {
            advance();
            return new AwaitExpression(parseUnary(), spanFrom(start));
        }
        Expression expression = parseLeftHandSide();
        Token next = peek();
        if ((next.isPunctuator("++") || next.isPunctuator("--")) && !next.newlineBefore()) {
            advance();
            return new UpdateExpression(next.value(), false, expression, spanFrom(start));
        }
        return expression;
    }

    private Expression parseLeftHandSide() {
        Token start = peek();
        Expression expression;
        if (check("new")) {
            expression = parseNew();
        } else if (check("super")) {
            advance();
            expression = new SuperExpression(spanFrom(start));
        } else if (check("import") && peekAt(1).isPunctuator("(")) {
            advance();
            advance();
            Expression from = withIn(this::parseAssignment);
            if (match(",") && !check(")")) {
                withIn(this::parseAssignment);
                match(",");
            }
            expect(")");
            expression = new ImportExpression(from, spanFrom(start));
        } else if (check("import") && peekAt(1).isPunctuator(".")) {
            advance();
            advance();
            Token property = advance();
            expression = new MetaProperty("import", property.value(), spanFrom(start));
        } else {
            expression = parsePrimary();
        }
        return parseCallTail(start, expression, true);
    }

    private Expression parseNew() {
        Token start = advance();
        if (match(".")) {
            Token property = advance();
            return new MetaProperty("new", property.value(), spanFrom(start));
        }
        Expression callee;
        if (check("new")) {
            callee = parseNew();
        } else {
            Token calleeStart = peek();
            callee = parseCallTail(calleeStart, parsePrimary(), false);
        }
        List<Expression> arguments = check("(") ? parseArguments() : List.of();
        return new NewExpression(callee, arguments, spanFrom(start));
    }

    private Expression parseCallTail(Token start, Expression expression, boolean allowCalls) {
        while (true) {
            if (match(".")) {
                expression = new MemberExpression(expression, parseMemberName(), false, false, spanFrom(start));
            } else if (check("?.")) {
                if (!allowCalls) {
                    return expression;
                }
                advance();
                if (check("(")) {
                    expression = new CallExpression(expression, parseArguments(), true, spanFrom(start));
                } else if (match("[")) {
                    Expression property = withIn(this::parseExpression);
                    expect("]");
                    expression = new MemberExpression(expression, property, true, true, spanFrom(start));
                } else {
                    expression = new MemberExpression(expression, parseMemberName(), false, true, spanFrom(start));
                }
            } else if (match("[")) {
                Expression property = withIn(this::parseExpression);
                expect("]");
                expression = new MemberExpression(expression, property, true, false, spanFrom(start));
            } else if (allowCalls && check("(")) {
                expression = new CallExpression(expression, parseArguments(), false, spanFrom(start));
            } else if (peek().type() == TokenType.TEMPLATE) {
                TemplateLiteral quasi = parseTemplate();
                expression = new TaggedTemplateExpression(expression, quasi, spanFrom(start));
            } else {
                return expression;
            }
        }
    }

    private List<Expression> parseArguments() {
        expect("(");
        var arguments = new ArrayList<Expression>();
        while (!match(")")) {
            Token start = peek();
            if (match("...")) {
                arguments.add(new SpreadElement(withIn(this::parseAssignment), spanFrom(start)));
            } else {
                arguments.add(withIn(this::parseAssignment));
            }
            if (!check(")")) {
                expect(",");
            }
        }
        return arguments;
    }

    private Identifier parseMemberName() {
        Token t = advance();
        if (t.type() == TokenType.IDENTIFIER || t.type() == TokenType.PRIVATE_NAME) {
            return new Identifier(t.value(), spanFrom(t));
        }
        throw error(t, "Expected property name");
    }

    private Expression parsePrimary() {
        Token t = peek();
        switch (t.type()) {
            case NUMBER:
                advance();
                return new NumberLiteral(t.value(), spanFrom(t));
            case STRING:
                return parseStringLiteral();
            case TEMPLATE:
                return parseTemplate();
            case REGEX:
                advance();
                return new RegExpLiteral(t.value(), t.flags(), spanFrom(t));
            case PRIVATE_NAME:
                advance();
                return new Identifier(t.value(), spanFrom(t));
            case PUNCTUATOR:
                if (t.value().equals("(")) {
                    advance();
                    Expression inner = withIn(this::parseExpression);
                    expect(")");
                    return inner;
                }
                if (t.value().equals("[")) {
                    return withIn(this::parseArrayLiteral);
                }
                if (t.value().equals("{")) {
                    return withIn(this::parseObjectLiteral);
                }
                throw error(t, "Unexpected token");
            case IDENTIFIER:
                return parseIdentifierLike(t);
            default:
                throw error(t, "Unexpected token");
        }
    }

    private Expression parseIdentifierLike(Token t) {
        switch (t.value()) {
            case "this":
                advance();
                return new ThisExpression(spanFrom(t));
            case "null":
                advance();
                return new NullLiteral(spanFrom(t));
            case "true":
            case "false":
                advance();
                return new BooleanLiteral(t.value().equals("true"), spanFrom(t));
            case "function":
                return new FunctionExpression(parseFunction(false), spanFrom(t));
            case "class":
                return new ClassExpression(parseClass(false), spanFrom(t));
            default:
                if (isAsyncFunction()) {
                    return new FunctionExpression(parseFunction(false), spanFrom(t));
                }
                if (RESERVED.contains(t.value())) {
                    throw error(t, "Unexpected token");
                }
                advance();
                return new Identifier(t.value(), spanFrom(t));
        }
    }

    private Expression parseArrayLiteral() {
        Token start = expect("[");
        var elements = new ArrayList<Expression>();
        while (!match("]")) {
            if (match(",")) {
                elements.add(null);
                continue;
            }
            Token elementStart = peek();
            if (match("...")) {
                elements.add(new SpreadElement(parseAssignment(), spanFrom(elementStart)));
            } else {
                elements.add(parseAssignment());
            }
            if (!check("]")) {
                expect(",");
            }
        }
        return new ArrayExpression(elements, spanFrom(start));
    }

    private Expression parseObjectLiteral() {
        Token start = expect("{");
        var properties = new ArrayList<ObjectMember>();
        while (!match("}")) {
            properties.add(parseObjectMember());
            if (!check("}")) {
                expect(",");
            }
        }
        return new ObjectExpression(properties, spanFrom(start));
    }

    private ObjectMember parseObjectMember() {
        Token start = peek();
        if (match("...")) {
            return new SpreadElement(parseAssignment(), spanFrom(start));
        }
        boolean async = false;
        if (check("async") && !isMemberKeyTerminator(peekAt(1)) && !peekAt(1).newlineBefore()) {
            advance();
            async = true;
        }
        boolean generator = match("*");
        MethodKind kind = MethodKind.METHOD;
        if ((check("get") || check("set")) && !async && !generator && !isMemberKeyTerminator(peekAt(1))) {
            kind = advance().value().equals("get") ? MethodKind.GET : MethodKind.SET;
        }
        PropertyKey key = parsePropertyKey();
        if (check("(")) {
            Function value = parseFunctionRest(peek(), null, async, generator);
            return new MethodProperty(key.key(), key.computed(), value, kind, spanFrom(start));
        }
        if (async || generator || kind != MethodKind.METHOD) {
            throw error(peek(), "Expected '('");
        }
        if (match(":")) {
            return new Property(key.key(), key.computed(), parseAssignment(), false, spanFrom(start));
        }
        if (key.computed() || !(key.key() instanceof Identifier name)) {
            throw error(peek(), "Expected ':'");
        }
        Expression value = new Identifier(name.name(), name.span());
        if (match("=")) {
            // only valid once the literal is reinterpreted as a destructuring pattern
            value = new AssignmentExpression("=", (Identifier) value, parseAssignment(), spanFrom(start));
        }
        return new Property(key.key(), false, value, true, spanFrom(start));
    }

    private TemplateLiteral parseTemplate() {
        Token t = advance();
        var expressions = new ArrayList<Expression>();
        for (TemplateSubstitution substitution : t.substitutions()) {
            var lexer = new Lexer(source, substitution.offset(), substitution.line(), substitution.column());
            var nested = new Parser(source, lexer.tokenize(substitution.offset() + substitution.source().length()));
            nested.inAsync = inAsync;
            nested.inGenerator = inGenerator;
            expressions.add(nested.parseExpression());
            if (!nested.isAtEnd()) {
                throw nested.error(nested.peek(), "Unexpected token in template substitution");
            }
        }
        return new TemplateLiteral(t.quasis(), expressions, spanFrom(t));
    }

    private StringLiteral parseStringLiteral() {
        Token t = advance();
        if (t.type() != TokenType.STRING) {
            throw error(t, "Expected string literal");
        }
        return new StringLiteral(t.value(), spanFrom(t));
    }

    private Identifier parseBindingIdentifier() {
        Token t = peek();
        if (t.type() != TokenType.IDENTIFIER || RESERVED.contains(t.value())) {
            throw error(t, "Expected identifier");
        }
        advance();
        return new Identifier(t.value(), spanFrom(t));
    }

    // ---------------------------------------------------------------- helpers

    private boolean isAsyncFunction() {
        return peek().type() == TokenType.IDENTIFIER && peek().value().equals("async")
            && peekAt(1).is("function") && !peekAt(1).newlineBefore();
    }

    private boolean isLetDeclaration() {
        Token next = peekAt(1);
        return peek().type() == TokenType.IDENTIFIER && peek().value().equals("let")
            && ((next.type() == TokenType.IDENTIFIER && !next.value().equals("in") && !next.value().equals("of"))
                || next.isPunctuator("[") || next.isPunctuator("{"));
    }

    private <T> T withIn(Supplier<T> parse) {
        boolean saved = allowIn;
        allowIn = true;
        try {
            return parse.get();
        } finally {
            allowIn = saved;
        }
    }

    private void consumeSemicolon() {
        if (match(";")) {
            return;
        }
        if (check("}") || isAtEnd() || peek().newlineBefore()) {
            return;
        }
        throw error(peek(), "Expected ';'");
    }

    private Span spanFrom(Token start) {
        Token last = current > 0 ? tokens.get(current - 1) : start;
        return new Span(start.start(), Math.max(start.end(), last.end()), start.line(), start.column());
    }

    private boolean check(String value) {
        Token t = peek();
        return t.type() != TokenType.EOF && t.is(value);
    }

    private boolean match(String value) {
        if (check(value)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(String value) {
        if (check(value)) {
            return advance();
        }
        throw error(peek(), "Expected '" + value + "'");
    }

    private Token advance() {
        Token t = peek();
        if (!isAtEnd()) {
            current++;
        }
        return t;
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int offset) {
        return tokenAt(current + offset);
    }

    private Token tokenAt(int index) {
        return tokens.get(Math.min(index, tokens.size() - 1));
    }

    private ParseException error(Token token, String message) {
        return new ParseException(message + " but found " + token, token.line(), token.column());
    }
}
