package io.templatexform.core.parse;

import io.templatexform.core.error.SourceParseException;
import io.templatexform.core.parse.ast.Expression;
import io.templatexform.core.parse.ast.JsxAttributeItem;
import io.templatexform.core.parse.ast.JsxChild;
import io.templatexform.core.parse.ast.Parameter;
import io.templatexform.core.parse.ast.Pattern;
import io.templatexform.core.parse.ast.Program;
import io.templatexform.core.parse.ast.Statement;
import io.templatexform.core.parse.ast.SyntaxNode;
import io.templatexform.core.parse.ast.TypeAnnotation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the TypeScript/JSX subset used by UI components.
 *
 * <p>Statements and expressions are parsed from tokens; JSX children and attribute strings are
 * scanned at character level, switching back to tokens for every {@code {...}} container. Type
 * annotations are not modelled: they are skipped as balanced token runs and kept as text, except
 * for object type literals whose members are needed to resolve prop types.
 *
 * <p>Arrow functions and call type arguments are recognized by speculative parsing: the parser
 * marks its position, tries the arrow form, and rewinds if that fails.
 *
 * <p>Not thread-safe; one instance parses one source range.
 */
final class SyntaxParser {

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "**=", "<<=", ">>=", ">>>=", "&=", "|=", "^=", "&&=", "||=", "??=");

    private static final Set<String> PREFIX_OPERATORS = Set.of("!", "~", "+", "-", "++", "--");

    private static final Set<String> PREFIX_KEYWORDS = Set.of("typeof", "void", "delete", "await");

    private static final Set<String> CLASS_MODIFIERS = Set.of(
            "static", "public", "private", "protected", "readonly", "abstract", "declare", "override", "async");

    /** Where a type annotation appears; decides which tokens end it. */
    private enum TypeContext {
        PARAMETER,
        DECLARATOR,
        ARROW_RETURN,
        FUNCTION_RETURN,
        ALIAS,
        MEMBER,
        ASSERTION
    }

    /** Parser position, for backtracking. */
    private record State(Token current, Token previous) {}

    private final String source;
    private final String sourceFile;
    private final LineMap lineMap;
    private final Lexer lexer;
    private Token current;
    private Token previous;

    SyntaxParser(String source, String sourceFile, LineMap lineMap, int start, int end) {
        this.source = source;
        this.sourceFile = sourceFile;
        this.lineMap = lineMap;
        this.lexer = new Lexer(source, sourceFile, lineMap, start, end);
    }

    // ── Entry points ──

    Program parseProgram() {
        advance();
        List<Statement> body = new ArrayList<>();
        while (!current.isEof()) {
            body.add(parseStatement());
        }
        return new Program(body, source, sourceFile);
    }

    Expression parseStandaloneExpression() {
        advance();
        Expression expression = parseExpression();
        if (!current.isEof()) {
            throw unexpected();
        }
        return expression;
    }

    TypeAnnotation parseStandaloneType() {
        advance();
        TypeAnnotation type = parseType(TypeContext.ALIAS);
        if (!current.isEof()) {
            throw unexpected();
        }
        return type;
    }

    // ── Token helpers ──

    private void advance() {
        previous = current;
        current = lexer.next();
    }

    private boolean check(String text) {
        return current.is(text);
    }

    private boolean eat(String text) {
        if (current.is(text)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(String text) {
        if (!current.is(text)) {
            throw error("Expected '" + text + "' but found " + current, current.start());
        }
        Token token = current;
        advance();
        return token;
    }

    private String expectIdentifier() {
        if (!current.isIdentifier()) {
            throw error("Expected identifier but found " + current, current.start());
        }
        String name = current.text();
        advance();
        return name;
    }

    private State mark() {
        return new State(current, previous);
    }

    private void restore(State state) {
        current = state.current();
        previous = state.previous();
        lexer.reset(current.end());
    }

    private Token peek() {
        State state = mark();
        advance();
        Token next = current;
        restore(state);
        return next;
    }

    private void consumeSemicolon() {
        if (eat(";")) {
            return;
        }
        if (check("}") || current.isEof() || current.newlineBefore()) {
            return;
        }
        throw error("Expected ';' but found " + current, current.start());
    }

    private int lastEnd() {
        return previous != null ? previous.end() : current.start();
    }

    private SourceParseException error(String message, int offset) {
        return lexer.error(message, offset);
    }

    private SourceParseException unexpected() {
        return error("Unexpected token " + current, current.start());
    }

    // ── Statements ──

    private Statement parseStatement() {
        Token token = current;
        int start = token.start();
        if (token.is("{")) {
            return parseBlock();
        }
        if (token.is(";")) {
            advance();
            return new Statement.Empty(start, token.end());
        }
        if (token.is("@")) {
            skipDecorator();
            return parseStatement();
        }
        if (token.isIdentifier()) {
            switch (token.text()) {
                case "import":
                    Token afterImport = peek();
                    if (!afterImport.is("(") && !afterImport.is(".")) {
                        return parseImport();
                    }
                    break;
                case "export":
                    return parseExport();
                case "function":
                    return parseFunctionDeclaration(start, false, false);
                case "async":
                    Token afterAsync = peek();
                    if (afterAsync.is("function") && !afterAsync.newlineBefore()) {
                        advance();
                        return parseFunctionDeclaration(start, true, false);
                    }
                    break;
                case "const":
                    if (peek().is("enum")) {
                        advance();
                        return parseOpaqueBraces(start, "enum");
                    }
                    return parseVariablesStatement();
                case "let":
                case "var":
                    return parseVariablesStatement();
                case "interface":
                    if (peek().isIdentifier()) {
                        return parseInterface();
                    }
                    break;
                case "type":
                    if (peek().isIdentifier()) {
                        return parseTypeAlias();
                    }
                    break;
                case "declare":
                    if (peek().isIdentifier()) {
                        advance();
                        return parseStatement();
                    }
                    break;
                case "return":
                    return parseReturn();
                case "if":
                    return parseIf();
                case "for":
                case "while":
                    return parseLoop();
                case "do":
                    return parseDoWhile();
                case "try":
                    return parseTry();
                case "switch":
                    return parseSwitch();
                case "class":
                case "abstract":
                    return parseClass(start);
                case "enum":
                    return parseOpaqueBraces(start, "enum");
                case "namespace":
                case "module":
                    if (peek().isIdentifier()) {
                        advance();
                        advance();
                        while (eat(".")) {
                            expectIdentifier();
                        }
                        Statement.Block block = parseBlock();
                        return new Statement.Compound(token.text(), List.of(block), start, block.end());
                    }
                    break;
                case "throw":
                    advance();
                    parseExpression();
                    consumeSemicolon();
                    return new Statement.Opaque("throw", start, lastEnd());
                case "break":
                case "continue":
                    advance();
                    if (current.isIdentifier() && !current.newlineBefore()) {
                        advance();
                    }
                    consumeSemicolon();
                    return new Statement.Opaque(token.text(), start, lastEnd());
                case "debugger":
                    advance();
                    consumeSemicolon();
                    return new Statement.Opaque("debugger", start, lastEnd());
                default:
                    if (peek().is(":")) {
                        advance();
                        advance();
                        Statement labelled = parseStatement();
                        return new Statement.Compound("label", List.of(labelled), start, labelled.end());
                    }
                    break;
            }
        }
        Expression expression = parseExpression();
        consumeSemicolon();
        return new Statement.ExpressionStatement(expression, start, lastEnd());
    }

    private Statement.Block parseBlock() {
        int start = expect("{").start();
        List<Statement> body = new ArrayList<>();
        while (!check("}")) {
            if (current.isEof()) {
                throw error("Unterminated block", start);
            }
            body.add(parseStatement());
        }
        int end = current.end();
        advance();
        return new Statement.Block(body, start, end);
    }

    private Statement parseImport() {
        int start = expect("import").start();
        boolean typeOnly = false;
        if (check("type")) {
            Token next = peek();
            if (!next.is("from") && !next.is(",") && !next.is("=")) {
                advance();
                typeOnly = true;
            }
        }
        String defaultImport = null;
        String namespaceImport = null;
        List<String> named = new ArrayList<>();
        if (current.type() == TokenType.STRING) {
            String moduleName = current.value();
            advance();
            consumeSemicolon();
            return new Statement.Import(moduleName, null, named, null, false, start, lastEnd());
        }
        if (current.isIdentifier() && !check("from")) {
            defaultImport = expectIdentifier();
            eat(",");
        }
        if (eat("*")) {
            expect("as");
            namespaceImport = expectIdentifier();
        } else if (eat("{")) {
            while (!check("}")) {
                named.add(parseImportSpecifier());
                if (!eat(",")) {
                    break;
                }
            }
            expect("}");
        }
        expect("from");
        if (current.type() != TokenType.STRING) {
            throw error("Expected module specifier but found " + current, current.start());
        }
        String moduleName = current.value();
        advance();
        if ((check("with") || check("assert")) && !current.newlineBefore()) {
            advance();
            skipBalanced("{", "}");
        }
        consumeSemicolon();
        return new Statement.Import(moduleName, defaultImport, named, namespaceImport, typeOnly, start, lastEnd());
    }

    private String parseImportSpecifier() {
        StringBuilder specifier = new StringBuilder();
        if (check("type") && (peek().isIdentifier() || peek().type() == TokenType.STRING)) {
            advance();
            specifier.append("type ");
        }
        if (current.type() == TokenType.STRING) {
            specifier.append(current.text());
            advance();
        } else {
            specifier.append(expectIdentifier());
        }
        if (eat("as")) {
            specifier.append(" as ").append(expectIdentifier());
        }
        return specifier.toString();
    }

    private Statement parseExport() {
        int start = expect("export").start();
        if (eat("default")) {
            if (check("function")) {
                return new Statement.ExportDefault(parseFunctionDeclaration(current.start(), false, true), start, lastEnd());
            }
            if (check("async") && peek().is("function")) {
                int fnStart = current.start();
                advance();
                return new Statement.ExportDefault(parseFunctionDeclaration(fnStart, true, true), start, lastEnd());
            }
            if (check("class") || check("abstract")) {
                return new Statement.ExportDefault(parseClass(current.start()), start, lastEnd());
            }
            if (check("interface")) {
                return new Statement.ExportDefault(parseInterface(), start, lastEnd());
            }
            Expression expression = parseAssignment();
            consumeSemicolon();
            return new Statement.ExportDefault(expression, start, lastEnd());
        }
        if (check("type") && peek().is("{")) {
            advance();
        }
        if (check("{") || check("*")) {
            if (eat("*")) {
                if (eat("as")) {
                    expectIdentifier();
                }
            } else {
                skipBalanced("{", "}");
            }
            if (eat("from")) {
                advance();
            }
            consumeSemicolon();
            return new Statement.ExportNamed(null, start, lastEnd());
        }
        if (check("=")) {
            advance();
            parseExpression();
            consumeSemicolon();
            return new Statement.ExportNamed(null, start, lastEnd());
        }
        Statement declaration = parseStatement();
        return new Statement.ExportNamed(declaration, start, declaration.end());
    }

    private Statement.FunctionDeclaration parseFunctionDeclaration(int start, boolean async, boolean nameOptional) {
        expect("function");
        eat("*");
        String name = null;
        if (current.isIdentifier() && !check("(")) {
            name = expectIdentifier();
        } else if (!nameOptional) {
            throw error("Expected function name but found " + current, current.start());
        }
        if (check("<")) {
            skipTypeArguments();
        }
        List<Parameter> params = parseParameters();
        TypeAnnotation returnType = eat(":") ? parseType(TypeContext.FUNCTION_RETURN) : null;
        if (!check("{")) {
            // overload signature without a body
            consumeSemicolon();
            return new Statement.FunctionDeclaration(name, params, returnType, null, async, start, lastEnd());
        }
        Statement.Block body = parseBlock();
        return new Statement.FunctionDeclaration(name, params, returnType, body, async, start, body.end());
    }

    private Statement parseVariablesStatement() {
        Statement.Variables variables = parseVariables();
        consumeSemicolon();
        return new Statement.Variables(
                variables.kind(), variables.declarators(), variables.start(), lastEnd());
    }

    private Statement.Variables parseVariables() {
        Token kind = current;
        advance();
        List<Statement.Declarator> declarators = new ArrayList<>();
        do {
            int start = current.start();
            Pattern id = parseBindingTarget();
            eat("!");
            TypeAnnotation type = eat(":") ? parseType(TypeContext.DECLARATOR) : null;
            Expression init = eat("=") ? parseAssignment() : null;
            declarators.add(new Statement.Declarator(id, type, init, start, lastEnd()));
        } while (eat(","));
        return new Statement.Variables(kind.text(), declarators, kind.start(), lastEnd());
    }

    private Statement parseInterface() {
        int start = expect("interface").start();
        String name = expectIdentifier();
        if (check("<")) {
            skipTypeArguments();
        }
        if (eat("extends")) {
            while (!check("{")) {
                if (current.isEof()) {
                    throw error("Unterminated interface declaration", start);
                }
                if (check("<")) {
                    skipTypeArguments();
                } else {
                    advance();
                }
            }
        }
        List<TypeAnnotation.TypeMember> members = parseTypeMembers();
        return new Statement.Interface(name, members, start, lastEnd());
    }

    private Statement parseTypeAlias() {
        int start = expect("type").start();
        String name = expectIdentifier();
        if (check("<")) {
            skipTypeArguments();
        }
        expect("=");
        TypeAnnotation type = parseType(TypeContext.ALIAS);
        consumeSemicolon();
        return new Statement.TypeAlias(name, type, start, lastEnd());
    }

    private Statement parseReturn() {
        int start = expect("return").start();
        Expression argument = null;
        if (!check(";") && !check("}") && !current.isEof() && !current.newlineBefore()) {
            argument = parseExpression();
        }
        consumeSemicolon();
        return new Statement.Return(argument, start, lastEnd());
    }

    private Statement parseIf() {
        int start = expect("if").start();
        expect("(");
        Expression test = parseExpression();
        expect(")");
        Statement consequent = parseStatement();
        Statement alternate = eat("else") ? parseStatement() : null;
        return new Statement.If(test, consequent, alternate, start, lastEnd());
    }

    private Statement parseLoop() {
        Token keyword = current;
        advance();
        eat("await");
        skipBalanced("(", ")");
        Statement body = parseStatement();
        return new Statement.Compound(keyword.text(), List.of(body), keyword.start(), body.end());
    }

    private Statement parseDoWhile() {
        int start = expect("do").start();
        Statement body = parseStatement();
        expect("while");
        skipBalanced("(", ")");
        eat(";");
        return new Statement.Compound("do", List.of(body), start, lastEnd());
    }

    private Statement parseTry() {
        int start = expect("try").start();
        List<Statement> bodies = new ArrayList<>();
        bodies.add(parseBlock());
        if (eat("catch")) {
            if (check("(")) {
                skipBalanced("(", ")");
            }
            bodies.add(parseBlock());
        }
        if (eat("finally")) {
            bodies.add(parseBlock());
        }
        return new Statement.Compound("try", bodies, start, lastEnd());
    }

    private Statement parseSwitch() {
        int start = expect("switch").start();
        skipBalanced("(", ")");
        expect("{");
        List<Statement> bodies = new ArrayList<>();
        while (!check("}")) {
            if (current.isEof()) {
                throw error("Unterminated switch statement", start);
            }
            if (eat("case")) {
                parseExpression();
                expect(":");
            } else if (eat("default")) {
                expect(":");
            } else {
                bodies.add(parseStatement());
            }
        }
        advance();
        return new Statement.Compound("switch", bodies, start, lastEnd());
    }

    /** Parses a class declaration, keeping method bodies so that markup inside them stays parseable. */
    private Statement parseClass(int start) {
        eat("abstract");
        expect("class");
        while (!check("{")) {
            if (current.isEof()) {
                throw error("Unterminated class declaration", start);
            }
            if (check("<")) {
                skipTypeArguments();
            } else {
                advance();
            }
        }
        expect("{");
        List<Statement> bodies = new ArrayList<>();
        while (!check("}")) {
            if (current.isEof()) {
                throw error("Unterminated class body", start);
            }
            if (eat(";")) {
                continue;
            }
            if (check("@")) {
                skipDecorator();
                continue;
            }
            if (check("static") && peek().is("{")) {
                advance();
                bodies.add(parseBlock());
                continue;
            }
            while (current.isIdentifier() && CLASS_MODIFIERS.contains(current.text()) && isMemberNameAhead()) {
                advance();
            }
            if ((check("get") || check("set")) && isMemberNameAhead()) {
                advance();
            }
            eat("*");
            if (check("[")) {
                skipBalanced("[", "]");
            } else {
                advance();
            }
            eat("?");
            eat("!");
            if (check("(") || check("<")) {
                if (check("<")) {
                    skipTypeArguments();
                }
                parseParameters();
                if (eat(":")) {
                    parseType(TypeContext.FUNCTION_RETURN);
                }
                if (check("{")) {
                    bodies.add(parseBlock());
                } else {
                    consumeSemicolon();
                }
                continue;
            }
            if (eat(":")) {
                parseType(TypeContext.DECLARATOR);
            }
            if (eat("=")) {
                parseAssignment();
            }
            consumeSemicolon();
        }
        advance();
        return new Statement.Compound("class", bodies, start, lastEnd());
    }

    /** Returns {@code true} when the token after the current one can start a class member name. */
    private boolean isMemberNameAhead() {
        Token next = peek();
        return !next.newlineBefore()
                && (next.isIdentifier()
                        || next.type() == TokenType.STRING
                        || next.type() == TokenType.NUMBER
                        || next.is("[")
                        || next.is("*"));
    }

    private Statement parseOpaqueBraces(int start, String keyword) {
        while (!check("{")) {
            if (current.isEof()) {
                throw error("Expected '{' in " + keyword + " declaration", start);
            }
            advance();
        }
        skipBalanced("{", "}");
        return new Statement.Opaque(keyword, start, lastEnd());
    }

    private void skipDecorator() {
        expect("@");
        parseLeftHandSide();
    }

    /** Skips a balanced token run starting at {@code open}, consuming the closing token. */
    private void skipBalanced(String open, String close) {
        int start = expect(open).start();
        int depth = 1;
        while (depth > 0) {
            if (current.isEof()) {
                throw error("Unbalanced '" + open + "'", start);
            }
            if (check(open)) {
                depth++;
            } else if (check(close)) {
                depth--;
            }
            advance();
        }
    }

    // ── Patterns and parameters ──

    private List<Parameter> parseParameters() {
        expect("(");
        List<Parameter> params = new ArrayList<>();
        while (!check(")")) {
            int start = current.start();
            while (current.isIdentifier()
                    && (check("public") || check("private") || check("protected") || check("readonly"))
                    && peek().isIdentifier()) {
                advance();
            }
            Pattern pattern;
            if (check("...")) {
                advance();
                Pattern argument = parseBindingTarget();
                pattern = new Pattern.RestElement(argument, start, lastEnd());
            } else {
                pattern = parseBindingTarget();
            }
            boolean optional = eat("?");
            TypeAnnotation type = eat(":") ? parseType(TypeContext.PARAMETER) : null;
            if (eat("=")) {
                Expression defaultValue = parseAssignment();
                pattern = new Pattern.AssignmentPattern(pattern, defaultValue, start, lastEnd());
            }
            params.add(new Parameter(pattern, type, optional, start, lastEnd()));
            if (!eat(",")) {
                break;
            }
        }
        expect(")");
        return params;
    }

    private Pattern parseBindingTarget() {
        if (check("{")) {
            return parseObjectPattern();
        }
        if (check("[")) {
            return parseArrayPattern();
        }
        if (current.isIdentifier()) {
            Token token = current;
            advance();
            return new Expression.Identifier(token.text(), token.start(), token.end());
        }
        throw error("Expected binding pattern but found " + current, current.start());
    }

    private Pattern parseObjectPattern() {
        int start = expect("{").start();
        List<Pattern.PatternProperty> properties = new ArrayList<>();
        Pattern rest = null;
        while (!check("}")) {
            if (eat("...")) {
                rest = parseBindingTarget();
            } else {
                int propertyStart = current.start();
                Token keyToken = current;
                String key;
                if (check("[")) {
                    advance();
                    Expression computed = parseAssignment();
                    expect("]");
                    key = computed.text(source);
                } else if (keyToken.type() == TokenType.STRING) {
                    key = keyToken.value();
                    advance();
                } else if (keyToken.isIdentifier() || keyToken.type() == TokenType.NUMBER) {
                    key = keyToken.text();
                    advance();
                } else {
                    throw error("Expected property name but found " + current, current.start());
                }
                Pattern value;
                boolean shorthand;
                if (eat(":")) {
                    value = parseBindingTarget();
                    shorthand = false;
                } else {
                    if (!keyToken.isIdentifier()) {
                        throw error("Expected ':' after property name", current.start());
                    }
                    value = new Expression.Identifier(key, keyToken.start(), keyToken.end());
                    shorthand = true;
                }
                Expression defaultValue = eat("=") ? parseAssignment() : null;
                properties.add(new Pattern.PatternProperty(key, value, defaultValue, shorthand, propertyStart, lastEnd()));
            }
            if (!eat(",")) {
                break;
            }
        }
        int end = expect("}").end();
        return new Pattern.ObjectPattern(properties, rest, start, end);
    }

    private Pattern parseArrayPattern() {
        int start = expect("[").start();
        List<Pattern> elements = new ArrayList<>();
        while (!check("]")) {
            if (check(",")) {
                advance();
                elements.add(null);
                continue;
            }
            int elementStart = current.start();
            Pattern element;
            if (eat("...")) {
                element = new Pattern.RestElement(parseBindingTarget(), elementStart, lastEnd());
            } else {
                element = parseBindingTarget();
                if (eat("=")) {
                    element = new Pattern.AssignmentPattern(element, parseAssignment(), elementStart, lastEnd());
                }
            }
            elements.add(element);
            if (!eat(",")) {
                break;
            }
        }
        int end = expect("]").end();
        return new Pattern.ArrayPattern(Collections.unmodifiableList(elements), start, end);
    }

    // ── Types ──

    private TypeAnnotation parseType(TypeContext context) {
        int start = current.start();
        if (check("{")) {
            List<TypeAnnotation.TypeMember> members = parseTypeMembers();
            if (!continuesType()) {
                return new TypeAnnotation(typeText(start, lastEnd()), members, start, lastEnd());
            }
        }
        skipTypeTokens(context, start);
        return new TypeAnnotation(typeText(start, lastEnd()), null, start, lastEnd());
    }

    private boolean continuesType() {
        return (check("[") && !current.newlineBefore()) || check("|") || check("&") || check("extends");
    }

    private String typeText(int start, int end) {
        return source.substring(start, end).replaceAll("\\s+", " ").trim();
    }

    private void skipTypeTokens(TypeContext context, int start) {
        int depth = 0;
        boolean consumed = current.start() > start;
        while (true) {
            if (current.isEof()) {
                if (depth > 0 || context == TypeContext.ARROW_RETURN) {
                    throw error("Unterminated type annotation", start);
                }
                break;
            }
            if (depth == 0) {
                if (consumed && endsType(context)) {
                    break;
                }
                if (consumed && current.newlineBefore() && !isTypeContinuation()) {
                    break;
                }
            }
            String text = current.type() == TokenType.PUNCTUATOR ? current.text() : "";
            switch (text) {
                case "(", "[", "{", "<" -> depth++;
                case ")", "]", "}" -> {
                    if (depth == 0) {
                        if (context == TypeContext.ARROW_RETURN || !consumed) {
                            throw error("Unexpected " + current + " in type", current.start());
                        }
                        return;
                    }
                    depth--;
                }
                case ">" -> depth--;
                case ">>" -> depth -= 2;
                case ">>>" -> depth -= 3;
                default -> {
                    // plain type token
                }
            }
            if (depth < 0) {
                throw error("Unbalanced '>' in type", current.start());
            }
            advance();
            consumed = true;
        }
        if (!consumed) {
            throw error("Expected type but found " + current, current.start());
        }
    }

    private boolean endsType(TypeContext context) {
        switch (context) {
            case PARAMETER:
                return check(",") || check(")") || check("=");
            case DECLARATOR:
                return check("=") || check(",") || check(";") || check(")");
            case ARROW_RETURN:
                if (check(",") || check(";") || check("]")) {
                    throw error("Unexpected " + current + " in return type", current.start());
                }
                return check("=>");
            case FUNCTION_RETURN:
                return check("{") || check(";");
            case ALIAS:
                return check(";");
            case MEMBER:
                return check(";") || check(",");
            case ASSERTION:
                return check(",") || check(";") || check(":") || check("?") || check("=")
                        || check("&&") || check("||") || check("??") || check("=>") || check("{");
            default:
                return false;
        }
    }

    private boolean isTypeContinuation() {
        if (check("|") || check("&") || check(".")) {
            return true;
        }
        return previous != null
                && (previous.is("|") || previous.is("&") || previous.is("=>") || previous.is(":")
                        || previous.is(",") || previous.is("<") || previous.is("="));
    }

    private List<TypeAnnotation.TypeMember> parseTypeMembers() {
        int start = expect("{").start();
        List<TypeAnnotation.TypeMember> members = new ArrayList<>();
        while (!check("}")) {
            if (current.isEof()) {
                throw error("Unterminated type literal", start);
            }
            if (eat(";") || eat(",")) {
                continue;
            }
            if (check("readonly") && !peek().is(":") && !peek().is("?")) {
                advance();
            }
            String name = null;
            if (check("[")) {
                skipBalanced("[", "]");
            } else if (check("(") || check("<") || check("new")) {
                parseType(TypeContext.MEMBER);
                continue;
            } else if (current.isIdentifier() || current.type() == TokenType.NUMBER) {
                name = current.text();
                advance();
            } else if (current.type() == TokenType.STRING) {
                name = current.value();
                advance();
            } else {
                throw error("Unexpected " + current + " in type literal", current.start());
            }
            eat("-");
            eat("+");
            boolean optional = eat("?");
            if (check("(") || check("<")) {
                parseType(TypeContext.MEMBER);
                continue;
            }
            if (eat(":")) {
                TypeAnnotation type = parseType(TypeContext.MEMBER);
                if (name != null) {
                    members.add(new TypeAnnotation.TypeMember(name, optional, type.text()));
                }
            } else if (name != null) {
                members.add(new TypeAnnotation.TypeMember(name, optional, "any"));
            }
        }
        advance();
        return members;
    }

    /** Skips {@code <...>} type arguments or parameters, consuming the closing bracket. */
    private void skipTypeArguments() {
        int start = expect("<").start();
        int depth = 1;
        while (depth > 0) {
            if (current.isEof() || check(";") || check("&&") || check("||")) {
                throw error("Unterminated type arguments", start);
            }
            String text = current.type() == TokenType.PUNCTUATOR ? current.text() : "";
            switch (text) {
                case "<" -> depth++;
                case ">" -> depth--;
                case ">>" -> depth -= 2;
                case ">>>" -> depth -= 3;
                default -> {
                    // type token
                }
            }
            if (depth < 0) {
                throw error("Unbalanced type arguments", current.start());
            }
            advance();
        }
    }

    // ── Expressions ──

    private Expression parseExpression() {
        int start = current.start();
        Expression first = parseAssignment();
        if (!check(",")) {
            return first;
        }
        List<Expression> expressions = new ArrayList<>();
        expressions.add(first);
        while (eat(",")) {
            expressions.add(parseAssignment());
        }
        return new Expression.Sequence(expressions, start, lastEnd());
    }

    private Expression parseAssignment() {
        Expression arrow = tryArrowFunction();
        if (arrow != null) {
            return arrow;
        }
        int start = current.start();
        Expression left = parseConditional();
        if (current.type() == TokenType.PUNCTUATOR && ASSIGNMENT_OPERATORS.contains(current.text())) {
            String operator = current.text();
            advance();
            Expression value = parseAssignment();
            return new Expression.Assignment(operator, left, value, start, lastEnd());
        }
        return left;
    }

    private Expression tryArrowFunction() {
        if (current.isIdentifier() && !check("async")) {
            Token next = peek();
            if (next.is("=>") && !next.newlineBefore()) {
                return parseArrowFunction();
            }
            return null;
        }
        if (check("async")) {
            Token next = peek();
            if (next.newlineBefore() || !(next.is("(") || next.isIdentifier() || next.is("<"))) {
                return null;
            }
            return speculativeArrow();
        }
        if (check("(")) {
            return speculativeArrow();
        }
        if (check("<") && looksLikeTypeParameters()) {
            return speculativeArrow();
        }
        return null;
    }

    private boolean looksLikeTypeParameters() {
        State state = mark();
        try {
            advance();
            if (!current.isIdentifier()) {
                return false;
            }
            advance();
            return check(",") || check("extends");
        } catch (SourceParseException e) {
            return false;
        } finally {
            restore(state);
        }
    }

    private Expression speculativeArrow() {
        State state = mark();
        try {
            return parseArrowFunction();
        } catch (SourceParseException e) {
            // not an arrow function; reparse from the mark as an ordinary expression
            restore(state);
            return null;
        }
    }

    private Expression parseArrowFunction() {
        int start = current.start();
        boolean async = false;
        if (check("async") && !peek().is("=>")) {
            advance();
            async = true;
        }
        List<Parameter> params;
        if (current.isIdentifier()) {
            Token name = current;
            advance();
            Pattern pattern = new Expression.Identifier(name.text(), name.start(), name.end());
            params = List.of(new Parameter(pattern, null, false, name.start(), name.end()));
        } else {
            if (check("<")) {
                skipTypeArguments();
            }
            params = parseParameters();
            if (eat(":")) {
                parseType(TypeContext.ARROW_RETURN);
            }
        }
        if (!check("=>") || current.newlineBefore()) {
            throw error("Expected '=>' but found " + current, current.start());
        }
        advance();
        SyntaxNode body = check("{") ? parseBlock() : parseAssignment();
        return new Expression.Arrow(params, body, async, start, lastEnd());
    }

    private Expression parseConditional() {
        int start = current.start();
        Expression test = parseBinary(0);
        if (!check("?")) {
            return test;
        }
        advance();
        Expression consequent = parseAssignment();
        expect(":");
        Expression alternate = parseAssignment();
        return new Expression.Conditional(test, consequent, alternate, start, lastEnd());
    }

    private int binaryPrecedence() {
        if (current.type() == TokenType.PUNCTUATOR) {
            switch (current.text()) {
                case "??":
                    return 1;
                case "||":
                    return 2;
                case "&&":
                    return 3;
                case "|":
                    return 4;
                case "^":
                    return 5;
                case "&":
                    return 6;
                case "==":
                case "!=":
                case "===":
                case "!==":
                    return 7;
                case "<":
                case ">":
                case "<=":
                case ">=":
                    return 8;
                case "<<":
                case ">>":
                case ">>>":
                    return 9;
                case "+":
                case "-":
                    return 10;
                case "*":
                case "/":
                case "%":
                    return 11;
                case "**":
                    return 12;
                default:
                    return -1;
            }
        }
        if (current.isIdentifier() && !current.newlineBefore()) {
            switch (current.text()) {
                case "instanceof":
                case "in":
                case "as":
                case "satisfies":
                    return 8;
                default:
                    return -1;
            }
        }
        return -1;
    }

    private Expression parseBinary(int minPrecedence) {
        int start = current.start();
        Expression left = parseUnary();
        while (true) {
            int precedence = binaryPrecedence();
            if (precedence < 0 || precedence <= minPrecedence) {
                return left;
            }
            String operator = current.text();
            advance();
            if (operator.equals("as") || operator.equals("satisfies")) {
                TypeAnnotation type = parseType(TypeContext.ASSERTION);
                left = new Expression.TypeAssertion(left, type.text(), start, lastEnd());
                continue;
            }
            Expression right = parseBinary(operator.equals("**") ? precedence - 1 : precedence);
            left = new Expression.Binary(operator, left, right, start, lastEnd());
        }
    }

    private Expression parseUnary() {
        int start = current.start();
        boolean operator = current.type() == TokenType.PUNCTUATOR && PREFIX_OPERATORS.contains(current.text());
        boolean keyword = current.isIdentifier() && PREFIX_KEYWORDS.contains(current.text()) && startsOperand(peek());
        if (operator || keyword) {
            String op = current.text();
            advance();
            Expression argument = parseUnary();
            return new Expression.Unary(op, argument, true, start, lastEnd());
        }
        Expression expression = parseLeftHandSide();
        if ((check("++") || check("--")) && !current.newlineBefore()) {
            String op = current.text();
            advance();
            return new Expression.Unary(op, expression, false, start, lastEnd());
        }
        return expression;
    }

    private static boolean startsOperand(Token token) {
        if (token.isEof()) {
            return false;
        }
        if (token.type() != TokenType.PUNCTUATOR) {
            return true;
        }
        return switch (token.text()) {
            case "(", "[", "{", "<", "!", "~", "+", "-", "++", "--", "/", "/=" -> true;
            default -> false;
        };
    }

    private Expression parseLeftHandSide() {
        int start = current.start();
        Expression expression = parsePrimary();
        while (true) {
            if (eat(".")) {
                Token name = expectPropertyName();
                Expression property = new Expression.Identifier(name.text(), name.start(), name.end());
                expression = new Expression.Member(expression, property, false, false, start, lastEnd());
            } else if (check("?.")) {
                advance();
                if (check("(")) {
                    List<Expression> args = parseArguments();
                    expression = new Expression.Call(expression, args, true, start, lastEnd());
                } else if (eat("[")) {
                    Expression property = parseExpression();
                    expect("]");
                    expression = new Expression.Member(expression, property, true, true, start, lastEnd());
                } else {
                    Token name = expectPropertyName();
                    Expression property = new Expression.Identifier(name.text(), name.start(), name.end());
                    expression = new Expression.Member(expression, property, false, true, start, lastEnd());
                }
            } else if (check("[")) {
                advance();
                Expression property = parseExpression();
                expect("]");
                expression = new Expression.Member(expression, property, true, false, start, lastEnd());
            } else if (check("(")) {
                List<Expression> args = parseArguments();
                expression = new Expression.Call(expression, args, false, start, lastEnd());
            } else if (current.type() == TokenType.TEMPLATE) {
                Expression.TemplateLiteral quasi = parseTemplate();
                expression = new Expression.TaggedTemplate(expression, quasi, start, lastEnd());
            } else if (check("!") && !current.newlineBefore()) {
                advance();
                expression = new Expression.NonNull(expression, start, lastEnd());
            } else if (check("<") && !current.newlineBefore() && skipCallTypeArguments()) {
                continue;
            } else {
                return expression;
            }
        }
    }

    /** Consumes {@code <T>} when it is followed by a call or template; otherwise rewinds. */
    private boolean skipCallTypeArguments() {
        State state = mark();
        try {
            skipTypeArguments();
            if (check("(") || current.type() == TokenType.TEMPLATE) {
                return true;
            }
        } catch (SourceParseException e) {
            // a comparison, not type arguments
        }
        restore(state);
        return false;
    }

    private Token expectPropertyName() {
        if (!current.isIdentifier()) {
            throw error("Expected property name but found " + current, current.start());
        }
        Token name = current;
        advance();
        return name;
    }

    private List<Expression> parseArguments() {
        expect("(");
        List<Expression> args = new ArrayList<>();
        while (!check(")")) {
            int start = current.start();
            if (eat("...")) {
                Expression argument = parseAssignment();
                args.add(new Expression.Spread(argument, start, lastEnd()));
            } else {
                args.add(parseAssignment());
            }
            if (!eat(",")) {
                break;
            }
        }
        expect(")");
        return args;
    }

    private Expression parsePrimary() {
        Token token = current;
        int start = token.start();
        switch (token.type()) {
            case IDENTIFIER:
                return parseIdentifierPrimary(token);
            case NUMBER:
                advance();
                return new Expression.Literal(Expression.LiteralKind.NUMBER, token.text(), token.text(), start, token.end());
            case STRING:
                advance();
                return new Expression.Literal(Expression.LiteralKind.STRING, token.value(), token.text(), start, token.end());
            case TEMPLATE:
                return parseTemplate();
            case PUNCTUATOR:
                break;
            default:
                throw unexpected();
        }
        switch (token.text()) {
            case "(": {
                advance();
                Expression inner = parseExpression();
                expect(")");
                return new Expression.Parenthesized(inner, start, lastEnd());
            }
            case "[":
                return parseArrayLiteral();
            case "{":
                return parseObjectLiteral();
            case "<":
                return parseJsxExpression();
            case "/":
            case "/=": {
                Token regex = lexer.rescanRegex(token);
                current = regex;
                advance();
                return new Expression.Literal(Expression.LiteralKind.REGEX, regex.text(), regex.text(), start, regex.end());
            }
            default:
                throw unexpected();
        }
    }

    private Expression parseIdentifierPrimary(Token token) {
        int start = token.start();
        switch (token.text()) {
            case "function":
                return parseFunctionExpression(start, false);
            case "async":
                if (peek().is("function")) {
                    advance();
                    return parseFunctionExpression(start, true);
                }
                break;
            case "new":
                return parseNew();
            case "true":
            case "false":
                advance();
                return new Expression.Literal(Expression.LiteralKind.BOOLEAN, token.text(), token.text(), start, token.end());
            case "null":
                advance();
                return new Expression.Literal(Expression.LiteralKind.NULL, "null", "null", start, token.end());
            case "class":
                throw error("Class expressions are not supported", start);
            default:
                break;
        }
        advance();
        return new Expression.Identifier(token.text(), start, token.end());
    }

    private Expression parseFunctionExpression(int start, boolean async) {
        expect("function");
        eat("*");
        String name = null;
        if (current.isIdentifier()) {
            name = expectIdentifier();
        }
        if (check("<")) {
            skipTypeArguments();
        }
        List<Parameter> params = parseParameters();
        if (eat(":")) {
            parseType(TypeContext.FUNCTION_RETURN);
        }
        Statement.Block body = parseBlock();
        return new Expression.Function(name, params, body, async, start, body.end());
    }

    private Expression parseNew() {
        int start = expect("new").start();
        if (eat(".")) {
            Token name = expectPropertyName();
            Expression meta = new Expression.Identifier("new", start, start + 3);
            Expression property = new Expression.Identifier(name.text(), name.start(), name.end());
            return new Expression.Member(meta, property, false, false, start, lastEnd());
        }
        Expression callee = parsePrimary();
        while (true) {
            if (eat(".")) {
                Token name = expectPropertyName();
                Expression property = new Expression.Identifier(name.text(), name.start(), name.end());
                callee = new Expression.Member(callee, property, false, false, start, lastEnd());
            } else if (check("[")) {
                advance();
                Expression property = parseExpression();
                expect("]");
                callee = new Expression.Member(callee, property, true, false, start, lastEnd());
            } else {
                break;
            }
        }
        if (check("<")) {
            skipCallTypeArguments();
        }
        List<Expression> args = check("(") ? parseArguments() : List.of();
        return new Expression.New(callee, args, start, lastEnd());
    }

    private Expression.TemplateLiteral parseTemplate() {
        Token token = current;
        List<Expression> expressions = new ArrayList<>();
        for (Token.Span span : token.spans()) {
            SyntaxParser nested = new SyntaxParser(source, sourceFile, lineMap, span.start(), span.end());
            expressions.add(nested.parseStandaloneExpression());
        }
        advance();
        return new Expression.TemplateLiteral(token.quasis(), expressions, token.start(), token.end());
    }

    private Expression parseArrayLiteral() {
        int start = expect("[").start();
        List<Expression> elements = new ArrayList<>();
        while (!check("]")) {
            if (check(",")) {
                advance();
                elements.add(null);
                continue;
            }
            int elementStart = current.start();
            if (eat("...")) {
                elements.add(new Expression.Spread(parseAssignment(), elementStart, lastEnd()));
            } else {
                elements.add(parseAssignment());
            }
            if (!eat(",")) {
                break;
            }
        }
        int end = expect("]").end();
        return new Expression.ArrayLiteral(Collections.unmodifiableList(elements), start, end);
    }

    private Expression parseObjectLiteral() {
        int start = expect("{").start();
        List<Expression> members = new ArrayList<>();
        while (!check("}")) {
            int memberStart = current.start();
            if (eat("...")) {
                members.add(new Expression.Spread(parseAssignment(), memberStart, lastEnd()));
            } else {
                members.add(parseObjectMember(memberStart));
            }
            if (!eat(",")) {
                break;
            }
        }
        int end = expect("}").end();
        return new Expression.ObjectLiteral(members, start, end);
    }

    private Expression parseObjectMember(int memberStart) {
        if ((check("get") || check("set") || check("async")) && isMemberNameAhead()) {
            advance();
        }
        eat("*");
        Expression key;
        boolean computed = false;
        Token keyToken = current;
        if (eat("[")) {
            key = parseAssignment();
            expect("]");
            computed = true;
        } else if (keyToken.type() == TokenType.STRING) {
            advance();
            key = new Expression.Literal(
                    Expression.LiteralKind.STRING, keyToken.value(), keyToken.text(), keyToken.start(), keyToken.end());
        } else if (keyToken.type() == TokenType.NUMBER) {
            advance();
            key = new Expression.Literal(
                    Expression.LiteralKind.NUMBER, keyToken.text(), keyToken.text(), keyToken.start(), keyToken.end());
        } else if (keyToken.isIdentifier()) {
            advance();
            key = new Expression.Identifier(keyToken.text(), keyToken.start(), keyToken.end());
        } else {
            throw error("Expected property name but found " + current, current.start());
        }
        if (check("(") || check("<")) {
            int fnStart = current.start();
            if (check("<")) {
                skipTypeArguments();
            }
            List<Parameter> params = parseParameters();
            if (eat(":")) {
                parseType(TypeContext.FUNCTION_RETURN);
            }
            Statement.Block body = parseBlock();
            Expression method = new Expression.Function(null, params, body, false, fnStart, body.end());
            return new Expression.Property(key, method, computed, false, memberStart, lastEnd());
        }
        if (eat(":")) {
            Expression value = parseAssignment();
            return new Expression.Property(key, value, computed, false, memberStart, lastEnd());
        }
        if (!(key instanceof Expression.Identifier)) {
            throw error("Expected ':' after property name", current.start());
        }
        Expression value = key;
        if (eat("=")) {
            Expression defaultValue = parseAssignment();
            value = new Expression.Assignment("=", key, defaultValue, memberStart, lastEnd());
        }
        return new Expression.Property(key, value, false, true, memberStart, lastEnd());
    }

    // ── JSX ──

    /** Parses the JSX element starting at the current {@code <} token, then resumes token scanning. */
    private Expression parseJsxExpression() {
        Expression element = parseJsxAt(current.start());
        lexer.reset(element.end());
        advance();
        previous = Token.simple(TokenType.PUNCTUATOR, ">", element.end() - 1, element.end(), false);
        return element;
    }

    private Expression parseJsxAt(int start) {
        int pos = skipJsxSpace(start + 1);
        requireJsxChar(pos, start);
        if (source.charAt(pos) == '>') {
            List<JsxChild> children = new ArrayList<>();
            int end = parseJsxChildren(pos + 1, null, start, children);
            return new Expression.JsxFragment(children, start, end);
        }
        int nameEnd = readJsxName(pos);
        String name = source.substring(pos, nameEnd);
        pos = nameEnd;
        List<JsxAttributeItem> attributes = new ArrayList<>();
        while (true) {
            pos = skipJsxSpace(pos);
            requireJsxChar(pos, start);
            char c = source.charAt(pos);
            if (c == '/') {
                if (pos + 1 >= lexer.limit() || source.charAt(pos + 1) != '>') {
                    throw error("Expected '>' after '/' in <" + name + ">", pos);
                }
                return new Expression.JsxElement(name, attributes, List.of(), true, start, pos + 2);
            }
            if (c == '>') {
                pos++;
                break;
            }
            if (c == '{') {
                int spreadStart = pos;
                lexer.reset(pos + 1);
                advance();
                expect("...");
                Expression argument = parseAssignment();
                int end = requireClosingBrace();
                attributes.add(new JsxAttributeItem.JsxSpreadAttribute(argument, spreadStart, end));
                pos = end;
                continue;
            }
            int attributeStart = pos;
            int attributeNameEnd = readJsxName(pos);
            String attributeName = source.substring(pos, attributeNameEnd);
            pos = attributeNameEnd;
            int afterName = skipJsxSpace(pos);
            SyntaxNode value = null;
            if (afterName < lexer.limit() && source.charAt(afterName) == '=') {
                pos = skipJsxSpace(afterName + 1);
                requireJsxChar(pos, start);
                char v = source.charAt(pos);
                if (v == '"' || v == '\'') {
                    int close = source.indexOf(v, pos + 1);
                    if (close < 0 || close >= lexer.limit()) {
                        throw error("Unterminated attribute value", pos);
                    }
                    String raw = source.substring(pos, close + 1);
                    String decoded = decodeEntities(source.substring(pos + 1, close));
                    value = new Expression.Literal(Expression.LiteralKind.STRING, decoded, raw, pos, close + 1);
                    pos = close + 1;
                } else if (v == '{') {
                    JsxChild.JsxExpressionContainer container = parseJsxContainer(pos);
                    value = container;
                    pos = container.end();
                } else if (v == '<') {
                    Expression element = parseJsxAt(pos);
                    value = element;
                    pos = element.end();
                } else {
                    throw error("Unexpected attribute value in <" + name + ">", pos);
                }
            }
            attributes.add(new JsxAttributeItem.JsxAttribute(attributeName, value, attributeStart, pos));
        }
        List<JsxChild> children = new ArrayList<>();
        int end = parseJsxChildren(pos, name, start, children);
        return new Expression.JsxElement(name, attributes, children, false, start, end);
    }

    /** Parses children up to the matching closing tag; returns the offset after it. */
    private int parseJsxChildren(int pos, String closingName, int elementStart, List<JsxChild> children) {
        String display = closingName == null ? "<>" : "<" + closingName + ">";
        while (true) {
            if (pos >= lexer.limit()) {
                throw error("Unclosed JSX element " + display, elementStart);
            }
            char c = source.charAt(pos);
            if (c == '<') {
                int p = skipJsxSpace(pos + 1);
                requireJsxChar(p, elementStart);
                if (source.charAt(p) == '/') {
                    p = skipJsxSpace(p + 1);
                    requireJsxChar(p, elementStart);
                    if (closingName != null) {
                        int nameEnd = readJsxName(p);
                        String found = source.substring(p, nameEnd);
                        if (!found.equals(closingName)) {
                            throw error("Expected closing tag </" + closingName + "> but found </" + found + ">", p);
                        }
                        p = skipJsxSpace(nameEnd);
                        requireJsxChar(p, elementStart);
                    }
                    if (source.charAt(p) != '>') {
                        throw error("Expected '>' in closing tag of " + display, p);
                    }
                    return p + 1;
                }
                Expression child = parseJsxAt(pos);
                children.add((JsxChild) child);
                pos = child.end();
            } else if (c == '{') {
                JsxChild.JsxExpressionContainer container = parseJsxContainer(pos);
                children.add(container);
                pos = container.end();
            } else {
                int end = pos;
                while (end < lexer.limit() && source.charAt(end) != '<' && source.charAt(end) != '{') {
                    end++;
                }
                children.add(new JsxChild.JsxText(source.substring(pos, end), pos, end));
                pos = end;
            }
        }
    }

    private JsxChild.JsxExpressionContainer parseJsxContainer(int start) {
        lexer.reset(start + 1);
        advance();
        if (check("}")) {
            String comment = extractComment(source.substring(start + 1, current.start()));
            return new JsxChild.JsxExpressionContainer(null, comment, start, current.end());
        }
        Expression expression;
        if (check("...")) {
            int spreadStart = current.start();
            advance();
            expression = new Expression.Spread(parseAssignment(), spreadStart, lastEnd());
        } else {
            expression = parseExpression();
        }
        int end = requireClosingBrace();
        return new JsxChild.JsxExpressionContainer(expression, null, start, end);
    }

    /** Checks that the current token closes a JSX container and returns the offset after it. */
    private int requireClosingBrace() {
        if (!check("}")) {
            throw error("Expected '}' but found " + current, current.start());
        }
        return current.end();
    }

    private static String extractComment(String inner) {
        String trimmed = inner.trim();
        if (trimmed.startsWith("/*") && trimmed.endsWith("*/") && trimmed.length() >= 4) {
            return trimmed.substring(2, trimmed.length() - 2).trim();
        }
        if (trimmed.startsWith("//")) {
            return trimmed.substring(2).trim();
        }
        return null;
    }

    private int readJsxName(int pos) {
        int end = pos;
        if (end >= lexer.limit() || !Lexer.isIdentifierStart(source.charAt(end))) {
            throw error("Expected JSX name", pos);
        }
        while (end < lexer.limit()) {
            char c = source.charAt(end);
            if (Lexer.isIdentifierPart(c) || c == '-') {
                end++;
            } else if ((c == ':' || c == '.')
                    && end + 1 < lexer.limit()
                    && Lexer.isIdentifierStart(source.charAt(end + 1))) {
                end++;
            } else {
                break;
            }
        }
        return end;
    }

    private int skipJsxSpace(int pos) {
        int p = pos;
        while (p < lexer.limit()) {
            char c = source.charAt(p);
            if (Character.isWhitespace(c)) {
                p++;
            } else if (c == '/' && p + 1 < lexer.limit() && source.charAt(p + 1) == '*') {
                int close = source.indexOf("*/", p + 2);
                if (close < 0) {
                    throw error("Unterminated comment", p);
                }
                p = close + 2;
            } else if (c == '/' && p + 1 < lexer.limit() && source.charAt(p + 1) == '/') {
                while (p < lexer.limit() && source.charAt(p) != '\n') {
                    p++;
                }
            } else {
                break;
            }
        }
        return p;
    }

    private void requireJsxChar(int pos, int elementStart) {
        if (pos >= lexer.limit()) {
            throw error("Unterminated JSX element", elementStart);
        }
    }

    static String decodeEntities(String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }
        return text.replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&");
    }
}
