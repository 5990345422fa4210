package org.pragmatica.loft.parser;

import org.pragmatica.loft.ast.Attribute;
import org.pragmatica.loft.ast.EnumVariant;
import org.pragmatica.loft.ast.Expr;
import org.pragmatica.loft.ast.FieldDecl;
import org.pragmatica.loft.ast.FieldInit;
import org.pragmatica.loft.ast.LambdaParam;
import org.pragmatica.loft.ast.MatchArm;
import org.pragmatica.loft.ast.Param;
import org.pragmatica.loft.ast.Stmt;
import org.pragmatica.loft.ast.TemplatePart;
import org.pragmatica.loft.ast.TraitMethod;
import org.pragmatica.loft.ast.Type;
import org.pragmatica.loft.error.ParseError;
import org.pragmatica.loft.lexer.Lexeme;
import org.pragmatica.loft.lexer.PositionedInputStream;
import org.pragmatica.loft.lexer.Token;
import org.pragmatica.loft.lexer.TokenCursor;
import org.pragmatica.loft.lexer.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for loft source.
 *
 * <p>Statements are dispatched on their leading token; expressions use precedence climbing over
 * {@link Precedence}. The only backtracking is token push-back through the {@link TokenCursor}:
 * a leading identifier is pushed back when it turns out not to start an assignment, and the tokens
 * scanned while deciding whether {@code (} opens a lambda are all pushed back before parsing resumes.
 *
 * <p>An instance parses one source once and is not thread-safe.
 */
public final class LoftParser {
    private static final Logger log = LoggerFactory.getLogger(LoftParser.class);

    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
        "fn", "let", "const", "if", "while", "for", "return", "teach", "learn", "def", "impl", "trait");

    private final TokenCursor tokens;
    private final ParserConfig config;
    private final String source;
    private final String path;

    private LoftParser(TokenCursor tokens, ParserConfig config, String source, String path) {
        this.tokens = tokens;
        this.config = config;
        this.source = source;
        this.path = path;
    }

    public static LoftParser create(String source, String path) {
        return create(source, path, ParserConfig.DEFAULT);
    }

    public static LoftParser create(String source, String path, ParserConfig config) {
        if (source.length() > config.maxInputSize()) {
            throw new IllegalArgumentException(
            "Input exceeds maximum size of " + config.maxInputSize() + " characters");
        }
        var tokenizer = Tokenizer.create(PositionedInputStream.of(path, source));
        return new LoftParser(TokenCursor.over(tokenizer), config, source, path);
    }

    /**
     * Parse all statements up to the end of input, failing on the first error.
     */
    public List<Stmt> parse() throws ParseError {
        var statements = new ArrayList<Stmt>();
        while (!tokens.atEnd()) {
            statements.add(parseStatement());
        }
        log.debug("Parsed {} statement(s) from {}", statements.size(), path);
        return List.copyOf(statements);
    }

    /**
     * Parse all statements, recording each failed statement's error and resynchronizing at the next
     * statement boundary. Never throws a {@link ParseError}.
     */
    public ParseOutcome parseRecoverable() {
        var statements = new ArrayList<Stmt>();
        var errors = new ArrayList<ParseError>();

        while (true) {
            try {
                if (tokens.atEnd()) {
                    break;
                }
                statements.add(parseStatement());
            } catch (ParseError error) {
                recordError(errors, error);
                // A lexical error has already consumed the offending characters
                synchronize(errors, error.kind() == ParseError.Kind.SYNTAX);
            }
        }

        log.debug("Parsed {} statement(s) with {} error(s) from {}", statements.size(), errors.size(), path);
        return new ParseOutcome(statements, errors, source, path);
    }

    /**
     * Fail unless all input has been consumed.
     */
    public void expectEnd() throws ParseError {
        var next = tokens.peek();
        if (next.isPresent()) {
            throw tokens.error("Unexpected token after expression: " + next.get().token().describe());
        }
    }

    /**
     * Return and clear the doc comment most recently skipped by the tokenizer.
     */
    public Optional<String> takeLastDocComment() {
        return tokens.takeLastDocComment();
    }

    private static void recordError(List<ParseError> errors, ParseError error) {
        log.debug("Recorded {} error at {}: {}", error.kind(), error.location(), error.reason());
        errors.add(error);
    }

    private void synchronize(List<ParseError> errors, boolean discardOffending) {
        int skipped = 0;
        boolean discard = discardOffending;

        while (true) {
            try {
                var next = tokens.peek();
                if (next.isEmpty()) {
                    break;
                }
                var token = next.get().token();
                if (!discard) {
                    if (isPunct(token, ";")) {
                        tokens.next();
                        skipped++;
                        break;
                    }
                    if (token instanceof Token.Keyword keyword && STATEMENT_KEYWORDS.contains(keyword.name())) {
                        break;
                    }
                }
                discard = false;
                tokens.next();
                skipped++;
            } catch (ParseError error) {
                recordError(errors, error);
                discard = false;
            }
        }
        log.debug("Synchronized after skipping {} token(s)", skipped);
    }

    // Statements

    public Stmt parseStatement() throws ParseError {
        var next = tokens.peek();
        if (next.isEmpty()) {
            throw tokens.error("Unexpected end of input");
        }
        var token = next.get().token();

        if (isPunct(token, "#")) {
            return parseAttributeStatement();
        }
        if (isPunct(token, "{")) {
            return parseBlock();
        }
        if (token instanceof Token.Keyword keyword) {
            return switch (keyword.name()) {
                case "let" -> parseVarDecl(false);
                case "mut" -> {
                    tokens.next();
                    yield parseVarDecl(true);
                }
                case "const" -> parseConstDecl();
                case "fn" -> parseFunctionDecl(false, false);
                case "teach" -> {
                    tokens.next();
                    boolean async = tokens.isKeyword("async");
                    if (async) {
                        tokens.next();
                    }
                    yield parseFunctionDecl(async, true);
                }
                case "async" -> parseAsyncStatement();
                case "def" -> parseStructDecl();
                case "enum" -> parseEnumDecl();
                case "trait" -> parseTraitDecl();
                case "impl" -> parseImplBlock();
                case "learn" -> parseImportStatement();
                case "if" -> parseIfStatement();
                case "while" -> parseWhileStatement();
                case "for" -> parseForStatement();
                case "match" -> parseMatchStatement();
                case "return" -> parseReturnStatement();
                case "break" -> {
                    tokens.next();
                    maybeConsumeSemicolon();
                    yield new Stmt.Break();
                }
                case "continue" -> {
                    tokens.next();
                    maybeConsumeSemicolon();
                    yield new Stmt.Continue();
                }
                default -> parseExpressionStatement();
            };
        }
        if (token instanceof Token.Ident) {
            return parseAssignmentOrExpression();
        }
        return parseExpressionStatement();
    }

    private Stmt parseExpressionStatement() throws ParseError {
        var expr = parseExpression();
        maybeConsumeSemicolon();
        return new Stmt.Expression(expr);
    }

    private Stmt parseAssignmentOrExpression() throws ParseError {
        var identifier = tokens.next().orElseThrow();

        if (tokens.isOp("=")) {
            tokens.next();
            var value = parseExpression();
            maybeConsumeSemicolon();
            return new Stmt.Assign(((Token.Ident) identifier.token()).name(), value);
        }

        tokens.pushBack(identifier);
        return parseExpressionStatement();
    }

    // 'async fn' declares a function, anything else is an async expression statement
    private Stmt parseAsyncStatement() throws ParseError {
        var asyncKeyword = tokens.next().orElseThrow();

        if (tokens.isKeyword("fn")) {
            return parseFunctionDecl(true, false);
        }

        tokens.pushBack(asyncKeyword);
        return parseExpressionStatement();
    }

    private Stmt parseAttributeStatement() throws ParseError {
        tokens.expectPunct("#");
        tokens.expectPunct("[");
        var name = expectIdentifier("attribute name");

        var args = new ArrayList<Expr>();
        if (tokens.isPunct("(")) {
            tokens.next();
            while (true) {
                if (tokens.isPunct(")")) {
                    tokens.next();
                    break;
                }
                args.add(parseExpression());
                if (tokens.isPunct(",")) {
                    tokens.next();
                } else if (tokens.isPunct(")")) {
                    tokens.next();
                    break;
                } else {
                    throw tokens.unexpected("',' or ')' in attribute args");
                }
            }
        }

        tokens.expectPunct("]");
        var stmt = parseStatement();
        return new Stmt.AttrStmt(new Attribute(name, args), stmt);
    }

    private Stmt parseVarDecl(boolean mutable) throws ParseError {
        tokens.expectKeyword("let");
        var name = expectIdentifier("identifier");
        var type = optionalTypeAnnotation();

        Optional<Expr> value = Optional.empty();
        if (tokens.isOp("=")) {
            tokens.next();
            value = Optional.of(parseExpression());
        }

        maybeConsumeSemicolon();
        return new Stmt.VarDecl(name, type, mutable, value);
    }

    private Stmt parseConstDecl() throws ParseError {
        tokens.expectKeyword("const");
        var name = expectIdentifier("identifier");
        var type = optionalTypeAnnotation();

        tokens.expectOp("=");
        var value = parseExpression();

        maybeConsumeSemicolon();
        return new Stmt.ConstDecl(name, type, value);
    }

    private Stmt parseImportStatement() throws ParseError {
        tokens.expectKeyword("learn");

        var next = tokens.peek();
        if (next.isEmpty() || !(next.get().token() instanceof Token.StringLiteral literal)) {
            throw tokens.unexpected("string literal after 'learn'");
        }
        tokens.next();

        var path = Arrays.asList(literal.value().split("::", -1));
        maybeConsumeSemicolon();
        return new Stmt.ImportDecl(path);
    }

    private Stmt.FunctionDecl parseFunctionDecl(boolean async, boolean exported) throws ParseError {
        tokens.expectKeyword("fn");
        var name = expectIdentifier("function name");

        var typeParams = new ArrayList<String>();
        if (tokens.isOp("<")) {
            tokens.next();
            while (true) {
                typeParams.add(expectIdentifier("type parameter name"));
                if (tokens.isPunct(",")) {
                    tokens.next();
                } else if (tokens.isOp(">")) {
                    tokens.next();
                    break;
                } else {
                    throw tokens.error("Expected ',' or '>' in type parameters");
                }
            }
        }

        tokens.expectPunct("(");
        var params = new ArrayList<Param>();
        while (!atClosing(")")) {
            var paramName = expectIdentifier("parameter name");
            Type paramType;
            if (paramName.equals("self") && !tokens.isPunct(":")) {
                paramType = new Type.Named("Self");
            } else {
                tokens.expectPunct(":");
                paramType = parseType();
            }
            params.add(new Param(paramName, paramType));
            skipComma();
        }
        tokens.expectPunct(")");

        Optional<Type> returnType = Optional.empty();
        if (tokens.isOp("->")) {
            tokens.next();
            returnType = Optional.of(parseType());
        }

        var body = parseBlock();
        return new Stmt.FunctionDecl(name, typeParams, params, returnType, body, async, exported);
    }

    private Stmt parseStructDecl() throws ParseError {
        tokens.expectKeyword("def");
        var name = expectIdentifier("struct name");

        tokens.expectPunct("{");
        var fields = new ArrayList<FieldDecl>();
        while (!atClosing("}")) {
            var fieldName = expectIdentifier("field name");
            tokens.expectPunct(":");
            fields.add(new FieldDecl(fieldName, parseType()));
            skipComma();
        }
        tokens.expectPunct("}");

        return new Stmt.StructDecl(name, fields);
    }

    private Stmt parseEnumDecl() throws ParseError {
        tokens.expectKeyword("enum");
        var name = expectIdentifier("enum name");

        tokens.expectPunct("{");
        var variants = new ArrayList<EnumVariant>();
        while (!atClosing("}")) {
            var variantName = expectIdentifier("variant name");

            Optional<List<Type>> payload = Optional.empty();
            if (tokens.isPunct("(")) {
                tokens.next();
                var types = new ArrayList<Type>();
                while (!atClosing(")")) {
                    types.add(parseType());
                    skipComma();
                }
                tokens.expectPunct(")");
                payload = Optional.of(types);
            }

            variants.add(new EnumVariant(variantName, payload));
            skipComma();
        }
        tokens.expectPunct("}");

        return new Stmt.EnumDecl(name, variants);
    }

    private Stmt parseTraitDecl() throws ParseError {
        tokens.expectKeyword("trait");
        var name = expectIdentifier("trait name");

        tokens.expectPunct("{");
        var methods = new ArrayList<TraitMethod>();
        while (!atClosing("}")) {
            methods.add(parseTraitMethod());
        }
        tokens.expectPunct("}");

        return new Stmt.TraitDecl(name, methods);
    }

    private TraitMethod parseTraitMethod() throws ParseError {
        tokens.expectKeyword("fn");
        var name = expectIdentifier("method name");

        tokens.expectPunct("(");
        var params = new ArrayList<Param>();
        while (!atClosing(")")) {
            var paramName = expectIdentifier("parameter name");
            // An unannotated parameter (normally 'self') is typed by its own name
            var paramType = tokens.isPunct(":")
                ? annotatedType()
                : new Type.Named(paramName);
            params.add(new Param(paramName, paramType));
            skipComma();
        }
        tokens.expectPunct(")");

        tokens.expectOp("->");
        var returnType = parseType();

        if (tokens.isPunct(";")) {
            tokens.next();
            return new TraitMethod.Signature(name, params, returnType);
        }
        if (tokens.isPunct("{")) {
            return new TraitMethod.Default(name, params, returnType, parseBlock());
        }
        throw tokens.error("Expected ';' or '{' after trait method signature");
    }

    private Stmt parseImplBlock() throws ParseError {
        tokens.expectKeyword("impl");
        var firstName = expectIdentifier("type or trait name");

        Optional<String> traitName = Optional.empty();
        var typeName = firstName;
        if (tokens.isKeyword("for")) {
            tokens.next();
            traitName = Optional.of(firstName);
            typeName = expectIdentifier("type name");
        }

        tokens.expectPunct("{");
        var methods = new ArrayList<Stmt.FunctionDecl>();
        while (!atClosing("}")) {
            methods.add(parseFunctionDecl(false, false));
        }
        tokens.expectPunct("}");

        return new Stmt.ImplBlock(typeName, traitName, methods);
    }

    private Stmt parseIfStatement() throws ParseError {
        tokens.expectKeyword("if");
        tokens.expectPunct("(");
        var condition = parseExpression();
        tokens.expectPunct(")");

        var thenBranch = parseStatement();

        Optional<Stmt> elseBranch = Optional.empty();
        if (tokens.isKeyword("else")) {
            tokens.next();
            elseBranch = Optional.of(parseStatement());
        }

        return new Stmt.If(condition, thenBranch, elseBranch);
    }

    private Stmt parseWhileStatement() throws ParseError {
        tokens.expectKeyword("while");
        tokens.expectPunct("(");
        var condition = parseExpression();
        tokens.expectPunct(")");

        return new Stmt.While(condition, parseBlock());
    }

    private Stmt parseForStatement() throws ParseError {
        tokens.expectKeyword("for");
        var variable = expectIdentifier("variable name");
        tokens.expectKeyword("in");

        // The loop body brace must not be read as a struct literal on the iterable
        var iterable = parseExpressionWithoutStructLiteral();

        return new Stmt.For(variable, iterable, parseBlock());
    }

    private Stmt parseMatchStatement() throws ParseError {
        tokens.expectKeyword("match");
        var subject = parseExpressionWithoutStructLiteral();

        tokens.expectPunct("{");
        var arms = new ArrayList<MatchArm<Stmt>>();
        while (!atClosing("}")) {
            var pattern = parsePattern();
            tokens.expectOp("=>");
            arms.add(new MatchArm<>(pattern, parseStatement()));
            skipComma();
        }
        tokens.expectPunct("}");

        return new Stmt.Match(subject, arms);
    }

    private Stmt parseReturnStatement() throws ParseError {
        tokens.expectKeyword("return");

        Optional<Expr> value = Optional.empty();
        if (!atClosing(";") && !tokens.isPunct("}")) {
            value = Optional.of(parseExpression());
        }

        maybeConsumeSemicolon();
        return new Stmt.Return(value);
    }

    private Stmt.Block parseBlock() throws ParseError {
        tokens.expectPunct("{");
        var statements = new ArrayList<Stmt>();
        while (!atClosing("}")) {
            statements.add(parseStatement());
        }
        tokens.expectPunct("}");
        return new Stmt.Block(statements);
    }

    // Types

    /**
     * Parse a type: a name, optionally followed by {@code <T, ...>}.
     */
    public Type parseType() throws ParseError {
        var name = expectIdentifier("type name");

        if (!tokens.isOp("<")) {
            return new Type.Named(name);
        }
        tokens.next();

        var typeArgs = new ArrayList<Type>();
        while (true) {
            typeArgs.add(parseType());
            if (tokens.isPunct(",")) {
                tokens.next();
            } else if (tokens.isOp(">")) {
                tokens.next();
                break;
            } else if (tokens.atEnd()) {
                throw tokens.error("Unexpected EOF in generic type");
            } else {
                throw tokens.error("Expected ',' or '>' in generic type");
            }
        }
        return new Type.Generic(name, typeArgs);
    }

    private Optional<Type> optionalTypeAnnotation() throws ParseError {
        return tokens.isPunct(":")
            ? Optional.of(annotatedType())
            : Optional.empty();
    }

    private Type annotatedType() throws ParseError {
        tokens.expectPunct(":");
        return parseType();
    }

    // Expressions

    /**
     * Parse one expression. Tokens after it are left in place.
     */
    public Expr parseExpression() throws ParseError {
        return foldBinary(parsePostfix(parsePrimary(true), true), Precedence.LOWEST, true);
    }

    /**
     * Expression whose postfix chains never read {@code {} as a struct literal: match subjects,
     * loop iterables and array elements, which may be followed by an unrelated brace.
     */
    private Expr parseExpressionWithoutStructLiteral() throws ParseError {
        return foldBinary(parsePostfix(parsePrimary(false), false), Precedence.LOWEST, false);
    }

    // Precedence climbing; every right operand is a primary with its postfix chain
    private Expr foldBinary(Expr left, int minPrecedence, boolean structLiterals) throws ParseError {
        while (true) {
            var operator = peekBinaryOperator(minPrecedence);
            if (operator.isEmpty()) {
                return left;
            }
            tokens.next();

            var op = operator.get();
            var operand = parsePostfix(parsePrimary(structLiterals), structLiterals);
            var right = foldBinary(operand, Precedence.of(op).getAsInt() + 1, structLiterals);
            left = new Expr.BinOp(op, left, right);
        }
    }

    private Optional<String> peekBinaryOperator(int minPrecedence) throws ParseError {
        return tokens.peekToken()
                     .filter(Token.Op.class::isInstance)
                     .map(token -> ((Token.Op) token).symbol())
                     .filter(symbol -> Precedence.of(symbol).orElse(-1) >= minPrecedence);
    }

    private Expr parsePrimary(boolean structLiterals) throws ParseError {
        var next = tokens.peek();
        if (next.isEmpty()) {
            throw tokens.error("Unexpected end of input in expression");
        }
        var token = next.get().token();

        if (token instanceof Token.Number number) {
            tokens.next();
            return new Expr.NumberLiteral(number.value());
        }
        if (token instanceof Token.StringLiteral literal) {
            tokens.next();
            return new Expr.StringLiteral(literal.value());
        }
        if (token instanceof Token.TemplateStart) {
            tokens.next();
            return parseTemplateLiteral();
        }
        if (token instanceof Token.Ident ident) {
            tokens.next();
            if (tokens.isOp("=>")) {
                tokens.next();
                return parseLambdaBody(List.of(new LambdaParam(ident.name(), Optional.empty())));
            }
            return new Expr.Identifier(ident.name());
        }
        if (token instanceof Token.Keyword keyword) {
            switch (keyword.name()) {
                case "true", "false" -> {
                    tokens.next();
                    return new Expr.BooleanLiteral(keyword.name().equals("true"));
                }
                case "await" -> {
                    tokens.next();
                    return new Expr.Await(parsePrefixOperand(structLiterals));
                }
                case "async" -> {
                    tokens.next();
                    return new Expr.Async(parsePrefixOperand(structLiterals));
                }
                case "lazy" -> {
                    tokens.next();
                    return new Expr.Lazy(parsePrefixOperand(structLiterals));
                }
                case "match" -> {
                    tokens.next();
                    return parseMatchExpression();
                }
                default -> throw unexpectedInExpression(token);
            }
        }
        if (token instanceof Token.Punct punct) {
            switch (punct.symbol()) {
                case "(" -> {
                    tokens.next();
                    if (isLambdaParams()) {
                        return parseLambdaWithParens();
                    }
                    var expr = parseExpression();
                    tokens.expectPunct(")");
                    return expr;
                }
                case "[" -> {
                    tokens.next();
                    return parseArrayLiteral();
                }
                case "{" -> {
                    return new Expr.Block(parseBlock().statements());
                }
                default -> throw unexpectedInExpression(token);
            }
        }
        if (token instanceof Token.Op op && (op.symbol().equals("-") || op.symbol().equals("!"))) {
            tokens.next();
            return new Expr.UnaryOp(op.symbol(), parsePrefixOperand(structLiterals));
        }
        throw unexpectedInExpression(token);
    }

    private Expr parsePrefixOperand(boolean structLiterals) throws ParseError {
        return parsePostfix(parsePrimary(structLiterals), structLiterals);
    }

    private ParseError unexpectedInExpression(Token token) throws ParseError {
        return tokens.error("Unexpected token in expression: " + token.describe());
    }

    private Expr parsePostfix(Expr base, boolean structLiterals) throws ParseError {
        var expr = base;
        while (true) {
            if (tokens.isPunct("(")) {
                expr = parseCall(expr);
            } else if (tokens.isOp(".")) {
                tokens.next();
                expr = new Expr.FieldAccess(expr, expectFieldName());
            } else if (tokens.isPunct("[")) {
                tokens.next();
                var index = parseExpression();
                tokens.expectPunct("]");
                expr = new Expr.Index(expr, index);
            } else if (structLiterals && tokens.isPunct("{") && expr instanceof Expr.Identifier identifier) {
                expr = parseStructLiteral(identifier.name());
            } else if (tokens.isOp("?")) {
                tokens.next();
                expr = new Expr.Try(expr);
            } else {
                return expr;
            }
        }
    }

    private Expr parseCall(Expr callee) throws ParseError {
        tokens.expectPunct("(");
        var args = new ArrayList<Expr>();
        while (!atClosing(")")) {
            args.add(parseExpression());
            if (tokens.isPunct(",")) {
                tokens.next();
            } else if (!atClosing(")")) {
                throw tokens.error("Expected ',' or ')' in function call");
            }
        }
        tokens.expectPunct(")");
        return new Expr.Call(callee, args);
    }

    private Expr parseStructLiteral(String name) throws ParseError {
        tokens.expectPunct("{");
        var fields = new ArrayList<FieldInit>();
        while (!atClosing("}")) {
            var fieldName = expectIdentifier("field name");
            tokens.expectPunct(":");
            // Inside the braces a '{' after a value can only open a nested literal
            fields.add(new FieldInit(fieldName, parseExpression()));
            skipComma();
        }
        tokens.expectPunct("}");
        return new Expr.StructLiteral(name, fields);
    }

    // '[' already consumed
    private Expr parseArrayLiteral() throws ParseError {
        var elements = new ArrayList<Expr>();
        while (!atClosing("]")) {
            elements.add(parseExpressionWithoutStructLiteral());
            skipComma();
        }
        tokens.expectPunct("]");
        return new Expr.ArrayLiteral(elements);
    }

    // TemplateStart already consumed
    private Expr parseTemplateLiteral() throws ParseError {
        var parts = new ArrayList<TemplatePart>();
        while (true) {
            var next = tokens.peek();
            if (next.isEmpty()) {
                throw tokens.error("Unexpected end of input in template literal");
            }
            var token = next.get().token();

            if (token instanceof Token.TemplateString text) {
                tokens.next();
                parts.add(new TemplatePart.Text(text.text()));
            } else if (token instanceof Token.TemplateExprStart) {
                tokens.next();
                parts.add(new TemplatePart.Interpolation(parseExpression()));
                expectTemplateExprEnd();
            } else if (token instanceof Token.TemplateEnd) {
                tokens.next();
                return new Expr.TemplateLiteral(parts);
            } else {
                throw tokens.error("Unexpected token in template literal: " + token.describe());
            }
        }
    }

    private void expectTemplateExprEnd() throws ParseError {
        var next = tokens.peek();
        if (next.isEmpty()) {
            throw tokens.error("Unexpected end of input in template expression");
        }
        if (!(next.get().token() instanceof Token.TemplateExprEnd)) {
            throw tokens.error("Expected '}' after template expression, found " + next.get().token().describe());
        }
        tokens.next();
    }

    // 'match' already consumed
    private Expr parseMatchExpression() throws ParseError {
        var subject = parseExpressionWithoutStructLiteral();

        tokens.expectPunct("{");
        var arms = new ArrayList<MatchArm<Expr>>();
        while (!atClosing("}")) {
            var pattern = parsePattern();
            tokens.expectOp("=>");
            arms.add(new MatchArm<>(pattern, parseExpression()));
            skipComma();
        }
        tokens.expectPunct("}");

        return new Expr.Match(subject, arms);
    }

    // Patterns: literals and names with call and field-access postfixes, never struct literals
    private Expr parsePattern() throws ParseError {
        var pattern = parsePatternPrimary();
        while (true) {
            if (tokens.isPunct("(")) {
                tokens.next();
                var args = new ArrayList<Expr>();
                while (!atClosing(")")) {
                    args.add(parsePattern());
                    skipComma();
                }
                tokens.expectPunct(")");
                pattern = new Expr.Call(pattern, args);
            } else if (tokens.isOp(".")) {
                tokens.next();
                pattern = new Expr.FieldAccess(pattern, expectFieldName());
            } else {
                return pattern;
            }
        }
    }

    private Expr parsePatternPrimary() throws ParseError {
        var next = tokens.peek();
        if (next.isEmpty()) {
            throw tokens.error("Unexpected EOF in pattern");
        }
        var token = next.get().token();

        if (token instanceof Token.Number number) {
            tokens.next();
            return new Expr.NumberLiteral(number.value());
        }
        if (token instanceof Token.StringLiteral literal) {
            tokens.next();
            return new Expr.StringLiteral(literal.value());
        }
        if (token instanceof Token.Ident ident) {
            tokens.next();
            return new Expr.Identifier(ident.name());
        }
        if (isKeyword(token, "true") || isKeyword(token, "false")) {
            tokens.next();
            return new Expr.BooleanLiteral(isKeyword(token, "true"));
        }
        if (isPunct(token, "(")) {
            tokens.next();
            var pattern = parsePattern();
            tokens.expectPunct(")");
            return pattern;
        }
        throw tokens.error("Unexpected token in pattern: " + token.describe());
    }

    // Lambdas

    /**
     * Decide whether the tokens after an already consumed {@code (} form a lambda parameter list:
     * scan for the {@code )} closing it and check that {@code =>} follows. Every scanned lexeme is
     * pushed back before returning, so the cursor is left exactly as it was.
     */
    private boolean isLambdaParams() throws ParseError {
        var scanned = new ArrayList<Lexeme>();
        var previousSpan = tokens.lastSpan();
        int depth = 0;
        boolean arrow = false;

        try {
            while (scanned.size() < config.lambdaLookaheadLimit()) {
                var next = tokens.next();
                if (next.isEmpty()) {
                    break;
                }
                var token = next.get().token();
                scanned.add(next.get());

                if (isPunct(token, ")")) {
                    if (depth == 0) {
                        var after = tokens.next();
                        after.ifPresent(scanned::add);
                        arrow = after.filter(lexeme -> isOp(lexeme.token(), "=>"))
                                     .isPresent();
                        break;
                    }
                    depth--;
                } else if (isPunct(token, "(")) {
                    depth++;
                }
            }
        } finally {
            tokens.pushBackAll(scanned, previousSpan);
        }

        if (scanned.size() >= config.lambdaLookaheadLimit() && !arrow) {
            log.debug("Lambda lookahead gave up after {} token(s)", scanned.size());
        }
        return arrow;
    }

    // '(' already consumed and the parameter list confirmed
    private Expr parseLambdaWithParens() throws ParseError {
        var params = new ArrayList<LambdaParam>();
        while (!tokens.isPunct(")")) {
            var name = expectIdentifier("parameter name");
            params.add(new LambdaParam(name, optionalTypeAnnotation()));
            skipComma();
        }
        tokens.expectPunct(")");
        tokens.expectOp("=>");
        return parseLambdaBody(params);
    }

    private Expr parseLambdaBody(List<LambdaParam> params) throws ParseError {
        var body = tokens.isPunct("{")
            ? new Expr.Block(parseBlock().statements())
            : parseExpression();
        return new Expr.Lambda(params, Optional.empty(), body);
    }

    // Helpers

    private String expectIdentifier(String what) throws ParseError {
        var next = tokens.peek();
        if (next.isPresent() && next.get().token() instanceof Token.Ident ident) {
            tokens.next();
            return ident.name();
        }
        throw tokens.unexpected(what);
    }

    private String expectFieldName() throws ParseError {
        var next = tokens.peek();
        if (next.isPresent() && next.get().token() instanceof Token.Ident ident) {
            tokens.next();
            return ident.name();
        }
        throw tokens.error("Expected field name after '.'");
    }

    private boolean atClosing(String symbol) throws ParseError {
        return tokens.atEnd() || tokens.isPunct(symbol);
    }

    private void skipComma() throws ParseError {
        if (tokens.isPunct(",")) {
            tokens.next();
        }
    }

    private void maybeConsumeSemicolon() throws ParseError {
        if (tokens.isPunct(";")) {
            tokens.next();
        }
    }

    private static boolean isPunct(Token token, String symbol) {
        return token instanceof Token.Punct punct && punct.symbol().equals(symbol);
    }

    private static boolean isKeyword(Token token, String name) {
        return token instanceof Token.Keyword keyword && keyword.name().equals(name);
    }

    private static boolean isOp(Token token, String symbol) {
        return token instanceof Token.Op op && op.symbol().equals(symbol);
    }
}
