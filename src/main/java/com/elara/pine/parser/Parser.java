package com.elara.pine.parser;

import com.elara.pine.debug.Debug;
import com.elara.pine.parser.Expr.ArrayLiteral;
import com.elara.pine.parser.Expr.Assign;
import com.elara.pine.parser.Expr.Binary;
import com.elara.pine.parser.Expr.CallArg;
import com.elara.pine.parser.Expr.Conditional;
import com.elara.pine.parser.Expr.GetExpr;
import com.elara.pine.parser.Expr.IndexExpr;
import com.elara.pine.parser.Expr.Literal;
import com.elara.pine.parser.Expr.LiteralKind;
import com.elara.pine.parser.Expr.SwitchExpr;
import com.elara.pine.parser.Expr.Unary;
import com.elara.pine.parser.Expr.Variable;
import com.elara.pine.parser.Statement.Block;
import com.elara.pine.parser.Statement.BreakStmt;
import com.elara.pine.parser.Statement.ContinueStmt;
import com.elara.pine.parser.Statement.DeclKind;
import com.elara.pine.parser.Statement.ExprStmt;
import com.elara.pine.parser.Statement.ForInStmt;
import com.elara.pine.parser.Statement.ForStmt;
import com.elara.pine.parser.Statement.FunctionStmt;
import com.elara.pine.parser.Statement.If;
import com.elara.pine.parser.Statement.ImportStmt;
import com.elara.pine.parser.Statement.Param;
import com.elara.pine.parser.Statement.ReturnStmt;
import com.elara.pine.parser.Statement.Stmt;
import com.elara.pine.parser.Statement.SwitchCase;
import com.elara.pine.parser.Statement.SwitchStmt;
import com.elara.pine.parser.Statement.TypeStmt;
import com.elara.pine.parser.Statement.VarStmt;
import com.elara.pine.parser.Statement.While;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive-descent parser over the token stream produced by {@link Lexer}.
 *
 * Syntax errors never escape {@link #parse()}: each one unwinds to the enclosing statement loop,
 * is recorded, and the parser resynchronizes at the next statement boundary.
 */
public class Parser {
    public static final int DEFAULT_MAX_TOKEN_COUNT = 100_000;
    public static final int DEFAULT_MAX_RECURSION_DEPTH = 500;

    private static final String TAG = "Parser";
    private static final int MAX_PARAMETERS = 64;

    private static final Set<String> TYPE_KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "int", "float", "bool", "string", "color", "line", "label", "box", "table", "array", "map", "matrix")));
    private static final Set<String> TYPE_QUALIFIERS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "series", "simple")));
    private static final Set<String> ASSIGNMENT_OPERATORS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "=", ":=", "+=", "-=", "*=", "/=", "%=")));

    private final List<Token> tokens;
    private final int maxRecursionDepth;
    private final List<ParseError> errors = new ArrayList<>();
    private int current = 0;
    private int depth = 0;
    private int version = Program.DEFAULT_VERSION;

    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_TOKEN_COUNT, DEFAULT_MAX_RECURSION_DEPTH);
    }

    /**
     * @throws IllegalArgumentException when {@code tokens} exceeds {@code maxTokenCount};
     *         nothing is parsed in that case
     */
    public Parser(List<Token> tokens, int maxTokenCount, int maxRecursionDepth) {
        if (tokens.size() > maxTokenCount) {
            throw new IllegalArgumentException("Input too large: " + tokens.size()
                    + " tokens exceeds maximum of " + maxTokenCount);
        }
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type != TokenType.EOF) {
            throw new IllegalArgumentException("Token stream must end with EOF.");
        }
        this.tokens = tokens;
        this.maxRecursionDepth = maxRecursionDepth;
    }

    public void setVersion(Integer version) {
        this.version = (version == null) ? Program.DEFAULT_VERSION : version;
    }

    public ParseResult parse() {
        List<Stmt> body = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE, TokenType.DEDENT)) continue;
            try {
                body.add(declaration());
            } catch (ParseError e) {
                recover(e);
            }
        }
        return new ParseResult(new Program(body, version), errors);
    }

    private void recover(ParseError e) {
        errors.add(e);
        Debug.get().w(TAG, e.getMessage());
        synchronize();
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt declaration() {
        if (check(TokenType.INDENT)) return block();

        if (check(TokenType.KEYWORD)) {
            switch (peek().lexeme) {
                case "if": advance(); return ifStatement();
                case "for": advance(); return forStatement();
                case "while": advance(); return whileStatement();
                case "return": advance(); return returnStatement();
                case "break": advance(); endStatement(); return new BreakStmt();
                case "continue": advance(); endStatement(); return new ContinueStmt();
                case "var": case "varip": case "const": case "let":
                    return varDeclaration(declKind(advance()), false);
                case "switch": {
                    advance();
                    SwitchExpr sw = switchBody();
                    return new SwitchStmt(sw.discriminant, sw.cases);
                }
                case "type": advance(); return typeDefinition(false);
                case "import": advance(); return importStatement();
                case "export": advance(); return exportDeclaration();
                case "method": advance(); return functionDeclaration().withFlags(false, true);
                default:
                    break;
            }
        }

        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LPAREN) && isFunctionDeclaration()) {
            return functionDeclaration();
        }

        if (check(TokenType.IDENTIFIER) || check(TokenType.LBRACKET)) {
            Optional<Stmt> declared = tryParse(this::variableOrAssignment);
            if (declared.isPresent()) return declared.get();
        }

        return expressionStatement();
    }

    /**
     * Runs {@code alternative} from a checkpoint. A null result means "not this shape":
     * the position is restored and empty is returned. Syntax errors raised after the
     * alternative committed propagate unchanged.
     */
    private <T> Optional<T> tryParse(Supplier<T> alternative) {
        int checkpoint = current;
        T result = alternative.get();
        if (result == null) current = checkpoint;
        return Optional.ofNullable(result);
    }

    /**
     * {@code [type] name = e}, {@code [a, b] = e}, {@code name := e}, {@code a.b = e},
     * {@code name += e}. Returns null when the tokens do not have that shape.
     */
    private Stmt variableOrAssignment() {
        SourceLocation location = SourceLocation.of(peek());
        skipQualifier();
        TypeAnnotation type = looksLikeTypedName() ? typeAnnotation() : null;

        List<String> tupleNames = null;
        Expr.ExprInterface target;
        if (check(TokenType.LBRACKET)) {
            tupleNames = tupleNamesOrNull();
            if (tupleNames == null) return null;
            List<Expr.ExprInterface> elements = new ArrayList<>();
            for (String name : tupleNames) elements.add(new Variable(name, location));
            target = new ArrayLiteral(elements);
        } else {
            if (!check(TokenType.IDENTIFIER)) return null;
            Token first = advance();
            target = new Variable(first.lexeme, SourceLocation.of(first));
            while (check(TokenType.DOT) && checkNext(TokenType.IDENTIFIER)) {
                advance();
                target = new GetExpr(target, advance().lexeme);
            }
        }

        if (!check(TokenType.OPERATOR) || !ASSIGNMENT_OPERATORS.contains(peek().lexeme)) return null;
        String operator = advance().lexeme;

        Expr.ExprInterface value = expression();
        endStatement();

        boolean declares = operator.equals("=") && !(target instanceof GetExpr);
        if (!declares) {
            return new ExprStmt(new Assign(target, operator, value));
        }
        if (tupleNames != null) {
            return new VarStmt(tupleNames, true, value, DeclKind.LET, type, false, location);
        }
        return new VarStmt(Collections.singletonList(((Variable) target).name), false, value,
                DeclKind.LET, type, false, location);
    }

    /** Reads {@code [a, b, ...]}; null (position unspecified) when the bracket is not a name list. */
    private List<String> tupleNamesOrNull() {
        advance(); // '['
        List<String> names = new ArrayList<>();
        do {
            if (!check(TokenType.IDENTIFIER)) return null;
            names.add(advance().lexeme);
        } while (match(TokenType.COMMA));
        if (!match(TokenType.RBRACKET)) return null;
        return names;
    }

    private Stmt varDeclaration(DeclKind kind, boolean exported) {
        SourceLocation location = SourceLocation.of(previous());
        skipQualifier();
        TypeAnnotation type = looksLikeTypedName() ? typeAnnotation() : null;

        List<String> names;
        boolean tuple = false;
        if (match(TokenType.LBRACKET)) {
            names = new ArrayList<>();
            do {
                names.add(consume(TokenType.IDENTIFIER, "Expect variable name in tuple.").lexeme);
            } while (match(TokenType.COMMA));
            consume(TokenType.RBRACKET, "Expect ']' after tuple names.");
            tuple = true;
        } else {
            names = Collections.singletonList(consume(TokenType.IDENTIFIER, "Expect variable name.").lexeme);
        }

        consumeOperator("=", "Expect '=' after variable name.");
        Expr.ExprInterface initializer = expression();
        endStatement();
        return new VarStmt(names, tuple, initializer, kind, type, exported, location);
    }

    private DeclKind declKind(Token keyword) {
        switch (keyword.lexeme) {
            case "var": return DeclKind.VAR;
            case "varip": return DeclKind.VARIP;
            case "const": return DeclKind.CONST;
            default: return DeclKind.LET;
        }
    }

    /** Scans {@code name( ... )} for a trailing {@code =>} without consuming anything. */
    private boolean isFunctionDeclaration() {
        int p = current + 1;
        int parens = 0;
        while (p < tokens.size()) {
            TokenType type = tokens.get(p).type;
            if (type == TokenType.LPAREN) {
                parens++;
            } else if (type == TokenType.RPAREN) {
                parens--;
                if (parens == 0) return tokenAt(p + 1).is(TokenType.OPERATOR, "=>");
            } else if (type == TokenType.EOF || type == TokenType.NEWLINE) {
                return false;
            }
            p++;
        }
        return false;
    }

    private FunctionStmt functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LPAREN, "Expect '(' after function name.");

        List<Param> params = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                if (params.size() >= MAX_PARAMETERS) {
                    throw error(peek(), "Too many parameters (max " + MAX_PARAMETERS + ").");
                }
                params.add(parameter());
            } while (match(TokenType.COMMA));
        }

        consume(TokenType.RPAREN, "Expect ')' after parameters.");
        consumeOperator("=>", "Expect '=>' after parameters.");
        return new FunctionStmt(name.lexeme, params, functionBody(), false, false);
    }

    private Param parameter() {
        skipQualifier();
        TypeAnnotation type = looksLikeTypedName() ? typeAnnotation() : null;
        Token name = consume(TokenType.IDENTIFIER, "Expect parameter name.");
        if (matchOperator("=")) {
            expression(); // default values are not carried into the output
        }
        return new Param(name.lexeme, type);
    }

    private Block functionBody() {
        if (match(TokenType.NEWLINE)) return block();
        Expr.ExprInterface value = expression();
        endStatement();
        return new Block(Collections.singletonList(new ReturnStmt(value)));
    }

    private Block block() {
        consume(TokenType.INDENT, "Expect indented block.");
        enter();
        try {
            List<Stmt> statements = new ArrayList<>();
            while (!check(TokenType.DEDENT) && !isAtEnd()) {
                if (match(TokenType.NEWLINE)) continue;
                try {
                    statements.add(declaration());
                } catch (ParseError e) {
                    recover(e);
                }
            }
            consume(TokenType.DEDENT, "Expect end of indented block.");
            return new Block(statements);
        } finally {
            depth--;
        }
    }

    private Stmt ifStatement() {
        Expr.ExprInterface condition = expression();
        match(TokenType.NEWLINE);
        Block thenBranch = block();

        Stmt elseBranch = null;
        if (matchKeyword("else")) {
            if (matchKeyword("if")) {
                elseBranch = ifStatement();
            } else {
                match(TokenType.NEWLINE);
                elseBranch = block();
            }
        }
        return new If(condition, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        Expr.ExprInterface condition = expression();
        match(TokenType.NEWLINE);
        return new While(condition, block());
    }

    // for i = a to b [by s]
    // for x in xs
    // for [i, x] in xs
    private Stmt forStatement() {
        if (match(TokenType.LBRACKET)) {
            List<String> names = new ArrayList<>();
            do {
                names.add(consume(TokenType.IDENTIFIER, "Expect loop variable name.").lexeme);
            } while (match(TokenType.COMMA));
            consume(TokenType.RBRACKET, "Expect ']' after loop variables.");
            consumeKeyword("in", "Expect 'in' after loop variables.");
            return forInRest(names, true);
        }

        Token variable = consume(TokenType.IDENTIFIER, "Expect loop variable name.");
        if (matchKeyword("in")) {
            return forInRest(Collections.singletonList(variable.lexeme), false);
        }

        consumeOperator("=", "Expect '=' after loop variable.");
        Expr.ExprInterface from = expression();
        consumeWord("to", "Expect 'to' after loop start value.");
        Expr.ExprInterface to = expression();
        Expr.ExprInterface step = matchWord("by") ? expression() : null;
        match(TokenType.NEWLINE);
        Block body = block();

        SourceLocation location = SourceLocation.of(variable);
        Assign init = new Assign(new Variable(variable.lexeme, location), "=", from);
        String comparison = isNegativeLiteral(step) ? ">=" : "<=";
        Expr.ExprInterface test = new Binary(new Variable(variable.lexeme, location), comparison, to);
        return new ForStmt(init, test, step, body);
    }

    private Stmt forInRest(List<String> names, boolean tuple) {
        Expr.ExprInterface iterable = expression();
        match(TokenType.NEWLINE);
        return new ForInStmt(names, tuple, iterable, block());
    }

    private static boolean isNegativeLiteral(Expr.ExprInterface step) {
        if (!(step instanceof Unary)) return false;
        Unary unary = (Unary) step;
        return unary.operator.equals("-") && unary.right instanceof Literal
                && ((Literal) unary.right).kind == LiteralKind.NUMBER;
    }

    private Stmt returnStatement() {
        Expr.ExprInterface value = null;
        if (!check(TokenType.NEWLINE) && !check(TokenType.DEDENT) && !isAtEnd()) {
            value = expression();
        }
        endStatement();
        return new ReturnStmt(value);
    }

    /** Shared by switch statements and switch expressions; the {@code switch} keyword is already consumed. */
    private SwitchExpr switchBody() {
        Expr.ExprInterface discriminant = check(TokenType.NEWLINE) ? null : expression();
        consume(TokenType.NEWLINE, "Expect newline after switch header.");
        consume(TokenType.INDENT, "Expect indented switch cases.");

        List<SwitchCase> cases = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (match(TokenType.NEWLINE)) continue;
            Expr.ExprInterface test = checkOperator("=>") ? null : expression();
            consumeOperator("=>", "Expect '=>' after switch case.");
            Block body;
            if (match(TokenType.NEWLINE)) {
                body = block();
            } else {
                Expr.ExprInterface value = expression();
                endStatement();
                body = new Block(Collections.singletonList(new ExprStmt(value)));
            }
            cases.add(new SwitchCase(test, body));
        }
        consume(TokenType.DEDENT, "Expect end of switch cases.");
        return new SwitchExpr(discriminant, cases);
    }

    private Stmt typeDefinition(boolean exported) {
        Token name = consume(TokenType.IDENTIFIER, "Expect type name.");
        consume(TokenType.NEWLINE, "Expect newline after type name.");
        consume(TokenType.INDENT, "Expect indented field list.");

        List<VarStmt> fields = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (match(TokenType.NEWLINE)) continue;
            SourceLocation location = SourceLocation.of(peek());
            skipQualifier();
            TypeAnnotation type = looksLikeTypedName() ? typeAnnotation() : null;
            Token field = consume(TokenType.IDENTIFIER, "Expect field name.");
            Expr.ExprInterface defaultValue = matchOperator("=") ? expression() : null;
            endStatement();
            fields.add(new VarStmt(Collections.singletonList(field.lexeme), false, defaultValue,
                    DeclKind.LET, type, false, location));
        }
        consume(TokenType.DEDENT, "Expect end of field list.");
        return new TypeStmt(name.lexeme, fields, exported);
    }

    // import "path" [as alias]
    // import user/lib/1 [as alias]
    private Stmt importStatement() {
        String path;
        if (match(TokenType.STRING)) {
            path = (String) previous().literal;
        } else {
            StringBuilder sb = new StringBuilder();
            while (!check(TokenType.NEWLINE) && !isAtEnd() && !checkWord("as")) {
                sb.append(advance().lexeme);
            }
            if (sb.length() == 0) throw error(peek(), "Expect import path.");
            path = sb.toString();
        }
        String alias = null;
        if (matchWord("as")) {
            alias = consume(TokenType.IDENTIFIER, "Expect alias name after 'as'.").lexeme;
        }
        endStatement();
        return new ImportStmt(path, alias);
    }

    private Stmt exportDeclaration() {
        if (matchKeyword("type")) return typeDefinition(true);
        if (checkKeyword("var") || checkKeyword("varip") || checkKeyword("const") || checkKeyword("let")) {
            return varDeclaration(declKind(advance()), true);
        }
        if (matchKeyword("method")) return functionDeclaration().withFlags(true, true);
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LPAREN) && isFunctionDeclaration()) {
            return functionDeclaration().withFlags(true, false);
        }
        if (check(TokenType.IDENTIFIER)) {
            Optional<Stmt> declared = tryParse(this::variableOrAssignment);
            if (declared.isPresent() && declared.get() instanceof VarStmt) {
                return ((VarStmt) declared.get()).exportedCopy();
            }
        }
        throw error(peek(), "Unexpected export target.");
    }

    private Stmt expressionStatement() {
        Expr.ExprInterface expr = expression();
        endStatement();
        return new ExprStmt(expr);
    }

    /** A statement ends at NEWLINE, before DEDENT/EOF, or right after a nested block closed. */
    private void endStatement() {
        if (match(TokenType.NEWLINE)) return;
        if (check(TokenType.DEDENT) || isAtEnd()) return;
        if (current > 0 && previous().type == TokenType.DEDENT) return;
        throw error(peek(), "Expected newline after statement.");
    }

    // -------------------------
    // Types
    // -------------------------

    private void skipQualifier() {
        if (check(TokenType.IDENTIFIER) && TYPE_QUALIFIERS.contains(peek().lexeme)
                && checkNext(TokenType.IDENTIFIER)) {
            advance();
        }
    }

    /** True when the upcoming tokens are a type followed by a name, e.g. {@code array<float> xs}. */
    private boolean looksLikeTypedName() {
        int after = scanType(current);
        return after > 0 && tokenAt(after).type == TokenType.IDENTIFIER;
    }

    /** Index just past a type starting at {@code p}, or -1 when there is no type there. */
    private int scanType(int p) {
        if (tokenAt(p).type != TokenType.IDENTIFIER) return -1;
        p++;
        if (tokenAt(p).is(TokenType.OPERATOR, "<")) {
            p++;
            while (true) {
                p = scanType(p);
                if (p < 0) return -1;
                if (tokenAt(p).type == TokenType.COMMA) {
                    p++;
                } else if (tokenAt(p).is(TokenType.OPERATOR, ">")) {
                    p++;
                    break;
                } else {
                    return -1;
                }
            }
        }
        if (tokenAt(p).type == TokenType.LBRACKET && tokenAt(p + 1).type == TokenType.RBRACKET) p += 2;
        return p;
    }

    private TypeAnnotation typeAnnotation() {
        String name = consume(TokenType.IDENTIFIER, "Expect type name.").lexeme;
        List<TypeAnnotation> arguments = new ArrayList<>();
        if (matchOperator("<")) {
            do {
                arguments.add(typeAnnotation());
            } while (match(TokenType.COMMA));
            consumeOperator(">", "Expect '>' after type arguments.");
        }
        TypeAnnotation type = new TypeAnnotation(name, arguments);
        if (check(TokenType.LBRACKET) && checkNext(TokenType.RBRACKET)) {
            advance();
            advance();
            type = new TypeAnnotation("array", Collections.singletonList(type));
        }
        return type;
    }

    /**
     * {@code <} starts generic type arguments only for {@code f<int>(...)} shapes: a type keyword
     * (or a name directly followed by {@code >}) and a closing {@code >} followed by {@code (}.
     */
    private boolean isGenericCall() {
        Token first = tokenAt(current + 1);
        if (first.type != TokenType.IDENTIFIER) return false;
        boolean plausible = TYPE_KEYWORDS.contains(first.lexeme)
                || tokenAt(current + 2).is(TokenType.OPERATOR, ">");
        if (!plausible) return false;

        int p = current + 1;
        while (true) {
            p = scanType(p);
            if (p < 0) return false;
            if (tokenAt(p).type == TokenType.COMMA) {
                p++;
            } else if (tokenAt(p).is(TokenType.OPERATOR, ">")) {
                return tokenAt(p + 1).type == TokenType.LPAREN;
            } else {
                return false;
            }
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    private Expr.ExprInterface expression() {
        enter();
        try {
            return ternary();
        } finally {
            depth--;
        }
    }

    private void enter() {
        if (++depth > maxRecursionDepth) {
            depth--;
            throw error(peek(), "Maximum recursion depth (" + maxRecursionDepth
                    + ") exceeded. Expression is too deeply nested.");
        }
    }

    private Expr.ExprInterface ternary() {
        Expr.ExprInterface condition = or();
        if (matchOperator("?")) {
            enter();
            try {
                Expr.ExprInterface thenValue = ternary();
                consume(TokenType.COLON, "Expect ':' in conditional expression.");
                Expr.ExprInterface elseValue = ternary();
                return new Conditional(condition, thenValue, elseValue);
            } finally {
                depth--;
            }
        }
        return condition;
    }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        int levels = 0;
        try {
            while (matchOperator("or")) {
                enter();
                levels++;
                expr = new Binary(expr, "or", and());
            }
            return expr;
        } finally {
            depth -= levels;
        }
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = equality();
        int levels = 0;
        try {
            while (matchOperator("and")) {
                enter();
                levels++;
                expr = new Binary(expr, "and", equality());
            }
            return expr;
        } finally {
            depth -= levels;
        }
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        int levels = 0;
        try {
            while (matchOperator("==", "!=")) {
                String op = previous().lexeme;
                enter();
                levels++;
                expr = new Binary(expr, op, comparison());
            }
            return expr;
        } finally {
            depth -= levels;
        }
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        int levels = 0;
        try {
            while (matchOperator(">", "<", ">=", "<=")) {
                String op = previous().lexeme;
                enter();
                levels++;
                expr = new Binary(expr, op, term());
            }
            return expr;
        } finally {
            depth -= levels;
        }
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        int levels = 0;
        try {
            while (matchOperator("+", "-")) {
                String op = previous().lexeme;
                enter();
                levels++;
                expr = new Binary(expr, op, factor());
            }
            return expr;
        } finally {
            depth -= levels;
        }
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        int levels = 0;
        try {
            while (matchOperator("*", "/", "%")) {
                String op = previous().lexeme;
                enter();
                levels++;
                expr = new Binary(expr, op, unary());
            }
            return expr;
        } finally {
            depth -= levels;
        }
    }

    private Expr.ExprInterface unary() {
        if (matchOperator("not", "-", "+")) {
            String op = previous().lexeme;
            enter();
            try {
                return new Unary(op, unary());
            } finally {
                depth--;
            }
        }
        return call();
    }

    private Expr.ExprInterface call() {
        Expr.ExprInterface expr = primary();
        int levels = 0;
        try {
            while (true) {
                if (check(TokenType.LPAREN) || check(TokenType.DOT) || check(TokenType.LBRACKET)
                        || (checkOperator("<") && isGenericCall())) {
                    enter();
                    levels++;
                }
                if (match(TokenType.LPAREN)) {
                    expr = finishCall(expr, Collections.<TypeAnnotation>emptyList());
                } else if (checkOperator("<") && isGenericCall()) {
                    advance();
                    List<TypeAnnotation> typeArguments = new ArrayList<>();
                    do {
                        typeArguments.add(typeAnnotation());
                    } while (match(TokenType.COMMA));
                    consumeOperator(">", "Expect '>' after type arguments.");
                    consume(TokenType.LPAREN, "Expect '(' after type arguments.");
                    expr = finishCall(expr, typeArguments);
                } else if (match(TokenType.DOT)) {
                    Token name = consume(TokenType.IDENTIFIER, "Expect property name after '.'.");
                    expr = new GetExpr(expr, name.lexeme);
                } else if (match(TokenType.LBRACKET)) {
                    Expr.ExprInterface index = expression();
                    consume(TokenType.RBRACKET, "Expect ']' after index.");
                    expr = new IndexExpr(expr, index);
                } else {
                    break;
                }
            }
            return expr;
        } finally {
            depth -= levels;
        }
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee, List<TypeAnnotation> typeArguments) {
        SourceLocation location = SourceLocation.of(previous());
        List<CallArg> arguments = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                arguments.add(callArg());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expect ')' after arguments.");
        return new Expr.Call(callee, arguments, typeArguments, location);
    }

    private CallArg callArg() {
        if (check(TokenType.IDENTIFIER) && tokenAt(current + 1).is(TokenType.OPERATOR, "=")) {
            String name = advance().lexeme;
            advance(); // '='
            return new CallArg(name, expression());
        }
        return new CallArg(null, expression());
    }

    private Expr.ExprInterface primary() {
        Token token = peek();
        SourceLocation location = SourceLocation.of(token);

        if (matchKeyword("switch")) return switchBody();
        if (match(TokenType.NUMBER)) return new Literal(token.literal, token.lexeme, LiteralKind.NUMBER, location);
        if (match(TokenType.STRING)) return new Literal(token.literal, token.lexeme, LiteralKind.STRING, location);
        if (match(TokenType.BOOLEAN)) return new Literal(token.literal, token.lexeme, LiteralKind.BOOLEAN, location);
        if (match(TokenType.COLOR)) return new Literal(token.literal, token.lexeme, LiteralKind.COLOR, location);
        if (check(TokenType.NA) && tokenAt(current + 1).type == TokenType.LPAREN) {
            // na(x) is the test function, not the value
            advance();
            return new Variable("na", location);
        }
        if (match(TokenType.NA)) return new Literal(null, "na", LiteralKind.NA, location);
        if (match(TokenType.IDENTIFIER)) return new Variable(token.lexeme, location);

        if (match(TokenType.LPAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RPAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LBRACKET)) {
            List<Expr.ExprInterface> elements = new ArrayList<>();
            if (!check(TokenType.RBRACKET)) {
                do {
                    elements.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RBRACKET, "Expect ']' after array elements.");
            return new ArrayLiteral(elements);
        }

        throw error(token, "Expect expression.");
    }

    // -------------------------
    // Recovery
    // -------------------------

    private void synchronize() {
        // a DEDENT is left for the enclosing block loop to close on
        if (!check(TokenType.DEDENT)) advance();
        while (!isAtEnd()) {
            if (previous().type == TokenType.NEWLINE) return;
            switch (peek().type) {
                case KEYWORD:
                case RBRACE:
                case RPAREN:
                case RBRACKET:
                case DEDENT:
                    return;
                default:
                    advance();
            }
        }
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean matchOperator(String... lexemes) {
        if (!check(TokenType.OPERATOR)) return false;
        for (String lexeme : lexemes) {
            if (peek().lexeme.equals(lexeme)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean checkOperator(String lexeme) { return peek().is(TokenType.OPERATOR, lexeme); }

    private boolean checkKeyword(String keyword) { return peek().is(TokenType.KEYWORD, keyword); }

    private boolean matchKeyword(String keyword) {
        if (!checkKeyword(keyword)) return false;
        advance();
        return true;
    }

    // 'to', 'by' and 'as' are contextual: they lex as identifiers
    private boolean checkWord(String word) { return peek().is(TokenType.IDENTIFIER, word); }

    private boolean matchWord(String word) {
        if (!checkWord(word)) return false;
        advance();
        return true;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private void consumeOperator(String lexeme, String message) {
        if (!matchOperator(lexeme)) throw error(peek(), message);
    }

    private void consumeKeyword(String keyword, String message) {
        if (!matchKeyword(keyword)) throw error(peek(), message);
    }

    private void consumeWord(String word, String message) {
        if (!matchWord(word)) throw error(peek(), message);
    }

    private boolean check(TokenType type) { return peek().type == type; }

    private boolean checkNext(TokenType type) { return tokenAt(current + 1).type == type; }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private Token tokenAt(int index) {
        return (index < tokens.size()) ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    private ParseError error(Token token, String message) {
        return new ParseError(message, token.line, token.column, token.lexeme);
    }
}
