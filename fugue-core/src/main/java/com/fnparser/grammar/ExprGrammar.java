package com.fnparser.grammar;

import com.fnparser.ParseError;
import com.fnparser.ParserSource;
import com.fnparser.ReplLine;
import com.fnparser.Token;
import com.fnparser.TokenSource;
import com.fnparser.TokenType;
import com.fnparser.ast.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent grammar over the layout-processed token stream.
 *
 * <p>Nodes are allocated in the caller's {@link Arena}. Recoverable errors (bad statements,
 * semantic action failures, error tokens from the stream) are appended to the error sink and
 * parsing continues; an error at the end of input is thrown as a {@link GrammarException}.</p>
 *
 * <p>Every indented block becomes a {@link BlockExpression}, even when it holds a single
 * expression, and a {@code let}, {@code type} or {@code do} statement takes the rest of its block
 * as its body.</p>
 */
public class ExprGrammar {

    private static final List<String> EXPRESSION_START = terminals(
        TokenType.IDENTIFIER, TokenType.INT, TokenType.BYTE, TokenType.FLOAT, TokenType.STRING,
        TokenType.CHAR, TokenType.LPAREN, TokenType.LBRACKET, TokenType.LBRACE, TokenType.BACKSLASH,
        TokenType.IF, TokenType.MATCH, TokenType.LET);
    private static final List<String> PATTERN_START = terminals(
        TokenType.IDENTIFIER, TokenType.INT, TokenType.BYTE, TokenType.FLOAT, TokenType.STRING,
        TokenType.CHAR, TokenType.LPAREN, TokenType.LBRACE);
    private static final List<String> STATEMENT_END = terminals(
        TokenType.OPERATOR, TokenType.SEPARATOR, TokenType.CLOSE_BLOCK);

    private record Lookahead(Token token, String doc) {
    }

    private final ParserSource source;
    private final TypeCache typeCache;
    private final Arena arena;
    private final IdentEnv env;
    private final List<GrammarError> errors;
    private final TempVecs temps;
    private final TokenSource tokens;

    private final List<Lookahead> buffer = new ArrayList<>();
    private final StringBuilder pendingDoc = new StringBuilder();
    private boolean sawEof = false;

    private Token previous;
    private int lastEnd;
    private int blockDepth = 0;

    public ExprGrammar(ParserSource source, TypeCache typeCache, Arena arena, IdentEnv env,
                       List<GrammarError> errors, TempVecs temps, TokenSource tokens) {
        this.source = source;
        this.typeCache = typeCache;
        this.arena = arena;
        this.env = env;
        this.errors = errors;
        this.temps = temps;
        this.tokens = tokens;
        this.lastEnd = source.startIndex();
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    /**
     * Parses a whole source as one expression. Returns the (possibly partial) tree; throws when
     * the input ends before a tree could be built.
     */
    public Expression parseExpression() {
        int start = peek().start();
        consumeBlockStart();
        Expression body = statements(start, null);
        consume(TokenType.CLOSE_BLOCK, STATEMENT_END);
        finish();
        return body;
    }

    /**
     * Parses a REPL line: empty input, a single {@code let} binding, or an expression.
     */
    public Optional<ReplLine> parseReplLine() {
        if (check(TokenType.EOF)) {
            return Optional.empty();
        }
        int start = peek().start();
        consumeBlockStart();

        Expression first = null;
        if (check(TokenType.LET) || check(TokenType.ATTRIBUTE_OPEN)) {
            int depth = blockDepth;
            try {
                Metadata metadata = metadata();
                consume(TokenType.LET, terminals(TokenType.LET));
                ValueBinding binding = valueBinding(metadata, start);
                if (match(TokenType.CLOSE_BLOCK)) {
                    finish();
                    return Optional.of(new ReplLine.LetLine(binding));
                }
                first = letBody(start, binding);
                expectStatementEnd();
            } catch (GrammarException e) {
                first = recover(e, start, depth);
            }
        }

        Expression expression = statements(start, first);
        consume(TokenType.CLOSE_BLOCK, STATEMENT_END);
        finish();
        return Optional.of(new ReplLine.ExprLine(expression));
    }

    // ========================================================================
    // Blocks and statements
    // ========================================================================

    /**
     * Statements up to, but not including, the closing token of the current block.
     * {@code first} is a statement the caller already parsed, or null.
     */
    private Expression statements(int start, Expression first) {
        List<Expression> body = temps.pop(Expression.class);
        try {
            boolean more = true;
            if (first != null) {
                body.add(first);
                more = matchSeparator();
            }
            while (more) {
                body.add(recoveringStatement());
                more = matchSeparator();
            }
            return arena.alloc(new BlockExpression(start, end(start), List.copyOf(body)));
        } finally {
            temps.push(Expression.class, body);
        }
    }

    private Expression recoveringStatement() {
        int start = peek().start();
        int depth = blockDepth;
        try {
            Expression statement = statement();
            expectStatementEnd();
            return statement;
        } catch (GrammarException e) {
            return recover(e, start, depth);
        }
    }

    private Expression recover(GrammarException e, int start, int depth) {
        if (e.isEndOfInput()) {
            throw e;
        }
        errors.add(e.error());
        while (!check(TokenType.EOF)) {
            Token t = peek();
            if (blockDepth <= depth && (t.type() == TokenType.SEPARATOR || t.type() == TokenType.CLOSE_BLOCK)) {
                break;
            }
            advance();
        }
        return arena.alloc(new ErrorExpression(start, Math.max(start, lastEnd)));
    }

    private Expression statement() {
        int start = peek().start();
        switch (peek().type()) {
            case LET:
            case TYPE:
            case ATTRIBUTE_OPEN: {
                Metadata metadata = metadata();
                if (match(TokenType.TYPE)) {
                    return typeStatement(start, metadata);
                }
                consume(TokenType.LET, terminals(TokenType.LET, TokenType.TYPE));
                return letBody(start, valueBinding(metadata, start));
            }
            case DO:
                advance();
                return doStatement(start);
            default:
                return expression();
        }
    }

    /**
     * The part after a binding: {@code in expr}, or a separator and the rest of the block.
     */
    private Expression letBody(int start, ValueBinding binding) {
        Expression body = bindingBody();
        return arena.alloc(new LetExpression(start, body.end(), List.of(binding), body));
    }

    private Expression bindingBody() {
        if (match(TokenType.IN)) {
            return body();
        }
        if (matchSeparator()) {
            return statements(peek().start(), null);
        }
        throw unexpected(terminals(TokenType.IN, TokenType.SEPARATOR));
    }

    private Expression typeStatement(int start, Metadata metadata) {
        Identifier name = identifier();
        List<Identifier> parameters = temps.pop(Identifier.class);
        try {
            while (check(TokenType.IDENTIFIER)) {
                parameters.add(identifier());
            }
            consume(TokenType.EQUALS, terminals(TokenType.IDENTIFIER, TokenType.EQUALS));
            AstType definition;
            if (match(TokenType.OPEN_BLOCK)) {
                definition = typeDefinition();
                consume(TokenType.CLOSE_BLOCK, terminals(TokenType.PIPE, TokenType.CLOSE_BLOCK));
            } else {
                definition = typeDefinition();
            }
            TypeBinding binding = arena.alloc(new TypeBinding(start, definition.end(), metadata, name,
                List.copyOf(parameters), definition));
            Expression body = bindingBody();
            return arena.alloc(new TypeExpression(start, body.end(), List.of(binding), body));
        } finally {
            temps.push(Identifier.class, parameters);
        }
    }

    private Expression doStatement(int start) {
        Pattern binding = null;
        if (doBindsPattern()) {
            binding = pattern();
            consume(TokenType.EQUALS, terminals(TokenType.EQUALS));
        }
        Expression bound = body();
        if (!matchSeparator()) {
            throw unexpected(terminals(TokenType.SEPARATOR));
        }
        Expression rest = statements(peek().start(), null);
        return arena.alloc(new DoExpression(start, rest.end(), binding, bound, rest));
    }

    // `do pat = expr` has an `=` before the end of the statement
    private boolean doBindsPattern() {
        int depth = 0;
        for (int i = 0; ; i++) {
            TokenType type = la(i).token().type();
            if (type == TokenType.EOF) {
                return false;
            }
            if (depth == 0 && (type == TokenType.SEPARATOR || type == TokenType.CLOSE_BLOCK
                || type == TokenType.OPEN_BLOCK)) {
                return false;
            }
            if (depth == 0 && type == TokenType.EQUALS) {
                return true;
            }
            if (type.isOpener()) {
                depth++;
            } else if (type.isCloser()) {
                depth--;
            }
        }
    }

    // ========================================================================
    // Bindings
    // ========================================================================

    private Metadata metadata() {
        String comment = peekDoc();
        List<Attribute> attributes = new ArrayList<>();
        while (check(TokenType.ATTRIBUTE_OPEN)) {
            advance();
            Token name = consume(TokenType.IDENTIFIER, terminals(TokenType.IDENTIFIER));
            String arguments = null;
            if (match(TokenType.LPAREN)) {
                arguments = rawArguments();
            }
            consume(TokenType.RBRACKET, terminals(TokenType.LPAREN, TokenType.RBRACKET));
            attributes.add(new Attribute(name.lexeme(), arguments));
            if (comment == null) {
                comment = peekDoc();
            }
        }
        if (comment == null && attributes.isEmpty()) {
            return Metadata.EMPTY;
        }
        return new Metadata(comment, attributes);
    }

    // Source text between the attribute's parentheses, consuming the closing `)`
    private String rawArguments() {
        int from = peek().start();
        int to = from;
        int depth = 0;
        while (true) {
            Token t = peek();
            if (t.type() == TokenType.EOF) {
                throw unexpected(terminals(TokenType.RPAREN));
            }
            if (t.type() == TokenType.RPAREN && depth == 0) {
                advance();
                break;
            }
            if (t.type() == TokenType.LPAREN) {
                depth++;
            } else if (t.type() == TokenType.RPAREN) {
                depth--;
            }
            advance();
            if (!t.isVirtual()) {
                to = t.end();
            }
        }
        int offset = source.startIndex();
        return source.src().substring(from - offset, Math.max(from, to) - offset);
    }

    private ValueBinding valueBinding(Metadata metadata, int start) {
        Pattern name;
        List<Identifier> parameters = temps.pop(Identifier.class);
        try {
            Token t = peek();
            if (t.type() == TokenType.IDENTIFIER && !isConstructorName(t) && !isAsPattern()) {
                Identifier ident = identifier();
                name = arena.alloc(new IdentifierPattern(ident.start(), ident.end(), ident.ident()));
                collectParameters(parameters);
            } else if (isParenthesizedOperator()) {
                Identifier op = parenthesizedOperator();
                name = arena.alloc(new IdentifierPattern(op.start(), op.end(), op.ident()));
                collectParameters(parameters);
            } else {
                name = pattern();
            }

            AstType typ = null;
            if (match(TokenType.COLON)) {
                typ = type();
            }
            consume(TokenType.EQUALS, terminals(TokenType.IDENTIFIER, TokenType.COLON, TokenType.EQUALS));
            Expression expression = body();
            return arena.alloc(new ValueBinding(start, expression.end(), metadata, name,
                List.copyOf(parameters), typ, expression));
        } finally {
            temps.push(Identifier.class, parameters);
        }
    }

    private void collectParameters(List<Identifier> parameters) {
        while (check(TokenType.IDENTIFIER)) {
            parameters.add(identifier());
        }
    }

    private AstType typeDefinition() {
        if (!check(TokenType.PIPE)) {
            return type();
        }
        int start = peek().start();
        List<Variant> variants = new ArrayList<>();
        while (match(TokenType.PIPE)) {
            Identifier name = identifier();
            List<AstType> arguments = new ArrayList<>();
            while (startsTypeAtom(peek())) {
                arguments.add(typeAtom());
            }
            variants.add(arena.alloc(new Variant(name.start(), end(name.end()), name, List.copyOf(arguments))));
        }
        return arena.alloc(new VariantType(start, end(start), List.copyOf(variants)));
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    /**
     * An indented block or a single expression.
     */
    private Expression body() {
        if (check(TokenType.OPEN_BLOCK)) {
            int start = peek().start();
            advance();
            Expression block = statements(start, null);
            consume(TokenType.CLOSE_BLOCK, STATEMENT_END);
            return block;
        }
        return expression();
    }

    private Expression expression() {
        Expression expr = infix();
        if (match(TokenType.COLON)) {
            AstType annotation = type();
            return arena.alloc(new AnnotatedExpression(expr.start(), end(expr.start()), expr, annotation));
        }
        return expr;
    }

    // Operators are left nested here; the infix reparser applies fixities later
    private Expression infix() {
        Expression left = operand();
        while (check(TokenType.OPERATOR)) {
            Identifier op = identifier();
            Expression right = operand();
            left = arena.alloc(new InfixExpression(left.start(), end(left.start()), left, op, right));
        }
        return left;
    }

    private Expression operand() {
        Token t = peek();
        switch (t.type()) {
            case BACKSLASH:
                return lambda();
            case IF: {
                advance();
                Expression test = expression();
                consume(TokenType.THEN, terminals(TokenType.OPERATOR, TokenType.THEN));
                Expression consequent = body();
                consume(TokenType.ELSE, terminals(TokenType.ELSE));
                Expression alternate = body();
                return arena.alloc(new IfExpression(t.start(), end(t.start()), test, consequent, alternate));
            }
            case MATCH:
                return match();
            case LET: {
                advance();
                ValueBinding binding = valueBinding(Metadata.EMPTY, t.start());
                consume(TokenType.IN, terminals(TokenType.IN));
                Expression body = body();
                return arena.alloc(new LetExpression(t.start(), body.end(), List.of(binding), body));
            }
            default:
                return application();
        }
    }

    private Expression lambda() {
        int start = advance().start();
        List<Identifier> parameters = temps.pop(Identifier.class);
        try {
            collectParameters(parameters);
            consume(TokenType.ARROW, terminals(TokenType.IDENTIFIER, TokenType.ARROW));
            Expression body = body();
            return arena.alloc(new LambdaExpression(start, body.end(), List.copyOf(parameters), body));
        } finally {
            temps.push(Identifier.class, parameters);
        }
    }

    private Expression match() {
        int start = advance().start();
        Expression discriminant = expression();
        consume(TokenType.WITH, terminals(TokenType.OPERATOR, TokenType.WITH));
        boolean indented = match(TokenType.OPEN_BLOCK);
        if (!check(TokenType.PIPE)) {
            throw unexpected(terminals(TokenType.PIPE));
        }
        List<Alternative> alternatives = new ArrayList<>();
        while (check(TokenType.PIPE)) {
            int altStart = advance().start();
            Pattern pattern = pattern();
            consume(TokenType.ARROW, terminals(TokenType.ARROW));
            Expression expression = body();
            alternatives.add(arena.alloc(new Alternative(altStart, expression.end(), pattern, expression)));
        }
        if (indented) {
            consume(TokenType.CLOSE_BLOCK, terminals(TokenType.PIPE, TokenType.CLOSE_BLOCK));
        }
        return arena.alloc(new MatchExpression(start, end(start), discriminant, List.copyOf(alternatives)));
    }

    private Expression application() {
        Expression function = atom();
        if (!startsAtom(peek()) && !check(TokenType.BACKSLASH)) {
            return function;
        }
        List<Expression> arguments = temps.pop(Expression.class);
        try {
            while (startsAtom(peek())) {
                arguments.add(atom());
            }
            if (check(TokenType.BACKSLASH)) {
                arguments.add(lambda());
            }
            return arena.alloc(new Application(function.start(), end(function.start()), function,
                List.copyOf(arguments)));
        } finally {
            temps.push(Expression.class, arguments);
        }
    }

    private Expression atom() {
        Expression expr = primary();
        while (check(TokenType.DOT)) {
            advance();
            Identifier property = identifier();
            expr = arena.alloc(new ProjectionExpression(expr.start(), property.end(), expr, property));
        }
        return expr;
    }

    private Expression primary() {
        Token t = peek();
        switch (t.type()) {
            case IDENTIFIER:
                return identifier();
            case INT:
            case BYTE:
            case FLOAT:
            case STRING:
            case CHAR:
                return literal(true);
            case LPAREN:
                return parenthesized();
            case LBRACKET:
                return array();
            case LBRACE:
                return record();
            default:
                throw unexpected(EXPRESSION_START);
        }
    }

    private Expression parenthesized() {
        if (isParenthesizedOperator()) {
            return parenthesizedOperator();
        }
        int start = advance().start();
        if (match(TokenType.RPAREN)) {
            return arena.alloc(new TupleExpression(start, lastEnd, List.of()));
        }
        Expression first = expression();
        if (!check(TokenType.COMMA)) {
            consume(TokenType.RPAREN, terminals(TokenType.OPERATOR, TokenType.COMMA, TokenType.RPAREN));
            return arena.alloc(new BlockExpression(start, lastEnd, List.of(first)));
        }
        List<Expression> elements = temps.pop(Expression.class);
        try {
            elements.add(first);
            while (match(TokenType.COMMA) && !check(TokenType.RPAREN)) {
                elements.add(expression());
            }
            consume(TokenType.RPAREN, terminals(TokenType.COMMA, TokenType.RPAREN));
            return arena.alloc(new TupleExpression(start, lastEnd, List.copyOf(elements)));
        } finally {
            temps.push(Expression.class, elements);
        }
    }

    private Expression array() {
        int start = advance().start();
        List<Expression> elements = temps.pop(Expression.class);
        try {
            while (!check(TokenType.RBRACKET)) {
                elements.add(expression());
                if (!match(TokenType.COMMA)) {
                    break;
                }
            }
            consume(TokenType.RBRACKET, terminals(TokenType.COMMA, TokenType.RBRACKET));
            return arena.alloc(new ArrayExpression(start, lastEnd, List.copyOf(elements)));
        } finally {
            temps.push(Expression.class, elements);
        }
    }

    private Expression record() {
        int start = advance().start();
        List<ExprField> fields = temps.pop(ExprField.class);
        Set<Symbol> seen = new HashSet<>();
        try {
            while (!check(TokenType.RBRACE)) {
                Spanned<Symbol> name = fieldName();
                Expression value = null;
                if (match(TokenType.EQUALS)) {
                    value = body();
                }
                checkDuplicateField(seen, name);
                fields.add(arena.alloc(new ExprField(name.start(), end(name.start()), name, value)));
                if (!match(TokenType.COMMA)) {
                    break;
                }
            }
            consume(TokenType.RBRACE, terminals(TokenType.COMMA, TokenType.RBRACE));
            return arena.alloc(new RecordExpression(start, lastEnd, List.copyOf(fields)));
        } finally {
            temps.push(ExprField.class, fields);
        }
    }

    private Literal literal(boolean allowSuffix) {
        Token t = advance();
        LiteralKind kind = switch (t.type()) {
            case INT -> LiteralKind.INT;
            case BYTE -> LiteralKind.BYTE;
            case FLOAT -> LiteralKind.FLOAT;
            case STRING -> LiteralKind.STRING;
            default -> LiteralKind.CHAR;
        };
        Spanned<String> suffix = null;
        if (check(TokenType.LITERAL_SUFFIX)) {
            Token s = peek();
            if (!allowSuffix) {
                throw new GrammarException(new GrammarError.InvalidToken(s.start()));
            }
            advance();
            suffix = Spanned.of(s.start(), s.end(), s.lexeme());
        }
        return arena.alloc(new Literal(t.start(), lastEnd, kind, t.literal(), t.lexeme(), suffix));
    }

    // ========================================================================
    // Patterns
    // ========================================================================

    private Pattern pattern() {
        Token t = peek();
        if (t.type() == TokenType.IDENTIFIER && isAsPattern()) {
            Identifier name = identifier();
            advance(); // @
            IdentifierPattern binding = arena.alloc(new IdentifierPattern(name.start(), name.end(), name.ident()));
            Pattern inner = pattern();
            return arena.alloc(new AsPattern(name.start(), inner.end(), binding, inner));
        }
        if (t.type() == TokenType.IDENTIFIER && isConstructorName(t)) {
            Identifier constructor = identifier();
            List<Pattern> arguments = temps.pop(Pattern.class);
            try {
                while (startsPatternAtom(peek())) {
                    arguments.add(patternAtom());
                }
                return arena.alloc(new ConstructorPattern(constructor.start(), lastEnd, constructor,
                    List.copyOf(arguments)));
            } finally {
                temps.push(Pattern.class, arguments);
            }
        }
        return patternAtom();
    }

    private Pattern patternAtom() {
        Token t = peek();
        switch (t.type()) {
            case IDENTIFIER: {
                Identifier name = identifier();
                if (isConstructorName(t)) {
                    return arena.alloc(new ConstructorPattern(name.start(), name.end(), name, List.of()));
                }
                return arena.alloc(new IdentifierPattern(name.start(), name.end(), name.ident()));
            }
            case INT:
            case BYTE:
            case FLOAT:
            case STRING:
            case CHAR: {
                Literal literal = literal(false);
                return arena.alloc(new LiteralPattern(literal.start(), literal.end(), literal));
            }
            case LPAREN:
                return parenthesizedPattern();
            case LBRACE:
                return recordPattern();
            default:
                throw unexpected(PATTERN_START);
        }
    }

    private Pattern parenthesizedPattern() {
        if (isParenthesizedOperator()) {
            Identifier op = parenthesizedOperator();
            return arena.alloc(new IdentifierPattern(op.start(), op.end(), op.ident()));
        }
        int start = advance().start();
        if (match(TokenType.RPAREN)) {
            return arena.alloc(new TuplePattern(start, lastEnd, List.of()));
        }
        Pattern first = pattern();
        if (match(TokenType.RPAREN)) {
            return first;
        }
        List<Pattern> elements = temps.pop(Pattern.class);
        try {
            elements.add(first);
            while (match(TokenType.COMMA) && !check(TokenType.RPAREN)) {
                elements.add(pattern());
            }
            consume(TokenType.RPAREN, terminals(TokenType.COMMA, TokenType.RPAREN));
            return arena.alloc(new TuplePattern(start, lastEnd, List.copyOf(elements)));
        } finally {
            temps.push(Pattern.class, elements);
        }
    }

    private Pattern recordPattern() {
        int start = advance().start();
        List<PatternField> fields = temps.pop(PatternField.class);
        Set<Symbol> seen = new HashSet<>();
        try {
            while (!check(TokenType.RBRACE)) {
                Spanned<Symbol> name = fieldName();
                Pattern value = null;
                if (match(TokenType.EQUALS)) {
                    value = pattern();
                }
                checkDuplicateField(seen, name);
                fields.add(arena.alloc(new PatternField(name.start(), end(name.start()), name, value)));
                if (!match(TokenType.COMMA)) {
                    break;
                }
            }
            consume(TokenType.RBRACE, terminals(TokenType.COMMA, TokenType.RBRACE));
            return arena.alloc(new RecordPattern(start, lastEnd, List.copyOf(fields)));
        } finally {
            temps.push(PatternField.class, fields);
        }
    }

    // ========================================================================
    // Types
    // ========================================================================

    private AstType type() {
        AstType parameter = typeApplication();
        if (match(TokenType.ARROW)) {
            AstType result = type();
            return arena.alloc(new FunctionType(parameter.start(), result.end(), parameter, result));
        }
        return parameter;
    }

    private AstType typeApplication() {
        AstType constructor = typeAtom();
        if (!startsTypeAtom(peek())) {
            return constructor;
        }
        List<AstType> arguments = new ArrayList<>();
        while (startsTypeAtom(peek())) {
            arguments.add(typeAtom());
        }
        return arena.alloc(new TypeApplication(constructor.start(), lastEnd, constructor, List.copyOf(arguments)));
    }

    private AstType typeAtom() {
        Token t = peek();
        if (t.type() == TokenType.IDENTIFIER) {
            advance();
            if (t.lexeme().equals("_")) {
                return arena.alloc(new TypeHole(t.start(), t.end()));
            }
            return arena.alloc(new TypeName(t.start(), t.end(), env.fromStr(t.lexeme())));
        }
        if (t.type() == TokenType.LPAREN) {
            advance();
            if (match(TokenType.RPAREN)) {
                return arena.alloc(new TypeName(t.start(), lastEnd, env.fromStr("()")));
            }
            AstType inner = type();
            consume(TokenType.RPAREN, terminals(TokenType.ARROW, TokenType.RPAREN));
            return inner;
        }
        throw unexpected(terminals(TokenType.IDENTIFIER, TokenType.LPAREN));
    }

    // ========================================================================
    // Names
    // ========================================================================

    private Identifier identifier() {
        Token t = peek();
        if (t.type() != TokenType.IDENTIFIER && t.type() != TokenType.OPERATOR) {
            throw unexpected(terminals(TokenType.IDENTIFIER));
        }
        advance();
        return arena.alloc(new Identifier(t.start(), t.end(), TypedIdent.of(env.fromStr(t.lexeme()), typeCache)));
    }

    // `(+)`, spanning the parentheses
    private Identifier parenthesizedOperator() {
        int start = advance().start();
        Token op = advance();
        advance();
        return arena.alloc(new Identifier(start, lastEnd, TypedIdent.of(env.fromStr(op.lexeme()), typeCache)));
    }

    private Spanned<Symbol> fieldName() {
        if (isParenthesizedOperator()) {
            Identifier op = parenthesizedOperator();
            return new Spanned<>(op.span(), op.name());
        }
        Token t = consume(TokenType.IDENTIFIER, terminals(TokenType.IDENTIFIER, TokenType.LPAREN));
        return Spanned.of(t.start(), t.end(), env.fromStr(t.lexeme()));
    }

    private void checkDuplicateField(Set<Symbol> seen, Spanned<Symbol> name) {
        if (!seen.add(name.value())) {
            errors.add(new GrammarError.User(new Spanned<>(name.span(),
                new ParseError.Message("Duplicate field `" + name.value() + "` in record"))));
        }
    }

    private boolean isParenthesizedOperator() {
        return check(TokenType.LPAREN)
            && la(1).token().type() == TokenType.OPERATOR
            && la(2).token().type() == TokenType.RPAREN;
    }

    private boolean isAsPattern() {
        Token next = la(1).token();
        return next.type() == TokenType.OPERATOR && next.lexeme().equals("@");
    }

    private static boolean isConstructorName(Token t) {
        return Character.isUpperCase(t.lexeme().charAt(0));
    }

    private static boolean startsAtom(Token t) {
        switch (t.type()) {
            case IDENTIFIER:
            case INT:
            case BYTE:
            case FLOAT:
            case STRING:
            case CHAR:
            case LPAREN:
            case LBRACKET:
            case LBRACE:
                return true;
            default:
                return false;
        }
    }

    private static boolean startsPatternAtom(Token t) {
        return startsAtom(t) && t.type() != TokenType.LBRACKET;
    }

    private static boolean startsTypeAtom(Token t) {
        return t.type() == TokenType.IDENTIFIER || t.type() == TokenType.LPAREN;
    }

    // ========================================================================
    // Token stream
    // ========================================================================

    private Lookahead la(int n) {
        while (buffer.size() <= n) {
            if (sawEof) {
                return buffer.get(buffer.size() - 1);
            }
            Token t = tokens.next();
            if (t.type() == TokenType.ERROR) {
                errors.add(new GrammarError.User(Spanned.of(t.start(), t.end(), t.error())));
                continue;
            }
            if (t.type() == TokenType.DOC_COMMENT) {
                if (pendingDoc.length() > 0) {
                    pendingDoc.append('\n');
                }
                pendingDoc.append((String) t.literal());
                continue;
            }
            String doc = null;
            if (pendingDoc.length() > 0) {
                doc = pendingDoc.toString();
                pendingDoc.setLength(0);
            }
            if (t.type() == TokenType.EOF) {
                sawEof = true;
            }
            buffer.add(new Lookahead(t, doc));
        }
        return buffer.get(n);
    }

    private Token peek() {
        return la(0).token();
    }

    private String peekDoc() {
        return la(0).doc();
    }

    private Token advance() {
        Token t = peek();
        if (t.type() == TokenType.EOF) {
            return t;
        }
        buffer.remove(0);
        previous = t;
        if (t.type() == TokenType.OPEN_BLOCK) {
            blockDepth++;
        } else if (t.type() == TokenType.CLOSE_BLOCK) {
            blockDepth--;
        }
        if (!t.isVirtual()) {
            lastEnd = t.end();
        }
        return t;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchSeparator() {
        return match(TokenType.SEPARATOR) || match(TokenType.SEMICOLON);
    }

    private Token consume(TokenType type, List<String> expected) {
        if (check(type)) {
            return advance();
        }
        throw unexpected(expected);
    }

    private void consumeBlockStart() {
        if (!match(TokenType.OPEN_BLOCK)) {
            throw unexpected(EXPRESSION_START);
        }
    }

    private void expectStatementEnd() {
        if (!check(TokenType.SEPARATOR) && !check(TokenType.SEMICOLON) && !check(TokenType.CLOSE_BLOCK)) {
            throw unexpected(STATEMENT_END);
        }
    }

    // Anything left after the outermost block
    private void finish() {
        if (!check(TokenType.EOF)) {
            errors.add(new GrammarError.ExtraToken(peek()));
        }
    }

    // End offset for a node starting at `start`: the end of the last real token consumed
    private int end(int start) {
        return Math.max(start, lastEnd);
    }

    private GrammarException unexpected(List<String> expected) {
        Token t = peek();
        if (isEndOfInput(t)) {
            return new GrammarException(new GrammarError.UnrecognizedEof(previous == null ? 0 : t.start(), expected));
        }
        return new GrammarException(new GrammarError.UnrecognizedToken(t, expected));
    }

    private boolean isEndOfInput(Token t) {
        return t.type() == TokenType.EOF || (t.isVirtual() && t.start() >= source.span().end());
    }

    private static List<String> terminals(TokenType... types) {
        List<String> names = new ArrayList<>(types.length);
        for (TokenType type : types) {
            names.add(type.terminal());
        }
        return List.copyOf(names);
    }
}
